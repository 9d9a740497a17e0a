/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.warehouse.store;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * In-memory output table with idempotent upsert semantics.
 *
 * <p>Rows are keyed by an identity function. Writing a row whose identity is
 * already present replaces the stored row, so re-running a window writes the
 * same content and leaves the store unchanged. Reads return rows in the
 * store's sort order.
 *
 * <p>Thread-safe.
 *
 * @param <T> Row type
 */
public class OutputStore<T> {

  private final String name;
  private final Function<T, String> identity;
  private final Comparator<T> order;
  private final Map<String, T> rows = new HashMap<>();

  /**
   * Creates a store.
   *
   * @param name Table name, for diagnostics
   * @param identity Upsert key of a row
   * @param order Read order
   */
  public OutputStore(String name, Function<T, String> identity, Comparator<T> order) {
    this.name = requireNonNull(name, "name");
    this.identity = requireNonNull(identity, "identity");
    this.order = requireNonNull(order, "order");
  }

  public String getName() {
    return name;
  }

  /**
   * Inserts or replaces rows.
   *
   * @param batch Rows to write
   * @return Number of rows that were new or changed
   */
  public synchronized int upsert(Collection<? extends T> batch) {
    int changed = 0;
    for (T row : batch) {
      T previous = rows.put(identity.apply(row), row);
      if (!row.equals(previous)) {
        changed++;
      }
    }
    return changed;
  }

  /** Returns all rows in read order. */
  public synchronized List<T> scan() {
    List<T> result = new ArrayList<>(rows.values());
    result.sort(order);
    return ImmutableList.copyOf(result);
  }

  /** Returns the rows matching a predicate, in read order. */
  public List<T> scan(Predicate<? super T> filter) {
    List<T> result = new ArrayList<>();
    for (T row : scan()) {
      if (filter.test(row)) {
        result.add(row);
      }
    }
    return result;
  }

  public synchronized int size() {
    return rows.size();
  }

  @Override public String toString() {
    return "OutputStore{" + name + ", rows=" + size() + "}";
  }
}

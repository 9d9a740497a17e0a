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
package org.apache.calcite.adapter.warehouse.raw;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Derives an entity's unique key from one or more source columns.
 *
 * <p>Composite keys are the column values joined with {@code |}, in the
 * configured column order, e.g. {@code order_id|product_id -> "10248|11"}.
 */
public class UniqueKeyExtractor {

  /** Separator between the components of a composite key. */
  public static final String SEPARATOR = "|";

  private final List<String> columns;

  public UniqueKeyExtractor(List<String> columns) {
    if (columns == null || columns.isEmpty()) {
      throw new IllegalArgumentException("At least one unique key column is required");
    }
    this.columns = ImmutableList.copyOf(columns);
  }

  public List<String> getColumns() {
    return columns;
  }

  /**
   * Extracts the key of a row.
   *
   * @param row Source row
   * @return The key, or null if any key column is null or blank
   */
  public @Nullable String extract(Map<String, ?> row) {
    StringBuilder sb = new StringBuilder();
    for (String column : columns) {
      Object value = row.get(column);
      if (value == null || value.toString().trim().isEmpty()) {
        return null;
      }
      if (sb.length() > 0) {
        sb.append(SEPARATOR);
      }
      sb.append(value);
    }
    return sb.toString();
  }
}

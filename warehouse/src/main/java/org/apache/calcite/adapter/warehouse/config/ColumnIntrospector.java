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
package org.apache.calcite.adapter.warehouse.config;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives the attribute columns that make up an entity's fingerprint domain.
 *
 * <p>Columns starting with {@link #METADATA_PREFIX} are loader or engine
 * metadata ({@code _dlt_load_id}, {@code _valid_from}, ...) and never take
 * part in the fingerprint. Explicitly excluded columns are dropped as well.
 * Column order is preserved, since the fingerprint depends on it.
 */
public final class ColumnIntrospector {

  /** Prefix of metadata columns. */
  public static final String METADATA_PREFIX = "_";

  private ColumnIntrospector() {
  }

  /**
   * Filters a declared column list down to the attribute columns.
   *
   * @param columns Declared columns, in fingerprint order
   * @param exclude Columns to leave out
   * @return Attribute columns
   */
  public static List<String> attributeColumns(Collection<String> columns,
      Collection<String> exclude) {
    ImmutableList.Builder<String> result = ImmutableList.builder();
    Set<String> seen = new LinkedHashSet<>();
    for (String column : columns) {
      if (column.startsWith(METADATA_PREFIX) || exclude.contains(column)) {
        continue;
      }
      if (!seen.add(column)) {
        throw new IllegalArgumentException("Column '" + column + "' is declared twice");
      }
      result.add(column);
    }
    return result.build();
  }

  /**
   * Returns the columns of a sample of landing rows, in first-seen order.
   * Used to declare an entity's columns from data it already has.
   */
  public static List<String> discover(Iterable<? extends Map<String, ?>> rows) {
    Set<String> columns = new LinkedHashSet<>();
    for (Map<String, ?> row : rows) {
      columns.addAll(row.keySet());
    }
    return ImmutableList.copyOf(columns);
  }
}

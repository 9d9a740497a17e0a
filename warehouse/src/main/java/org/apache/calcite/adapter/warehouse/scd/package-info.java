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
/**
 * Incremental slowly-changing-dimension engine.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link org.apache.calcite.adapter.warehouse.scd.ChangeWindowDetector} - Finds the
 *       keys observed inside a window</li>
 *   <li>{@link org.apache.calcite.adapter.warehouse.scd.VersionBuilder} - Rebuilds the
 *       versions of a key from its history and selects those to emit</li>
 *   <li>{@link org.apache.calcite.adapter.warehouse.scd.KeyHistory} - Ordered history
 *       slice of one key</li>
 *   <li>{@link org.apache.calcite.adapter.warehouse.scd.IntervalConvention} - How validity
 *       starts are derived</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * TimeWindow window = TimeWindow.of(start, end);
 * VersionBuilder builder = new VersionBuilder(store, IntervalConvention.LAGGED);
 * for (String key : new ChangeWindowDetector(store).changedKeys(window)) {
 *   List<VersionedRecord> versions = builder.rebuild(key, window);
 * }
 * }</pre>
 */
package org.apache.calcite.adapter.warehouse.scd;

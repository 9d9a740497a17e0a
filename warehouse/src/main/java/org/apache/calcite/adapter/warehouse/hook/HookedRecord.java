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
package org.apache.calcite.adapter.warehouse.hook;

import org.apache.calcite.adapter.warehouse.scd.VersionedRecord;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A versioned record together with its hook columns.
 *
 * <p>Hook columns are ordered: the point-in-time hook first, then the primary
 * hooks, then the composite hooks, in configuration order.
 */
public final class HookedRecord {

  private final VersionedRecord record;
  private final Map<String, String> hooks;
  private final String primaryHook;
  private final String pitHook;

  public HookedRecord(VersionedRecord record, Map<String, String> hooks, String primaryHook,
      String pitHook) {
    this.record = requireNonNull(record, "record");
    this.hooks = Collections.unmodifiableMap(new LinkedHashMap<>(hooks));
    this.primaryHook = requireNonNull(primaryHook, "primaryHook");
    this.pitHook = requireNonNull(pitHook, "pitHook");
  }

  public VersionedRecord getRecord() {
    return record;
  }

  /** Returns all hook columns by name. */
  public Map<String, String> getHooks() {
    return hooks;
  }

  /** Returns the value of a hook column, or null if absent. */
  public @Nullable String getHook(String name) {
    return hooks.get(name);
  }

  /** Returns the name of the entity's primary hook column. */
  public String getPrimaryHook() {
    return primaryHook;
  }

  /** Returns the name of the point-in-time hook column. */
  public String getPitHook() {
    return pitHook;
  }

  @Override public String toString() {
    return "HookedRecord{" + hooks.get(pitHook) + "}";
  }
}

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
package org.apache.calcite.adapter.warehouse.bridge;

import org.apache.calcite.adapter.warehouse.hook.HookedRecord;
import org.apache.calcite.adapter.warehouse.scd.VersionedRecord;
import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Denormalized fact joining one or more versioned entity streams through
 * shared hooks.
 *
 * <p>Attribute columns carry the name of the entity they came from as a
 * suffix ({@code company_name__northwind__customers}), so columns of different
 * sides never clash. The validity columns are the intersection of every
 * joined side's interval.
 */
public final class BridgeRow {

  /** Separator between a column name and its source entity suffix. */
  public static final String SUFFIX_SEPARATOR = "__";

  private final String peripheral;
  private final Map<String, String> hooks;
  private final Map<String, @Nullable Object> attributes;
  private final Instant validFrom;
  private final Instant validTo;
  private final Instant updatedAt;
  private final boolean current;

  public BridgeRow(String peripheral, Map<String, String> hooks,
      Map<String, ? extends @Nullable Object> attributes, Instant validFrom, Instant validTo,
      Instant updatedAt, boolean current) {
    this.peripheral = requireNonNull(peripheral, "peripheral");
    this.hooks = Collections.unmodifiableMap(new LinkedHashMap<>(hooks));
    this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    this.validFrom = requireNonNull(validFrom, "validFrom");
    this.validTo = requireNonNull(validTo, "validTo");
    this.updatedAt = requireNonNull(updatedAt, "updatedAt");
    this.current = current;
  }

  /**
   * Lifts a hooked record into a single-sided bridge row.
   *
   * @param entity Entity the record belongs to; used as peripheral name and
   *     attribute suffix
   * @param hooked Record with its hooks
   */
  public static BridgeRow of(String entity, HookedRecord hooked) {
    VersionedRecord record = hooked.getRecord();
    Map<String, @Nullable Object> attributes = new LinkedHashMap<>();
    for (Map.Entry<String, @Nullable Object> entry : record.getPayload().entrySet()) {
      attributes.put(suffixed(entry.getKey(), entity), entry.getValue());
    }
    return new BridgeRow(entity, hooked.getHooks(), attributes, record.getValidFrom(),
        record.getValidTo(), record.getUpdatedAt(), record.isCurrent());
  }

  /** Returns {@code column__entity}. */
  public static String suffixed(String column, String entity) {
    return column + SUFFIX_SEPARATOR + entity;
  }

  /** Returns the entity whose bridge this row belongs to. */
  public String getPeripheral() {
    return peripheral;
  }

  public Map<String, String> getHooks() {
    return hooks;
  }

  public @Nullable String getHook(String name) {
    return hooks.get(name);
  }

  public Map<String, @Nullable Object> getAttributes() {
    return attributes;
  }

  public Instant getValidFrom() {
    return validFrom;
  }

  public Instant getValidTo() {
    return validTo;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isCurrent() {
    return current;
  }

  /** Returns whether the two rows are valid at a common instant. */
  public boolean overlaps(BridgeRow other) {
    return validFrom.isBefore(other.validTo) && validTo.isAfter(other.validFrom);
  }

  /**
   * Returns the store identity of this row: peripheral, hooks and validity
   * start. Recomputing the same join yields the same identity.
   */
  public String identity() {
    StringBuilder sb = new StringBuilder(peripheral);
    for (Map.Entry<String, String> hook : hooks.entrySet()) {
      sb.append('\u0000').append(hook.getKey()).append('=').append(hook.getValue());
    }
    return sb.append('\u0000').append(validFrom).toString();
  }

  @Override public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof BridgeRow)) {
      return false;
    }
    BridgeRow that = (BridgeRow) obj;
    return current == that.current
        && peripheral.equals(that.peripheral)
        && hooks.equals(that.hooks)
        && attributes.equals(that.attributes)
        && validFrom.equals(that.validFrom)
        && validTo.equals(that.validTo)
        && updatedAt.equals(that.updatedAt);
  }

  @Override public int hashCode() {
    return Objects.hash(peripheral, hooks, validFrom, validTo);
  }

  @Override public String toString() {
    return "BridgeRow{" + peripheral + ", hooks=" + hooks.values()
        + ", valid=[" + WarehouseTimestamps.format(validFrom) + ", "
        + WarehouseTimestamps.format(validTo) + ")"
        + (current ? ", current" : "") + "}";
  }
}

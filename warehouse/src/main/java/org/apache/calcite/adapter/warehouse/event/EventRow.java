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
package org.apache.calcite.adapter.warehouse.event;

import org.apache.calcite.adapter.warehouse.bridge.BridgeRow;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * One occurrence of a configured event on a bridge row.
 */
public final class EventRow {

  private final String peripheral;
  private final Map<String, String> hooks;
  private final String event;
  private final LocalDate occurredOn;
  private final LocalTime occurredAt;
  private final Instant validFrom;
  private final Instant validTo;
  private final Instant updatedAt;
  private final boolean current;

  public EventRow(BridgeRow bridge, Map<String, String> hooks, String event,
      LocalDate occurredOn, LocalTime occurredAt) {
    this.peripheral = bridge.getPeripheral();
    this.hooks = Collections.unmodifiableMap(new LinkedHashMap<>(hooks));
    this.event = requireNonNull(event, "event");
    this.occurredOn = requireNonNull(occurredOn, "occurredOn");
    this.occurredAt = requireNonNull(occurredAt, "occurredAt");
    this.validFrom = bridge.getValidFrom();
    this.validTo = bridge.getValidTo();
    this.updatedAt = bridge.getUpdatedAt();
    this.current = bridge.isCurrent();
  }

  public String getPeripheral() {
    return peripheral;
  }

  /** Returns the point-in-time hooks of the underlying bridge row. */
  public Map<String, String> getHooks() {
    return hooks;
  }

  public String getEvent() {
    return event;
  }

  public LocalDate getOccurredOn() {
    return occurredOn;
  }

  /** Returns the time of day, truncated to seconds. */
  public LocalTime getOccurredAt() {
    return occurredAt;
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

  /** Returns the store identity: peripheral, hooks, event and validity start. */
  public String identity() {
    StringBuilder sb = new StringBuilder(peripheral);
    for (Map.Entry<String, String> hook : hooks.entrySet()) {
      sb.append('\u0000').append(hook.getKey()).append('=').append(hook.getValue());
    }
    return sb.append('\u0000').append(event).append('\u0000').append(validFrom).toString();
  }

  @Override public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof EventRow)) {
      return false;
    }
    EventRow that = (EventRow) obj;
    return current == that.current
        && peripheral.equals(that.peripheral)
        && hooks.equals(that.hooks)
        && event.equals(that.event)
        && occurredOn.equals(that.occurredOn)
        && occurredAt.equals(that.occurredAt)
        && validFrom.equals(that.validFrom)
        && validTo.equals(that.validTo)
        && updatedAt.equals(that.updatedAt);
  }

  @Override public int hashCode() {
    return Objects.hash(peripheral, hooks, event, validFrom);
  }

  @Override public String toString() {
    return "EventRow{" + peripheral + ", " + event + " on " + occurredOn + " at " + occurredAt
        + "}";
  }
}

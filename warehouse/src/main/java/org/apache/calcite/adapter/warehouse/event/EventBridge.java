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
import org.apache.calcite.adapter.warehouse.hook.HookResolver;
import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unpivots the event timestamps of bridge rows into one row per event.
 *
 * <p>Each configured event names a timestamp column of a bridge row. A bridge
 * row produces one {@link EventRow} for every event whose column is non-null,
 * carrying the row's point-in-time hooks and validity. Timestamps are read
 * in UTC and split into a date and a time of day at second precision.
 *
 * <p>The as-of view ({@link #asOf}) is the union of the event rows of all
 * entities.
 */
public class EventBridge {

  private static final Logger LOGGER = LoggerFactory.getLogger(EventBridge.class);

  private static final Comparator<EventRow> AS_OF_ORDER =
      Comparator.comparing(EventRow::getPeripheral)
          .thenComparing(row -> String.join("\u0000", row.getHooks().values()))
          .thenComparing(EventRow::getValidFrom)
          .thenComparing(EventRow::getOccurredOn)
          .thenComparing(EventRow::getOccurredAt)
          .thenComparing(EventRow::getEvent);

  private EventBridge() {
  }

  /**
   * Produces the event rows of one entity's bridge.
   *
   * @param entity Entity owning the bridge
   * @param bridgeRows Bridge rows of the entity
   * @param events Event definitions of the entity
   * @return Event rows, in bridge row order then event order
   */
  public static List<EventRow> unpivot(String entity, List<BridgeRow> bridgeRows,
      List<EventDefinition> events) {
    List<EventRow> rows = new ArrayList<>();
    if (events.isEmpty()) {
      return rows;
    }
    for (BridgeRow bridge : bridgeRows) {
      Map<String, String> pitHooks = pitHooks(bridge);
      for (EventDefinition event : events) {
        String column = BridgeRow.suffixed(event.getExpression(), event.sourceOr(entity));
        Object value = bridge.getAttributes().get(column);
        if (value == null) {
          continue;
        }
        LocalDateTime occurred = toDateTime(value);
        if (occurred == null) {
          LOGGER.warn("Entity '{}': skipping event '{}' with unreadable timestamp '{}'",
              entity, event.getName(), value);
          continue;
        }
        rows.add(
            new EventRow(bridge, pitHooks, event.getName(), occurred.toLocalDate(),
                occurred.toLocalTime().truncatedTo(ChronoUnit.SECONDS)));
      }
    }
    LOGGER.debug("Entity '{}': {} event rows from {} bridge rows", entity, rows.size(),
        bridgeRows.size());
    return rows;
  }

  /**
   * Returns the union of the given event rows, ordered by peripheral, hooks
   * and validity.
   */
  public static List<EventRow> asOf(Collection<? extends Collection<EventRow>> perEntity) {
    List<EventRow> rows = new ArrayList<>();
    for (Collection<EventRow> entityRows : perEntity) {
      rows.addAll(entityRows);
    }
    rows.sort(AS_OF_ORDER);
    return rows;
  }

  private static Map<String, String> pitHooks(BridgeRow bridge) {
    Map<String, String> hooks = new LinkedHashMap<>();
    for (Map.Entry<String, String> hook : bridge.getHooks().entrySet()) {
      if (hook.getKey().startsWith(HookResolver.PIT_PREFIX)) {
        hooks.put(hook.getKey(), hook.getValue());
      }
    }
    return hooks;
  }

  /** Converts a timestamp-like value to a UTC date-time, or null. */
  static @Nullable LocalDateTime toDateTime(Object value) {
    if (value instanceof Instant) {
      return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
    }
    if (value instanceof LocalDateTime) {
      return (LocalDateTime) value;
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay();
    }
    if (value instanceof Date) {
      return LocalDateTime.ofInstant(((Date) value).toInstant(), ZoneOffset.UTC);
    }
    String text = value.toString().trim();
    try {
      return LocalDateTime.ofInstant(WarehouseTimestamps.parse(text), ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      LOGGER.trace("'{}' is not a warehouse timestamp", text);
    }
    try {
      return LocalDateTime.ofInstant(Instant.parse(text), ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      LOGGER.trace("'{}' is not an ISO instant", text);
    }
    try {
      return LocalDateTime.parse(text);
    } catch (DateTimeParseException e) {
      LOGGER.trace("'{}' is not an ISO date-time", text);
    }
    try {
      return LocalDate.parse(text).atStartOfDay();
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}

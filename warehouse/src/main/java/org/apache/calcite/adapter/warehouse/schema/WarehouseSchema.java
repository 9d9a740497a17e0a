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
package org.apache.calcite.adapter.warehouse.schema;

import org.apache.calcite.DataContext;
import org.apache.calcite.adapter.warehouse.bridge.BridgeRow;
import org.apache.calcite.adapter.warehouse.config.ColumnIntrospector;
import org.apache.calcite.adapter.warehouse.config.EntityConfig;
import org.apache.calcite.adapter.warehouse.config.WarehouseConfig;
import org.apache.calcite.adapter.warehouse.event.EventRow;
import org.apache.calcite.adapter.warehouse.hook.HookResolver;
import org.apache.calcite.adapter.warehouse.run.WarehouseRunner;
import org.apache.calcite.adapter.warehouse.scd.VersionedRecord;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;
import org.apache.calcite.schema.impl.AbstractTable;
import org.apache.calcite.sql.type.SqlTypeName;

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exposes the output stores of a {@link WarehouseRunner} as SQL tables.
 *
 * <p>Tables:
 * <ul>
 *   <li>{@code <entity>}: versioned records, one row per version</li>
 *   <li>{@code _bridge__<entity>}: bridge rows of the entity</li>
 *   <li>{@code _event_bridge__<entity>}: event rows of the entity</li>
 *   <li>{@code _bridge__as_of}: event rows of all entities</li>
 * </ul>
 *
 * <p>Payload columns are typed VARCHAR; validity columns are TIMESTAMP (UTC).
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * Connection connection = DriverManager.getConnection("jdbc:calcite:");
 * CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
 * calcite.getRootSchema().add("northwind", new WarehouseSchema(runner));
 * }</pre>
 */
public class WarehouseSchema extends AbstractSchema {

  /** Name of the table holding the event rows of every entity. */
  public static final String AS_OF_TABLE = "_bridge__as_of";

  public static final String UNIQUE_KEY = "_unique_key";
  public static final String LOADED_AT = "_loaded_at";
  public static final String CONTENT_HASH = "_content_hash";
  public static final String PERIPHERAL = "peripheral";

  private final WarehouseRunner runner;
  private final Map<String, Table> tableMap;

  public WarehouseSchema(WarehouseRunner runner) {
    this.runner = runner;
    this.tableMap = createTableMap();
  }

  @Override protected Map<String, Table> getTableMap() {
    return tableMap;
  }

  private Map<String, Table> createTableMap() {
    WarehouseConfig config = runner.getConfig();
    ImmutableMap.Builder<String, Table> tables = ImmutableMap.builder();
    Set<String> pitHooks = new LinkedHashSet<>();
    for (EntityConfig entity : config.getEntities().values()) {
      tables.put(entity.getName(), new VersionTable(entity));
      List<String> hooks = new ArrayList<>();
      List<String> attributes = new ArrayList<>();
      bridgeColumns(config, entity.getName(), hooks, attributes);
      tables.put("_bridge__" + entity.getName(),
          new BridgeTable(entity.getName(), hooks, attributes));
      List<String> entityPitHooks = new ArrayList<>();
      for (String hook : hooks) {
        if (hook.startsWith(HookResolver.PIT_PREFIX)) {
          entityPitHooks.add(hook);
        }
      }
      pitHooks.addAll(entityPitHooks);
      tables.put("_event_bridge__" + entity.getName(),
          new EventTable(entity.getName(), entityPitHooks));
    }
    tables.put(AS_OF_TABLE, new EventTable(null, new ArrayList<>(pitHooks)));
    return tables.build();
  }

  /**
   * Collects the hook and attribute columns a bridge row of the entity can
   * carry: its own, then those of every entity it references.
   */
  static void bridgeColumns(WarehouseConfig config, String entity, List<String> hooks,
      List<String> attributes) {
    EntityConfig entityConfig = config.getEntity(entity);
    addAbsent(hooks, HookResolver.PIT_PREFIX + entityConfig.getPrimaryHook());
    for (String hook : entityConfig.getHookNames()) {
      addAbsent(hooks, hook);
    }
    for (String column : entityConfig.getColumns()) {
      if (!column.startsWith(ColumnIntrospector.METADATA_PREFIX)) {
        addAbsent(attributes, BridgeRow.suffixed(column, entity));
      }
    }
    for (String foreign : config.foreignHooks(entity).values()) {
      bridgeColumns(config, foreign, hooks, attributes);
    }
  }

  private static void addAbsent(List<String> list, String value) {
    if (!list.contains(value)) {
      list.add(value);
    }
  }

  private static @Nullable Long millis(@Nullable Instant instant) {
    return instant == null ? null : instant.toEpochMilli();
  }

  private static @Nullable String text(@Nullable Object value) {
    return value == null ? null : value.toString();
  }

  private static void addValidity(RelDataTypeFactory.Builder builder) {
    builder.add(VersionedRecord.VALID_FROM, SqlTypeName.TIMESTAMP)
        .add(VersionedRecord.VALID_TO, SqlTypeName.TIMESTAMP)
        .add(VersionedRecord.UPDATED_AT, SqlTypeName.TIMESTAMP);
  }

  /**
   * Versioned records of one entity.
   */
  private class VersionTable extends AbstractTable implements ScannableTable {
    private final EntityConfig entity;
    private final List<String> payloadColumns = new ArrayList<>();

    VersionTable(EntityConfig entity) {
      this.entity = entity;
      for (String column : entity.getColumns()) {
        if (!column.startsWith(ColumnIntrospector.METADATA_PREFIX)) {
          payloadColumns.add(column);
        }
      }
    }

    @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
      RelDataTypeFactory.Builder builder = typeFactory.builder()
          .add(UNIQUE_KEY, SqlTypeName.VARCHAR);
      for (String column : payloadColumns) {
        builder.add(column, SqlTypeName.VARCHAR).nullable(true);
      }
      builder.add(LOADED_AT, SqlTypeName.TIMESTAMP)
          .add(CONTENT_HASH, SqlTypeName.VARCHAR);
      addValidity(builder);
      return builder.add(VersionedRecord.VERSION, SqlTypeName.INTEGER)
          .add(VersionedRecord.IS_CURRENT, SqlTypeName.BOOLEAN)
          .build();
    }

    @Override public Enumerable<Object[]> scan(DataContext root) {
      List<Object[]> rows = new ArrayList<>();
      for (VersionedRecord record : runner.getVersionStore(entity.getName()).scan()) {
        rows.add(row(record));
      }
      return Linq4j.asEnumerable(rows);
    }

    private Object[] row(VersionedRecord record) {
      Object[] row = new Object[payloadColumns.size() + 8];
      int i = 0;
      row[i++] = record.getUniqueKey();
      for (String column : payloadColumns) {
        row[i++] = text(record.getPayload().get(column));
      }
      row[i++] = millis(record.getLoadedAt());
      row[i++] = record.getContentHash();
      row[i++] = millis(record.getValidFrom());
      row[i++] = millis(record.getValidTo());
      row[i++] = millis(record.getUpdatedAt());
      row[i++] = record.getVersion();
      row[i] = record.isCurrent();
      return row;
    }
  }

  /**
   * Bridge rows of one entity.
   */
  private class BridgeTable extends AbstractTable implements ScannableTable {
    private final String entity;
    private final List<String> hooks;
    private final List<String> attributes;

    BridgeTable(String entity, List<String> hooks, List<String> attributes) {
      this.entity = entity;
      this.hooks = hooks;
      this.attributes = attributes;
    }

    @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
      RelDataTypeFactory.Builder builder = typeFactory.builder()
          .add(PERIPHERAL, SqlTypeName.VARCHAR);
      for (String hook : hooks) {
        builder.add(hook, SqlTypeName.VARCHAR).nullable(true);
      }
      for (String attribute : attributes) {
        builder.add(attribute, SqlTypeName.VARCHAR).nullable(true);
      }
      addValidity(builder);
      return builder.add(VersionedRecord.IS_CURRENT, SqlTypeName.BOOLEAN).build();
    }

    @Override public Enumerable<Object[]> scan(DataContext root) {
      List<Object[]> rows = new ArrayList<>();
      for (BridgeRow bridge : runner.getBridgeStore(entity).scan()) {
        Object[] row = new Object[hooks.size() + attributes.size() + 5];
        int i = 0;
        row[i++] = bridge.getPeripheral();
        for (String hook : hooks) {
          row[i++] = bridge.getHook(hook);
        }
        for (String attribute : attributes) {
          row[i++] = text(bridge.getAttributes().get(attribute));
        }
        row[i++] = millis(bridge.getValidFrom());
        row[i++] = millis(bridge.getValidTo());
        row[i++] = millis(bridge.getUpdatedAt());
        row[i] = bridge.isCurrent();
        rows.add(row);
      }
      return Linq4j.asEnumerable(rows);
    }
  }

  /**
   * Event rows of one entity, or of all entities when {@code entity} is null.
   */
  private class EventTable extends AbstractTable implements ScannableTable {
    private final @Nullable String entity;
    private final List<String> pitHooks;

    EventTable(@Nullable String entity, List<String> pitHooks) {
      this.entity = entity;
      this.pitHooks = pitHooks;
    }

    @Override public RelDataType getRowType(RelDataTypeFactory typeFactory) {
      RelDataTypeFactory.Builder builder = typeFactory.builder()
          .add(PERIPHERAL, SqlTypeName.VARCHAR);
      for (String hook : pitHooks) {
        builder.add(hook, SqlTypeName.VARCHAR).nullable(true);
      }
      builder.add("event", SqlTypeName.VARCHAR)
          .add("event_occurred_on", SqlTypeName.DATE)
          .add("event_occurred_at", SqlTypeName.TIME);
      addValidity(builder);
      return builder.add(VersionedRecord.IS_CURRENT, SqlTypeName.BOOLEAN).build();
    }

    @Override public Enumerable<Object[]> scan(DataContext root) {
      List<EventRow> events = entity == null
          ? runner.asOfEvents()
          : runner.getEventStore(entity).scan();
      List<Object[]> rows = new ArrayList<>(events.size());
      for (EventRow event : events) {
        Object[] row = new Object[pitHooks.size() + 8];
        int i = 0;
        row[i++] = event.getPeripheral();
        for (String hook : pitHooks) {
          row[i++] = event.getHooks().get(hook);
        }
        row[i++] = event.getEvent();
        row[i++] = (int) event.getOccurredOn().toEpochDay();
        row[i++] = (int) (event.getOccurredAt().toNanoOfDay() / 1_000_000L);
        row[i++] = millis(event.getValidFrom());
        row[i++] = millis(event.getValidTo());
        row[i++] = millis(event.getUpdatedAt());
        row[i] = event.isCurrent();
        rows.add(row);
      }
      return Linq4j.asEnumerable(rows);
    }
  }
}

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

import org.apache.calcite.adapter.warehouse.event.EventDefinition;
import org.apache.calcite.adapter.warehouse.hook.CompositeHookDefinition;
import org.apache.calcite.adapter.warehouse.hook.HookDefinition;
import org.apache.calcite.adapter.warehouse.hook.HookResolver;
import org.apache.calcite.adapter.warehouse.scd.IntervalConvention;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration of one warehouse entity (one raw frame).
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * - name: northwind__orders
 *   uniqueKey: order_id
 *   columns: [order_id, customer_id, order_date, shipped_date, freight]
 *   exclude: [freight]
 *   intervalConvention: lagged      # or contiguous
 *   retention: P365D                # optional history depth
 *   loadIdColumn: _dlt_load_id
 *   hooks:
 *     - name: _hook__order__id
 *       keyset: northwind.order.id
 *       expression: order_id
 *       primary: true
 *     - name: _hook__customer__id
 *       keyset: northwind.customer.id
 *       expression: customer_id
 *   events:
 *     - name: order_placed
 *       expression: order_date
 * }</pre>
 *
 * <p>The attribute columns hashed into the content fingerprint are the
 * declared {@code columns} minus metadata columns and {@code exclude}.
 */
public class EntityConfig {

  /** Default column carrying the load identifier of a landing row. */
  public static final String DEFAULT_LOAD_ID_COLUMN = "_dlt_load_id";

  private final String name;
  private final List<String> uniqueKey;
  private final List<String> columns;
  private final List<String> attributeColumns;
  private final IntervalConvention intervalConvention;
  private final @Nullable Duration retention;
  private final String loadIdColumn;
  private final List<HookDefinition> hooks;
  private final List<CompositeHookDefinition> compositeHooks;
  private final List<EventDefinition> events;
  private final String primaryHook;

  private EntityConfig(Builder builder, List<String> attributeColumns, String primaryHook) {
    this.name = builder.name;
    this.uniqueKey = ImmutableList.copyOf(builder.uniqueKey);
    this.columns = ImmutableList.copyOf(builder.columns);
    this.attributeColumns = attributeColumns;
    this.intervalConvention = builder.intervalConvention;
    this.retention = builder.retention;
    this.loadIdColumn = builder.loadIdColumn;
    this.hooks = ImmutableList.copyOf(builder.hooks);
    this.compositeHooks = ImmutableList.copyOf(builder.compositeHooks);
    this.events = ImmutableList.copyOf(builder.events);
    this.primaryHook = primaryHook;
  }

  public String getName() {
    return name;
  }

  /** Returns the columns forming the unique key, in order. */
  public List<String> getUniqueKey() {
    return uniqueKey;
  }

  public List<String> getColumns() {
    return columns;
  }

  /** Returns the fingerprint domain, in fingerprint order. */
  public List<String> getAttributeColumns() {
    return attributeColumns;
  }

  public IntervalConvention getIntervalConvention() {
    return intervalConvention;
  }

  /** Returns the retained history depth, or null for the full history. */
  public @Nullable Duration getRetention() {
    return retention;
  }

  public String getLoadIdColumn() {
    return loadIdColumn;
  }

  public List<HookDefinition> getHooks() {
    return hooks;
  }

  public List<CompositeHookDefinition> getCompositeHooks() {
    return compositeHooks;
  }

  public List<EventDefinition> getEvents() {
    return events;
  }

  /** Returns the name of the hook identifying this entity. */
  public String getPrimaryHook() {
    return primaryHook;
  }

  /** Returns the names of all simple and composite hooks. */
  public List<String> getHookNames() {
    List<String> names = new ArrayList<>();
    for (HookDefinition hook : hooks) {
      names.add(hook.getName());
    }
    for (CompositeHookDefinition hook : compositeHooks) {
      names.add(hook.getName());
    }
    return names;
  }

  /** Creates a hook resolver for this entity. */
  public HookResolver hookResolver() {
    return new HookResolver(name, hooks, compositeHooks);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates an entity configuration from a YAML/JSON map.
   *
   * @param map Configuration map
   * @return Entity configuration
   * @throws IllegalArgumentException if the configuration is invalid
   */
  @SuppressWarnings("unchecked")
  public static EntityConfig fromMap(Map<String, Object> map) {
    Builder builder = builder()
        .name((String) map.get("name"))
        .uniqueKey(stringList(map.get("uniqueKey"), "uniqueKey"))
        .columns(stringList(map.get("columns"), "columns"))
        .exclude(stringList(map.get("exclude"), "exclude"))
        .intervalConvention(
            IntervalConvention.fromString((String) map.get("intervalConvention")))
        .hooks(HookDefinition.fromList((List<?>) map.get("hooks")))
        .compositeHooks(CompositeHookDefinition.fromList((List<?>) map.get("compositeHooks")))
        .events(EventDefinition.fromList((List<?>) map.get("events")));

    Object retention = map.get("retention");
    if (retention != null) {
      try {
        builder.retention(Duration.parse(retention.toString()));
      } catch (DateTimeParseException e) {
        throw new IllegalArgumentException("Entity '" + map.get("name")
            + "': invalid retention '" + retention + "', expected ISO-8601 duration", e);
      }
    }
    Object loadIdColumn = map.get("loadIdColumn");
    if (loadIdColumn != null) {
      builder.loadIdColumn(loadIdColumn.toString());
    }
    return builder.build();
  }

  /** Accepts a single string or a list of strings. */
  static List<String> stringList(@Nullable Object value, String key) {
    if (value == null) {
      return Collections.emptyList();
    }
    if (value instanceof String) {
      return Collections.singletonList((String) value);
    }
    if (value instanceof List) {
      List<String> result = new ArrayList<>();
      for (Object item : (List<?>) value) {
        result.add(String.valueOf(item));
      }
      return result;
    }
    throw new IllegalArgumentException("'" + key + "' must be a string or a list: " + value);
  }

  @Override public String toString() {
    return "EntityConfig{name='" + name + "', uniqueKey=" + uniqueKey
        + ", attributes=" + attributeColumns.size() + ", primaryHook=" + primaryHook + "}";
  }

  /**
   * Builder for EntityConfig.
   */
  public static class Builder {
    private String name;
    private List<String> uniqueKey = Collections.emptyList();
    private List<String> columns = Collections.emptyList();
    private List<String> exclude = Collections.emptyList();
    private IntervalConvention intervalConvention = IntervalConvention.LAGGED;
    private @Nullable Duration retention;
    private String loadIdColumn = DEFAULT_LOAD_ID_COLUMN;
    private List<HookDefinition> hooks = Collections.emptyList();
    private List<CompositeHookDefinition> compositeHooks = Collections.emptyList();
    private List<EventDefinition> events = Collections.emptyList();

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder uniqueKey(List<String> uniqueKey) {
      this.uniqueKey = uniqueKey;
      return this;
    }

    public Builder columns(List<String> columns) {
      this.columns = columns;
      return this;
    }

    /** Declares the columns from a sample of landing rows. */
    public Builder columnsFrom(List<? extends Map<String, ?>> sample) {
      this.columns = ColumnIntrospector.discover(sample);
      return this;
    }

    public Builder exclude(List<String> exclude) {
      this.exclude = exclude;
      return this;
    }

    public Builder intervalConvention(IntervalConvention intervalConvention) {
      this.intervalConvention = intervalConvention;
      return this;
    }

    public Builder retention(@Nullable Duration retention) {
      this.retention = retention;
      return this;
    }

    public Builder loadIdColumn(String loadIdColumn) {
      this.loadIdColumn = loadIdColumn;
      return this;
    }

    public Builder hooks(List<HookDefinition> hooks) {
      this.hooks = hooks;
      return this;
    }

    public Builder compositeHooks(List<CompositeHookDefinition> compositeHooks) {
      this.compositeHooks = compositeHooks;
      return this;
    }

    public Builder events(List<EventDefinition> events) {
      this.events = events;
      return this;
    }

    public EntityConfig build() {
      if (name == null || name.trim().isEmpty()) {
        throw new IllegalArgumentException("Entity name is required");
      }
      if (uniqueKey.isEmpty()) {
        throw new IllegalArgumentException("Entity '" + name + "' has no uniqueKey");
      }
      List<String> attributes = ColumnIntrospector.attributeColumns(columns, exclude);
      if (attributes.isEmpty()) {
        throw new IllegalArgumentException("Entity '" + name + "' has no attribute columns");
      }
      if (retention != null && (retention.isNegative() || retention.isZero())) {
        throw new IllegalArgumentException("Entity '" + name + "': retention must be positive");
      }
      String primary = new HookResolver(name, hooks, compositeHooks).getPrimaryHook();
      return new EntityConfig(this, attributes, primary);
    }
  }
}

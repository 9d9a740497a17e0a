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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration of an event timestamp column of an entity.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * events:
 *   - name: order_placed
 *     expression: order_date
 *   - name: customer_registered
 *     expression: registered_at
 *     source: northwind__customers
 * }</pre>
 *
 * <p>{@code source} names the entity whose column holds the timestamp, for
 * events read from a joined entity; it defaults to the entity itself.
 */
public class EventDefinition {

  private final String name;
  private final String expression;
  private final @Nullable String source;

  private EventDefinition(String name, String expression, @Nullable String source) {
    this.name = name;
    this.expression = expression;
    this.source = source;
  }

  public static EventDefinition of(String name, String expression) {
    return of(name, expression, null);
  }

  public static EventDefinition of(String name, String expression, @Nullable String source) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Event name is required");
    }
    if (expression == null || expression.trim().isEmpty()) {
      throw new IllegalArgumentException("Event '" + name + "' has no expression");
    }
    return new EventDefinition(name, expression, source);
  }

  public String getName() {
    return name;
  }

  public String getExpression() {
    return expression;
  }

  public @Nullable String getSource() {
    return source;
  }

  /** Returns the source entity, falling back to the owning entity. */
  public String sourceOr(String entity) {
    return source != null ? source : entity;
  }

  /**
   * Creates an event definition from a configuration map.
   */
  public static EventDefinition fromMap(Map<String, Object> map) {
    Object source = map.get("source");
    return of((String) map.get("name"), (String) map.get("expression"),
        source == null ? null : source.toString());
  }

  /**
   * Creates event definitions from a configuration list.
   */
  @SuppressWarnings("unchecked")
  public static List<EventDefinition> fromList(@Nullable List<?> list) {
    if (list == null) {
      return Collections.emptyList();
    }
    List<EventDefinition> events = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof Map)) {
        throw new IllegalArgumentException("Event entry must be a map: " + item);
      }
      events.add(fromMap((Map<String, Object>) item));
    }
    return events;
  }

  @Override public String toString() {
    return "EventDefinition{" + name + " <- " + (source == null ? "" : source + ".")
        + expression + "}";
  }
}

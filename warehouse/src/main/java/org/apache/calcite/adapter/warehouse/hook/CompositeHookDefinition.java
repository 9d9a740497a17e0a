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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Configuration of a composite hook: a relationship built from primary hooks
 * of the same entity.
 *
 * <p>The component order is defined here, once per relationship type, and
 * used for every record, so the same relationship always yields the same
 * string.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * compositeHooks:
 *   - name: _hook__order__product
 *     hooks: [_hook__order__id, _hook__product__id]
 *     primary: true
 * }</pre>
 */
public class CompositeHookDefinition {

  private final String name;
  private final List<String> hooks;
  private final boolean primary;

  private CompositeHookDefinition(String name, List<String> hooks, boolean primary) {
    this.name = name;
    this.hooks = Collections.unmodifiableList(new ArrayList<String>(hooks));
    this.primary = primary;
  }

  /**
   * Creates a composite hook definition.
   *
   * @param name Output column name
   * @param hooks Names of the component hooks, in composition order
   * @param primary Whether this hook identifies the entity itself
   */
  public static CompositeHookDefinition of(String name, List<String> hooks, boolean primary) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Composite hook name is required");
    }
    if (hooks == null || hooks.size() < 2) {
      throw new IllegalArgumentException(
          "Composite hook '" + name + "' requires at least two component hooks");
    }
    return new CompositeHookDefinition(name, hooks, primary);
  }

  public String getName() {
    return name;
  }

  /** Returns the component hook names in composition order. */
  public List<String> getHooks() {
    return hooks;
  }

  public boolean isPrimary() {
    return primary;
  }

  /**
   * Creates a CompositeHookDefinition from a YAML/JSON map.
   *
   * @param map Configuration map with keys: name, hooks, primary
   * @return CompositeHookDefinition instance, or null if map is null
   */
  public static CompositeHookDefinition fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    List<String> hooks = new ArrayList<String>();
    Object hooksObj = map.get("hooks");
    if (hooksObj instanceof List) {
      for (Object hook : (List<?>) hooksObj) {
        hooks.add(String.valueOf(hook));
      }
    }
    Object primaryObj = map.get("primary");
    return of((String) map.get("name"), hooks,
        primaryObj instanceof Boolean && (Boolean) primaryObj);
  }

  /**
   * Parses a list of composite hook definitions.
   */
  @SuppressWarnings("unchecked")
  public static List<CompositeHookDefinition> fromList(List<?> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }
    List<CompositeHookDefinition> result = new ArrayList<CompositeHookDefinition>();
    for (Object item : list) {
      if (item instanceof Map) {
        result.add(fromMap((Map<String, Object>) item));
      }
    }
    return result;
  }

  @Override public String toString() {
    return "CompositeHookDefinition{name='" + name + "', hooks=" + hooks
        + (primary ? ", primary" : "") + "}";
  }
}

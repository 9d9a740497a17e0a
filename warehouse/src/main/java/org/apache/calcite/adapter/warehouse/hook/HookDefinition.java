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
 * Configuration of a primary hook column of an entity.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * hooks:
 *   - name: _hook__customer__id
 *     keyset: northwind.customer.id
 *     expression: customer_id
 *     primary: true
 * }</pre>
 *
 * <p>The hook value is read from the {@code expression} column of each
 * versioned record.
 */
public class HookDefinition {

  private final String name;
  private final String keyset;
  private final String expression;
  private final boolean primary;

  private HookDefinition(Builder builder) {
    this.name = builder.name;
    this.keyset = builder.keyset;
    this.expression = builder.expression;
    this.primary = builder.primary;
  }

  /** Returns the output column name of the hook. */
  public String getName() {
    return name;
  }

  /** Returns {@code namespace.concept.qualifier}. */
  public String getKeyset() {
    return keyset;
  }

  /** Returns the source column holding the hook value. */
  public String getExpression() {
    return expression;
  }

  /** Returns whether this hook identifies the entity itself. */
  public boolean isPrimary() {
    return primary;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a HookDefinition from a YAML/JSON map.
   *
   * @param map Configuration map with keys: name, keyset, expression, primary
   * @return HookDefinition instance, or null if map is null
   */
  public static HookDefinition fromMap(Map<String, Object> map) {
    if (map == null) {
      return null;
    }
    Builder builder = builder()
        .name((String) map.get("name"))
        .keyset((String) map.get("keyset"))
        .expression((String) map.get("expression"));
    Object primaryObj = map.get("primary");
    if (primaryObj instanceof Boolean) {
      builder.primary((Boolean) primaryObj);
    }
    return builder.build();
  }

  /**
   * Parses a list of hook definitions.
   */
  @SuppressWarnings("unchecked")
  public static List<HookDefinition> fromList(List<?> list) {
    if (list == null || list.isEmpty()) {
      return Collections.emptyList();
    }
    List<HookDefinition> result = new ArrayList<HookDefinition>();
    for (Object item : list) {
      if (item instanceof Map) {
        result.add(fromMap((Map<String, Object>) item));
      }
    }
    return result;
  }

  @Override public String toString() {
    return "HookDefinition{name='" + name + "', keyset='" + keyset + "', expression='"
        + expression + "'" + (primary ? ", primary" : "") + "}";
  }

  /**
   * Builder for HookDefinition.
   */
  public static class Builder {
    private String name;
    private String keyset;
    private String expression;
    private boolean primary;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder keyset(String keyset) {
      this.keyset = keyset;
      return this;
    }

    public Builder expression(String expression) {
      this.expression = expression;
      return this;
    }

    public Builder primary(boolean primary) {
      this.primary = primary;
      return this;
    }

    public HookDefinition build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Hook name is required");
      }
      if (expression == null || expression.isEmpty()) {
        throw new IllegalArgumentException("Hook '" + name + "' requires an expression");
      }
      // keyset is validated with a placeholder value
      HookCodec.composePrimary(keyset, "x");
      return new HookDefinition(this);
    }
  }
}

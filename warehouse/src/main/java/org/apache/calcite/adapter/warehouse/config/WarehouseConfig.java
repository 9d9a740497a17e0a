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

import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration of a warehouse: its entities and how a run is executed.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * name: northwind
 * parallelism: 4
 * entities:
 *   - name: northwind__customers
 *     uniqueKey: customer_id
 *     columns: [customer_id, company_name, city]
 *     hooks:
 *       - name: _hook__customer__id
 *         keyset: northwind.customer.id
 *         expression: customer_id
 *         primary: true
 * }</pre>
 *
 * <p>Relationships between entities are implied by hook names: when an
 * entity carries a non-primary hook whose name is the primary hook of another
 * entity, the bridge of the first entity joins the bridge of the second.
 */
public class WarehouseConfig {

  private final String name;
  private final Map<String, EntityConfig> entities;
  private final int parallelism;

  private WarehouseConfig(Builder builder) {
    this.name = builder.name;
    this.entities = Collections.unmodifiableMap(new LinkedHashMap<>(builder.entities));
    this.parallelism = builder.parallelism;
  }

  public String getName() {
    return name;
  }

  /** Returns the entities by name, in configuration order. */
  public Map<String, EntityConfig> getEntities() {
    return entities;
  }

  /**
   * Returns an entity by name.
   *
   * @throws IllegalArgumentException if no such entity is configured
   */
  public EntityConfig getEntity(String entity) {
    EntityConfig config = entities.get(entity);
    if (config == null) {
      throw new IllegalArgumentException("Unknown entity '" + entity + "'");
    }
    return config;
  }

  /** Returns the number of threads rebuilding keys; 1 means sequential. */
  public int getParallelism() {
    return parallelism;
  }

  /**
   * Returns the entity whose primary hook has the given name, or null.
   */
  public @Nullable String primaryHookOwner(String hookName) {
    for (EntityConfig entity : entities.values()) {
      if (entity.getPrimaryHook().equals(hookName)) {
        return entity.getName();
      }
    }
    return null;
  }

  /**
   * Returns the foreign hooks of an entity: its non-primary hooks, simple or
   * composite, that identify another entity, mapped to that entity.
   */
  public Map<String, String> foreignHooks(String entity) {
    EntityConfig config = getEntity(entity);
    Map<String, String> foreign = new LinkedHashMap<>();
    for (String hook : config.getHookNames()) {
      if (hook.equals(config.getPrimaryHook())) {
        continue;
      }
      String owner = primaryHookOwner(hook);
      if (owner != null && !owner.equals(entity)) {
        foreign.put(hook, owner);
      }
    }
    return foreign;
  }

  /** Returns {@link #foreignHooks(String)} for every entity. */
  public Map<String, Map<String, String>> foreignEntities() {
    Map<String, Map<String, String>> result = new LinkedHashMap<>();
    for (String entity : entities.keySet()) {
      result.put(entity, foreignHooks(entity));
    }
    return result;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a warehouse configuration from a YAML/JSON map.
   *
   * @param map Configuration map with keys: name, parallelism, entities
   * @return Warehouse configuration
   * @throws IllegalArgumentException if the configuration is invalid
   */
  @SuppressWarnings("unchecked")
  public static WarehouseConfig fromMap(Map<String, Object> map) {
    Builder builder = builder().name((String) map.get("name"));
    Object parallelism = map.get("parallelism");
    if (parallelism instanceof Number) {
      builder.parallelism(((Number) parallelism).intValue());
    } else if (parallelism != null) {
      throw new IllegalArgumentException("'parallelism' must be a number: " + parallelism);
    }
    Object entities = map.get("entities");
    if (!(entities instanceof List)) {
      throw new IllegalArgumentException("'entities' must be a list");
    }
    List<EntityConfig> configs = new ArrayList<>();
    for (Object item : (List<?>) entities) {
      if (!(item instanceof Map)) {
        throw new IllegalArgumentException("Entity entry must be a map: " + item);
      }
      configs.add(EntityConfig.fromMap((Map<String, Object>) item));
    }
    return builder.entities(configs).build();
  }

  @Override public String toString() {
    return "WarehouseConfig{name='" + name + "', entities=" + entities.keySet()
        + ", parallelism=" + parallelism + "}";
  }

  /**
   * Builder for WarehouseConfig.
   */
  public static class Builder {
    private String name;
    private final Map<String, EntityConfig> entities = new LinkedHashMap<>();
    private int parallelism = 1;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder entity(EntityConfig entity) {
      if (entities.put(entity.getName(), entity) != null) {
        throw new IllegalArgumentException("Entity '" + entity.getName() + "' is defined twice");
      }
      return this;
    }

    public Builder entities(Collection<EntityConfig> entities) {
      for (EntityConfig entity : entities) {
        entity(entity);
      }
      return this;
    }

    public Builder parallelism(int parallelism) {
      this.parallelism = parallelism;
      return this;
    }

    public WarehouseConfig build() {
      if (name == null || name.trim().isEmpty()) {
        throw new IllegalArgumentException("Warehouse name is required");
      }
      if (entities.isEmpty()) {
        throw new IllegalArgumentException("Warehouse '" + name + "' has no entities");
      }
      if (parallelism < 1) {
        throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
      }
      Map<String, String> primaryOwners = new HashMap<>();
      for (EntityConfig entity : entities.values()) {
        String previous = primaryOwners.put(entity.getPrimaryHook(), entity.getName());
        if (previous != null) {
          throw new IllegalArgumentException("Entities '" + previous + "' and '"
              + entity.getName() + "' share primary hook '" + entity.getPrimaryHook() + "'");
        }
        for (EventDefinition event : entity.getEvents()) {
          if (event.getSource() != null && !entities.containsKey(event.getSource())) {
            throw new IllegalArgumentException("Event '" + event.getName() + "' of entity '"
                + entity.getName() + "' reads unknown entity '" + event.getSource() + "'");
          }
        }
      }
      WarehouseConfig config = new WarehouseConfig(this);
      checkAcyclic(config);
      return config;
    }

    private static void checkAcyclic(WarehouseConfig config) {
      Map<String, Map<String, String>> edges = config.foreignEntities();
      Set<String> done = new HashSet<>();
      for (String entity : edges.keySet()) {
        visit(entity, edges, new ArrayList<>(), done);
      }
    }

    private static void visit(String entity, Map<String, Map<String, String>> edges,
        List<String> path, Set<String> done) {
      if (done.contains(entity)) {
        return;
      }
      if (path.contains(entity)) {
        throw new IllegalArgumentException("Cyclic relationship between entities: "
            + String.join(" -> ", path) + " -> " + entity);
      }
      path.add(entity);
      for (String next : edges.getOrDefault(entity, ImmutableMap.of()).values()) {
        visit(next, edges, path, done);
      }
      path.remove(path.size() - 1);
      done.add(entity);
    }
  }
}

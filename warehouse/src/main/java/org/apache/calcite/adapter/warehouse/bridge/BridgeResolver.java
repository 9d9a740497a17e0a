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

import org.apache.calcite.adapter.warehouse.hook.HookCodec;
import org.apache.calcite.adapter.warehouse.hook.HookedRecord;
import org.apache.calcite.adapter.warehouse.hook.MalformedHookException;
import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Joins versioned entity streams through shared hooks.
 *
 * <p>Two rows join when they carry byte-identical values for the join hook
 * and their validity intervals overlap
 * ({@code left.valid_from < right.valid_to && left.valid_to > right.valid_from}).
 * The joined row is valid on the intersection:
 * <ul>
 *   <li>{@code valid_from = max(left, right)}</li>
 *   <li>{@code valid_to = min(left, right)}</li>
 *   <li>{@code updated_at = max(left, right)}</li>
 *   <li>{@code is_current = left AND right}</li>
 * </ul>
 * Intersection is associative, so a chain of joins yields the same rows in
 * any grouping.
 *
 * <p>A hook value that does not parse is logged and recorded in
 * {@link #getMalformedHooks()}; it never matches, and the rest of the join
 * carries on.
 *
 * <p>An instance is scoped to a single run: it memoizes the bridge of every
 * entity it resolves.
 */
public class BridgeResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(BridgeResolver.class);

  private final Map<String, Map<String, String>> foreignEntities;
  private final Map<String, List<BridgeRow>> resolved = new HashMap<>();
  private final Set<String> resolving = new LinkedHashSet<>();
  private final List<String> malformedHooks = new ArrayList<>();

  /**
   * Creates a resolver that joins pairs only; {@link #resolve} has no
   * relationships to follow.
   */
  public BridgeResolver() {
    this(ImmutableMap.of());
  }

  /**
   * Creates a resolver.
   *
   * @param foreignEntities For each entity, the foreign hooks it carries
   *     mapped to the entity whose primary hook they are
   */
  public BridgeResolver(Map<String, Map<String, String>> foreignEntities) {
    this.foreignEntities = requireNonNull(foreignEntities, "foreignEntities");
  }

  /** Returns the malformed hook strings met so far. */
  public List<String> getMalformedHooks() {
    return Collections.unmodifiableList(malformedHooks);
  }

  /**
   * Inner-joins two streams on a hook.
   *
   * @param left Left rows
   * @param right Right rows
   * @param hookName Hook column both sides carry
   * @return One row per matching pair with overlapping validity
   */
  public List<BridgeRow> join(List<BridgeRow> left, List<BridgeRow> right, String hookName) {
    return join(left, right, hookName, false);
  }

  /**
   * Joins two streams on a hook, keeping every left row that found no
   * overlapping partner unchanged. Left rows whose hook is malformed are
   * dropped.
   */
  public List<BridgeRow> leftJoin(List<BridgeRow> left, List<BridgeRow> right,
      String hookName) {
    return join(left, right, hookName, true);
  }

  /**
   * Inner-joins a chain of streams. Stream {@code i + 1} is joined to the
   * running result on {@code hookNames.get(i)}.
   */
  public List<BridgeRow> joinAll(List<List<BridgeRow>> streams, List<String> hookNames) {
    if (streams.isEmpty()) {
      return ImmutableList.of();
    }
    if (hookNames.size() != streams.size() - 1) {
      throw new IllegalArgumentException("Joining " + streams.size()
          + " streams needs " + (streams.size() - 1) + " hooks, got " + hookNames.size());
    }
    List<BridgeRow> result = streams.get(0);
    for (int i = 1; i < streams.size(); i++) {
      result = join(result, streams.get(i), hookNames.get(i - 1));
    }
    return result;
  }

  /**
   * Builds the bridge of an entity: its own hooked rows, left-joined with the
   * bridge of every entity whose primary hook it carries as a foreign hook.
   * Foreign bridges are resolved recursively.
   *
   * @param entity Entity to resolve
   * @param hookedByEntity Hooked rows of every entity
   * @return Bridge rows of the entity
   * @throws IllegalStateException if the relationships form a cycle
   */
  public List<BridgeRow> resolve(String entity,
      Map<String, List<HookedRecord>> hookedByEntity) {
    List<BridgeRow> cached = resolved.get(entity);
    if (cached != null) {
      return cached;
    }
    if (!resolving.add(entity)) {
      throw new IllegalStateException("Cyclic bridge relationship: "
          + String.join(" -> ", resolving) + " -> " + entity);
    }
    try {
      List<BridgeRow> rows = new ArrayList<>();
      for (HookedRecord hooked : hookedByEntity.getOrDefault(entity, ImmutableList.of())) {
        rows.add(BridgeRow.of(entity, hooked));
      }
      Map<String, String> foreign = foreignEntities.getOrDefault(entity, ImmutableMap.of());
      for (Map.Entry<String, String> edge : foreign.entrySet()) {
        List<BridgeRow> other = resolve(edge.getValue(), hookedByEntity);
        rows = leftJoin(rows, other, edge.getKey());
      }
      LOGGER.debug("Bridge of '{}': {} rows after joining {}", entity, rows.size(),
          foreign.values());
      resolved.put(entity, rows);
      return rows;
    } finally {
      resolving.remove(entity);
    }
  }

  private List<BridgeRow> join(List<BridgeRow> left, List<BridgeRow> right, String hookName,
      boolean keepUnmatched) {
    Map<String, List<BridgeRow>> index = new HashMap<>();
    for (BridgeRow row : right) {
      String value = checkedHook(row, hookName);
      if (value != null) {
        index.computeIfAbsent(value, k -> new ArrayList<>()).add(row);
      }
    }
    List<BridgeRow> joined = new ArrayList<>();
    for (BridgeRow row : left) {
      String value = checkedHook(row, hookName);
      if (value == null && row.getHook(hookName) != null) {
        // malformed: excluded even from a left join
        continue;
      }
      boolean matched = false;
      if (value != null) {
        for (BridgeRow candidate : index.getOrDefault(value, ImmutableList.of())) {
          if (row.overlaps(candidate)) {
            joined.add(merge(row, candidate));
            matched = true;
          }
        }
      }
      if (!matched && keepUnmatched) {
        joined.add(row);
      }
    }
    return joined;
  }

  private @Nullable String checkedHook(BridgeRow row, String hookName) {
    String value = row.getHook(hookName);
    if (value == null) {
      return null;
    }
    try {
      HookCodec.parse(value);
      return value;
    } catch (MalformedHookException e) {
      LOGGER.warn("Skipping {} row with malformed hook '{}': {}", row.getPeripheral(),
          hookName, e.getMessage());
      synchronized (malformedHooks) {
        malformedHooks.add(value);
      }
      return null;
    }
  }

  /** Left columns win on name clashes; shared hooks carry equal values. */
  static BridgeRow merge(BridgeRow left, BridgeRow right) {
    Map<String, String> hooks = new LinkedHashMap<>(left.getHooks());
    right.getHooks().forEach(hooks::putIfAbsent);
    Map<String, @Nullable Object> attributes = new LinkedHashMap<>(left.getAttributes());
    for (Map.Entry<String, @Nullable Object> entry : right.getAttributes().entrySet()) {
      if (!attributes.containsKey(entry.getKey())) {
        attributes.put(entry.getKey(), entry.getValue());
      }
    }
    return new BridgeRow(left.getPeripheral(), hooks, attributes,
        WarehouseTimestamps.max(left.getValidFrom(), right.getValidFrom()),
        WarehouseTimestamps.min(left.getValidTo(), right.getValidTo()),
        WarehouseTimestamps.max(left.getUpdatedAt(), right.getUpdatedAt()),
        left.isCurrent() && right.isCurrent());
  }
}

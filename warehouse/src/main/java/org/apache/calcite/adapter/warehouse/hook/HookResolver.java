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

import org.apache.calcite.adapter.warehouse.scd.VersionedRecord;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds hook columns to the versioned records of one entity.
 *
 * <p>For each record the resolver composes
 * <ol>
 *   <li>every primary hook, as {@code keyset|value-of-expression-column}</li>
 *   <li>every composite hook, joining its component hooks in their configured
 *       order</li>
 *   <li>the point-in-time hook {@code _pit<primary hook name>}: the entity's
 *       primary hook pinned to the record's {@code valid_from}</li>
 * </ol>
 *
 * <p>If a composite hook is flagged primary it takes precedence over a
 * primary-flagged simple hook, so relationship entities (such as order lines)
 * are identified by their composite hook.
 *
 * <p>A record with a null or blank hook component is quarantined; see
 * {@link HookResolution}.
 */
public class HookResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(HookResolver.class);

  /** Prefix of the point-in-time hook column name. */
  public static final String PIT_PREFIX = "_pit";

  private final String entity;
  private final List<HookDefinition> hooks;
  private final List<CompositeHookDefinition> compositeHooks;
  private final String primaryHook;

  /**
   * Creates a resolver.
   *
   * @param entity Entity name, used in log messages
   * @param hooks Primary hook definitions
   * @param compositeHooks Composite hook definitions
   * @throws IllegalArgumentException if no primary hook is defined, more than
   *     one is, or a composite hook names an unknown component
   */
  public HookResolver(String entity, List<HookDefinition> hooks,
      List<CompositeHookDefinition> compositeHooks) {
    this.entity = entity;
    this.hooks = ImmutableList.copyOf(hooks);
    this.compositeHooks = ImmutableList.copyOf(compositeHooks);
    this.primaryHook = findPrimaryHook(entity, this.hooks, this.compositeHooks);
  }

  /**
   * Returns the name of the hook that identifies the entity, honouring the
   * precedence of primary composite hooks.
   */
  static String findPrimaryHook(String entity, List<HookDefinition> hooks,
      List<CompositeHookDefinition> compositeHooks) {
    Set<String> names = new HashSet<>();
    String primary = null;
    int primaries = 0;
    for (HookDefinition hook : hooks) {
      if (!names.add(hook.getName())) {
        throw new IllegalArgumentException(
            "Entity '" + entity + "' defines hook '" + hook.getName() + "' twice");
      }
      if (hook.isPrimary()) {
        primary = hook.getName();
        primaries++;
      }
    }
    Set<String> simpleHooks = new HashSet<>(names);
    String compositePrimary = null;
    int compositePrimaries = 0;
    for (CompositeHookDefinition hook : compositeHooks) {
      for (String component : hook.getHooks()) {
        if (!simpleHooks.contains(component)) {
          throw new IllegalArgumentException("Composite hook '" + hook.getName()
              + "' of entity '" + entity + "' references unknown hook '" + component + "'");
        }
      }
      if (!names.add(hook.getName())) {
        throw new IllegalArgumentException(
            "Entity '" + entity + "' defines hook '" + hook.getName() + "' twice");
      }
      if (hook.isPrimary()) {
        compositePrimary = hook.getName();
        compositePrimaries++;
      }
    }
    if (primaries > 1 || compositePrimaries > 1) {
      throw new IllegalArgumentException("Entity '" + entity + "' has more than one primary hook");
    }
    if (compositePrimary != null) {
      return compositePrimary;
    }
    if (primary == null) {
      throw new IllegalArgumentException("Entity '" + entity + "' has no primary hook");
    }
    return primary;
  }

  /** Returns the name of the primary hook column. */
  public String getPrimaryHook() {
    return primaryHook;
  }

  /** Returns the name of the point-in-time hook column. */
  public String getPitHook() {
    return PIT_PREFIX + primaryHook;
  }

  /**
   * Composes the hooks of a batch of records.
   *
   * @param records Versioned records of this entity
   * @return Hooked records plus quarantined ones
   */
  public HookResolution resolve(List<VersionedRecord> records) {
    List<HookedRecord> hooked = new ArrayList<>(records.size());
    List<HookResolution.Quarantined> quarantined = new ArrayList<>();
    for (VersionedRecord record : records) {
      HookedRecord result = resolve(record, quarantined);
      if (result != null) {
        hooked.add(result);
      }
    }
    if (!quarantined.isEmpty()) {
      LOGGER.warn("Entity '{}': {} of {} records quarantined during hook composition",
          entity, quarantined.size(), records.size());
    }
    return new HookResolution(hooked, quarantined);
  }

  private @Nullable HookedRecord resolve(VersionedRecord record,
      List<HookResolution.Quarantined> quarantined) {
    Map<String, String> values = new LinkedHashMap<>();
    for (HookDefinition hook : hooks) {
      Object value = record.getPayload().get(hook.getExpression());
      if (value == null || value.toString().trim().isEmpty()) {
        quarantined.add(
            new HookResolution.Quarantined(record, hook.getName(),
                HookResolution.Quarantined.Reason.MISSING_HOOK_COMPONENT,
                "column '" + hook.getExpression() + "' is null or blank"));
        return null;
      }
      try {
        values.put(hook.getName(), HookCodec.composePrimary(hook.getKeyset(), value.toString()));
      } catch (MalformedHookException e) {
        quarantined.add(
            new HookResolution.Quarantined(record, hook.getName(),
                HookResolution.Quarantined.Reason.MALFORMED_HOOK, e.getMessage()));
        return null;
      }
    }
    for (CompositeHookDefinition hook : compositeHooks) {
      List<String> components = new ArrayList<>(hook.getHooks().size());
      for (String component : hook.getHooks()) {
        components.add(values.get(component));
      }
      values.put(hook.getName(), HookCodec.composeComposite(components));
    }

    Map<String, String> ordered = new LinkedHashMap<>();
    ordered.put(getPitHook(),
        HookCodec.composePit(values.get(primaryHook), record.getValidFrom()));
    ordered.putAll(values);
    return new HookedRecord(record, ordered, primaryHook, getPitHook());
  }
}

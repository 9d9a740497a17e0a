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
package org.apache.calcite.adapter.warehouse.run;

import org.apache.calcite.adapter.warehouse.bridge.BridgeResolver;
import org.apache.calcite.adapter.warehouse.bridge.BridgeRow;
import org.apache.calcite.adapter.warehouse.config.EntityConfig;
import org.apache.calcite.adapter.warehouse.config.WarehouseConfig;
import org.apache.calcite.adapter.warehouse.event.EventBridge;
import org.apache.calcite.adapter.warehouse.event.EventRow;
import org.apache.calcite.adapter.warehouse.hook.HookResolution;
import org.apache.calcite.adapter.warehouse.hook.HookedRecord;
import org.apache.calcite.adapter.warehouse.raw.InMemoryRawObservationStore;
import org.apache.calcite.adapter.warehouse.raw.IngestResult;
import org.apache.calcite.adapter.warehouse.raw.RawIngestor;
import org.apache.calcite.adapter.warehouse.raw.RawObservationStore;
import org.apache.calcite.adapter.warehouse.scd.ChangeWindowDetector;
import org.apache.calcite.adapter.warehouse.scd.KeyHistory;
import org.apache.calcite.adapter.warehouse.scd.TimeWindow;
import org.apache.calcite.adapter.warehouse.scd.VersionBuilder;
import org.apache.calcite.adapter.warehouse.scd.VersionedRecord;
import org.apache.calcite.adapter.warehouse.store.OutputStore;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static java.util.Objects.requireNonNull;

/**
 * Runs the warehouse over incremental windows.
 *
 * <p>A run over {@code [start, end)} executes three phases:
 * <ol>
 *   <li><b>versions</b>: per entity, detect the keys observed in the window,
 *       rebuild each of them from its history, write the emitted versions,
 *       renumber the older stored versions of those keys and compose their
 *       hooks</li>
 *   <li><b>bridges</b>: per entity, join its hooked records with the bridges
 *       of the entities it references and write the bridge rows updated
 *       inside the window</li>
 *   <li><b>events</b>: unpivot the event timestamps of those bridge rows</li>
 * </ol>
 *
 * <p>Every write is an upsert, so running a window twice leaves every store
 * as the first run left it. A failure inside one entity marks that entity
 * failed in the {@link WarehouseRunResult} and the run continues with the
 * others.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * WarehouseConfig config = WarehouseConfigLoader.loadResource("/northwind-warehouse.yaml");
 * WarehouseRunner runner = new WarehouseRunner(config);
 * runner.ingest("northwind__customers", landingRows);
 * WarehouseRunResult result = runner.run(TimeWindow.of(start, end));
 * }</pre>
 */
public class WarehouseRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(WarehouseRunner.class);

  static final String PHASE_VERSIONS = "versions";
  static final String PHASE_BRIDGES = "bridges";
  static final String PHASE_EVENTS = "events";

  private final WarehouseConfig config;
  private final RunListener listener;
  private final Map<String, RawObservationStore> rawStores = new LinkedHashMap<>();
  private final Map<String, OutputStore<VersionedRecord>> versionStores = new LinkedHashMap<>();
  private final Map<String, OutputStore<HookedRecord>> hookStores = new LinkedHashMap<>();
  private final Map<String, OutputStore<BridgeRow>> bridgeStores = new LinkedHashMap<>();
  private final Map<String, OutputStore<EventRow>> eventStores = new LinkedHashMap<>();

  /**
   * Creates a runner with in-memory raw stores and a logging listener.
   */
  public WarehouseRunner(WarehouseConfig config) {
    this(config, new LinkedHashMap<>(), new LoggingRunListener());
  }

  /**
   * Creates a runner.
   *
   * @param config Warehouse configuration
   * @param rawStores Raw stores by entity; entities without one get an
   *     in-memory store
   * @param listener Progress listener
   */
  public WarehouseRunner(WarehouseConfig config, Map<String, RawObservationStore> rawStores,
      RunListener listener) {
    this.config = requireNonNull(config, "config");
    this.listener = requireNonNull(listener, "listener");
    for (String entity : config.getEntities().keySet()) {
      this.rawStores.put(entity,
          rawStores.containsKey(entity) ? rawStores.get(entity) : new InMemoryRawObservationStore());
      versionStores.put(entity,
          new OutputStore<VersionedRecord>(entity, VersionedRecord::identity,
              Comparator.comparing(VersionedRecord::getUniqueKey)
                  .thenComparing(VersionedRecord::getLoadedAt)));
      hookStores.put(entity,
          new OutputStore<HookedRecord>(entity, (HookedRecord r) -> r.getRecord().identity(),
              Comparator.comparing((HookedRecord r) -> r.getRecord().getUniqueKey())
                  .thenComparing(r -> r.getRecord().getLoadedAt())));
      bridgeStores.put(entity,
          new OutputStore<BridgeRow>("_bridge__" + entity, BridgeRow::identity,
              Comparator.comparing(BridgeRow::identity)));
      eventStores.put(entity,
          new OutputStore<EventRow>("_event_bridge__" + entity, EventRow::identity,
              Comparator.comparing(EventRow::identity)));
    }
  }

  public WarehouseConfig getConfig() {
    return config;
  }

  /**
   * Ingests landing rows into an entity's raw store.
   *
   * @throws IllegalArgumentException if the entity is unknown
   */
  public IngestResult ingest(String entity, List<? extends Map<String, ?>> rows) {
    return new RawIngestor(config.getEntity(entity), getRawStore(entity)).ingest(rows);
  }

  /**
   * Returns a version builder over an entity's raw store, e.g. to inspect the
   * full history of a key.
   */
  public VersionBuilder versionBuilder(String entity) {
    EntityConfig entityConfig = config.getEntity(entity);
    return new VersionBuilder(getRawStore(entity), entityConfig.getIntervalConvention(),
        entityConfig.getRetention());
  }

  /**
   * Processes one window.
   *
   * @param window Half-open window {@code [start, end)}
   * @return Per-entity statistics
   */
  public WarehouseRunResult run(TimeWindow window) {
    long startTime = System.currentTimeMillis();
    LOGGER.info("Running warehouse '{}' over {}", config.getName(), window);
    Map<String, EntityRunResult.Builder> results = new LinkedHashMap<>();
    for (String entity : config.getEntities().keySet()) {
      results.put(entity, EntityRunResult.builder(entity));
    }

    ExecutorService executor = config.getParallelism() > 1
        ? Executors.newFixedThreadPool(config.getParallelism())
        : null;
    try {
      listener.onPhaseStart(PHASE_VERSIONS, results.size());
      int processed = 0;
      for (Map.Entry<String, EntityRunResult.Builder> entry : results.entrySet()) {
        try {
          buildVersions(entry.getKey(), window, entry.getValue(), executor);
          processed++;
        } catch (RuntimeException e) {
          fail(entry.getKey(), PHASE_VERSIONS, entry.getValue(), e);
        }
      }
      listener.onPhaseComplete(PHASE_VERSIONS, processed);
    } finally {
      if (executor != null) {
        executor.shutdownNow();
      }
    }

    Map<String, List<BridgeRow>> bridged = buildBridges(window, results);
    buildEvents(bridged, results);

    List<EntityRunResult> entities = new ArrayList<>();
    for (EntityRunResult.Builder builder : results.values()) {
      entities.add(builder.build());
    }
    WarehouseRunResult result =
        new WarehouseRunResult(config.getName(), window, entities,
            System.currentTimeMillis() - startTime);
    listener.onRunComplete(result);
    return result;
  }

  private void buildVersions(String entity, TimeWindow window,
      EntityRunResult.Builder result, @Nullable ExecutorService executor) {
    EntityConfig entityConfig = config.getEntity(entity);
    RawObservationStore raw = getRawStore(entity);
    Set<String> changed = new ChangeWindowDetector(raw).changedKeys(window);
    result.changedKeys(changed.size());

    VersionBuilder builder = versionBuilder(entity);
    List<KeyRebuild> rebuilds = new ArrayList<>(changed.size());
    if (executor == null) {
      for (String key : changed) {
        rebuilds.add(rebuild(builder, key, window));
      }
    } else {
      List<Future<KeyRebuild>> futures = new ArrayList<>(changed.size());
      for (String key : changed) {
        futures.add(executor.submit(() -> rebuild(builder, key, window)));
      }
      for (Future<KeyRebuild> future : futures) {
        rebuilds.add(await(entity, future));
      }
    }

    List<VersionedRecord> emitted = new ArrayList<>();
    Map<String, Integer> versions = new HashMap<>();
    int gaps = 0;
    for (KeyRebuild rebuild : rebuilds) {
      versions.putAll(rebuild.versions);
      for (VersionedRecord record : rebuild.records) {
        emitted.add(
            record.withVersion(versions.getOrDefault(record.identity(), record.getVersion())));
      }
      if (rebuild.boundaryGap) {
        gaps++;
      }
    }

    // Versions of a key shift when a new one arrives; renumber stored rows too
    Set<String> emittedIds = new HashSet<>();
    for (VersionedRecord record : emitted) {
      emittedIds.add(record.identity());
    }
    OutputStore<VersionedRecord> versionStore = versionStores.get(entity);
    Map<String, VersionedRecord> renumbered = new HashMap<>();
    for (VersionedRecord stored : versionStore.scan(
        r -> changed.contains(r.getUniqueKey()) && !emittedIds.contains(r.identity()))) {
      Integer version = versions.get(stored.identity());
      if (version != null && version != stored.getVersion()) {
        renumbered.put(stored.identity(), stored.withVersion(version));
      }
    }
    List<VersionedRecord> writes = new ArrayList<>(emitted);
    writes.addAll(renumbered.values());
    result.versionsEmitted(emitted.size())
        .boundaryGaps(gaps)
        .versionsWritten(versionStore.upsert(writes));

    HookResolution hooks = entityConfig.hookResolver().resolve(emitted);
    OutputStore<HookedRecord> hookStore = hookStores.get(entity);
    List<HookedRecord> hooked = new ArrayList<>(hooks.getRecords());
    for (HookedRecord stored : hookStore.scan(
        h -> renumbered.containsKey(h.getRecord().identity()))) {
      hooked.add(
          new HookedRecord(renumbered.get(stored.getRecord().identity()), stored.getHooks(),
              stored.getPrimaryHook(), stored.getPitHook()));
    }
    hookStore.upsert(hooked);
    result.hookedRecords(hooks.getRecords().size())
        .quarantined(hooks.getQuarantineCount());
    for (HookResolution.Quarantined quarantined : hooks.getQuarantined()) {
      result.error(quarantined.toString());
    }
  }

  private static KeyRebuild rebuild(VersionBuilder builder, String key, TimeWindow window) {
    KeyHistory history = builder.load(key, window);
    return new KeyRebuild(builder.rebuild(history, window), history.hasBoundaryGap(window),
        builder.versionNumbers(key));
  }

  private static KeyRebuild await(String entity, Future<KeyRebuild> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while rebuilding entity '" + entity + "'", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new IllegalStateException("Rebuilding entity '" + entity + "' failed", cause);
    }
  }

  private Map<String, List<BridgeRow>> buildBridges(TimeWindow window,
      Map<String, EntityRunResult.Builder> results) {
    Map<String, List<HookedRecord>> hooked = new LinkedHashMap<>();
    for (Map.Entry<String, OutputStore<HookedRecord>> entry : hookStores.entrySet()) {
      hooked.put(entry.getKey(), entry.getValue().scan());
    }
    BridgeResolver resolver = new BridgeResolver(config.foreignEntities());
    Map<String, List<BridgeRow>> bridged = new LinkedHashMap<>();

    listener.onPhaseStart(PHASE_BRIDGES, results.size());
    int processed = 0;
    for (Map.Entry<String, EntityRunResult.Builder> entry : results.entrySet()) {
      String entity = entry.getKey();
      EntityRunResult.Builder result = entry.getValue();
      if (result.isFailed()) {
        continue;
      }
      try {
        int malformedBefore = resolver.getMalformedHooks().size();
        List<BridgeRow> rows = new ArrayList<>();
        for (BridgeRow row : resolver.resolve(entity, hooked)) {
          if (window.contains(row.getUpdatedAt())) {
            rows.add(row);
          }
        }
        bridgeStores.get(entity).upsert(rows);
        bridged.put(entity, rows);
        result.bridgeRows(rows.size())
            .malformedHooks(resolver.getMalformedHooks().size() - malformedBefore);
        processed++;
      } catch (RuntimeException e) {
        fail(entity, PHASE_BRIDGES, result, e);
      }
    }
    listener.onPhaseComplete(PHASE_BRIDGES, processed);
    return bridged;
  }

  private void buildEvents(Map<String, List<BridgeRow>> bridged,
      Map<String, EntityRunResult.Builder> results) {
    listener.onPhaseStart(PHASE_EVENTS, bridged.size());
    int processed = 0;
    for (Map.Entry<String, List<BridgeRow>> entry : bridged.entrySet()) {
      String entity = entry.getKey();
      EntityRunResult.Builder result = results.get(entity);
      try {
        List<EventRow> rows =
            EventBridge.unpivot(entity, entry.getValue(), config.getEntity(entity).getEvents());
        eventStores.get(entity).upsert(rows);
        result.eventRows(rows.size());
        processed++;
      } catch (RuntimeException e) {
        fail(entity, PHASE_EVENTS, result, e);
      }
    }
    listener.onPhaseComplete(PHASE_EVENTS, processed);
  }

  private void fail(String entity, String phase, EntityRunResult.Builder result,
      RuntimeException e) {
    LOGGER.error("Entity '{}' failed in phase '{}'", entity, phase, e);
    result.failed(phase + ": " + e.getMessage());
    listener.onEntityError(entity, phase, e);
  }

  public RawObservationStore getRawStore(String entity) {
    return lookup(rawStores, entity);
  }

  public OutputStore<VersionedRecord> getVersionStore(String entity) {
    return lookup(versionStores, entity);
  }

  public OutputStore<HookedRecord> getHookStore(String entity) {
    return lookup(hookStores, entity);
  }

  public OutputStore<BridgeRow> getBridgeStore(String entity) {
    return lookup(bridgeStores, entity);
  }

  public OutputStore<EventRow> getEventStore(String entity) {
    return lookup(eventStores, entity);
  }

  /**
   * Returns the event rows of every entity as one as-of view.
   */
  public List<EventRow> asOfEvents() {
    List<List<EventRow>> perEntity = new ArrayList<>();
    for (OutputStore<EventRow> store : eventStores.values()) {
      perEntity.add(store.scan());
    }
    return EventBridge.asOf(perEntity);
  }

  private static <T> T lookup(Map<String, T> stores, String entity) {
    T store = stores.get(entity);
    if (store == null) {
      throw new IllegalArgumentException("Unknown entity '" + entity + "'");
    }
    return store;
  }

  /** Versions of one key emitted for a window. */
  private static class KeyRebuild {
    final List<VersionedRecord> records;
    final boolean boundaryGap;
    final Map<String, Integer> versions;

    KeyRebuild(List<VersionedRecord> records, boolean boundaryGap,
        Map<String, Integer> versions) {
      this.records = records;
      this.boundaryGap = boundaryGap;
      this.versions = versions;
    }
  }

  /**
   * Callback interface for run progress.
   */
  public interface RunListener {
    /**
     * Called when a phase starts.
     *
     * @param phase Phase name: versions, bridges or events
     * @param totalItems Number of entities the phase will process
     */
    void onPhaseStart(String phase, int totalItems);

    /**
     * Called when a phase completes.
     *
     * @param phase Phase name
     * @param processedItems Number of entities that completed the phase
     */
    void onPhaseComplete(String phase, int processedItems);

    /**
     * Called when an entity fails; the run continues without it.
     */
    void onEntityError(String entity, String phase, Exception error);

    /**
     * Called once the run is complete.
     */
    void onRunComplete(WarehouseRunResult result);
  }

  /**
   * Listener that logs progress.
   */
  public static class LoggingRunListener implements RunListener {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingRunListener.class);

    @Override public void onPhaseStart(String phase, int totalItems) {
      LOG.debug("Starting phase '{}' for {} entities", phase, totalItems);
    }

    @Override public void onPhaseComplete(String phase, int processedItems) {
      LOG.debug("Completed phase '{}': {} entities processed", phase, processedItems);
    }

    @Override public void onEntityError(String entity, String phase, Exception error) {
      LOG.warn("Entity '{}' skipped after phase '{}': {}", entity, phase, error.getMessage());
    }

    @Override public void onRunComplete(WarehouseRunResult result) {
      for (EntityRunResult entity : result.getEntities()) {
        LOG.info("{}", entity);
      }
      LOG.info("{}", result);
    }
  }
}

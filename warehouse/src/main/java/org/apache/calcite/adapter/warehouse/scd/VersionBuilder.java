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
package org.apache.calcite.adapter.warehouse.scd;

import org.apache.calcite.adapter.warehouse.raw.RawObservation;
import org.apache.calcite.adapter.warehouse.raw.RawObservationStore;
import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Reconstructs the versions of a key from its raw history.
 *
 * <p>Only keys reported by {@link ChangeWindowDetector} are rebuilt, but each
 * over its full (retained) history: closing the version that preceded the
 * window needs the observation before it, and the validity end of a version
 * opened inside the window needs the observation after it.
 *
 * <h3>Derivation</h3>
 * For observations sorted by {@code loaded_at}, at position {@code i} of
 * {@code N}:
 * <ul>
 *   <li>{@code valid_from}: the epoch for the first observation, otherwise
 *       {@code loaded_at(i-1)} ({@link IntervalConvention#LAGGED}) or
 *       {@code loaded_at(i)} ({@link IntervalConvention#CONTIGUOUS})</li>
 *   <li>{@code valid_to}: {@code loaded_at(i+1)}, or
 *       {@link WarehouseTimestamps#FAR_FUTURE} for the last observation</li>
 *   <li>{@code updated_at}: {@code valid_to} for closed versions;
 *       {@code loaded_at} for the open one</li>
 *   <li>{@code version}: {@code N - i}, so the current version is 1</li>
 *   <li>{@code is_current}: true only for the last observation</li>
 * </ul>
 *
 * <h3>Emission</h3>
 * A version is emitted for a window when its hash is one of the window's
 * boundary hashes ({@link KeyHistory#boundaryHashes(TimeWindow)}) and its
 * {@code updated_at} falls inside the window. A version therefore stays
 * un-emitted until an observation opens or closes it.
 *
 * <p>Consecutive observations with identical hashes still produce separate
 * versions.
 */
public class VersionBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(VersionBuilder.class);

  private final RawObservationStore store;
  private final IntervalConvention convention;
  private final @Nullable Duration retention;

  /**
   * Creates a builder over the full history of every key.
   */
  public VersionBuilder(RawObservationStore store, IntervalConvention convention) {
    this(store, convention, null);
  }

  /**
   * Creates a builder.
   *
   * @param store Raw observations of one entity
   * @param convention How validity starts are derived
   * @param retention How far before the window end history is retained, or
   *     null to read the full history
   */
  public VersionBuilder(RawObservationStore store, IntervalConvention convention,
      @Nullable Duration retention) {
    this.store = requireNonNull(store, "store");
    this.convention = requireNonNull(convention, "convention");
    this.retention = retention;
  }

  public IntervalConvention getConvention() {
    return convention;
  }

  /**
   * Loads the history slice of a key for processing a window.
   *
   * @param uniqueKey Key to load
   * @param window Window being processed
   * @return Slice, truncated at the retention horizon if one is configured
   */
  public KeyHistory load(String uniqueKey, TimeWindow window) {
    if (retention == null) {
      return KeyHistory.of(uniqueKey, store.history(uniqueKey));
    }
    Instant horizon = window.getEnd().minus(retention);
    return KeyHistory.retained(uniqueKey, store.history(uniqueKey, horizon),
        store.hasHistoryBefore(uniqueKey, horizon));
  }

  /**
   * Rebuilds a key and returns the versions to emit for the window.
   *
   * @param uniqueKey Key reported as changed for the window
   * @param window Window being processed
   * @return Emitted versions, oldest first
   */
  public List<VersionedRecord> rebuild(String uniqueKey, TimeWindow window) {
    return rebuild(load(uniqueKey, window), window);
  }

  /**
   * Returns the versions of a loaded slice to emit for the window.
   *
   * @param history Slice loaded by {@link #load(String, TimeWindow)}
   * @param window Window being processed
   * @return Emitted versions, oldest first
   */
  public List<VersionedRecord> rebuild(KeyHistory history, TimeWindow window) {
    if (history.hasBoundaryGap(window)) {
      LOGGER.warn("Key '{}': observation preceding window {} is beyond retained history;"
          + " using the epoch as validity start", history.getUniqueKey(), window);
    }
    Set<String> boundary = history.boundaryHashes(window);
    List<VersionedRecord> emitted = new ArrayList<>();
    for (VersionedRecord record : derive(history)) {
      if (boundary.contains(record.getContentHash())
          && window.contains(record.getUpdatedAt())) {
        emitted.add(record);
      }
    }
    LOGGER.debug("Key '{}': {} of {} versions emitted for window {}",
        history.getUniqueKey(), emitted.size(), history.size(), window);
    return emitted;
  }

  /**
   * Returns every version of a key, oldest first, without window filtering.
   *
   * @param uniqueKey Key to derive
   * @return All versions; empty if the key has no observations
   */
  public List<VersionedRecord> history(String uniqueKey) {
    return derive(KeyHistory.of(uniqueKey, store.history(uniqueKey)));
  }

  /**
   * Returns the version number of every observation of a key, counted over
   * its full history so that the latest is 1 and the oldest is the number of
   * observations, whatever part of the history a window read.
   *
   * @param uniqueKey Key to number
   * @return Version number by {@link VersionedRecord#identity()}
   */
  public Map<String, Integer> versionNumbers(String uniqueKey) {
    List<RawObservation> observations =
        KeyHistory.of(uniqueKey, store.history(uniqueKey)).getObservations();
    int n = observations.size();
    Map<String, Integer> numbers = new HashMap<>();
    for (int i = 0; i < n; i++) {
      RawObservation observation = observations.get(i);
      numbers.put(
          VersionedRecord.identity(uniqueKey, observation.getLoadedAt(),
              observation.getContentHash()),
          n - i);
    }
    return numbers;
  }

  /**
   * Derives all versions of a slice.
   */
  public List<VersionedRecord> derive(KeyHistory history) {
    List<RawObservation> observations = history.getObservations();
    int n = observations.size();
    List<VersionedRecord> records = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      RawObservation observation = observations.get(i);
      boolean last = i == n - 1;
      Instant validFrom = validFrom(observations, i);
      Instant validTo = last
          ? WarehouseTimestamps.FAR_FUTURE
          : observations.get(i + 1).getLoadedAt();
      Instant updatedAt = last ? observation.getLoadedAt() : validTo;
      records.add(
          new VersionedRecord(observation.getUniqueKey(), observation.getLoadedAt(),
              observation.getContentHash(), observation.getPayload(),
              validFrom, validTo, updatedAt, n - i, last));
    }
    return records;
  }

  private Instant validFrom(List<RawObservation> observations, int i) {
    if (i == 0) {
      return WarehouseTimestamps.EPOCH;
    }
    switch (convention) {
    case CONTIGUOUS:
      return observations.get(i).getLoadedAt();
    case LAGGED:
    default:
      return observations.get(i - 1).getLoadedAt();
    }
  }
}

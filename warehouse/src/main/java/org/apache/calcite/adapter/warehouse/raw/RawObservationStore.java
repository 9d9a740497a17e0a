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
package org.apache.calcite.adapter.warehouse.raw;

import org.apache.calcite.adapter.warehouse.scd.TimeWindow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only store of raw observations for one entity.
 *
 * <p>The warehouse engine only reads from this store, apart from
 * {@link RawIngestor} which appends. Implementations must tolerate concurrent
 * readers; keys are rebuilt in parallel.
 */
public interface RawObservationStore {

  /**
   * Appends an observation.
   *
   * @param observation Observation to append
   */
  void append(RawObservation observation);

  /**
   * Returns the observations whose {@code loaded_at} lies inside the window,
   * in insertion order.
   *
   * @param window Half-open time window
   * @return Observations loaded during the window
   */
  List<RawObservation> scan(TimeWindow window);

  /**
   * Returns every observation of a key, in insertion order.
   *
   * @param uniqueKey Entity key
   * @return Full history of the key, empty if unknown
   */
  List<RawObservation> history(String uniqueKey);

  /**
   * Returns whether an observation with this content hash was already stored.
   */
  boolean containsHash(String contentHash);

  /** Returns the number of stored observations. */
  long size();

  /**
   * Returns the observations of a key loaded at or after a horizon.
   *
   * @param uniqueKey Entity key
   * @param horizon Oldest instant still retained
   * @return Retained history of the key, in insertion order
   */
  default List<RawObservation> history(String uniqueKey, Instant horizon) {
    List<RawObservation> retained = new ArrayList<>();
    for (RawObservation observation : history(uniqueKey)) {
      if (!observation.getLoadedAt().isBefore(horizon)) {
        retained.add(observation);
      }
    }
    return retained;
  }

  /**
   * Returns whether a key has observations older than a horizon.
   */
  default boolean hasHistoryBefore(String uniqueKey, Instant horizon) {
    for (RawObservation observation : history(uniqueKey)) {
      if (observation.getLoadedAt().isBefore(horizon)) {
        return true;
      }
    }
    return false;
  }
}

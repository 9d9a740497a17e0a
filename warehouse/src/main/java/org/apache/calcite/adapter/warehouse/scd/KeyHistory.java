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

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * In-memory slice of one key's raw history, sorted by {@code loaded_at}.
 *
 * <p>A slice is loaded for each touched key, processed, and discarded, so
 * memory stays bounded by the touched keys and their histories.
 *
 * <p>Sorting is stable: observations sharing a {@code loaded_at} keep the
 * order in which the store returned them.
 */
public final class KeyHistory {

  private static final Comparator<RawObservation> BY_LOADED_AT =
      Comparator.comparing(RawObservation::getLoadedAt);

  private final String uniqueKey;
  private final List<RawObservation> observations;
  private final boolean truncated;

  private KeyHistory(String uniqueKey, List<RawObservation> observations, boolean truncated) {
    this.uniqueKey = uniqueKey;
    List<RawObservation> sorted = new ArrayList<>(observations);
    sorted.sort(BY_LOADED_AT);
    this.observations = ImmutableList.copyOf(sorted);
    this.truncated = truncated;
  }

  /**
   * Creates a slice over the full history of a key.
   */
  public static KeyHistory of(String uniqueKey, List<RawObservation> observations) {
    return new KeyHistory(uniqueKey, observations, false);
  }

  /**
   * Creates a slice over a retained part of a key's history.
   *
   * @param truncated Whether older observations exist beyond the retention horizon
   */
  public static KeyHistory retained(String uniqueKey, List<RawObservation> observations,
      boolean truncated) {
    return new KeyHistory(uniqueKey, observations, truncated);
  }

  public String getUniqueKey() {
    return uniqueKey;
  }

  /** Returns the observations, oldest first. */
  public List<RawObservation> getObservations() {
    return observations;
  }

  /** Returns whether observations older than the slice exist in the store. */
  public boolean isTruncated() {
    return truncated;
  }

  public int size() {
    return observations.size();
  }

  public boolean isEmpty() {
    return observations.isEmpty();
  }

  /** Returns the latest observation loaded strictly before an instant. */
  public @Nullable RawObservation lastBefore(Instant instant) {
    RawObservation last = null;
    for (RawObservation observation : observations) {
      if (!observation.getLoadedAt().isBefore(instant)) {
        break;
      }
      last = observation;
    }
    return last;
  }

  /** Returns the observations loaded inside a window. */
  public List<RawObservation> within(TimeWindow window) {
    List<RawObservation> result = new ArrayList<>();
    for (RawObservation observation : observations) {
      if (window.contains(observation.getLoadedAt())) {
        result.add(observation);
      }
    }
    return result;
  }

  /** Returns the earliest observation loaded at or after an instant. */
  public @Nullable RawObservation firstAtOrAfter(Instant instant) {
    for (RawObservation observation : observations) {
      if (!observation.getLoadedAt().isBefore(instant)) {
        return observation;
      }
    }
    return null;
  }

  /**
   * Returns the hashes whose versions may change when the window is processed:
   * the observation right before the window, every observation inside it,
   * and the observation right after it.
   */
  public Set<String> boundaryHashes(TimeWindow window) {
    Set<String> hashes = new LinkedHashSet<>();
    RawObservation previous = lastBefore(window.getStart());
    if (previous != null) {
      hashes.add(previous.getContentHash());
    }
    for (RawObservation observation : within(window)) {
      hashes.add(observation.getContentHash());
    }
    RawObservation next = firstAtOrAfter(window.getEnd());
    if (next != null) {
      hashes.add(next.getContentHash());
    }
    return hashes;
  }

  /**
   * Returns whether the window has observations for this key but the
   * observation preceding them lies beyond the retained history.
   */
  public boolean hasBoundaryGap(TimeWindow window) {
    return truncated
        && lastBefore(window.getStart()) == null
        && !within(window).isEmpty();
  }

  @Override public String toString() {
    return "KeyHistory{key='" + uniqueKey + "', size=" + observations.size()
        + (truncated ? ", truncated" : "") + "}";
  }
}

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

import org.apache.calcite.adapter.warehouse.raw.InMemoryRawObservationStore;
import org.apache.calcite.adapter.warehouse.raw.RawObservation;
import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link ChangeWindowDetector} and {@link TimeWindow}.
 */
@Tag("unit")
public class ChangeWindowDetectorTest {

  private static final Instant T1 = Instant.parse("2025-01-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2025-01-02T00:00:00Z");
  private static final Instant T3 = Instant.parse("2025-01-03T00:00:00Z");

  private static RawObservation observation(String key, Instant loadedAt) {
    return new RawObservation(key, loadedAt, key + "@" + loadedAt,
        Collections.<String, Object>emptyMap());
  }

  @Test void testChangedKeysAreDistinctAndWindowScoped() {
    InMemoryRawObservationStore store = new InMemoryRawObservationStore();
    store.append(observation("B", T1));
    store.append(observation("A", T2));
    store.append(observation("B", T2.plusSeconds(60)));
    store.append(observation("C", T3));

    Set<String> changed = new ChangeWindowDetector(store).changedKeys(TimeWindow.of(T2, T3));

    assertEquals(Arrays.asList("A", "B"), new ArrayList<>(changed));
  }

  @Test void testEmptyWindow() {
    InMemoryRawObservationStore store = new InMemoryRawObservationStore();
    store.append(observation("A", T1));

    assertTrue(new ChangeWindowDetector(store).changedKeys(TimeWindow.of(T2, T2)).isEmpty());
  }

  @Test void testWindowIsHalfOpen() {
    TimeWindow window = TimeWindow.of(T1, T2);
    assertTrue(window.contains(T1));
    assertTrue(window.contains(T2.minusNanos(1000)));
    assertFalse(window.contains(T2));
    assertFalse(window.contains(T1.minusNanos(1000)));
  }

  @Test void testWindowBounds() {
    assertThrows(IllegalArgumentException.class, () -> TimeWindow.of(T2, T1));
    assertTrue(TimeWindow.all().contains(WarehouseTimestamps.EPOCH));
    assertTrue(TimeWindow.all().contains(WarehouseTimestamps.FAR_FUTURE));
    assertEquals(TimeWindow.of(T1, T2), TimeWindow.of(T1, T2));
  }
}

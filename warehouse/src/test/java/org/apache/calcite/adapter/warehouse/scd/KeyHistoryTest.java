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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link KeyHistory}.
 */
@Tag("unit")
public class KeyHistoryTest {

  private static final Instant T1 = Instant.parse("2025-01-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2025-01-02T00:00:00Z");
  private static final Instant T3 = Instant.parse("2025-01-03T00:00:00Z");
  private static final Instant T4 = Instant.parse("2025-01-04T00:00:00Z");

  private static RawObservation observation(Instant loadedAt, String hash) {
    return new RawObservation("K", loadedAt, hash, Collections.<String, Object>emptyMap());
  }

  private static KeyHistory history() {
    return KeyHistory.of("K", Arrays.asList(
        observation(T4, "H4"),
        observation(T1, "H1"),
        observation(T3, "H3"),
        observation(T2, "H2")));
  }

  @Test void testBoundaryHashes() {
    assertEquals(Arrays.asList("H1", "H2", "H3"),
        new ArrayList<>(history().boundaryHashes(TimeWindow.of(T2, T3))));
    assertEquals(Arrays.asList("H3", "H4"),
        new ArrayList<>(history().boundaryHashes(TimeWindow.of(T4, T4.plusSeconds(1)))));
  }

  @Test void testNeighbours() {
    KeyHistory history = history();
    assertEquals("H2", history.lastBefore(T3).getContentHash());
    assertNull(history.lastBefore(T1));
    assertEquals("H3", history.firstAtOrAfter(T3).getContentHash());
    assertNull(history.firstAtOrAfter(T4.plusSeconds(1)));
  }

  @Test void testFullHistoryHasNoGap() {
    assertFalse(history().hasBoundaryGap(TimeWindow.of(T1, T2)));
  }
}

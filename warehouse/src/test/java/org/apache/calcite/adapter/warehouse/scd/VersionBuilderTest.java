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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link VersionBuilder}.
 */
@Tag("unit")
public class VersionBuilderTest {

  private static final Instant T1 = Instant.parse("2025-01-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2025-01-02T00:00:00Z");
  private static final Instant T3 = Instant.parse("2025-01-03T00:00:00Z");
  private static final Instant T4 = Instant.parse("2025-01-04T00:00:00Z");

  private InMemoryRawObservationStore store;

  @BeforeEach void setUp() {
    store = new InMemoryRawObservationStore();
  }

  private void observe(String key, Instant loadedAt, String hash) {
    store.append(
        new RawObservation(key, loadedAt, hash, Collections.singletonMap("name", hash)));
  }

  private void threeObservations() {
    observe("K", T1, "H1");
    observe("K", T2, "H2");
    observe("K", T3, "H3");
  }

  private static void assertVersion(VersionedRecord record, String hash, Instant from,
      Instant to, int version, boolean current) {
    assertEquals(hash, record.getContentHash());
    assertEquals(from, record.getValidFrom(), "valid_from of " + hash);
    assertEquals(to, record.getValidTo(), "valid_to of " + hash);
    assertEquals(version, record.getVersion(), "version of " + hash);
    assertEquals(current, record.isCurrent(), "is_current of " + hash);
  }

  @Test void testThreeObservationScenario() {
    threeObservations();
    VersionBuilder builder = new VersionBuilder(store, IntervalConvention.LAGGED);

    List<VersionedRecord> records = builder.rebuild("K", TimeWindow.of(T1, T3.plusSeconds(1)));

    assertEquals(3, records.size());
    assertVersion(records.get(0), "H1", WarehouseTimestamps.EPOCH, T2, 3, false);
    assertVersion(records.get(1), "H2", T1, T3, 2, false);
    assertVersion(records.get(2), "H3", T2, WarehouseTimestamps.FAR_FUTURE, 1, true);
  }

  @Test void testUpdatedAtClosesOrOpensVersion() {
    threeObservations();
    List<VersionedRecord> records =
        new VersionBuilder(store, IntervalConvention.LAGGED).history("K");

    assertEquals(T2, records.get(0).getUpdatedAt());
    assertEquals(T3, records.get(1).getUpdatedAt());
    assertEquals(T3, records.get(2).getUpdatedAt());
  }

  @Test void testWindowEmitsOnlyBoundaryVersions() {
    threeObservations();
    VersionBuilder builder = new VersionBuilder(store, IntervalConvention.LAGGED);

    List<VersionedRecord> records = builder.rebuild("K", TimeWindow.of(T3, T4));

    // H2 is closed by T3 and H3 opens; H1 was closed in an earlier window
    assertEquals(2, records.size());
    assertVersion(records.get(0), "H2", T1, T3, 2, false);
    assertVersion(records.get(1), "H3", T2, WarehouseTimestamps.FAR_FUTURE, 1, true);
  }

  @Test void testVersionOpenedBeforeLaterObservationIsNotReemitted() {
    threeObservations();
    VersionBuilder builder = new VersionBuilder(store, IntervalConvention.LAGGED);

    // The window holds H2 only; H2 closes at T3, outside the window
    List<VersionedRecord> records = builder.rebuild("K", TimeWindow.of(T2, T3));

    assertEquals(1, records.size());
    assertVersion(records.get(0), "H1", WarehouseTimestamps.EPOCH, T2, 3, false);
  }

  @Test void testContiguousConventionPartitionsTime() {
    threeObservations();
    observe("K", T4, "H4");
    List<VersionedRecord> records =
        new VersionBuilder(store, IntervalConvention.CONTIGUOUS).history("K");

    assertEquals(WarehouseTimestamps.EPOCH, records.get(0).getValidFrom());
    for (int i = 0; i + 1 < records.size(); i++) {
      assertEquals(records.get(i).getValidTo(), records.get(i + 1).getValidFrom());
    }
    assertEquals(T4, records.get(3).getValidFrom());
    assertEquals(WarehouseTimestamps.FAR_FUTURE, records.get(3).getValidTo());
  }

  @Test void testSingleCurrentRowAndVersionSequence() {
    threeObservations();
    observe("K", T4, "H4");
    for (IntervalConvention convention : IntervalConvention.values()) {
      List<VersionedRecord> records = new VersionBuilder(store, convention).history("K");
      int current = 0;
      for (int i = 0; i < records.size(); i++) {
        assertEquals(records.size() - i, records.get(i).getVersion());
        if (records.get(i).isCurrent()) {
          current++;
          assertEquals(T4, records.get(i).getLoadedAt());
        }
      }
      assertEquals(1, current);
    }
  }

  @Test void testIdenticalConsecutiveHashesStaySeparateVersions() {
    observe("K", T1, "H1");
    observe("K", T2, "H1");
    List<VersionedRecord> records =
        new VersionBuilder(store, IntervalConvention.LAGGED).history("K");

    assertEquals(2, records.size());
    assertEquals(2, records.get(0).getVersion());
    assertEquals(1, records.get(1).getVersion());
  }

  @Test void testOutOfOrderAppendsAreSorted() {
    observe("K", T3, "H3");
    observe("K", T1, "H1");
    observe("K", T2, "H2");
    List<VersionedRecord> records =
        new VersionBuilder(store, IntervalConvention.LAGGED).history("K");

    assertEquals("H1", records.get(0).getContentHash());
    assertEquals("H3", records.get(2).getContentHash());
  }

  @Test void testTiesKeepInsertionOrder() {
    observe("K", T1, "first");
    observe("K", T1, "second");
    List<VersionedRecord> records =
        new VersionBuilder(store, IntervalConvention.LAGGED).history("K");

    assertEquals("first", records.get(0).getContentHash());
    assertEquals("second", records.get(1).getContentHash());
    assertTrue(records.get(1).isCurrent());
  }

  @Test void testRebuildIsIdempotent() {
    threeObservations();
    VersionBuilder builder = new VersionBuilder(store, IntervalConvention.LAGGED);
    TimeWindow window = TimeWindow.of(T2, T4);

    assertEquals(builder.rebuild("K", window), builder.rebuild("K", window));
  }

  @Test void testUnknownKeyYieldsNothing() {
    VersionBuilder builder = new VersionBuilder(store, IntervalConvention.LAGGED);
    assertTrue(builder.rebuild("missing", TimeWindow.all()).isEmpty());
    assertTrue(builder.history("missing").isEmpty());
  }

  @Test void testRetentionTruncatesHistory() {
    threeObservations();
    VersionBuilder builder =
        new VersionBuilder(store, IntervalConvention.LAGGED, Duration.ofDays(1));
    TimeWindow window = TimeWindow.of(T3, T4);

    // Horizon is T4 - 1 day = T3: the observation before the window is gone
    KeyHistory history = builder.load("K", window);
    assertTrue(history.isTruncated());
    assertTrue(history.hasBoundaryGap(window));

    List<VersionedRecord> records = builder.rebuild(history, window);
    assertEquals(1, records.size());
    assertVersion(records.get(0), "H3", WarehouseTimestamps.EPOCH,
        WarehouseTimestamps.FAR_FUTURE, 1, true);
  }

  @Test void testRetentionCoveringBoundaryHasNoGap() {
    threeObservations();
    VersionBuilder builder =
        new VersionBuilder(store, IntervalConvention.LAGGED, Duration.ofDays(2));
    TimeWindow window = TimeWindow.of(T3, T4);

    KeyHistory history = builder.load("K", window);
    assertTrue(history.isTruncated());
    assertFalse(history.hasBoundaryGap(window));
    assertEquals(2, builder.rebuild(history, window).size());
  }
}

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

import org.apache.calcite.adapter.warehouse.config.EntityConfig;
import org.apache.calcite.adapter.warehouse.hook.HookDefinition;
import org.apache.calcite.adapter.warehouse.scd.TimeWindow;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for {@link RawIngestor}.
 */
@Tag("unit")
public class RawIngestorTest {

  private InMemoryRawObservationStore store;
  private RawIngestor ingestor;

  @BeforeEach void setUp() {
    EntityConfig entity = EntityConfig.builder()
        .name("northwind__order_details")
        .uniqueKey(Arrays.asList("order_id", "product_id"))
        .columns(Arrays.asList("order_id", "product_id", "quantity", "_dlt_id"))
        .hooks(
            Collections.singletonList(
                HookDefinition.builder()
                    .name("_hook__order__id")
                    .keyset("northwind.order.id")
                    .expression("order_id")
                    .primary(true)
                    .build()))
        .build();
    store = new InMemoryRawObservationStore();
    ingestor = new RawIngestor(entity, store);
  }

  private static Map<String, Object> row(Object orderId, Object productId, Object quantity,
      Object loadId) {
    Map<String, Object> row = new HashMap<>();
    row.put("order_id", orderId);
    row.put("product_id", productId);
    row.put("quantity", quantity);
    row.put("_dlt_load_id", loadId);
    row.put("_dlt_id", "row-" + orderId + "-" + loadId);
    return row;
  }

  @Test void testIngestBuildsObservations() {
    IngestResult result = ingestor.ingest(
        Collections.singletonList(row(10248, 11, 12, "1724140800.5")));

    assertEquals(1, result.getAppended());
    RawObservation observation = store.history("10248|11").get(0);
    assertEquals(Instant.parse("2024-08-20T08:00:00.500Z"), observation.getLoadedAt());
    assertEquals(Arrays.asList("order_id", "product_id", "quantity"),
        new ArrayList<>(observation.getPayload().keySet()));
    assertEquals(12, observation.getPayload().get("quantity"));
  }

  @Test void testInstantLoadIdIsTruncatedToMicros() {
    ingestor.ingest(Collections.singletonList(
        row(10248, 11, 12, Instant.parse("2024-08-20T08:00:00.000001999Z"))));

    assertEquals(Instant.parse("2024-08-20T08:00:00.000001Z"),
        store.history("10248|11").get(0).getLoadedAt());
  }

  @Test void testReingestingIsIdempotent() {
    List<Map<String, Object>> batch = Arrays.asList(
        row(10248, 11, 12, "1724140800"),
        row(10248, 42, 10, "1724140800"));

    ingestor.ingest(batch);
    IngestResult again = ingestor.ingest(batch);

    assertEquals(0, again.getAppended());
    assertEquals(2, again.getDuplicates());
    assertEquals(2, store.size());
  }

  @Test void testMetadataColumnsDoNotChangeHash() {
    ingestor.ingest(Collections.singletonList(row(10248, 11, 12, "1724140800")));
    IngestResult result =
        ingestor.ingest(Collections.singletonList(row(10248, 11, 12, "1724227200")));

    assertEquals(1, result.getDuplicates());
    assertEquals(1, store.history("10248|11").size());
  }

  @Test void testChangedAttributesAppend() {
    ingestor.ingest(Collections.singletonList(row(10248, 11, 12, "1724140800")));
    ingestor.ingest(Collections.singletonList(row(10248, 11, 15, "1724227200")));

    assertEquals(2, store.history("10248|11").size());
    assertEquals(1, store.scan(
        TimeWindow.of(Instant.parse("2024-08-21T00:00:00Z"),
            Instant.parse("2024-08-22T00:00:00Z"))).size());
  }

  @Test void testDuplicateInsideBatch() {
    IngestResult result = ingestor.ingest(Arrays.asList(
        row(10248, 11, 12, "1724140800"),
        row(10248, 11, 12, "1724140801")));

    assertEquals(1, result.getAppended());
    assertEquals(1, result.getDuplicates());
  }

  @Test void testRejectsRowsWithoutKeyOrLoadId() {
    IngestResult result = ingestor.ingest(Arrays.asList(
        row(10248, null, 12, "1724140800"),
        row(10249, 11, 12, null),
        row(10250, 11, 12, "not-a-number"),
        row(10251, 11, 12, Instant.parse("2024-08-20T08:00:00Z"))));

    assertEquals(4, result.getReceived());
    assertEquals(3, result.getRejected());
    assertEquals(3, result.getErrors().size());
    assertEquals(1, result.getAppended());
    assertFalse(store.history("10251|11").isEmpty());
  }

  @Test void testUniqueKeyExtractor() {
    UniqueKeyExtractor extractor =
        new UniqueKeyExtractor(Arrays.asList("order_id", "product_id"));
    assertEquals("10248|11", extractor.extract(row(10248, 11, 1, "1")));
    assertNull(extractor.extract(row(10248, " ", 1, "1")));
  }
}

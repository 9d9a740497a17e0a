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

import org.apache.calcite.adapter.warehouse.config.ColumnIntrospector;
import org.apache.calcite.adapter.warehouse.config.EntityConfig;
import org.apache.calcite.adapter.warehouse.fingerprint.Fingerprinter;
import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Turns landing rows of one entity into raw observations.
 *
 * <p>For each landing row the ingestor
 * <ol>
 *   <li>extracts the unique key from the configured key columns</li>
 *   <li>reads {@code loaded_at} from the load id column: an {@link Instant}
 *       is taken as is, anything else is read as seconds since the epoch</li>
 *   <li>fingerprints the entity's attribute columns</li>
 *   <li>drops the row if an observation with the same hash is already stored
 *       or appeared earlier in the batch</li>
 * </ol>
 *
 * <p>Re-ingesting a batch therefore appends nothing. Rows without a key or
 * load id are rejected and reported in the {@link IngestResult}; they never
 * abort the batch.
 */
public class RawIngestor {

  private static final Logger LOGGER = LoggerFactory.getLogger(RawIngestor.class);

  private final EntityConfig entity;
  private final RawObservationStore store;
  private final UniqueKeyExtractor keyExtractor;
  private final Fingerprinter fingerprinter;

  public RawIngestor(EntityConfig entity, RawObservationStore store) {
    this.entity = requireNonNull(entity, "entity");
    this.store = requireNonNull(store, "store");
    this.keyExtractor = new UniqueKeyExtractor(entity.getUniqueKey());
    this.fingerprinter = new Fingerprinter(entity.getAttributeColumns());
  }

  /**
   * Ingests a batch of landing rows.
   *
   * @param rows Landing rows, in load order
   * @return Counts of appended, duplicate and rejected rows
   */
  public IngestResult ingest(List<? extends Map<String, ?>> rows) {
    IngestResult.Builder result = IngestResult.builder(entity.getName()).received(rows.size());
    Set<String> batchHashes = new HashSet<>();
    int index = 0;
    for (Map<String, ?> row : rows) {
      index++;
      String key = keyExtractor.extract(row);
      if (key == null) {
        result.rejected("row " + index + ": missing unique key " + entity.getUniqueKey());
        continue;
      }
      Instant loadedAt = loadedAt(row.get(entity.getLoadIdColumn()));
      if (loadedAt == null) {
        result.rejected("row " + index + " (key " + key + "): missing or invalid "
            + entity.getLoadIdColumn() + " '" + row.get(entity.getLoadIdColumn()) + "'");
        continue;
      }
      String hash = fingerprinter.fingerprint(row);
      if (!batchHashes.add(hash) || store.containsHash(hash)) {
        result.duplicate();
        continue;
      }
      store.append(new RawObservation(key, loadedAt, hash, payload(row)));
      result.appended();
    }
    IngestResult ingest = result.build();
    if (ingest.getRejected() > 0) {
      LOGGER.warn("Entity '{}': rejected {} of {} landing rows, first: {}", entity.getName(),
          ingest.getRejected(), rows.size(), ingest.getErrors().get(0));
    }
    LOGGER.info("{}", ingest);
    return ingest;
  }

  private Map<String, @Nullable Object> payload(Map<String, ?> row) {
    Map<String, @Nullable Object> payload = new LinkedHashMap<>();
    for (String column : entity.getColumns()) {
      if (!column.startsWith(ColumnIntrospector.METADATA_PREFIX)) {
        payload.put(column, row.get(column));
      }
    }
    return payload;
  }

  private static @Nullable Instant loadedAt(@Nullable Object loadId) {
    if (loadId == null) {
      return null;
    }
    if (loadId instanceof Instant) {
      return ((Instant) loadId).truncatedTo(ChronoUnit.MICROS);
    }
    try {
      return WarehouseTimestamps.fromLoadId(loadId.toString());
    } catch (NumberFormatException | ArithmeticException e) {
      LOGGER.debug("Unreadable load id '{}': {}", loadId, e.getMessage());
      return null;
    }
  }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Heap-backed {@link RawObservationStore}.
 *
 * <p>Keeps the append log plus an index by key, so that a key's history is
 * read without scanning the whole log.
 */
public class InMemoryRawObservationStore implements RawObservationStore {

  private final List<RawObservation> log = new ArrayList<>();
  private final Map<String, List<RawObservation>> byKey = new HashMap<>();
  private final Set<String> hashes = new HashSet<>();

  @Override public synchronized void append(RawObservation observation) {
    log.add(observation);
    byKey.computeIfAbsent(observation.getUniqueKey(), k -> new ArrayList<>())
        .add(observation);
    hashes.add(observation.getContentHash());
  }

  @Override public synchronized List<RawObservation> scan(TimeWindow window) {
    List<RawObservation> result = new ArrayList<>();
    for (RawObservation observation : log) {
      if (window.contains(observation.getLoadedAt())) {
        result.add(observation);
      }
    }
    return result;
  }

  @Override public synchronized List<RawObservation> history(String uniqueKey) {
    List<RawObservation> history = byKey.get(uniqueKey);
    return history == null
        ? Collections.emptyList()
        : new ArrayList<>(history);
  }

  @Override public synchronized boolean containsHash(String contentHash) {
    return hashes.contains(contentHash);
  }

  @Override public synchronized long size() {
    return log.size();
  }

  @Override public String toString() {
    return "InMemoryRawObservationStore{size=" + size() + "}";
  }
}

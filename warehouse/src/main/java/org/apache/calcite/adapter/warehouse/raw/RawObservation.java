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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * One ingested snapshot of an entity's attributes.
 *
 * <p>Observations are created once by ingestion and never updated or deleted.
 * Payload values may be null; column order is preserved.
 */
public final class RawObservation {

  private final String uniqueKey;
  private final Instant loadedAt;
  private final String contentHash;
  private final Map<String, @Nullable Object> payload;

  public RawObservation(String uniqueKey, Instant loadedAt, String contentHash,
      Map<String, ? extends @Nullable Object> payload) {
    this.uniqueKey = requireNonNull(uniqueKey, "uniqueKey");
    this.loadedAt = requireNonNull(loadedAt, "loadedAt");
    this.contentHash = requireNonNull(contentHash, "contentHash");
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
  }

  public String getUniqueKey() {
    return uniqueKey;
  }

  public Instant getLoadedAt() {
    return loadedAt;
  }

  public String getContentHash() {
    return contentHash;
  }

  /** Returns the payload columns, in source order. */
  public Map<String, @Nullable Object> getPayload() {
    return payload;
  }

  @Override public String toString() {
    return "RawObservation{key='" + uniqueKey + "', loadedAt=" + loadedAt
        + ", hash=" + contentHash.substring(0, Math.min(12, contentHash.length())) + "}";
  }
}

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

import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Historical slice of one key: the payload of an observation together with
 * its validity interval, version number and currency flag.
 *
 * <p>The interval is half-open, {@code [validFrom, validTo)}. The open-ended
 * version carries {@link WarehouseTimestamps#FAR_FUTURE} as {@code validTo}.
 */
public final class VersionedRecord {

  /** Column names exposed to collaborators. */
  public static final String VALID_FROM = "_valid_from";
  public static final String VALID_TO = "_valid_to";
  public static final String UPDATED_AT = "_updated_at";
  public static final String VERSION = "_version";
  public static final String IS_CURRENT = "_is_current";

  private final String uniqueKey;
  private final Instant loadedAt;
  private final String contentHash;
  private final Map<String, @Nullable Object> payload;
  private final Instant validFrom;
  private final Instant validTo;
  private final Instant updatedAt;
  private final int version;
  private final boolean current;

  public VersionedRecord(String uniqueKey, Instant loadedAt, String contentHash,
      Map<String, ? extends @Nullable Object> payload, Instant validFrom, Instant validTo,
      Instant updatedAt, int version, boolean current) {
    this.uniqueKey = requireNonNull(uniqueKey, "uniqueKey");
    this.loadedAt = requireNonNull(loadedAt, "loadedAt");
    this.contentHash = requireNonNull(contentHash, "contentHash");
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    this.validFrom = requireNonNull(validFrom, "validFrom");
    this.validTo = requireNonNull(validTo, "validTo");
    this.updatedAt = requireNonNull(updatedAt, "updatedAt");
    if (version < 1) {
      throw new IllegalArgumentException("Version must be positive: " + version);
    }
    this.version = version;
    this.current = current;
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

  public Map<String, @Nullable Object> getPayload() {
    return payload;
  }

  public Instant getValidFrom() {
    return validFrom;
  }

  public Instant getValidTo() {
    return validTo;
  }

  /** Returns the instant that closed this version, or opened it if still current. */
  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Returns the version number; 1 is the most recent. */
  public int getVersion() {
    return version;
  }

  public boolean isCurrent() {
    return current;
  }

  /** Returns this record with another version number, or this if unchanged. */
  public VersionedRecord withVersion(int version) {
    if (version == this.version) {
      return this;
    }
    return new VersionedRecord(uniqueKey, loadedAt, contentHash, payload, validFrom, validTo,
        updatedAt, version, current);
  }

  /**
   * Returns the store identity of this row: key, load instant and hash.
   * Re-emitting the same observation yields the same identity.
   */
  public String identity() {
    return identity(uniqueKey, loadedAt, contentHash);
  }

  /** Returns the store identity of the version of an observation. */
  public static String identity(String uniqueKey, Instant loadedAt, String contentHash) {
    return uniqueKey + '\u0000' + loadedAt + '\u0000' + contentHash;
  }

  @Override public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof VersionedRecord)) {
      return false;
    }
    VersionedRecord that = (VersionedRecord) obj;
    return version == that.version
        && current == that.current
        && uniqueKey.equals(that.uniqueKey)
        && loadedAt.equals(that.loadedAt)
        && contentHash.equals(that.contentHash)
        && payload.equals(that.payload)
        && validFrom.equals(that.validFrom)
        && validTo.equals(that.validTo)
        && updatedAt.equals(that.updatedAt);
  }

  @Override public int hashCode() {
    return Objects.hash(uniqueKey, loadedAt, contentHash, validFrom, validTo, version);
  }

  @Override public String toString() {
    return "VersionedRecord{key='" + uniqueKey + "', version=" + version
        + ", valid=[" + WarehouseTimestamps.format(validFrom) + ", "
        + WarehouseTimestamps.format(validTo) + ")"
        + (current ? ", current" : "") + "}";
  }
}

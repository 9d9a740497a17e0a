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
package org.apache.calcite.adapter.warehouse.run;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statistics and status of one entity within a warehouse run.
 *
 * <p>A failed entity keeps the counts of the phases that completed before
 * the failure.
 *
 * @see WarehouseRunResult
 */
public class EntityRunResult {

  private final String entity;
  private final int changedKeys;
  private final int versionsEmitted;
  private final int versionsWritten;
  private final int hookedRecords;
  private final int quarantined;
  private final int boundaryGaps;
  private final int bridgeRows;
  private final int malformedHooks;
  private final int eventRows;
  private final List<String> errors;
  private final boolean failed;
  private final String failureMessage;

  private EntityRunResult(Builder builder) {
    this.entity = builder.entity;
    this.changedKeys = builder.changedKeys;
    this.versionsEmitted = builder.versionsEmitted;
    this.versionsWritten = builder.versionsWritten;
    this.hookedRecords = builder.hookedRecords;
    this.quarantined = builder.quarantined;
    this.boundaryGaps = builder.boundaryGaps;
    this.bridgeRows = builder.bridgeRows;
    this.malformedHooks = builder.malformedHooks;
    this.eventRows = builder.eventRows;
    this.errors = Collections.unmodifiableList(new ArrayList<String>(builder.errors));
    this.failed = builder.failed;
    this.failureMessage = builder.failureMessage;
  }

  public String getEntity() {
    return entity;
  }

  /**
   * Returns the number of keys with observations inside the window.
   */
  public int getChangedKeys() {
    return changedKeys;
  }

  /**
   * Returns the number of versions emitted for the window.
   */
  public int getVersionsEmitted() {
    return versionsEmitted;
  }

  /**
   * Returns the number of emitted versions that were new or changed in the
   * output store. Zero when a window is re-run.
   */
  public int getVersionsWritten() {
    return versionsWritten;
  }

  public int getHookedRecords() {
    return hookedRecords;
  }

  /**
   * Returns the number of records quarantined for missing or malformed hook
   * components.
   */
  public int getQuarantined() {
    return quarantined;
  }

  /**
   * Returns the number of keys whose history was truncated right before the
   * window by the retention depth.
   */
  public int getBoundaryGaps() {
    return boundaryGaps;
  }

  public int getBridgeRows() {
    return bridgeRows;
  }

  /**
   * Returns the number of malformed hook values skipped while joining.
   */
  public int getMalformedHooks() {
    return malformedHooks;
  }

  public int getEventRows() {
    return eventRows;
  }

  public List<String> getErrors() {
    return errors;
  }

  public boolean isFailed() {
    return failed;
  }

  public String getFailureMessage() {
    return failureMessage;
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("EntityRunResult{entity='").append(entity).append("'");
    if (failed) {
      sb.append(", FAILED: ").append(failureMessage);
    }
    sb.append(", changedKeys=").append(changedKeys);
    sb.append(", versions=").append(versionsEmitted);
    if (quarantined > 0) {
      sb.append(" (").append(quarantined).append(" quarantined)");
    }
    if (boundaryGaps > 0) {
      sb.append(", boundaryGaps=").append(boundaryGaps);
    }
    sb.append(", bridgeRows=").append(bridgeRows);
    if (malformedHooks > 0) {
      sb.append(" (").append(malformedHooks).append(" malformed hooks)");
    }
    sb.append(", eventRows=").append(eventRows);
    sb.append("}");
    return sb.toString();
  }

  public static Builder builder(String entity) {
    return new Builder(entity);
  }

  /**
   * Builder for EntityRunResult.
   */
  public static class Builder {
    private final String entity;
    private int changedKeys;
    private int versionsEmitted;
    private int versionsWritten;
    private int hookedRecords;
    private int quarantined;
    private int boundaryGaps;
    private int bridgeRows;
    private int malformedHooks;
    private int eventRows;
    private final List<String> errors = new ArrayList<String>();
    private boolean failed;
    private String failureMessage;

    Builder(String entity) {
      this.entity = entity;
    }

    public Builder changedKeys(int changedKeys) {
      this.changedKeys = changedKeys;
      return this;
    }

    public Builder versionsEmitted(int versionsEmitted) {
      this.versionsEmitted = versionsEmitted;
      return this;
    }

    public Builder versionsWritten(int versionsWritten) {
      this.versionsWritten = versionsWritten;
      return this;
    }

    public Builder hookedRecords(int hookedRecords) {
      this.hookedRecords = hookedRecords;
      return this;
    }

    public Builder quarantined(int quarantined) {
      this.quarantined = quarantined;
      return this;
    }

    public Builder boundaryGaps(int boundaryGaps) {
      this.boundaryGaps = boundaryGaps;
      return this;
    }

    public Builder bridgeRows(int bridgeRows) {
      this.bridgeRows = bridgeRows;
      return this;
    }

    public Builder malformedHooks(int malformedHooks) {
      this.malformedHooks = malformedHooks;
      return this;
    }

    public Builder eventRows(int eventRows) {
      this.eventRows = eventRows;
      return this;
    }

    public Builder error(String error) {
      this.errors.add(error);
      return this;
    }

    /**
     * Marks the entity failed. Later phases skip a failed entity.
     */
    public Builder failed(String message) {
      this.failed = true;
      this.failureMessage = message;
      this.errors.add(message);
      return this;
    }

    public boolean isFailed() {
      return failed;
    }

    public EntityRunResult build() {
      return new EntityRunResult(this);
    }
  }
}

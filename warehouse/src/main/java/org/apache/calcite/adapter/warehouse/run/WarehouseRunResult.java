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

import org.apache.calcite.adapter.warehouse.scd.TimeWindow;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of running a warehouse over one window.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * WarehouseRunResult result = runner.run(TimeWindow.of(start, end));
 * if (!result.isSuccessful()) {
 *   for (EntityRunResult entity : result.getFailedEntities()) {
 *     LOGGER.error("{}: {}", entity.getEntity(), entity.getFailureMessage());
 *   }
 * }
 * }</pre>
 *
 * @see WarehouseRunner
 */
public class WarehouseRunResult {

  private final String warehouse;
  private final TimeWindow window;
  private final List<EntityRunResult> entities;
  private final long elapsedMs;

  public WarehouseRunResult(String warehouse, TimeWindow window,
      List<EntityRunResult> entities, long elapsedMs) {
    this.warehouse = warehouse;
    this.window = window;
    this.entities = Collections.unmodifiableList(new ArrayList<EntityRunResult>(entities));
    this.elapsedMs = elapsedMs;
  }

  public String getWarehouse() {
    return warehouse;
  }

  public TimeWindow getWindow() {
    return window;
  }

  /**
   * Returns the per-entity results, in configuration order.
   */
  public List<EntityRunResult> getEntities() {
    return entities;
  }

  /**
   * Returns the result of one entity, or null if it was not part of the run.
   */
  public @Nullable EntityRunResult getEntity(String entity) {
    for (EntityRunResult result : entities) {
      if (result.getEntity().equals(entity)) {
        return result;
      }
    }
    return null;
  }

  public List<EntityRunResult> getFailedEntities() {
    List<EntityRunResult> failed = new ArrayList<EntityRunResult>();
    for (EntityRunResult result : entities) {
      if (result.isFailed()) {
        failed.add(result);
      }
    }
    return failed;
  }

  /**
   * Returns whether every entity completed.
   */
  public boolean isSuccessful() {
    return getFailedEntities().isEmpty();
  }

  public long getElapsedMs() {
    return elapsedMs;
  }

  /**
   * Returns the total number of versions emitted across entities.
   */
  public int getVersionsEmitted() {
    int total = 0;
    for (EntityRunResult result : entities) {
      total += result.getVersionsEmitted();
    }
    return total;
  }

  /**
   * Returns the total number of quarantined records across entities.
   */
  public int getQuarantined() {
    int total = 0;
    for (EntityRunResult result : entities) {
      total += result.getQuarantined();
    }
    return total;
  }

  @Override public String toString() {
    return "WarehouseRunResult{warehouse='" + warehouse + "', window=" + window
        + ", entities=" + entities.size() + ", failed=" + getFailedEntities().size()
        + ", versions=" + getVersionsEmitted() + ", elapsed=" + elapsedMs + "ms}";
  }
}

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
import org.apache.calcite.adapter.warehouse.raw.RawObservationStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;

/**
 * Finds the keys that received at least one observation inside a window.
 *
 * <p>Only the newly arrived slice is examined, so the cost of a run follows
 * arrival volume rather than history size. Pure read.
 */
public class ChangeWindowDetector {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChangeWindowDetector.class);

  private final RawObservationStore store;

  public ChangeWindowDetector(RawObservationStore store) {
    this.store = requireNonNull(store, "store");
  }

  /**
   * Returns the distinct keys loaded inside the window, in sorted order.
   *
   * @param window Half-open window
   * @return Changed keys, empty if nothing arrived
   */
  public Set<String> changedKeys(TimeWindow window) {
    Set<String> keys = new TreeSet<>();
    int arrivals = 0;
    for (RawObservation observation : store.scan(window)) {
      keys.add(observation.getUniqueKey());
      arrivals++;
    }
    LOGGER.debug("Window {}: {} arrivals over {} keys", window, arrivals, keys.size());
    return keys;
  }
}

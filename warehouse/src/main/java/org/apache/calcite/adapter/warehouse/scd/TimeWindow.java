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

import java.time.Instant;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Half-open time range {@code [start, end)} processed by one incremental run.
 */
public final class TimeWindow {

  private final Instant start;
  private final Instant end;

  private TimeWindow(Instant start, Instant end) {
    this.start = requireNonNull(start, "start");
    this.end = requireNonNull(end, "end");
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("Window end " + end + " precedes start " + start);
    }
  }

  /**
   * Creates a window.
   *
   * @param start Inclusive lower bound
   * @param end Exclusive upper bound
   */
  public static TimeWindow of(Instant start, Instant end) {
    return new TimeWindow(start, end);
  }

  /** Window covering all representable validity instants. */
  public static TimeWindow all() {
    return new TimeWindow(WarehouseTimestamps.EPOCH, WarehouseTimestamps.FAR_FUTURE.plusSeconds(1));
  }

  public Instant getStart() {
    return start;
  }

  public Instant getEnd() {
    return end;
  }

  /** Returns whether {@code start <= instant < end}. */
  public boolean contains(Instant instant) {
    return !instant.isBefore(start) && instant.isBefore(end);
  }

  @Override public boolean equals(Object obj) {
    return this == obj
        || obj instanceof TimeWindow
        && start.equals(((TimeWindow) obj).start)
        && end.equals(((TimeWindow) obj).end);
  }

  @Override public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override public String toString() {
    return "[" + WarehouseTimestamps.format(start) + ", " + WarehouseTimestamps.format(end) + ")";
  }
}

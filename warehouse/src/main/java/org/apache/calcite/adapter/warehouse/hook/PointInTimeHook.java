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
package org.apache.calcite.adapter.warehouse.hook;

import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import java.time.Instant;

/**
 * Primary or composite hook pinned to the instant a version became valid:
 * {@code <hook>~epoch__valid_from|<timestamp>}.
 */
public final class PointInTimeHook extends Hook {

  private final Hook base;
  private final Instant validFrom;
  private final String canonical;

  PointInTimeHook(Hook base, Instant validFrom) {
    this.base = base;
    this.validFrom = validFrom;
    this.canonical = base.canonical() + HookCodec.PIT_MARKER
        + WarehouseTimestamps.format(validFrom);
  }

  /** Returns the unpinned hook, either a {@link PrimaryHook} or a {@link CompositeHook}. */
  public Hook getBase() {
    return base;
  }

  public Instant getValidFrom() {
    return validFrom;
  }

  @Override public String canonical() {
    return canonical;
  }
}

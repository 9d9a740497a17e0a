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

import java.util.Locale;

/**
 * How the validity start of a version is derived.
 *
 * <p>Both conventions close a version at the next observation's
 * {@code loaded_at} and use the epoch for the first version of a key.
 */
public enum IntervalConvention {
  /**
   * A version is valid from the previous observation's {@code loaded_at}.
   * Adjacent versions overlap by one observation.
   */
  LAGGED,
  /**
   * A version is valid from its own {@code loaded_at}. Adjacent versions
   * partition time: each {@code valid_to} equals the next {@code valid_from}.
   */
  CONTIGUOUS;

  /**
   * Parses a convention name, case-insensitively.
   *
   * @param value Name, or null for the default
   * @return The convention, {@link #LAGGED} if value is null or empty
   */
  public static IntervalConvention fromString(String value) {
    if (value == null || value.trim().isEmpty()) {
      return LAGGED;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown interval convention: " + value, e);
    }
  }
}

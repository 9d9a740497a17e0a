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
package org.apache.calcite.adapter.warehouse.temporal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Timestamp constants and text conversions shared by the warehouse layers.
 *
 * <p>All instants are rendered in UTC with a fixed-width pattern
 * ({@value #PATTERN}), so the textual form sorts the same way as the
 * instants themselves. Hook strings depend on this exact rendering.
 */
public final class WarehouseTimestamps {

  /** Fixed-width text pattern used in hooks and diagnostics. */
  public static final String PATTERN = "uuuu-MM-dd HH:mm:ss.SSSSSS";

  /** Lower validity bound for the first version of a key. */
  public static final Instant EPOCH = Instant.EPOCH;

  /** Upper validity bound for the open-ended (current) version of a key. */
  public static final Instant FAR_FUTURE =
      LocalDateTime.of(9999, 12, 31, 23, 59, 59).toInstant(ZoneOffset.UTC);

  private static final DateTimeFormatter FORMATTER =
      DateTimeFormatter.ofPattern(PATTERN, Locale.ROOT)
          .withZone(ZoneOffset.UTC)
          .withResolverStyle(ResolverStyle.STRICT);

  private static final BigDecimal MICROS_PER_SECOND = BigDecimal.valueOf(1_000_000L);

  private WarehouseTimestamps() {
  }

  /**
   * Formats an instant at microsecond precision.
   *
   * @param instant Instant to format
   * @return Text such as {@code 2025-08-20 10:15:00.000000}
   */
  public static String format(Instant instant) {
    return FORMATTER.format(instant.truncatedTo(ChronoUnit.MICROS));
  }

  /**
   * Parses text produced by {@link #format(Instant)}.
   *
   * @param text Timestamp text
   * @return Parsed instant
   * @throws DateTimeParseException if the text does not match {@value #PATTERN}
   */
  public static Instant parse(String text) {
    return LocalDateTime.parse(text, FORMATTER).toInstant(ZoneOffset.UTC);
  }

  /**
   * Converts a loader id (seconds since the epoch, optionally fractional,
   * e.g. {@code "1724140800.123456"}) into an instant rounded to the
   * microsecond.
   *
   * @param loadId Load id text
   * @return Instant the load happened
   * @throws NumberFormatException if the id is not numeric
   */
  public static Instant fromLoadId(String loadId) {
    BigDecimal seconds = new BigDecimal(loadId.trim());
    long micros = seconds.multiply(MICROS_PER_SECOND)
        .setScale(0, RoundingMode.HALF_UP)
        .longValueExact();
    return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
  }

  /** Returns the later of two instants. */
  public static Instant max(Instant a, Instant b) {
    return a.isAfter(b) ? a : b;
  }

  /** Returns the earlier of two instants. */
  public static Instant min(Instant a, Instant b) {
    return a.isBefore(b) ? a : b;
  }
}

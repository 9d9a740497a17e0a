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
package org.apache.calcite.adapter.warehouse.fingerprint;

import com.google.common.collect.ImmutableList;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes the content hash of an observation's attributes.
 *
 * <p>The hash is SHA-256 over the attribute values in their configured order,
 * each rendered as text, separated by {@code |}. Null values are replaced by
 * {@link #NULL_TOKEN} so that a null and an empty string hash differently.
 *
 * <p>The hash is used purely as a change-equality test. Two different
 * attribute sets that collide are treated as unchanged; there is no detection
 * for that case.
 */
public class Fingerprinter {

  /** Stand-in for null attribute values. */
  public static final String NULL_TOKEN = "_surrogate_key_null_";

  private static final String SEPARATOR = "|";

  private final List<String> attributeColumns;

  /**
   * Creates a fingerprinter over a fixed, ordered attribute list.
   *
   * @param attributeColumns Columns that make up the fingerprint domain
   */
  public Fingerprinter(List<String> attributeColumns) {
    if (attributeColumns == null || attributeColumns.isEmpty()) {
      throw new IllegalArgumentException("At least one attribute column is required");
    }
    this.attributeColumns = ImmutableList.copyOf(attributeColumns);
  }

  /**
   * Returns the ordered columns hashed by this fingerprinter.
   */
  public List<String> getAttributeColumns() {
    return attributeColumns;
  }

  /**
   * Fingerprints a row using the configured attribute columns.
   * Columns missing from the row hash as null.
   *
   * @param row Row values by column name
   * @return Lowercase hex SHA-256 digest
   */
  public String fingerprint(Map<String, ?> row) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < attributeColumns.size(); i++) {
      if (i > 0) {
        sb.append(SEPARATOR);
      }
      sb.append(render(row.get(attributeColumns.get(i))));
    }
    return sha256(sb.toString());
  }

  /**
   * Fingerprints an explicit ordered list of (name, value) pairs.
   *
   * @param attributes Attribute pairs, in fingerprint order
   * @return Lowercase hex SHA-256 digest
   */
  public static String fingerprint(List<? extends Map.Entry<String, ?>> attributes) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < attributes.size(); i++) {
      if (i > 0) {
        sb.append(SEPARATOR);
      }
      sb.append(render(attributes.get(i).getValue()));
    }
    return sha256(sb.toString());
  }

  private static String render(@Nullable Object value) {
    return value == null ? NULL_TOKEN : value.toString();
  }

  private static String sha256(String text) {
    try {
      MessageDigest md = MessageDigest.getInstance("SHA-256");
      byte[] digest = md.digest(text.getBytes(StandardCharsets.UTF_8));
      StringBuilder sb = new StringBuilder(digest.length * 2);
      for (byte b : digest) {
        sb.append(String.format(Locale.ROOT, "%02x", b));
      }
      return sb.toString();
    } catch (NoSuchAlgorithmException e) {
      // Every JRE ships SHA-256
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}

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
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes and parses hook strings.
 *
 * <h3>Grammar</h3>
 * <pre>
 * primary   := namespace "." concept "." qualifier "|" value
 * composite := primary ("~" primary)+
 * pit       := (primary | composite) "~epoch__valid_from|" timestamp
 * </pre>
 *
 * <p>Namespace, concept and qualifier are non-empty and contain none of
 * {@code . | ~}. The value is non-empty and contains no {@code ~}. The
 * timestamp uses {@link WarehouseTimestamps#PATTERN}.
 *
 * <p>Every {@code compose*} method validates its input against the same
 * grammar its {@code parse*} counterpart accepts, so compose, parse and
 * compose again always yields the original string.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * String customer = HookCodec.composePrimary("northwind", "customer", "id", "ALFKI");
 * // northwind.customer.id|ALFKI
 * String line = HookCodec.composeComposite(
 *     Arrays.asList("northwind.order.id|10248", "northwind.product.id|11"));
 * // northwind.order.id|10248~northwind.product.id|11
 * }</pre>
 */
public final class HookCodec {

  static final String KEYSET_SEPARATOR = ".";
  static final String VALUE_SEPARATOR = "|";
  static final String COMPONENT_SEPARATOR = "~";
  static final String PIT_MARKER = "~epoch__valid_from|";

  private HookCodec() {
  }

  /**
   * Composes a primary hook.
   *
   * @return {@code namespace.concept.qualifier|value}
   * @throws MalformedHookException if any component violates the grammar
   */
  public static String composePrimary(String namespace, String concept, String qualifier,
      String value) {
    return primary(namespace, concept, qualifier, value).canonical();
  }

  /**
   * Composes a primary hook from a keyset ({@code namespace.concept.qualifier})
   * and a value.
   *
   * @throws MalformedHookException if the keyset or value violates the grammar
   */
  public static String composePrimary(String keyset, String value) {
    String[] parts = splitKeyset(keyset, keyset + VALUE_SEPARATOR + value);
    return composePrimary(parts[0], parts[1], parts[2], value);
  }

  /**
   * Joins primary hooks with {@code ~}, in exactly the order given.
   *
   * <p>The order is the caller's responsibility and must be the fixed component
   * order defined for the relationship type; no sorting is applied.
   *
   * @param primaryHooks At least two primary hook strings
   * @throws MalformedHookException if fewer than two components are given, or
   *     any component is not a primary hook
   */
  public static String composeComposite(List<String> primaryHooks) {
    if (primaryHooks == null || primaryHooks.size() < 2) {
      throw new MalformedHookException(String.valueOf(primaryHooks),
          "a composite hook needs at least two components");
    }
    List<PrimaryHook> components = new ArrayList<>(primaryHooks.size());
    for (String component : primaryHooks) {
      components.add(parsePrimary(component));
    }
    return new CompositeHook(components).canonical();
  }

  /**
   * Pins a primary or composite hook to an instant.
   *
   * @param hook Primary or composite hook string
   * @param instant Validity start; must not carry sub-microsecond precision,
   *     which the timestamp text cannot hold
   * @throws MalformedHookException if the hook is neither primary nor composite,
   *     or the instant is finer than a microsecond
   */
  public static String composePit(String hook, Instant instant) {
    Hook base = parseUnpinned(hook);
    if (instant.getNano() % 1_000 != 0) {
      throw new MalformedHookException(hook,
          "valid_from " + instant + " is finer than a microsecond");
    }
    return new PointInTimeHook(base, instant).canonical();
  }

  /**
   * Parses a primary hook.
   *
   * @throws MalformedHookException if the text is not a primary hook
   */
  public static PrimaryHook parsePrimary(String text) {
    if (text == null) {
      throw new MalformedHookException("null", "hook is null");
    }
    int pipe = text.indexOf(VALUE_SEPARATOR);
    if (pipe < 0) {
      throw new MalformedHookException(text, "missing '|' between keyset and value");
    }
    String[] keyset = splitKeyset(text.substring(0, pipe), text);
    return primary(keyset[0], keyset[1], keyset[2], text.substring(pipe + 1), text);
  }

  /**
   * Parses a composite hook.
   *
   * @throws MalformedHookException if the text is not a composite hook
   */
  public static CompositeHook parseComposite(String text) {
    if (text == null) {
      throw new MalformedHookException("null", "hook is null");
    }
    String[] parts = text.split(COMPONENT_SEPARATOR, -1);
    if (parts.length < 2) {
      throw new MalformedHookException(text, "a composite hook needs at least two components");
    }
    List<PrimaryHook> components = new ArrayList<>(parts.length);
    for (String part : parts) {
      components.add(parsePrimary(part));
    }
    return new CompositeHook(components);
  }

  /**
   * Parses a point-in-time hook.
   *
   * @throws MalformedHookException if the text is not a point-in-time hook
   */
  public static PointInTimeHook parsePit(String text) {
    if (text == null) {
      throw new MalformedHookException("null", "hook is null");
    }
    int marker = text.lastIndexOf(PIT_MARKER);
    if (marker < 0) {
      throw new MalformedHookException(text, "missing '" + PIT_MARKER + "' suffix");
    }
    Hook base = parseUnpinned(text.substring(0, marker));
    String timestamp = text.substring(marker + PIT_MARKER.length());
    Instant validFrom;
    try {
      validFrom = WarehouseTimestamps.parse(timestamp);
    } catch (DateTimeParseException e) {
      throw new MalformedHookException(text, "invalid timestamp '" + timestamp + "'");
    }
    return new PointInTimeHook(base, validFrom);
  }

  /**
   * Parses any hook variant.
   *
   * @throws MalformedHookException if the text matches no variant
   */
  public static Hook parse(String text) {
    if (text != null && text.contains(PIT_MARKER)) {
      return parsePit(text);
    }
    return parseUnpinned(text);
  }

  private static Hook parseUnpinned(String text) {
    if (text != null && text.contains(COMPONENT_SEPARATOR)) {
      return parseComposite(text);
    }
    return parsePrimary(text);
  }

  private static String[] splitKeyset(String keyset, String hook) {
    if (keyset == null) {
      throw new MalformedHookException(hook, "keyset is null");
    }
    String[] parts = keyset.split("\\.", -1);
    if (parts.length != 3) {
      throw new MalformedHookException(hook,
          "keyset '" + keyset + "' must be namespace.concept.qualifier");
    }
    return parts;
  }

  private static PrimaryHook primary(String namespace, String concept, String qualifier,
      String value) {
    String text = namespace + KEYSET_SEPARATOR + concept + KEYSET_SEPARATOR + qualifier
        + VALUE_SEPARATOR + value;
    return primary(namespace, concept, qualifier, value, text);
  }

  private static PrimaryHook primary(String namespace, String concept, String qualifier,
      String value, String text) {
    checkKeysetPart("namespace", namespace, text);
    checkKeysetPart("concept", concept, text);
    checkKeysetPart("qualifier", qualifier, text);
    if (value == null || value.isEmpty()) {
      throw new MalformedHookException(text, "value is empty");
    }
    if (value.contains(COMPONENT_SEPARATOR)) {
      throw new MalformedHookException(text, "value contains '~'");
    }
    return new PrimaryHook(namespace, concept, qualifier, value);
  }

  private static void checkKeysetPart(String name, String part, String text) {
    if (part == null || part.isEmpty()) {
      throw new MalformedHookException(text, name + " is empty");
    }
    if (part.contains(KEYSET_SEPARATOR) || part.contains(VALUE_SEPARATOR)
        || part.contains(COMPONENT_SEPARATOR)) {
      throw new MalformedHookException(text, name + " '" + part + "' contains a reserved character");
    }
  }
}

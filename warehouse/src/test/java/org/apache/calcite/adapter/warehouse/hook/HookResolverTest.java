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

import org.apache.calcite.adapter.warehouse.scd.VersionedRecord;
import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link HookResolver}.
 */
@Tag("unit")
public class HookResolverTest {

  private static final Instant T1 = Instant.parse("2025-01-01T00:00:00Z");

  private static HookDefinition hook(String name, String keyset, String expression,
      boolean primary) {
    return HookDefinition.builder()
        .name(name)
        .keyset(keyset)
        .expression(expression)
        .primary(primary)
        .build();
  }

  private static VersionedRecord record(String key, Map<String, Object> payload) {
    return new VersionedRecord(key, T1, "h-" + key, payload, WarehouseTimestamps.EPOCH,
        WarehouseTimestamps.FAR_FUTURE, T1, 1, true);
  }

  private static Map<String, Object> orderLine(Object orderId, Object productId) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("order_id", orderId);
    payload.put("product_id", productId);
    payload.put("quantity", 12);
    return payload;
  }

  private static HookResolver orderLineResolver() {
    return new HookResolver("northwind__order_details",
        Arrays.asList(
            hook("_hook__order__id", "northwind.order.id", "order_id", false),
            hook("_hook__product__id", "northwind.product.id", "product_id", false)),
        Collections.singletonList(
            CompositeHookDefinition.of("_hook__order__product",
                Arrays.asList("_hook__order__id", "_hook__product__id"), true)));
  }

  @Test void testPrimaryAndPitHooks() {
    HookResolver resolver = new HookResolver("northwind__customers",
        Collections.singletonList(
            hook("_hook__customer__id", "northwind.customer.id", "customer_id", true)),
        Collections.<CompositeHookDefinition>emptyList());
    Map<String, Object> payload = new HashMap<>();
    payload.put("customer_id", "ALFKI");

    HookResolution resolution =
        resolver.resolve(Collections.singletonList(record("ALFKI", payload)));

    assertEquals(0, resolution.getQuarantineCount());
    HookedRecord hooked = resolution.getRecords().get(0);
    assertEquals("_pit_hook__customer__id", hooked.getPitHook());
    assertEquals("northwind.customer.id|ALFKI", hooked.getHook("_hook__customer__id"));
    assertEquals("northwind.customer.id|ALFKI~epoch__valid_from|1970-01-01 00:00:00.000000",
        hooked.getHook("_pit_hook__customer__id"));
    assertEquals(Arrays.asList("_pit_hook__customer__id", "_hook__customer__id"),
        new ArrayList<>(hooked.getHooks().keySet()));
  }

  @Test void testPrimaryCompositeTakesPrecedence() {
    HookResolver resolver = orderLineResolver();
    assertEquals("_hook__order__product", resolver.getPrimaryHook());

    HookedRecord hooked = resolver.resolve(
        Collections.singletonList(record("10248|11", orderLine(10248, 11))))
        .getRecords().get(0);

    assertEquals("northwind.order.id|10248~northwind.product.id|11",
        hooked.getHook("_hook__order__product"));
    assertEquals("northwind.order.id|10248~northwind.product.id|11"
            + "~epoch__valid_from|1970-01-01 00:00:00.000000",
        hooked.getHook("_pit_hook__order__product"));
  }

  @Test void testMissingComponentIsQuarantined() {
    List<VersionedRecord> records = Arrays.asList(
        record("10248|11", orderLine(10248, 11)),
        record("10249|", orderLine(10249, null)),
        record("10250|  ", orderLine(10250, "  ")));

    HookResolution resolution = orderLineResolver().resolve(records);

    assertEquals(1, resolution.getRecords().size());
    assertEquals(2, resolution.getQuarantineCount());
    HookResolution.Quarantined quarantined = resolution.getQuarantined().get(0);
    assertEquals("_hook__product__id", quarantined.getHook());
    assertEquals(HookResolution.Quarantined.Reason.MISSING_HOOK_COMPONENT,
        quarantined.getReason());
    assertEquals("10249|", quarantined.getRecord().getUniqueKey());
  }

  @Test void testMalformedValueIsQuarantined() {
    HookResolution resolution = orderLineResolver().resolve(
        Collections.singletonList(record("1~2|11", orderLine("1~2", 11))));

    assertTrue(resolution.getRecords().isEmpty());
    assertEquals(HookResolution.Quarantined.Reason.MALFORMED_HOOK,
        resolution.getQuarantined().get(0).getReason());
  }

  @Test void testMissingPrimaryHookIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new HookResolver("orders",
            Collections.singletonList(
                hook("_hook__order__id", "northwind.order.id", "order_id", false)),
            Collections.<CompositeHookDefinition>emptyList()));
  }

  @Test void testTwoPrimaryHooksAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new HookResolver("orders",
            Arrays.asList(
                hook("_hook__order__id", "northwind.order.id", "order_id", true),
                hook("_hook__customer__id", "northwind.customer.id", "customer_id", true)),
            Collections.<CompositeHookDefinition>emptyList()));
  }

  @Test void testUnknownCompositeComponentIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new HookResolver("order_details",
            Collections.singletonList(
                hook("_hook__order__id", "northwind.order.id", "order_id", true)),
            Collections.singletonList(
                CompositeHookDefinition.of("_hook__order__product",
                    Arrays.asList("_hook__order__id", "_hook__product__id"), false))));
  }

  @Test void testInvalidKeysetIsRejected() {
    assertThrows(MalformedHookException.class,
        () -> hook("_hook__order__id", "northwind.order", "order_id", true));
  }
}

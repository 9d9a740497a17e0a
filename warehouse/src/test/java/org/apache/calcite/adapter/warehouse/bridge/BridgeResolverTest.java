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
package org.apache.calcite.adapter.warehouse.bridge;

import org.apache.calcite.adapter.warehouse.hook.HookedRecord;
import org.apache.calcite.adapter.warehouse.scd.VersionedRecord;
import org.apache.calcite.adapter.warehouse.temporal.WarehouseTimestamps;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link BridgeResolver}.
 */
@Tag("unit")
public class BridgeResolverTest {

  private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");
  private static final Instant T1 = Instant.parse("2025-02-01T00:00:00Z");
  private static final Instant T2 = Instant.parse("2025-03-01T00:00:00Z");
  private static final Instant T3 = Instant.parse("2025-04-01T00:00:00Z");
  private static final Instant FAR = WarehouseTimestamps.FAR_FUTURE;

  private static final String CUSTOMER_HOOK = "_hook__customer__id";
  private static final String ALFKI = "northwind.customer.id|ALFKI";

  private static BridgeRow row(String peripheral, Map<String, String> hooks, String column,
      Object value, Instant from, Instant to, boolean current) {
    return new BridgeRow(peripheral, hooks,
        Collections.singletonMap(BridgeRow.suffixed(column, peripheral), value),
        from, to, current ? from : to, current);
  }

  private static Map<String, String> hooks(String... pairs) {
    Map<String, String> hooks = new LinkedHashMap<>();
    for (int i = 0; i < pairs.length; i += 2) {
      hooks.put(pairs[i], pairs[i + 1]);
    }
    return hooks;
  }

  private static BridgeRow customer(Instant from, Instant to, boolean current) {
    return row("customers", hooks(CUSTOMER_HOOK, ALFKI), "company_name", "Alfreds", from, to,
        current);
  }

  private static BridgeRow order(String customerHook, Instant from, Instant to,
      boolean current) {
    return row("orders",
        hooks("_hook__order__id", "northwind.order.id|10248", CUSTOMER_HOOK, customerHook),
        "freight", "32.38", from, to, current);
  }

  @Test void testCustomerOrderScenario() {
    List<BridgeRow> joined = new BridgeResolver().join(
        Collections.singletonList(order(ALFKI, T1, T2, false)),
        Collections.singletonList(customer(T0, FAR, true)),
        CUSTOMER_HOOK);

    assertEquals(1, joined.size());
    BridgeRow row = joined.get(0);
    assertEquals(T1, row.getValidFrom());
    assertEquals(T2, row.getValidTo());
    assertFalse(row.isCurrent());
    assertEquals(T2, row.getUpdatedAt());
    assertEquals("orders", row.getPeripheral());
    assertEquals("Alfreds", row.getAttributes().get("company_name__customers"));
    assertEquals("32.38", row.getAttributes().get("freight__orders"));
    assertEquals("northwind.order.id|10248", row.getHook("_hook__order__id"));
  }

  @Test void testNonOverlappingPairsProduceNothing() {
    BridgeResolver resolver = new BridgeResolver();
    // Touching intervals share no instant
    assertTrue(resolver.join(
        Collections.singletonList(order(ALFKI, T2, T3, false)),
        Collections.singletonList(customer(T0, T2, false)),
        CUSTOMER_HOOK).isEmpty());
  }

  @Test void testDifferentHookValuesDoNotJoin() {
    assertTrue(new BridgeResolver().join(
        Collections.singletonList(order("northwind.customer.id|ANATR", T1, T2, false)),
        Collections.singletonList(customer(T0, FAR, true)),
        CUSTOMER_HOOK).isEmpty());
  }

  @Test void testEachOverlappingVersionJoins() {
    List<BridgeRow> joined = new BridgeResolver().join(
        Collections.singletonList(order(ALFKI, T1, FAR, true)),
        Arrays.asList(customer(T0, T2, false), customer(T2, FAR, true)),
        CUSTOMER_HOOK);

    assertEquals(2, joined.size());
    assertEquals(T1, joined.get(0).getValidFrom());
    assertEquals(T2, joined.get(0).getValidTo());
    assertFalse(joined.get(0).isCurrent());
    assertEquals(T2, joined.get(1).getValidFrom());
    assertEquals(FAR, joined.get(1).getValidTo());
    assertTrue(joined.get(1).isCurrent());
  }

  @Test void testMalformedHookSkipsOnlyThatRow() {
    BridgeResolver resolver = new BridgeResolver();
    List<BridgeRow> joined = resolver.join(
        Arrays.asList(order("not a hook", T1, T2, false), order(ALFKI, T1, T2, false)),
        Collections.singletonList(customer(T0, FAR, true)),
        CUSTOMER_HOOK);

    assertEquals(1, joined.size());
    assertEquals(Collections.singletonList("not a hook"), resolver.getMalformedHooks());
  }

  @Test void testLeftJoinKeepsUnmatchedRows() {
    List<BridgeRow> joined = new BridgeResolver().leftJoin(
        Collections.singletonList(order("northwind.customer.id|ANATR", T1, T2, false)),
        Collections.singletonList(customer(T0, FAR, true)),
        CUSTOMER_HOOK);

    assertEquals(1, joined.size());
    assertFalse(joined.get(0).getAttributes().containsKey("company_name__customers"));
  }

  @Test void testLeftJoinDropsRowsWithMalformedHook() {
    BridgeResolver resolver = new BridgeResolver();
    List<BridgeRow> joined = resolver.leftJoin(
        Arrays.asList(order("not a hook", T1, T2, false),
            order("northwind.customer.id|ANATR", T1, T2, false)),
        Collections.singletonList(customer(T0, FAR, true)),
        CUSTOMER_HOOK);

    assertEquals(1, joined.size());
    assertEquals("northwind.customer.id|ANATR", joined.get(0).getHook(CUSTOMER_HOOK));
    assertEquals(Collections.singletonList("not a hook"), resolver.getMalformedHooks());
  }

  @Test void testJoinOrderDoesNotChangeValidity() {
    String productHook = "_hook__product__id";
    BridgeRow line = row("order_details",
        hooks("_hook__order__id", "northwind.order.id|10248", productHook,
            "northwind.product.id|11"),
        "quantity", 12, T0, FAR, true);
    BridgeRow orderRow = order(ALFKI, T1, T3, false);
    BridgeRow product = row("products", hooks(productHook, "northwind.product.id|11"),
        "product_name", "Queso", T2, FAR, true);
    BridgeResolver resolver = new BridgeResolver();

    List<BridgeRow> leftFirst = resolver.join(
        resolver.join(Collections.singletonList(line), Collections.singletonList(orderRow),
            "_hook__order__id"),
        Collections.singletonList(product), productHook);
    List<BridgeRow> productFirst = resolver.join(
        resolver.join(Collections.singletonList(line), Collections.singletonList(product),
            productHook),
        Collections.singletonList(orderRow), "_hook__order__id");
    List<BridgeRow> chained = resolver.joinAll(
        Arrays.asList(Collections.singletonList(line), Collections.singletonList(orderRow),
            Collections.singletonList(product)),
        Arrays.asList("_hook__order__id", productHook));

    assertEquals(1, leftFirst.size());
    assertEquals(T2, leftFirst.get(0).getValidFrom());
    assertEquals(T3, leftFirst.get(0).getValidTo());
    assertEquals(leftFirst, chained);
    assertEquals(1, productFirst.size());
    assertEquals(leftFirst.get(0).getValidFrom(), productFirst.get(0).getValidFrom());
    assertEquals(leftFirst.get(0).getValidTo(), productFirst.get(0).getValidTo());
    assertEquals(leftFirst.get(0).isCurrent(), productFirst.get(0).isCurrent());
  }

  @Test void testResolveFollowsForeignHooks() {
    Map<String, Map<String, String>> foreign = new HashMap<>();
    foreign.put("orders", Collections.singletonMap(CUSTOMER_HOOK, "customers"));
    BridgeResolver resolver = new BridgeResolver(foreign);

    Map<String, List<HookedRecord>> hooked = new HashMap<>();
    hooked.put("customers", Collections.singletonList(
        hookedRecord("ALFKI", T0, FAR, true,
            hooks(CUSTOMER_HOOK, ALFKI), CUSTOMER_HOOK)));
    hooked.put("orders", Collections.singletonList(
        hookedRecord("10248", T1, FAR, true,
            hooks("_hook__order__id", "northwind.order.id|10248", CUSTOMER_HOOK, ALFKI),
            "_hook__order__id")));

    List<BridgeRow> bridge = resolver.resolve("orders", hooked);

    assertEquals(1, bridge.size());
    assertEquals("orders", bridge.get(0).getPeripheral());
    assertEquals(T1, bridge.get(0).getValidFrom());
    assertTrue(bridge.get(0).isCurrent());
    assertEquals("ALFKI", bridge.get(0).getAttributes().get("name__customers"));
    assertEquals(1, resolver.resolve("customers", hooked).size());
  }

  @Test void testResolveFollowsCompositeForeignHook() {
    String lineHook = "_hook__order__product";
    String line = "northwind.order.id|10248~northwind.product.id|11";
    Map<String, Map<String, String>> foreign = new HashMap<>();
    foreign.put("shipments", Collections.singletonMap(lineHook, "order_details"));
    BridgeResolver resolver = new BridgeResolver(foreign);

    Map<String, List<HookedRecord>> hooked = new HashMap<>();
    hooked.put("order_details", Collections.singletonList(
        hookedRecord("10248|11", T0, FAR, true, hooks(lineHook, line), lineHook)));
    hooked.put("shipments", Collections.singletonList(
        hookedRecord("S1", T1, FAR, true,
            hooks("_hook__shipment__id", "northwind.shipment.id|S1", lineHook, line),
            "_hook__shipment__id")));

    List<BridgeRow> bridge = resolver.resolve("shipments", hooked);

    assertEquals(1, bridge.size());
    assertEquals("10248|11", bridge.get(0).getAttributes().get("name__order_details"));
    assertEquals(T1, bridge.get(0).getValidFrom());
  }

  @Test void testResolveDetectsCycles() {
    Map<String, Map<String, String>> foreign = new HashMap<>();
    foreign.put("a", Collections.singletonMap("_hook__b", "b"));
    foreign.put("b", Collections.singletonMap("_hook__a", "a"));

    assertThrows(IllegalStateException.class,
        () -> new BridgeResolver(foreign).resolve("a",
            Collections.<String, List<HookedRecord>>emptyMap()));
  }

  private static HookedRecord hookedRecord(String key, Instant from, Instant to,
      boolean current, Map<String, String> hooks, String primaryHook) {
    VersionedRecord record = new VersionedRecord(key, from, "hash-" + key,
        Collections.singletonMap("name", key), from, to, current ? from : to, 1, current);
    return new HookedRecord(record, hooks, primaryHook, "_pit" + primaryHook);
  }
}

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
package org.apache.calcite.adapter.warehouse.schema;

import org.apache.calcite.adapter.warehouse.config.WarehouseConfig;
import org.apache.calcite.adapter.warehouse.config.WarehouseConfigLoader;
import org.apache.calcite.adapter.warehouse.run.WarehouseRunner;
import org.apache.calcite.adapter.warehouse.scd.TimeWindow;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link WarehouseSchema} through the Calcite JDBC driver.
 */
@Tag("unit")
public class WarehouseSchemaTest {

  private static final long T1 = 1724140800L;
  private static final long DAY = 86400L;

  private WarehouseConfig config;
  private WarehouseRunner runner;
  private Connection calciteConn;

  @BeforeEach
  public void setUp() throws Exception {
    config = WarehouseConfigLoader.loadResource("/northwind-warehouse.yaml");
    runner = new WarehouseRunner(config);
    runner.ingest("northwind__customers",
        Collections.singletonList(customer(T1, "Berlin")));
    runner.ingest("northwind__orders", Collections.singletonList(
        row(T1, "order_id", 10248, "customer_id", "ALFKI", "order_date", "2024-08-19",
            "freight", 32.38)));
    runner.run(TimeWindow.of(Instant.ofEpochSecond(T1), Instant.ofEpochSecond(T1 + DAY)));
    runner.ingest("northwind__customers",
        Collections.singletonList(customer(T1 + DAY, "Hamburg")));
    runner.run(
        TimeWindow.of(Instant.ofEpochSecond(T1 + DAY), Instant.ofEpochSecond(T1 + 2 * DAY)));

    calciteConn = DriverManager.getConnection("jdbc:calcite:");
    CalciteConnection calciteConnection = calciteConn.unwrap(CalciteConnection.class);
    SchemaPlus rootSchema = calciteConnection.getRootSchema();
    rootSchema.add("northwind", new WarehouseSchema(runner));
  }

  @AfterEach
  public void tearDown() throws Exception {
    if (calciteConn != null) {
      calciteConn.close();
    }
  }

  private static Map<String, Object> row(long loadId, Object... keyValues) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      row.put((String) keyValues[i], keyValues[i + 1]);
    }
    row.put("_dlt_load_id", String.valueOf(loadId));
    return row;
  }

  private static Map<String, Object> customer(long loadId, String city) {
    return row(loadId, "customer_id", "ALFKI", "company_name", "Alfreds Futterkiste",
        "city", city, "registered_at", "2024-01-15");
  }

  private List<String> query(String sql) throws Exception {
    List<String> results = new ArrayList<>();
    try (Statement stmt = calciteConn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      int columns = rs.getMetaData().getColumnCount();
      while (rs.next()) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= columns; i++) {
          if (i > 1) {
            sb.append(',');
          }
          sb.append(rs.getString(i));
        }
        results.add(sb.toString());
      }
    }
    return results;
  }

  @Test void testVersionTable() throws Exception {
    List<String> rows = query("SELECT \"_unique_key\", \"city\", \"_version\", \"_is_current\""
        + " FROM \"northwind\".\"northwind__customers\" ORDER BY \"_loaded_at\"");

    assertEquals(Arrays.asList("ALFKI,Berlin,2,false", "ALFKI,Hamburg,1,true"), rows);
  }

  @Test void testVersionTableNumbersFullHistory() throws Exception {
    runner.ingest("northwind__customers",
        Collections.singletonList(customer(T1 + 2 * DAY, "Paris")));
    runner.run(
        TimeWindow.of(Instant.ofEpochSecond(T1 + 2 * DAY), Instant.ofEpochSecond(T1 + 3 * DAY)));

    List<String> rows = query("SELECT \"city\", \"_version\", \"_is_current\""
        + " FROM \"northwind\".\"northwind__customers\" ORDER BY \"_loaded_at\"");

    assertEquals(
        Arrays.asList("Berlin,3,false", "Hamburg,2,false", "Paris,1,true"), rows);
  }

  @Test void testCurrentVersionFilter() throws Exception {
    List<String> rows = query("SELECT \"city\" FROM \"northwind\".\"northwind__customers\""
        + " WHERE \"_is_current\" AND \"_valid_to\" > \"_valid_from\"");

    assertEquals(Collections.singletonList("Hamburg"), rows);
  }

  @Test void testBridgeTable() throws Exception {
    List<String> rows = query("SELECT \"_hook__order__id\", \"city__northwind__customers\","
        + " \"_is_current\" FROM \"northwind\".\"_bridge__northwind__orders\""
        + " ORDER BY \"_valid_from\"");

    assertEquals(
        Arrays.asList("northwind.order.id|10248,Berlin,false",
            "northwind.order.id|10248,Hamburg,true"),
        rows);
  }

  @Test void testEventTables() throws Exception {
    List<String> orders = query("SELECT \"event\", \"event_occurred_on\""
        + " FROM \"northwind\".\"_event_bridge__northwind__orders\"");
    assertEquals(Arrays.asList("order_placed,2024-08-19", "order_placed,2024-08-19"), orders);

    List<String> counts = query("SELECT \"peripheral\", COUNT(*)"
        + " FROM \"northwind\".\"_bridge__as_of\" GROUP BY \"peripheral\""
        + " ORDER BY \"peripheral\"");
    assertEquals(Arrays.asList("northwind__customers,2", "northwind__orders,2"), counts);

    List<String> pits = query("SELECT COUNT(\"_pit_hook__customer__id\")"
        + " FROM \"northwind\".\"_event_bridge__northwind__orders\"");
    assertEquals(Collections.singletonList("2"), pits);
  }

  @Test void testTableNames() {
    WarehouseSchema schema = new WarehouseSchema(new WarehouseRunner(config));

    assertTrue(schema.getTableMap().containsKey("northwind__order_details"));
    assertTrue(schema.getTableMap().containsKey("_bridge__northwind__order_details"));
    assertTrue(schema.getTableMap().containsKey("_event_bridge__northwind__products"));
    assertTrue(schema.getTableMap().containsKey(WarehouseSchema.AS_OF_TABLE));
    assertEquals(4 * 3 + 1, schema.getTableMap().size());
  }

  @Test void testBridgeColumnsFollowForeignHooks() {
    List<String> hooks = new ArrayList<>();
    List<String> attributes = new ArrayList<>();
    WarehouseSchema.bridgeColumns(config, "northwind__order_details", hooks, attributes);

    assertEquals(Arrays.asList("_pit_hook__order__product", "_hook__order__id",
        "_hook__product__id", "_hook__order__product", "_pit_hook__order__id",
        "_hook__customer__id", "_pit_hook__customer__id", "_pit_hook__product__id"), hooks);
    assertTrue(attributes.contains("quantity__northwind__order_details"));
    assertTrue(attributes.contains("company_name__northwind__customers"));
    assertTrue(attributes.contains("product_name__northwind__products"));
    assertFalse(attributes.contains("_dlt_id__northwind__customers"));
  }
}

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
package org.apache.calcite.adapter.warehouse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Reads a {@link WarehouseConfig} from YAML.
 *
 * <p>JSON is a subset of YAML, so JSON documents load as well.
 */
public final class WarehouseConfigLoader {

  private static final Logger LOGGER = LoggerFactory.getLogger(WarehouseConfigLoader.class);
  private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

  private WarehouseConfigLoader() {
  }

  /**
   * Loads a configuration from a stream. The stream is not closed.
   *
   * @throws IOException if the document cannot be read or is not a mapping
   * @throws IllegalArgumentException if the configuration is invalid
   */
  public static WarehouseConfig load(InputStream in) throws IOException {
    Object document = YAML_MAPPER.readValue(in, Object.class);
    if (!(document instanceof Map)) {
      throw new IOException("Warehouse configuration must be a YAML mapping");
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> map = (Map<String, Object>) document;
    WarehouseConfig config = WarehouseConfig.fromMap(map);
    LOGGER.info("Loaded warehouse '{}' with {} entities", config.getName(),
        config.getEntities().size());
    return config;
  }

  /**
   * Loads a configuration from a file.
   */
  public static WarehouseConfig load(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return load(in);
    }
  }

  /**
   * Loads a configuration from a classpath resource.
   *
   * @param resourcePath Absolute resource path, e.g. {@code /northwind-warehouse.yaml}
   */
  public static WarehouseConfig loadResource(String resourcePath) throws IOException {
    InputStream in = WarehouseConfigLoader.class.getResourceAsStream(resourcePath);
    if (in == null) {
      throw new IOException("Resource not found: " + resourcePath);
    }
    try {
      return load(in);
    } finally {
      in.close();
    }
  }
}

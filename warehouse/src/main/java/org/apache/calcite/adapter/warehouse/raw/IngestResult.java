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
package org.apache.calcite.adapter.warehouse.raw;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of ingesting one batch of landing rows.
 *
 * <p>{@code received = appended + duplicates + rejected}.
 *
 * @see RawIngestor
 */
public class IngestResult {

  private final String entity;
  private final int received;
  private final int appended;
  private final int duplicates;
  private final int rejected;
  private final List<String> errors;

  private IngestResult(Builder builder) {
    this.entity = builder.entity;
    this.received = builder.received;
    this.appended = builder.appended;
    this.duplicates = builder.duplicates;
    this.rejected = builder.errors.size();
    this.errors = Collections.unmodifiableList(new ArrayList<>(builder.errors));
  }

  public String getEntity() {
    return entity;
  }

  /** Returns the number of landing rows in the batch. */
  public int getReceived() {
    return received;
  }

  /** Returns the number of new observations stored. */
  public int getAppended() {
    return appended;
  }

  /** Returns the number of rows dropped because their hash was already known. */
  public int getDuplicates() {
    return duplicates;
  }

  /** Returns the number of rows without a usable key or load id. */
  public int getRejected() {
    return rejected;
  }

  /** Returns one message per rejected row. */
  public List<String> getErrors() {
    return errors;
  }

  @Override public String toString() {
    return "IngestResult{entity='" + entity + "', received=" + received
        + ", appended=" + appended + ", duplicates=" + duplicates
        + ", rejected=" + rejected + "}";
  }

  static Builder builder(String entity) {
    return new Builder(entity);
  }

  /**
   * Builder for IngestResult.
   */
  static class Builder {
    private final String entity;
    private int received;
    private int appended;
    private int duplicates;
    private final List<String> errors = new ArrayList<>();

    Builder(String entity) {
      this.entity = entity;
    }

    Builder received(int received) {
      this.received = received;
      return this;
    }

    Builder appended() {
      appended++;
      return this;
    }

    Builder duplicate() {
      duplicates++;
      return this;
    }

    Builder rejected(String error) {
      errors.add(error);
      return this;
    }

    IngestResult build() {
      return new IngestResult(this);
    }
  }
}

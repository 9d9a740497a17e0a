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

/**
 * Hook referencing a single entity instance:
 * {@code namespace.concept.qualifier|value}.
 *
 * <p>For example {@code northwind.customer.id|ALFKI}.
 */
public final class PrimaryHook extends Hook {

  private final String namespace;
  private final String concept;
  private final String qualifier;
  private final String value;
  private final String canonical;

  PrimaryHook(String namespace, String concept, String qualifier, String value) {
    this.namespace = namespace;
    this.concept = concept;
    this.qualifier = qualifier;
    this.value = value;
    this.canonical = namespace + HookCodec.KEYSET_SEPARATOR + concept
        + HookCodec.KEYSET_SEPARATOR + qualifier + HookCodec.VALUE_SEPARATOR + value;
  }

  public String getNamespace() {
    return namespace;
  }

  public String getConcept() {
    return concept;
  }

  public String getQualifier() {
    return qualifier;
  }

  public String getValue() {
    return value;
  }

  /** Returns the keyset part, {@code namespace.concept.qualifier}. */
  public String getKeyset() {
    return canonical.substring(0, canonical.indexOf(HookCodec.VALUE_SEPARATOR));
  }

  @Override public String canonical() {
    return canonical;
  }
}

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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Hook referencing a relationship: primary hooks joined with {@code ~} in the
 * component order configured for the relationship type.
 */
public final class CompositeHook extends Hook {

  private final List<PrimaryHook> components;
  private final String canonical;

  CompositeHook(List<PrimaryHook> components) {
    this.components = ImmutableList.copyOf(components);
    StringBuilder sb = new StringBuilder();
    for (PrimaryHook component : this.components) {
      if (sb.length() > 0) {
        sb.append(HookCodec.COMPONENT_SEPARATOR);
      }
      sb.append(component.canonical());
    }
    this.canonical = sb.toString();
  }

  /** Returns the primary hooks in their defined order. */
  public List<PrimaryHook> getComponents() {
    return components;
  }

  @Override public String canonical() {
    return canonical;
  }
}

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
 * Immutable, content-derived identifier of an entity instance or of a
 * relationship between entity instances.
 *
 * <p>The canonical string is the only identity: two hooks are equal iff their
 * canonical strings are equal, byte for byte.
 *
 * @see PrimaryHook
 * @see CompositeHook
 * @see PointInTimeHook
 * @see HookCodec
 */
public abstract class Hook {

  /** Returns the canonical text of this hook. */
  public abstract String canonical();

  @Override public boolean equals(Object obj) {
    return this == obj
        || obj instanceof Hook && canonical().equals(((Hook) obj).canonical());
  }

  @Override public int hashCode() {
    return canonical().hashCode();
  }

  @Override public String toString() {
    return canonical();
  }
}

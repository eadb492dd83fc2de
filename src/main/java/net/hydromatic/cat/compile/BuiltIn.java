/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cat.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.cat.type.Kind;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Built-in functions. */
public enum BuiltIn {
  /** Function "domain", of kind "relation &rarr; set"; the events that have
   * at least one successor. */
  DOMAIN("domain", Kind.SET),

  /** Function "range", of kind "relation &rarr; set"; the events that have
   * at least one predecessor. */
  RANGE("range", Kind.SET);

  /** Name as it appears in cat source. */
  public final String mlName;
  /** Kind of the result. */
  public final Kind kind;

  private static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : values()) {
      b.put(builtIn.mlName, builtIn);
    }
    BY_NAME = b.build();
  }

  BuiltIn(String mlName, Kind kind) {
    this.mlName = requireNonNull(mlName);
    this.kind = requireNonNull(kind);
  }

  /** Returns the built-in with a given name, or null. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name);
  }
}

// End BuiltIn.java

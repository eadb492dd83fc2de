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
package net.hydromatic.cat.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.Set;

/** An event in a candidate execution, such as a read, a write or a fence. */
public final class Event {
  public final String name;
  /** Position of this event in its {@link EventUniverse}. */
  public final int ordinal;
  /** Names of the classes this event belongs to, for example "R" or "W". */
  public final Set<String> classes;

  Event(String name, int ordinal, Iterable<String> classes) {
    this.name = requireNonNull(name);
    this.ordinal = ordinal;
    this.classes = ImmutableSet.copyOf(classes);
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Event.java

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

import net.hydromatic.cat.type.Kind;

/**
 * Value of a cat expression: an {@link EventSet} or a {@link Relation} over
 * an {@link EventUniverse}.
 *
 * <p>Values are immutable. Two values are equal if they have the same kind
 * and the same members.
 */
public abstract class Value {
  public final EventUniverse universe;

  Value(EventUniverse universe) {
    this.universe = requireNonNull(universe);
  }

  /** Returns {@link Kind#SET} or {@link Kind#RELATION}. */
  public abstract Kind kind();

  /** Returns whether this value has no members. */
  public abstract boolean isEmpty();

  /** Returns the number of members: events for a set, pairs for a
   * relation. */
  public abstract int size();

  /** Returns the complement of this value with respect to the universe. */
  public abstract Value complement();

  /** Returns the union of this and a value of the same kind. */
  public abstract Value union(Value value);

  /** Returns the intersection of this and a value of the same kind. */
  public abstract Value intersect(Value value);

  /** Returns the members of this that are not in a value of the same
   * kind. */
  public abstract Value minus(Value value);

  /** Returns the empty value of a given kind. */
  public static Value empty(EventUniverse universe, Kind kind) {
    switch (kind) {
      case SET:
        return EventSet.empty(universe);
      case RELATION:
        return Relation.empty(universe);
      default:
        throw new IllegalArgumentException("no empty value of kind " + kind);
    }
  }
}

// End Value.java

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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.List;
import net.hydromatic.cat.type.Kind;

/** A set of events. */
public final class EventSet extends Value {
  /** Members; never modified after construction. */
  final BitSet bits;

  /** Creates a set; takes ownership of {@code bits}. */
  EventSet(EventUniverse universe, BitSet bits) {
    super(universe);
    this.bits = requireNonNull(bits);
  }

  /** Returns the empty set. */
  public static EventSet empty(EventUniverse universe) {
    return new EventSet(universe, new BitSet());
  }

  /** Creates a set of the named events. */
  public static EventSet of(EventUniverse universe, String... names) {
    final BitSet bits = new BitSet();
    for (String name : names) {
      bits.set(universe.event(name).ordinal);
    }
    return new EventSet(universe, bits);
  }

  @Override
  public Kind kind() {
    return Kind.SET;
  }

  @Override
  public boolean isEmpty() {
    return bits.isEmpty();
  }

  @Override
  public int size() {
    return bits.cardinality();
  }

  public boolean contains(Event event) {
    return bits.get(event.ordinal);
  }

  /** Returns the members, in order of ordinal. */
  public List<Event> events() {
    final ImmutableList.Builder<Event> b = ImmutableList.builder();
    bits.stream().forEach(i -> b.add(universe.event(i)));
    return b.build();
  }

  @Override
  public EventSet complement() {
    final BitSet b = (BitSet) bits.clone();
    b.flip(0, universe.size());
    return new EventSet(universe, b);
  }

  @Override
  public EventSet union(Value value) {
    final BitSet b = (BitSet) bits.clone();
    b.or(set(value).bits);
    return new EventSet(universe, b);
  }

  @Override
  public EventSet intersect(Value value) {
    final BitSet b = (BitSet) bits.clone();
    b.and(set(value).bits);
    return new EventSet(universe, b);
  }

  @Override
  public EventSet minus(Value value) {
    final BitSet b = (BitSet) bits.clone();
    b.andNot(set(value).bits);
    return new EventSet(universe, b);
  }

  private EventSet set(Value value) {
    checkArgument(value instanceof EventSet && value.universe == universe,
        "not a set over the same universe: %s", value);
    return (EventSet) value;
  }

  @Override
  public int hashCode() {
    return bits.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof EventSet && bits.equals(((EventSet) o).bits);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    bits.stream().forEach(i -> {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(universe.event(i).name);
    });
    return b.append('}').toString();
  }
}

// End EventSet.java

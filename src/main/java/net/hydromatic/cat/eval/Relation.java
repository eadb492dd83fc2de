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
import java.util.AbstractMap;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import net.hydromatic.cat.type.Kind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A binary relation over events.
 *
 * <p>Stored as one bit set per event, holding the event's successors.
 */
public final class Relation extends Value {
  /** Successors of each event, indexed by ordinal; never modified after
   * construction. */
  private final BitSet[] rows;

  /** Creates a relation; takes ownership of {@code rows}. */
  private Relation(EventUniverse universe, BitSet[] rows) {
    super(universe);
    this.rows = requireNonNull(rows);
    checkArgument(rows.length == universe.size());
  }

  private static BitSet[] newRows(int n) {
    final BitSet[] rows = new BitSet[n];
    for (int i = 0; i < n; i++) {
      rows[i] = new BitSet(n);
    }
    return rows;
  }

  private BitSet[] copyRows() {
    final BitSet[] copy = new BitSet[rows.length];
    for (int i = 0; i < rows.length; i++) {
      copy[i] = (BitSet) rows[i].clone();
    }
    return copy;
  }

  /** Returns the empty relation. */
  public static Relation empty(EventUniverse universe) {
    return new Relation(universe, newRows(universe.size()));
  }

  /**
   * Creates a relation from pairs of event names.
   *
   * <p>For example, {@code of(u, "e1", "e2", "e2", "e3")} is the relation
   * {@code {(e1, e2), (e2, e3)}}.
   */
  public static Relation of(EventUniverse universe, String... names) {
    checkArgument(names.length % 2 == 0, "odd number of event names");
    final BitSet[] rows = newRows(universe.size());
    for (int i = 0; i < names.length; i += 2) {
      rows[universe.event(names[i]).ordinal]
          .set(universe.event(names[i + 1]).ordinal);
    }
    return new Relation(universe, rows);
  }

  /** Returns the identity relation on a set, {@code [s]}. */
  public static Relation identity(EventSet set) {
    final BitSet[] rows = newRows(set.universe.size());
    set.bits.stream().forEach(i -> rows[i].set(i));
    return new Relation(set.universe, rows);
  }

  /** Returns the identity relation on all events. */
  public static Relation identity(EventUniverse universe) {
    return identity(universe.all());
  }

  /** Returns the cartesian product of two sets, {@code a * b}. */
  public static Relation cartesian(EventSet a, EventSet b) {
    checkArgument(a.universe == b.universe, "different universes");
    final BitSet[] rows = newRows(a.universe.size());
    a.bits.stream().forEach(i -> rows[i].or(b.bits));
    return new Relation(a.universe, rows);
  }

  @Override
  public Kind kind() {
    return Kind.RELATION;
  }

  @Override
  public boolean isEmpty() {
    for (BitSet row : rows) {
      if (!row.isEmpty()) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int size() {
    int n = 0;
    for (BitSet row : rows) {
      n += row.cardinality();
    }
    return n;
  }

  /** Returns whether {@code (a, b)} is in this relation. */
  public boolean contains(Event a, Event b) {
    return rows[a.ordinal].get(b.ordinal);
  }

  /** Returns the events that {@code e} is related to. */
  public EventSet successors(Event e) {
    return new EventSet(universe, (BitSet) rows[e.ordinal].clone());
  }

  /** Returns the pairs in this relation, ordered by source then target. */
  public List<Map.Entry<Event, Event>> pairs() {
    final ImmutableList.Builder<Map.Entry<Event, Event>> b =
        ImmutableList.builder();
    for (int i = 0; i < rows.length; i++) {
      final Event source = universe.event(i);
      rows[i].stream().forEach(j ->
          b.add(new AbstractMap.SimpleImmutableEntry<>(source,
              universe.event(j))));
    }
    return b.build();
  }

  /** Returns the first event related to itself, or null if the relation is
   * irreflexive. */
  public @Nullable Event reflexiveEvent() {
    for (int i = 0; i < rows.length; i++) {
      if (rows[i].get(i)) {
        return universe.event(i);
      }
    }
    return null;
  }

  @Override
  public Relation complement() {
    final BitSet[] b = copyRows();
    for (BitSet row : b) {
      row.flip(0, rows.length);
    }
    return new Relation(universe, b);
  }

  @Override
  public Relation union(Value value) {
    final Relation that = relation(value);
    final BitSet[] b = copyRows();
    for (int i = 0; i < b.length; i++) {
      b[i].or(that.rows[i]);
    }
    return new Relation(universe, b);
  }

  @Override
  public Relation intersect(Value value) {
    final Relation that = relation(value);
    final BitSet[] b = copyRows();
    for (int i = 0; i < b.length; i++) {
      b[i].and(that.rows[i]);
    }
    return new Relation(universe, b);
  }

  @Override
  public Relation minus(Value value) {
    final Relation that = relation(value);
    final BitSet[] b = copyRows();
    for (int i = 0; i < b.length; i++) {
      b[i].andNot(that.rows[i]);
    }
    return new Relation(universe, b);
  }

  /** Returns the converse relation, {@code r^-1}. */
  public Relation inverse() {
    final BitSet[] b = newRows(rows.length);
    for (int i = 0; i < rows.length; i++) {
      final int source = i;
      rows[i].stream().forEach(j -> b[j].set(source));
    }
    return new Relation(universe, b);
  }

  /** Returns the composition of this relation followed by another,
   * {@code r;s}. */
  public Relation compose(Relation that) {
    checkArgument(that.universe == universe, "different universes");
    final BitSet[] b = newRows(rows.length);
    for (int i = 0; i < rows.length; i++) {
      final BitSet row = b[i];
      rows[i].stream().forEach(j -> row.or(that.rows[j]));
    }
    return new Relation(universe, b);
  }

  /** Returns the union of this relation with the identity, {@code r?}. */
  public Relation identityUnion() {
    final BitSet[] b = copyRows();
    for (int i = 0; i < b.length; i++) {
      b[i].set(i);
    }
    return new Relation(universe, b);
  }

  /** Returns the set of events that have at least one successor. */
  public EventSet domain() {
    final BitSet b = new BitSet(rows.length);
    for (int i = 0; i < rows.length; i++) {
      if (!rows[i].isEmpty()) {
        b.set(i);
      }
    }
    return new EventSet(universe, b);
  }

  /** Returns the set of events that have at least one predecessor. */
  public EventSet range() {
    final BitSet b = new BitSet(rows.length);
    for (BitSet row : rows) {
      b.or(row);
    }
    return new EventSet(universe, b);
  }

  /** Returns the transitive closure, {@code r^+}: the pairs connected by a
   * path of one or more steps. */
  public Relation transitiveClosure(Prop.ClosureAlgorithm algorithm) {
    switch (algorithm) {
      case WARSHALL:
        final BitSet[] b = copyRows();
        for (int k = 0; k < b.length; k++) {
          for (BitSet row : b) {
            if (row.get(k)) {
              row.or(b[k]);
            }
          }
        }
        return new Relation(universe, b);

      case SQUARING:
        Relation r = this;
        for (;;) {
          final Relation r2 = r.union(r.compose(r));
          if (r2.equals(r)) {
            return r;
          }
          r = r2;
        }

      default:
        throw new AssertionError(algorithm);
    }
  }

  /** Returns the reflexive-transitive closure, {@code r^*}. */
  public Relation reflexiveTransitiveClosure(
      Prop.ClosureAlgorithm algorithm) {
    return transitiveClosure(algorithm).identityUnion();
  }

  private Relation relation(Value value) {
    checkArgument(value instanceof Relation && value.universe == universe,
        "not a relation over the same universe: %s", value);
    return (Relation) value;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(rows);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Relation && Arrays.equals(rows, ((Relation) o).rows);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("{");
    for (Map.Entry<Event, Event> pair : pairs()) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append('(').append(pair.getKey()).append(", ")
          .append(pair.getValue()).append(')');
    }
    return b.append('}').toString();
  }
}

// End Relation.java

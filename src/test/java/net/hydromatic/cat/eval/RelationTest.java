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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;
import net.hydromatic.cat.type.Kind;
import org.junit.jupiter.api.Test;

/** Tests for {@link Relation}, {@link EventSet} and {@link EventUniverse}. */
public class RelationTest {
  private static final EventUniverse U =
      EventUniverse.builder()
          .event("a", "W", "M")
          .event("b", "R", "M")
          .event("c", "W", "M")
          .event("d", "F")
          .declareClass("A")
          .build();

  @Test void testUniverse() {
    assertThat(U.size(), is(4));
    assertThat(U.event("c").ordinal, is(2));
    assertThat(U.event(3), hasToString("d"));
    assertThat(U.all(), hasToString("{a, b, c, d}"));
    assertThat(U.classSet("W"), hasToString("{a, c}"));
    assertThat(U.classSet("M"), hasToString("{a, b, c}"));
    // a declared class with no events is empty, not absent
    assertThat(U.classSet("A"), hasToString("{}"));
    assertThat(U.classSet("X"), nullValue());
    assertThrows(RuntimeException.class, () -> U.event("z"));
  }

  @Test void testSetOperations() {
    final EventSet w = EventSet.of(U, "a", "c");
    final EventSet m = EventSet.of(U, "a", "b", "c");
    assertThat(w.union(EventSet.of(U, "d")), hasToString("{a, c, d}"));
    assertThat(m.minus(w), hasToString("{b}"));
    assertThat(m.intersect(w), is(w));
    assertThat(w.complement(), hasToString("{b, d}"));
    assertThat(EventSet.empty(U).isEmpty(), is(true));
    assertThat(m.size(), is(3));
    assertThat(Value.empty(U, Kind.SET), is(EventSet.empty(U)));
    assertThat(Value.empty(U, Kind.RELATION), is(Relation.empty(U)));
  }

  @Test void testRelationOperations() {
    final Relation po = Relation.of(U, "a", "b", "b", "c");
    assertThat(po, hasToString("{(a, b), (b, c)}"));
    assertThat(po.size(), is(2));
    assertThat(po.inverse(), hasToString("{(b, a), (c, b)}"));
    assertThat(po.compose(po), hasToString("{(a, c)}"));
    assertThat(po.compose(po.inverse()),
        hasToString("{(a, a), (b, b)}"));
    assertThat(po.identityUnion(),
        hasToString("{(a, a), (a, b), (b, b), (b, c), (c, c), (d, d)}"));
    assertThat(po.domain(), hasToString("{a, b}"));
    assertThat(po.range(), hasToString("{b, c}"));
    assertThat(po.union(Relation.of(U, "c", "d")),
        hasToString("{(a, b), (b, c), (c, d)}"));
    assertThat(po.minus(Relation.of(U, "a", "b")), hasToString("{(b, c)}"));
    assertThat(po.complement().size(), is(14));
    assertThat(po.reflexiveEvent(), nullValue());
    assertThat(po.compose(po.inverse()).reflexiveEvent(), hasToString("a"));
    assertThat(po.successors(U.event("a")), hasToString("{b}"));

    final EventSet w = EventSet.of(U, "a", "c");
    final EventSet r = EventSet.of(U, "b");
    assertThat(Relation.cartesian(w, r), hasToString("{(a, b), (c, b)}"));
    assertThat(Relation.identity(w), hasToString("{(a, a), (c, c)}"));
    assertThat(Relation.identity(U).size(), is(4));
  }

  @Test void testMixedKinds() {
    final Relation po = Relation.of(U, "a", "b");
    assertThrows(IllegalArgumentException.class,
        () -> po.union(EventSet.of(U, "a")));
    assertThrows(IllegalArgumentException.class,
        () -> Relation.of(U, "a"));
  }

  @Test void testClosure() {
    final Relation po = Relation.of(U, "a", "b", "b", "c", "c", "d");
    for (Prop.ClosureAlgorithm algorithm
        : Prop.ClosureAlgorithm.values()) {
      assertThat(po.transitiveClosure(algorithm),
          hasToString("{(a, b), (a, c), (a, d), (b, c), (b, d), (c, d)}"));
      assertThat(po.reflexiveTransitiveClosure(algorithm).size(), is(10));
      assertThat(Relation.empty(U).transitiveClosure(algorithm).isEmpty(),
          is(true));
    }
  }

  /** Checks that both closure algorithms agree with each other, and with
   * the definition: the closure contains the relation, is transitive, and
   * adding it to the relation composed with itself changes nothing. */
  @Test void testClosureAlgorithmsAgree() {
    final EventUniverse.Builder b = EventUniverse.builder();
    for (int i = 0; i < 12; i++) {
      b.event("e" + i);
    }
    final EventUniverse u = b.build();
    final Random random = new Random(1234L);
    for (int trial = 0; trial < 50; trial++) {
      Relation r = Relation.empty(u);
      final int edges = random.nextInt(20);
      for (int i = 0; i < edges; i++) {
        r = r.union(
            Relation.of(u, "e" + random.nextInt(12),
                "e" + random.nextInt(12)));
      }
      final Relation warshall =
          r.transitiveClosure(Prop.ClosureAlgorithm.WARSHALL);
      final Relation squaring =
          r.transitiveClosure(Prop.ClosureAlgorithm.SQUARING);
      assertThat(r.toString(), warshall, is(squaring));
      assertThat(warshall.intersect(r), is(r));
      assertThat(warshall.union(warshall.compose(warshall)), is(warshall));
      assertThat(r.union(r.compose(warshall)), is(warshall));
    }
  }
}

// End RelationTest.java

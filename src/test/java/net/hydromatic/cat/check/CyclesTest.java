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
package net.hydromatic.cat.check;

import static java.util.Objects.requireNonNull;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import java.util.List;
import net.hydromatic.cat.eval.Event;
import net.hydromatic.cat.eval.EventUniverse;
import net.hydromatic.cat.eval.Relation;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Cycles}. */
public class CyclesTest {
  private static final EventUniverse U =
      EventUniverse.builder()
          .event("a").event("b").event("c").event("d").event("e")
          .build();

  private static @Nullable List<Event> cycle(String... pairs) {
    return Cycles.findCycle(Relation.of(U, pairs));
  }

  @Test void testAcyclic() {
    assertThat(cycle(), nullValue());
    assertThat(cycle("a", "b", "b", "c", "a", "c"), nullValue());
    // diamond; "d" is reached twice but is not on a cycle
    assertThat(cycle("a", "b", "a", "c", "b", "d", "c", "d", "d", "e"),
        nullValue());
  }

  @Test void testSelfLoop() {
    assertThat(cycle("c", "c"), hasToString("[c]"));
    assertThat(cycle("a", "b", "b", "d", "d", "d"), hasToString("[d]"));
  }

  @Test void testCycle() {
    assertThat(cycle("a", "b", "b", "a"), hasToString("[a, b]"));
    assertThat(cycle("e", "c", "c", "d", "d", "e"), hasToString("[c, d, e]"));
    // the search starts from "a", and the cycle does not include the path
    // that leads to it
    assertThat(cycle("a", "b", "b", "c", "c", "d", "d", "b"),
        hasToString("[b, c, d]"));
  }

  @Test void testEachEventRelatedToNext() {
    final Relation r =
        Relation.of(U, "a", "c", "c", "e", "e", "b", "b", "d", "d", "a",
            "a", "b");
    final List<Event> events = requireNonNull(Cycles.findCycle(r));
    for (int i = 0; i < events.size(); i++) {
      final Event next = events.get((i + 1) % events.size());
      assertThat(events + " " + i, r.contains(events.get(i), next), is(true));
    }
  }
}

// End CyclesTest.java

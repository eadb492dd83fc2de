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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import net.hydromatic.cat.eval.Event;
import net.hydromatic.cat.eval.EventUniverse;
import net.hydromatic.cat.eval.Relation;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for finding cycles in relations. */
public abstract class Cycles {
  private Cycles() {}

  /** State of an event during depth-first search. */
  private enum Color { WHITE, GREY, BLACK }

  /**
   * Returns a cycle in a relation, or null if the relation is acyclic.
   *
   * <p>The cycle is a list of events {@code [e0, e1, ..., ek]} such that each
   * is related to the next and {@code ek} is related to {@code e0}; the first
   * event is not repeated at the end. A self-loop is a cycle of one event.
   */
  public static @Nullable List<Event> findCycle(Relation relation) {
    final EventUniverse universe = relation.universe;
    final int n = universe.size();
    final Color[] colors = new Color[n];
    Arrays.fill(colors, Color.WHITE);
    final int[] parents = new int[n];
    for (int root = 0; root < n; root++) {
      if (colors[root] != Color.WHITE) {
        continue;
      }
      // Iterative depth-first search; each stack entry is an event and the
      // iterator over its successors.
      final Deque<Frame> stack = new ArrayDeque<>();
      colors[root] = Color.GREY;
      parents[root] = -1;
      stack.push(new Frame(relation, universe.event(root)));
      while (!stack.isEmpty()) {
        final Frame frame = stack.peek();
        final int next = frame.nextSuccessor();
        if (next < 0) {
          colors[frame.event.ordinal] = Color.BLACK;
          stack.pop();
          continue;
        }
        switch (colors[next]) {
          case WHITE:
            colors[next] = Color.GREY;
            parents[next] = frame.event.ordinal;
            stack.push(new Frame(relation, universe.event(next)));
            break;
          case GREY:
            return cycle(universe, parents, frame.event.ordinal, next);
          default:
            break;
        }
      }
    }
    return null;
  }

  /** Builds the cycle closed by the edge from {@code last} back to
   * {@code first}, which is one of its ancestors in the search tree. */
  private static List<Event> cycle(EventUniverse universe, int[] parents,
      int last, int first) {
    final List<Event> events = new ArrayList<>();
    for (int i = last; i != first; i = parents[i]) {
      events.add(universe.event(i));
    }
    events.add(universe.event(first));
    return ImmutableList.copyOf(Lists.reverse(events));
  }

  /** An event being visited, and its successors not yet explored. */
  private static class Frame {
    final Event event;
    final List<Event> successors;
    int i = 0;

    Frame(Relation relation, Event event) {
      this.event = event;
      this.successors = relation.successors(event).events();
    }

    int nextSuccessor() {
      return i < successors.size() ? successors.get(i++).ordinal : -1;
    }
  }
}

// End Cycles.java

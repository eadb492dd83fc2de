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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.cat.eval.Event;
import net.hydromatic.cat.eval.Value;

/** Evidence that a check does not hold. */
public abstract class Witness {
  private Witness() {}

  /** Creates a witness that a relation is cyclic. */
  public static Cycle cycle(List<Event> events) {
    return new Cycle(events);
  }

  /** Creates a witness that a relation is reflexive. */
  public static Reflexive reflexive(Event event) {
    return new Reflexive(event);
  }

  /** Creates a witness that a value is not empty. */
  public static Members members(Value value) {
    return new Members(value);
  }

  /** Cycle of events; each is related to the next, and the last to the
   * first. */
  public static final class Cycle extends Witness {
    public final List<Event> events;

    Cycle(List<Event> events) {
      this.events = ImmutableList.copyOf(events);
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder("cycle ");
      events.forEach(e -> b.append(e).append(" -> "));
      return b.append(events.get(0)).toString();
    }
  }

  /** Event that is related to itself. */
  public static final class Reflexive extends Witness {
    public final Event event;

    Reflexive(Event event) {
      this.event = requireNonNull(event);
    }

    @Override
    public String toString() {
      return "reflexive " + event;
    }
  }

  /** Members of a value that should have been empty. */
  public static final class Members extends Witness {
    public final Value value;

    Members(Value value) {
      this.value = requireNonNull(value);
    }

    @Override
    public String toString() {
      return "members " + value;
    }
  }
}

// End Witness.java

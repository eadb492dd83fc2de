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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The primitive sets and relations of a candidate execution, such as
 * {@code po}, {@code rf} and {@code co}, keyed by name.
 */
public final class Primitives {
  public final EventUniverse universe;
  private final ImmutableMap<String, Value> values;

  private Primitives(EventUniverse universe,
      ImmutableMap<String, Value> values) {
    this.universe = requireNonNull(universe);
    this.values = requireNonNull(values);
  }

  /** Creates a builder of primitives over a given universe. */
  public static Builder builder(EventUniverse universe) {
    return new Builder(universe);
  }

  /** Returns the value of a primitive, or null if it is not supplied. */
  public @Nullable Value get(String name) {
    return values.get(name);
  }

  @Override
  public String toString() {
    return values.toString();
  }

  /** Builder for {@link Primitives}. */
  public static final class Builder {
    private final EventUniverse universe;
    private final Map<String, Value> values = new LinkedHashMap<>();

    private Builder(EventUniverse universe) {
      this.universe = requireNonNull(universe);
    }

    /** Adds a set of events, given their names. */
    public Builder set(String name, String... events) {
      return put(name, EventSet.of(universe, events));
    }

    /** Adds a relation, given pairs of event names. */
    public Builder relation(String name, String... events) {
      return put(name, Relation.of(universe, events));
    }

    /** Adds a value. */
    public Builder put(String name, Value value) {
      checkArgument(value.universe == universe,
          "value of %s is over a different universe", name);
      values.put(name, value);
      return this;
    }

    public Primitives build() {
      return new Primitives(universe, ImmutableMap.copyOf(values));
    }
  }
}

// End Primitives.java

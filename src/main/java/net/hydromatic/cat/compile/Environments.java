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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.cat.type.Kind;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Environment}. */
public abstract class Environments {
  /** Relations that a candidate execution conventionally supplies. */
  public static final List<String> STANDARD_RELATIONS =
      ImmutableList.of("po", "po-loc", "rf", "rfe", "rfi", "co", "coe", "coi",
          "fr", "fre", "fri", "addr", "data", "ctrl", "rmw", "loc", "int",
          "ext", "id");

  /** Sets of events that a candidate execution conventionally supplies:
   * reads, writes, memory accesses, atomics, releases, acquires and
   * fences. */
  public static final List<String> STANDARD_SETS =
      ImmutableList.of("R", "W", "M", "A", "L", "X", "F");

  /** An environment containing only the built-in functions. */
  private static final Environment BASIC_ENVIRONMENT = basic();

  private Environments() {}

  private static Environment basic() {
    Environment env = EmptyEnvironment.INSTANCE;
    for (BuiltIn builtIn : BuiltIn.values()) {
      env = env.bind(Binding.builtIn(builtIn.mlName, builtIn.kind));
    }
    return env;
  }

  /** Returns an environment that contains only the built-in functions,
   * such as {@code domain} and {@code range}. */
  public static Environment empty() {
    return BASIC_ENVIRONMENT;
  }

  /**
   * Creates an environment that declares the conventional primitive
   * relations and sets, plus a set for each fence.
   *
   * @param fenceNames Names of the fence instructions of an architecture,
   *     each of which becomes a set of events
   */
  public static Environment standard(Iterable<String> fenceNames) {
    Environment env = empty();
    for (String name : STANDARD_RELATIONS) {
      env = env.bind(Binding.primitive(name, Kind.RELATION));
    }
    for (String name : STANDARD_SETS) {
      env = env.bind(Binding.primitive(name, Kind.SET));
    }
    for (String name : fenceNames) {
      env = env.bind(Binding.primitive(name, Kind.SET));
    }
    return env;
  }

  /** Creates an environment that is a given environment plus bindings. */
  static Environment bind(Environment env, Iterable<Binding> bindings) {
    for (Binding binding : bindings) {
      env = env.bind(binding);
    }
    return env;
  }

  /** Environment that inherits from a parent environment and adds one
   * binding. */
  static class SubEnvironment extends Environment {
    private final Environment parent;
    private final Binding binding;

    SubEnvironment(Environment parent, Binding binding) {
      this.parent = requireNonNull(parent);
      this.binding = requireNonNull(binding);
    }

    @Override
    public String toString() {
      return binding.name + ", ...";
    }

    @Override
    public @Nullable Binding getOpt(String name) {
      if (name.equals(binding.name)) {
        return binding;
      }
      return parent.getOpt(name);
    }

    @Override
    void visit(Consumer<Binding> consumer) {
      consumer.accept(binding);
      parent.visit(consumer);
    }
  }

  /** Empty environment. */
  private static class EmptyEnvironment extends Environment {
    static final EmptyEnvironment INSTANCE = new EmptyEnvironment();

    @Override
    void visit(Consumer<Binding> consumer) {}

    @Override
    public @Nullable Binding getOpt(String name) {
      return null;
    }
  }
}

// End Environments.java

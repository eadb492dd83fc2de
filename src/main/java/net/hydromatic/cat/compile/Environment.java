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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Maps names to their {@link Binding}s.
 *
 * <p>Environments are immutable and layered: {@link #bind} returns a child
 * that adds one binding and may hide a binding of the same name in its
 * parent. A resolved model keeps the environment at each definition, so
 * that later definitions do not change what an earlier one refers to.
 *
 * <p>Start from {@link Environments#empty()} or
 * {@link Environments#standard}.
 */
public abstract class Environment {
  /** Calls a consumer for each binding, innermost first, including bindings
   * that are hidden by later bindings of the same name. */
  abstract void visit(Consumer<Binding> consumer);

  /** Returns the binding of a name, or null if the name is not bound. */
  public abstract @Nullable Binding getOpt(String name);

  /** Returns an environment with one more binding. */
  public Environment bind(Binding binding) {
    return new Environments.SubEnvironment(this, binding);
  }

  /** Returns an environment with several more bindings; a later binding
   * hides an earlier one of the same name. */
  public final Environment bindAll(Iterable<Binding> bindings) {
    return Environments.bind(this, bindings);
  }

  /** Returns the bindings that are not hidden, most recent first. */
  public final Map<String, Binding> bindings() {
    final Map<String, Binding> map = new LinkedHashMap<>();
    visit(binding -> map.putIfAbsent(binding.name, binding));
    return map;
  }
}

// End Environment.java

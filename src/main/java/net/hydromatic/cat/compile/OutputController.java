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
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.type.Kind;

/**
 * Keeps track of which relations a model shows.
 *
 * <p>{@code show a, b} adds names; {@code unshow a} removes them;
 * {@code show e as n} adds {@code n}, bound to expression {@code e}, without
 * binding {@code n} in the evaluation environment. Names are kept in the
 * order they were first shown.
 *
 * <p>Immutable; {@link #show} and {@link #unshow} return a new controller.
 * Showing never affects whether an execution is consistent.
 */
public final class OutputController {
  /** Controller that shows nothing. */
  public static final OutputController EMPTY =
      new OutputController(ImmutableMap.of());

  private final ImmutableMap<String, Item> items;

  private OutputController(ImmutableMap<String, Item> items) {
    this.items = requireNonNull(items);
  }

  /** Returns a controller that also shows an expression under a name. If the
   * name is already shown, its expression is replaced but its place in the
   * order is kept. */
  public OutputController show(String name, Ast.Exp<Kind> exp,
      Environment env) {
    final Map<String, Item> map = new LinkedHashMap<>(items);
    map.put(name, new Item(name, exp, env));
    return new OutputController(ImmutableMap.copyOf(map));
  }

  /** Returns a controller that no longer shows a name. Unshowing a name that
   * is not shown has no effect. */
  public OutputController unshow(String name) {
    if (!items.containsKey(name)) {
      return this;
    }
    final Map<String, Item> map = new LinkedHashMap<>(items);
    map.remove(name);
    return new OutputController(ImmutableMap.copyOf(map));
  }

  /** Returns the names of the shown items, in order. */
  public List<String> shownNames() {
    return ImmutableList.copyOf(items.keySet());
  }

  /** Returns the shown items, in order. */
  public Collection<Item> items() {
    return items.values();
  }

  @Override
  public String toString() {
    return items.keySet().toString();
  }

  /** A shown relation: a display name, and the expression whose value is
   * displayed, with the environment to evaluate it in. */
  public static final class Item {
    public final String name;
    public final Ast.Exp<Kind> exp;
    public final Environment env;

    Item(String name, Ast.Exp<Kind> exp, Environment env) {
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.env = requireNonNull(env);
    }

    @Override
    public String toString() {
      return name + " = " + exp;
    }
  }
}

// End OutputController.java

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
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.type.Kind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A resolved cat model.
 *
 * <p>Contains the final environment, the axioms in the order they were
 * defined (each with the environment in force at its definition), and the
 * relations that the model shows. Immutable, and may be shared between
 * threads.
 */
public final class CatModel {
  /** Name of the model, or null. */
  public final @Nullable String tag;
  /** Definitions, with includes expanded and kinds deduced. */
  public final List<Ast.Def<Kind>> defs;
  /** Environment after the last definition. */
  public final Environment env;
  public final List<ScopedAxiom> axioms;
  public final OutputController output;

  CatModel(@Nullable String tag, ImmutableList<Ast.Def<Kind>> defs,
      Environment env, ImmutableList<ScopedAxiom> axioms,
      OutputController output) {
    this.tag = tag;
    this.defs = requireNonNull(defs);
    this.env = requireNonNull(env);
    this.axioms = requireNonNull(axioms);
    this.output = requireNonNull(output);
  }

  /** Returns the axioms that are checks (not flags). */
  public List<ScopedAxiom> checks() {
    return ImmutableList.copyOf(
        axioms.stream().filter(a -> !a.axiom.isFlag()).iterator());
  }

  /** Returns the axioms that are flags. */
  public List<ScopedAxiom> flags() {
    return ImmutableList.copyOf(
        axioms.stream().filter(a -> a.axiom.isFlag()).iterator());
  }

  /** Returns the axiom of this model that is equal to a given axiom (ignoring
   * annotations), or null. */
  public @Nullable ScopedAxiom find(Ast.Axiom<?> axiom) {
    for (ScopedAxiom scopedAxiom : axioms) {
      if (scopedAxiom.axiom.equals(axiom)) {
        return scopedAxiom;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    if (tag != null) {
      b.append('"').append(tag).append("\"\n");
    }
    defs.forEach(def -> b.append(def).append('\n'));
    return b.toString();
  }

  /** An axiom and the environment in which its expression is evaluated. */
  public static final class ScopedAxiom {
    public final Ast.Axiom<Kind> axiom;
    public final Environment env;

    ScopedAxiom(Ast.Axiom<Kind> axiom, Environment env) {
      this.axiom = requireNonNull(axiom);
      this.env = requireNonNull(env);
    }

    @Override
    public String toString() {
      return axiom.toString();
    }
  }
}

// End CatModel.java

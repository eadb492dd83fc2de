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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.eval.Value;
import net.hydromatic.cat.type.Kind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Outcome of checking an axiom against a candidate execution.
 *
 * <p>A verdict moves through the states {@link State#PENDING},
 * {@link State#EVALUATED}, and finally {@link State#SATISFIED} or
 * {@link State#VIOLATED}. Each transition creates a new verdict.
 */
public final class Verdict {
  public final Ast.Axiom<Kind> axiom;
  public final State state;
  /** Value of the axiom's expression; null until evaluated. */
  public final @Nullable Value value;
  /** Evidence of a violation; null unless violated and witnesses are
   * enabled. */
  public final @Nullable Witness witness;

  private Verdict(Ast.Axiom<Kind> axiom, State state, @Nullable Value value,
      @Nullable Witness witness) {
    this.axiom = requireNonNull(axiom);
    this.state = requireNonNull(state);
    this.value = value;
    this.witness = witness;
  }

  /** Creates a verdict for an axiom that has not been evaluated. */
  public static Verdict pending(Ast.Axiom<Kind> axiom) {
    return new Verdict(axiom, State.PENDING, null, null);
  }

  /** Returns a verdict in state {@link State#EVALUATED}. */
  public Verdict evaluated(Value value) {
    checkState(state == State.PENDING, "not pending: %s", this);
    return new Verdict(axiom, State.EVALUATED, requireNonNull(value), null);
  }

  /** Returns a verdict in state {@link State#SATISFIED} or
   * {@link State#VIOLATED}. */
  public Verdict decide(boolean satisfied, @Nullable Witness witness) {
    checkState(state == State.EVALUATED, "not evaluated: %s", this);
    return new Verdict(axiom, satisfied ? State.SATISFIED : State.VIOLATED,
        value, satisfied ? null : witness);
  }

  public boolean isSatisfied() {
    return state == State.SATISFIED;
  }

  public boolean isViolated() {
    return state == State.VIOLATED;
  }

  /** Whether the axiom is a flag, whose violation does not make the
   * execution inconsistent. */
  public boolean isFlag() {
    return axiom.isFlag();
  }

  /** Returns the axiom's tag, or null. */
  public @Nullable String tag() {
    return axiom.tag;
  }

  @Override
  public String toString() {
    final StringBuilder b =
        new StringBuilder(axiom.describe()).append(": ").append(state);
    if (witness != null) {
      b.append(" (").append(witness).append(')');
    }
    return b.toString();
  }

  /** State of a verdict. */
  public enum State {
    PENDING,
    EVALUATED,
    SATISFIED,
    VIOLATED
  }
}

// End Verdict.java

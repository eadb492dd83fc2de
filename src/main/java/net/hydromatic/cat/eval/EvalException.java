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

import static java.util.Objects.requireNonNull;

import net.hydromatic.cat.ast.Pos;
import net.hydromatic.cat.util.CatException;

/**
 * Error while evaluating an expression against a candidate execution.
 *
 * <p>Inside the first operand of {@code try ... with}, the error is
 * caught and the second operand is evaluated instead; otherwise it makes the
 * axiom being checked fail, for the current candidate only.
 */
public class EvalException extends RuntimeException
    implements CatException {
  public final Kind kind;
  /** Name involved in the error, or the empty string. */
  public final String name;
  private final Pos pos;

  public EvalException(Kind kind, String name, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.name = requireNonNull(name);
    this.pos = requireNonNull(pos);
  }

  static EvalException unboundName(String name, Pos pos) {
    return new EvalException(Kind.UNBOUND_NAME, name,
        "unbound name '" + name + "'", pos);
  }

  static EvalException unboundPrimitive(String name, Pos pos) {
    return new EvalException(Kind.UNBOUND_PRIMITIVE, name,
        "primitive '" + name + "' is not supplied by the candidate", pos);
  }

  static EvalException typeMismatch(String description,
      net.hydromatic.cat.type.Kind expected,
      net.hydromatic.cat.type.Kind actual, Pos pos) {
    return new EvalException(Kind.TYPE_MISMATCH, "",
        description + ": expected " + expected.description + ", got "
            + actual.description, pos);
  }

  static EvalException notAFunction(String name, Pos pos) {
    return new EvalException(Kind.NOT_A_FUNCTION, name,
        "'" + name + "' is not a function", pos);
  }

  static EvalException noFixpoint(String name, int rounds, Pos pos) {
    return new EvalException(Kind.NO_FIXPOINT, name,
        "definition of '" + name + "' did not converge after " + rounds
            + " rounds", pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }

  /** Kinds of evaluation error. */
  public enum Kind {
    UNBOUND_NAME,
    UNBOUND_PRIMITIVE,
    TYPE_MISMATCH,
    NOT_A_FUNCTION,
    NO_FIXPOINT
  }
}

// End EvalException.java

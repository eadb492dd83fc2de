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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.type.Kind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Binding of a name to a definition in an {@link Environment}.
 *
 * <p>A binding is immutable once the resolver has finished with it. The one
 * exception to construction-time initialization is the environment in which
 * the body of a {@code let} group is evaluated: for a recursive group it
 * contains the group's own bindings, so it can only be attached after they
 * have been created.
 */
public final class Binding {
  public final String name;
  public final Sort sort;
  /** Kind of the value; for a function, the kind of its result. */
  public final Kind kind;
  /** Body: the expression of a value, the operand of a closure, or the body
   * of a function; null for primitives, parameters and built-ins. */
  public final Ast.@Nullable Exp<Kind> exp;
  /** Name of the parameter of a function; null otherwise. */
  public final @Nullable String param;
  /** Whether the binding belongs to a {@code let} group whose definitions
   * refer to each other (or to themselves). */
  public final boolean recursive;
  /** Definition this binding came from, if any. All bindings of a
   * {@code let} group share the same definition. */
  public final Ast.@Nullable Def<Kind> def;

  private @Nullable Environment env;

  private Binding(String name, Sort sort, Kind kind,
      Ast.@Nullable Exp<Kind> exp, @Nullable String param, boolean recursive,
      Ast.@Nullable Def<Kind> def, @Nullable Environment env) {
    this.name = requireNonNull(name);
    this.sort = requireNonNull(sort);
    this.kind = requireNonNull(kind);
    this.exp = exp;
    this.param = param;
    this.recursive = recursive;
    this.def = def;
    this.env = env;
  }

  /** Creates a binding for a member of a {@code let} group. Its environment
   * must be supplied later, via {@link #attach}. */
  public static Binding value(String name, Ast.Exp<Kind> exp,
      boolean recursive, Ast.Def<Kind> def) {
    return new Binding(name, Sort.VALUE, exp.annotation, exp, null, recursive,
        def, null);
  }

  /** Creates a binding for a transitive or reflexive-transitive closure. */
  public static Binding closure(Ast.ClosureDef<Kind> def, Environment env) {
    return new Binding(def.name, Sort.CLOSURE, Kind.RELATION, def.exp, null,
        false, def, env);
  }

  /** Creates a binding for a function. */
  public static Binding function(Ast.FnDef<Kind> def, Environment env) {
    return new Binding(def.name, Sort.FUNCTION, def.body.annotation, def.body,
        def.param().name, false, def, env);
  }

  /** Creates a binding for a primitive set or relation, whose value is
   * supplied with each candidate execution. */
  public static Binding primitive(String name, Kind kind) {
    return new Binding(name, Sort.PRIMITIVE, kind, null, null, false, null,
        null);
  }

  /** Creates a binding for a function whose implementation is built in. */
  public static Binding builtIn(String name, Kind kind) {
    return new Binding(name, Sort.BUILT_IN, kind, null, null, false, null,
        null);
  }

  /** Creates a binding for a local variable or function parameter. Such
   * bindings exist only while names are being resolved. */
  public static Binding local(String name, Kind kind) {
    return new Binding(name, Sort.LOCAL, kind, null, null, false, null, null);
  }

  /** Returns a binding the same as this but with a different kind. Used by
   * the resolver while it infers the kinds of a {@code let} group. */
  Binding withKind(Kind kind) {
    if (kind == this.kind) {
      return this;
    }
    return new Binding(name, sort, kind, exp, param, recursive, def, env);
  }

  /** Sets the environment of a binding that was created without one. */
  void attach(Environment env) {
    checkState(this.env == null, "already attached: %s", name);
    this.env = requireNonNull(env);
  }

  /** Returns the environment in which the body of this binding is
   * evaluated. */
  public Environment env() {
    checkState(env != null, "binding %s has no environment", name);
    return env;
  }

  /** Whether the binding can be applied to an argument. */
  public boolean isFunction() {
    return sort == Sort.FUNCTION || sort == Sort.BUILT_IN;
  }

  @Override
  public String toString() {
    return name + ": " + sort + " " + kind;
  }

  /** What a name is bound to. */
  public enum Sort {
    /** Member of a {@code let} group. */
    VALUE,
    /** Transitive or reflexive-transitive closure. */
    CLOSURE,
    /** Function with one parameter. */
    FUNCTION,
    /** Set or relation supplied with each candidate execution. */
    PRIMITIVE,
    /** Function implemented in Java, such as {@code domain}. */
    BUILT_IN,
    /** Local variable or function parameter; resolution only. */
    LOCAL
  }
}

// End Binding.java

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
package net.hydromatic.cat.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.File;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  /** Creates an empty set or relation. */
  public <A> Ast.Exp<A> empty(Pos pos, A a) {
    return new Ast.Empty<>(pos, a);
  }

  /** Creates a reference to a name. */
  public <A> Ast.Id<A> id(Pos pos, A a, String name) {
    return new Ast.Id<>(pos, a, name);
  }

  /** Creates an application of a function to an argument. */
  public <A> Ast.Exp<A> apply(Pos pos, A a, String fn, Ast.Exp<A> arg) {
    return new Ast.Apply<>(pos, a, fn, arg);
  }

  /** Creates a complement, "~x". */
  public <A> Ast.Exp<A> compl(Pos pos, A a, Ast.Exp<A> e) {
    return new Ast.PrefixCall<>(pos, Op.COMPL, a, e);
  }

  /** Creates an inverse, "x^-1". */
  public <A> Ast.Exp<A> inverse(Pos pos, A a, Ast.Exp<A> e) {
    return new Ast.PostfixCall<>(pos, Op.INVERSE, a, e);
  }

  /** Creates a union with the identity relation, "x?". */
  public <A> Ast.Exp<A> identityUnion(Pos pos, A a, Ast.Exp<A> e) {
    return new Ast.PostfixCall<>(pos, Op.IDENTITY_UNION, a, e);
  }

  /** Creates a call to a prefix or postfix operator. */
  public <A> Ast.Exp<A> unary(Pos pos, Op op, A a, Ast.Exp<A> e) {
    switch (op) {
      case COMPL:
        return compl(pos, a, e);
      case INVERSE:
      case IDENTITY_UNION:
        return new Ast.PostfixCall<>(pos, op, a, e);
      case IDENTITY:
        return identity(pos, a, e);
      default:
        throw new AssertionError("not a unary operator: " + op);
    }
  }

  /** Creates the identity relation on a set, "[x]". */
  public <A> Ast.Exp<A> identity(Pos pos, A a, Ast.Exp<A> e) {
    return new Ast.Identity<>(pos, a, e);
  }

  /** Creates a call to an infix operator. */
  public <A> Ast.Exp<A> infixCall(
      Pos pos, Op op, A a, Ast.Exp<A> a0, Ast.Exp<A> a1) {
    return new Ast.InfixCall<>(pos, op, a, a0, a1);
  }

  public <A> Ast.Exp<A> cartesian(Pos pos, A a, Ast.Exp<A> a0, Ast.Exp<A> a1) {
    return infixCall(pos, Op.CARTESIAN, a, a0, a1);
  }

  public <A> Ast.Exp<A> diff(Pos pos, A a, Ast.Exp<A> a0, Ast.Exp<A> a1) {
    return infixCall(pos, Op.DIFF, a, a0, a1);
  }

  public <A> Ast.Exp<A> inter(Pos pos, A a, Ast.Exp<A> a0, Ast.Exp<A> a1) {
    return infixCall(pos, Op.INTER, a, a0, a1);
  }

  public <A> Ast.Exp<A> seq(Pos pos, A a, Ast.Exp<A> a0, Ast.Exp<A> a1) {
    return infixCall(pos, Op.SEQ, a, a0, a1);
  }

  public <A> Ast.Exp<A> union(Pos pos, A a, Ast.Exp<A> a0, Ast.Exp<A> a1) {
    return infixCall(pos, Op.UNION, a, a0, a1);
  }

  public <A> Ast.Exp<A> let(
      Pos pos, A a, String name, Ast.Exp<A> exp, Ast.Exp<A> body) {
    return new Ast.Let<>(pos, a, name, exp, body);
  }

  public <A> Ast.Exp<A> tryWith(
      Pos pos, A a, Ast.Exp<A> exp, Ast.Exp<A> fallback) {
    return new Ast.TryWith<>(pos, a, exp, fallback);
  }

  public <A> Ast.Include<A> include(Pos pos, String path) {
    return new Ast.Include<>(pos, path);
  }

  public <A> Ast.ValBind<A> valBind(Pos pos, String name, Ast.Exp<A> exp) {
    return new Ast.ValBind<>(pos, name, exp);
  }

  public <A> Ast.LetDef<A> letDef(
      Pos pos, Iterable<Ast.ValBind<A>> binds, boolean rec) {
    return new Ast.LetDef<>(pos, ImmutableList.copyOf(binds), rec);
  }

  public <A> Ast.ClosureDef<A> closureDef(
      Pos pos, boolean reflexive, String name, Ast.Exp<A> exp) {
    return new Ast.ClosureDef<>(
        pos, reflexive ? Op.RTCLOSURE_DEF : Op.TCLOSURE_DEF, name, exp);
  }

  public <A> Ast.Param<A> param(Pos pos, String name, A a) {
    return new Ast.Param<>(pos, name, a);
  }

  public <A> Ast.FnDef<A> fnDef(
      Pos pos, String name, Iterable<Ast.Param<A>> params, Ast.Exp<A> body) {
    return new Ast.FnDef<>(pos, name, ImmutableList.copyOf(params), body);
  }

  public <A> Ast.CheckDef<A> checkDef(
      Pos pos, Check check, Ast.Exp<A> exp, @Nullable String tag) {
    return new Ast.CheckDef<>(pos, check, exp, tag);
  }

  public <A> Ast.FlagDef<A> flagDef(
      Pos pos, Check check, Ast.Exp<A> exp, String tag) {
    return new Ast.FlagDef<>(pos, check, exp, tag);
  }

  /** Creates a check or flag, copying the kind of axiom from an existing
   * one. */
  public <A> Ast.Axiom<A> axiom(Ast.Axiom<?> axiom, Ast.Exp<A> exp) {
    return axiom.isFlag()
        ? flagDef(axiom.pos, axiom.check, exp, requireNonNull(axiom.tag))
        : checkDef(axiom.pos, axiom.check, exp, axiom.tag);
  }

  public <A> Ast.ShowDef<A> show(Pos pos, Iterable<String> names) {
    return new Ast.ShowDef<>(pos, Op.SHOW, ImmutableList.copyOf(names));
  }

  public <A> Ast.ShowDef<A> unshow(Pos pos, Iterable<String> names) {
    return new Ast.ShowDef<>(pos, Op.UNSHOW, ImmutableList.copyOf(names));
  }

  public <A> Ast.ShowAs<A> showAs(Pos pos, Ast.Exp<A> exp, String name) {
    return new Ast.ShowAs<>(pos, exp, name);
  }

  public <A> Ast.Declaration<A> declareSet(Pos pos, String name) {
    return new Ast.Declaration<>(pos, Op.SET_DECL, name);
  }

  public <A> Ast.Declaration<A> declareRelation(Pos pos, String name) {
    return new Ast.Declaration<>(pos, Op.RELATION_DECL, name);
  }

  public <A> Ast.ParseCat<A> parseCat(
      @Nullable String tag,
      Iterable<? extends Ast.ParseDef<A>> defs,
      @Nullable File directory) {
    return new Ast.ParseCat<>(tag, ImmutableList.copyOf(defs), directory);
  }
}

// End AstBuilder.java

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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.util.List;
import java.util.Objects;
import java.util.function.ObjIntConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes.
 *
 * <p>Every expression and definition is generic over an annotation type
 * {@code A}. The parser produces trees annotated with {@link
 * net.hydromatic.cat.util.Unit}; the type resolver produces trees annotated
 * with {@link net.hydromatic.cat.type.Kind}.
 *
 * <p>Expressions implement {@link #equals} structurally, ignoring positions
 * and annotations.
 */
public class Ast {
  private Ast() {}

  /** Base class of expression ASTs. */
  public abstract static class Exp<A> extends AstNode {
    public final A annotation;

    Exp(Pos pos, Op op, A annotation) {
      super(pos, op);
      this.annotation = requireNonNull(annotation);
    }

    public void forEachArg(ObjIntConsumer<Exp<A>> action) {
      // no args
    }

    /** Returns a list of all arguments. */
    public final List<Exp<A>> args() {
      final ImmutableList.Builder<Exp<A>> args = ImmutableList.builder();
      forEachArg((exp, i) -> args.add(exp));
      return args.build();
    }
  }

  /** The empty set or relation, written "0" or "{}". */
  public static class Empty<A> extends Exp<A> {
    Empty(Pos pos, A annotation) {
      super(pos, Op.EMPTY, annotation);
    }

    @Override
    public int hashCode() {
      return "0".hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Empty;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("0");
    }
  }

  /** Parse tree node of an identifier. */
  public static class Id<A> extends Exp<A> {
    public final String name;

    Id(Pos pos, A annotation, String name) {
      super(pos, Op.ID, annotation);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && name.equals(((Id<?>) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /**
   * Application of a function to an argument.
   *
   * <p>For example, "{@code domain(po)}" or "{@code f x}".
   */
  public static class Apply<A> extends Exp<A> {
    public final String fn;
    public final Exp<A> arg;

    Apply(Pos pos, A annotation, String fn, Exp<A> arg) {
      super(pos, Op.APPLY, annotation);
      this.fn = requireNonNull(fn);
      this.arg = requireNonNull(arg);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp<A>> action) {
      action.accept(arg, 0);
    }

    @Override
    public int hashCode() {
      return Objects.hash(fn, arg);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
              && fn.equals(((Apply<?>) o).fn)
              && arg.equals(((Apply<?>) o).arg);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      return w.id(fn).append(op.padded).append(arg, op.right, right);
    }
  }

  /** Call to a prefix operator; the only one is complement, "~". */
  public static class PrefixCall<A> extends Exp<A> {
    public final Exp<A> a;

    PrefixCall(Pos pos, Op op, A annotation, Exp<A> a) {
      super(pos, op, annotation);
      this.a = requireNonNull(a);
      checkArgument(op == Op.COMPL);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp<A>> action) {
      action.accept(a, 0);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PrefixCall
              && op == ((PrefixCall<?>) o).op
              && a.equals(((PrefixCall<?>) o).a);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /**
   * Call to a postfix operator, either inverse ("{@code x^-1}") or union
   * with identity ("{@code x?}").
   */
  public static class PostfixCall<A> extends Exp<A> {
    public final Exp<A> a;

    PostfixCall(Pos pos, Op op, A annotation, Exp<A> a) {
      super(pos, op, annotation);
      this.a = requireNonNull(a);
      checkArgument(op == Op.INVERSE || op == Op.IDENTITY_UNION);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp<A>> action) {
      action.accept(a, 0);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof PostfixCall
              && op == ((PostfixCall<?>) o).op
              && a.equals(((PostfixCall<?>) o).a);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.postfix(left, a, op, right);
    }
  }

  /** Identity relation on a set, written "{@code [x]}". */
  public static class Identity<A> extends Exp<A> {
    public final Exp<A> a;

    Identity(Pos pos, A annotation, Exp<A> a) {
      super(pos, Op.IDENTITY, annotation);
      this.a = requireNonNull(a);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp<A>> action) {
      action.accept(a, 0);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Identity && a.equals(((Identity<?>) o).a);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("[").append(a, 0, 0).append("]");
    }
  }

  /**
   * Call to an infix operator: cartesian product, difference, intersection,
   * sequence or union.
   */
  public static class InfixCall<A> extends Exp<A> {
    public final Exp<A> a0;
    public final Exp<A> a1;

    InfixCall(Pos pos, Op op, A annotation, Exp<A> a0, Exp<A> a1) {
      super(pos, op, annotation);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
      checkArgument(op.isInfix());
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp<A>> action) {
      action.accept(a0, 0);
      action.accept(a1, 1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, a0, a1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
              && op == ((InfixCall<?>) o).op
              && a0.equals(((InfixCall<?>) o).a0)
              && a1.equals(((InfixCall<?>) o).a1);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return op == Op.CARTESIAN
          ? w.nonAssoc(left, a0, op, a1, right)
          : w.infix(left, a0, op, a1, right);
    }
  }

  /** "Let" expression, "{@code let name = exp in body}". */
  public static class Let<A> extends Exp<A> {
    public final String name;
    public final Exp<A> exp;
    public final Exp<A> body;

    Let(Pos pos, A annotation, String name, Exp<A> exp, Exp<A> body) {
      super(pos, Op.LET, annotation);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      this.body = requireNonNull(body);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp<A>> action) {
      action.accept(exp, 0);
      action.accept(body, 1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, exp, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Let
              && name.equals(((Let<?>) o).name)
              && exp.equals(((Let<?>) o).exp)
              && body.equals(((Let<?>) o).body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      return w.append("let ")
          .id(name)
          .append(" = ")
          .append(exp, 0, 0)
          .append(" in ")
          .append(body, 0, 0);
    }
  }

  /** "Try" expression, "{@code try exp with fallback}". */
  public static class TryWith<A> extends Exp<A> {
    public final Exp<A> exp;
    public final Exp<A> fallback;

    TryWith(Pos pos, A annotation, Exp<A> exp, Exp<A> fallback) {
      super(pos, Op.TRY_WITH, annotation);
      this.exp = requireNonNull(exp);
      this.fallback = requireNonNull(fallback);
    }

    @Override
    public void forEachArg(ObjIntConsumer<Exp<A>> action) {
      action.accept(exp, 0);
      action.accept(fallback, 1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, exp, fallback);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof TryWith
              && exp.equals(((TryWith<?>) o).exp)
              && fallback.equals(((TryWith<?>) o).fallback);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        w.append("(");
        unparse(w, 0, 0);
        return w.append(")");
      }
      return w.append("try ")
          .append(exp, 0, 0)
          .append(" with ")
          .append(fallback, 0, 0);
    }
  }

  /**
   * Top-level item in a cat file: either an {@link Include} directive or a
   * {@link Def}.
   */
  public abstract static class ParseDef<A> extends AstNode {
    ParseDef(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Include directive, "{@code include "path"}". */
  public static class Include<A> extends ParseDef<A> {
    public final String path;

    Include(Pos pos, String path) {
      super(pos, Op.INCLUDE);
      this.path = requireNonNull(path);
    }

    @Override
    public int hashCode() {
      return path.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Include && path.equals(((Include<?>) o).path);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded).string(path);
    }
  }

  /** Base class for definitions. */
  public abstract static class Def<A> extends ParseDef<A> {
    Def(Pos pos, Op op) {
      super(pos, op);
    }
  }

  /** Binding of a name to an expression, within a {@link LetDef}. */
  public static class ValBind<A> extends AstNode {
    public final String name;
    public final Exp<A> exp;

    ValBind(Pos pos, String name, Exp<A> exp) {
      super(pos, Op.VAL_BIND);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ValBind
              && name.equals(((ValBind<?>) o).name)
              && exp.equals(((ValBind<?>) o).exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name).append(op.padded).append(exp, 0, 0);
    }
  }

  /**
   * Group of bindings whose names are visible to each other,
   * "{@code let a = x and b = y}".
   */
  public static class LetDef<A> extends Def<A> {
    public final List<ValBind<A>> binds;
    /** Whether the group was written "let rec". */
    public final boolean rec;

    LetDef(Pos pos, ImmutableList<ValBind<A>> binds, boolean rec) {
      super(pos, Op.LET_DEF);
      this.binds = requireNonNull(binds);
      this.rec = rec;
      checkArgument(!binds.isEmpty());
    }

    @Override
    public int hashCode() {
      return Objects.hash(binds, rec);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof LetDef
              && binds.equals(((LetDef<?>) o).binds)
              && rec == ((LetDef<?>) o).rec;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(rec ? "let rec " : "let ");
      for (int i = 0; i < binds.size(); i++) {
        w.append(i == 0 ? "" : " and ").append(binds.get(i), 0, 0);
      }
      return w;
    }
  }

  /**
   * Definition of a name as the transitive closure ("{@code let r = x^+}") or
   * reflexive-transitive closure ("{@code let r = x^*}") of an expression.
   */
  public static class ClosureDef<A> extends Def<A> {
    public final String name;
    public final Exp<A> exp;

    ClosureDef(Pos pos, Op op, String name, Exp<A> exp) {
      super(pos, op);
      this.name = requireNonNull(name);
      this.exp = requireNonNull(exp);
      checkArgument(op == Op.TCLOSURE_DEF || op == Op.RTCLOSURE_DEF);
    }

    /** Whether the closure includes the identity relation. */
    public boolean isReflexive() {
      return op == Op.RTCLOSURE_DEF;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name, exp);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ClosureDef
              && op == ((ClosureDef<?>) o).op
              && name.equals(((ClosureDef<?>) o).name)
              && exp.equals(((ClosureDef<?>) o).exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("let ")
          .id(name)
          .append(" = ")
          .append(exp, 0, 0)
          .append(op.padded);
    }
  }

  /** Formal parameter of a function. */
  public static class Param<A> extends AstNode {
    public final String name;
    public final A annotation;

    Param(Pos pos, String name, A annotation) {
      super(pos, Op.PARAM);
      this.name = requireNonNull(name);
      this.annotation = requireNonNull(annotation);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Param && name.equals(((Param<?>) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /** Function definition, "{@code let f(x) = body}". */
  public static class FnDef<A> extends Def<A> {
    public final String name;
    public final List<Param<A>> params;
    public final Exp<A> body;

    FnDef(Pos pos, String name, ImmutableList<Param<A>> params, Exp<A> body) {
      super(pos, Op.FN_DEF);
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
      checkArgument(params.size() == 1, "function must have one parameter");
    }

    /** Returns the sole parameter. */
    public Param<A> param() {
      return params.get(0);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, params, body);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FnDef
              && name.equals(((FnDef<?>) o).name)
              && params.equals(((FnDef<?>) o).params)
              && body.equals(((FnDef<?>) o).body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("let ").id(name).append("(");
      for (int i = 0; i < params.size(); i++) {
        w.append(i == 0 ? "" : ", ").append(params.get(i), 0, 0);
      }
      return w.append(") = ").append(body, 0, 0);
    }
  }

  /**
   * Consistency axiom: a {@link Check} applied to an expression.
   *
   * @see CheckDef
   * @see FlagDef
   */
  public abstract static class Axiom<A> extends Def<A> {
    public final Check check;
    public final Exp<A> exp;
    public final @Nullable String tag;

    Axiom(Pos pos, Op op, Check check, Exp<A> exp, @Nullable String tag) {
      super(pos, op);
      this.check = requireNonNull(check);
      this.exp = requireNonNull(exp);
      this.tag = tag;
    }

    /** Whether a violation of this axiom is only reported, and does not
     * make the execution inconsistent. */
    public boolean isFlag() {
      return op == Op.FLAG_DEF;
    }

    /** Returns the tag, or the text of the axiom if it has no tag. */
    public String describe() {
      return tag != null ? tag : check.keyword + " " + exp;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, check, exp, tag);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Axiom
              && op == ((Axiom<?>) o).op
              && check == ((Axiom<?>) o).check
              && exp.equals(((Axiom<?>) o).exp)
              && Objects.equals(tag, ((Axiom<?>) o).tag);
    }
  }

  /** Mandatory axiom, for example "{@code acyclic po | rf as sc}". */
  public static class CheckDef<A> extends Axiom<A> {
    CheckDef(Pos pos, Check check, Exp<A> exp, @Nullable String tag) {
      super(pos, Op.CHECK_DEF, check, exp, tag);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(check.keyword).append(" ").append(exp, 0, 0);
      if (tag != null) {
        w.append(" as ").id(tag);
      }
      return w;
    }
  }

  /**
   * Non-fatal axiom, for example
   * "{@code flag ~empty rmw & (fre;coe) as atomic}".
   */
  public static class FlagDef<A> extends Axiom<A> {
    FlagDef(Pos pos, Check check, Exp<A> exp, String tag) {
      super(pos, Op.FLAG_DEF, check, exp, requireNonNull(tag));
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("flag ")
          .append(check.keyword)
          .append(" ")
          .append(exp, 0, 0)
          .append(" as ")
          .id(requireNonNull(tag));
    }
  }

  /** "Show" or "unshow" directive with a list of names. */
  public static class ShowDef<A> extends Def<A> {
    public final List<String> names;

    ShowDef(Pos pos, Op op, ImmutableList<String> names) {
      super(pos, op);
      this.names = requireNonNull(names);
      checkArgument(op == Op.SHOW || op == Op.UNSHOW);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, names);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ShowDef
              && op == ((ShowDef<?>) o).op
              && names.equals(((ShowDef<?>) o).names);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op == Op.SHOW ? "show " : "unshow ").names(names);
    }
  }

  /** Directive that shows an expression under a name,
   * "{@code show exp as name}". */
  public static class ShowAs<A> extends Def<A> {
    public final Exp<A> exp;
    public final String name;

    ShowAs(Pos pos, Exp<A> exp, String name) {
      super(pos, Op.SHOW_AS);
      this.exp = requireNonNull(exp);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(exp, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ShowAs
              && exp.equals(((ShowAs<?>) o).exp)
              && name.equals(((ShowAs<?>) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("show ").append(exp, 0, 0).append(op.padded).id(name);
    }
  }

  /**
   * Declaration of a primitive set ("{@code set R}") or relation
   * ("{@code relation po}") whose value is supplied with each candidate
   * execution.
   */
  public static class Declaration<A> extends Def<A> {
    public final String name;

    Declaration(Pos pos, Op op, String name) {
      super(pos, op);
      this.name = requireNonNull(name);
      checkArgument(op == Op.SET_DECL || op == Op.RELATION_DECL);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Declaration
              && op == ((Declaration<?>) o).op
              && name.equals(((Declaration<?>) o).name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(op.padded).id(name);
    }
  }

  /** A parsed cat file. */
  public static class ParseCat<A> {
    /** Name of the model, from a string or identifier at the start of the
     * file; may be null. */
    public final @Nullable String tag;
    public final List<ParseDef<A>> defs;
    /** Directory that relative include paths are resolved against; null if
     * the file was not read from a file system. */
    public final @Nullable File directory;

    ParseCat(
        @Nullable String tag,
        ImmutableList<ParseDef<A>> defs,
        @Nullable File directory) {
      this.tag = tag;
      this.defs = requireNonNull(defs);
      this.directory = directory;
    }

    /** Converts this file back to cat source, one definition per line. */
    public String unparse() {
      final AstWriter w = new AstWriter();
      if (tag != null) {
        w.string(tag).append("\n");
      }
      defs.forEach(def -> w.append(def, 0, 0).append("\n"));
      return w.toString();
    }

    @Override
    public String toString() {
      return unparse();
    }

    @Override
    public int hashCode() {
      return Objects.hash(tag, defs);
    }

    /** Two files are equal if they have the same tag and definitions;
     * the directory is ignored. */
    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof ParseCat
              && Objects.equals(tag, ((ParseCat<?>) o).tag)
              && defs.equals(((ParseCat<?>) o).defs);
    }
  }
}

// End Ast.java

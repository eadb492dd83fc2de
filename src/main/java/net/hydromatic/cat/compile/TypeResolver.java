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

import static net.hydromatic.cat.ast.AstBuilder.ast;

import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.type.Kind;
import net.hydromatic.cat.util.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Deduces the {@link Kind} of each expression.
 *
 * <p>Converts a tree annotated with {@link Unit} into one annotated with
 * {@link Kind}. Deduction never fails: where operands disagree, or a name is
 * unknown, the kind is {@link Kind#ANY}, and any real error is found when the
 * expression is evaluated.
 *
 * <p>The kind of the empty value, {@code 0} or {@code {}}, comes from its
 * context: the kind required by the operator it is an operand of, or the kind
 * of its sibling operand.
 */
public class TypeResolver {
  private TypeResolver() {}

  /** Deduces the kinds of an expression in an environment. */
  public static Ast.Exp<Kind> deduce(Ast.Exp<?> exp, Environment env) {
    return deduce(exp, env, Kind.ANY);
  }

  /** Deduces the kinds of an expression, given the kind that its context
   * requires. */
  static Ast.Exp<Kind> deduce(Ast.Exp<?> exp, Environment env,
      Kind expected) {
    switch (exp.op) {
      case EMPTY:
        return ast.empty(exp.pos, expected);

      case ID:
        final Ast.Id<?> id = (Ast.Id<?>) exp;
        final @Nullable Binding binding = env.getOpt(id.name);
        final Kind kind =
            binding == null || binding.isFunction() ? Kind.ANY : binding.kind;
        return ast.id(id.pos, kind, id.name);

      case APPLY:
        final Ast.Apply<?> apply = (Ast.Apply<?>) exp;
        final @Nullable Binding fn = env.getOpt(apply.fn);
        if (fn != null && fn.sort == Binding.Sort.BUILT_IN) {
          final Ast.Exp<Kind> arg = deduce(apply.arg, env, Kind.RELATION);
          return ast.apply(apply.pos, fn.kind, apply.fn, arg);
        }
        final Ast.Exp<Kind> arg = deduce(apply.arg, env, Kind.ANY);
        final Kind resultKind =
            fn != null && fn.sort == Binding.Sort.FUNCTION ? fn.kind : Kind.ANY;
        return ast.apply(apply.pos, resultKind, apply.fn, arg);

      case COMPL:
        final Ast.PrefixCall<?> compl = (Ast.PrefixCall<?>) exp;
        final Ast.Exp<Kind> a = deduce(compl.a, env, expected);
        return ast.compl(compl.pos, a.annotation, a);

      case INVERSE:
      case IDENTITY_UNION:
        final Ast.PostfixCall<?> postfix = (Ast.PostfixCall<?>) exp;
        return ast.unary(postfix.pos, postfix.op, Kind.RELATION,
            deduce(postfix.a, env, Kind.RELATION));

      case IDENTITY:
        final Ast.Identity<?> identity = (Ast.Identity<?>) exp;
        return ast.identity(identity.pos, Kind.RELATION,
            deduce(identity.a, env, Kind.SET));

      case CARTESIAN:
        final Ast.InfixCall<?> product = (Ast.InfixCall<?>) exp;
        return ast.cartesian(product.pos, Kind.RELATION,
            deduce(product.a0, env, Kind.SET),
            deduce(product.a1, env, Kind.SET));

      case SEQ:
        final Ast.InfixCall<?> seq = (Ast.InfixCall<?>) exp;
        return ast.seq(seq.pos, Kind.RELATION,
            deduce(seq.a0, env, Kind.RELATION),
            deduce(seq.a1, env, Kind.RELATION));

      case UNION:
      case INTER:
      case DIFF:
        final Ast.InfixCall<?> call = (Ast.InfixCall<?>) exp;
        final Ast.Exp<Kind> a0 = deduce(call.a0, env, expected);
        final Ast.Exp<Kind> a1 = deduce(call.a1, env, expected);
        final Ast.Exp<Kind> a0b = rededuce(call.a0, a0, a1, env);
        final Ast.Exp<Kind> a1b = rededuce(call.a1, a1, a0b, env);
        return ast.infixCall(call.pos, call.op,
            a0b.annotation.unify(a1b.annotation), a0b, a1b);

      case LET:
        final Ast.Let<?> let = (Ast.Let<?>) exp;
        final Ast.Exp<Kind> e = deduce(let.exp, env, Kind.ANY);
        final Ast.Exp<Kind> body =
            deduce(let.body, env.bind(Binding.local(let.name, e.annotation)),
                expected);
        return ast.let(let.pos, body.annotation, let.name, e, body);

      case TRY_WITH:
        final Ast.TryWith<?> tryWith = (Ast.TryWith<?>) exp;
        final Ast.Exp<Kind> e0 = deduce(tryWith.exp, env, expected);
        final Ast.Exp<Kind> e1 = deduce(tryWith.fallback, env, expected);
        final Ast.Exp<Kind> e0b = rededuce(tryWith.exp, e0, e1, env);
        final Ast.Exp<Kind> e1b = rededuce(tryWith.fallback, e1, e0b, env);
        return ast.tryWith(tryWith.pos, e0b.annotation.unify(e1b.annotation),
            e0b, e1b);

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }

  /** If an operand's kind is unknown but its sibling's is known, deduces the
   * operand again expecting the sibling's kind. This is how an empty value
   * gets its kind, even beneath a complement, as in {@code ~0 & R}.
   *
   * @param exp Operand before deduction
   * @param deduced Operand after the first deduction
   * @param sibling The other operand, after deduction
   * @param env Environment
   */
  private static Ast.Exp<Kind> rededuce(Ast.Exp<?> exp,
      Ast.Exp<Kind> deduced, Ast.Exp<Kind> sibling, Environment env) {
    if (deduced.annotation == Kind.ANY && sibling.annotation != Kind.ANY) {
      return deduce(exp, env, sibling.annotation);
    }
    return deduced;
  }
}

// End TypeResolver.java

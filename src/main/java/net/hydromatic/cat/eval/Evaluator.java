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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.ast.Op;
import net.hydromatic.cat.ast.Pos;
import net.hydromatic.cat.compile.Binding;
import net.hydromatic.cat.compile.BuiltIn;
import net.hydromatic.cat.compile.Environment;
import net.hydromatic.cat.compile.Tracer;
import net.hydromatic.cat.type.Kind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates cat expressions against one candidate execution.
 *
 * <p>An evaluator is created for a particular {@link EventUniverse} and
 * {@link Primitives}, and must not be shared between threads. It remembers
 * the value of every definition it evaluates, and (if {@link Prop#MEMOIZE}
 * is set) of every sub-expression, so each is computed at most once per
 * candidate.
 *
 * <p>A recursive {@code let} group is evaluated as a least fixpoint: every
 * member starts empty, and all members are re-evaluated until none of them
 * changes. Sub-expression values are not remembered while a fixpoint is being
 * computed.
 */
public class Evaluator {
  private final EventUniverse universe;
  private final Primitives primitives;
  private final Map<Prop, Object> props;
  private final Tracer tracer;
  private final boolean memoize;
  private final Prop.ClosureAlgorithm closureAlgorithm;

  /** Values of definitions. */
  private final Map<Binding, Value> bindingValues = new IdentityHashMap<>();
  /** Current values of the members of the recursive groups whose fixpoints
   * are being computed. */
  private final Map<Binding, Value> approximations = new IdentityHashMap<>();
  /** Values of sub-expressions. */
  private final Map<MemoKey, Value> memo = new HashMap<>();
  /** Number of fixpoints being computed. */
  private int fixpointDepth;

  public Evaluator(EventUniverse universe, Primitives primitives,
      Map<Prop, Object> props, Tracer tracer) {
    this.universe = requireNonNull(universe);
    this.primitives = requireNonNull(primitives);
    this.props = requireNonNull(props);
    this.tracer = requireNonNull(tracer);
    checkArgument(primitives.universe == universe,
        "primitives are over a different universe");
    this.memoize = Prop.MEMOIZE.booleanValue(props);
    this.closureAlgorithm =
        Prop.CLOSURE_ALGORITHM.enumValue(props,
            Prop.ClosureAlgorithm.class);
  }

  public EventUniverse universe() {
    return universe;
  }

  /** Evaluates an expression in a given environment.
   *
   * @throws EvalException if the expression refers to something that is not
   *   defined, or applies an operator to a value of the wrong kind */
  public Value evaluate(Ast.Exp<Kind> exp, Environment env) {
    return eval(exp, env, EvalEnvs.empty());
  }

  /** Returns the value of a name in a given environment. */
  public Value valueOf(String name, Environment env) {
    final @Nullable Binding binding = env.getOpt(name);
    if (binding == null) {
      throw EvalException.unboundName(name, Pos.ZERO);
    }
    return valueOf(binding, Pos.ZERO);
  }

  private Value eval(Ast.Exp<Kind> exp, Environment env, EvalEnv locals) {
    if (!memoize
        || fixpointDepth > 0
        || exp instanceof Ast.Id
        || exp instanceof Ast.Empty) {
      return eval2(exp, env, locals);
    }
    final MemoKey key = new MemoKey(exp, env, locals);
    final @Nullable Value value = memo.get(key);
    if (value != null) {
      return value;
    }
    final Value value2 = eval2(exp, env, locals);
    memo.put(key, value2);
    return value2;
  }

  private Value eval2(Ast.Exp<Kind> exp, Environment env, EvalEnv locals) {
    switch (exp.op) {
      case EMPTY:
        return Value.empty(universe, exp.annotation.orElse(Kind.RELATION));

      case ID:
        return lookup(((Ast.Id<Kind>) exp).name, exp.pos, env, locals);

      case APPLY:
        return apply((Ast.Apply<Kind>) exp, env, locals);

      case COMPL:
        return eval(((Ast.PrefixCall<Kind>) exp).a, env, locals).complement();

      case INVERSE:
        final Ast.PostfixCall<Kind> inverse = (Ast.PostfixCall<Kind>) exp;
        return relation(eval(inverse.a, env, locals), "operand of ^-1",
            inverse.pos).inverse();

      case IDENTITY_UNION:
        final Ast.PostfixCall<Kind> opt = (Ast.PostfixCall<Kind>) exp;
        return relation(eval(opt.a, env, locals), "operand of ?", opt.pos)
            .identityUnion();

      case IDENTITY:
        final Ast.Identity<Kind> identity = (Ast.Identity<Kind>) exp;
        return Relation.identity(
            set(eval(identity.a, env, locals), "operand of [ ]",
                identity.pos));

      case CARTESIAN:
        final Ast.InfixCall<Kind> product = (Ast.InfixCall<Kind>) exp;
        return Relation.cartesian(
            set(eval(product.a0, env, locals), "left operand of *",
                product.pos),
            set(eval(product.a1, env, locals), "right operand of *",
                product.pos));

      case SEQ:
        final Ast.InfixCall<Kind> seq = (Ast.InfixCall<Kind>) exp;
        final Relation r0 =
            relation(eval(seq.a0, env, locals), "left operand of ;", seq.pos);
        final Relation r1 =
            relation(eval(seq.a1, env, locals), "right operand of ;", seq.pos);
        return r0.compose(r1);

      case UNION:
      case INTER:
      case DIFF:
        return setOp((Ast.InfixCall<Kind>) exp, env, locals);

      case LET:
        final Ast.Let<Kind> let = (Ast.Let<Kind>) exp;
        final Value value = eval(let.exp, env, locals);
        return eval(let.body, env, locals.bind(let.name, value));

      case TRY_WITH:
        final Ast.TryWith<Kind> tryWith = (Ast.TryWith<Kind>) exp;
        try {
          return eval(tryWith.exp, env, locals);
        } catch (EvalException e) {
          if (e.kind == EvalException.Kind.NO_FIXPOINT) {
            throw e;
          }
          return eval(tryWith.fallback, env, locals);
        }

      default:
        throw new AssertionError("unknown op " + exp.op);
    }
  }

  /** Evaluates union, intersection or difference. The operands must have
   * the same kind; an empty operand of unknown kind takes the kind of the
   * other. */
  private Value setOp(Ast.InfixCall<Kind> call, Environment env,
      EvalEnv locals) {
    final Value v0;
    final Value v1;
    if (isUntypedConstant(call.a0)) {
      v1 = eval(call.a1, env, locals);
      v0 = constant(call.a0, v1.kind());
    } else if (isUntypedConstant(call.a1)) {
      v0 = eval(call.a0, env, locals);
      v1 = constant(call.a1, v0.kind());
    } else {
      v0 = eval(call.a0, env, locals);
      v1 = eval(call.a1, env, locals);
    }
    if (v0.kind() != v1.kind()) {
      throw EvalException.typeMismatch(
          "operands of '" + call.op.padded.trim() + "'", v0.kind(),
          v1.kind(), call.pos);
    }
    switch (call.op) {
      case UNION:
        return v0.union(v1);
      case INTER:
        return v0.intersect(v1);
      case DIFF:
        return v0.minus(v1);
      default:
        throw new AssertionError(call.op);
    }
  }

  /** Whether an expression is a constant whose kind was not known when the
   * model was resolved: {@code 0}, or the complement of such a constant. */
  private static boolean isUntypedConstant(Ast.Exp<Kind> exp) {
    if (exp.annotation != Kind.ANY) {
      return false;
    }
    switch (exp.op) {
      case EMPTY:
        return true;
      case COMPL:
        return isUntypedConstant(((Ast.PrefixCall<Kind>) exp).a);
      default:
        return false;
    }
  }

  /** Evaluates an untyped constant as a value of a given kind. */
  private Value constant(Ast.Exp<Kind> exp, Kind kind) {
    if (exp.op == Op.COMPL) {
      return constant(((Ast.PrefixCall<Kind>) exp).a, kind).complement();
    }
    return Value.empty(universe, kind);
  }

  private Value apply(Ast.Apply<Kind> apply, Environment env,
      EvalEnv locals) {
    if (locals.getOpt(apply.fn) != null) {
      throw EvalException.notAFunction(apply.fn, apply.pos);
    }
    final @Nullable Binding binding = env.getOpt(apply.fn);
    if (binding == null) {
      throw EvalException.unboundName(apply.fn, apply.pos);
    }
    switch (binding.sort) {
      case BUILT_IN:
        final BuiltIn builtIn = requireNonNull(BuiltIn.lookup(binding.name));
        final Relation r =
            relation(eval(apply.arg, env, locals),
                "argument of " + builtIn.mlName, apply.pos);
        switch (builtIn) {
          case DOMAIN:
            return r.domain();
          case RANGE:
            return r.range();
          default:
            throw new AssertionError(builtIn);
        }

      case FUNCTION:
        final Value arg = eval(apply.arg, env, locals);
        return eval(requireNonNull(binding.exp), binding.env(),
            EvalEnvs.empty().bind(requireNonNull(binding.param), arg));

      default:
        throw EvalException.notAFunction(apply.fn, apply.pos);
    }
  }

  private Value lookup(String name, Pos pos, Environment env,
      EvalEnv locals) {
    final @Nullable Value value = locals.getOpt(name);
    if (value != null) {
      return value;
    }
    final @Nullable Binding binding = env.getOpt(name);
    if (binding == null) {
      throw EvalException.unboundName(name, pos);
    }
    return valueOf(binding, pos);
  }

  private Value valueOf(Binding binding, Pos pos) {
    switch (binding.sort) {
      case PRIMITIVE:
        return primitive(binding, pos);

      case FUNCTION:
      case BUILT_IN:
        throw new EvalException(EvalException.Kind.TYPE_MISMATCH,
            binding.name,
            "'" + binding.name + "' is a function, not a set or relation",
            pos);

      case VALUE:
      case CLOSURE:
        final @Nullable Value approximation = approximations.get(binding);
        if (approximation != null) {
          return approximation;
        }
        final @Nullable Value value = bindingValues.get(binding);
        if (value != null) {
          return value;
        }
        if (binding.recursive) {
          fixpoint(binding);
          return requireNonNull(bindingValues.get(binding));
        }
        final Value value2 = compute(binding);
        bindingValues.put(binding, value2);
        tracer.onValue(binding.name, value2);
        return value2;

      default:
        throw EvalException.unboundName(binding.name, pos);
    }
  }

  /** Computes the value of a non-recursive definition. */
  private Value compute(Binding binding) {
    final Ast.Exp<Kind> exp = requireNonNull(binding.exp);
    final Value value = eval(exp, binding.env(), EvalEnvs.empty());
    if (binding.sort != Binding.Sort.CLOSURE) {
      return value;
    }
    final Relation r = relation(value, "operand of closure", exp.pos);
    final Ast.ClosureDef<Kind> def =
        (Ast.ClosureDef<Kind>) requireNonNull(binding.def);
    return def.isReflexive()
        ? r.reflexiveTransitiveClosure(closureAlgorithm)
        : r.transitiveClosure(closureAlgorithm);
  }

  /** Returns the value of a primitive. A set that the candidate does not
   * supply is the class of events with the same name, if the universe has
   * one. */
  private Value primitive(Binding binding, Pos pos) {
    final @Nullable Value value = primitives.get(binding.name);
    if (value == null) {
      if (binding.kind == Kind.SET) {
        final @Nullable EventSet classSet = universe.classSet(binding.name);
        if (classSet != null) {
          return classSet;
        }
      }
      throw EvalException.unboundPrimitive(binding.name, pos);
    }
    if (binding.kind != Kind.ANY && value.kind() != binding.kind) {
      throw EvalException.typeMismatch("primitive '" + binding.name + "'",
          binding.kind, value.kind(), pos);
    }
    return value;
  }

  /** Computes the least fixpoint of the recursive group that a binding
   * belongs to, and stores the value of each member. */
  private void fixpoint(Binding binding) {
    final Ast.LetDef<Kind> def =
        (Ast.LetDef<Kind>) requireNonNull(binding.def);
    final List<Binding> group = new ArrayList<>();
    for (Ast.ValBind<Kind> bind : def.binds) {
      group.add(requireNonNull(binding.env().getOpt(bind.name)));
    }
    final int limit = fixpointLimit(group.size());
    for (Binding member : group) {
      approximations.put(member,
          Value.empty(universe, member.kind.orElse(Kind.RELATION)));
    }
    ++fixpointDepth;
    try {
      for (int round = 1;; round++) {
        if (round > limit) {
          throw EvalException.noFixpoint(binding.name, limit, def.pos);
        }
        final List<Value> values = new ArrayList<>();
        for (Binding member : group) {
          values.add(
              eval(requireNonNull(member.exp), member.env(),
                  EvalEnvs.empty()));
        }
        boolean changed = false;
        for (int i = 0; i < group.size(); i++) {
          final Value previous = approximations.put(group.get(i),
              values.get(i));
          if (!values.get(i).equals(previous)) {
            changed = true;
          }
        }
        if (!changed) {
          break;
        }
      }
      for (Binding member : group) {
        final Value value = requireNonNull(approximations.get(member));
        bindingValues.put(member, value);
        tracer.onValue(member.name, value);
      }
    } finally {
      --fixpointDepth;
      group.forEach(approximations::remove);
    }
  }

  /** Returns the maximum number of rounds for a fixpoint. Each round that
   * changes something adds at least one pair to one member of the group, so
   * a monotonic definition converges within this limit. */
  private int fixpointLimit(int groupSize) {
    final @Nullable Object limit = Prop.FIXPOINT_LIMIT.get(props);
    if (limit != null) {
      return (Integer) limit;
    }
    final int n = universe.size();
    return groupSize * n * n + 1;
  }

  private static Relation relation(Value value, String description,
      Pos pos) {
    if (value instanceof Relation) {
      return (Relation) value;
    }
    throw EvalException.typeMismatch(description, Kind.RELATION,
        value.kind(), pos);
  }

  private static EventSet set(Value value, String description, Pos pos) {
    if (value instanceof EventSet) {
      return (EventSet) value;
    }
    throw EvalException.typeMismatch(description, Kind.SET, value.kind(),
        pos);
  }

  /** Key for the memo of sub-expression values. Compares the expression and
   * environments by identity. */
  private static final class MemoKey {
    final Ast.Exp<Kind> exp;
    final Environment env;
    final EvalEnv locals;

    MemoKey(Ast.Exp<Kind> exp, Environment env, EvalEnv locals) {
      this.exp = exp;
      this.env = env;
      this.locals = locals;
    }

    @Override
    public int hashCode() {
      return (System.identityHashCode(exp) * 31
          + System.identityHashCode(env)) * 31
          + System.identityHashCode(locals);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof MemoKey
              && exp == ((MemoKey) o).exp
              && env == ((MemoKey) o).env
              && locals == ((MemoKey) o).locals;
    }
  }
}

// End Evaluator.java

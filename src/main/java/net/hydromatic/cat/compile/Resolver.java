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
import static net.hydromatic.cat.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.ast.Op;
import net.hydromatic.cat.type.Kind;
import net.hydromatic.cat.util.Unit;

/**
 * Resolves the names in a parsed cat file, producing a {@link CatModel}.
 *
 * <p>Definitions are processed in order, each in the environment left by the
 * previous ones. A {@code let} group is resolved in two phases: first all of
 * its names are declared, then each expression is checked in the environment
 * that contains the whole group, so members may refer to each other. A
 * closure definition cannot see the name it defines; a function body sees its
 * parameter.
 *
 * <p>An unbound name is an error, except inside the first operand of
 * {@code try ... with}; such names are looked up at evaluation time.
 */
public class Resolver {
  private final Environment base;
  private final List<File> searchPath;
  private final Tracer tracer;

  private Resolver(Environment base, List<File> searchPath, Tracer tracer) {
    this.base = requireNonNull(base);
    this.searchPath = ImmutableList.copyOf(searchPath);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a resolver.
   *
   * @param base Environment that the model's definitions are added to
   * @param searchPath Directories in which to look for included files that
   *     are not found relative to the including file
   * @param tracer Tracer
   */
  public static Resolver of(Environment base, List<File> searchPath,
      Tracer tracer) {
    return new Resolver(base, searchPath, tracer);
  }

  /** Resolves a parsed file. */
  public CatModel resolve(Ast.ParseCat<Unit> parseCat) {
    final List<Ast.Def<Unit>> defs =
        new Includer(searchPath, tracer).expand(parseCat);
    final State state = new State(base);
    for (Ast.Def<Unit> def : defs) {
      state.define(def);
    }
    return new CatModel(parseCat.tag, ImmutableList.copyOf(state.defs),
        state.env, ImmutableList.copyOf(state.axioms), state.output);
  }

  /** Resolves an axiom that is not part of a model, in a given
   * environment. */
  public static CatModel.ScopedAxiom resolveAxiom(Ast.Axiom<?> axiom,
      Environment env) {
    checkNames(axiom.exp, env, false);
    final Ast.Exp<Kind> exp = TypeResolver.deduce(axiom.exp, env);
    return new CatModel.ScopedAxiom(ast.axiom(axiom, exp), env);
  }

  /** Throws if an expression contains an unbound name.
   *
   * @param deferred Whether the expression is the first operand of a
   *     {@code try}, in which case unbound names are allowed */
  static void checkNames(Ast.Exp<?> exp, Environment env, boolean deferred) {
    switch (exp.op) {
      case ID:
        final Ast.Id<?> id = (Ast.Id<?>) exp;
        if (!deferred && env.getOpt(id.name) == null) {
          throw new ResolveException(ResolveException.Kind.UNBOUND_NAME,
              id.name, id.pos);
        }
        return;

      case APPLY:
        final Ast.Apply<?> apply = (Ast.Apply<?>) exp;
        if (!deferred && env.getOpt(apply.fn) == null) {
          throw new ResolveException(ResolveException.Kind.UNBOUND_NAME,
              apply.fn, apply.pos);
        }
        checkNames(apply.arg, env, deferred);
        return;

      case LET:
        final Ast.Let<?> let = (Ast.Let<?>) exp;
        checkNames(let.exp, env, deferred);
        checkNames(let.body, env.bind(Binding.local(let.name, Kind.ANY)),
            deferred);
        return;

      case TRY_WITH:
        final Ast.TryWith<?> tryWith = (Ast.TryWith<?>) exp;
        checkNames(tryWith.exp, env, true);
        checkNames(tryWith.fallback, env, deferred);
        return;

      default:
        exp.forEachArg((arg, i) -> checkNames(arg, env, deferred));
    }
  }

  /** Adds to {@code names} each name that occurs free in an expression. */
  static void freeNames(Ast.Exp<?> exp, Set<String> bound,
      Set<String> names) {
    switch (exp.op) {
      case ID:
        final String name = ((Ast.Id<?>) exp).name;
        if (!bound.contains(name)) {
          names.add(name);
        }
        return;

      case APPLY:
        final Ast.Apply<?> apply = (Ast.Apply<?>) exp;
        if (!bound.contains(apply.fn)) {
          names.add(apply.fn);
        }
        freeNames(apply.arg, bound, names);
        return;

      case LET:
        final Ast.Let<?> let = (Ast.Let<?>) exp;
        freeNames(let.exp, bound, names);
        final Set<String> bound2 = new HashSet<>(bound);
        bound2.add(let.name);
        freeNames(let.body, bound2, names);
        return;

      default:
        exp.forEachArg((arg, i) -> freeNames(arg, bound, names));
    }
  }

  /** Work space for resolving the definitions of one model. */
  private static class State {
    Environment env;
    OutputController output = OutputController.EMPTY;
    final List<Ast.Def<Kind>> defs = new ArrayList<>();
    final List<CatModel.ScopedAxiom> axioms = new ArrayList<>();
    /** Names declared by "set" and "relation" in this model. */
    final Set<String> primitiveNames = new HashSet<>();

    State(Environment env) {
      this.env = env;
    }

    void define(Ast.Def<Unit> def) {
      switch (def.op) {
        case LET_DEF:
          defineGroup((Ast.LetDef<Unit>) def);
          return;

        case TCLOSURE_DEF:
        case RTCLOSURE_DEF:
          final Ast.ClosureDef<Unit> closureDef = (Ast.ClosureDef<Unit>) def;
          checkNames(closureDef.exp, env, false);
          final Ast.ClosureDef<Kind> closureDef2 =
              ast.closureDef(closureDef.pos, closureDef.isReflexive(),
                  closureDef.name,
                  TypeResolver.deduce(closureDef.exp, env, Kind.RELATION));
          defs.add(closureDef2);
          env = env.bind(Binding.closure(closureDef2, env));
          return;

        case FN_DEF:
          final Ast.FnDef<Unit> fnDef = (Ast.FnDef<Unit>) def;
          final Ast.Param<Unit> param = fnDef.param();
          final Environment fnEnv =
              env.bind(Binding.local(param.name, Kind.ANY));
          checkNames(fnDef.body, fnEnv, false);
          final Ast.FnDef<Kind> fnDef2 =
              ast.fnDef(fnDef.pos, fnDef.name,
                  ImmutableList.of(ast.param(param.pos, param.name, Kind.ANY)),
                  TypeResolver.deduce(fnDef.body, fnEnv));
          defs.add(fnDef2);
          env = env.bind(Binding.function(fnDef2, env));
          return;

        case CHECK_DEF:
        case FLAG_DEF:
          final CatModel.ScopedAxiom axiom =
              resolveAxiom((Ast.Axiom<Unit>) def, env);
          defs.add(axiom.axiom);
          axioms.add(axiom);
          return;

        case SHOW:
        case UNSHOW:
          final Ast.ShowDef<Unit> showDef = (Ast.ShowDef<Unit>) def;
          for (String name : showDef.names) {
            final Binding binding = env.getOpt(name);
            if (binding == null) {
              throw new ResolveException(ResolveException.Kind.UNBOUND_NAME,
                  name, showDef.pos);
            }
            output = def.op == Op.SHOW
                ? output.show(name, ast.id(showDef.pos, binding.kind, name),
                    env)
                : output.unshow(name);
          }
          defs.add(def.op == Op.SHOW
              ? ast.show(showDef.pos, showDef.names)
              : ast.unshow(showDef.pos, showDef.names));
          return;

        case SHOW_AS:
          final Ast.ShowAs<Unit> showAs = (Ast.ShowAs<Unit>) def;
          checkNames(showAs.exp, env, false);
          final Ast.Exp<Kind> shown = TypeResolver.deduce(showAs.exp, env);
          output = output.show(showAs.name, shown, env);
          defs.add(ast.showAs(showAs.pos, shown, showAs.name));
          return;

        case SET_DECL:
        case RELATION_DECL:
          final Ast.Declaration<Unit> declaration =
              (Ast.Declaration<Unit>) def;
          if (!primitiveNames.add(declaration.name)) {
            throw new ResolveException(
                ResolveException.Kind.DUPLICATE_BINDING, declaration.name,
                declaration.pos);
          }
          final Kind kind = def.op == Op.SET_DECL ? Kind.SET : Kind.RELATION;
          defs.add(def.op == Op.SET_DECL
              ? ast.declareSet(declaration.pos, declaration.name)
              : ast.declareRelation(declaration.pos, declaration.name));
          env = env.bind(Binding.primitive(declaration.name, kind));
          return;

        default:
          throw new AssertionError("unknown definition " + def.op);
      }
    }

    /** Defines the bindings of a {@code let} group. */
    private void defineGroup(Ast.LetDef<Unit> letDef) {
      final Set<String> names = new LinkedHashSet<>();
      for (Ast.ValBind<Unit> bind : letDef.binds) {
        if (!names.add(bind.name)) {
          throw new ResolveException(ResolveException.Kind.DUPLICATE_BINDING,
              bind.name, bind.pos);
        }
      }

      // A plain "let" of one name that is already bound extends the earlier
      // value: "let r = r | x" sees the previous "r", not itself.
      final boolean extension = !letDef.rec
          && letDef.binds.size() == 1
          && env.getOpt(letDef.binds.get(0).name) != null;

      // Phase 1. Declare every name, then check each expression.
      final List<Binding> declared = new ArrayList<>();
      names.forEach(name -> declared.add(Binding.local(name, Kind.ANY)));
      final Environment groupEnv = extension ? env : env.bindAll(declared);
      final Set<String> free = new HashSet<>();
      for (Ast.ValBind<Unit> bind : letDef.binds) {
        checkNames(bind.exp, groupEnv, false);
        freeNames(bind.exp, new HashSet<>(), free);
      }
      free.retainAll(names);
      final boolean recursive = !extension && !free.isEmpty();

      // Phase 2. Deduce kinds. The first pass assumes nothing about the
      // kinds of the group's members; the second uses what the first found.
      List<Ast.Exp<Kind>> exps = deduceAll(letDef, groupEnv);
      if (recursive) {
        final List<Binding> typed = new ArrayList<>();
        for (int i = 0; i < exps.size(); i++) {
          typed.add(declared.get(i).withKind(exps.get(i).annotation));
        }
        exps = deduceAll(letDef, env.bindAll(typed));
      }

      final List<Ast.ValBind<Kind>> binds = new ArrayList<>();
      for (int i = 0; i < exps.size(); i++) {
        final Ast.ValBind<Unit> bind = letDef.binds.get(i);
        binds.add(ast.valBind(bind.pos, bind.name, exps.get(i)));
      }
      final Ast.LetDef<Kind> letDef2 =
          ast.letDef(letDef.pos, binds, letDef.rec);
      defs.add(letDef2);

      final List<Binding> bindings = new ArrayList<>();
      for (Ast.ValBind<Kind> bind : binds) {
        bindings.add(Binding.value(bind.name, bind.exp, recursive, letDef2));
      }
      // A non-recursive group is evaluated in the environment before it.
      final Environment outer = env;
      env = env.bindAll(bindings);
      final Environment bodyEnv = recursive ? env : outer;
      bindings.forEach(binding -> binding.attach(bodyEnv));
    }

    private static List<Ast.Exp<Kind>> deduceAll(Ast.LetDef<Unit> letDef,
        Environment env) {
      final List<Ast.Exp<Kind>> exps = new ArrayList<>();
      for (Ast.ValBind<Unit> bind : letDef.binds) {
        exps.add(TypeResolver.deduce(bind.exp, env));
      }
      return exps;
    }
  }
}

// End Resolver.java

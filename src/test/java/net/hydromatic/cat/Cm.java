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
package net.hydromatic.cat;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.cat.Matchers.isAst;
import static net.hydromatic.cat.Matchers.throwsA;
import static org.hamcrest.CoreMatchers.hasItems;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.File;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.ast.AstNode;
import net.hydromatic.cat.ast.Pos;
import net.hydromatic.cat.check.CandidateReport;
import net.hydromatic.cat.compile.CatModel;
import net.hydromatic.cat.compile.Environment;
import net.hydromatic.cat.compile.Environments;
import net.hydromatic.cat.compile.ResolveException;
import net.hydromatic.cat.compile.Tracer;
import net.hydromatic.cat.compile.Tracers;
import net.hydromatic.cat.eval.EvalException;
import net.hydromatic.cat.eval.Evaluator;
import net.hydromatic.cat.eval.EventUniverse;
import net.hydromatic.cat.eval.Primitives;
import net.hydromatic.cat.eval.Prop;
import net.hydromatic.cat.eval.Value;
import net.hydromatic.cat.parse.CatParseException;
import net.hydromatic.cat.parse.Parsers;
import net.hydromatic.cat.util.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Cm {
  private final String cat;
  private final @Nullable Pos pos;
  private final Environment env;
  private final List<File> searchPath;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;
  private final @Nullable Primitives primitives;

  Cm(String cat, @Nullable Pos pos, Environment env, List<File> searchPath,
      Map<Prop, Object> propMap, Tracer tracer,
      @Nullable Primitives primitives) {
    this.cat = cat;
    this.pos = pos;
    this.env = env;
    this.searchPath = ImmutableList.copyOf(searchPath);
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = tracer;
    this.primitives = primitives;
  }

  /** Creates a {@code Cm}. */
  static Cm cat(String cat) {
    return new Cm(cat, null, Environments.empty(), ImmutableList.of(),
        ImmutableMap.of(), Tracers.empty(), null);
  }

  /** Creates a {@code Cm} containing an error position delimited by '$'. */
  static Cm catE(String cat) {
    final Map.Entry<String, Pos> pair = Pos.split(cat, '$', "");
    return new Cm(pair.getKey(), pair.getValue(), Environments.empty(),
        ImmutableList.of(), ImmutableMap.of(), Tracers.empty(), null);
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  static void assertError(Runnable runnable, Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  Cm withEnv(Environment env) {
    return new Cm(cat, pos, env, searchPath, propMap, tracer, primitives);
  }

  Cm withSearchPath(File... directories) {
    return new Cm(cat, pos, env, ImmutableList.copyOf(directories), propMap,
        tracer, primitives);
  }

  Cm withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Cm(cat, pos, env, searchPath, map, tracer, primitives);
  }

  Cm withTracer(Tracer tracer) {
    return new Cm(cat, pos, env, searchPath, propMap, tracer, primitives);
  }

  /** Returns a helper that evaluates against a given candidate execution. */
  Cm withCandidate(Primitives primitives) {
    return new Cm(cat, pos, env, searchPath, propMap, tracer, primitives);
  }

  private Primitives primitives() {
    return requireNonNull(primitives, "no candidate; call withCandidate");
  }

  // -- Parsing --------------------------------------------------------------

  /** Checks that the text parses as an expression that matches. */
  @CanIgnoreReturnValue
  Cm assertParseExp(Matcher<? super Ast.Exp<Unit>> matcher) {
    assertThat(Parsers.parseExp(cat), matcher);
    return this;
  }

  /** Checks that the text parses as an expression and returns the given
   * string when unparsed. */
  @CanIgnoreReturnValue
  Cm assertParseExp(String expected) {
    return assertParseExp(isAst(AstNode.class, expected));
  }

  /** Checks that the text parses as an expression, and that unparsing it
   * yields the same text, which parses to an equal tree. */
  @CanIgnoreReturnValue
  Cm assertParseExpSame() {
    final Ast.Exp<Unit> exp = Parsers.parseExp(cat);
    assertThat(exp.toString(), is(cat));
    assertThat(Parsers.parseExp(exp.toString()), is(exp));
    return this;
  }

  /** Checks that the text parses as a file and returns the given string
   * when unparsed. */
  @CanIgnoreReturnValue
  Cm assertParse(String expected) {
    final Ast.ParseCat<Unit> parseCat = Parsers.parse(cat, null);
    assertThat(parseCat.unparse(), is(expected));
    assertThat(Parsers.parse(parseCat.unparse(), null), is(parseCat));
    return this;
  }

  /** Checks that the text parses as a file and unparses to the same text,
   * with a newline after each definition. */
  @CanIgnoreReturnValue
  Cm assertParseSame() {
    return assertParse(cat);
  }

  /** Checks that parsing the text as a file throws a
   * {@link CatParseException} with a given message and, if the text was
   * created with {@link #catE}, position. */
  @CanIgnoreReturnValue
  Cm assertParseThrows(String message) {
    assertError(() -> Parsers.parse(cat, null),
        throwsA(CatParseException.class, message, pos));
    return this;
  }

  /** Checks that parsing the text as a file fails at an unexpected token,
   * that the message starts with a given prefix, and that the tokens the
   * parser would have accepted include the given ones. */
  @CanIgnoreReturnValue
  Cm assertParseThrowsExpecting(String prefix, String... expected) {
    try {
      Parsers.parse(cat, null);
      fail("expected error");
    } catch (CatParseException e) {
      assertThat(e.getMessage(), startsWith(prefix));
      assertThat(e.pos(), is(requireNonNull(pos)));
      assertThat(e.expected, hasItems(expected));
    }
    return this;
  }

  // -- Resolution -----------------------------------------------------------

  CatModel model() {
    return Cat.resolve(Parsers.parse(cat, null), env, searchPath, propMap,
        tracer);
  }

  @CanIgnoreReturnValue
  Cm withModel(Consumer<CatModel> action) {
    action.accept(model());
    return this;
  }

  /** Checks that the model resolves, and its definitions unparse to the
   * given string. */
  @CanIgnoreReturnValue
  Cm assertModel(String expected) {
    return withModel(model -> assertThat(model.toString(), is(expected)));
  }

  /** Checks that resolving the model throws a {@link ResolveException}. */
  @CanIgnoreReturnValue
  Cm assertResolveThrows(ResolveException.Kind kind, String name) {
    try {
      final CatModel model = model();
      fail("expected error, got " + model);
    } catch (ResolveException e) {
      assertThat(e.kind, is(kind));
      assertThat(e.name, is(name));
      if (pos != null) {
        assertThat(e.pos(), is(pos));
      }
    }
    return this;
  }

  // -- Evaluation -----------------------------------------------------------

  private Evaluator evaluator() {
    final Primitives primitives = primitives();
    return new Evaluator(primitives.universe, primitives, propMap, tracer);
  }

  /** Checks the value of a definition of the model. */
  @CanIgnoreReturnValue
  Cm assertValue(String name, Matcher<Value> matcher) {
    final CatModel model = model();
    assertThat(evaluator().valueOf(name, model.env), matcher);
    return this;
  }

  /** Checks the string representation of the value of a definition. */
  @CanIgnoreReturnValue
  Cm assertValue(String name, String expected) {
    final CatModel model = model();
    assertThat(evaluator().valueOf(name, model.env).toString(),
        is(expected));
    return this;
  }

  /** Checks that evaluating a definition throws an {@link EvalException}
   * of a given kind. */
  @CanIgnoreReturnValue
  Cm assertValueThrows(String name, EvalException.Kind kind,
      String message) {
    final CatModel model = model();
    final Evaluator evaluator = evaluator();
    try {
      final Value value = evaluator.valueOf(name, model.env);
      fail("expected error, got " + value);
    } catch (EvalException e) {
      assertThat(e.kind, is(kind));
      assertThat(e.getMessage(), is(message));
    }
    return this;
  }

  /** Checks the model against the candidate, and passes the report to an
   * action. */
  @CanIgnoreReturnValue
  Cm withReport(Consumer<CandidateReport> action) {
    final Primitives primitives = primitives();
    action.accept(
        Cat.check(model(), primitives.universe, primitives, propMap,
            tracer));
    return this;
  }

  /** Checks whether the candidate satisfies the model. */
  @CanIgnoreReturnValue
  Cm assertConsistent(boolean consistent) {
    return withReport(report ->
        assertThat(report.toString(), report.isConsistent(),
            is(consistent)));
  }

  // -- Candidates -----------------------------------------------------------

  /** Creates a universe of events. Each argument is an event name followed
   * by the names of its classes, separated by colons; for example
   * {@code "e1:R:M"}. */
  static EventUniverse universe(String... events) {
    final EventUniverse.Builder b = EventUniverse.builder();
    for (String event : events) {
      final String[] parts = event.split(":");
      final String[] classes = new String[parts.length - 1];
      System.arraycopy(parts, 1, classes, 0, classes.length);
      b.event(parts[0], classes);
    }
    return b.build();
  }
}

// End Cm.java

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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.check.AxiomChecker;
import net.hydromatic.cat.check.CandidateReport;
import net.hydromatic.cat.check.Verdict;
import net.hydromatic.cat.compile.CatModel;
import net.hydromatic.cat.compile.Environment;
import net.hydromatic.cat.compile.Environments;
import net.hydromatic.cat.compile.Resolver;
import net.hydromatic.cat.compile.Tracer;
import net.hydromatic.cat.compile.Tracers;
import net.hydromatic.cat.eval.Evaluator;
import net.hydromatic.cat.eval.EventUniverse;
import net.hydromatic.cat.eval.Primitives;
import net.hydromatic.cat.eval.Prop;
import net.hydromatic.cat.parse.Parsers;
import net.hydromatic.cat.util.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry points for loading a cat model and checking candidate executions
 * against it.
 *
 * <p>A typical use parses a file, resolves it against an environment that
 * declares the primitive sets and relations, and then checks each candidate:
 *
 * <blockquote><pre>
 * CatModel model = Cat.resolve(Cat.parseFile(new File("tso.cat")),
 *     Environments.standard(ImmutableList.of("MFENCE")));
 * CandidateReport report = Cat.check(model, universe, primitives);
 * boolean allowed = report.isConsistent();
 * </pre></blockquote>
 */
public abstract class Cat {
  private Cat() {}

  /** Parses the text of a cat file.
   *
   * @param text Text
   * @param directory Directory against which relative includes are resolved,
   *     or null
   */
  public static Ast.ParseCat<Unit> parse(String text,
      @Nullable File directory) {
    return Parsers.parse(text, directory);
  }

  /** Reads and parses a cat file. */
  public static Ast.ParseCat<Unit> parseFile(File file) throws IOException {
    return Parsers.parseFile(file);
  }

  /** Resolves a parsed file in an environment containing only the built-in
   * functions. */
  public static CatModel resolve(Ast.ParseCat<Unit> parseCat) {
    return resolve(parseCat, Environments.empty());
  }

  /** Resolves a parsed file in a given environment. */
  public static CatModel resolve(Ast.ParseCat<Unit> parseCat,
      Environment base) {
    return resolve(parseCat, base, ImmutableList.of(), ImmutableMap.of(),
        Tracers.empty());
  }

  /** Resolves a parsed file.
   *
   * <p>If the file has no directory, includes are looked for in
   * {@link Prop#DIRECTORY} before the search path.
   */
  public static CatModel resolve(Ast.ParseCat<Unit> parseCat,
      Environment base, List<File> searchPath, Map<Prop, Object> props,
      Tracer tracer) {
    final List<File> path = new ArrayList<>();
    if (parseCat.directory == null) {
      path.add(Prop.DIRECTORY.fileValue(props));
    }
    path.addAll(searchPath);
    return Resolver.of(base, path, tracer).resolve(parseCat);
  }

  /** Checks every axiom of a model against a candidate execution. */
  public static CandidateReport check(CatModel model, EventUniverse universe,
      Primitives primitives) {
    return check(model, universe, primitives, ImmutableMap.of(),
        Tracers.empty());
  }

  /** Checks every axiom of a model against a candidate execution, with
   * given properties and tracer. */
  public static CandidateReport check(CatModel model, EventUniverse universe,
      Primitives primitives, Map<Prop, Object> props, Tracer tracer) {
    return AxiomChecker.check(model, universe, primitives, props, tracer);
  }

  /** Checks a single axiom against a candidate execution.
   *
   * <p>If the axiom is one of the model's, it is evaluated in the
   * environment where it was defined; otherwise it is evaluated in the
   * model's final environment.
   *
   * @throws net.hydromatic.cat.eval.EvalException if the axiom's expression
   *   cannot be evaluated
   */
  public static Verdict evaluateCheck(CatModel model, Ast.Axiom<?> axiom,
      EventUniverse universe, Primitives primitives) {
    return evaluateCheck(model, axiom, universe, primitives,
        ImmutableMap.of(), Tracers.empty());
  }

  /** Checks a single axiom against a candidate execution, with given
   * properties and tracer. */
  public static Verdict evaluateCheck(CatModel model, Ast.Axiom<?> axiom,
      EventUniverse universe, Primitives primitives, Map<Prop, Object> props,
      Tracer tracer) {
    final CatModel.@Nullable ScopedAxiom found = model.find(axiom);
    final CatModel.ScopedAxiom scopedAxiom = found != null
        ? found
        : Resolver.resolveAxiom(axiom, model.env);
    final Evaluator evaluator =
        new Evaluator(universe, primitives, props, tracer);
    return new AxiomChecker(evaluator, props, tracer).check(scopedAxiom);
  }
}

// End Cat.java

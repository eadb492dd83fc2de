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

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.compile.CatModel;
import net.hydromatic.cat.compile.OutputController;
import net.hydromatic.cat.compile.Tracer;
import net.hydromatic.cat.eval.EvalException;
import net.hydromatic.cat.eval.Evaluator;
import net.hydromatic.cat.eval.Event;
import net.hydromatic.cat.eval.EventUniverse;
import net.hydromatic.cat.eval.Primitives;
import net.hydromatic.cat.eval.Prop;
import net.hydromatic.cat.eval.Relation;
import net.hydromatic.cat.eval.Value;
import net.hydromatic.cat.type.Kind;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks the axioms of a model against a candidate execution.
 *
 * <ul>
 *   <li>{@code acyclic r} holds if {@code r} has no cycle, including
 *       self-loops; the witness of a violation is a cycle;
 *   <li>{@code irreflexive r} holds if no event is related to itself; the
 *       witness is such an event;
 *   <li>{@code empty v} holds if set or relation {@code v} has no members;
 *       the witness is the value;
 *   <li>each negated check holds if and only if the check it negates does
 *       not.
 * </ul>
 */
public class AxiomChecker {
  private final Evaluator evaluator;
  private final Tracer tracer;
  private final boolean witness;

  public AxiomChecker(Evaluator evaluator, Map<Prop, Object> props,
      Tracer tracer) {
    this.evaluator = requireNonNull(evaluator);
    this.tracer = requireNonNull(tracer);
    this.witness = Prop.WITNESS.booleanValue(props);
  }

  /** Checks every axiom of a model against a candidate execution, and
   * evaluates the relations the model shows. */
  public static CandidateReport check(CatModel model, EventUniverse universe,
      Primitives primitives, Map<Prop, Object> props, Tracer tracer) {
    final Evaluator evaluator =
        new Evaluator(universe, primitives, props, tracer);
    return new AxiomChecker(evaluator, props, tracer).checkAll(model);
  }

  /** Checks every axiom of a model. An axiom whose evaluation fails is
   * recorded in the report, and does not prevent the other axioms from being
   * checked. */
  public CandidateReport checkAll(CatModel model) {
    final List<Ast.Axiom<Kind>> axioms = new ArrayList<>();
    final List<Verdict> verdicts = new ArrayList<>();
    final List<CandidateReport.Failure> failures = new ArrayList<>();
    for (CatModel.ScopedAxiom axiom : model.axioms) {
      axioms.add(axiom.axiom);
      try {
        verdicts.add(check(axiom));
      } catch (EvalException e) {
        tracer.onException(e);
        failures.add(new CandidateReport.Failure(axiom.axiom, e));
      }
    }
    final Map<String, Value> shown = new LinkedHashMap<>();
    final Map<String, EvalException> showFailures = new LinkedHashMap<>();
    for (OutputController.Item item : model.output.items()) {
      try {
        final Value value = evaluator.evaluate(item.exp, item.env);
        tracer.onValue(item.name, value);
        shown.put(item.name, value);
      } catch (EvalException e) {
        tracer.onException(e);
        showFailures.put(item.name, e);
      }
    }
    return new CandidateReport(axioms, verdicts, failures, shown,
        showFailures);
  }

  /** Checks one axiom.
   *
   * @throws EvalException if the axiom's expression cannot be evaluated, or
   *   its value has the wrong kind for the check */
  public Verdict check(CatModel.ScopedAxiom scopedAxiom) {
    final Ast.Axiom<Kind> axiom = scopedAxiom.axiom;
    Verdict verdict = Verdict.pending(axiom);
    final Value value = evaluator.evaluate(axiom.exp, scopedAxiom.env);
    verdict = verdict.evaluated(value);

    final @Nullable Witness baseWitness;
    switch (axiom.check.base()) {
      case ACYCLIC:
        final @Nullable List<Event> cycle =
            Cycles.findCycle(relation(value, axiom));
        baseWitness = cycle == null ? null : Witness.cycle(cycle);
        break;
      case IRREFLEXIVE:
        final @Nullable Event event = relation(value, axiom).reflexiveEvent();
        baseWitness = event == null ? null : Witness.reflexive(event);
        break;
      case EMPTY:
        baseWitness = value.isEmpty() ? null : Witness.members(value);
        break;
      default:
        throw new AssertionError(axiom.check);
    }

    // The base check holds if there is no evidence against it.
    final boolean holds = baseWitness == null;
    final boolean satisfied = axiom.check.isNegated() ? !holds : holds;
    verdict = verdict.decide(satisfied, witness ? baseWitness : null);
    tracer.onVerdict(verdict);
    return verdict;
  }

  private static Relation relation(Value value, Ast.Axiom<Kind> axiom) {
    if (value instanceof Relation) {
      return (Relation) value;
    }
    throw new EvalException(EvalException.Kind.TYPE_MISMATCH, "",
        "operand of " + axiom.check.keyword + ": expected relation, got "
            + value.kind().description,
        axiom.exp.pos);
  }
}

// End AxiomChecker.java

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
import static net.hydromatic.cat.Cm.cat;
import static net.hydromatic.cat.Cm.universe;
import static net.hydromatic.cat.Matchers.isVerdict;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.io.File;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.check.CandidateReport;
import net.hydromatic.cat.check.Verdict;
import net.hydromatic.cat.check.Witness;
import net.hydromatic.cat.compile.CatModel;
import net.hydromatic.cat.compile.Environment;
import net.hydromatic.cat.compile.Environments;
import net.hydromatic.cat.compile.Tracer;
import net.hydromatic.cat.compile.Tracers;
import net.hydromatic.cat.eval.EvalException;
import net.hydromatic.cat.eval.EventUniverse;
import net.hydromatic.cat.eval.Primitives;
import net.hydromatic.cat.eval.Prop;
import net.hydromatic.cat.parse.Parsers;
import net.hydromatic.cat.util.Unit;
import org.junit.jupiter.api.Test;

/** Tests checking axioms against candidate executions. */
public class CheckTest {
  private static final Environment STANDARD =
      Environments.standard(ImmutableList.of("MFENCE"));

  private static final EventUniverse U = universe("a:W", "b:W", "c:R");

  /** Returns a helper that checks a model against a candidate. */
  private static Cm check(String cat, Primitives primitives) {
    return cat(cat).withEnv(STANDARD).withCandidate(primitives);
  }

  private static Primitives.Builder primitives() {
    return Primitives.builder(U);
  }

  private static Verdict onlyVerdict(CandidateReport report) {
    assertThat(report.toString(), report.verdicts, hasSize(1));
    return report.verdicts.get(0);
  }

  @Test void testAcyclic() {
    check("acyclic po", primitives().relation("po").build())
        .withReport(report -> {
          assertThat(onlyVerdict(report),
              isVerdict(Verdict.State.SATISFIED, "acyclic po: SATISFIED"));
          assertThat(report.isConsistent(), is(true));
        });
    check("acyclic po", primitives().relation("po", "b", "b").build())
        .withReport(report -> {
          assertThat(onlyVerdict(report),
              isVerdict(Verdict.State.VIOLATED,
                  "acyclic po: VIOLATED (cycle b -> b)"));
          assertThat(report.isConsistent(), is(false));
        });
    check("acyclic po as three",
        primitives().relation("po", "a", "b", "b", "c", "c", "a").build())
        .withReport(report -> {
          final Verdict verdict = onlyVerdict(report);
          assertThat(verdict,
              isVerdict(Verdict.State.VIOLATED,
                  "three: VIOLATED (cycle a -> b -> c -> a)"));
          assertThat(verdict.witness, instanceOf(Witness.Cycle.class));
          assertThat(((Witness.Cycle) requireNonNull(verdict.witness)).events,
              hasSize(3));
        });
    // a relation with no cycle, but where depth-first search meets an event
    // twice
    check("acyclic po",
        primitives().relation("po", "a", "b", "a", "c", "b", "c").build())
        .assertConsistent(true);
  }

  @Test void testIrreflexive() {
    check("irreflexive po;po",
        primitives().relation("po", "a", "b", "b", "c").build())
        .assertConsistent(true);
    check("irreflexive po;po",
        primitives().relation("po", "a", "b", "b", "a").build())
        .withReport(report ->
            assertThat(onlyVerdict(report),
                isVerdict(Verdict.State.VIOLATED,
                    "irreflexive po;po: VIOLATED (reflexive a)")));
    check("~irreflexive po;po",
        primitives().relation("po", "a", "b", "b", "a").build())
        .assertConsistent(true);
  }

  @Test void testEmptyAndNonEmpty() {
    final Primitives p =
        primitives().relation("rmw", "a", "c").relation("po").build();
    check("empty rmw", p)
        .withReport(report ->
            assertThat(onlyVerdict(report),
                isVerdict(Verdict.State.VIOLATED,
                    "empty rmw: VIOLATED (members {(a, c)})")));
    check("~empty rmw", p).assertConsistent(true);
    check("empty po", p).assertConsistent(true);
    check("~empty po", p)
        .withReport(report ->
            assertThat(onlyVerdict(report),
                isVerdict(Verdict.State.VIOLATED, "~empty po: VIOLATED")));
    // sets may be checked for emptiness too
    check("empty W & R", p).assertConsistent(true);
    check("empty W", p).assertConsistent(false);
  }

  @Test void testNegationIsComplement() {
    final List<Primitives> candidates =
        ImmutableList.of(primitives().relation("po").build(),
            primitives().relation("po", "a", "a").build(),
            primitives().relation("po", "a", "b", "b", "c").build(),
            primitives().relation("po", "a", "b", "b", "a").build());
    for (String check : ImmutableList.of("acyclic", "irreflexive", "empty")) {
      for (Primitives p : candidates) {
        final boolean[] results = new boolean[2];
        check(check + " po", p)
            .withReport(report -> results[0] = report.isConsistent());
        check("~" + check + " po", p)
            .withReport(report -> results[1] = report.isConsistent());
        assertThat(check + " " + p, results[0], is(!results[1]));
      }
    }
  }

  @Test void testCoherence() {
    final String model = "acyclic co | rf | fr | po-loc as Coherence";
    final EventUniverse u = universe("w1:W", "w2:W");
    final Primitives.Builder b =
        Primitives.builder(u)
            .relation("co", "w1", "w2")
            .relation("fr")
            .relation("po-loc");
    cat(model).withEnv(STANDARD)
        .withCandidate(b.relation("rf").build())
        .assertConsistent(true);
    final Primitives.Builder b2 =
        Primitives.builder(u)
            .relation("co", "w1", "w2")
            .relation("fr")
            .relation("po-loc");
    cat(model).withEnv(STANDARD)
        .withCandidate(b2.relation("rf", "w2", "w1").build())
        .withReport(report ->
            assertThat(onlyVerdict(report),
                isVerdict(Verdict.State.VIOLATED,
                    "Coherence: VIOLATED (cycle w1 -> w2 -> w1)")));
  }

  @Test void testFlag() {
    final String model = "flag empty rmw & (fre;coe) as Atomic";
    check(model,
        primitives()
            .relation("rmw")
            .relation("fre", "c", "b")
            .relation("coe", "b", "a")
            .build())
        .withReport(report -> {
          assertThat(onlyVerdict(report), isVerdict(Verdict.State.SATISFIED));
          assertThat(report.raisedFlags(), hasSize(0));
          assertThat(report.isConsistent(), is(true));
        });
    check(model,
        primitives()
            .relation("rmw", "c", "a")
            .relation("fre", "c", "b")
            .relation("coe", "b", "a")
            .build())
        .withReport(report -> {
          assertThat(onlyVerdict(report), isVerdict(Verdict.State.VIOLATED));
          assertThat(report.raisedFlags(), is(ImmutableList.of("Atomic")));
          // a violated flag does not make the candidate inconsistent
          assertThat(report.isConsistent(), is(true));
          assertThat(report.flags(), hasSize(1));
          assertThat(report.checks(), hasSize(0));
        });
  }

  @Test void testEvaluationErrors() {
    final List<Throwable> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnException(Tracers.empty(), exceptions::add);
    // rf is not supplied; the error affects only the axiom that uses it
    check("acyclic rf as uses-rf\nacyclic po as uses-po",
        primitives().relation("po").build())
        .withTracer(tracer)
        .withReport(report -> {
          assertThat(report.verdicts, hasSize(1));
          assertThat(report.verdicts.get(0),
              isVerdict(Verdict.State.SATISFIED, "uses-po: SATISFIED"));
          assertThat(report.failures, hasSize(1));
          final CandidateReport.Failure failure = report.failures.get(0);
          assertThat(failure.axiom.describe(), is("uses-rf"));
          assertThat(failure.exception.kind,
              is(EvalException.Kind.UNBOUND_PRIMITIVE));
          assertThat(failure,
              hasToString("uses-rf: primitive 'rf' is not supplied by the"
                  + " candidate"));
          assertThat(report.isConsistent(), is(false));
        });
    assertThat(exceptions, hasSize(1));

    // an error in a flag raises the flag, and the candidate is consistent
    check("flag empty rf as f", primitives().relation("po").build())
        .withReport(report -> {
          assertThat(report.raisedFlags(), is(ImmutableList.of("f")));
          assertThat(report.isConsistent(), is(true));
        });

    // raised flags are listed in model order, whether they were violated
    // or failed to evaluate
    check("flag empty po as violated1\n"
            + "flag empty rf as failed\n"
            + "flag empty po as violated2",
        primitives().relation("po", "a", "b").build())
        .withReport(report ->
            assertThat(report.raisedFlags(),
                is(ImmutableList.of("violated1", "failed", "violated2"))));

    // acyclic and irreflexive need a relation
    check("acyclic W", primitives().build())
        .withReport(report -> {
          assertThat(report.failures, hasSize(1));
          final EvalException e = report.failures.get(0).exception;
          assertThat(e.kind, is(EvalException.Kind.TYPE_MISMATCH));
          assertThat(e.getMessage(),
              is("operand of acyclic: expected relation, got set"));
        });
    check("~irreflexive W", primitives().build())
        .withReport(report ->
            assertThat(report.failures.get(0).exception.getMessage(),
                is("operand of ~irreflexive: expected relation, got set")));
  }

  @Test void testWitnessProp() {
    check("acyclic po", primitives().relation("po", "a", "a").build())
        .withProp(Prop.WITNESS, false)
        .withReport(report -> {
          final Verdict verdict = onlyVerdict(report);
          assertThat(verdict.state, is(Verdict.State.VIOLATED));
          assertThat(verdict.witness, nullValue());
        });
  }

  @Test void testTracer() {
    final List<String> verdicts = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnVerdict(Tracers.empty(),
            verdict -> verdicts.add(verdict.toString()));
    check("let a = po\nacyclic a as x\nirreflexive a as y",
        primitives().relation("po", "a", "b").build())
        .withTracer(tracer)
        .assertConsistent(true);
    assertThat(verdicts,
        is(ImmutableList.of("x: SATISFIED", "y: SATISFIED")));
  }

  @Test void testShow() {
    final List<Throwable> exceptions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnException(Tracers.empty(), exceptions::add);
    check("let a = po;po\nshow a\nshow po | a as both\nshow rf\nunshow a",
        primitives().relation("po", "a", "b", "b", "c").build())
        .withTracer(tracer)
        .withReport(report -> {
          assertThat(report.shown().keySet(), is(ImmutableSet.of("both")));
          assertThat(report.shown().get("both"),
              hasToString("{(a, b), (a, c), (b, c)}"));
          // rf is shown but is not supplied
          assertThat(report.showFailures.keySet(), hasSize(1));
          assertThat(report.verdicts, hasSize(0));
          assertThat(report.isConsistent(), is(true));
        });
    // the tracer sees the failure to evaluate rf
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0), instanceOf(EvalException.class));
  }

  @Test void testAxiomScope() {
    // an axiom sees the definitions before it, not later ones
    check("let a = po\nacyclic a as first\nlet a = po | po^-1\n"
            + "acyclic a as second",
        primitives().relation("po", "a", "b").build())
        .withReport(report -> {
          assertThat(report.verdicts.get(0),
              isVerdict(Verdict.State.SATISFIED));
          assertThat(report.verdicts.get(1),
              isVerdict(Verdict.State.VIOLATED,
                  "second: VIOLATED (cycle a -> b -> a)"));
        });
  }

  @Test void testEvaluateCheck() {
    final CatModel model =
        Cat.resolve(Cat.parse("let hb = po | rf\nacyclic hb as causality",
            null), STANDARD);
    final Primitives p =
        primitives().relation("po", "a", "b").relation("rf", "b", "a")
            .build();

    // an axiom of the model
    final Verdict verdict =
        Cat.evaluateCheck(model, model.axioms.get(0).axiom, U, p);
    assertThat(verdict,
        isVerdict(Verdict.State.VIOLATED,
            "causality: VIOLATED (cycle a -> b -> a)"));

    // an axiom that is not in the model sees all of its definitions
    final Ast.ParseCat<Unit> parseCat =
        Parsers.parse("irreflexive hb;hb as twice", null);
    final Ast.Axiom<Unit> axiom = (Ast.Axiom<Unit>) parseCat.defs.get(0);
    assertThat(Cat.evaluateCheck(model, axiom, U, p),
        isVerdict(Verdict.State.VIOLATED, "twice: VIOLATED (reflexive a)"));
    final Ast.Axiom<Unit> axiom2 =
        (Ast.Axiom<Unit>) Parsers.parse("~empty hb", null).defs.get(0);
    assertThat(Cat.evaluateCheck(model, axiom2, U, p),
        isVerdict(Verdict.State.SATISFIED));
  }

  /** Store buffering: each thread writes one location then reads the other,
   * and both reads see the initial values. TSO allows this outcome, and
   * sequential consistency forbids it. */
  @Test void testStoreBuffering() throws Exception {
    final EventUniverse u =
        EventUniverse.builder()
            .event("ix", "W")
            .event("iy", "W")
            .event("a", "W")
            .event("b", "R")
            .event("c", "W")
            .event("d", "R")
            .declareClass("MFENCE")
            .build();
    final Primitives p =
        Primitives.builder(u)
            .relation("po", "a", "b", "c", "d")
            .relation("po-loc")
            .relation("rf", "iy", "b", "ix", "d")
            .relation("rfe", "iy", "b", "ix", "d")
            .relation("co", "ix", "a", "iy", "c")
            .relation("coe", "ix", "a", "iy", "c")
            .relation("ext", "b", "c", "d", "a")
            .relation("rmw")
            .build();

    final CatModel sc = Cat.resolve(Cat.parseFile(resource("sc.cat")),
        STANDARD);
    final CandidateReport scReport = Cat.check(sc, u, p);
    assertThat(scReport.isConsistent(), is(false));
    assertThat(scReport.verdicts.get(0),
        isVerdict(Verdict.State.VIOLATED,
            "sc: VIOLATED (cycle a -> b -> c -> d -> a)"));

    final CatModel tso = Cat.resolve(Cat.parseFile(resource("tso.cat")),
        STANDARD);
    final List<String> values = new ArrayList<>();
    final CandidateReport tsoReport =
        Cat.check(tso, u, p, ImmutableMap.of(),
            Tracers.withOnValue(Tracers.empty(),
                (name, value) -> values.add(name)));
    assertThat(tsoReport.toString(), tsoReport.isConsistent(), is(true));
    assertThat(tsoReport.verdicts, hasSize(4));
    assertThat(tsoReport.raisedFlags(), hasSize(0));
    assertThat(tsoReport.shown().get("ghb"),
        hasToString("{(ix, a), (ix, d), (iy, b), (iy, c), (b, c), (d, a)}"));
    assertThat(values.contains("ghb"), is(true));
  }

  private static File resource(String name) throws Exception {
    return new File(
        requireNonNull(CheckTest.class.getResource("/cat/" + name)).toURI());
  }
}

// End CheckTest.java

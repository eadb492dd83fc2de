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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.eval.EvalException;
import net.hydromatic.cat.eval.Value;
import net.hydromatic.cat.type.Kind;

/**
 * Result of checking every axiom of a model against one candidate execution.
 *
 * <p>The execution is consistent if every check (not counting flags) is
 * satisfied. An axiom whose evaluation failed counts as not satisfied.
 */
public final class CandidateReport {
  /** Verdicts of the axioms that could be evaluated, in model order. */
  public final List<Verdict> verdicts;
  /** Axioms whose evaluation failed. */
  public final List<Failure> failures;
  /** Values of the shown relations, in the order they were shown. */
  private final ImmutableMap<String, Value> shown;
  /** Shown relations whose evaluation failed. */
  public final Map<String, EvalException> showFailures;
  /** Every axiom of the model, in model order. */
  private final ImmutableList<Ast.Axiom<Kind>> axioms;

  CandidateReport(List<Ast.Axiom<Kind>> axioms, List<Verdict> verdicts,
      List<Failure> failures, Map<String, Value> shown,
      Map<String, EvalException> showFailures) {
    this.axioms = ImmutableList.copyOf(axioms);
    this.verdicts = ImmutableList.copyOf(verdicts);
    this.failures = ImmutableList.copyOf(failures);
    this.shown = ImmutableMap.copyOf(shown);
    this.showFailures = ImmutableMap.copyOf(showFailures);
  }

  /** Returns whether the execution satisfies every check. */
  public boolean isConsistent() {
    for (Verdict verdict : verdicts) {
      if (!verdict.isFlag() && !verdict.isSatisfied()) {
        return false;
      }
    }
    for (Failure failure : failures) {
      if (!failure.axiom.isFlag()) {
        return false;
      }
    }
    return true;
  }

  /** Returns the verdicts of checks. */
  public List<Verdict> checks() {
    return ImmutableList.copyOf(
        verdicts.stream().filter(v -> !v.isFlag()).iterator());
  }

  /** Returns the verdicts of flags. */
  public List<Verdict> flags() {
    return ImmutableList.copyOf(
        verdicts.stream().filter(Verdict::isFlag).iterator());
  }

  /** Returns the tags of the flags that were raised, that is, violated or
   * failed to evaluate, in model order. */
  public List<String> raisedFlags() {
    // Identity, not equality: a model may define the same flag twice.
    final Set<Ast.Axiom<Kind>> raised = Sets.newIdentityHashSet();
    for (Verdict verdict : verdicts) {
      if (verdict.isFlag() && verdict.isViolated()) {
        raised.add(verdict.axiom);
      }
    }
    for (Failure failure : failures) {
      raised.add(failure.axiom);
    }
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (Ast.Axiom<Kind> axiom : axioms) {
      if (axiom.isFlag() && raised.contains(axiom)) {
        b.add(requireNonNull(axiom.tag));
      }
    }
    return b.build();
  }

  /** Returns the values of the shown relations, keyed by display name. */
  public Map<String, Value> shown() {
    return shown;
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    verdicts.forEach(v -> b.append(v).append('\n'));
    failures.forEach(f -> b.append(f).append('\n'));
    return b.toString();
  }

  /** An axiom whose expression could not be evaluated. */
  public static final class Failure {
    public final Ast.Axiom<Kind> axiom;
    public final EvalException exception;

    Failure(Ast.Axiom<Kind> axiom, EvalException exception) {
      this.axiom = requireNonNull(axiom);
      this.exception = requireNonNull(exception);
    }

    @Override
    public String toString() {
      return axiom.describe() + ": " + exception.getMessage();
    }
  }
}

// End CandidateReport.java

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

/**
 * Kind of consistency axiom.
 *
 * <p>The {@code NON_} variants are the logical negation of the base checks;
 * a model uses them to require that an execution exhibits a cycle, a
 * reflexive pair or a non-empty result.
 */
public enum Check {
  ACYCLIC("acyclic"),
  IRREFLEXIVE("irreflexive"),
  EMPTY("empty"),
  NON_ACYCLIC("~acyclic"),
  NON_IRREFLEXIVE("~irreflexive"),
  NON_EMPTY("~empty");

  /** How the check is written in a cat file. */
  public final String keyword;

  Check(String keyword) {
    this.keyword = keyword;
  }

  /** Returns whether this is one of the negated checks. */
  public boolean isNegated() {
    return keyword.startsWith("~");
  }

  /** Returns the check without negation, e.g. {@code ACYCLIC} for both
   * {@code ACYCLIC} and {@code NON_ACYCLIC}. */
  public Check base() {
    switch (this) {
      case NON_ACYCLIC:
        return ACYCLIC;
      case NON_IRREFLEXIVE:
        return IRREFLEXIVE;
      case NON_EMPTY:
        return EMPTY;
      default:
        return this;
    }
  }

  /** Returns the logical negation of this check. */
  public Check negate() {
    switch (this) {
      case ACYCLIC:
        return NON_ACYCLIC;
      case IRREFLEXIVE:
        return NON_IRREFLEXIVE;
      case EMPTY:
        return NON_EMPTY;
      default:
        return base();
    }
  }
}

// End Check.java

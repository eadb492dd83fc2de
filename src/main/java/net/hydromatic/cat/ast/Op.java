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
 * Sub-types of {@link AstNode}.
 *
 * <p>Expression operators carry a left and right precedence, which {@link
 * AstWriter} uses to decide where parentheses are needed. The precedence
 * levels follow the grammar: union binds loosest, then sequence,
 * intersection, difference, cartesian product, prefix complement, postfix
 * operators, and function application.
 */
public enum Op {
  // atoms
  ID(true),
  EMPTY(true),
  IDENTITY(true),

  APPLY(" ", 9),
  INVERSE("^-1", 8),
  IDENTITY_UNION("?", 8),
  COMPL("~", 7),
  CARTESIAN(" * ", 6),
  DIFF(" \\ ", 5),
  INTER(" & ", 4, false),
  SEQ(";", 3, false),
  UNION(" | ", 1, false),
  LET,
  TRY_WITH,

  // definitions
  LET_DEF,
  VAL_BIND(" = "),
  TCLOSURE_DEF("^+"),
  RTCLOSURE_DEF("^*"),
  FN_DEF,
  PARAM,
  CHECK_DEF,
  FLAG_DEF,
  SHOW,
  SHOW_AS(" as "),
  UNSHOW,
  SET_DECL("set "),
  RELATION_DECL("relation "),
  INCLUDE("include ");

  /** Padded name, e.g. " | ". */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is one of the binary operators. */
  public boolean isInfix() {
    switch (this) {
      case CARTESIAN:
      case DIFF:
      case INTER:
      case SEQ:
      case UNION:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java

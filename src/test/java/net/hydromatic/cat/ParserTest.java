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

import static net.hydromatic.cat.Cm.cat;
import static net.hydromatic.cat.Cm.catE;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import net.hydromatic.cat.ast.Ast;
import net.hydromatic.cat.ast.Check;
import net.hydromatic.cat.ast.Op;
import net.hydromatic.cat.parse.Parsers;
import net.hydromatic.cat.util.Unit;
import org.junit.jupiter.api.Test;

/** Tests the parser. */
public class ParserTest {
  @Test void testPrecedence() {
    // ";" binds tighter than "|"
    final Ast.Exp<Unit> e = Parsers.parseExp("a;b|c");
    assertThat(e.op, is(Op.UNION));
    assertThat(((Ast.InfixCall<Unit>) e).a0.op, is(Op.SEQ));
    assertThat(e, hasToString("a;b | c"));

    // "&" binds tighter than ";"
    final Ast.Exp<Unit> e2 = Parsers.parseExp("a&b;c");
    assertThat(e2.op, is(Op.SEQ));
    assertThat(((Ast.InfixCall<Unit>) e2).a0.op, is(Op.INTER));
    assertThat(e2, hasToString("a & b;c"));

    // postfix binds tighter than any infix operator
    final Ast.Exp<Unit> e3 = Parsers.parseExp("x^-1|y");
    assertThat(e3.op, is(Op.UNION));
    assertThat(((Ast.InfixCall<Unit>) e3).a0.op, is(Op.INVERSE));

    cat("a|b&c").assertParseExp("a | b & c");
    cat("a&b\\c").assertParseExp("a & b \\ c");
    cat("a\\b&c").assertParseExp("a \\ b & c");
    cat("A*B;po").assertParseExp("A * B;po");
    cat("~a;b").assertParseExp("~a;b");
    cat("~(a;b)").assertParseExp("~(a;b)");
    cat("(a|b);c").assertParseExp("(a | b);c");
    cat("[R];po;[W]").assertParseExp("[R];po;[W]");
    cat("po^-1?").assertParseExp("po^-1?");
    cat("(po;rf)?").assertParseExp("(po;rf)?");
    cat("~a^-1").assertParseExp("~a^-1");
  }

  @Test void testAssociativity() {
    // ";", "&" and "|" are right-associative
    cat("a;b;c").assertParseExp("a;b;c");
    cat("a;(b;c)").assertParseExp("a;b;c");
    cat("(a;b);c").assertParseExp("(a;b);c");
    cat("(a|b)|c").assertParseExp("(a | b) | c");
    cat("(a&b)&c").assertParseExp("(a & b) & c");

    // "\" is left-associative
    final Ast.Exp<Unit> e = Parsers.parseExp("a\\b\\c");
    assertThat(((Ast.InfixCall<Unit>) e).a0.op, is(Op.DIFF));
    cat("a\\b\\c").assertParseExp("a \\ b \\ c");
    cat("a\\(b\\c)").assertParseExp("a \\ (b \\ c)");

    // "*" is not associative
    cat("(A*B)*C").assertParseExp("(A * B) * C");
    cat("A*(B*C)").assertParseExp("A * (B * C)");
  }

  @Test void testAtoms() {
    cat("0").assertParseExp("0");
    cat("{}").assertParseExp("0");
    cat("po").assertParseExp("po");
    cat("po-loc").assertParseExp("po-loc");
    cat("rmw.a").assertParseExp("rmw.a");
    cat("((po))").assertParseExp("po");
    cat("[R | W]").assertParseExp("[R | W]");
    // a keyword followed by more identifier characters is an identifier
    cat("acyclic-po").assertParseExp("acyclic-po");
  }

  @Test void testApply() {
    final Ast.Exp<Unit> e = Parsers.parseExp("domain(po)");
    assertThat(e, instanceOf(Ast.Apply.class));
    assertThat(((Ast.Apply<Unit>) e).fn, is("domain"));
    assertThat(e, hasToString("domain po"));
    cat("domain(po;rf)").assertParseExp("domain (po;rf)");
    cat("range(rf) & W").assertParseExp("range rf & W");
    cat("f x;y").assertParseExp("f x;y");
    cat("f(x)^-1").assertParseExp("f x^-1");
    cat("f [R]").assertParseExp("f [R]");
  }

  @Test void testLetTry() {
    cat("let x = po in x;x").assertParseExpSame();
    cat("try undefined with 0").assertParseExpSame();
    cat("a | (try b with c)").assertParseExpSame();
    cat("let x = [R] in try x;po with 0").assertParseExpSame();
  }

  @Test void testUnicodeAndComments() {
    cat("a ∪ b ∩ c").assertParseExp("a | b & c");
    cat("A × B").assertParseExp("A * B");
    cat("po (* between *) ; rf # to end of line").assertParseExp("po;rf");
    cat("po (* a comment\n over two lines *) | rf").assertParseExp("po | rf");
  }

  @Test void testPosition() {
    final Ast.Exp<Unit> e = Parsers.parseExp("a |\n  bc");
    assertThat(((Ast.InfixCall<Unit>) e).a1.pos, hasToString("2.3-2.5"));
    assertThat(e.pos, hasToString("1.1-2.5"));
  }

  @Test void testParseDefs() {
    cat("let com = rf | co | fr\n").assertParseSame();
    cat("let rec a = b;a and b = po\n").assertParseSame();
    cat("let a = po and b = rf\n").assertParseSame();
    cat("let hb = po | rf^+\n").assertParseSame();
    cat("let rt = po^*\n").assertParseSame();
    cat("let f(x) = x;x\n").assertParseSame();
    cat("acyclic po | com as sc\n").assertParseSame();
    cat("irreflexive fr;rf\n").assertParseSame();
    cat("~empty rmw as Atomic\n").assertParseSame();
    cat("flag ~empty a & b as ab\n").assertParseSame();
    cat("show po, rf\n").assertParseSame();
    cat("show po;rf as porf\n").assertParseSame();
    cat("unshow po\n").assertParseSame();
    cat("set MFENCE\n").assertParseSame();
    cat("relation rmw2\n").assertParseSame();
    cat("include \"stdlib.cat\"\n").assertParseSame();
    cat("let r =  po\n\n  ;rf\n").assertParse("let r = po;rf\n");
  }

  @Test void testParseCat() {
    final String text = "\"X86 TSO\"\n"
        + "(* x86 *)\n"
        + "include \"x86fences.cat\"\n"
        + "let com = rf | co | fr\n"
        + "let ppo = po \\ (W * R)\n"
        + "acyclic po-loc | com as uniproc\n"
        + "empty rmw & (fre;coe) as atomic\n"
        + "flag ~empty rmw as rmw-present\n";
    final Ast.ParseCat<Unit> parseCat = Parsers.parse(text, null);
    assertThat(parseCat.tag, is("X86 TSO"));
    assertThat(parseCat.directory, nullValue());
    assertThat(parseCat.defs, hasSize(6));
    assertThat(parseCat.defs.get(0), instanceOf(Ast.Include.class));
    final Ast.Axiom<Unit> atomic = (Ast.Axiom<Unit>) parseCat.defs.get(4);
    assertThat(atomic.check, is(Check.EMPTY));
    assertThat(atomic.tag, is("atomic"));
    assertThat(atomic.isFlag(), is(false));
    final Ast.Axiom<Unit> flag = (Ast.Axiom<Unit>) parseCat.defs.get(5);
    assertThat(flag.check, is(Check.NON_EMPTY));
    assertThat(flag.isFlag(), is(true));
    assertThat(flag.describe(), is("rmw-present"));

    // an identifier at the start of the file is also a tag
    assertThat(Parsers.parse("PPC let a = po", null).tag, is("PPC"));
    assertThat(Parsers.parse("let a = po", null).tag, nullValue());
    assertThat(Parsers.parse("", null).defs, hasSize(0));
  }

  @Test void testCheck() {
    assertThat(Check.ACYCLIC.negate(), is(Check.NON_ACYCLIC));
    assertThat(Check.NON_ACYCLIC.negate(), is(Check.ACYCLIC));
    assertThat(Check.NON_EMPTY.base(), is(Check.EMPTY));
    assertThat(Check.IRREFLEXIVE.base(), is(Check.IRREFLEXIVE));
    assertThat(Check.NON_IRREFLEXIVE.isNegated(), is(true));
    assertThat(Check.EMPTY.isNegated(), is(false));
  }

  @Test void testReservedOperators() {
    catE("let x = a $++$ b")
        .assertParseThrows("operator '++' is reserved");
    catE("let x = a $+$ b")
        .assertParseThrows("operator '+' is reserved");
  }

  @Test void testParseErrors() {
    catE("acyclic $)$")
        .assertParseThrowsExpecting("Encountered \")\" at line 1, column 9."
                + " Was expecting one of: ",
            "\"let\"", "\"try\"", "\"~\"", "\"0\"", "<identifier>",
            "\"{\"", "\"(\"", "\"[\"");
    catE("flag acyclic po$$")
        .assertParseThrowsExpecting("Encountered <EOF> at line 1, column 16."
                + " Was expecting one of: ",
            "\"as\"", "\"|\"", "\";\"", "\"^-1\"");
    catE("let x = A * B $*$ C")
        .assertParseThrows("'*' is not associative; use parentheses");
    catE("let a = po^+ $and$ b = rf")
        .assertParseThrows(
            "a closure definition cannot be part of an 'and' group");
    catE("let a = po and b = rf$^*$")
        .assertParseThrows(
            "a closure definition cannot be part of an 'and' group");
    catE("let a = (po;rf$$")
        .assertParseThrowsExpecting("Encountered <EOF> at line 1, column 15."
                + " Was expecting one of: ",
            "\")\"", "\";\"");
    catE("show po;rf$$")
        .assertParseThrows("Encountered <EOF> at line 1, column 11."
            + " Was expecting one of: \"as\"");
  }

  /** The description of an unexpected token uses the source text, even for
   * a mathematical symbol that stands for an ASCII operator. */
  @Test void testParseErrorDescribesToken() {
    catE("let x = a \u222a $\u222a$ b")
        .assertParseThrowsExpecting("Encountered \"\u222a\" at line 1,"
                + " column 13. Was expecting one of: ",
            "\"0\"", "<identifier>");
  }

  @Test void testLexErrors() {
    catE("let x = a $%$ b")
        .assertParseThrows("unexpected character '%'");
    catE("let x = $1$")
        .assertParseThrows("unexpected character '1'");
    catE("let x = a\n$(*$ no end")
        .assertParseThrows("unterminated comment");
    catE("include $\"$foo.cat")
        .assertParseThrows("unterminated string");
    catE("let x = a $(*$)")
        .assertParseThrows("unterminated comment");
  }
}

// End ParserTest.java

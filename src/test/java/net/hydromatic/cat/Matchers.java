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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.Objects;
import net.hydromatic.cat.ast.AstNode;
import net.hydromatic.cat.ast.Pos;
import net.hydromatic.cat.check.Verdict;
import net.hydromatic.cat.util.CatException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.CustomTypeSafeMatcher;
import org.hamcrest.Matcher;

/** Matchers for use in cat tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Matches an AST node by its string representation. */
  static <T extends AstNode> Matcher<T> isAst(Class<? extends T> clazz,
      String expected) {
    return new CustomTypeSafeMatcher<T>("ast with value " + expected) {
      protected boolean matchesSafely(T t) {
        assertThat(clazz.isInstance(t), is(true));
        return t.toString().equals(expected);
      }
    };
  }

  /** Matches a throwable whose message contains a given string. */
  static Matcher<Throwable> throwsA(String message) {
    return new CustomTypeSafeMatcher<Throwable>("throwable: " + message) {
      @Override protected boolean matchesSafely(Throwable item) {
        return item.toString().contains(message);
      }
    };
  }

  /** Matches a throwable of a given class whose message matches. */
  static <T extends Throwable> Matcher<Throwable> throwsA(Class<T> clazz,
      Matcher<?> messageMatcher) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message "
        + messageMatcher) {
      @Override protected boolean matchesSafely(Throwable item) {
        return clazz.isInstance(item)
            && messageMatcher.matches(item.getMessage());
      }
    };
  }

  /** Matches a throwable of a given class, with a given message and, if
   * {@code pos} is not null, a given position. */
  static <T extends Throwable> Matcher<Throwable> throwsA(Class<T> clazz,
      String message, @Nullable Pos pos) {
    return new CustomTypeSafeMatcher<Throwable>(clazz + " with message '"
        + message + "'" + (pos == null ? "" : " at " + pos)) {
      @Override protected boolean matchesSafely(Throwable item) {
        if (!clazz.isInstance(item)
            || !Objects.equals(item.getMessage(), message)) {
          return false;
        }
        return pos == null
            || item instanceof CatException
                && ((CatException) item).pos().equals(pos);
      }
    };
  }

  /** Matches a verdict in a given state. */
  static Matcher<Verdict> isVerdict(Verdict.State state) {
    return new CustomTypeSafeMatcher<Verdict>("verdict " + state) {
      @Override protected boolean matchesSafely(Verdict verdict) {
        return verdict.state == state;
      }
    };
  }

  /** Matches a verdict in a given state whose string representation
   * (including witness) is as given. */
  static Matcher<Verdict> isVerdict(Verdict.State state, String expected) {
    return new CustomTypeSafeMatcher<Verdict>("verdict " + state + ", "
        + expected) {
      @Override protected boolean matchesSafely(Verdict verdict) {
        return verdict.state == state
            && verdict.toString().equals(expected);
      }
    };
  }
}

// End Matchers.java

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
package net.hydromatic.cat.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.cat.ast.Pos;
import net.hydromatic.cat.util.CatException;

/** Exception caused by a parse error. */
public class CatParseException extends RuntimeException
    implements CatException {
  private final Pos pos;
  /** Descriptions of the tokens that would have been valid; empty if the
   * error is not about an unexpected token. */
  public final List<String> expected;

  public CatParseException(String message, Pos pos) {
    this(message, pos, ImmutableList.of());
  }

  public CatParseException(String message, Pos pos, List<String> expected) {
    super(message);
    this.pos = requireNonNull(pos);
    this.expected = ImmutableList.copyOf(expected);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End CatParseException.java

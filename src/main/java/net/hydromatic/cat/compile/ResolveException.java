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
package net.hydromatic.cat.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.cat.ast.Pos;
import net.hydromatic.cat.util.CatException;

/** Error found while resolving the names and includes of a cat model. */
public class ResolveException extends RuntimeException
    implements CatException {
  public final Kind kind;
  /** The name or include path that caused the error. */
  public final String name;
  private final Pos pos;

  public ResolveException(Kind kind, String name, Pos pos) {
    super(kind.message(name));
    this.kind = requireNonNull(kind);
    this.name = requireNonNull(name);
    this.pos = requireNonNull(pos);
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

  /** Kinds of resolution error. */
  public enum Kind {
    UNBOUND_NAME("unbound name '%s'"),
    DUPLICATE_BINDING("duplicate binding of '%s'"),
    INCLUDE_NOT_FOUND("include file not found: %s"),
    INCLUDE_CYCLE("include cycle: %s includes itself"),
    INCLUDE_PARSE_ERROR("error parsing include file %s");

    private final String format;

    Kind(String format) {
      this.format = format;
    }

    String message(String name) {
      return String.format(format, name);
    }
  }
}

// End ResolveException.java

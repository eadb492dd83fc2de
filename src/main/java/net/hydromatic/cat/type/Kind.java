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
package net.hydromatic.cat.type;

/**
 * Kind of a cat value: a set of events, or a relation (set of ordered pairs
 * of events).
 *
 * <p>{@link #ANY} means that the kind is not known statically; for example
 * the kind of {@code 0}, or of an expression whose operands disagree.
 */
public enum Kind {
  SET("set"),
  RELATION("relation"),
  ANY("any");

  public final String description;

  Kind(String description) {
    this.description = description;
  }

  /**
   * Combines two kinds that must be the same. If one is {@link #ANY}, returns
   * the other; if they conflict, returns {@link #ANY}.
   */
  public Kind unify(Kind kind) {
    if (this == kind || kind == ANY) {
      return this;
    }
    if (this == ANY) {
      return kind;
    }
    return ANY;
  }

  /** Returns this kind, or {@code defaultKind} if this is {@link #ANY}. */
  public Kind orElse(Kind defaultKind) {
    return this == ANY ? defaultKind : this;
  }
}

// End Kind.java

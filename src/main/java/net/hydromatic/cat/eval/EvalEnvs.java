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
package net.hydromatic.cat.eval;

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link EvalEnv}. */
public final class EvalEnvs {
  private EvalEnvs() {}

  /** Returns an environment with no local variables. */
  public static EvalEnv empty() {
    return EmptyEvalEnv.INSTANCE;
  }

  /** Evaluation environment that binds no variables. */
  private static class EmptyEvalEnv implements EvalEnv {
    static final EvalEnv INSTANCE = new EmptyEvalEnv();

    @Override
    public @Nullable Value getOpt(String name) {
      return null;
    }

    @Override
    public String toString() {
      return "{}";
    }
  }

  /** Evaluation environment that inherits from a parent environment and
   * adds one binding. */
  static class SubEvalEnv implements EvalEnv {
    private final EvalEnv parent;
    private final String name;
    private final Value value;

    SubEvalEnv(EvalEnv parent, String name, Value value) {
      this.parent = requireNonNull(parent);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    @Override
    public @Nullable Value getOpt(String name) {
      if (name.equals(this.name)) {
        return value;
      }
      return parent.getOpt(name);
    }

    @Override
    public String toString() {
      return name + "=" + value + ", " + parent;
    }
  }
}

// End EvalEnvs.java

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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment of local variables: the names bound by
 * {@code let ... in} expressions and by function parameters.
 *
 * <p>Whereas {@link net.hydromatic.cat.compile.Environment} holds the
 * definitions of a model, an EvalEnv holds the values computed for one
 * candidate execution. Names not found here are looked up in the
 * definitions.
 */
public interface EvalEnv {
  /** Returns the value of {@code name} if bound, null if not. */
  @Nullable Value getOpt(String name);

  /**
   * Creates an environment that has the same content as this one, plus the
   * binding (name, value).
   */
  default EvalEnv bind(String name, Value value) {
    return new EvalEnvs.SubEvalEnv(this, name, value);
  }
}

// End EvalEnv.java

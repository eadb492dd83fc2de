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

import java.io.File;
import net.hydromatic.cat.check.Verdict;
import net.hydromatic.cat.eval.Value;

/** Called on various events during resolution, evaluation and checking. */
public interface Tracer {
  /** Called when a file is about to be included. */
  void onInclude(File file);

  /** Called when a top-level binding or a shown expression has been
   * evaluated. */
  void onValue(String name, Value value);

  /** Called when an axiom has been checked. */
  void onVerdict(Verdict verdict);

  /** Called with an exception thrown while checking an axiom or evaluating
   * a shown expression. The checker records the exception in its report
   * whatever the tracer does. */
  void onException(Throwable e);
}

// End Tracer.java

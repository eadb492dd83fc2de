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
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.cat.check.Verdict;
import net.hydromatic.cat.eval.Value;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each included file,
   * then calls the underlying tracer. */
  public static Tracer withOnInclude(Tracer tracer, Consumer<File> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onInclude(File file) {
        consumer.accept(file);
        super.onInclude(file);
      }
    };
  }

  /** Returns a tracer that performs the given action on each evaluated
   * value, then calls the underlying tracer. */
  public static Tracer withOnValue(Tracer tracer,
      BiConsumer<String, Value> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onValue(String name, Value value) {
        consumer.accept(name, value);
        super.onValue(name, value);
      }
    };
  }

  /** Returns a tracer that performs the given action on each verdict, then
   * calls the underlying tracer. */
  public static Tracer withOnVerdict(Tracer tracer,
      Consumer<Verdict> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onVerdict(Verdict verdict) {
        consumer.accept(verdict);
        super.onVerdict(verdict);
      }
    };
  }

  public static Tracer withOnException(Tracer tracer,
      Consumer<Throwable> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onException(Throwable e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onInclude(File file) {}

    @Override
    public void onValue(String name, Value value) {}

    @Override
    public void onVerdict(Verdict verdict) {}

    @Override
    public void onException(Throwable e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onInclude(File file) {
      tracer.onInclude(file);
    }

    @Override
    public void onValue(String name, Value value) {
      tracer.onValue(name, value);
    }

    @Override
    public void onVerdict(Verdict verdict) {
      tracer.onVerdict(verdict);
    }

    @Override
    public void onException(Throwable e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java

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
package net.hydromatic.lpdoc.analyze;

import java.util.List;
import java.util.function.Consumer;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each statement, then
   * calls the underlying tracer.
   */
  public static Tracer withOnStatement(
      Tracer tracer, Consumer<Statement> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onStatement(Statement statement) {
        consumer.accept(statement);
        super.onStatement(statement);
      }
    };
  }

  public static Tracer withOnWarnings(
      Tracer tracer, Consumer<List<AnalysisException>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onWarnings(List<AnalysisException> warningList) {
        consumer.accept(warningList);
        super.onWarnings(warningList);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a completed model,
   * then calls the underlying tracer.
   */
  public static Tracer withOnModel(Tracer tracer, Consumer<Model> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onModel(Model model) {
        consumer.accept(model);
        super.onModel(model);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onStatement(Statement statement) {}

    @Override
    public void onWarnings(List<AnalysisException> warningList) {}

    @Override
    public void onModel(Model model) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onStatement(Statement statement) {
      tracer.onStatement(statement);
    }

    @Override
    public void onWarnings(List<AnalysisException> warningList) {
      tracer.onWarnings(warningList);
    }

    @Override
    public void onModel(Model model) {
      tracer.onModel(model);
    }
  }
}

// End Tracers.java

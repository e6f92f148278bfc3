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
package net.hydromatic.coinduct.compile;

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.coinduct.ast.Declaration;
import net.hydromatic.coinduct.graph.ConstraintGraph;
import net.hydromatic.coinduct.type.Obligation;
import net.hydromatic.coinduct.util.CoinductionException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each resolution, then
   * calls the underlying tracer.
   */
  public static Tracer withOnResolve(
      Tracer tracer,
      BiConsumer<Obligation, PatternMatcher.Resolution> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onResolve(
          Declaration declaration,
          Obligation obligation,
          PatternMatcher.Resolution resolution) {
        consumer.accept(obligation, resolution);
        super.onResolve(declaration, obligation, resolution);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the graph of each
   * declaration, then calls the underlying tracer.
   */
  public static Tracer withOnGraph(
      Tracer tracer, BiConsumer<Declaration, ConstraintGraph> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onGraph(Declaration declaration, ConstraintGraph graph) {
        consumer.accept(declaration, graph);
        super.onGraph(declaration, graph);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each rewritten
   * declaration, then calls the underlying tracer.
   */
  public static Tracer withOnRewrite(
      Tracer tracer, BiConsumer<Declaration, Declaration> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onRewrite(Declaration declaration, Declaration rewritten) {
        consumer.accept(declaration, rewritten);
        super.onRewrite(declaration, rewritten);
      }
    };
  }

  public static Tracer withOnException(
      Tracer tracer, Consumer<CoinductionException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean onException(CoinductionException e) {
        consumer.accept(e);
        super.onException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onResolve(
        Declaration declaration,
        Obligation obligation,
        PatternMatcher.Resolution resolution) {}

    @Override
    public void onGraph(Declaration declaration, ConstraintGraph graph) {}

    @Override
    public void onRewrite(Declaration declaration, Declaration rewritten) {}

    @Override
    public boolean onException(CoinductionException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onResolve(
        Declaration declaration,
        Obligation obligation,
        PatternMatcher.Resolution resolution) {
      tracer.onResolve(declaration, obligation, resolution);
    }

    @Override
    public void onGraph(Declaration declaration, ConstraintGraph graph) {
      tracer.onGraph(declaration, graph);
    }

    @Override
    public void onRewrite(Declaration declaration, Declaration rewritten) {
      tracer.onRewrite(declaration, rewritten);
    }

    @Override
    public boolean onException(CoinductionException e) {
      return tracer.onException(e);
    }
  }
}

// End Tracers.java

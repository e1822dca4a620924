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
package net.hydromatic.algol68.compile;

import java.util.function.Consumer;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the mode graph once
   * declarers have been collected, then calls the underlying tracer. */
  public static Tracer withOnModesCollected(Tracer tracer,
      Consumer<ModeGraph> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onModesCollected(ModeGraph graph) {
        consumer.accept(graph);
        super.onModesCollected(graph);
      }
    };
  }

  /** Returns a tracer that receives the number of modes after each round of
   * derivation, then calls the underlying tracer. */
  public static Tracer withOnDerivationRound(Tracer tracer,
      Consumer<Integer> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDerivationRound(int round, int modeCount) {
        consumer.accept(modeCount);
        super.onDerivationRound(round, modeCount);
      }
    };
  }

  /** Returns a tracer that performs the given action on each coercion
   * node, then calls the underlying tracer. */
  public static Tracer withOnCoercion(Tracer tracer, Consumer<Node> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCoercion(Node node, Attribute coercion, Mode mode) {
        consumer.accept(node);
        super.onCoercion(node, coercion, mode);
      }
    };
  }

  public static Tracer withOnDiagnostic(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDiagnostic(CompileException e) {
        consumer.accept(e);
        super.onDiagnostic(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onModesCollected(ModeGraph graph) {}

    @Override
    public void onDerivationRound(int round, int modeCount) {}

    @Override
    public void onCoercion(Node node, Attribute coercion, Mode mode) {}

    @Override
    public void onDiagnostic(CompileException e) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onModesCollected(ModeGraph graph) {
      tracer.onModesCollected(graph);
    }

    @Override
    public void onDerivationRound(int round, int modeCount) {
      tracer.onDerivationRound(round, modeCount);
    }

    @Override
    public void onCoercion(Node node, Attribute coercion, Mode mode) {
      tracer.onCoercion(node, coercion, mode);
    }

    @Override
    public void onDiagnostic(CompileException e) {
      tracer.onDiagnostic(e);
    }
  }
}

// End Tracers.java

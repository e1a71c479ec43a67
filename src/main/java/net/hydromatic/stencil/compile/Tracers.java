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
package net.hydromatic.stencil.compile;

import java.util.List;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.Sym;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the relations of an
   * equation, then calls the underlying tracer. */
  public static Tracer withOnRelations(Tracer tracer,
      BiConsumer<Sym.Equation, Set<List<Dimension>>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRelations(Sym.Equation equation,
          Set<List<Dimension>> relations) {
        consumer.accept(equation, relations);
        super.onRelations(equation, relations);
      }
    };
  }

  /** Returns a tracer that performs the given action on the ordering of the
   * dimensions of an equation, then calls the underlying tracer. */
  public static Tracer withOnOrdering(Tracer tracer,
      BiConsumer<Sym.Equation, List<Dimension>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onOrdering(Sym.Equation equation,
          List<Dimension> ordering) {
        consumer.accept(equation, ordering);
        super.onOrdering(equation, ordering);
      }
    };
  }

  /** Returns a tracer that performs the given action on the stencil of an
   * equation, then calls the underlying tracer. */
  public static Tracer withOnStencil(Tracer tracer,
      BiConsumer<Sym.Equation, Stencil> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStencil(Sym.Equation equation,
          Stencil stencil) {
        consumer.accept(equation, stencil);
        super.onStencil(equation, stencil);
      }
    };
  }

  /** Returns a tracer that performs the given action on an exception, then
   * calls the underlying tracer. */
  public static Tracer withOnException(Tracer tracer,
      Consumer<RuntimeException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(Sym.Equation equation,
          RuntimeException e) {
        consumer.accept(e);
        super.onException(equation, e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRelations(Sym.Equation equation,
        Set<List<Dimension>> relations) {
    }

    @Override public void onOrdering(Sym.Equation equation,
        List<Dimension> ordering) {
    }

    @Override public void onStencil(Sym.Equation equation, Stencil stencil) {
    }

    @Override public void onException(Sym.Equation equation,
        RuntimeException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onRelations(Sym.Equation equation,
        Set<List<Dimension>> relations) {
      tracer.onRelations(equation, relations);
    }

    @Override public void onOrdering(Sym.Equation equation,
        List<Dimension> ordering) {
      tracer.onOrdering(equation, ordering);
    }

    @Override public void onStencil(Sym.Equation equation, Stencil stencil) {
      tracer.onStencil(equation, stencil);
    }

    @Override public void onException(Sym.Equation equation,
        RuntimeException e) {
      tracer.onException(equation, e);
    }
  }
}

// End Tracers.java

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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.Sym;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Analyzes equations: sorts their dimensions, and computes their stencils.
 *
 * <p>An analyzer is immutable, and may be used from several threads, provided
 * that its {@link Tracer} is thread-safe.
 */
public class Analyzer {
  private final ImmutableMap<Prop, Object> map;
  private final Tracer tracer;
  private final DimensionSorter sorter;

  private Analyzer(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
    this.sorter = new DimensionSorter(this.map, tracer);
  }

  /** Creates an analyzer with default properties and no tracer. */
  public static Analyzer create() {
    return builder().build();
  }

  /** Creates a builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Returns the value of each property that has been set. */
  public ImmutableMap<Prop, Object> props() {
    return map;
  }

  /** Sorts the dimensions of an equation.
   *
   * @see DimensionSorter#sort */
  public ImmutableList<Dimension> dimensionSort(Sym.Equation equation) {
    return sorter.sort(equation);
  }

  /** Computes the union of the stencils of some equations. */
  public Stencil stencil(Sym.Equation... equations) {
    final Stencil[] stencils = new Stencil[equations.length];
    for (int i = 0; i < equations.length; i++) {
      stencils[i] = Stencil.extract(equations[i]);
      tracer.onStencil(equations[i], stencils[i]);
    }
    return Stencil.union(stencils);
  }

  /** Builds an {@link Analyzer}. */
  public static class Builder {
    private final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    private Tracer tracer = Tracers.empty();

    private Builder() {}

    /** Sets the value of a property. */
    public Builder set(Prop prop, @Nullable Object value) {
      prop.set(map, value);
      return this;
    }

    /** Sets the value of a property, identified by name; the value may be a
     * string. */
    public Builder set(String propName, @Nullable Object value) {
      Prop.lookup(propName).setLenient(map, value);
      return this;
    }

    /** Sets the tracer. */
    public Builder withTracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer);
      return this;
    }

    public Analyzer build() {
      return new Analyzer(map, tracer);
    }
  }
}

// End Analyzer.java

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
package net.hydromatic.stencil.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.stencil.ast.SymBuilder.sym;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Named array-like object defined over a fixed, ordered list of dimensions;
 * for example "u(t, x, y)".
 *
 * <p>Like {@link Dimension}, a function is compared by identity.
 */
public class DiscreteFunction {
  public final String name;
  public final ImmutableList<Dimension> dimensions;

  private DiscreteFunction(String name, ImmutableList<Dimension> dimensions) {
    this.name = requireNonNull(name, "name");
    this.dimensions = requireNonNull(dimensions, "dimensions");
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Creates a function. */
  public static DiscreteFunction of(String name, Dimension... dimensions) {
    return of(name, ImmutableList.copyOf(dimensions));
  }

  /** Creates a function. */
  public static DiscreteFunction of(String name,
      List<Dimension> dimensions) {
    return new DiscreteFunction(name, ImmutableList.copyOf(dimensions));
  }

  /** Creates an access to an element of this function. */
  public Sym.Indexed indexed(Sym.Exp... indices) {
    return sym.indexed(this, indices);
  }

  /** Creates an access to the element at the current point, that is, with
   * each dimension used as its own index. */
  public Sym.Indexed indexed() {
    return sym.indexed(this, dimensions);
  }

  @Override public String toString() {
    return name + dimensions.stream().map(d -> d.name)
        .collect(Collectors.joining(", ", "(", ")"));
  }
}

// End DiscreteFunction.java

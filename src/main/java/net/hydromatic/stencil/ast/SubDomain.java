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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Region of a grid over which an equation is defined, together with the
 * order in which its axes must be iterated.
 *
 * <p>Each index is usually a {@link Dimension}, often one derived from a
 * space dimension of the grid (such as "xi", a sub-range of "x").
 */
public class SubDomain {
  public final String name;
  public final ImmutableList<Sym.Exp> indices;

  private SubDomain(String name, ImmutableList<Sym.Exp> indices) {
    this.name = requireNonNull(name, "name");
    this.indices = requireNonNull(indices, "indices");
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Creates a sub-domain whose indices are dimensions. */
  public static SubDomain of(String name, Dimension... dimensions) {
    return new SubDomain(name, ImmutableList.copyOf(dimensions));
  }

  /** Creates a sub-domain. */
  public static SubDomain of(String name, List<? extends Sym.Exp> indices) {
    return new SubDomain(name, ImmutableList.copyOf(indices));
  }

  @Override public int hashCode() {
    return Objects.hash(name, indices);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof SubDomain
        && name.equals(((SubDomain) o).name)
        && indices.equals(((SubDomain) o).indices);
  }

  @Override public String toString() {
    return new AstWriter().append(name).list("(", indices, ")").toString();
  }
}

// End SubDomain.java

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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.function.Consumer;
import net.hydromatic.stencil.ast.AstNode;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.DiscreteFunction;
import net.hydromatic.stencil.ast.Sym;
import net.hydromatic.stencil.ast.Visitor;

/** Finds nodes of particular kinds in expressions. */
public abstract class Finders {
  private Finders() {}

  /**
   * Returns the accesses in an expression or equation, in the order that they
   * occur (an access before the accesses in its indices).
   *
   * @param node Expression or equation
   * @param deep Whether to look for accesses inside the indices of accesses,
   *             as "g[x]" in "f[g[x]]"
   */
  public static ImmutableList<Sym.Indexed> indexeds(AstNode node,
      boolean deep) {
    final ImmutableList.Builder<Sym.Indexed> list = ImmutableList.builder();
    node.accept(new IndexedFinder(deep, list::add));
    return list.build();
  }

  /** Returns the dimensions that occur in an expression or equation, in the
   * order that they first occur. */
  public static ImmutableSet<Dimension> dimensions(AstNode node) {
    final ImmutableSet.Builder<Dimension> set = ImmutableSet.builder();
    node.accept(new DimensionFinder(set::add));
    return set.build();
  }

  /** Returns the functions accessed in an expression or equation, including
   * in nested accesses, in the order that they first occur. */
  public static ImmutableSet<DiscreteFunction> functions(AstNode node) {
    final ImmutableSet.Builder<DiscreteFunction> set = ImmutableSet.builder();
    for (Sym.Indexed indexed : indexeds(node, true)) {
      set.add(indexed.function);
    }
    return set.build();
  }

  /** Visitor that finds accesses. */
  private static class IndexedFinder extends Visitor {
    final boolean deep;
    final Consumer<Sym.Indexed> consumer;

    IndexedFinder(boolean deep, Consumer<Sym.Indexed> consumer) {
      this.deep = deep;
      this.consumer = consumer;
    }

    @Override protected void visit(Sym.Indexed indexed) {
      consumer.accept(indexed);
      if (deep) {
        super.visit(indexed);
      }
    }
  }

  /** Visitor that finds dimensions. */
  private static class DimensionFinder extends Visitor {
    final Consumer<Dimension> consumer;

    DimensionFinder(Consumer<Dimension> consumer) {
      this.consumer = consumer;
    }

    @Override protected void visit(Dimension dimension) {
      consumer.accept(dimension);
    }
  }
}

// End Finders.java

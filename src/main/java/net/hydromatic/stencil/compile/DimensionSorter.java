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
import static net.hydromatic.stencil.util.Static.distinctEager;
import static net.hydromatic.stencil.util.Static.filterEager;
import static net.hydromatic.stencil.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.DiscreteFunction;
import net.hydromatic.stencil.ast.SubDomain;
import net.hydromatic.stencil.ast.Sym;
import net.hydromatic.stencil.util.PartialOrders;

/**
 * Sorts the dimensions of an equation topologically, based on the order in
 * which they occur in its accesses.
 *
 * <p>The result determines the nesting of the loops generated for the
 * equation, outermost first; so the result is deterministic, and respects
 * every relation extracted from the equation's accesses, the ordering
 * declared by its sub-domain (if any), and the ancestry of derived
 * dimensions.
 *
 * <p>Instances are immutable, and may be used from several threads.
 */
public class DimensionSorter {
  private final Map<Prop, Object> map;
  private final Tracer tracer;

  /** Creates a DimensionSorter. */
  public DimensionSorter(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer);
  }

  /** Sorts the dimensions of an equation, using default properties. */
  public static ImmutableList<Dimension> dimensionSort(Sym.Equation equation) {
    return new DimensionSorter(ImmutableMap.of(), Tracers.empty())
        .sort(equation);
  }

  /**
   * Sorts the dimensions of an equation.
   *
   * @throws MultipleDimensionsException if the equation cannot be combined
   *   with the ordering of its sub-domain
   * @throws net.hydromatic.stencil.util.CycleException if the relations are
   *   contradictory
   */
  public ImmutableList<Dimension> sort(Sym.Equation equation) {
    try {
      final ImmutableList<Dimension> ordering = sort_(equation);
      tracer.onOrdering(equation, ordering);
      return ordering;
    } catch (RuntimeException e) {
      tracer.onException(equation, e);
      throw e;
    }
  }

  private ImmutableList<Dimension> sort_(Sym.Equation equation) {
    // Relations observed in accesses, including accesses in indices.
    // An empty relation (from, say, "a[3]") says nothing, so drop it. A
    // repeated dimension, as in "(x, y, x)" from "f[x, y, g[x]]", only
    // reinforces its first occurrence.
    Set<List<Dimension>> relations = new LinkedHashSet<>();
    for (Sym.Indexed indexed : Finders.indexeds(equation, true)) {
      final ImmutableList<Dimension> relation =
          distinctEager(RelationExtractor.extract(indexed));
      if (!relation.isEmpty()) {
        relations.add(relation);
      }
    }

    // Merge in the ordering declared by the sub-domain.
    final SubDomain subDomain = equation.subDomain;
    if (subDomain != null && !subDomain.indices.isEmpty()) {
      relations = combine(equation, subDomain, relations);
    }

    // Dimensions that are not in any relation: those that occur outside
    // accesses, and those of functions accessed only at fixed positions.
    final Set<Dimension> extraSet = new LinkedHashSet<>(
        Finders.dimensions(equation));
    if (Prop.INCLUDE_DATA_DIMENSIONS.booleanValue(map)) {
      for (DiscreteFunction function : Finders.functions(equation)) {
        extraSet.addAll(function.dimensions);
      }
    }
    final List<Dimension> extra = Dimension.BY_NAME.sortedCopy(extraSet);

    // Implicit relations.
    //
    // 1. A derived dimension follows its parent: "(time, t)", never
    // "(t, time)". Otherwise, given "((t, time), (t, x, y), (x, y))", "x"
    // could precede "time", whereas "t", and therefore "time", must precede
    // "x".
    //
    // 2. The roots of a relation are in the same order as the relation. Given
    // "((time, xi), (x))", where "xi" is derived from "x", we need "(time, x)"
    // as well as "(x, xi)"; otherwise "(x, time, xi)" would be valid.
    final Set<List<Dimension>> implicitRelations = new LinkedHashSet<>();
    final Set<Dimension> mentioned = new LinkedHashSet<>(extra);
    relations.forEach(mentioned::addAll);
    for (Dimension d : mentioned) {
      for (Dimension a : d.ancestors()) {
        final Dimension parent = a.parent();
        if (parent != null) {
          implicitRelations.add(ImmutableList.of(parent, a));
        }
      }
    }
    for (List<Dimension> relation : relations) {
      implicitRelations.add(
          distinctEager(transformEager(relation, Dimension::root)));
    }

    final Set<List<Dimension>> allRelations = new LinkedHashSet<>(relations);
    allRelations.addAll(implicitRelations);
    tracer.onRelations(equation, ImmutableSet.copyOf(allRelations));

    return PartialOrders.resolve(extra, allRelations, Dimension.BY_NAME);
  }

  /**
   * Combines the relations extracted from an equation with the ordering of
   * its sub-domain.
   *
   * <p>Each combined relation consists of the non-space dimensions of an
   * extracted relation, then the dimensions of the sub-domain, then the space
   * dimensions of the extracted relation; a dimension that occurs more than
   * once is kept only at its first occurrence.
   *
   * <p>A dimension of the extracted relation that is an ancestor of a
   * sub-domain dimension is omitted; for example, given sub-domain "(xi)",
   * "(t, x)" becomes "(t, xi)". The implicit relation "(x, xi)" places it.
   */
  private Set<List<Dimension>> combine(Sym.Equation equation,
      SubDomain subDomain, Set<List<Dimension>> relations) {
    final List<Dimension> ordering = subDomainDimensions(equation, subDomain);
    final Set<List<Dimension>> combined = new LinkedHashSet<>();
    if (relations.isEmpty()) {
      combined.add(distinctEager(ordering));
      return combined;
    }
    final Prop.SubdomainPolicy policy =
        Prop.SUBDOMAIN_POLICY.enumValue(map, Prop.SubdomainPolicy.class);
    if (policy == Prop.SubdomainPolicy.STRICT && relations.size() > 1) {
      throw new MultipleDimensionsException("cannot combine sub-domain "
          + subDomain + " with more than one relation " + relations,
          equation);
    }
    final Set<Dimension> covered = new HashSet<>();
    for (Dimension d : ordering) {
      covered.addAll(d.ancestors().subList(1, d.ancestors().size()));
    }
    for (List<Dimension> relation : relations) {
      final List<Dimension> remaining =
          filterEager(relation, d -> !covered.contains(d));
      final List<Dimension> list = new ArrayList<>();
      list.addAll(filterEager(remaining, d -> !d.isSpace()));
      list.addAll(ordering);
      list.addAll(filterEager(remaining, Dimension::isSpace));
      combined.add(distinctEager(list));
    }
    return combined;
  }

  /** Returns the dimension of each index of a sub-domain. An index must be a
   * dimension, or an expression with exactly one dimension among its
   * arguments (such as "xi + 1"). */
  private static List<Dimension> subDomainDimensions(Sym.Equation equation,
      SubDomain subDomain) {
    final List<Dimension> list = new ArrayList<>();
    for (Sym.Exp index : subDomain.indices) {
      if (index instanceof Dimension) {
        list.add((Dimension) index);
        continue;
      }
      final List<Dimension> dimensions = new ArrayList<>();
      for (Sym.Exp arg : index.args()) {
        if (arg instanceof Dimension) {
          dimensions.add((Dimension) arg);
        }
      }
      switch (dimensions.size()) {
      case 0:
        throw new AnalysisException("index " + index + " of sub-domain "
            + subDomain.name + " has no dimension", equation);
      case 1:
        list.add(dimensions.get(0));
        break;
      default:
        throw new MultipleDimensionsException("index " + index
            + " of sub-domain " + subDomain.name + " has more than one "
            + "dimension " + dimensions, equation);
      }
    }
    return list;
  }
}

// End DimensionSorter.java

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

import static net.hydromatic.stencil.Matchers.parentsFirst;
import static net.hydromatic.stencil.Matchers.respects;
import static net.hydromatic.stencil.ast.SymBuilder.sym;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.DiscreteFunction;
import net.hydromatic.stencil.ast.SubDomain;
import net.hydromatic.stencil.ast.Sym;
import net.hydromatic.stencil.util.CycleException;
import org.junit.jupiter.api.Test;

/** Tests {@link DimensionSorter}. */
class DimensionSorterTest {
  private final Dimension time = Dimension.time("time");
  private final Dimension t = Dimension.stepping("t", time);
  private final Dimension x = Dimension.space("x");
  private final Dimension y = Dimension.space("y");
  private final Dimension xi = Dimension.sub("xi", x);
  private final Dimension yi = Dimension.sub("yi", y);
  private final Dimension d = Dimension.of("d");

  /** Sorts, and checks that the result respects every relation given to the
   * resolver, and puts parents before derived dimensions. */
  private ImmutableList<Dimension> sort(Analyzer.Builder builder,
      Sym.Equation equation) {
    final Set<List<Dimension>> relations = new LinkedHashSet<>();
    final Analyzer analyzer =
        builder.withTracer(
                Tracers.withOnRelations(Tracers.empty(),
                    (e, rs) -> relations.addAll(rs)))
            .build();
    final ImmutableList<Dimension> ordering =
        analyzer.dimensionSort(equation);
    for (List<Dimension> relation : relations) {
      assertThat(ordering, respects(relation));
    }
    assertThat(ordering, parentsFirst());
    return ordering;
  }

  private ImmutableList<Dimension> sort(Sym.Equation equation) {
    return sort(Analyzer.builder(), equation);
  }

  /** "f[x, y] = g[x + 1, y - 2]"; nothing distinguishes "x" from "y" but
   * their names. */
  @Test void testSimple() {
    final DiscreteFunction f = DiscreteFunction.of("f", x, y);
    final DiscreteFunction g = DiscreteFunction.of("g", x, y);
    final Sym.Equation e =
        sym.equation(f.indexed(x, y),
            g.indexed(sym.plus(x, 1), sym.minus(y, 2)));
    assertThat(sort(e), is(ImmutableList.of(x, y)));
    assertThat(DimensionSorter.dimensionSort(e), is(ImmutableList.of(x, y)));
  }

  @Test void testDeterministic() {
    final DiscreteFunction f = DiscreteFunction.of("f", time, y, x);
    final DiscreteFunction g = DiscreteFunction.of("g", d);
    final Sym.Equation e =
        sym.equation(f.indexed(time, y, x),
            sym.plus(g.indexed(sym.intLiteral(0)), f.indexed(time, y, x)));
    final ImmutableList<Dimension> ordering = sort(e);
    assertThat(ordering, hasToString("[d, time, y, x]"));
    for (int i = 0; i < 5; i++) {
      assertThat(DimensionSorter.dimensionSort(e), is(ordering));
    }
  }

  /** The order of indices beats the order of names. */
  @Test void testRelationBeatsName() {
    final DiscreteFunction f = DiscreteFunction.of("f", y, x);
    final Sym.Equation e =
        sym.equation(f.indexed(y, x), sym.plus(f.indexed(y, x), x));
    assertThat(sort(e), is(ImmutableList.of(y, x)));
  }

  /** Dimensions that occur outside accesses take part, ordered by name. */
  @Test void testFreeDimension() {
    final DiscreteFunction f = DiscreteFunction.of("f", y);
    final Sym.Equation e =
        sym.equation(f.indexed(y), sym.times(f.indexed(y), x));
    assertThat(sort(e), is(ImmutableList.of(x, y)));
  }

  /** "h[x] = f[g[x]]"; "f" is indexed by the value of "g", so its
   * dimension "d" occurs in no relation. */
  @Test void testNested() {
    final DiscreteFunction f = DiscreteFunction.of("f", d);
    final DiscreteFunction g = DiscreteFunction.of("g", x);
    final DiscreteFunction h = DiscreteFunction.of("h", x);
    final Sym.Equation e =
        sym.equation(h.indexed(x), f.indexed(g.indexed(x)));
    assertThat(sort(e), is(ImmutableList.of(d, x)));
    assertThat(
        sort(Analyzer.builder().set(Prop.INCLUDE_DATA_DIMENSIONS, false), e),
        is(ImmutableList.of(x)));
  }

  /** "f[x, y, g[x]] = 0" yields the relation "(x, y, x)"; the second "x"
   * adds nothing, and in particular does not make "x" follow "y". */
  @Test void testRepeatedDimension() {
    final DiscreteFunction f = DiscreteFunction.of("f", x, y, d);
    final DiscreteFunction g = DiscreteFunction.of("g", x);
    final Sym.Indexed access = f.indexed(x, y, g.indexed(x));
    assertThat(RelationExtractor.extract(access), hasToString("[x, y, x]"));
    final Sym.Equation e = sym.equation(access, sym.intLiteral(0));
    assertThat(sort(e), is(ImmutableList.of(d, x, y)));
    assertThat(DimensionSorter.dimensionSort(e),
        is(ImmutableList.of(d, x, y)));
  }

  /** Dimensions of a function accessed only at fixed positions, as in
   * "a[3]", take part in the sort. */
  @Test void testDataDimensions() {
    final DiscreteFunction a = DiscreteFunction.of("a", d);
    final DiscreteFunction f = DiscreteFunction.of("f", x);
    final Sym.Equation e =
        sym.equation(f.indexed(x), a.indexed(sym.intLiteral(3)));
    assertThat(sort(e), is(ImmutableList.of(d, x)));
    assertThat(
        sort(Analyzer.builder().set("includeDataDimensions", "false"), e),
        is(ImmutableList.of(x)));
  }

  /** "u[t + 1, x, y] = u[t, x, y] + u[t, x + 1, y]"; "time" is not in the
   * equation, but as the parent of "t" it must precede it. */
  @Test void testTimeBuffered() {
    final DiscreteFunction u = DiscreteFunction.of("u", t, x, y);
    final Sym.Equation e =
        sym.equation(u.indexed(sym.plus(t, 1), x, y),
            sym.plus(u.indexed(t, x, y),
                u.indexed(t, sym.plus(x, 1), y)));
    assertThat(sort(e), is(ImmutableList.of(time, t, x, y)));
  }

  /** Given relations "(time, xi)" and "(x)", where "xi" is derived from "x",
   * the root relation "(time, x)" keeps "x" after "time", even though "x"
   * would otherwise come first. */
  @Test void testRootRelation() {
    final Dimension a = Dimension.space("a");
    final Dimension ai = Dimension.sub("ai", a);
    final DiscreteFunction u = DiscreteFunction.of("u", time, a);
    final DiscreteFunction w = DiscreteFunction.of("w", a);
    final Sym.Equation e =
        sym.equation(u.indexed(time, ai), w.indexed(a));
    assertThat(sort(e), is(ImmutableList.of(time, a, ai)));
  }

  /** With a sub-domain, non-space dimensions come first, then the
   * sub-domain's dimensions, then space dimensions. */
  @Test void testSubDomain() {
    final DiscreteFunction u = DiscreteFunction.of("u", x, time);
    final Sym.Exp access = u.indexed(x, time);
    final Sym.Equation e =
        sym.equation(access, sym.plus(access, sym.intLiteral(1)));
    assertThat(sort(e), is(ImmutableList.of(x, time)));

    final Sym.Equation e2 =
        sym.equation(access, sym.plus(access, sym.intLiteral(1)),
            SubDomain.of("interior", x));
    final List<Set<List<Dimension>>> relationsList = new ArrayList<>();
    final Analyzer analyzer =
        Analyzer.builder()
            .withTracer(
                Tracers.withOnRelations(Tracers.empty(),
                    (eq, relations) -> relationsList.add(relations)))
            .build();
    assertThat(analyzer.dimensionSort(e2), is(ImmutableList.of(time, x)));
    assertThat(relationsList, hasSize(1));
    assertThat(relationsList.get(0), hasItem(ImmutableList.of(time, x)));
  }

  /** An equation over a sub-domain whose accesses use the sub-domain's
   * derived dimensions. */
  @Test void testSubDomainDerived() {
    final DiscreteFunction v = DiscreteFunction.of("v", time, x, y);
    final Sym.Equation e =
        sym.equation(v.indexed(sym.plus(time, 1), xi, yi),
            v.indexed(time, xi, yi),
            SubDomain.of("interior", xi, yi));
    assertThat(sort(e), is(ImmutableList.of(time, x, xi, y, yi)));
  }

  /** "u[t + 1, x] = u[t, x]" over a sub-domain of "xi", a sub-range of
   * "x"; the accesses use "x", which the sub-domain refines to "xi". */
  @Test void testSubDomainOverDerivedDimension() {
    final DiscreteFunction u = DiscreteFunction.of("u", t, x);
    final Sym.Equation e =
        sym.equation(u.indexed(sym.plus(t, 1), x), u.indexed(t, x),
            SubDomain.of("interior", xi));
    assertThat(sort(e), is(ImmutableList.of(time, t, x, xi)));

    final DiscreteFunction v = DiscreteFunction.of("v", t, x, y);
    final Sym.Equation e2 =
        sym.equation(v.indexed(sym.plus(t, 1), x, y), v.indexed(t, x, y),
            SubDomain.of("interior", xi, yi));
    // "xi" and "yi" occur only in the sub-domain, so among unconstrained
    // dimensions they come last
    assertThat(sort(e2), is(ImmutableList.of(time, t, x, y, xi, yi)));
  }

  /** If accesses yield more than one relation, each is combined with the
   * sub-domain; unless the policy is strict. */
  @Test void testSubDomainMultipleRelations() {
    final DiscreteFunction p = DiscreteFunction.of("p", time, x);
    final DiscreteFunction q = DiscreteFunction.of("q", x, y);
    final Sym.Equation e =
        sym.equation(p.indexed(time, x), q.indexed(x, y),
            SubDomain.of("strip", y));
    assertThat(sort(e), is(ImmutableList.of(time, y, x)));

    final Analyzer.Builder strict =
        Analyzer.builder()
            .set(Prop.SUBDOMAIN_POLICY, Prop.SubdomainPolicy.STRICT);
    final MultipleDimensionsException ex =
        assertThrows(MultipleDimensionsException.class,
            () -> sort(strict, e));
    assertThat(ex.getMessage(),
        containsString("more than one relation"));
    assertThat(ex.equation(), sameInstance(e));
  }

  /** A sub-domain index associated with two dimensions is an error. */
  @Test void testSubDomainIndexWithTwoDimensions() {
    final DiscreteFunction f = DiscreteFunction.of("f", x, y);
    final Sym.Equation e =
        sym.equation(f.indexed(x, y), f.indexed(x, y),
            SubDomain.of("bad", ImmutableList.of(sym.plus(x, y))));
    final MultipleDimensionsException ex =
        assertThrows(MultipleDimensionsException.class,
            () -> DimensionSorter.dimensionSort(e));
    assertThat(ex.getMessage(),
        is("index x + y of sub-domain bad has more than one dimension "
            + "[x, y]"));
  }

  /** A sub-domain alone provides the relation if the accesses provide
   * none. */
  @Test void testSubDomainWithoutRelations() {
    final DiscreteFunction a = DiscreteFunction.of("a", d);
    final Sym.Equation e =
        sym.equation(a.indexed(sym.intLiteral(0)), sym.plus(y, x),
            SubDomain.of("all", y, x));
    assertThat(sort(e), is(ImmutableList.of(d, y, x)));
  }

  /** "f[x, y] = f[y, x]" has no valid order. */
  @Test void testCycle() {
    final DiscreteFunction f = DiscreteFunction.of("f", x, y);
    final Sym.Equation e = sym.equation(f.indexed(x, y), f.indexed(y, x));
    final List<RuntimeException> exceptions = new ArrayList<>();
    final Analyzer analyzer =
        Analyzer.builder()
            .withTracer(
                Tracers.withOnException(Tracers.empty(), exceptions::add))
            .build();
    final CycleException ex =
        assertThrows(CycleException.class, () -> analyzer.dimensionSort(e));
    assertThat(ex.vertices, is(ImmutableList.<Object>of(x, y)));
    assertThat(ex.getMessage(), is("cycle detected among [x, y]"));
    assertThat(exceptions, hasSize(1));
    assertThat(exceptions.get(0), sameInstance(ex));
  }
}

// End DimensionSorterTest.java

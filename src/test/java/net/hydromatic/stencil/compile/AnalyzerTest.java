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

import static net.hydromatic.stencil.ast.SymBuilder.sym;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.DiscreteFunction;
import net.hydromatic.stencil.ast.Sym;
import org.junit.jupiter.api.Test;

/** Tests {@link Analyzer}, {@link Prop} and {@link Tracers}. */
class AnalyzerTest {
  private final Dimension x = Dimension.space("x");
  private final Dimension y = Dimension.space("y");

  @Test void testLookup() {
    assertThat(Prop.lookup("subdomainPolicy"), is(Prop.SUBDOMAIN_POLICY));
    assertThat(Prop.lookup("SUBDOMAIN_POLICY"), is(Prop.SUBDOMAIN_POLICY));
    assertThat(Prop.lookup("includeDataDimensions"),
        is(Prop.INCLUDE_DATA_DIMENSIONS));
    assertThat(Prop.BY_CAMEL_NAME,
        is(ImmutableList.of(Prop.INCLUDE_DATA_DIMENSIONS,
            Prop.SUBDOMAIN_POLICY)));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("fooBar"));
    assertThat(e.getMessage(), is("property fooBar not found"));
  }

  @Test void testDefaults() {
    final Analyzer analyzer = Analyzer.create();
    assertThat(analyzer.props(), is(ImmutableMap.of()));
    assertThat(Prop.INCLUDE_DATA_DIMENSIONS.booleanValue(analyzer.props()),
        is(true));
    assertThat(
        Prop.SUBDOMAIN_POLICY.enumValue(analyzer.props(),
            Prop.SubdomainPolicy.class),
        is(Prop.SubdomainPolicy.MERGE));
    assertThat(Prop.SUBDOMAIN_POLICY.get(analyzer.props()),
        is(Prop.SubdomainPolicy.MERGE));
    assertThat(Prop.INCLUDE_DATA_DIMENSIONS.get(analyzer.props()),
        is(true));
  }

  @Test void testSet() {
    final Analyzer analyzer =
        Analyzer.builder()
            .set("subdomainPolicy", "strict")
            .set("INCLUDE_DATA_DIMENSIONS", false)
            .build();
    assertThat(analyzer.props().get(Prop.SUBDOMAIN_POLICY),
        is(Prop.SubdomainPolicy.STRICT));
    assertThat(Prop.INCLUDE_DATA_DIMENSIONS.booleanValue(analyzer.props()),
        is(false));
    assertThat(Prop.INCLUDE_DATA_DIMENSIONS.get(analyzer.props()),
        is(false));

    // the builder is not shared with the analyzer
    final Analyzer.Builder builder = Analyzer.builder();
    final Analyzer a1 = builder.build();
    builder.set(Prop.SUBDOMAIN_POLICY, Prop.SubdomainPolicy.STRICT);
    assertThat(a1.props().isEmpty(), is(true));
  }

  @Test void testSetInvalid() {
    final Analyzer.Builder builder = Analyzer.builder();
    final IllegalArgumentException e1 =
        assertThrows(IllegalArgumentException.class,
            () -> builder.set("subdomainPolicy", "lax"));
    assertThat(e1.getMessage(), is("value must be one of: 'MERGE', 'STRICT'"));

    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> builder.set(Prop.INCLUDE_DATA_DIMENSIONS, "true"));
    assertThat(e2.getMessage(),
        is("value for property includeDataDimensions must have type "
            + "class java.lang.Boolean"));

    final IllegalArgumentException e3 =
        assertThrows(IllegalArgumentException.class,
            () -> builder.set(Prop.SUBDOMAIN_POLICY, null));
    assertThat(e3.getMessage(), is("property subdomainPolicy is required"));

    final IllegalArgumentException e4 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.INCLUDE_DATA_DIMENSIONS.enumValue(ImmutableMap.of(),
                Prop.SubdomainPolicy.class));
    assertThat(e4.getMessage(),
        is("invalid type class java.lang.Boolean for property "
            + "includeDataDimensions"));
  }

  /** The tracer sees relations, then the ordering; and each equation's
   * stencil. */
  @Test void testTracer() {
    final DiscreteFunction f = DiscreteFunction.of("f", x, y);
    final Sym.Equation e1 =
        sym.equation(f.indexed(x, y), f.indexed(sym.plus(x, 1), y));
    final Sym.Equation e2 =
        sym.equation(f.indexed(x, y), f.indexed(x, sym.minus(y, 1)));
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnRelations(tracer,
        (e, relations) -> events.add("relations " + relations));
    tracer = Tracers.withOnOrdering(tracer,
        (e, ordering) -> events.add("ordering " + ordering));
    tracer = Tracers.withOnStencil(tracer,
        (e, stencil) -> events.add("stencil " + e + ": " + stencil));
    final Analyzer analyzer = Analyzer.builder().withTracer(tracer).build();

    assertThat(analyzer.dimensionSort(e1), is(ImmutableList.of(x, y)));
    assertThat(events,
        is(ImmutableList.of("relations [[x, y]]", "ordering [x, y]")));

    events.clear();
    final Stencil stencil = analyzer.stencil(e1, e2);
    assertThat(stencil, hasToString("{x=[0, 1], y=[-1, 0]}"));
    assertThat(events, hasSize(2));
    assertThat(events.get(0),
        is("stencil f[x, y] = f[x + 1, y]: {x=[0, 1], y=[0]}"));
    assertThat(events.get(1),
        is("stencil f[x, y] = f[x, y - 1]: {x=[0], y=[-1, 0]}"));
  }

  @Test void testAnalysisException() {
    final DiscreteFunction f = DiscreteFunction.of("f", x);
    final Sym.Equation e = sym.equation(f.indexed(x), sym.intLiteral(0));
    final AnalysisException ex = new AnalysisException("bad equation", e);
    assertThat(ex.equation(), sameInstance(e));
    assertThat(ex.getMessage(), is("bad equation"));
    assertThat(ex,
        hasToString(AnalysisException.class.getName()
            + ": bad equation in f[x] = 0"));
  }
}

// End AnalyzerTest.java

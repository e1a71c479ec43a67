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
/**
 * Analysis of equations for a stencil compiler.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.stencil.compile.Analyzer} - Main entry point.
 *       Holds properties and a tracer.
 *   <li>{@link net.hydromatic.stencil.compile.DimensionSorter} - Orders the
 *       dimensions of an equation, outermost loop first.
 *   <li>{@link net.hydromatic.stencil.compile.RelationExtractor} - Extracts
 *       the order of dimensions observed in one access.
 *   <li>{@link net.hydromatic.stencil.compile.Affine} - Decomposes an index
 *       into a dimension and an integer offset.
 *   <li>{@link net.hydromatic.stencil.compile.Stencil} - The offsets at which
 *       equations access each dimension.
 * </ul>
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * Dimension x = Dimension.space("x");
 * Dimension y = Dimension.space("y");
 * DiscreteFunction f = DiscreteFunction.of("f", x, y);
 * DiscreteFunction g = DiscreteFunction.of("g", x, y);
 * Sym.Equation e =
 *     sym.equation(f.indexed(x, y),
 *         g.indexed(sym.plus(x, 1), sym.minus(y, 2)));
 * Analyzer.create().dimensionSort(e);  // [x, y]
 * Analyzer.create().stencil(e);        // {x=[0, 1], y=[-2, 0]}
 * }</pre>
 */
package net.hydromatic.stencil.compile;

// End package-info.java

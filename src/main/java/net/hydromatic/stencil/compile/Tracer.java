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
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.Sym;

/** Called on various events during analysis. */
public interface Tracer {
  /** Called with the relations that will be given to the resolver, including
   * implicit relations. */
  void onRelations(Sym.Equation equation, Set<List<Dimension>> relations);

  /** Called with the result of sorting the dimensions of an equation. */
  void onOrdering(Sym.Equation equation, List<Dimension> ordering);

  /** Called with the stencil extracted from an equation. */
  void onStencil(Sym.Equation equation, Stencil stencil);

  /** Called with an exception thrown while analyzing an equation, just
   * before the exception is propagated to the caller. */
  void onException(Sym.Equation equation, RuntimeException e);
}

// End Tracer.java

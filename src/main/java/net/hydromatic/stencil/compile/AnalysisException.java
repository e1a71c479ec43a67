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

import net.hydromatic.stencil.ast.Sym;
import net.hydromatic.stencil.util.StencilException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** An error occurred while analyzing an equation. */
public class AnalysisException extends RuntimeException
    implements StencilException {
  private final Sym.@Nullable Equation equation;

  public AnalysisException(String message, Sym.@Nullable Equation equation) {
    super(message);
    this.equation = equation;
  }

  @Override public String toString() {
    return equation == null
        ? super.toString()
        : super.toString() + " in " + equation;
  }

  /** Returns the equation being analyzed, if known. */
  public Sym.@Nullable Equation equation() {
    return equation;
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    if (equation != null) {
      buf.append(equation).append(": ");
    }
    return buf.append("Error: ").append(getMessage());
  }
}

// End AnalysisException.java

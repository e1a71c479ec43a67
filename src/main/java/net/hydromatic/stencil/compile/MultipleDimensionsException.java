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

import net.hydromatic.stencil.ast.Sym;

/**
 * Thrown if an equation cannot be combined with the ordering of its
 * sub-domain: an index of the sub-domain is associated with more than one
 * dimension, or, under {@link Prop.SubdomainPolicy#STRICT}, the equation's
 * accesses yield more than one relation.
 *
 * <p>Usually indicates a malformed equation or sub-domain declaration.
 */
public class MultipleDimensionsException extends AnalysisException {
  public MultipleDimensionsException(String message, Sym.Equation equation) {
    super(message, requireNonNull(equation));
  }
}

// End MultipleDimensionsException.java

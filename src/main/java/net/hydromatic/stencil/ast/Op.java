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

/** Sub-types of {@link AstNode}. */
public enum Op {
  // atoms
  DIMENSION(true),
  SYMBOL(true),
  INT_LITERAL(true),
  REAL_LITERAL(true),

  // accesses
  /** Access to an element of a {@link DiscreteFunction}, "f[x, y + 1]". */
  INDEXED(true),
  /** Call to a named function that is opaque to analysis, "floor(x)". */
  APPLY(true),

  // arithmetic
  POWER(" ** ", 9, false),
  TIMES(" * ", 7),
  DIVIDE(" / ", 7),
  PLUS(" + ", 6),

  // equations
  EQ(" = ", 4);

  /** Padded name, e.g. " + ". */
  public final String padded;

  /** Left precedence. */
  public final int left;

  /** Right precedence. */
  public final int right;

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }
}

// End Op.java

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

/** Visits expression trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // atoms

  protected void visit(Dimension dimension) {}

  protected void visit(Sym.Symbol symbol) {}

  protected void visit(Sym.Literal literal) {}

  // calls

  protected void visit(Sym.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Sym.Apply apply) {
    apply.args.forEach(this::accept);
  }

  protected void visit(Sym.Indexed indexed) {
    indexed.indices.forEach(this::accept);
  }

  // equations

  protected void visit(Sym.Equation equation) {
    equation.lhs.accept(this);
    equation.rhs.accept(this);
  }
}

// End Visitor.java

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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbolic expressions.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Nodes are immutable, and are usually created via {@link SymBuilder}.
 * {@link Dimension} is also an expression, but lives in its own file.
 */
public class Sym {
  private Sym() {}

  /** Base class of expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }

    /** Returns the arguments of this expression; empty for atoms. */
    public List<Exp> args() {
      return ImmutableList.of();
    }

    /** Returns whether this expression is an integer literal. */
    public boolean isInteger() {
      return false;
    }
  }

  /** Named scalar that is not a dimension, such as a grid spacing "h_x". */
  public static class Symbol extends Exp {
    public final String name;

    Symbol(String name) {
      super(Op.SYMBOL);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Symbol
          && name.equals(((Symbol) o).name);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }
  }

  /**
   * Numeric constant.
   *
   * <p>The value of an {@link Op#INT_LITERAL} is a {@link Long}; the value of
   * an {@link Op#REAL_LITERAL} is a {@link BigDecimal}.
   */
  public static class Literal extends Exp {
    public final Number value;

    Literal(Op op, Number value) {
      super(op);
      this.value = requireNonNull(value);
      checkArgument(op == Op.INT_LITERAL ? value instanceof Long
          : op == Op.REAL_LITERAL && value instanceof BigDecimal);
    }

    @Override public boolean isInteger() {
      return op == Op.INT_LITERAL;
    }

    /** Returns the value of an integer literal. */
    public long longValue() {
      checkArgument(isInteger(), "not an integer: %s", this);
      return (Long) value;
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && op == ((Literal) o).op
          && value.equals(((Literal) o).value);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      final String s = value instanceof BigDecimal
          ? ((BigDecimal) value).toPlainString()
          : value.toString();
      if (s.startsWith("-") && left > 0) {
        return w.append("(").append(s).append(")");
      }
      return w.append(s);
    }
  }

  /** Arithmetic: sum, product, quotient or power. */
  public static class Call extends Exp {
    public final ImmutableList<Exp> args;

    Call(Op op, ImmutableList<Exp> args) {
      super(op);
      this.args = requireNonNull(args);
      checkArgument(op == Op.PLUS || op == Op.TIMES
          || op == Op.DIVIDE || op == Op.POWER, "bad op %s", op);
      checkArgument(args.size() >= 2, "too few args");
      checkArgument(args.size() == 2
          || op == Op.PLUS || op == Op.TIMES, "too many args");
    }

    @Override public List<Exp> args() {
      return args;
    }

    @Override public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Call
          && op == ((Call) o).op
          && args.equals(((Call) o).args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (left > op.left || op.right < right) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      final int last = args.size() - 1;
      for (int i = 0; i <= last; i++) {
        final Exp arg = args.get(i);
        final int argLeft = i == 0 ? left : op.right;
        final int argRight = i == last ? right : op.left;
        if (i > 0) {
          if (op == Op.PLUS
              && arg.isInteger()
              && ((Literal) arg).longValue() < 0) {
            // Write "x - 1" rather than "x + (-1)"
            w.append(" - ").append(Long.toString(-((Literal) arg).longValue()));
            continue;
          }
          w.append(op.padded);
        }
        arg.unparse(w, argLeft, argRight);
      }
      return w;
    }
  }

  /**
   * Call to a named function whose meaning is opaque to analysis, such as
   * "floor(x / 2)" or "sin(u[x])".
   */
  public static class Apply extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;

    Apply(String name, ImmutableList<Exp> args) {
      super(Op.APPLY);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override public List<Exp> args() {
      return args;
    }

    @Override public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Apply
          && name.equals(((Apply) o).name)
          && args.equals(((Apply) o).args);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).list("(", args, ")");
    }
  }

  /** Access to an element of a {@link DiscreteFunction}, "f[x, y + 1]".
   *
   * <p>There is one index expression per dimension of the function. An index
   * may itself contain accesses, as in "f[g[x]]". */
  public static class Indexed extends Exp {
    public final DiscreteFunction function;
    public final ImmutableList<Exp> indices;

    Indexed(DiscreteFunction function, ImmutableList<Exp> indices) {
      super(Op.INDEXED);
      this.function = requireNonNull(function);
      this.indices = requireNonNull(indices);
      checkArgument(indices.size() == function.dimensions.size(),
          "function %s has %s dimensions but access has %s indices",
          function.name, function.dimensions.size(), indices.size());
    }

    /** {@inheritDoc}
     *
     * <p>The arguments of an access are its indices. */
    @Override public List<Exp> args() {
      return indices;
    }

    @Override public int hashCode() {
      return Objects.hash(function, indices);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Indexed
          && function.equals(((Indexed) o).function)
          && indices.equals(((Indexed) o).indices);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(function.name).list("[", indices, "]");
    }
  }

  /** Equation "lhs = rhs", optionally restricted to a {@link SubDomain}. */
  public static class Equation extends AstNode {
    public final Exp lhs;
    public final Exp rhs;
    public final @Nullable SubDomain subDomain;

    Equation(Exp lhs, Exp rhs, @Nullable SubDomain subDomain) {
      super(Op.EQ);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      this.subDomain = subDomain;
    }

    @Override public int hashCode() {
      return Objects.hash(lhs, rhs, subDomain);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Equation
          && lhs.equals(((Equation) o).lhs)
          && rhs.equals(((Equation) o).rhs)
          && Objects.equals(subDomain, ((Equation) o).subDomain);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.infix(left, lhs, op, rhs, right);
      if (subDomain != null) {
        w.append(" in ").append(subDomain.toString());
      }
      return w;
    }
  }
}

// End Sym.java

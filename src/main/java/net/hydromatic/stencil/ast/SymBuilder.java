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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds expressions.
 *
 * <p>Arithmetic is put into a canonical form, as a computer algebra system
 * would: sums and products are flattened, integer constants are folded, and
 * subtraction becomes addition of a negated operand. So {@code minus(x, 2)}
 * yields a sum whose arguments are {@code x} and {@code -2}, and
 * {@code plus(plus(x, 1), 1)} yields {@code x + 2}.
 */
public enum SymBuilder {
  /** The singleton instance of the builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  sym;

  private final Sym.Literal zero = new Sym.Literal(Op.INT_LITERAL, 0L);

  private final Sym.Literal one = new Sym.Literal(Op.INT_LITERAL, 1L);

  private final Sym.Literal minusOne = new Sym.Literal(Op.INT_LITERAL, -1L);

  /** Creates a symbol that is not a dimension. */
  public Sym.Symbol symbol(String name) {
    return new Sym.Symbol(name);
  }

  /** Creates an integer literal. */
  public Sym.Literal intLiteral(long value) {
    return value == 0L ? zero
        : value == 1L ? one
        : value == -1L ? minusOne
        : new Sym.Literal(Op.INT_LITERAL, value);
  }

  /** Creates a real literal. */
  public Sym.Literal realLiteral(BigDecimal value) {
    return new Sym.Literal(Op.REAL_LITERAL, value);
  }

  /** Creates a real literal. */
  public Sym.Literal realLiteral(double value) {
    return realLiteral(BigDecimal.valueOf(value));
  }

  /** Creates a sum. */
  public Sym.Exp plus(Sym.Exp... args) {
    return plus(Arrays.asList(args));
  }

  /** Creates a sum of an expression and an integer constant. */
  public Sym.Exp plus(Sym.Exp e, long offset) {
    return plus(e, intLiteral(offset));
  }

  /** Creates a sum.
   *
   * <p>Nested sums are flattened; integer literals are folded into a single
   * constant, which comes last and is omitted if it is zero. */
  public Sym.Exp plus(List<? extends Sym.Exp> args) {
    final ImmutableList.Builder<Sym.Exp> terms = ImmutableList.builder();
    final long constant = flatten(Op.PLUS, args, terms, 0L);
    return build(Op.PLUS, terms, constant, 0L);
  }

  /** Creates a difference. */
  public Sym.Exp minus(Sym.Exp a0, Sym.Exp a1) {
    return plus(a0, negate(a1));
  }

  /** Creates the difference of an expression and an integer constant. */
  public Sym.Exp minus(Sym.Exp e, long offset) {
    return plus(e, intLiteral(-offset));
  }

  /** Creates the negation of an expression. */
  public Sym.Exp negate(Sym.Exp e) {
    if (e.isInteger()) {
      return intLiteral(-((Sym.Literal) e).longValue());
    }
    return times(minusOne, e);
  }

  /** Creates a product. */
  public Sym.Exp times(Sym.Exp... args) {
    return times(Arrays.asList(args));
  }

  /** Creates a product.
   *
   * <p>Nested products are flattened; integer literals are folded into a
   * single coefficient, which comes first and is omitted if it is one. A zero
   * coefficient yields zero. */
  public Sym.Exp times(List<? extends Sym.Exp> args) {
    final ImmutableList.Builder<Sym.Exp> factors = ImmutableList.builder();
    final long coefficient = flatten(Op.TIMES, args, factors, 1L);
    if (coefficient == 0L) {
      return zero;
    }
    return build(Op.TIMES, factors, coefficient, 1L);
  }

  /** Creates a quotient. */
  public Sym.Exp divide(Sym.Exp a0, Sym.Exp a1) {
    return new Sym.Call(Op.DIVIDE, ImmutableList.of(a0, a1));
  }

  /** Creates a power. */
  public Sym.Exp power(Sym.Exp a0, Sym.Exp a1) {
    return new Sym.Call(Op.POWER, ImmutableList.of(a0, a1));
  }

  /** Creates a call to a function that is opaque to analysis. */
  public Sym.Apply apply(String name, Sym.Exp... args) {
    return new Sym.Apply(name, ImmutableList.copyOf(args));
  }

  /** Creates an access to an element of a function. */
  public Sym.Indexed indexed(DiscreteFunction function, Sym.Exp... indices) {
    return indexed(function, Arrays.asList(indices));
  }

  /** Creates an access to an element of a function. */
  public Sym.Indexed indexed(DiscreteFunction function,
      List<? extends Sym.Exp> indices) {
    return new Sym.Indexed(function, ImmutableList.copyOf(indices));
  }

  /** Creates an equation. */
  public Sym.Equation equation(Sym.Exp lhs, Sym.Exp rhs) {
    return equation(lhs, rhs, null);
  }

  /** Creates an equation over a sub-domain. */
  public Sym.Equation equation(Sym.Exp lhs, Sym.Exp rhs,
      @Nullable SubDomain subDomain) {
    return new Sym.Equation(lhs, rhs, subDomain);
  }

  /** Adds the operands of an n-ary operator to a builder, expanding operands
   * that are calls to the same operator, and returns the result of combining
   * the integer literals with {@code identity}. */
  private static long flatten(Op op, List<? extends Sym.Exp> args,
      ImmutableList.Builder<Sym.Exp> builder, long identity) {
    long constant = identity;
    for (Sym.Exp arg : args) {
      requireNonNull(arg, "arg");
      if (arg.isInteger()) {
        constant = combine(op, constant, ((Sym.Literal) arg).longValue());
      } else if (arg.op == op) {
        constant = combine(op, constant,
            flatten(op, arg.args(), builder, identity));
      } else {
        builder.add(arg);
      }
    }
    return constant;
  }

  private static long combine(Op op, long v0, long v1) {
    return op == Op.PLUS
        ? Math.addExact(v0, v1)
        : Math.multiplyExact(v0, v1);
  }

  private Sym.Exp build(Op op, ImmutableList.Builder<Sym.Exp> builder,
      long constant, long identity) {
    final ImmutableList<Sym.Exp> operands = builder.build();
    final ImmutableList.Builder<Sym.Exp> args = ImmutableList.builder();
    if (op == Op.TIMES && constant != identity) {
      args.add(intLiteral(constant));
    }
    args.addAll(operands);
    if (op == Op.PLUS && constant != identity) {
      args.add(intLiteral(constant));
    }
    final ImmutableList<Sym.Exp> list = args.build();
    switch (list.size()) {
    case 0:
      return intLiteral(constant);
    case 1:
      return list.get(0);
    default:
      return new Sym.Call(op, list);
    }
  }
}

// End SymBuilder.java

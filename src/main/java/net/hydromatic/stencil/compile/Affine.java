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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.Sym;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Index expression of the form "dimension + offset", where the offset is an
 * integer constant.
 *
 * <p>For example, "x", "x + 1", "x - 2" and "1 + x - 3" are affine; "2 * x",
 * "x + y", "x + h", "x + 0.5" and "f[x]" are not.
 */
public final class Affine {
  public final Dimension dimension;
  public final long offset;

  private Affine(Dimension dimension, long offset) {
    this.dimension = requireNonNull(dimension);
    this.offset = offset;
  }

  /** Creates an Affine. */
  public static Affine of(Dimension dimension, long offset) {
    return new Affine(dimension, offset);
  }

  /**
   * Decomposes an expression into a dimension and an integer offset; returns
   * null if the expression is not affine.
   *
   * <p>The expression need not be in canonical form: integer constants are
   * folded, and integer coefficients are multiplied out, before deciding. The
   * expression is affine if, after folding, exactly one dimension remains,
   * with coefficient 1.
   *
   * @throws ArithmeticException if a coefficient or the offset overflows a
   *   {@code long}
   */
  public static @Nullable Affine decompose(Sym.Exp exp) {
    final LinearForm form = new LinearForm();
    if (!form.add(exp, 1L)) {
      return null;
    }
    return form.toAffine();
  }

  @Override public int hashCode() {
    return Objects.hash(dimension, offset);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Affine
        && dimension == ((Affine) o).dimension
        && offset == ((Affine) o).offset;
  }

  @Override public String toString() {
    return offset == 0 ? dimension.name
        : offset > 0 ? dimension.name + " + " + offset
        : dimension.name + " - " + -offset;
  }

  /** Sum of dimensions multiplied by integer coefficients, plus an integer
   * constant. */
  private static class LinearForm {
    final Map<Dimension, Long> coefficients = new LinkedHashMap<>();
    long constant;

    /** Adds {@code coefficient * exp} to this form; returns false if
     * {@code exp} is not linear in dimensions. */
    boolean add(Sym.Exp exp, long coefficient) {
      switch (exp.op) {
      case DIMENSION:
        coefficients.merge((Dimension) exp, coefficient, Math::addExact);
        return true;

      case INT_LITERAL:
        constant = Math.addExact(constant,
            Math.multiplyExact(coefficient, ((Sym.Literal) exp).longValue()));
        return true;

      case PLUS:
        for (Sym.Exp arg : exp.args()) {
          if (!add(arg, coefficient)) {
            return false;
          }
        }
        return true;

      case TIMES:
        // Linear only if all factors but one are integer literals
        long product = coefficient;
        Sym.@Nullable Exp term = null;
        for (Sym.Exp arg : exp.args()) {
          if (arg.isInteger()) {
            product =
                Math.multiplyExact(product, ((Sym.Literal) arg).longValue());
          } else if (term == null) {
            term = arg;
          } else {
            return false;
          }
        }
        if (term == null) {
          constant = Math.addExact(constant, product);
          return true;
        }
        return add(term, product);

      default:
        // symbols, reals, quotients, powers, opaque calls, accesses
        return false;
      }
    }

    @Nullable Affine toAffine() {
      Dimension dimension = null;
      for (Map.Entry<Dimension, Long> entry : coefficients.entrySet()) {
        final long c = entry.getValue();
        if (c == 0L) {
          continue;
        }
        if (c != 1L || dimension != null) {
          return null;
        }
        dimension = entry.getKey();
      }
      return dimension == null ? null : new Affine(dimension, constant);
    }
  }
}

// End Affine.java

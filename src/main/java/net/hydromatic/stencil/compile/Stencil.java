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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.TreeSet;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.Sym;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mapping from dimensions to the set of integer offsets at which equations
 * access them; that is, the neighboring points accessed. Zero offsets are
 * included.
 *
 * <p>The dimensions are ordered by insertion, which for a stencil extracted
 * from an equation is the order in which they were first encountered. The
 * offsets of a dimension have no significant order, though they are printed
 * in ascending order.
 *
 * <p>Looking up a dimension that is not present returns "{0}"; the zero
 * offset is the default, never absence.
 *
 * <p>A stencil is mutable until {@link #frozen() frozen}. A stencil is not
 * thread-safe, but a frozen stencil is immutable and may be shared.
 */
public class Stencil {
  private static final ImmutableSortedSet<Long> ZERO =
      ImmutableSortedSet.of(0L);

  private final Map<Dimension, NavigableSet<Long>> map = new LinkedHashMap<>();
  private final boolean frozen;

  /** Creates an empty, mutable Stencil. */
  public Stencil() {
    this(false);
  }

  private Stencil(boolean frozen) {
    this.frozen = frozen;
  }

  /** Creates a mutable Stencil from a list of entries. If a dimension occurs
   * in more than one entry, the last entry wins. */
  public static Stencil of(Iterable<Entry> entries) {
    final Stencil stencil = new Stencil();
    for (Entry entry : entries) {
      stencil.put(entry.dimension, entry.offsets);
    }
    return stencil;
  }

  /** Creates a mutable Stencil that is the union of the stencils of some
   * equations. */
  public static Stencil of(Sym.Equation... equations) {
    final Stencil stencil = new Stencil();
    for (Sym.Equation equation : equations) {
      stencil.addAll(extract(equation));
    }
    return stencil;
  }

  /**
   * Computes the stencil of an equation.
   *
   * <p>Looks at every access in the equation, including accesses in the
   * indices of other accesses. For each index of an access: if the index is
   * a dimension, registers offset 0 for that dimension; otherwise, if a
   * dimension is among the arguments of the index, registers the integer
   * literals among the arguments as offsets of that dimension. Thus "x + 1"
   * registers offset 1 for "x", and "x - 2" (whose arguments are "x" and
   * "-2") registers -2.
   */
  public static Stencil extract(Sym.Equation equation) {
    final Stencil stencil = new Stencil();
    for (Sym.Indexed indexed : Finders.indexeds(equation, true)) {
      for (Sym.Exp index : indexed.indices) {
        if (index instanceof Dimension) {
          stencil.update((Dimension) index, ZERO);
          continue;
        }
        Dimension dimension = null;
        final List<Long> offsets = new ArrayList<>();
        for (Sym.Exp arg : index.args()) {
          if (arg instanceof Dimension) {
            dimension = (Dimension) arg;
          } else if (arg.isInteger()) {
            offsets.add(((Sym.Literal) arg).longValue());
          }
        }
        if (dimension != null) {
          stencil.update(dimension, offsets);
        }
      }
    }
    return stencil;
  }

  /** Computes the union of some stencils. The result is mutable, and
   * contains only dimensions present in at least one of the stencils. */
  public static Stencil union(Stencil... stencils) {
    final Stencil output = new Stencil();
    for (Stencil stencil : stencils) {
      output.addAll(stencil);
    }
    return output;
  }

  /**
   * Computes the set difference, for each dimension in this stencil, with
   * the corresponding dimension in another stencil.
   *
   * <p>Dimensions present only in this stencil are unchanged; dimensions
   * present only in {@code o} are ignored. The result is mutable.
   */
  public Stencil subtract(Stencil o) {
    final Stencil output = new Stencil();
    map.forEach((dimension, offsets) -> {
      final NavigableSet<Long> set = new TreeSet<>(offsets);
      final NavigableSet<Long> other = o.map.get(dimension);
      if (other != null) {
        set.removeAll(other);
      }
      output.map.put(dimension, set);
    });
    return output;
  }

  /** Returns an immutable copy of this stencil. */
  public Stencil frozen() {
    if (frozen) {
      return this;
    }
    final Stencil output = new Stencil(true);
    map.forEach((dimension, offsets) ->
        output.map.put(dimension, ImmutableSortedSet.copyOf(offsets)));
    return output;
  }

  /** Returns whether this stencil is immutable. */
  public boolean isFrozen() {
    return frozen;
  }

  /** Returns whether every dimension has an empty set of offsets. (A stencil
   * with no dimensions is empty.) */
  public boolean isEmpty() {
    return map.values().stream().allMatch(Collection::isEmpty);
  }

  /** Returns whether a dimension is present. */
  public boolean containsKey(Dimension dimension) {
    return map.containsKey(dimension);
  }

  /** Returns the offsets of a dimension, or "{0}" if the dimension is not
   * present. */
  public ImmutableSortedSet<Long> get(Dimension dimension) {
    final NavigableSet<Long> offsets = map.get(dimension);
    return offsets == null ? ZERO : ImmutableSortedSet.copyOf(offsets);
  }

  /** Returns the dimensions, in order of insertion. */
  public ImmutableList<Dimension> dimensions() {
    return ImmutableList.copyOf(map.keySet());
  }

  /** Returns the entries, in order of insertion. */
  public ImmutableList<Entry> entries() {
    final ImmutableList.Builder<Entry> b = ImmutableList.builder();
    map.forEach((dimension, offsets) -> b.add(new Entry(dimension, offsets)));
    return b.build();
  }

  /** Returns the number of dimensions. */
  public int size() {
    return map.size();
  }

  /** Sets the offsets of a dimension, replacing any previous offsets. */
  public Stencil put(Dimension dimension, Collection<Long> offsets) {
    checkMutable();
    map.put(requireNonNull(dimension, "dimension"), copy(offsets));
    return this;
  }

  /** Adds offsets to a dimension. The dimension is present afterwards, even
   * if {@code offsets} is empty. */
  public Stencil update(Dimension dimension, Collection<Long> offsets) {
    checkMutable();
    map.computeIfAbsent(requireNonNull(dimension, "dimension"),
        d -> new TreeSet<>())
        .addAll(copy(offsets));
    return this;
  }

  private void addAll(Stencil stencil) {
    stencil.map.forEach(this::update);
  }

  private void checkMutable() {
    if (frozen) {
      throw new UnsupportedOperationException("stencil is frozen");
    }
  }

  private static NavigableSet<Long> copy(Collection<Long> offsets) {
    requireNonNull(offsets, "offsets");
    for (Long offset : offsets) {
      checkArgument(offset != null, "null offset");
    }
    return new TreeSet<>(offsets);
  }

  @Override public int hashCode() {
    return map.hashCode();
  }

  @Override public boolean equals(@Nullable Object o) {
    return o == this
        || o instanceof Stencil
        && map.equals(((Stencil) o).map);
  }

  @Override public String toString() {
    return map.toString();
  }

  /** Dimension and its offsets. */
  public static final class Entry {
    public final Dimension dimension;
    public final ImmutableSortedSet<Long> offsets;

    public Entry(Dimension dimension, Collection<Long> offsets) {
      this.dimension = requireNonNull(dimension, "dimension");
      this.offsets = ImmutableSortedSet.copyOf(copy(offsets));
    }

    @Override public int hashCode() {
      return Objects.hash(dimension, offsets);
    }

    @Override public boolean equals(@Nullable Object o) {
      return o == this
          || o instanceof Entry
          && dimension == ((Entry) o).dimension
          && offsets.equals(((Entry) o).offsets);
    }

    @Override public String toString() {
      return dimension.name + "=" + offsets;
    }
  }
}

// End Stencil.java

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
import com.google.common.collect.Ordering;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Named axis of a computation, such as "x" or "time".
 *
 * <p>A dimension may be <em>derived</em> from a parent dimension; for
 * example, "t" may be a buffered view of "time", and "xi" may be a sub-range
 * of "x". A derived dimension has the same {@link Kind} as its parent.
 *
 * <p>Dimensions are created once per grid and shared by many equations.
 * They are immutable, and compared by identity; two dimensions with the same
 * name are not equal.
 */
public class Dimension extends Sym.Exp {
  /** Orders dimensions by name. */
  public static final Ordering<Dimension> BY_NAME =
      Ordering.<String>natural().onResultOf((Dimension d) -> d.name);

  public final String name;
  public final Kind kind;
  private final @Nullable Dimension parent;

  private Dimension(String name, Kind kind, @Nullable Dimension parent) {
    super(Op.DIMENSION);
    this.name = requireNonNull(name, "name");
    this.kind = requireNonNull(kind, "kind");
    this.parent = parent;
    checkArgument(!name.isEmpty(), "empty name");
    checkArgument(parent == null || parent.kind == kind,
        "kind %s of %s differs from kind %s of its parent", kind, name,
        parent == null ? null : parent.kind);
  }

  /** Creates a space dimension. */
  public static Dimension space(String name) {
    return new Dimension(name, Kind.SPACE, null);
  }

  /** Creates a time dimension. */
  public static Dimension time(String name) {
    return new Dimension(name, Kind.TIME, null);
  }

  /** Creates a dimension that is neither space nor time. */
  public static Dimension of(String name) {
    return new Dimension(name, Kind.DEFAULT, null);
  }

  /** Creates a dimension that steps through a buffer along its parent,
   * typically "t" over "time". */
  public static Dimension stepping(String name, Dimension parent) {
    return new Dimension(name, parent.kind, parent);
  }

  /** Creates a dimension that iterates over a sub-range of its parent. */
  public static Dimension sub(String name, Dimension parent) {
    return new Dimension(name, parent.kind, parent);
  }

  /** Returns whether this is a space dimension (possibly derived from
   * one). */
  public boolean isSpace() {
    return kind == Kind.SPACE;
  }

  /** Returns whether this dimension is derived from another. */
  public boolean isDerived() {
    return parent != null;
  }

  /** Returns the parent of a derived dimension, or null. */
  public @Nullable Dimension parent() {
    return parent;
  }

  /** Returns the topmost ancestor; a dimension that is not derived is its own
   * root. */
  public Dimension root() {
    Dimension d = this;
    while (d.parent != null) {
      d = d.parent;
    }
    return d;
  }

  /** Returns this dimension and its ancestors, this dimension first. */
  public ImmutableList<Dimension> ancestors() {
    final ImmutableList.Builder<Dimension> b = ImmutableList.builder();
    for (Dimension d = this; d != null; d = d.parent) {
      b.add(d);
    }
    return b.build();
  }

  @Override public void accept(Visitor visitor) {
    visitor.visit(this);
  }

  @Override AstWriter unparse(AstWriter w, int left, int right) {
    return w.append(name);
  }

  /** Kind of dimension. */
  public enum Kind {
    /** Spatial axis. */
    SPACE,
    /** Time axis. */
    TIME,
    /** Any other axis, for example the index of a data array. */
    DEFAULT
  }
}

// End Dimension.java

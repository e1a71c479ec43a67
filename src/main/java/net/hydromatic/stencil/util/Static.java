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
package net.hydromatic.stencil.util;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Eagerly converts a List to an ImmutableList, applying a mapping function to
   * each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      List<? extends E> elements, Function<E, T> mapper) {
    switch (elements.size()) {
    case 0:
      // Save ourselves the effort of creating a Builder.
      return ImmutableList.of();

    case 1:
      return ImmutableList.of(mapper.apply(elements.get(0)));

    default:
      final ImmutableList.Builder<T> b =
          ImmutableList.builderWithExpectedSize(elements.size());
      elements.forEach(e -> b.add(mapper.apply(e)));
      return b.build();
    }
  }

  /**
   * Eagerly converts a List to an ImmutableList, keeping elements that pass a
   * predicate.
   */
  public static <E> ImmutableList<E> filterEager(
      List<? extends E> elements, Predicate<E> predicate) {
    final ImmutableList.Builder<E> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    for (E e : elements) {
      if (predicate.test(e)) {
        b.add(e);
      }
    }
    return b.build();
  }

  /**
   * Eagerly converts a List to an ImmutableList, keeping only the first
   * occurrence of each element.
   */
  public static <E> ImmutableList<E> distinctEager(List<? extends E> elements) {
    final Set<E> seen = new HashSet<>();
    return filterEager(elements, seen::add);
  }
}

// End Static.java

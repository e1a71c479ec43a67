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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.stencil.ast.Dimension;
import net.hydromatic.stencil.ast.Sym;

/**
 * Extracts the relation of an access; that is, the dimensions of its indices,
 * in the order that they occur.
 *
 * <p>For each index, in order:
 *
 * <ol>
 *   <li>If the index is affine ("x", "x + 1"), adds its dimension.
 *   <li>Otherwise, if the index contains accesses (as "g[x]" in "f[g[x]]"),
 *       adds the relations of those accesses.
 *   <li>Otherwise, adds the dimensions that occur in the index, sorted by
 *       name.
 * </ol>
 *
 * <p>The result may contain duplicates; for example, "f[x, g[x]]" yields
 * "(x, x)".
 */
public class RelationExtractor {
  private RelationExtractor() {}

  /** Returns the relation of an access. */
  public static ImmutableList<Dimension> extract(Sym.Indexed indexed) {
    final ImmutableList.Builder<Dimension> relation = ImmutableList.builder();
    for (Sym.Exp index : indexed.indices) {
      final Affine affine = Affine.decompose(index);
      if (affine != null) {
        relation.add(affine.dimension);
        continue;
      }

      final ImmutableList.Builder<Dimension> nested = ImmutableList.builder();
      for (Sym.Indexed indexed2 : Finders.indexeds(index, false)) {
        nested.addAll(extract(indexed2));
      }
      final List<Dimension> nestedList = nested.build();
      if (!nestedList.isEmpty()) {
        relation.addAll(nestedList);
        continue;
      }

      // Whatever the index means, its dimensions are all we have
      relation.addAll(Dimension.BY_NAME.sortedCopy(Finders.dimensions(index)));
    }
    return relation.build();
  }
}

// End RelationExtractor.java

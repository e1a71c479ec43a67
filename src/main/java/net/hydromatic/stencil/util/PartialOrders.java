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
import com.google.common.graph.ElementOrder;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Resolves partial orders into total orders.
 *
 * <p>Each relation is a list of elements, meaning that each element precedes
 * the next. Relations from different sources are independent observations;
 * together they induce a directed graph, and a topological sort of that graph
 * is a total order consistent with all of them.
 */
public abstract class PartialOrders {
  private PartialOrders() {}

  /**
   * Returns a total order of the given elements, and of the members of the
   * given relations, that is consistent with every relation.
   *
   * <p>The result is deterministic. When several elements are unconstrained
   * at a given step, the one that occurs earliest in {@code elements} is
   * chosen; elements that occur only in relations come after those in
   * {@code elements}, and are ordered by {@code tieBreak}.
   *
   * <p>A relation may repeat an element in adjacent positions, as in
   * "(x, x, y)"; that adds no constraint.
   *
   * @param elements Elements, in order of preference
   * @param relations Relations; each a list of elements
   * @param tieBreak Comparator used to order elements of equal preference
   * @param <E> Element type
   *
   * @throws CycleException if the relations are contradictory
   */
  public static <E> ImmutableList<E> resolve(Iterable<? extends E> elements,
      Iterable<? extends List<? extends E>> relations,
      Comparator<? super E> tieBreak) {
    final MutableGraph<E> graph =
        GraphBuilder.directed()
            .allowsSelfLoops(false)
            .nodeOrder(ElementOrder.insertion())
            .build();
    final Map<E, Integer> preference = new HashMap<>();
    for (E e : elements) {
      graph.addNode(e);
      preference.putIfAbsent(e, preference.size());
    }
    for (List<? extends E> relation : relations) {
      E previous = null;
      for (E e : relation) {
        graph.addNode(e);
        if (previous != null && !previous.equals(e)) {
          graph.putEdge(previous, e);
        }
        previous = e;
      }
    }
    return sort(graph, preference, tieBreak);
  }

  /** Sorts a graph topologically (Kahn's algorithm), choosing among ready
   * nodes by preference, then tie-break, then order of insertion. */
  private static <E> ImmutableList<E> sort(MutableGraph<E> graph,
      Map<E, Integer> preference, Comparator<? super E> tieBreak) {
    final Map<E, Integer> position = new HashMap<>();
    final Map<E, Integer> inDegrees = new HashMap<>();
    for (E node : graph.nodes()) {
      position.put(node, position.size());
      inDegrees.put(node, graph.inDegree(node));
    }
    final Comparator<E> comparator =
        Comparator.<E>comparingInt(e ->
                preference.getOrDefault(e, Integer.MAX_VALUE))
            .thenComparing(tieBreak)
            .thenComparingInt(position::get);
    final PriorityQueue<E> ready = new PriorityQueue<>(comparator);
    inDegrees.forEach((node, inDegree) -> {
      if (inDegree == 0) {
        ready.add(node);
      }
    });

    final ImmutableList.Builder<E> b =
        ImmutableList.builderWithExpectedSize(graph.nodes().size());
    int count = 0;
    while (!ready.isEmpty()) {
      final E node = ready.poll();
      b.add(node);
      ++count;
      for (E successor : graph.successors(node)) {
        if (inDegrees.merge(successor, -1, Integer::sum) == 0) {
          ready.add(successor);
        }
      }
    }

    if (count < graph.nodes().size()) {
      final List<E> unresolved = new ArrayList<>();
      for (E node : graph.nodes()) {
        if (inDegrees.get(node) > 0) {
          unresolved.add(node);
        }
      }
      throw new CycleException(unresolved);
    }
    return b.build();
  }
}

// End PartialOrders.java

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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Thrown by {@link PartialOrders#resolve} if relations are contradictory;
 * that is, if the graph of "precedes" edges has a cycle.
 *
 * <p>No total order exists, so the caller should not retry; usually an
 * equation was constructed incorrectly.
 */
public class CycleException extends RuntimeException
    implements StencilException {
  /** Elements that could not be ordered; each lies on, or after, a cycle. */
  public final ImmutableList<Object> vertices;

  public CycleException(List<?> vertices) {
    super("cycle detected among " + vertices);
    this.vertices = ImmutableList.copyOf(requireNonNull(vertices));
  }

  @Override public StringBuilder describeTo(StringBuilder buf) {
    return buf.append("Error: ").append(getMessage());
  }
}

// End CycleException.java

/*
 * Copyright 2018-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.facebook.buildplan.graph;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Breadth-first walk over the nodes reachable from a set of initial nodes. Every node is visited
 * once, even on cyclic input. Instances run at most once.
 */
public abstract class AbstractBreadthFirstTraversal<Node> {

  private final Deque<Node> frontier = new ArrayDeque<>();
  private final Set<Node> explored = new LinkedHashSet<>();
  private boolean started;

  public AbstractBreadthFirstTraversal(Node initialNode) {
    this(ImmutableList.of(initialNode));
  }

  public AbstractBreadthFirstTraversal(Iterable<? extends Node> initialNodes) {
    Iterables.addAll(frontier, initialNodes);
  }

  /** Runs the traversal and returns the explored nodes in visiting order. */
  public final ImmutableSet<Node> start() {
    Preconditions.checkState(!started, "Traversal has already been run.");
    started = true;
    for (Node node = frontier.poll(); node != null; node = frontier.poll()) {
      if (!explored.add(node)) {
        continue;
      }
      for (Node next : visit(node)) {
        if (!explored.contains(next)) {
          frontier.addLast(next);
        }
      }
    }
    return getExplored();
  }

  public final ImmutableSet<Node> getExplored() {
    return ImmutableSet.copyOf(explored);
  }

  /** Returns the direct successors of {@code node}; they are visited after the current level. */
  public abstract Iterable<? extends Node> visit(Node node);
}

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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Depth-first, post-order walk over a graph that must be acyclic. Children are explored in the
 * order {@link GraphTraversable#findChildren} returns them.
 *
 * @param <T> the type of node in the graph
 */
public class AcyclicDepthFirstPostOrderTraversal<T> {

  private final GraphTraversable<T> traversable;

  public AcyclicDepthFirstPostOrderTraversal(GraphTraversable<T> traversable) {
    this.traversable = traversable;
  }

  /**
   * @param initialNodes where to start, in order. Not allowed to contain {@code null}.
   * @return every reachable node exactly once, each after all of its children.
   * @throws CycleException if a node is reached again while it is still on the current path.
   */
  public ImmutableList<T> traverse(Iterable<? extends T> initialNodes) throws CycleException {
    Set<T> explored = new LinkedHashSet<>();
    // The current path from an initial node, each entry holding its unexplored children.
    LinkedHashMap<T, Iterator<T>> path = new LinkedHashMap<>();

    for (T initialNode : initialNodes) {
      if (!explored.contains(initialNode)) {
        enter(path, initialNode);
      }
      while (!path.isEmpty()) {
        Map.Entry<T, Iterator<T>> top = Iterables.getLast(path.entrySet());
        T child = nextUnexplored(top.getValue(), explored, path);
        if (child != null) {
          enter(path, child);
          continue;
        }
        path.remove(top.getKey());
        explored.add(top.getKey());
        onNodeExplored(top.getKey());
      }
    }
    return ImmutableList.copyOf(explored);
  }

  /** Called once per node, after all of its transitive children have been explored. */
  protected void onNodeExplored(T node) {}

  private void enter(LinkedHashMap<T, Iterator<T>> path, T node) {
    path.put(Preconditions.checkNotNull(node), traversable.findChildren(node));
  }

  @Nullable
  private T nextUnexplored(Iterator<T> children, Set<T> explored, Map<T, Iterator<T>> path)
      throws CycleException {
    while (children.hasNext()) {
      T child = children.next();
      if (path.containsKey(child)) {
        ImmutableList.Builder<T> cycle = ImmutableList.builder();
        boolean inCycle = false;
        for (T onPath : path.keySet()) {
          inCycle |= onPath.equals(child);
          if (inCycle) {
            cycle.add(onPath);
          }
        }
        throw new CycleException(cycle.add(child).build());
      }
      if (!explored.contains(child)) {
        return child;
      }
    }
    return null;
  }

  @SuppressWarnings("serial")
  public static final class CycleException extends Exception {

    private final ImmutableList<?> nodes;

    private CycleException(ImmutableList<?> nodes) {
      super("Cycle found: " + Joiner.on(" -> ").join(nodes));
      this.nodes = nodes;
    }

    /** The nodes of the cycle, starting and ending with the same node. */
    public ImmutableList<?> getCycle() {
      return nodes;
    }
  }
}

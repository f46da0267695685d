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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.Multimap;
import org.junit.Test;

public class AbstractBreadthFirstTraversalTest {

  @Test
  public void visitsEveryReachableNodeOnceInBreadthFirstOrder() {
    Multimap<String, String> graph = LinkedListMultimap.create();
    graph.put("root", "b");
    graph.put("root", "a");
    graph.put("a", "c");
    graph.put("b", "c");
    graph.put("c", "root");
    graph.put("unreachable", "a");

    AbstractBreadthFirstTraversal<String> traversal =
        new AbstractBreadthFirstTraversal<String>("root") {
          @Override
          public Iterable<String> visit(String node) {
            return graph.get(node);
          }
        };

    assertThat(traversal.start(), contains("root", "b", "a", "c"));
    assertThat(traversal.getExplored(), contains("root", "b", "a", "c"));
  }

  @Test
  public void startsFromEveryInitialNode() {
    Multimap<String, String> graph = LinkedListMultimap.create();
    graph.put("x", "shared");
    graph.put("y", "shared");

    AbstractBreadthFirstTraversal<String> traversal =
        new AbstractBreadthFirstTraversal<String>(ImmutableList.of("x", "y")) {
          @Override
          public Iterable<String> visit(String node) {
            return graph.get(node);
          }
        };
    traversal.start();

    assertThat(traversal.getExplored(), contains("x", "y", "shared"));
  }

  @Test(expected = IllegalStateException.class)
  public void runsOnlyOnce() {
    AbstractBreadthFirstTraversal<String> traversal =
        new AbstractBreadthFirstTraversal<String>("only") {
          @Override
          public Iterable<String> visit(String node) {
            return ImmutableList.of();
          }
        };
    traversal.start();
    traversal.start();
  }
}

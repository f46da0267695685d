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
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.Multimap;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class AcyclicDepthFirstPostOrderTraversalTest {

  /**
   * Verifies that a traversal of a well-formed DAG proceeds as expected.
   *
   * <pre>
   *         A
   *       /   \
   *     B       C
   *   /   \   /
   * D       E
   *   \   /
   *     F
   * </pre>
   */
  @Test
  public void testExpectedTraversal() throws AcyclicDepthFirstPostOrderTraversal.CycleException {
    Multimap<String, String> graph = LinkedListMultimap.create();
    graph.put("A", "B");
    graph.put("A", "C");
    graph.put("B", "D");
    graph.put("B", "E");
    graph.put("C", "E");
    graph.put("D", "F");
    graph.put("E", "F");
    TestDagDepthFirstSearch dfs = new TestDagDepthFirstSearch(graph);

    ImmutableList<String> postOrder = dfs.traverse(ImmutableList.of("A"));

    assertThat(postOrder, contains("F", "D", "E", "B", "C", "A"));
    assertThat(dfs.exploredNodes, equalTo(postOrder));
  }

  @Test
  public void testMultipleInitialNodesShareExploredNodes()
      throws AcyclicDepthFirstPostOrderTraversal.CycleException {
    Multimap<String, String> graph = LinkedListMultimap.create();
    graph.put("A", "C");
    graph.put("B", "C");
    graph.put("C", "D");
    TestDagDepthFirstSearch dfs = new TestDagDepthFirstSearch(graph);

    assertThat(dfs.traverse(ImmutableList.of("A", "B", "A")), contains("D", "C", "A", "B"));
  }

  /**
   * Verifies that the reported cycle starts and ends at the node that was found twice.
   *
   * <pre>
   *   A -> B -> C -> D -> B
   * </pre>
   */
  @Test
  public void testCycleDetection() {
    Multimap<String, String> graph = LinkedListMultimap.create();
    graph.put("A", "B");
    graph.put("B", "C");
    graph.put("C", "D");
    graph.put("D", "B");
    TestDagDepthFirstSearch dfs = new TestDagDepthFirstSearch(graph);

    try {
      dfs.traverse(ImmutableList.of("A"));
      fail("Should have thrown a CycleException.");
    } catch (AcyclicDepthFirstPostOrderTraversal.CycleException e) {
      assertThat(e.getMessage(), equalTo("Cycle found: B -> C -> D -> B"));
      assertThat(e.getCycle(), contains("B", "C", "D", "B"));
    }
  }

  @Test
  public void testSelfLoopIsACycle() {
    Multimap<String, String> graph = LinkedListMultimap.create();
    graph.put("A", "A");
    TestDagDepthFirstSearch dfs = new TestDagDepthFirstSearch(graph);

    try {
      dfs.traverse(ImmutableList.of("A"));
      fail("Should have thrown a CycleException.");
    } catch (AcyclicDepthFirstPostOrderTraversal.CycleException e) {
      assertThat(e.getCycle(), contains("A", "A"));
    }
  }

  private static class TestDagDepthFirstSearch extends AcyclicDepthFirstPostOrderTraversal<String> {

    private final List<String> exploredNodes = new ArrayList<>();

    TestDagDepthFirstSearch(Multimap<String, String> graph) {
      super(node -> graph.get(node).iterator());
    }

    @Override
    protected void onNodeExplored(String node) {
      exploredNodes.add(node);
    }
  }
}

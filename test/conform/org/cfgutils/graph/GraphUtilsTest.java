/***
 * ASM: a very small and fast Java bytecode manipulation framework
 * Copyright (c) 2000-2011 INRIA, France Telecom
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions
 * are met:
 * 1. Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 2. Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the distribution.
 * 3. Neither the name of the copyright holders nor the names of its
 *    contributors may be used to endorse or promote products derived from
 *    this software without specific prior written permission.
 *
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT OWNER OR CONTRIBUTORS BE
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF
 * THE POSSIBILITY OF SUCH DAMAGE.
 */
package org.cfgutils.graph;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import junit.framework.TestCase;

public class GraphUtilsTest extends TestCase {

    private static DiGraph<Integer> graph(int[][] edges) {
        DiGraph<Integer> g = new DiGraph<Integer>();
        for (int[] e : edges) {
            g.addEdge(e[0], e[1]);
        }
        return g;
    }

    private static DiGraph<Integer> diamond() {
        return graph(new int[][] { { 1, 2 }, { 1, 3 }, { 2, 4 }, { 3, 4 }, { 4, 5 } });
    }

    public void testBackEdges() {
        DiGraph<Integer> g = graph(new int[][] { { 1, 2 }, { 2, 3 }, { 3, 2 }, { 3, 4 }, { 4, 1 } });
        List<DiGraph.Edge<Integer>> back = GraphUtils.dfsBackEdges(g, 1);
        assertEquals(2, back.size());
        assertEquals(Integer.valueOf(3), back.get(0).getSource());
        assertEquals(Integer.valueOf(2), back.get(0).getTarget());
        assertEquals(Integer.valueOf(4), back.get(1).getSource());
        assertEquals(Integer.valueOf(1), back.get(1).getTarget());
    }

    public void testCrossEdgeIsNotBackEdge() {
        DiGraph<Integer> g = graph(new int[][] { { 1, 2 }, { 1, 3 }, { 3, 2 } });
        assertTrue(GraphUtils.dfsBackEdges(g, 1).isEmpty());
    }

    public void testSelfLoopIsBackEdge() {
        DiGraph<Integer> g = graph(new int[][] { { 1, 1 } });
        List<DiGraph.Edge<Integer>> back = GraphUtils.dfsBackEdges(g, 1);
        assertEquals(1, back.size());
        assertEquals(back.get(0).getSource(), back.get(0).getTarget());
    }

    public void testPostorder() {
        DiGraph<Integer> g = graph(new int[][] { { 1, 2 }, { 1, 3 }, { 2, 4 }, { 3, 4 } });
        assertEquals(Arrays.asList(4, 2, 3, 1), GraphUtils.dfsPostorderNodes(g, 1));
        assertEquals(Arrays.asList(4, 3), GraphUtils.dfsPostorderNodes(g, 3));
    }

    public void testPostorderWholeGraph() {
        DiGraph<Integer> g = graph(new int[][] { { 1, 2 }, { 3, 2 } });
        assertEquals(Arrays.asList(2, 1, 3), GraphUtils.dfsPostorderNodes(g));
    }

    public void testReachableStopsAtBlockedNodes() {
        DiGraph<Integer> g = graph(new int[][] { { 1, 2 }, { 2, 3 } });
        Set<Integer> r = GraphUtils.reachable(g, 1, Collections.singleton(2), false);
        assertEquals(new HashSet<Integer>(Arrays.asList(1, 2)), r);
        r = GraphUtils.reachable(g, 3, Collections.emptySet(), true);
        assertEquals(new HashSet<Integer>(Arrays.asList(1, 2, 3)), r);
    }

    public void testSubgraphBetweenNodes() {
        DiGraph<Integer> g = diamond();
        List<Integer> frontier = Collections.singletonList(4);
        DiGraph<Integer> sub = GraphUtils.subgraphBetweenNodes(g, 1, frontier, true);
        assertEquals(Arrays.asList(1, 2, 3, 4), sub.nodes());
        assertEquals(4, sub.numberOfEdges());
        sub = GraphUtils.subgraphBetweenNodes(g, 1, frontier, false);
        assertEquals(Arrays.asList(1, 2, 3), sub.nodes());
    }

    public void testSubgraphBetweenNodesUnreachable() {
        DiGraph<Integer> g = diamond();
        DiGraph<Integer> sub = GraphUtils.subgraphBetweenNodes(g, 4, Collections.singletonList(2), true);
        assertTrue(sub.isEmpty());
    }

    public void testSubgraphBetweenNodesOfLoop() {
        // natural loop of 2 with latching node 3
        DiGraph<Integer> g = graph(new int[][] { { 1, 2 }, { 2, 3 }, { 2, 5 }, { 3, 2 }, { 3, 4 } });
        DiGraph<Integer> sub = GraphUtils.subgraphBetweenNodes(g, 2, Collections.singletonList(3), true);
        assertEquals(Arrays.asList(2, 3), sub.nodes());
        assertTrue(sub.containsEdge(3, 2));
    }

    public void testTopologicalSort() {
        assertEquals(Arrays.asList(1, 2, 3, 4, 5), GraphUtils.topologicalSort(diamond()));
    }

    public void testTopologicalSortRejectsCycles() {
        try {
            GraphUtils.topologicalSort(graph(new int[][] { { 1, 2 }, { 2, 1 } }));
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testQuasiTopologicalSort() {
        DiGraph<Integer> g = graph(new int[][] { { 1, 2 }, { 2, 3 }, { 3, 2 }, { 3, 4 } });
        assertEquals(Arrays.asList(1, 2, 3, 4), GraphUtils.quasiTopologicalSort(g));
        assertEquals(Arrays.asList(2, 4), GraphUtils.quasiTopologicalSort(g, Arrays.asList(4, 2)));
    }

    public void testQuasiTopologicalSortEntersLoopAtItsEntry() {
        // the loop {2, 3} is entered at 3
        DiGraph<Integer> g = graph(new int[][] { { 1, 3 }, { 2, 3 }, { 3, 2 }, { 2, 4 } });
        assertEquals(Arrays.asList(1, 3, 2, 4), GraphUtils.quasiTopologicalSort(g));
    }

    public void testQuasiTopologicalSortSingleNode() {
        DiGraph<Integer> g = graph(new int[][] { { 1, 1 } });
        assertEquals(Arrays.asList(1), GraphUtils.quasiTopologicalSort(g));
    }

    public void testQuasiTopologicalSortChainedComponents() {
        // a self loop stays a single node; {2, 3} and {4, 5} are placed whole
        DiGraph<Integer> g = graph(new int[][] { { 1, 1 }, { 1, 2 }, { 2, 3 }, { 3, 2 }, { 3, 4 }, { 4, 5 }, { 5, 4 } });
        assertEquals(Arrays.asList(1, 2, 3, 4, 5), GraphUtils.quasiTopologicalSort(g));
        assertEquals(Arrays.asList(3, 5), GraphUtils.quasiTopologicalSort(g, Arrays.asList(5, 3)));
    }
}

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
import java.util.List;

import junit.framework.TestCase;

public class DiGraphTest extends TestCase {

    private static DiGraph<String> chain(String... nodes) {
        DiGraph<String> g = new DiGraph<String>();
        for (int i = 0; i + 1 < nodes.length; ++i) {
            g.addEdge(nodes[i], nodes[i + 1]);
        }
        return g;
    }

    public void testInsertionOrder() {
        DiGraph<String> g = new DiGraph<String>();
        g.addEdge("c", "a");
        g.addEdge("c", "b");
        g.addNode("d");
        g.addEdge("a", "b");
        assertEquals(Arrays.asList("c", "a", "b", "d"), g.nodes());
        assertEquals(Arrays.asList("a", "b"), g.successors("c"));
        assertEquals(Arrays.asList("c", "a"), g.predecessors("b"));
        assertEquals(3, g.numberOfEdges());
    }

    public void testAddExistingNode() {
        DiGraph<String> g = new DiGraph<String>();
        assertTrue(g.addNode("a"));
        assertFalse(g.addNode("a"));
        assertEquals(1, g.numberOfNodes());
    }

    public void testNullNode() {
        try {
            new DiGraph<String>().addNode(null);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testUnknownNode() {
        DiGraph<String> g = chain("a", "b");
        try {
            g.successors("z");
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testEdgeTypes() {
        DiGraph<String> g = new DiGraph<String>();
        g.addEdge("a", "b", EdgeType.CALL);
        g.addEdge("a", "c");
        assertSame(EdgeType.CALL, g.getEdgeType("a", "b"));
        assertSame(EdgeType.FLOW, g.getEdgeType("a", "c"));
        assertNull(g.getEdgeType("b", "a"));
        g.addEdge("a", "b", EdgeType.FAKE_RETURN);
        assertSame(EdgeType.FAKE_RETURN, g.getEdgeType("a", "b"));
        assertEquals(2, g.numberOfEdges());
    }

    public void testRemoveNode() {
        DiGraph<String> g = chain("a", "b", "c");
        g.addEdge("b", "b");
        assertTrue(g.removeNode("b"));
        assertFalse(g.removeNode("b"));
        assertEquals(Arrays.asList("a", "c"), g.nodes());
        assertEquals(0, g.outDegree("a"));
        assertEquals(0, g.inDegree("c"));
        assertEquals(0, g.numberOfEdges());
    }

    public void testRemoveEdge() {
        DiGraph<String> g = chain("a", "b");
        assertFalse(g.removeEdge("b", "a"));
        assertTrue(g.removeEdge("a", "b"));
        assertFalse(g.containsEdge("a", "b"));
        assertTrue(g.containsNode("a"));
        assertTrue(g.containsNode("b"));
    }

    public void testCopyIsIndependent() {
        DiGraph<String> g = chain("a", "b");
        DiGraph<String> copy = new DiGraph<String>(g);
        copy.addEdge("b", "c");
        copy.removeEdge("a", "b");
        assertTrue(g.containsEdge("a", "b"));
        assertFalse(g.containsNode("c"));
    }

    public void testEdges() {
        DiGraph<String> g = chain("a", "b", "c");
        g.addEdge("a", "c");
        List<DiGraph.Edge<String>> edges = g.edges();
        assertEquals(3, edges.size());
        assertEquals(new DiGraph.Edge<String>("a", "b", EdgeType.FLOW), edges.get(0));
        assertEquals(new DiGraph.Edge<String>("a", "c", EdgeType.FLOW), edges.get(1));
        assertEquals(new DiGraph.Edge<String>("b", "c", EdgeType.FLOW), edges.get(2));
        assertEquals(2, g.inEdges("c").size());
        // in-edges follow edge insertion order, not node order
        assertEquals("b", g.inEdges("c").get(0).getSource());
        assertEquals("a", g.inEdges("c").get(1).getSource());
        assertEquals(2, g.outEdges("a").size());
    }

    public void testReverse() {
        DiGraph<String> g = chain("a", "b", "c");
        g.addEdge("c", "a", EdgeType.CALL);
        DiGraph<String> r = g.reverse();
        assertEquals(g.nodes(), r.nodes());
        assertTrue(r.containsEdge("b", "a"));
        assertTrue(r.containsEdge("c", "b"));
        assertSame(EdgeType.CALL, r.getEdgeType("a", "c"));
        assertFalse(r.containsEdge("a", "b"));
    }

    public void testSubgraph() {
        DiGraph<String> g = chain("a", "b", "c", "d");
        g.addEdge("d", "b");
        DiGraph<String> sub = g.subgraph(Arrays.asList("d", "b", "c"));
        assertEquals(Arrays.asList("b", "c", "d"), sub.nodes());
        assertEquals(3, sub.numberOfEdges());
        assertTrue(sub.containsEdge("d", "b"));
        assertFalse(sub.containsNode("a"));
    }
}

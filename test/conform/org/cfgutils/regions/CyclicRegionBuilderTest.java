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
package org.cfgutils.regions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import junit.framework.TestCase;

import org.cfgutils.data.Block;
import org.cfgutils.graph.DiGraph;

public class CyclicRegionBuilderTest extends TestCase {

    private Map<Long, Region> leaves;

    private DiGraph<Region> graph;

    private void build(long[][] edges) {
        leaves = new HashMap<Long, Region>();
        graph = new DiGraph<Region>();
        for (long[] e : edges) {
            graph.addEdge(leaf(e[0]), leaf(e[1]));
        }
    }

    private Region leaf(long addr) {
        Region r = leaves.get(addr);
        if (r == null) {
            r = new LeafRegion(new Block(addr));
            leaves.put(addr, r);
        }
        return r;
    }

    private static Set<Long> addrs(Iterable<Region> regions) {
        Set<Long> s = new HashSet<Long>();
        for (Region r : regions) {
            s.add(r.getAddr());
        }
        return s;
    }

    private static Set<Long> set(long... addrs) {
        Set<Long> s = new HashSet<Long>();
        for (long a : addrs) {
            s.add(a);
        }
        return s;
    }

    public void testSwitchCasesJoinTheLoop() {
        build(new long[][] { { 0, 1 }, { 1, 2 }, { 2, 1 }, { 2, 3 }, { 2, 4 }, { 2, 5 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        assertEquals(set(1, 2, 3, 4, 5), addrs(builder.findInitialLoopNodes(leaf(1), leaf(0))));
    }

    public void testSelfLoopBody() {
        build(new long[][] { { 0, 1 }, { 1, 1 }, { 1, 2 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        assertEquals(set(1), addrs(builder.findInitialLoopNodes(leaf(1), leaf(0))));
    }

    public void testNoLoopAtHeader() {
        build(new long[][] { { 0, 1 }, { 1, 2 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        assertNull(builder.makeCyclicRegion(leaf(1), leaf(0), Collections.singletonList(leaf(1))));
        assertEquals(3, graph.numberOfNodes());
    }

    public void testRejectsLoopAroundPendingHeader() {
        build(new long[][] { { 1, 2 }, { 2, 3 }, { 3, 4 }, { 4, 3 }, { 4, 5 }, { 5, 2 }, { 5, 6 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        List<Region> pending = Arrays.asList(leaf(2), leaf(3));
        assertNull(builder.makeCyclicRegion(leaf(2), leaf(1), pending));
        assertEquals(6, graph.numberOfNodes());
        assertTrue(graph.containsNode(leaf(3)));

        CyclicRegion inner = builder.makeCyclicRegion(leaf(3), leaf(1), pending);
        assertNotNull(inner);
        assertEquals(set(3, 4), addrs(inner.getGraph().nodes()));
    }

    public void testAbstraction() {
        build(new long[][] { { 0, 1 }, { 1, 2 }, { 2, 1 }, { 2, 3 }, { 9, 2 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        CyclicRegion loop = builder.makeCyclicRegion(leaf(1), leaf(0), Collections.singletonList(leaf(1)));
        assertNotNull(loop);
        assertSame(leaf(1), loop.getHead());
        assertEquals(set(1, 2), addrs(loop.getGraph().nodes()));
        assertTrue(loop.getGraph().containsEdge(leaf(2), leaf(1)));
        assertSame(leaf(3), loop.getNormalExit());

        // the side entry 9 -> 2 now enters the region
        assertEquals(Arrays.asList(leaf(0), leaf(9)), graph.predecessors(loop));
        assertEquals(Collections.singletonList(leaf(3)), graph.successors(loop));
        assertFalse(graph.containsNode(leaf(1)));
        assertTrue(loop.getFullGraph().containsEdge(leaf(9), leaf(2)));
        assertTrue(loop.getGraphWithSuccessors().containsEdge(leaf(2), leaf(3)));
        assertFalse(loop.getGraph().containsNode(leaf(3)));
    }

    public void testNormalExitComesFirstInPostorder() {
        // a loop whose two exits cannot be pulled into it
        build(new long[][] {
            { 0, 1 }, { 1, 2 }, { 2, 1 }, { 1, 3 }, { 2, 4 }, { 0, 3 }, { 0, 4 }, { 3, 5 }, { 4, 5 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        CyclicRegion loop = builder.makeCyclicRegion(leaf(1), leaf(0), Collections.singletonList(leaf(1)));
        assertEquals(set(1, 2), addrs(loop.getGraph().nodes()));
        // postorder from 1: 5, 4, 2, 3, 1
        assertSame(leaf(4), loop.getNormalExit());
        assertEquals(Collections.singletonList(leaf(3)), loop.getAbnormalExits());
        assertEquals(Arrays.asList(leaf(4), leaf(3)), loop.getSuccessors());
    }

    /**
     * Both exits of the loop lead to terminal code only, so the refinement
     * pulls everything in; the larger of the two trees is handed back.
     */
    public void testLargestSuccessorTreeLeavesTheLoop() {
        long[][] edges = {
            { 0, 1 }, { 1, 2 }, { 2, 1 }, { 1, 3 }, { 2, 4 },
            { 3, 5 }, { 3, 6 }, { 4, 7 }, { 4, 8 }, { 4, 10 } };
        build(edges);
        CyclicRegion loop = new CyclicRegionBuilder(graph, true)
            .makeCyclicRegion(leaf(1), leaf(0), Collections.singletonList(leaf(1)));
        assertEquals(set(1, 2, 3, 5, 6), addrs(loop.getGraph().nodes()));
        assertSame(leaf(4), loop.getNormalExit());
        assertTrue(loop.getAbnormalExits().isEmpty());
        assertEquals(Collections.singletonList(leaf(4)), graph.successors(loop));

        build(edges);
        loop = new CyclicRegionBuilder(graph, false)
            .makeCyclicRegion(leaf(1), leaf(0), Collections.singletonList(leaf(1)));
        assertEquals(set(1, 2, 3, 4, 5, 6, 7, 8, 10), addrs(loop.getGraph().nodes()));
        assertNull(loop.getNormalExit());
        assertEquals(0, graph.outDegree(loop));
    }

    public void testEqualTreesStayInTheLoop() {
        build(new long[][] {
            { 0, 1 }, { 1, 2 }, { 2, 1 }, { 1, 3 }, { 2, 4 },
            { 3, 5 }, { 3, 6 }, { 4, 7 }, { 4, 8 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        CyclicRegion loop = builder.makeCyclicRegion(leaf(1), leaf(0), Collections.singletonList(leaf(1)));
        assertEquals(8, loop.getGraph().numberOfNodes());
        assertNull(loop.getNormalExit());
    }

    public void testRefineLoopWithSingleExit() {
        build(new long[][] { { 0, 1 }, { 1, 2 }, { 2, 1 }, { 2, 3 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        LinkedHashSet<Region> loopNodes = builder.findInitialLoopNodes(leaf(1), leaf(0));
        LinkedHashSet<Region> exits = new LinkedHashSet<Region>(Collections.singletonList(leaf(3)));
        CyclicRegionBuilder.Loop loop = builder.refineLoop(leaf(1), leaf(0), loopNodes, exits);
        assertSame(loopNodes, loop.nodes);
        assertSame(exits, loop.exits);
    }

    public void testEntriesBypassingHeadAreAbnormal() {
        build(new long[][] { { 0, 1 }, { 1, 2 }, { 2, 1 }, { 2, 3 }, { 9, 2 }, { 8, 1 }, { 8, 2 } });
        CyclicRegionBuilder builder = new CyclicRegionBuilder(graph, true);
        CyclicRegion loop = builder.makeCyclicRegion(leaf(1), leaf(0), Collections.singletonList(leaf(1)));
        assertNotNull(loop);
        assertEquals(Arrays.asList(leaf(0), leaf(8)), new ArrayList<Region>(loop.getNormalEntries()));
        assertEquals(1, loop.getAbnormalEntries().size());
        assertSame(leaf(2), loop.getAbnormalEntries().get(leaf(9)));
        // every entry still reaches the region through one plain edge
        assertEquals(Arrays.asList(leaf(0), leaf(8), leaf(9)), graph.predecessors(loop));
    }

    public void testLoopWithoutSideEntries() {
        build(new long[][] { { 0, 1 }, { 1, 2 }, { 2, 1 }, { 2, 3 } });
        CyclicRegion loop = new CyclicRegionBuilder(graph, true)
            .makeCyclicRegion(leaf(1), leaf(0), Collections.singletonList(leaf(1)));
        assertEquals(Collections.singleton(leaf(0)), loop.getNormalEntries());
        assertTrue(loop.getAbnormalEntries().isEmpty());
    }
}

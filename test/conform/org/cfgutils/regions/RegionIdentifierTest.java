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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import junit.framework.TestCase;

import org.cfgutils.data.Block;
import org.cfgutils.data.BlockGraphs;
import org.cfgutils.graph.DiGraph;
import org.cfgutils.transform.Transformations;

public class RegionIdentifierTest extends TestCase {

    private static final long[][] DIAMOND = {
        { 1, 2 }, { 1, 3 }, { 2, 4 }, { 3, 4 }, { 4, 5 }, { 4, 6 }, { 5, 7 }, { 6, 7 } };

    private static Set<Long> set(long... addrs) {
        Set<Long> s = new HashSet<Long>();
        for (long a : addrs) {
            s.add(a);
        }
        return s;
    }

    private static Set<Set<Long>> groups(RegionIdentifier ri) {
        Set<Set<Long>> s = new HashSet<Set<Long>>();
        for (List<Long> group : ri.getRegionsByBlockAddrs()) {
            s.add(new HashSet<Long>(group));
        }
        return s;
    }

    private static List<Long> range(long from, long to) {
        Long[] r = new Long[(int) (to - from + 1)];
        for (int i = 0; i < r.length; ++i) {
            r[i] = from + i;
        }
        return Arrays.asList(r);
    }

    private static CyclicRegion loopAt(GraphRegion root, long addr) {
        for (GraphRegion r : RegionUtils.findMatchingRegions(root, Collections.singleton(addr))) {
            if (r instanceof CyclicRegion) {
                return (CyclicRegion) r;
            }
        }
        fail("no loop at " + addr);
        return null;
    }

    public void testDiamond() {
        RegionIdentifier ri = new RegionIdentifier(BlockGraphs.fromNumberedEdges(DIAMOND));
        Set<Set<Long>> groups = groups(ri);
        assertTrue(groups.contains(set(1, 2, 3)));
        assertTrue(groups.contains(set(4, 5, 6)));
        assertTrue(groups.contains(set(1, 7)));
        assertEquals(4, groups.size());

        GraphRegion root = ri.getRegion();
        Region head = root.getHead();
        while (head instanceof GraphRegion) {
            head = ((GraphRegion) head).getHead();
        }
        assertTrue(head instanceof LeafRegion);
        assertEquals(1, ((LeafRegion) head).getBlock().getAddr());
        assertEquals(1, root.getHeadBlock().getAddr());
        assertTrue(ri.getStructuredLoopHeaderAddrs().isEmpty());
    }

    public void testCompleteness() {
        RegionIdentifier ri = new RegionIdentifier(BlockGraphs.fromNumberedEdges(DIAMOND));
        assertEquals(range(1, 7), RegionUtils.collectBlockAddrs(ri.getRegion()));
    }

    public void testInputIsNotModified() {
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(DIAMOND);
        List<Block> nodes = g.nodes();
        new RegionIdentifier(g);
        assertEquals(nodes, g.nodes());
        assertEquals(8, g.numberOfEdges());
    }

    public void testDeterminism() {
        RegionIdentifier a = new RegionIdentifier(BlockGraphs.fromNumberedEdges(DIAMOND));
        RegionIdentifier b = new RegionIdentifier(BlockGraphs.fromNumberedEdges(DIAMOND));
        assertEquals(a.getRegionsByBlockAddrs(), b.getRegionsByBlockAddrs());
    }

    public void testSelfLoop() {
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] { { 1, 1 } });
        RegionIdentifier ri = new RegionIdentifier(g, 1, 0);
        GraphRegion root = ri.getRegion();
        assertTrue(root instanceof CyclicRegion);
        assertEquals(1, root.getGraph().numberOfNodes());
        Region body = root.getGraph().nodes().get(0);
        assertTrue(body instanceof LeafRegion);
        assertEquals(1, body.getAddr());
        assertTrue(root.getGraph().containsEdge(body, body));
        assertNull(((CyclicRegion) root).getNormalExit());
        assertTrue(((CyclicRegion) root).getSuccessors().isEmpty());
        assertEquals(Arrays.asList(Arrays.asList(1L)), ri.getRegionsByBlockAddrs());
    }

    public void testStartFromEntrypointFlag() {
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] { { 1, 1 } });
        g.nodes().get(0).setEntrypoint(true);
        RegionIdentifier ri = new RegionIdentifier(g);
        assertEquals(Arrays.asList(1L), ri.getStructuredLoopHeaderAddrs());
    }

    public void testMissingStartNode() {
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] { { 1, 2 }, { 2, 1 } });
        try {
            new RegionIdentifier(g);
            fail();
        } catch (RegionIdentificationException e) {
            // expected
        }
    }

    public void testEmptyGraph() {
        try {
            new RegionIdentifier(new DiGraph<Block>());
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    public void testWhileLoop() {
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] { { 0, 2 }, { 2, 6 }, { 2, 8 }, { 6, 2 } });
        RegionIdentifier ri = new RegionIdentifier(g);
        assertEquals(Arrays.asList(2L), ri.getStructuredLoopHeaderAddrs());
        CyclicRegion loop = loopAt(ri.getRegion(), 2);
        assertEquals(Arrays.asList(2L, 6L), RegionUtils.collectBlockAddrs(loop));
        assertEquals(8, loop.getNormalExit().getAddr());
        assertTrue(loop.getAbnormalExits().isEmpty());
        assertTrue(loop.getFullGraph().containsNode(loop.getNormalExit()));
        assertEquals(3, loop.getGraphWithSuccessors().numberOfNodes());

        Set<Set<Long>> groups = groups(ri);
        assertTrue(groups.contains(set(2, 6)));
        assertTrue(groups.contains(set(0, 2)));
        assertTrue(groups.contains(set(0, 8)));
    }

    public void testLoopExitsAreAbsorbed() {
        // 2 -> 4 leaves the loop normally, 3 -> 5 breaks out of it
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] {
            { 1, 2 }, { 2, 3 }, { 3, 2 }, { 2, 4 }, { 3, 5 }, { 4, 6 }, { 5, 6 } });
        RegionIdentifier ri = new RegionIdentifier(g);
        CyclicRegion loop = loopAt(ri.getRegion(), 2);
        assertEquals(range(2, 5), RegionUtils.collectBlockAddrs(loop));
        assertEquals(6, loop.getNormalExit().getAddr());
        assertTrue(loop.getAbnormalExits().isEmpty());
        assertEquals(range(1, 6), RegionUtils.collectBlockAddrs(ri.getRegion()));
    }

    public void testNestedLoops() {
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] {
            { 1, 2 }, { 2, 3 }, { 3, 4 }, { 4, 3 }, { 4, 5 }, { 5, 2 }, { 5, 6 } });
        RegionIdentifier ri = new RegionIdentifier(g);
        // innermost first
        assertEquals(Arrays.asList(3L, 2L), ri.getStructuredLoopHeaderAddrs());

        GraphRegion root = ri.getRegion();
        CyclicRegion outer = loopAt(root, 2);
        CyclicRegion inner = loopAt(root, 3);
        assertTrue(outer.getGraph().containsNode(inner));
        assertEquals(Arrays.asList(3L, 4L), RegionUtils.collectBlockAddrs(inner));
        assertEquals(5, inner.getNormalExit().getAddr());
        assertEquals(6, outer.getNormalExit().getAddr());
        assertEquals(Collections.<GraphRegion>singletonList(outer), RegionUtils.findParentRegions(root, 3));
        assertEquals(range(1, 6), RegionUtils.collectBlockAddrs(root));
    }

    public void testIrreducible() {
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] {
            { 1, 2 }, { 1, 3 }, { 2, 3 }, { 3, 2 }, { 2, 4 }, { 3, 4 } });
        assertFalse(Transformations.isReducible(g));
        RegionIdentifier ri = new RegionIdentifier(g);
        assertEquals(range(1, 4), RegionUtils.collectBlockAddrs(ri.getRegion()));

        Set<Long> seen = new HashSet<Long>();
        for (List<Long> group : ri.getRegionsByBlockAddrs()) {
            seen.addAll(group);
        }
        assertEquals(set(1, 2, 3, 4), seen);
    }

    public void testUnreachableBlocksAreKept() {
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] { { 1, 2 }, { 2, 3 }, { 9, 3 } });
        RegionIdentifier ri = new RegionIdentifier(g);
        assertEquals(Arrays.asList(1L, 2L, 3L, 9L), RegionUtils.collectBlockAddrs(ri.getRegion()));
    }

    public void testCompleteSuccessorsFlag() {
        // loop at 1 whose body 2 -> 3 forms a region leaving the loop at 2
        DiGraph<Block> g = BlockGraphs.fromNumberedEdges(new long[][] {
            { 0, 1 }, { 1, 2 }, { 2, 3 }, { 3, 4 }, { 4, 1 }, { 2, 9 } });
        RegionIdentifier plain = new RegionIdentifier(g);
        RegionIdentifier complete = new RegionIdentifier(g, RegionIdentifier.COMPLETE_SUCCESSORS);
        assertEquals(plain.getRegionsByBlockAddrs(), complete.getRegionsByBlockAddrs());

        CyclicRegion loop = loopAt(complete.getRegion(), 1);
        AcyclicRegion body = null;
        for (Region n : loop.getGraph().nodes()) {
            if (n instanceof AcyclicRegion) {
                body = (AcyclicRegion) n;
            }
        }
        assertNotNull(body);
        assertEquals(Arrays.asList(2L, 3L), RegionUtils.collectBlockAddrs(body));
        Set<Long> successors = new HashSet<Long>();
        for (Region r : body.getSuccessors()) {
            successors.add(r.getAddr());
        }
        assertEquals(set(4, 9), successors);
    }
}

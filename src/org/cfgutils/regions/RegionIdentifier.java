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
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.cfgutils.data.Block;
import org.cfgutils.data.BlockGraphs;
import org.cfgutils.graph.DiGraph;
import org.cfgutils.graph.GraphUtils;
import org.cfgutils.transform.SupergraphPreprocessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the region tree of a function control flow graph.
 * <p>
 * The input graph is copied and the copy is rewritten: loops are
 * abstracted into {@link CyclicRegion}s from the innermost outwards, then
 * single-entry single-exit subgraphs of every loop body and of the whole
 * graph are abstracted into {@link AcyclicRegion}s. What cannot be reduced
 * to a single region ends up in one flat region, so every block of the
 * input appears exactly once in the tree.
 * <p>
 * The analysis runs in the constructor. Instances are not thread safe but
 * share nothing with their input.
 */
public class RegionIdentifier {

    /**
     * Flag to keep a loop as found when the exit refinement pulled every
     * exit into it, instead of handing the largest successor tree back to
     * the code following the loop.
     */
    public static final int SKIP_SUCCESSOR_TREE_REFINEMENT = 1;

    /**
     * Flag to add every successor from the loop body graph with exits to
     * the regions found inside a loop body. By default only the successors
     * leaving the loop body are added.
     */
    public static final int COMPLETE_SUCCESSORS = 2;

    private static final Logger logger = LoggerFactory.getLogger(RegionIdentifier.class);

    /**
     * Option flags, see the constants of this class.
     */
    private final int flags;

    /**
     * Whether {@link #functionAddr} is known.
     */
    private final boolean hasFunctionAddr;

    /**
     * Address of the function entry, used to find the start node of a graph
     * without a node of in-degree 0.
     */
    private final long functionAddr;

    /**
     * Loop headers not structured yet, in quasi-topological order.
     */
    private List<Region> loopHeaders;

    /**
     * Loop headers structured into a {@link CyclicRegion}.
     */
    private final Set<Region> structuredLoopHeaders = new LinkedHashSet<Region>();

    private GraphRegion region;

    private List<List<Long>> regionsByBlockAddrs;

    /**
     * Structures a graph with the default options.
     */
    public RegionIdentifier(DiGraph<Block> graph) {
        this(graph, 0);
    }

    /**
     * Structures a graph. The function entry is the block flagged as entry
     * point, if any.
     */
    public RegionIdentifier(DiGraph<Block> graph, int flags) {
        this(graph, entrypoint(graph), flags);
    }

    /**
     * Structures a graph whose function entry is at the given address.
     */
    public RegionIdentifier(DiGraph<Block> graph, long functionAddr, int flags) {
        this(graph, Long.valueOf(functionAddr), flags);
    }

    private RegionIdentifier(DiGraph<Block> graph, Long functionAddr, int flags) {
        if (graph == null || graph.isEmpty()) {
            throw new IllegalArgumentException("empty graph");
        }
        this.flags = flags;
        this.hasFunctionAddr = functionAddr != null;
        this.functionAddr = functionAddr == null ? 0L : functionAddr.longValue();
        analyze(graph);
    }

    private static Long entrypoint(DiGraph<Block> graph) {
        if (graph != null) {
            for (Block b : graph.nodes()) {
                if (b.isEntrypoint()) {
                    return Long.valueOf(b.getAddr());
                }
            }
        }
        return null;
    }

    /**
     * @return the root of the region tree
     */
    public GraphRegion getRegion() {
        return region;
    }

    /**
     * Flattens the region tree breadth-first. Each group lists, for one
     * region, the addresses of its blocks and the head addresses of the
     * regions directly nested in it.
     */
    public List<List<Long>> getRegionsByBlockAddrs() {
        return regionsByBlockAddrs;
    }

    /**
     * @return the head addresses of the loops structured into cyclic
     *         regions, innermost first
     */
    public List<Long> getStructuredLoopHeaderAddrs() {
        List<Long> addrs = new ArrayList<Long>();
        for (Region h : structuredLoopHeaders) {
            addrs.add(h.getAddr());
        }
        return addrs;
    }

    // ------------------------------------------------------------------------
    // Analysis
    // ------------------------------------------------------------------------

    private void analyze(DiGraph<Block> input) {
        DiGraph<Block> blocks = BlockGraphs.copy(input);
        SupergraphPreprocessor.makeSupergraph(blocks);

        DiGraph<Region> graph = new DiGraph<Region>();
        IdentityHashMap<Block, Region> leaves = new IdentityHashMap<Block, Region>();
        for (Block b : blocks.nodes()) {
            LeafRegion leaf = new LeafRegion(b);
            leaves.put(b, leaf);
            graph.addNode(leaf);
        }
        for (DiGraph.Edge<Block> e : blocks.edges()) {
            graph.addEdge(leaves.get(e.getSource()), leaves.get(e.getTarget()), e.getType());
        }

        loopHeaders = findLoopHeaders(graph, getStartNode(graph));
        region = makeRegions(graph);
        regionsByBlockAddrs = makeRegionsByBlockAddrs(region);
    }

    /**
     * @throws RegionIdentificationException if the graph has no node of
     *         in-degree 0 and no node at the function address
     */
    Region getStartNode(DiGraph<Region> graph) {
        for (Region n : graph.nodes()) {
            if (graph.inDegree(n) == 0) {
                return n;
            }
        }
        if (hasFunctionAddr) {
            for (Region n : graph.nodes()) {
                if (n.getAddr() == functionAddr) {
                    return n;
                }
            }
        }
        throw new RegionIdentificationException("Cannot find the start node from the graph");
    }

    private static List<Region> findLoopHeaders(DiGraph<Region> graph, Region start) {
        LinkedHashSet<Region> heads = new LinkedHashSet<Region>();
        for (DiGraph.Edge<Region> e : GraphUtils.dfsBackEdges(graph, start)) {
            heads.add(e.getTarget());
        }
        return new ArrayList<Region>(GraphUtils.quasiTopologicalSort(graph, heads));
    }

    private GraphRegion makeRegions(DiGraph<Region> graph) {
        CyclicRegionBuilder cyclicBuilder = new CyclicRegionBuilder(graph,
            (flags & SKIP_SUCCESSOR_TREE_REFINEMENT) == 0);
        List<CyclicRegion> newRegions = new ArrayList<CyclicRegion>();

        boolean restart = true;
        while (restart) {
            restart = false;
            Region start = getStartNode(graph);
            List<Region> bottomUp = new ArrayList<Region>(loopHeaders);
            Collections.reverse(bottomUp);
            for (Region node : bottomUp) {
                if (structuredLoopHeaders.contains(node) || !graph.containsNode(node)) {
                    continue;
                }
                CyclicRegion cyclic = cyclicBuilder.makeCyclicRegion(node, start, loopHeaders);
                if (cyclic == null) {
                    logger.debug("Failed to structure a loop region starting at {}, removing it from loop headers",
                        node);
                    loopHeaders.remove(node);
                } else {
                    logger.debug("Structured a loop region {}", cyclic);
                    newRegions.add(cyclic);
                    structuredLoopHeaders.add(node);
                    restart = true;
                    break;
                }
            }
        }

        logger.debug("Identified {} loop regions", structuredLoopHeaders.size());

        AcyclicRegionBuilder acyclicBuilder = new AcyclicRegionBuilder((flags & COMPLETE_SUCCESSORS) != 0);
        for (CyclicRegion cyclic : newRegions) {
            cyclic.head = structureAcyclic(acyclicBuilder, cyclic.head, cyclic.graph,
                cyclic.graphWithSuccessors, true);
        }
        structureAcyclic(acyclicBuilder, getStartNode(graph), graph, null, false);

        if (graph.numberOfNodes() == 1 && graph.nodes().get(0) instanceof GraphRegion) {
            return (GraphRegion) graph.nodes().get(0);
        }
        logger.debug("Wrapping {} unstructured nodes into one region", graph.numberOfNodes());
        Region head = getStartNode(graph);
        return new AcyclicRegion(head, graph, Collections.<Region>emptyList(), new DiGraph<Region>(graph));
    }

    /**
     * Abstracts acyclic regions of <code>graph</code> until none is left.
     *
     * @return the node of <code>graph</code> that now holds
     *         <code>head</code>
     */
    private static Region structureAcyclic(AcyclicRegionBuilder builder, Region head, DiGraph<Region> graph,
                                           DiGraph<Region> secondaryGraph, boolean cyclic) {
        HashSet<AcyclicRegionBuilder.Attempt> failedAttempts = new HashSet<AcyclicRegionBuilder.Attempt>();
        while (builder.makeAcyclicRegion(head, graph, secondaryGraph, failedAttempts, cyclic)) {
            head = resolveHead(graph, head);
        }
        return head;
    }

    /**
     * Finds the node of <code>graph</code> that is <code>head</code> or
     * holds it through a chain of region heads. Falls back to the first
     * node with the same address.
     */
    static Region resolveHead(DiGraph<Region> graph, Region head) {
        if (graph.containsNode(head)) {
            return head;
        }
        for (Region n : graph.nodes()) {
            Region r = n;
            while (r instanceof GraphRegion) {
                r = ((GraphRegion) r).head;
                if (r == head) {
                    return n;
                }
            }
        }
        for (Region n : graph.nodes()) {
            if (n.getAddr() == head.getAddr()) {
                return n;
            }
        }
        throw new IllegalStateException("Lost region head " + head);
    }

    private static List<List<Long>> makeRegionsByBlockAddrs(GraphRegion root) {
        List<List<Long>> groups = new ArrayList<List<Long>>();
        Set<Region> seen = Collections.newSetFromMap(new IdentityHashMap<Region, Boolean>());
        List<GraphRegion> workList = Collections.singletonList(root);
        while (!workList.isEmpty()) {
            List<GraphRegion> children = new ArrayList<GraphRegion>();
            for (GraphRegion r : workList) {
                List<Long> addrs = new ArrayList<Long>();
                for (Region node : r.graph.nodes()) {
                    if (node instanceof GraphRegion) {
                        if (seen.add(node)) {
                            children.add((GraphRegion) node);
                            addrs.add(node.getAddr());
                        }
                    } else {
                        addrs.add(node.getAddr());
                    }
                }
                if (!addrs.isEmpty()) {
                    groups.add(Collections.unmodifiableList(addrs));
                }
            }
            workList = children;
        }
        return Collections.unmodifiableList(groups);
    }
}

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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cfgutils.data.Block;
import org.cfgutils.graph.DiGraph;
import org.cfgutils.graph.Dominators;
import org.cfgutils.graph.GraphUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds single-entry single-exit regions in an acyclic graph, or in a loop
 * body once its header is excluded, and abstracts them one at a time.
 */
final class AcyclicRegionBuilder {

    private static final Logger logger = LoggerFactory.getLogger(AcyclicRegionBuilder.class);

    /**
     * Address of the blocks behind the synthetic end nodes.
     */
    static final long DUMMY_END_ADDR = -1L;

    /**
     * A (region entry, candidate exit) pair already rejected.
     */
    static final class Attempt {
        final Region node;
        final Region postdom;

        Attempt(Region node, Region postdom) {
            this.node = node;
            this.postdom = postdom;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Attempt)) {
                return false;
            }
            Attempt a = (Attempt) o;
            return node == a.node && postdom == a.postdom;
        }

        @Override
        public int hashCode() {
            return 31 * System.identityHashCode(node) + System.identityHashCode(postdom);
        }
    }

    /**
     * Whether loop body regions get every successor from the body graph
     * with exits, or only those leaving the loop body.
     */
    private final boolean completeSuccessors;

    AcyclicRegionBuilder(boolean completeSuccessors) {
        this.completeSuccessors = completeSuccessors;
    }

    /**
     * Abstracts at most one region of <code>graph</code>.
     *
     * @param head entry of <code>graph</code>
     * @param secondaryGraph graph with loop exits kept in sync with
     *        <code>graph</code>, or <code>null</code>
     * @param failedAttempts pairs rejected by earlier calls on the same
     *        graph, updated by this call
     * @param cyclic whether <code>graph</code> is a loop body, whose head is
     *        never a region entry
     * @return <code>true</code> if the graph changed
     */
    boolean makeAcyclicRegion(Region head, DiGraph<Region> graph, DiGraph<Region> secondaryGraph,
                              Set<Attempt> failedAttempts, boolean cyclic) {
        List<DiGraph.Edge<Region>> headInEdges = graph.inEdges(head);
        DiGraph<Region> graphCopy = graph;
        if (!headInEdges.isEmpty()) {
            graphCopy = new DiGraph<Region>(graph);
            for (DiGraph.Edge<Region> e : headInEdges) {
                graphCopy.removeEdge(e.getSource(), head);
            }
        }

        List<Region> endNodes = new ArrayList<Region>();
        for (Region n : graphCopy.nodes()) {
            if (graphCopy.outDegree(n) == 0) {
                endNodes.add(n);
            }
        }
        if (endNodes.isEmpty()) {
            return false;
        }

        boolean addDummyEndNode = endNodes.size() > 1;
        if (!addDummyEndNode && !headInEdges.isEmpty()
            && !graph.predecessors(head).contains(endNodes.get(0)))
        {
            // the end node and a predecessor of the head may then share a
            // region
            addDummyEndNode = true;
        }
        Region dummyEndNode = null;
        if (addDummyEndNode) {
            graphCopy = new DiGraph<Region>(graphCopy);
            dummyEndNode = new LeafRegion(new Block(DUMMY_END_ADDR));
            for (Region endNode : endNodes) {
                graphCopy.addEdge(endNode, dummyEndNode);
            }
            endNodes = Collections.singletonList(dummyEndNode);
        }

        Map<Region, Region> doms = Dominators.immediateDominators(graphCopy, head);
        Map<Region, Region> postdoms = Dominators.immediatePostDominators(graphCopy, endNodes.get(0));
        Map<Region, Set<Region>> df = Dominators.dominanceFrontiers(graphCopy, doms);

        for (Region node : GraphUtils.dfsPostorderNodes(graphCopy, head)) {
            if (node == dummyEndNode) {
                continue;
            }
            if (cyclic && node == head) {
                continue;
            }

            if (graphCopy.outDegree(node) == 0) {
                // the root of the region tree is always a graph region
                if (graphCopy.inDegree(node) == 0 && node.isLeaf()) {
                    DiGraph<Region> subgraph = new DiGraph<Region>();
                    subgraph.addNode(node);
                    abstractAcyclicRegion(graph,
                        new AcyclicRegion(node, subgraph, Collections.<Region>emptyList(), subgraph),
                        Collections.<Region>emptyList(), secondaryGraph);
                }
                continue;
            }

            Region postdom = postdoms.get(node);
            while (postdom != null) {
                Attempt attempt = new Attempt(node, postdom);
                if (!failedAttempts.contains(attempt) && checkRegion(graphCopy, node, postdom, doms, df)) {
                    AcyclicRegion region = computeRegion(graphCopy, node, postdom, dummyEndNode);
                    if (region != null) {
                        restoreHeadInEdges(graph, region);
                        if (secondaryGraph != null) {
                            addSuccessorsFrom(secondaryGraph, graphCopy, region);
                        }
                        logger.debug("Node {}, frontier {}", node, region.frontier);
                        abstractAcyclicRegion(graph, region, region.frontier, secondaryGraph);
                        return true;
                    }
                }
                failedAttempts.add(attempt);
                if (!Dominators.dominates(doms, node, postdom)) {
                    break;
                }
                Region next = postdoms.get(postdom);
                if (next == postdom) {
                    break;
                }
                postdom = next;
            }
        }
        return false;
    }

    /**
     * Tests whether the nodes dominated by <code>start</code> and not
     * beyond <code>end</code> form a region that control enters only
     * through <code>start</code> and leaves only to <code>end</code>.
     */
    static boolean checkRegion(DiGraph<Region> graph, Region start, Region end,
                               Map<Region, Region> doms, Map<Region, Set<Region>> df) {
        Set<Region> startFrontier = frontierOf(df, start);
        Set<Region> endFrontier = frontierOf(df, end);

        // end may be the header of a loop around start
        if (!Dominators.dominates(doms, start, end)) {
            for (Region n : startFrontier) {
                if (n != start && n != end) {
                    return false;
                }
            }
        }

        // nothing enters the region from outside
        for (Region n : endFrontier) {
            if (n != end && Dominators.dominates(doms, start, n)) {
                return false;
            }
        }

        // nothing leaves it except through end
        for (Region n : startFrontier) {
            if (n == start || n == end) {
                continue;
            }
            if (!endFrontier.contains(n)) {
                return false;
            }
            for (Region pred : graph.predecessors(n)) {
                if (Dominators.dominates(doms, start, pred) && !Dominators.dominates(doms, end, pred)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static Set<Region> frontierOf(Map<Region, Set<Region>> df, Region n) {
        Set<Region> s = df.get(n);
        return s == null ? Collections.<Region>emptySet() : s;
    }

    /**
     * Collects the nodes reachable from <code>node</code> without passing
     * <code>frontier</code>.
     *
     * @return the region, or <code>null</code> if it would hold
     *         <code>node</code> alone
     */
    static AcyclicRegion computeRegion(DiGraph<Region> graph, Region node, Region frontier,
                                       Region dummyEndNode) {
        DiGraph<Region> subgraph = new DiGraph<Region>();
        List<DiGraph.Edge<Region>> frontierEdges = new ArrayList<DiGraph.Edge<Region>>();
        Deque<Region> stack = new ArrayDeque<Region>();
        HashSet<Region> traversed = new HashSet<Region>();
        stack.push(node);

        while (!stack.isEmpty()) {
            Region n = stack.pop();
            if (n == frontier) {
                continue;
            }
            traversed.add(n);
            subgraph.addNode(n);
            for (DiGraph.Edge<Region> e : graph.outEdges(n)) {
                Region succ = e.getTarget();
                if (succ == dummyEndNode) {
                    continue;
                }
                if (succ == frontier) {
                    frontierEdges.add(e);
                    continue;
                }
                subgraph.addEdge(n, succ, e.getType());
                if (!traversed.contains(succ)) {
                    stack.push(succ);
                }
            }
        }

        if (subgraph.numberOfNodes() <= 1) {
            return null;
        }
        DiGraph<Region> subgraphWithFrontier = new DiGraph<Region>(subgraph);
        for (DiGraph.Edge<Region> e : frontierEdges) {
            subgraphWithFrontier.addEdge(e.getSource(), e.getTarget(), e.getType());
        }
        List<Region> realFrontier = frontier == dummyEndNode
            ? Collections.<Region>emptyList()
            : Collections.singletonList(frontier);
        return new AcyclicRegion(node, subgraph, realFrontier, subgraphWithFrontier);
    }

    /**
     * Edges into the region head from region members were cut for the
     * analysis; they are kept inside the region.
     */
    private static void restoreHeadInEdges(DiGraph<Region> graph, AcyclicRegion region) {
        Region head = region.head;
        for (DiGraph.Edge<Region> e : graph.inEdges(head)) {
            if (region.graph.containsNode(e.getSource())) {
                region.graph.addEdge(e.getSource(), head, e.getType());
                region.graphWithSuccessors.addEdge(e.getSource(), head, e.getType());
            }
        }
    }

    /**
     * Adds the edges that leave a loop body to the region, from the graph
     * of the body with its exits.
     */
    private void addSuccessorsFrom(DiGraph<Region> secondaryGraph, DiGraph<Region> graph,
                                   AcyclicRegion region) {
        for (Region nn : region.graph.nodes()) {
            if (!secondaryGraph.containsNode(nn)) {
                continue;
            }
            for (DiGraph.Edge<Region> e : secondaryGraph.outEdges(nn)) {
                Region succ = e.getTarget();
                boolean missing = completeSuccessors
                    ? !region.graphWithSuccessors.containsEdge(nn, succ)
                    : !graph.containsNode(succ);
                if (missing) {
                    region.graphWithSuccessors.addEdge(nn, succ, e.getType());
                    region.successors.add(succ);
                }
            }
        }
    }

    /**
     * Replaces the region members in <code>graph</code> by the region.
     * In-edges of the region head and out-edges of any member that leave
     * the region are redirected to the region node.
     */
    static void abstractAcyclicRegion(DiGraph<Region> graph, AcyclicRegion region,
                                      List<Region> frontier, DiGraph<Region> secondaryGraph) {
        DiGraph<Region> members = region.graph;
        List<Region> inSources = new ArrayList<Region>();
        if (graph.containsNode(region.head)) {
            for (Region src : graph.predecessors(region.head)) {
                if (!members.containsNode(src)) {
                    inSources.add(src);
                }
            }
        }
        LinkedHashSet<Region> outTargets = new LinkedHashSet<Region>();
        for (Region n : members.nodes()) {
            if (!graph.containsNode(n)) {
                continue;
            }
            for (Region dst : graph.successors(n)) {
                if (!members.containsNode(dst)) {
                    outTargets.add(dst);
                }
            }
        }

        graph.removeNodes(members.nodes());
        graph.addNode(region);
        for (Region src : inSources) {
            graph.addEdge(src, region);
        }
        for (Region dst : outTargets) {
            graph.addEdge(region, dst);
        }
        for (Region f : frontier) {
            graph.addEdge(region, f);
        }

        if (secondaryGraph != null) {
            abstractAcyclicRegion(secondaryGraph, region, Collections.<Region>emptyList(), null);
        }
    }
}

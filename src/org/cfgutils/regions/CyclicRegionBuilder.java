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
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cfgutils.graph.DiGraph;
import org.cfgutils.graph.Dominators;
import org.cfgutils.graph.GraphUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the loop at a header, refines its exits and abstracts it into a
 * {@link CyclicRegion} node of the working graph.
 */
final class CyclicRegionBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CyclicRegionBuilder.class);

    /**
     * Loop nodes together with the nodes control leaves them for.
     */
    static final class Loop {
        final LinkedHashSet<Region> nodes;
        final LinkedHashSet<Region> exits;

        Loop(LinkedHashSet<Region> nodes, LinkedHashSet<Region> exits) {
            this.nodes = nodes;
            this.exits = exits;
        }
    }

    private final DiGraph<Region> graph;

    /**
     * Whether to hand the largest successor tree back to the code after
     * the loop when refinement swallowed every exit.
     */
    private final boolean largestSuccessorTreeOutsideLoop;

    CyclicRegionBuilder(DiGraph<Region> graph, boolean largestSuccessorTreeOutsideLoop) {
        this.graph = graph;
        this.largestSuccessorTreeOutsideLoop = largestSuccessorTreeOutsideLoop;
    }

    /**
     * Structures the loop at <code>head</code> and replaces its nodes in
     * the graph by the new region.
     *
     * @param start entry of the graph, for the back-edge search
     * @param pendingHeaders loop headers not structured yet
     * @return the new region, or <code>null</code> if the loop contains
     *         another pending header or no loop is found at
     *         <code>head</code>; the graph is unchanged in that case
     */
    CyclicRegion makeCyclicRegion(Region head, Region start, Collection<Region> pendingHeaders) {
        logger.debug("Found cyclic region at {}", head);
        LinkedHashSet<Region> initialLoopNodes = findInitialLoopNodes(head, start);
        if (initialLoopNodes.isEmpty()) {
            return null;
        }
        logger.debug("Initial loop nodes {}", initialLoopNodes);

        // inner loops go first
        for (Region n : initialLoopNodes) {
            if (n.getAddr() != head.getAddr() && pendingHeaders.contains(n)) {
                return null;
            }
        }

        LinkedHashSet<Region> initialExitNodes = new LinkedHashSet<Region>();
        for (Region n : initialLoopNodes) {
            for (Region succ : graph.successors(n)) {
                if (!initialLoopNodes.contains(succ)) {
                    initialExitNodes.add(succ);
                }
            }
        }
        logger.debug("Initial exit nodes {}", initialExitNodes);

        Loop refined = refineLoop(head, start, initialLoopNodes, initialExitNodes);
        logger.debug("Refined loop nodes {}", refined.nodes);
        logger.debug("Refined exit nodes {}", refined.exits);

        Region normalExit = null;
        List<Region> abnormalExits = new ArrayList<Region>();
        if (refined.exits.size() > 1) {
            final Map<Region, Integer> rank = postorderRank(head);
            List<Region> sorted = new ArrayList<Region>(refined.exits);
            Collections.sort(sorted, new Comparator<Region>() {
                public int compare(Region a, Region b) {
                    return Integer.compare(rankOf(rank, a), rankOf(rank, b));
                }
            });
            normalExit = sorted.get(0);
            abnormalExits.addAll(sorted.subList(1, sorted.size()));
        } else if (refined.exits.size() == 1) {
            normalExit = refined.exits.iterator().next();
        }

        return abstractCyclicRegion(refined.nodes, head, normalExit, abnormalExits);
    }

    // ------------------------------------------------------------------------
    // Loop discovery
    // ------------------------------------------------------------------------

    /**
     * Computes the natural loop of <code>head</code>: the nodes on a path
     * from <code>head</code> to one of its latching nodes, widened by the
     * successors of switch-like nodes.
     */
    LinkedHashSet<Region> findInitialLoopNodes(Region head, Region start) {
        LinkedHashSet<Region> latchingNodes = new LinkedHashSet<Region>();
        for (DiGraph.Edge<Region> e : GraphUtils.dfsBackEdges(graph, start)) {
            if (e.getTarget() == head) {
                latchingNodes.add(e.getSource());
            }
        }

        LinkedHashSet<Region> nodes = new LinkedHashSet<Region>(
            GraphUtils.subgraphBetweenNodes(graph, head, latchingNodes, true).nodes());
        if (nodes.isEmpty() && graph.containsEdge(head, head)) {
            // a loop made of its header alone
            nodes.add(head);
        }

        // a node with more than two successors is most likely a switch:
        // all of its cases belong to the loop
        boolean updated = true;
        while (updated) {
            updated = false;
            for (Region node : new ArrayList<Region>(nodes)) {
                List<Region> nonSelfSuccessors = new ArrayList<Region>();
                for (Region succ : graph.successors(node)) {
                    if (succ != node) {
                        nonSelfSuccessors.add(succ);
                    }
                }
                if (nonSelfSuccessors.size() > 2) {
                    for (Region succ : nonSelfSuccessors) {
                        if (nodes.add(succ)) {
                            updated = true;
                        }
                    }
                }
            }
        }
        return nodes;
    }

    // ------------------------------------------------------------------------
    // Loop refinement
    // ------------------------------------------------------------------------

    /**
     * Reduces the number of loop exits by pulling exit nodes into the loop.
     */
    Loop refineLoop(Region head, Region start, LinkedHashSet<Region> initialLoopNodes,
                    LinkedHashSet<Region> initialExitNodes) {
        if (initialExitNodes.size() <= 1) {
            return new Loop(initialLoopNodes, initialExitNodes);
        }

        LinkedHashSet<Region> loopNodes = new LinkedHashSet<Region>(initialLoopNodes);
        LinkedHashSet<Region> exitNodes = new LinkedHashSet<Region>(initialExitNodes);

        // absorb exits that are only reachable from the loop and lead to at
        // most one place
        boolean added = true;
        while (added && exitNodes.size() > 1) {
            added = false;
            for (Region exit : new ArrayList<Region>(exitNodes)) {
                if (exitNodes.size() <= 1) {
                    break;
                }
                if (graph.inDegree(exit) == 1 && graph.outDegree(exit) <= 1) {
                    loopNodes.add(exit);
                    exitNodes.remove(exit);
                    for (Region succ : graph.successors(exit)) {
                        if (!loopNodes.contains(succ)) {
                            exitNodes.add(succ);
                        }
                    }
                    added = true;
                }
            }
        }
        if (exitNodes.size() <= 1) {
            return new Loop(loopNodes, exitNodes);
        }

        Map<Region, Region> idom = Dominators.immediateDominators(graph, start);

        // edges from nodes pulled into the loop to their successors; every
        // node of this graph is reachable from some initial exit
        DiGraph<Region> grown = new DiGraph<Region>();

        List<Region> sortedExitNodes = GraphUtils.quasiTopologicalSort(graph, exitNodes);
        Set<Region> newExitNodes = exitNodes;
        while (sortedExitNodes.size() > 1 && !newExitNodes.isEmpty()) {
            LinkedHashMap<Region, Set<Region>> candidates = new LinkedHashMap<Region, Set<Region>>();
            for (Region n : sortedExitNodes) {
                boolean onlyFromLoop = true;
                for (Region pred : graph.predecessors(n)) {
                    if (pred != n && !loopNodes.contains(pred)) {
                        onlyFromLoop = false;
                        break;
                    }
                }
                if (onlyFromLoop && Dominators.dominates(idom, head, n)) {
                    candidates.put(n, outsideSuccessors(n, loopNodes));
                }
            }

            // a candidate that would become the exit of another candidate
            // stays an exit, unless that holds for all of them
            LinkedHashSet<Region> allNewExitCandidates = new LinkedHashSet<Region>();
            for (Set<Region> s : candidates.values()) {
                allNewExitCandidates.addAll(s);
            }
            if (allNewExitCandidates.containsAll(candidates.keySet())) {
                allNewExitCandidates.clear();
            }

            newExitNodes = new LinkedHashSet<Region>();
            for (Region n : candidates.keySet()) {
                if (allNewExitCandidates.contains(n)) {
                    continue;
                }
                loopNodes.add(n);
                sortedExitNodes.remove(n);
                for (Region succ : outsideSuccessors(n, loopNodes)) {
                    newExitNodes.add(succ);
                    grown.addEdge(n, succ);
                }
            }

            LinkedHashSet<Region> merged = new LinkedHashSet<Region>(sortedExitNodes);
            merged.addAll(newExitNodes);
            sortedExitNodes = GraphUtils.quasiTopologicalSort(graph, merged);
        }

        exitNodes = new LinkedHashSet<Region>(sortedExitNodes);
        loopNodes.removeAll(exitNodes);

        if (largestSuccessorTreeOutsideLoop && exitNodes.isEmpty()) {
            splitLargestSuccessorTree(grown, initialExitNodes, loopNodes, exitNodes);
        }
        return new Loop(loopNodes, exitNodes);
    }

    /**
     * The refinement pulled everything into the loop. The initial exit with
     * the strictly largest tree of pulled-in nodes, if those nodes are
     * reachable from no other initial exit, is the code following the
     * loop: it is moved out again and becomes the only exit. Ties change
     * nothing.
     */
    private void splitLargestSuccessorTree(DiGraph<Region> grown, Set<Region> initialExitNodes,
                                           Set<Region> loopNodes, Set<Region> exitNodes) {
        LinkedHashMap<Region, Set<Region>> exitToNewNodes = new LinkedHashMap<Region, Set<Region>>();
        HashMap<Region, Set<Region>> newNodeToExits = new HashMap<Region, Set<Region>>();
        for (Region initialExit : initialExitNodes) {
            if (!grown.containsNode(initialExit)) {
                continue;
            }
            Set<Region> tree = GraphUtils.reachable(grown, initialExit, Collections.emptySet(), false);
            tree.remove(initialExit);
            if (tree.isEmpty()) {
                continue;
            }
            exitToNewNodes.put(initialExit, tree);
            for (Region n : tree) {
                Set<Region> exits = newNodeToExits.get(n);
                if (exits == null) {
                    exits = new LinkedHashSet<Region>();
                    newNodeToExits.put(n, exits);
                }
                exits.add(initialExit);
            }
        }
        if (exitToNewNodes.isEmpty()) {
            return;
        }

        int maxTreeSize = 0;
        int count = 0;
        Region maxSizeExit = null;
        for (Map.Entry<Region, Set<Region>> e : exitToNewNodes.entrySet()) {
            int size = e.getValue().size();
            if (size > maxTreeSize) {
                maxTreeSize = size;
                maxSizeExit = e.getKey();
                count = 1;
            } else if (size == maxTreeSize) {
                ++count;
            }
        }
        if (count != 1) {
            logger.debug("No unique largest successor tree, keeping the loop as is");
            return;
        }
        Set<Region> tree = exitToNewNodes.get(maxSizeExit);
        for (Region n : tree) {
            if (newNodeToExits.get(n).size() != 1) {
                return;
            }
        }
        loopNodes.removeAll(tree);
        loopNodes.remove(maxSizeExit);
        exitNodes.add(maxSizeExit);
    }

    private LinkedHashSet<Region> outsideSuccessors(Region n, Set<Region> loopNodes) {
        LinkedHashSet<Region> result = new LinkedHashSet<Region>();
        for (Region succ : graph.successors(n)) {
            if (!loopNodes.contains(succ)) {
                result.add(succ);
            }
        }
        return result;
    }

    private Map<Region, Integer> postorderRank(Region head) {
        HashMap<Region, Integer> rank = new HashMap<Region, Integer>();
        List<Region> order = GraphUtils.dfsPostorderNodes(graph, head);
        for (int i = 0; i < order.size(); ++i) {
            rank.put(order.get(i), i);
        }
        return rank;
    }

    private static int rankOf(Map<Region, Integer> rank, Region n) {
        Integer r = rank.get(n);
        return r == null ? Integer.MAX_VALUE : r;
    }

    // ------------------------------------------------------------------------
    // Abstraction
    // ------------------------------------------------------------------------

    /**
     * Replaces the loop nodes in the graph by one region node. Edges from
     * outside into any loop node now enter the region, which records
     * whether they targeted the head or bypassed it; edges from a loop
     * node to outside now leave it. An outside successor that is neither
     * the normal exit nor a known abnormal exit is added to the abnormal
     * exits.
     */
    CyclicRegion abstractCyclicRegion(Set<Region> loopNodes, Region head, Region normalExit,
                                      List<Region> abnormalExits) {
        DiGraph<Region> subgraph = new DiGraph<Region>();
        DiGraph<Region> fullGraph = new DiGraph<Region>();
        List<DiGraph.Edge<Region>> regionOutEdges = new ArrayList<DiGraph.Edge<Region>>();
        LinkedHashSet<Region> entries = new LinkedHashSet<Region>();
        LinkedHashSet<Region> exits = new LinkedHashSet<Region>();
        List<Region> abnormal = new ArrayList<Region>(abnormalExits);

        LinkedHashSet<Region> normalEntries = new LinkedHashSet<Region>();
        for (Region pred : graph.predecessors(head)) {
            if (!loopNodes.contains(pred)) {
                normalEntries.add(pred);
            }
        }
        LinkedHashMap<Region, Region> abnormalEntries = new LinkedHashMap<Region, Region>();

        for (Region node : loopNodes) {
            subgraph.addNode(node);
            for (DiGraph.Edge<Region> e : graph.inEdges(node)) {
                Region src = e.getSource();
                fullGraph.addEdge(src, e.getTarget(), e.getType());
                if (loopNodes.contains(src)) {
                    subgraph.addEdge(src, e.getTarget(), e.getType());
                } else {
                    entries.add(src);
                    if (!normalEntries.contains(src) && !abnormalEntries.containsKey(src)) {
                        abnormalEntries.put(src, node);
                    }
                }
            }
            for (DiGraph.Edge<Region> e : graph.outEdges(node)) {
                fullGraph.addEdge(e.getSource(), e.getTarget(), e.getType());
                Region dst = e.getTarget();
                if (loopNodes.contains(dst)) {
                    subgraph.addEdge(e.getSource(), dst, e.getType());
                } else {
                    regionOutEdges.add(e);
                    exits.add(dst);
                    if (dst != normalExit && !abnormal.contains(dst)) {
                        abnormal.add(dst);
                    }
                }
            }
        }

        DiGraph<Region> subgraphWithExits = new DiGraph<Region>(subgraph);
        for (DiGraph.Edge<Region> e : regionOutEdges) {
            subgraphWithExits.addEdge(e.getSource(), e.getTarget(), e.getType());
        }
        CyclicRegion region = new CyclicRegion(head, subgraph, subgraphWithExits, fullGraph,
                                               normalEntries, abnormalEntries, normalExit, abnormal);
        if (!abnormalEntries.isEmpty()) {
            logger.debug("Abnormal entries {}", abnormalEntries.keySet());
        }

        graph.removeNodes(loopNodes);
        graph.addNode(region);
        for (Region src : entries) {
            graph.addEdge(src, region);
        }
        for (Region dst : exits) {
            graph.addEdge(region, dst);
        }
        return region;
    }
}

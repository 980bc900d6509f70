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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Traversals and orderings over {@link DiGraph}.
 *
 * All depth-first traversals are iterative and visit successors in the
 * graph's insertion order.
 */
public final class GraphUtils {

    private GraphUtils() {
    }

    // ------------------------------------------------------------------------
    // Depth-first search
    // ------------------------------------------------------------------------

    /**
     * Classifies the back edges of a depth-first search from
     * <code>start</code>: edges whose target is still on the DFS stack.
     *
     * @return the back edges in discovery order
     */
    public static <N> List<DiGraph.Edge<N>> dfsBackEdges(DiGraph<N> graph, N start) {
        List<DiGraph.Edge<N>> backEdges = new ArrayList<DiGraph.Edge<N>>();
        HashSet<N> visited = new HashSet<N>();
        HashSet<N> finished = new HashSet<N>();
        Deque<N> path = new ArrayDeque<N>();
        Deque<Iterator<N>> children = new ArrayDeque<Iterator<N>>();

        visited.add(start);
        path.push(start);
        children.push(graph.successors(start).iterator());
        while (!path.isEmpty()) {
            N node = path.peek();
            Iterator<N> it = children.peek();
            if (it.hasNext()) {
                N child = it.next();
                if (finished.contains(child)) {
                    continue;
                }
                if (visited.contains(child)) {
                    backEdges.add(new DiGraph.Edge<N>(node, child, graph.getEdgeType(node, child)));
                } else {
                    visited.add(child);
                    path.push(child);
                    children.push(graph.successors(child).iterator());
                }
            } else {
                finished.add(node);
                path.pop();
                children.pop();
            }
        }
        return backEdges;
    }

    /**
     * @return the nodes reachable from <code>source</code> in depth-first
     *         postorder
     */
    public static <N> List<N> dfsPostorderNodes(DiGraph<N> graph, N source) {
        List<N> order = new ArrayList<N>();
        postorder(graph, source, new HashSet<N>(), order);
        return order;
    }

    /**
     * @return all nodes in depth-first postorder, starting new searches
     *         from unvisited nodes in graph order
     */
    public static <N> List<N> dfsPostorderNodes(DiGraph<N> graph) {
        List<N> order = new ArrayList<N>();
        HashSet<N> visited = new HashSet<N>();
        for (N node : graph.nodes()) {
            if (!visited.contains(node)) {
                postorder(graph, node, visited, order);
            }
        }
        return order;
    }

    private static <N> void postorder(DiGraph<N> graph, N source, Set<N> visited, List<N> order) {
        Deque<N> path = new ArrayDeque<N>();
        Deque<Iterator<N>> children = new ArrayDeque<Iterator<N>>();
        visited.add(source);
        path.push(source);
        children.push(graph.successors(source).iterator());
        while (!path.isEmpty()) {
            Iterator<N> it = children.peek();
            if (it.hasNext()) {
                N child = it.next();
                if (visited.add(child)) {
                    path.push(child);
                    children.push(graph.successors(child).iterator());
                }
            } else {
                order.add(path.pop());
                children.pop();
            }
        }
    }

    /**
     * @return the nodes reachable from <code>source</code> without
     *         expanding any node in <code>blocked</code>, in discovery order
     */
    public static <N> LinkedHashSet<N> reachable(DiGraph<N> graph, N source, Collection<?> blocked, boolean reverse) {
        LinkedHashSet<N> seen = new LinkedHashSet<N>();
        Deque<N> work = new ArrayDeque<N>();
        seen.add(source);
        work.add(source);
        while (!work.isEmpty()) {
            N node = work.poll();
            if (blocked.contains(node) && !node.equals(source)) {
                continue;
            }
            for (N next : reverse ? graph.predecessors(node) : graph.successors(node)) {
                if (seen.add(next)) {
                    work.add(next);
                }
            }
        }
        return seen;
    }

    // ------------------------------------------------------------------------
    // Slicing
    // ------------------------------------------------------------------------

    /**
     * Computes the subgraph of all nodes lying on a path from
     * <code>source</code> to one of the <code>frontier</code> nodes, such
     * that the path leaves <code>source</code> once and stops at the first
     * visit of its frontier node.
     *
     * @param includeFrontier whether frontier nodes belong to the result
     * @return the induced subgraph, in graph node order; empty if no
     *         frontier node is reachable
     */
    public static <N> DiGraph<N> subgraphBetweenNodes(DiGraph<N> graph, N source, Collection<N> frontier,
                                                      boolean includeFrontier) {
        HashSet<N> members = new HashSet<N>();
        List<N> sourceOnly = Collections.singletonList(source);
        for (N target : frontier) {
            if (target.equals(source)) {
                continue;
            }
            Set<N> forward = reachable(graph, source, Collections.singletonList(target), false);
            if (!forward.contains(target)) {
                continue;
            }
            Set<N> backward = reachable(graph, target, sourceOnly, true);
            for (N n : forward) {
                if (backward.contains(n)) {
                    members.add(n);
                }
            }
        }
        if (!includeFrontier) {
            members.removeAll(frontier);
        }

        List<N> ordered = new ArrayList<N>();
        for (N n : graph.nodes()) {
            if (members.contains(n)) {
                ordered.add(n);
            }
        }
        return graph.subgraph(ordered);
    }

    // ------------------------------------------------------------------------
    // Quasi-topological sort
    // ------------------------------------------------------------------------

    /**
     * Sorts all nodes of a graph in topological order, tolerating cycles:
     * every strongly connected component is placed as a whole and ordered
     * internally by the same procedure after cutting the edges into its
     * entry node.
     */
    public static <N> List<N> quasiTopologicalSort(DiGraph<N> graph) {
        return quasiTopologicalSort(graph, null);
    }

    /**
     * Like {@link #quasiTopologicalSort(DiGraph)}, restricted to
     * <code>nodes</code>.
     *
     * @param nodes the nodes to keep, or <code>null</code> for all
     */
    public static <N> List<N> quasiTopologicalSort(DiGraph<N> graph, Collection<N> nodes) {
        List<N> ordered = new ArrayList<N>();
        if (graph.numberOfNodes() == 1) {
            ordered.addAll(graph.nodes());
        } else {
            appendQuasiTopological(graph, ordered);
        }
        if (nodes == null) {
            return ordered;
        }
        HashSet<N> keep = new HashSet<N>(nodes);
        List<N> filtered = new ArrayList<N>();
        for (N n : ordered) {
            if (keep.contains(n)) {
                filtered.add(n);
            }
        }
        return filtered;
    }

    private static <N> void appendQuasiTopological(DiGraph<N> graph, List<N> ordered) {
        // condense the graph: every node is replaced by its component
        HashMap<N, Scc<N>> componentOf = new HashMap<N, Scc<N>>();
        for (Scc<N> scc : Scc.stronglyConnectedComponents(graph)) {
            for (N n : scc.nodes) {
                componentOf.put(n, scc);
            }
        }

        DiGraph<Scc<N>> condensed = new DiGraph<Scc<N>>();
        for (DiGraph.Edge<N> edge : graph.edges()) {
            Scc<N> src = componentOf.get(edge.src);
            Scc<N> dst = componentOf.get(edge.dst);
            if (src != dst) {
                condensed.addEdge(src, dst);
            }
        }
        for (N n : graph.nodes()) {
            condensed.addNode(componentOf.get(n));
        }

        for (Scc<N> scc : topologicalSort(condensed)) {
            if (scc.size() > 1) {
                appendScc(graph, ordered, scc);
            } else {
                ordered.add(scc.first);
            }
        }
    }

    private static <N> void appendScc(DiGraph<N> graph, List<N> ordered, Scc<N> scc) {
        // entry: the first component node that succeeds the most recently
        // placed node
        N loopHead = null;
        for (int i = ordered.size() - 1; i >= 0 && loopHead == null; --i) {
            N parent = ordered.get(i);
            for (N n : scc.nodes) {
                if (graph.containsEdge(parent, n)) {
                    loopHead = n;
                    break;
                }
            }
        }
        if (loopHead == null) {
            loopHead = scc.nodes.iterator().next();
        }

        DiGraph<N> subgraph = graph.subgraph(scc.nodes);
        for (N src : subgraph.predecessors(loopHead)) {
            subgraph.removeEdge(src, loopHead);
        }
        ordered.addAll(quasiTopologicalSort(subgraph));
    }

    /**
     * Kahn's algorithm, emitting one generation of zero in-degree nodes at
     * a time.
     *
     * @throws IllegalArgumentException if the graph has a cycle
     */
    public static <N> List<N> topologicalSort(DiGraph<N> graph) {
        List<N> order = new ArrayList<N>();
        HashMap<N, Integer> inDegree = new HashMap<N, Integer>();
        List<N> generation = new ArrayList<N>();
        for (N n : graph.nodes()) {
            int d = graph.inDegree(n);
            if (d == 0) {
                generation.add(n);
            } else {
                inDegree.put(n, d);
            }
        }
        while (!generation.isEmpty()) {
            List<N> next = new ArrayList<N>();
            for (N n : generation) {
                order.add(n);
                for (N child : graph.successors(n)) {
                    int d = inDegree.get(child) - 1;
                    if (d == 0) {
                        inDegree.remove(child);
                        next.add(child);
                    } else {
                        inDegree.put(child, d);
                    }
                }
            }
            generation = next;
        }
        if (!inDegree.isEmpty()) {
            throw new IllegalArgumentException("graph contains a cycle");
        }
        return order;
    }
}

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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed graph without parallel edges.
 *
 * Nodes, successors and predecessors are iterated in insertion order, so
 * every traversal built on top of this class is reproducible from one run
 * to the next. Node identity follows {@link Object#equals} of the node
 * type.
 *
 * @param <N> node type
 */
public class DiGraph<N> {

    /**
     * An edge together with its tag.
     */
    public static final class Edge<N> {
        final N src;
        final N dst;
        final EdgeType type;

        public Edge(N src, N dst, EdgeType type) {
            this.src = src;
            this.dst = dst;
            this.type = type;
        }

        public N getSource() {
            return src;
        }

        public N getTarget() {
            return dst;
        }

        public EdgeType getType() {
            return type;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Edge)) {
                return false;
            }
            Edge<?> other = (Edge<?>) o;
            return src.equals(other.src) && dst.equals(other.dst);
        }

        @Override
        public int hashCode() {
            return 31 * src.hashCode() + dst.hashCode();
        }

        @Override
        public String toString() {
            return "(" + src + " -> " + dst + (type == EdgeType.FLOW ? "" : ", " + type) + ")";
        }
    }

    /**
     * Outgoing adjacency: node to (successor to edge tag).
     */
    private final LinkedHashMap<N, LinkedHashMap<N, EdgeType>> succ;

    /**
     * Incoming adjacency, the inverse of {@link #succ}.
     */
    private final LinkedHashMap<N, LinkedHashMap<N, EdgeType>> pred;

    public DiGraph() {
        this.succ = new LinkedHashMap<N, LinkedHashMap<N, EdgeType>>();
        this.pred = new LinkedHashMap<N, LinkedHashMap<N, EdgeType>>();
    }

    /**
     * Copies another graph. Nodes themselves are shared, the adjacency
     * structure is not.
     */
    public DiGraph(DiGraph<N> other) {
        this();
        for (N node : other.succ.keySet()) {
            addNode(node);
        }
        for (Map.Entry<N, LinkedHashMap<N, EdgeType>> entry : other.succ.entrySet()) {
            for (Map.Entry<N, EdgeType> e : entry.getValue().entrySet()) {
                addEdge(entry.getKey(), e.getKey(), e.getValue());
            }
        }
    }

    // ------------------------------------------------------------------------
    // Mutation
    // ------------------------------------------------------------------------

    /**
     * @return <code>true</code> if the node was not already present
     */
    public boolean addNode(N node) {
        if (node == null) {
            throw new IllegalArgumentException("null node");
        }
        if (succ.containsKey(node)) {
            return false;
        }
        succ.put(node, new LinkedHashMap<N, EdgeType>());
        pred.put(node, new LinkedHashMap<N, EdgeType>());
        return true;
    }

    public void addEdge(N src, N dst) {
        addEdge(src, dst, EdgeType.FLOW);
    }

    /**
     * Adds an edge, adding missing end points first. Re-adding an
     * existing edge replaces its tag.
     */
    public void addEdge(N src, N dst, EdgeType type) {
        addNode(src);
        addNode(dst);
        succ.get(src).put(dst, type);
        pred.get(dst).put(src, type);
    }

    /**
     * Removes a node and all edges touching it.
     *
     * @return <code>true</code> if the node was present
     */
    public boolean removeNode(N node) {
        LinkedHashMap<N, EdgeType> out = succ.remove(node);
        if (out == null) {
            return false;
        }
        LinkedHashMap<N, EdgeType> in = pred.remove(node);
        for (N s : out.keySet()) {
            LinkedHashMap<N, EdgeType> p = pred.get(s);
            if (p != null) {
                p.remove(node);
            }
        }
        for (N p : in.keySet()) {
            LinkedHashMap<N, EdgeType> s = succ.get(p);
            if (s != null) {
                s.remove(node);
            }
        }
        return true;
    }

    public void removeNodes(Collection<? extends N> nodes) {
        for (N node : nodes) {
            removeNode(node);
        }
    }

    /**
     * @return <code>true</code> if the edge was present
     */
    public boolean removeEdge(N src, N dst) {
        LinkedHashMap<N, EdgeType> out = succ.get(src);
        if (out == null || !out.containsKey(dst)) {
            return false;
        }
        out.remove(dst);
        pred.get(dst).remove(src);
        return true;
    }

    // ------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------

    public boolean containsNode(Object node) {
        return succ.containsKey(node);
    }

    public boolean containsEdge(N src, N dst) {
        LinkedHashMap<N, EdgeType> out = succ.get(src);
        return out != null && out.containsKey(dst);
    }

    /**
     * @return the tag of an edge, or <code>null</code> if there is no such edge
     */
    public EdgeType getEdgeType(N src, N dst) {
        LinkedHashMap<N, EdgeType> out = succ.get(src);
        return out == null ? null : out.get(dst);
    }

    /**
     * @return a snapshot of the nodes in insertion order
     */
    public List<N> nodes() {
        return new ArrayList<N>(succ.keySet());
    }

    public int numberOfNodes() {
        return succ.size();
    }

    public int numberOfEdges() {
        int count = 0;
        for (LinkedHashMap<N, EdgeType> out : succ.values()) {
            count += out.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return succ.isEmpty();
    }

    public List<N> successors(N node) {
        return new ArrayList<N>(adjacency(succ, node).keySet());
    }

    public List<N> predecessors(N node) {
        return new ArrayList<N>(adjacency(pred, node).keySet());
    }

    public int outDegree(N node) {
        return adjacency(succ, node).size();
    }

    public int inDegree(N node) {
        return adjacency(pred, node).size();
    }

    /**
     * @return all edges, grouped by source in node order
     */
    public List<Edge<N>> edges() {
        List<Edge<N>> edges = new ArrayList<Edge<N>>();
        for (Map.Entry<N, LinkedHashMap<N, EdgeType>> entry : succ.entrySet()) {
            for (Map.Entry<N, EdgeType> e : entry.getValue().entrySet()) {
                edges.add(new Edge<N>(entry.getKey(), e.getKey(), e.getValue()));
            }
        }
        return edges;
    }

    /**
     * @return the edges into <code>node</code>, in the order they were added
     */
    public List<Edge<N>> inEdges(N node) {
        List<Edge<N>> edges = new ArrayList<Edge<N>>();
        for (Map.Entry<N, EdgeType> e : adjacency(pred, node).entrySet()) {
            edges.add(new Edge<N>(e.getKey(), node, e.getValue()));
        }
        return edges;
    }

    public List<Edge<N>> outEdges(N node) {
        List<Edge<N>> edges = new ArrayList<Edge<N>>();
        for (Map.Entry<N, EdgeType> e : adjacency(succ, node).entrySet()) {
            edges.add(new Edge<N>(node, e.getKey(), e.getValue()));
        }
        return edges;
    }

    private LinkedHashMap<N, EdgeType> adjacency(LinkedHashMap<N, LinkedHashMap<N, EdgeType>> map, N node) {
        LinkedHashMap<N, EdgeType> adj = map.get(node);
        if (adj == null) {
            throw new IllegalArgumentException("node " + node + " is not in the graph");
        }
        return adj;
    }

    // ------------------------------------------------------------------------
    // Derived graphs
    // ------------------------------------------------------------------------

    /**
     * @return a new graph with every edge reversed
     */
    public DiGraph<N> reverse() {
        DiGraph<N> reversed = new DiGraph<N>();
        for (N node : succ.keySet()) {
            reversed.addNode(node);
        }
        for (Edge<N> edge : edges()) {
            reversed.addEdge(edge.dst, edge.src, edge.type);
        }
        return reversed;
    }

    /**
     * @return the subgraph induced by <code>nodes</code>, keeping this
     *         graph's node order
     */
    public DiGraph<N> subgraph(Collection<? extends N> nodes) {
        DiGraph<N> sub = new DiGraph<N>();
        for (N node : succ.keySet()) {
            if (nodes.contains(node)) {
                sub.addNode(node);
            }
        }
        for (N node : sub.nodes()) {
            for (Map.Entry<N, EdgeType> e : succ.get(node).entrySet()) {
                if (sub.containsNode(e.getKey())) {
                    sub.addEdge(node, e.getKey(), e.getValue());
                }
            }
        }
        return sub;
    }

    @Override
    public String toString() {
        return "DiGraph" + edges();
    }
}

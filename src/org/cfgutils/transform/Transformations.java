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
package org.cfgutils.transform;

import java.util.List;

import org.cfgutils.data.Block;
import org.cfgutils.graph.DiGraph;
import org.cfgutils.graph.GraphUtils;

/**
 * Structural rewrites of block graphs.
 */
public final class Transformations {

    private Transformations() {
    }

    /**
     * Replaces <code>a</code> and <code>b</code> by their merged block.
     * The new block inherits the in-edges of <code>a</code> and the
     * out-edges of <code>b</code>; an edge between the two becomes a self
     * loop. Edge tags are kept.
     *
     * @return the merged block
     */
    public static Block mergeGraphNodes(DiGraph<Block> graph, Block a, Block b) {
        List<DiGraph.Edge<Block>> inEdges = graph.inEdges(a);
        List<DiGraph.Edge<Block>> outEdges = graph.outEdges(b);
        Block merged = Block.merge(a, b);

        graph.removeNode(a);
        graph.removeNode(b);
        graph.addNode(merged);
        for (DiGraph.Edge<Block> e : inEdges) {
            Block src = e.getSource().equals(b) ? merged : e.getSource();
            graph.addEdge(src, merged, e.getType());
        }
        for (DiGraph.Edge<Block> e : outEdges) {
            Block dst = e.getTarget().equals(a) ? merged : e.getTarget();
            graph.addEdge(merged, dst, e.getType());
        }
        return merged;
    }

    /**
     * Folds <code>child</code>, whose only predecessor is
     * <code>parent</code>, into <code>parent</code>. The merged block keeps
     * the in-edges of <code>parent</code> and the out-edges of both.
     *
     * @return the merged block
     */
    public static Block absorbNode(DiGraph<Block> graph, Block parent, Block child) {
        List<DiGraph.Edge<Block>> parentIn = graph.inEdges(parent);
        List<DiGraph.Edge<Block>> parentOut = graph.outEdges(parent);
        List<DiGraph.Edge<Block>> childOut = graph.outEdges(child);
        Block merged = Block.merge(parent, child);

        graph.removeNode(parent);
        graph.removeNode(child);
        graph.addNode(merged);
        for (DiGraph.Edge<Block> e : parentIn) {
            Block src = e.getSource().equals(child) ? merged : e.getSource();
            graph.addEdge(src, merged, e.getType());
        }
        for (DiGraph.Edge<Block> e : parentOut) {
            if (e.getTarget().equals(child)) {
                continue;
            }
            Block dst = e.getTarget().equals(parent) ? merged : e.getTarget();
            graph.addEdge(merged, dst, e.getType());
        }
        for (DiGraph.Edge<Block> e : childOut) {
            Block dst = e.getTarget().equals(parent) || e.getTarget().equals(child) ? merged : e.getTarget();
            graph.addEdge(merged, dst, e.getType());
        }
        return merged;
    }

    /**
     * Copies a graph and collapses every straight-line chain: an edge whose
     * source has one successor and whose target has one predecessor is
     * contracted, until no such edge is left.
     */
    public static DiGraph<Block> toSupergraph(DiGraph<Block> graph) {
        DiGraph<Block> result = new DiGraph<Block>(graph);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (DiGraph.Edge<Block> e : result.edges()) {
                Block src = e.getSource();
                Block dst = e.getTarget();
                if (!src.equals(dst) && result.outDegree(src) == 1 && result.inDegree(dst) == 1) {
                    mergeGraphNodes(result, src, dst);
                    changed = true;
                    break;
                }
            }
        }
        return result;
    }

    /**
     * Tests reducibility by Hecht and Ullman's T1/T2 transformations: self
     * loops are removed (T1) and nodes with a single predecessor are folded
     * into it (T2) until neither applies. The graph is reducible iff one
     * node is left.
     *
     * The argument is not modified.
     */
    public static boolean isReducible(DiGraph<Block> graph) {
        DiGraph<Block> g = new DiGraph<Block>(graph);
        SupergraphPreprocessor.makeSupergraph(g);
        boolean changed = true;
        while (changed) {
            changed = removeSelfLoops(g);
            changed |= mergeSingleEntryNode(g);
        }
        return g.numberOfNodes() == 1;
    }

    private static boolean removeSelfLoops(DiGraph<Block> graph) {
        boolean removed = false;
        for (Block node : graph.nodes()) {
            if (graph.removeEdge(node, node)) {
                removed = true;
            }
        }
        return removed;
    }

    private static boolean mergeSingleEntryNode(DiGraph<Block> graph) {
        boolean merged = false;
        boolean again = true;
        while (again) {
            again = false;
            for (Block node : GraphUtils.dfsPostorderNodes(graph)) {
                List<Block> preds = graph.predecessors(node);
                if (preds.size() == 1 && !preds.get(0).equals(node)) {
                    absorbNode(graph, preds.get(0), node);
                    merged = true;
                    again = true;
                    break;
                }
            }
        }
        return merged;
    }
}

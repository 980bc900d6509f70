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
package org.cfgutils.data;

import java.util.LinkedHashMap;

import org.cfgutils.graph.DiGraph;

/**
 * Factories for block graphs.
 */
public final class BlockGraphs {

    private BlockGraphs() {
    }

    /**
     * Builds a graph of empty blocks from address pairs. Every distinct
     * address becomes one block; blocks without predecessors are flagged
     * as entry points and blocks without successors as exit points.
     *
     * @param edges <code>{src, dst}</code> pairs
     */
    public static DiGraph<Block> fromNumberedEdges(long[][] edges) {
        LinkedHashMap<Long, Block> blocks = new LinkedHashMap<Long, Block>();
        DiGraph<Block> graph = new DiGraph<Block>();
        for (long[] edge : edges) {
            if (edge.length != 2) {
                throw new IllegalArgumentException("edge must be a {src, dst} pair");
            }
            graph.addEdge(block(blocks, edge[0]), block(blocks, edge[1]));
        }
        markEndpoints(graph);
        return graph;
    }

    /**
     * Sets the entry flag on all blocks without predecessors and the exit
     * flag on all blocks without successors.
     */
    public static void markEndpoints(DiGraph<Block> graph) {
        for (Block b : graph.nodes()) {
            if (graph.inDegree(b) == 0) {
                b.setEntrypoint(true);
            }
            if (graph.outDegree(b) == 0) {
                b.setExitpoint(true);
            }
        }
    }

    /**
     * Deep copy: blocks are re-created, so flags can be changed on the
     * copy without affecting the original.
     */
    public static DiGraph<Block> copy(DiGraph<Block> graph) {
        LinkedHashMap<Block, Block> copies = new LinkedHashMap<Block, Block>();
        DiGraph<Block> result = new DiGraph<Block>();
        for (Block b : graph.nodes()) {
            Block c = new Block(b.addr, b.idx, b.statements, b.entrypoint, b.exitpoint, b.mergedNode);
            copies.put(b, c);
            result.addNode(c);
        }
        for (DiGraph.Edge<Block> edge : graph.edges()) {
            result.addEdge(copies.get(edge.getSource()), copies.get(edge.getTarget()), edge.getType());
        }
        return result;
    }

    private static Block block(LinkedHashMap<Long, Block> blocks, long addr) {
        Block b = blocks.get(addr);
        if (b == null) {
            b = new Block(addr);
            blocks.put(addr, b);
        }
        return b;
    }
}

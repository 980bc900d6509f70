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

import java.util.Collection;

import org.cfgutils.data.Block;
import org.cfgutils.graph.DiGraph;

/**
 * Region abstracting a subgraph of other regions.
 */
public abstract class GraphRegion extends Region {

    /**
     * Entry node of {@link #graph}. Replaced when the builders nest the
     * entry into a smaller region.
     */
    Region head;

    /**
     * Member nodes and the edges between them.
     */
    DiGraph<Region> graph;

    /**
     * {@link #graph} plus the edges leaving the region.
     */
    DiGraph<Region> graphWithSuccessors;

    GraphRegion(Kind kind, Region head, DiGraph<Region> graph, DiGraph<Region> graphWithSuccessors) {
        super(kind);
        this.head = head;
        this.graph = graph;
        this.graphWithSuccessors = graphWithSuccessors;
    }

    public Region getHead() {
        return head;
    }

    public DiGraph<Region> getGraph() {
        return graph;
    }

    public DiGraph<Region> getGraphWithSuccessors() {
        return graphWithSuccessors;
    }

    /**
     * @return the nodes control leaves the region for
     */
    public abstract Collection<Region> getSuccessors();

    @Override
    public long getAddr() {
        return head.getAddr();
    }

    @Override
    public Block getHeadBlock() {
        return head.getHeadBlock();
    }

    @Override
    public String toString() {
        return "<" + getClass().getSimpleName() + " 0x" + Long.toHexString(getAddr())
            + " of " + graph.numberOfNodes() + " nodes>";
    }
}

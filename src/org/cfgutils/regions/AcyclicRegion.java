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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.cfgutils.graph.DiGraph;

/**
 * A single-entry single-exit region, or the flat residue of a graph that
 * could not be reduced further.
 */
public final class AcyclicRegion extends GraphRegion {

    /**
     * Nodes bounding the region: control reaches them on leaving.
     */
    final List<Region> frontier;

    /**
     * The frontier plus successors added back for regions inside a loop
     * body.
     */
    final LinkedHashSet<Region> successors;

    AcyclicRegion(Region head, DiGraph<Region> graph, List<Region> frontier,
                  DiGraph<Region> graphWithSuccessors) {
        super(Kind.ACYCLIC, head, graph, graphWithSuccessors);
        this.frontier = Collections.unmodifiableList(new ArrayList<Region>(frontier));
        this.successors = new LinkedHashSet<Region>(frontier);
    }

    public List<Region> getFrontier() {
        return frontier;
    }

    @Override
    public Set<Region> getSuccessors() {
        return Collections.unmodifiableSet(successors);
    }
}

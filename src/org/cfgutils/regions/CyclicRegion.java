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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.cfgutils.graph.DiGraph;

/**
 * A natural loop, possibly widened by the loop refinement.
 */
public final class CyclicRegion extends GraphRegion {

    /**
     * All edges touching a loop member before the loop was abstracted,
     * including those from entries and to exits.
     */
    final DiGraph<Region> fullGraph;

    /**
     * Nodes outside the loop that jump to its head.
     */
    final Set<Region> normalEntries;

    /**
     * Nodes outside the loop that jump into its body past the head, each
     * mapped to the loop member it enters first.
     */
    final Map<Region, Region> abnormalEntries;

    /**
     * Exit taken when the loop terminates normally, or <code>null</code>
     * for a loop without exits.
     */
    final Region normalExit;

    /**
     * Other exits: breaks out of enclosing constructs, irregular jumps.
     */
    final List<Region> abnormalExits;

    CyclicRegion(Region head, DiGraph<Region> graph, DiGraph<Region> graphWithSuccessors,
                 DiGraph<Region> fullGraph, Set<Region> normalEntries, Map<Region, Region> abnormalEntries,
                 Region normalExit, List<Region> abnormalExits) {
        super(Kind.CYCLIC, head, graph, graphWithSuccessors);
        this.fullGraph = fullGraph;
        this.normalEntries = Collections.unmodifiableSet(new LinkedHashSet<Region>(normalEntries));
        this.abnormalEntries = Collections.unmodifiableMap(new LinkedHashMap<Region, Region>(abnormalEntries));
        this.normalExit = normalExit;
        this.abnormalExits = Collections.unmodifiableList(new ArrayList<Region>(abnormalExits));
    }

    public DiGraph<Region> getFullGraph() {
        return fullGraph;
    }

    public Set<Region> getNormalEntries() {
        return normalEntries;
    }

    /**
     * @return the entries that bypass the head, with the member each one
     *         jumps to
     */
    public Map<Region, Region> getAbnormalEntries() {
        return abnormalEntries;
    }

    public Region getNormalExit() {
        return normalExit;
    }

    public List<Region> getAbnormalExits() {
        return abnormalExits;
    }

    /**
     * @return the normal exit, if any, followed by the abnormal exits
     */
    @Override
    public List<Region> getSuccessors() {
        List<Region> successors = new ArrayList<Region>(abnormalExits.size() + 1);
        if (normalExit != null) {
            successors.add(normalExit);
        }
        successors.addAll(abnormalExits);
        return successors;
    }
}

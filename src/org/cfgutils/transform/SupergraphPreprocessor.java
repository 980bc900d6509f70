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

import org.cfgutils.data.Block;
import org.cfgutils.graph.DiGraph;
import org.cfgutils.graph.EdgeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes call artifacts from a block graph so that only intraprocedural
 * control flow is left.
 */
public final class SupergraphPreprocessor {

    private static final Logger logger = LoggerFactory.getLogger(SupergraphPreprocessor.class);

    private SupergraphPreprocessor() {
    }

    /**
     * Rewrites <code>graph</code> in place until a fixed point is reached:
     * <ul>
     * <li>a {@link EdgeType#FAKE_RETURN} edge from a block with a single
     * successor to a block with a single predecessor is contracted into one
     * merged block;</li>
     * <li>the target of a {@link EdgeType#CALL} edge is removed.</li>
     * </ul>
     * Every rewrite removes at least one node, so this terminates.
     *
     * @return the number of rewrites performed
     */
    public static int makeSupergraph(DiGraph<Block> graph) {
        int rewrites = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (DiGraph.Edge<Block> e : graph.edges()) {
                Block src = e.getSource();
                Block dst = e.getTarget();
                if (e.getType() == EdgeType.FAKE_RETURN) {
                    if (!src.equals(dst) && graph.outDegree(src) == 1 && graph.inDegree(dst) == 1) {
                        Transformations.mergeGraphNodes(graph, src, dst);
                        changed = true;
                        break;
                    }
                } else if (e.getType() == EdgeType.CALL) {
                    graph.removeNode(dst);
                    changed = true;
                    break;
                }
            }
            if (changed) {
                ++rewrites;
            }
        }
        if (rewrites > 0) {
            logger.debug("Supergraph preprocessing applied {} rewrites", rewrites);
        }
        return rewrites;
    }
}

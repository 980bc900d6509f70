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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dominator trees and dominance frontiers, computed according to
 * Cooper, Harvey, and Kennedy,
 * A Simple, Fast Dominance Algorithm,
 * Software Practice and Experience, 2001.
 *
 * Trees are represented as maps from a node to its immediate dominator.
 * The root maps to itself; nodes unreachable from the root are absent.
 */
public final class Dominators {

    private Dominators() {
    }

    /**
     * Computes the immediate dominators of all nodes reachable from
     * <code>start</code>.
     */
    public static <N> Map<N, N> immediateDominators(DiGraph<N> graph, N start) {
        LinkedHashMap<N, N> idom = new LinkedHashMap<N, N>();
        idom.put(start, start);

        List<N> order = GraphUtils.dfsPostorderNodes(graph, start);
        HashMap<N, Integer> dfn = new HashMap<N, Integer>();
        for (int i = 0; i < order.size(); ++i) {
            dfn.put(order.get(i), i);
        }
        // reverse postorder without the start node
        order.remove(order.size() - 1);
        Collections.reverse(order);

        boolean changed = true;
        while (changed) {
            changed = false;
            for (N u : order) {
                N newIdom = null;
                for (N v : graph.predecessors(u)) {
                    if (!idom.containsKey(v)) {
                        continue;
                    }
                    newIdom = (newIdom == null) ? v : intersect(idom, dfn, v, newIdom);
                }
                if (newIdom == null) {
                    continue;
                }
                N old = idom.get(u);
                if (old == null || !old.equals(newIdom)) {
                    idom.put(u, newIdom);
                    changed = true;
                }
            }
        }
        return idom;
    }

    private static <N> N intersect(Map<N, N> idom, Map<N, Integer> dfn, N u, N v) {
        while (!u.equals(v)) {
            while (dfn.get(u) < dfn.get(v)) {
                u = idom.get(u);
            }
            while (dfn.get(u) > dfn.get(v)) {
                v = idom.get(v);
            }
        }
        return u;
    }

    /**
     * Computes the immediate postdominators of all nodes that reach
     * <code>end</code>, as dominators of the reversed graph.
     */
    public static <N> Map<N, N> immediatePostDominators(DiGraph<N> graph, N end) {
        return immediateDominators(graph.reverse(), end);
    }

    public static <N> Map<N, Set<N>> dominanceFrontiers(DiGraph<N> graph, N start) {
        return dominanceFrontiers(graph, immediateDominators(graph, start));
    }

    /**
     * Computes dominance frontiers from an existing dominator tree.
     */
    public static <N> Map<N, Set<N>> dominanceFrontiers(DiGraph<N> graph, Map<N, N> idom) {
        LinkedHashMap<N, Set<N>> df = new LinkedHashMap<N, Set<N>>();
        for (N u : idom.keySet()) {
            df.put(u, new LinkedHashSet<N>());
        }
        for (N u : idom.keySet()) {
            List<N> preds = graph.predecessors(u);
            if (preds.size() < 2) {
                continue;
            }
            for (N v : preds) {
                if (!idom.containsKey(v)) {
                    continue;
                }
                while (!v.equals(idom.get(u))) {
                    df.get(v).add(u);
                    N next = idom.get(v);
                    if (next.equals(v)) {
                        // reached the root
                        break;
                    }
                    v = next;
                }
            }
        }
        return df;
    }

    /**
     * Tests whether <code>dominator</code> dominates <code>node</code> in
     * the tree <code>idom</code>. Every node dominates itself.
     */
    public static <N> boolean dominates(Map<N, N> idom, N dominator, N node) {
        N n = node;
        while (n != null) {
            if (n.equals(dominator)) {
                return true;
            }
            N parent = idom.get(n);
            n = (parent != null && !parent.equals(n)) ? parent : null;
        }
        return false;
    }
}

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
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Stack;

/**
 * Component of the SCC graph of a {@link DiGraph}.
 *
 * @param <N> node type
 */
public final class Scc<N> {

    /**
     * Node through which Tarjan's algorithm entered this component.
     */
    final N first;

    /**
     * Nodes of this component, in the order of the underlying graph.
     */
    final LinkedHashSet<N> nodes;

    Scc(N first) {
        this.first = first;
        this.nodes = new LinkedHashSet<N>();
    }

    public N getFirst() {
        return first;
    }

    public LinkedHashSet<N> getNodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(Object node) {
        return nodes.contains(node);
    }

    @Override
    public String toString() {
        return "Scc" + nodes;
    }

    // ------------------------------------------------------------------------
    // Strongly-connected components
    // ------------------------------------------------------------------------

    /**
     * Per-run bookkeeping of Tarjan's algorithm.
     */
    private static final class State<N> {
        final HashMap<N, Integer> index = new HashMap<N, Integer>();
        final HashMap<N, Integer> lowLink = new HashMap<N, Integer>();
        final Stack<N> stack = new Stack<N>();
        final HashSet<N> onStack = new HashSet<N>();
        final List<Scc<N>> components = new ArrayList<Scc<N>>();
        int next;
    }

    /**
     * Computes the strongly connected components of a graph.
     *
     * @return the components in the order Tarjan's algorithm completes
     *         them, i.e. a reverse topological order of the SCC graph
     */
    public static <N> List<Scc<N>> stronglyConnectedComponents(DiGraph<N> graph) {
        // Tarjan's algorithm
        State<N> state = new State<N>();
        for (N n : graph.nodes()) {
            if (!state.index.containsKey(n)) {
                strongConnect(graph, n, state);
            }
        }
        // keep graph order inside each component
        List<N> order = graph.nodes();
        for (Scc<N> scc : state.components) {
            HashSet<N> members = new HashSet<N>(scc.nodes);
            scc.nodes.clear();
            for (N n : order) {
                if (members.contains(n)) {
                    scc.nodes.add(n);
                }
            }
        }
        return state.components;
    }

    private static <N> void strongConnect(DiGraph<N> graph, N n, State<N> state) {
        state.index.put(n, state.next);
        state.lowLink.put(n, state.next);
        ++state.next;
        state.stack.push(n);
        state.onStack.add(n);

        // Consider successors of n
        for (N w : graph.successors(n)) {
            if (!state.index.containsKey(w)) {
                // Successor w has not yet been visited; recurse on it
                strongConnect(graph, w, state);
                state.lowLink.put(n, Math.min(state.lowLink.get(n), state.lowLink.get(w)));
            } else if (state.onStack.contains(w)) {
                // Successor w is in stack S and hence in the current SCC
                state.lowLink.put(n, Math.min(state.lowLink.get(n), state.index.get(w)));
            }
        }

        // If n is a root node, pop the stack and generate an SCC
        if (state.lowLink.get(n).intValue() == state.index.get(n).intValue()) {
            Scc<N> component = new Scc<N>(n);
            N w;
            do {
                w = state.stack.pop();
                state.onStack.remove(w);
                component.nodes.add(w);
            } while (!w.equals(n));
            state.components.add(component);
        }
    }
}

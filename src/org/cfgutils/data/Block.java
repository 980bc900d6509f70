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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Basic block in a control-flow graph.
 *
 * A block is a value: its address and statements never change once
 * built, and merging two blocks produces a third one. Only the entry and
 * exit flags may be set after construction.
 *
 * Equality is based on the runtime class, the address and the statement
 * list. The disambiguating index is not part of it.
 */
public class Block implements Comparable<Block> {

    /**
     * Marker for a block without a disambiguating index.
     */
    public static final int NO_IDX = -1;

    final long addr;

    /**
     * Disambiguates blocks sharing an address, or {@link #NO_IDX}.
     */
    final int idx;

    /**
     * Opaque statements, compared and concatenated but never interpreted.
     */
    final List<Object> statements;

    boolean entrypoint;

    boolean exitpoint;

    /**
     * Set on blocks created by {@link #merge}.
     */
    final boolean mergedNode;

    public Block(long addr) {
        this(addr, NO_IDX, Collections.<Object>emptyList());
    }

    public Block(long addr, List<?> statements) {
        this(addr, NO_IDX, statements);
    }

    public Block(long addr, int idx, List<?> statements) {
        this(addr, idx, statements, false, false, false);
    }

    Block(long addr, int idx, List<?> statements, boolean entrypoint, boolean exitpoint, boolean mergedNode) {
        if (statements == null) {
            throw new IllegalArgumentException("null statement list");
        }
        this.addr = addr;
        this.idx = idx;
        this.statements = Collections.unmodifiableList(new ArrayList<Object>(statements));
        this.entrypoint = entrypoint;
        this.exitpoint = exitpoint;
        this.mergedNode = mergedNode;
    }

    public long getAddr() {
        return addr;
    }

    public int getIdx() {
        return idx;
    }

    public boolean hasIdx() {
        return idx != NO_IDX;
    }

    public List<Object> getStatements() {
        return statements;
    }

    public boolean isEntrypoint() {
        return entrypoint;
    }

    public void setEntrypoint(boolean entrypoint) {
        this.entrypoint = entrypoint;
    }

    public boolean isExitpoint() {
        return exitpoint;
    }

    public void setExitpoint(boolean exitpoint) {
        this.exitpoint = exitpoint;
    }

    public boolean isMergedNode() {
        return mergedNode;
    }

    /**
     * Merges two blocks into a new one that starts at <code>first</code>'s
     * address and carries both statement lists in order.
     */
    public static Block merge(Block first, Block second) {
        List<Object> statements = new ArrayList<Object>(first.statements.size() + second.statements.size());
        statements.addAll(first.statements);
        statements.addAll(second.statements);
        return new Block(first.addr, first.idx, statements,
                         first.entrypoint || second.entrypoint,
                         first.exitpoint || second.exitpoint,
                         true);
    }

    /**
     * Merges a non-empty list of blocks into one block at
     * <code>addr</code>.
     */
    public static Block mergeMany(long addr, List<Block> blocks) {
        if (blocks.isEmpty()) {
            throw new IllegalArgumentException("nothing to merge");
        }
        Block merged = blocks.get(0);
        for (Block b : blocks.subList(1, blocks.size())) {
            merged = merge(merged, b);
        }
        return new Block(addr, merged.idx, merged.statements, merged.entrypoint, merged.exitpoint, true);
    }

    /**
     * @return <code>true</code> if the block starts at <code>a</code> or
     *         holds a {@link Statement} at <code>a</code>
     */
    public boolean containsAddr(long a) {
        if (a == addr) {
            return true;
        }
        for (Object s : statements) {
            if (s instanceof Statement && ((Statement) s).getAddr() == a) {
                return true;
            }
        }
        return false;
    }

    public int compareTo(Block other) {
        int c = Long.compare(addr, other.addr);
        return c != 0 ? c : Integer.compare(idx, other.idx);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || o.getClass() != getClass()) {
            return false;
        }
        Block other = (Block) o;
        return addr == other.addr && statements.equals(other.statements);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(new Object[] { getClass(), addr, statements });
    }

    @Override
    public String toString() {
        String name = "0x" + Long.toHexString(addr);
        return hasIdx() ? name + "." + idx : name;
    }
}

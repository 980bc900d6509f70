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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.cfgutils.data.Block;
import org.cfgutils.graph.DiGraph;

/**
 * Queries over region trees and the block graphs they were built from.
 */
public final class RegionUtils {

    private RegionUtils() {
    }

    /**
     * @return the block a region starts with, following nested heads
     */
    public static Block expandRegionHeadToBlock(Region region) {
        return region.getHeadBlock();
    }

    /**
     * @return <code>true</code> if no member of the region is itself a
     *         graph region
     */
    public static boolean isOnlyBlocks(GraphRegion region) {
        for (Region node : region.graph.nodes()) {
            if (node instanceof GraphRegion) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collects, depth first with nested regions before their parent, the
     * regions whose members are all blocks.
     */
    public static List<GraphRegion> leafRegions(GraphRegion region) {
        List<GraphRegion> result = new ArrayList<GraphRegion>();
        collectLeafRegions(region, result);
        return result;
    }

    private static void collectLeafRegions(GraphRegion region, List<GraphRegion> result) {
        boolean hasBlock = false;
        boolean onlyBlocks = true;
        for (Region node : region.graph.nodes()) {
            if (node instanceof GraphRegion) {
                collectLeafRegions((GraphRegion) node, result);
                onlyBlocks = false;
            } else {
                hasBlock = true;
            }
        }
        if (onlyBlocks && hasBlock) {
            result.add(region);
        }
    }

    /**
     * Collects, in pre-order, the regions of the tree whose head address is
     * one of <code>addrs</code>.
     */
    public static List<GraphRegion> findMatchingRegions(GraphRegion region, Collection<Long> addrs) {
        List<GraphRegion> result = new ArrayList<GraphRegion>();
        collectMatchingRegions(region, addrs, result);
        return result;
    }

    private static void collectMatchingRegions(GraphRegion region, Collection<Long> addrs,
                                               List<GraphRegion> result) {
        if (addrs.contains(region.getAddr())) {
            result.add(region);
        }
        for (Region node : region.graph.nodes()) {
            if (node instanceof GraphRegion) {
                collectMatchingRegions((GraphRegion) node, addrs, result);
            }
        }
    }

    /**
     * Collects the regions that directly hold a nested region starting at
     * <code>childAddr</code>.
     */
    public static List<GraphRegion> findParentRegions(GraphRegion region, long childAddr) {
        List<GraphRegion> result = new ArrayList<GraphRegion>();
        collectParentRegions(region, childAddr, result);
        return result;
    }

    private static void collectParentRegions(GraphRegion region, long childAddr, List<GraphRegion> result) {
        for (Region node : region.graph.nodes()) {
            if (node instanceof GraphRegion) {
                if (node.getAddr() == childAddr) {
                    result.add(region);
                }
                collectParentRegions((GraphRegion) node, childAddr, result);
            }
        }
    }

    /**
     * Maps addresses to the blocks holding them. An address held by no
     * block maps to the block with the closest address at or below it, or
     * to the lowest block if there is none.
     *
     * @return the start addresses of the blocks found
     */
    public static Set<Long> findContainingBlockAddrs(DiGraph<Block> graph, Collection<Long> addrs) {
        Set<Long> result = new LinkedHashSet<Long>();
        List<Block> blocks = graph.nodes();
        if (blocks.isEmpty()) {
            return result;
        }
        Block lowest = blocks.get(0);
        for (Block b : blocks) {
            if (b.getAddr() < lowest.getAddr()) {
                lowest = b;
            }
        }

        for (Long a : addrs) {
            boolean contained = false;
            for (Block b : blocks) {
                if (b.containsAddr(a)) {
                    result.add(b.getAddr());
                    contained = true;
                }
            }
            if (contained) {
                continue;
            }
            Block closest = lowest;
            for (Block b : blocks) {
                if (a >= b.getAddr() && b.getAddr() >= closest.getAddr()) {
                    closest = b;
                }
            }
            result.add(closest.getAddr());
        }
        return result;
    }

    /**
     * @return <code>true</code> if the region starts with a non-empty block
     *         flagged as function entry
     */
    public static boolean nodeIsFunctionStart(Region node) {
        if (node == null) {
            return false;
        }
        Block b = node.getHeadBlock();
        return !b.getStatements().isEmpty() && b.isEntrypoint();
    }

    /**
     * @return <code>true</code> if the region starts with a non-empty block
     *         flagged as function exit
     */
    public static boolean nodeIsFunctionEnd(Region node) {
        if (node == null) {
            return false;
        }
        Block b = node.getHeadBlock();
        return !b.getStatements().isEmpty() && b.isExitpoint();
    }

    /**
     * @return all blocks of the region tree, in member order
     */
    public static List<Block> collectBlocks(Region region) {
        List<Block> result = new ArrayList<Block>();
        collectBlocks(region, result);
        return result;
    }

    private static void collectBlocks(Region region, List<Block> result) {
        if (region instanceof LeafRegion) {
            result.add(((LeafRegion) region).block);
            return;
        }
        for (Region node : ((GraphRegion) region).graph.nodes()) {
            collectBlocks(node, result);
        }
    }

    /**
     * @return the addresses of all blocks of the region tree, sorted
     */
    public static List<Long> collectBlockAddrs(Region region) {
        List<Long> result = new ArrayList<Long>();
        for (Block b : collectBlocks(region)) {
            result.add(b.getAddr());
        }
        Collections.sort(result);
        return result;
    }
}

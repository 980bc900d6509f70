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
package org.cfgutils.asm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.cfgutils.data.Block;
import org.cfgutils.data.Statement;
import org.cfgutils.graph.DiGraph;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.MultiANewArrayInsnNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicInterpreter;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.util.Printer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the block graph of a method from its bytecode.
 * <p>
 * Block addresses are the indexes, in the method's instruction list, of
 * the first instruction of each block. Statements are the real
 * instructions of a block, named after their opcode; labels, line numbers
 * and frames only take up an index. Unreachable instructions are left
 * out.
 */
public final class BytecodeGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(BytecodeGraphBuilder.class);

    /**
     * Records the control flow edges found while analyzing a method.
     */
    static final class EdgeCollector extends Analyzer<BasicValue> {

        /**
         * Normal successors of each instruction.
         */
        final List<Set<Integer>> successors;

        /**
         * Handler successors of each instruction.
         */
        final List<Set<Integer>> handlers;

        EdgeCollector(int size) {
            super(new BasicInterpreter());
            successors = new ArrayList<Set<Integer>>(size);
            handlers = new ArrayList<Set<Integer>>(size);
            for (int i = 0; i < size; ++i) {
                successors.add(new LinkedHashSet<Integer>());
                handlers.add(new LinkedHashSet<Integer>());
            }
        }

        @Override
        protected void newControlFlowEdge(int insnIndex, int successorIndex) {
            successors.get(insnIndex).add(successorIndex);
        }

        @Override
        protected boolean newControlFlowExceptionEdge(int insnIndex, int successorIndex) {
            handlers.get(insnIndex).add(successorIndex);
            return true;
        }
    }

    private BytecodeGraphBuilder() {
    }

    /**
     * @param owner internal name of the class declaring the method
     * @return the block graph; empty for a method without code
     * @throws AnalyzerException if the bytecode of the method is invalid
     */
    public static DiGraph<Block> build(String owner, MethodNode method) throws AnalyzerException {
        DiGraph<Block> graph = new DiGraph<Block>();
        InsnList insns = method.instructions;
        int n = insns.size();
        if (n == 0) {
            return graph;
        }

        EdgeCollector collector = new EdgeCollector(n);
        Frame<BasicValue>[] frames = collector.analyze(owner, method);

        boolean[] leader = new boolean[n + 1];
        leader[0] = true;
        for (int i = 0; i < n; ++i) {
            if (frames[i] == null) {
                continue;
            }
            if (i > 0 && frames[i - 1] == null) {
                leader[i] = true;
            }
            Set<Integer> succ = collector.successors.get(i);
            if (succ.size() != 1 || !succ.contains(i + 1)) {
                // jump, switch, return or throw
                for (Integer s : succ) {
                    leader[s] = true;
                }
                leader[i + 1] = true;
            }
        }
        for (TryCatchBlockNode tcb : method.tryCatchBlocks) {
            leader[insns.indexOf(tcb.handler)] = true;
        }

        int[] blockOf = new int[n];
        Arrays.fill(blockOf, -1);
        LinkedHashMap<Integer, List<Statement>> statements = new LinkedHashMap<Integer, List<Statement>>();
        int current = -1;
        for (int i = 0; i < n; ++i) {
            if (frames[i] == null) {
                current = -1;
                continue;
            }
            if (leader[i] || current == -1) {
                current = i;
                statements.put(i, new ArrayList<Statement>());
            }
            blockOf[i] = current;
            AbstractInsnNode insn = insns.get(i);
            if (insn.getOpcode() >= 0) {
                statements.get(current).add(toStatement(insns, i, insn));
            }
        }

        LinkedHashMap<Integer, Block> blocks = new LinkedHashMap<Integer, Block>();
        for (Integer start : statements.keySet()) {
            Block b = new Block(start, statements.get(start));
            blocks.put(start, b);
            graph.addNode(b);
        }
        for (int i = 0; i < n; ++i) {
            if (blockOf[i] == -1) {
                continue;
            }
            Block src = blocks.get(blockOf[i]);
            for (Integer s : collector.successors.get(i)) {
                // other edges fall through inside a block
                if (leader[s]) {
                    graph.addEdge(src, blocks.get(blockOf[s]));
                }
            }
            for (Integer h : collector.handlers.get(i)) {
                graph.addEdge(src, blocks.get(blockOf[h]));
            }
        }

        for (Block b : graph.nodes()) {
            if (graph.outDegree(b) == 0) {
                b.setExitpoint(true);
            }
        }
        blocks.get(0).setEntrypoint(true);

        logger.debug("Built {} blocks for {}.{}{}", graph.numberOfNodes(), owner, method.name, method.desc);
        return graph;
    }

    static Statement toStatement(InsnList insns, int index, AbstractInsnNode insn) {
        String op = Printer.OPCODES[insn.getOpcode()];
        List<Object> operands = new ArrayList<Object>();
        switch (insn.getType()) {
        case AbstractInsnNode.INT_INSN:
            operands.add(((IntInsnNode) insn).operand);
            break;
        case AbstractInsnNode.VAR_INSN:
            operands.add(((VarInsnNode) insn).var);
            break;
        case AbstractInsnNode.TYPE_INSN:
            operands.add(((TypeInsnNode) insn).desc);
            break;
        case AbstractInsnNode.FIELD_INSN: {
            FieldInsnNode f = (FieldInsnNode) insn;
            operands.add(f.owner);
            operands.add(f.name);
            operands.add(f.desc);
            break;
        }
        case AbstractInsnNode.METHOD_INSN: {
            MethodInsnNode m = (MethodInsnNode) insn;
            operands.add(m.owner);
            operands.add(m.name);
            operands.add(m.desc);
            break;
        }
        case AbstractInsnNode.JUMP_INSN:
            operands.add(insns.indexOf(((JumpInsnNode) insn).label));
            break;
        case AbstractInsnNode.LDC_INSN:
            operands.add(String.valueOf(((LdcInsnNode) insn).cst));
            break;
        case AbstractInsnNode.IINC_INSN: {
            IincInsnNode iinc = (IincInsnNode) insn;
            operands.add(iinc.var);
            operands.add(iinc.incr);
            break;
        }
        case AbstractInsnNode.TABLESWITCH_INSN: {
            TableSwitchInsnNode ts = (TableSwitchInsnNode) insn;
            operands.add(insns.indexOf(ts.dflt));
            for (LabelNode l : ts.labels) {
                operands.add(insns.indexOf(l));
            }
            break;
        }
        case AbstractInsnNode.LOOKUPSWITCH_INSN: {
            LookupSwitchInsnNode ls = (LookupSwitchInsnNode) insn;
            operands.add(insns.indexOf(ls.dflt));
            for (LabelNode l : ls.labels) {
                operands.add(insns.indexOf(l));
            }
            break;
        }
        case AbstractInsnNode.MULTIANEWARRAY_INSN: {
            MultiANewArrayInsnNode m = (MultiANewArrayInsnNode) insn;
            operands.add(m.desc);
            operands.add(m.dims);
            break;
        }
        default:
            break;
        }
        return new Statement(index, op, operands);
    }
}

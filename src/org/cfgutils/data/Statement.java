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
import java.util.Collections;
import java.util.List;

/**
 * Generic statement: an operation name applied to operands.
 *
 * The address is informational only; two statements are equal when their
 * operation and operands are, wherever they occur.
 */
public final class Statement {

    final long addr;

    final String op;

    final List<Object> operands;

    public Statement(long addr, String op, List<?> operands) {
        this.addr = addr;
        this.op = op;
        this.operands = operands == null
            ? Collections.<Object>emptyList()
            : Collections.unmodifiableList(new ArrayList<Object>(operands));
    }

    public Statement(long addr, String op) {
        this(addr, op, null);
    }

    public long getAddr() {
        return addr;
    }

    public String getOp() {
        return op;
    }

    public List<Object> getOperands() {
        return operands;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Statement)) {
            return false;
        }
        Statement other = (Statement) o;
        return op.equals(other.op) && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return 31 * op.hashCode() + operands.hashCode();
    }

    @Override
    public String toString() {
        return "<Statement 0x" + Long.toHexString(addr) + ": " + op + operands + ">";
    }
}

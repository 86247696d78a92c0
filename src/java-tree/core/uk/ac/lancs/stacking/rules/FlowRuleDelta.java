/*
 * Copyright 2019, Regents of the University of Lancaster
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are
 * met:
 * 
 *  * Redistributions of source code must retain the above copyright
 *    notice, this list of conditions and the following disclaimer.
 * 
 *  * Redistributions in binary form must reproduce the above copyright
 *    notice, this list of conditions and the following disclaimer in the
 *    documentation and/or other materials provided with the
 *    distribution.
 * 
 *  * Neither the name of the University of Lancaster nor the names of
 *    its contributors may be used to endorse or promote products derived
 *    from this software without specific prior written permission.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
 * "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
 * LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
 * A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
 * OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
 * SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
 * LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
 * DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
 * THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
 * OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 *
 *
 * Author: Steven Simpson <s.simpson@lancaster.ac.uk>
 */

package uk.ac.lancs.stacking.rules;

/**
 * Instructs a datapath to change one rule.
 * 
 * @author simpsons
 */
public final class FlowRuleDelta {
    /**
     * Says how a rule is to change.
     */
    public enum Op {
        /**
         * Install a rule not previously present.
         */
        INSTALL,

        /**
         * Replace a rule's actions.
         */
        REPLACE,

        /**
         * Remove a rule.
         */
        DELETE;
    }

    private final Op op;
    private final FlowRule rule;

    FlowRuleDelta(Op op, FlowRule rule) {
        this.op = op;
        this.rule = rule;
    }

    /**
     * Get the change to be made.
     * 
     * @return the operation
     */
    public Op op() {
        return op;
    }

    /**
     * Get the rule affected. For deletions, this is the rule as it was
     * installed.
     * 
     * @return the rule
     */
    public FlowRule rule() {
        return rule;
    }

    @Override
    public int hashCode() {
        return op.hashCode() * 31 + rule.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowRuleDelta)) return false;
        FlowRuleDelta other = (FlowRuleDelta) obj;
        return op == other.op && rule.equals(other.rule);
    }

    @Override
    public String toString() {
        return op + " " + rule;
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import uk.ac.lancs.stacking.flood.FloodAction;

/**
 * Describes a forwarding rule of one datapath, independent of how the
 * datapath encodes it. Rules of a datapath are identified by key. A
 * rule with no actions drops what it matches.
 * 
 * @author simpsons
 */
public final class FlowRule {
    private final String datapath;
    private final String key;
    private final List<FloodAction> actions;

    /**
     * Describe a rule.
     * 
     * @param datapath the datapath the rule belongs to
     * 
     * @param key the rule's identity within the datapath
     * 
     * @param actions the rule's actions in order
     */
    public FlowRule(String datapath, String key,
                    List<? extends FloodAction> actions) {
        if (datapath == null) throw new NullPointerException("datapath");
        if (key == null) throw new NullPointerException("key");
        this.datapath = datapath;
        this.key = key;
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    }

    /**
     * Get the datapath the rule belongs to.
     * 
     * @return the datapath name
     */
    public String datapath() {
        return datapath;
    }

    /**
     * Get the rule's identity.
     * 
     * @return the rule key
     */
    public String key() {
        return key;
    }

    /**
     * Get the rule's actions.
     * 
     * @return the actions in order
     */
    public List<FloodAction> actions() {
        return actions;
    }

    @Override
    public int hashCode() {
        return (datapath.hashCode() * 31 + key.hashCode()) * 31
            + actions.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowRule)) return false;
        FlowRule other = (FlowRule) obj;
        return datapath.equals(other.datapath) && key.equals(other.key)
            && actions.equals(other.actions);
    }

    @Override
    public String toString() {
        return datapath + "/" + key + actions;
    }
}

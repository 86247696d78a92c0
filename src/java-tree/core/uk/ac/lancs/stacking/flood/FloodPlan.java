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

package uk.ac.lancs.stacking.flood;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Lists the actions applied to a flooded frame arriving on a port. A
 * plan with no actions drops the frame.
 * 
 * @author simpsons
 */
public final class FloodPlan {
    private final int inPort;
    private final boolean pruned;
    private final List<FloodAction> actions;

    FloodPlan(int inPort, boolean pruned, List<FloodAction> actions) {
        this.inPort = inPort;
        this.pruned = pruned;
        this.actions = Collections.unmodifiableList(new ArrayList<>(actions));
    }

    static FloodPlan drop(int inPort) {
        return new FloodPlan(inPort, true,
                             Collections.<FloodAction>emptyList());
    }

    /**
     * Get the port the frame arrived on.
     * 
     * @return the ingress port number, or 0 for frames from the
     * controller
     */
    public int inPort() {
        return inPort;
    }

    /**
     * Determine whether the frame is dropped because its ingress port
     * is redundant.
     * 
     * @return {@code true} if the ingress port is pruned
     */
    public boolean isPruned() {
        return pruned;
    }

    /**
     * Get the actions in order.
     * 
     * @return an unmodifiable list of actions
     */
    public List<FloodAction> actions() {
        return actions;
    }

    /**
     * Get the set of ports that the frame is sent out of, including
     * the ingress port if it is reflected.
     * 
     * @return a fresh set of port numbers
     */
    public SortedSet<Integer> outputs() {
        SortedSet<Integer> result = new TreeSet<>();
        for (FloodAction act : actions) {
            switch (act.kind()) {
            case OUTPUT:
                result.add(act.port());
                break;
            case OUTPUT_IN_PORT:
                result.add(inPort);
                break;
            default:
                break;
            }
        }
        return result;
    }

    /**
     * Get the external mark applied to the frame.
     * 
     * @return {@link FloodAction#SET_EXTERNAL},
     * {@link FloodAction#SET_NO_EXTERNAL}, or {@code null} if the
     * frame is not marked
     */
    public FloodAction mark() {
        FloodAction result = null;
        for (FloodAction act : actions)
            if (act.kind() == FloodAction.Kind.SET_EXTERNAL
                || act.kind() == FloodAction.Kind.SET_NO_EXTERNAL)
                result = act;
        return result;
    }

    @Override
    public int hashCode() {
        return actions.hashCode() * 31 + inPort + (pruned ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FloodPlan)) return false;
        FloodPlan other = (FloodPlan) obj;
        return inPort == other.inPort && pruned == other.pruned
            && actions.equals(other.actions);
    }

    @Override
    public String toString() {
        return "in:" + inPort + (pruned ? " pruned" : " " + actions);
    }
}

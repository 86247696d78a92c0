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

package uk.ac.lancs.stacking.roles;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import uk.ac.lancs.stacking.PortRef;

/**
 * Selects stack ports leading towards other datapaths.
 * 
 * @author simpsons
 */
public final class StackPaths {
    private final StackView view;
    private final Comparator<? super PortRef> order;

    /**
     * Create a port selector over a view of the stack.
     * 
     * @param view the current graph, root and port states
     * 
     * @param order the order deciding which of several ports is first
     */
    public StackPaths(StackView view, Comparator<? super PortRef> order) {
        if (view == null) throw new NullPointerException("view");
        if (order == null) throw new NullPointerException("order");
        this.view = view;
        this.order = order;
    }

    private List<PortRef> upPortsTo(String self, String peerDp) {
        List<PortRef> result = new ArrayList<>();
        for (PortRef p : view.upPorts(self))
            if (view.peerOf(p).datapath().equals(peerDp)) result.add(p);
        return result;
    }

    /**
     * Get the first up port on the shortest path from one datapath to
     * another.
     * 
     * @param self the datapath to leave from
     * 
     * @param dst the destination datapath
     * 
     * @return the port, or {@code null} if the datapaths are the same
     * or the destination is unreachable
     */
    public PortRef shortestPathPort(String self, String dst) {
        List<String> path = view.graph().shortestPath(self, dst);
        if (path.size() < 2) return null;
        return PortOrder.first(order, upPortsTo(self, path.get(1)));
    }
}

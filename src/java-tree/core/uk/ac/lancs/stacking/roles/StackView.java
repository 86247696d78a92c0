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

import java.util.Collection;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.graph.StackGraph;

/**
 * Presents the shared stack state that role computation reads. The
 * graph and root must not change while a view is in use.
 * 
 * @author simpsons
 */
public interface StackView {
    /**
     * Get the current stack graph.
     * 
     * @return the graph
     */
    StackGraph graph();

    /**
     * Get the elected root.
     * 
     * @return the root's name, or {@code null} if none is elected
     */
    String root();

    /**
     * Get the stack ports of a datapath that are confirmed up.
     * 
     * @param datapath the datapath name
     * 
     * @return the datapath's up stack ports
     */
    Collection<PortRef> upPorts(String datapath);

    /**
     * Get the configured peer of a stack port.
     * 
     * @param port the stack port
     * 
     * @return the peer port
     * 
     * @throws IllegalStateException if the port has no peer
     */
    PortRef peerOf(PortRef port);
}

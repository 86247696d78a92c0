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

package uk.ac.lancs.stacking.link;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackState;

/**
 * Records a change of stack state of one port, and whether the link it
 * terminates should now be in the stack graph.
 * 
 * @author simpsons
 */
public final class PortTransition {
    private final PortRef port;
    private final PortRef peer;
    private final StackState before, after;
    private final String reason;
    private final boolean linkUp;

    PortTransition(PortRef port, PortRef peer, StackState before,
                   StackState after, String reason, boolean linkUp) {
        this.port = port;
        this.peer = peer;
        this.before = before;
        this.after = after;
        this.reason = reason;
        this.linkUp = linkUp;
    }

    /**
     * Get the port that changed state.
     * 
     * @return the port
     */
    public PortRef port() {
        return port;
    }

    /**
     * Get the configured peer of the port.
     * 
     * @return the peer port
     */
    public PortRef peer() {
        return peer;
    }

    /**
     * Get the state before the change.
     * 
     * @return the former state
     */
    public StackState before() {
        return before;
    }

    /**
     * Get the state after the change.
     * 
     * @return the new state
     */
    public StackState after() {
        return after;
    }

    /**
     * Get the reason for the change.
     * 
     * @return a human-readable reason
     */
    public String reason() {
        return reason;
    }

    /**
     * Determine whether the link should be in the stack graph. It is
     * if this port is up, or if it is initializing while its peer is
     * up.
     * 
     * @return {@code true} if the link should be present
     */
    public boolean linkUp() {
        return linkUp;
    }

    @Override
    public String toString() {
        return port + ": " + before + "->" + after + " (" + reason + ")";
    }
}

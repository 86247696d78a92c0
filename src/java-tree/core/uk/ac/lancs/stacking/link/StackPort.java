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
import uk.ac.lancs.stacking.config.StackPortConfig;

/**
 * Tracks the run-time condition of a stack port. Only
 * {@link LinkStateMonitor} changes it.
 * 
 * @author simpsons
 */
public final class StackPort {
    private final StackPortConfig config;
    private StackState state = StackState.NONE;
    private boolean physicallyUp = true;
    private long stateSince;
    private Long lastProbeSent;
    private Keepalive lastKeepalive;
    private boolean correct;

    StackPort(StackPortConfig config) {
        this.config = config;
    }

    /**
     * Get the port.
     * 
     * @return the local port reference
     */
    public PortRef local() {
        return config.local();
    }

    /**
     * Get the port this port should be cabled to.
     * 
     * @return the configured peer
     */
    public PortRef peer() {
        return config.peer();
    }

    /**
     * Get the current stack state.
     * 
     * @return the state
     */
    public StackState state() {
        return state;
    }

    /**
     * Determine whether the port is confirmed.
     * 
     * @return {@code true} if the state is {@link StackState#UP}
     */
    public boolean isUp() {
        return state == StackState.UP;
    }

    /**
     * Determine whether the port is physically up.
     * 
     * @return {@code true} if the port has not been reported down
     */
    public boolean isPhysicallyUp() {
        return physicallyUp;
    }

    /**
     * Get the time of the last state change.
     * 
     * @return the time in milliseconds
     */
    public long stateSince() {
        return stateSince;
    }

    /**
     * Get the time the last probe was sent.
     * 
     * @return the time in milliseconds, or {@code null} if none has
     * been sent
     */
    public Long lastProbeSent() {
        return lastProbeSent;
    }

    /**
     * Get the time the last probe was received.
     * 
     * @return the time in milliseconds, or {@code null} if none has
     * been received since probing began
     */
    public Long lastProbeReceived() {
        return lastKeepalive == null ? null : lastKeepalive.time();
    }

    /**
     * Get the last probe received.
     * 
     * @return the last probe, or {@code null} if none has been
     * received since probing began
     */
    public Keepalive lastKeepalive() {
        return lastKeepalive;
    }

    /**
     * Determine whether the last probe came from the configured peer.
     * 
     * @return {@code true} if the last probe matched the configured
     * peer
     */
    public boolean isCorrect() {
        return correct;
    }

    void sent(long now) {
        lastProbeSent = now;
    }

    void received(Keepalive probe, boolean correct) {
        this.lastKeepalive = probe;
        this.correct = correct;
    }

    void physical(boolean up) {
        physicallyUp = up;
    }

    void forget() {
        lastKeepalive = null;
        correct = false;
    }

    void enter(StackState state, long now) {
        this.state = state;
        this.stateSince = now;
    }

    @Override
    public String toString() {
        return local() + "(" + state + ")";
    }
}

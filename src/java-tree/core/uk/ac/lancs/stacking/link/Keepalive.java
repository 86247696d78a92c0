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
 * Reports a keepalive probe received on a stack port, with the
 * identity and state that the sending end claimed.
 * 
 * @author simpsons
 */
public final class Keepalive {
    private final PortRef receivedOn;
    private final long remoteId;
    private final String remoteName;
    private final int remotePort;
    private final StackState remoteState;
    private final long time;

    /**
     * Describe a received probe.
     * 
     * @param receivedOn the port that received the probe
     * 
     * @param remoteId the numeric id of the sending datapath
     * 
     * @param remoteName the name of the sending datapath
     * 
     * @param remotePort the port number that sent the probe
     * 
     * @param remoteState the sending port's stack state
     * 
     * @param time the time of reception, in milliseconds
     */
    public Keepalive(PortRef receivedOn, long remoteId, String remoteName,
                     int remotePort, StackState remoteState, long time) {
        if (receivedOn == null) throw new NullPointerException("receivedOn");
        if (remoteName == null) throw new NullPointerException("remoteName");
        if (remoteState == null)
            throw new NullPointerException("remoteState");
        this.receivedOn = receivedOn;
        this.remoteId = remoteId;
        this.remoteName = remoteName;
        this.remotePort = remotePort;
        this.remoteState = remoteState;
        this.time = time;
    }

    /**
     * Get the port that received the probe.
     * 
     * @return the receiving port
     */
    public PortRef receivedOn() {
        return receivedOn;
    }

    /**
     * Get the numeric id claimed by the sender.
     * 
     * @return the sender's datapath id
     */
    public long remoteId() {
        return remoteId;
    }

    /**
     * Get the datapath name claimed by the sender.
     * 
     * @return the sender's datapath name
     */
    public String remoteName() {
        return remoteName;
    }

    /**
     * Get the port number claimed by the sender.
     * 
     * @return the sender's port
     */
    public int remotePort() {
        return remotePort;
    }

    /**
     * Get the sending port's stack state.
     * 
     * @return the remote state
     */
    public StackState remoteState() {
        return remoteState;
    }

    /**
     * Get the time of reception.
     * 
     * @return the reception time in milliseconds
     */
    public long time() {
        return time;
    }

    /**
     * Describe the sender's identity.
     * 
     * @return <samp><var>id</var>:<var>name</var>:<var>port</var></samp>
     */
    public String remoteIdentity() {
        return "0x" + Long.toHexString(remoteId) + ":" + remoteName + ":"
            + remotePort;
    }

    @Override
    public String toString() {
        return receivedOn + "<-" + remoteIdentity() + "(" + remoteState
            + ")@" + time;
    }
}

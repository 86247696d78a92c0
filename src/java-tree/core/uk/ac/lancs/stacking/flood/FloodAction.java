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

/**
 * Is one step in flooding a frame from a datapath.
 * 
 * @author simpsons
 */
public final class FloodAction {
    /**
     * Identifies the kind of flood action.
     */
    public enum Kind {
        /**
         * Send the frame out of a numbered port.
         */
        OUTPUT,

        /**
         * Send the frame back out of the port it arrived on.
         */
        OUTPUT_IN_PORT,

        /**
         * Mark the frame as still to be flooded to external ports.
         */
        SET_EXTERNAL,

        /**
         * Mark the frame as already flooded to external ports.
         */
        SET_NO_EXTERNAL;
    }

    private final Kind kind;
    private final int port;

    private FloodAction(Kind kind, int port) {
        this.kind = kind;
        this.port = port;
    }

    /**
     * Reflect the frame out of its ingress port.
     */
    public static final FloodAction OUTPUT_IN_PORT =
        new FloodAction(Kind.OUTPUT_IN_PORT, 0);

    /**
     * Request external flooding downstream.
     */
    public static final FloodAction SET_EXTERNAL =
        new FloodAction(Kind.SET_EXTERNAL, 0);

    /**
     * Mark external flooding as done.
     */
    public static final FloodAction SET_NO_EXTERNAL =
        new FloodAction(Kind.SET_NO_EXTERNAL, 0);

    /**
     * Send the frame out of a port.
     * 
     * @param port the port number
     * 
     * @return the requested action
     * 
     * @constructor
     */
    public static FloodAction output(int port) {
        if (port <= 0)
            throw new IllegalArgumentException("bad port number " + port);
        return new FloodAction(Kind.OUTPUT, port);
    }

    /**
     * Get the kind of action.
     * 
     * @return the action's kind
     */
    public Kind kind() {
        return kind;
    }

    /**
     * Get the output port.
     * 
     * @return the port number, or 0 if the action is not
     * {@link Kind#OUTPUT}
     */
    public int port() {
        return port;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + port;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FloodAction)) return false;
        FloodAction other = (FloodAction) obj;
        return kind == other.kind && port == other.port;
    }

    @Override
    public String toString() {
        if (kind == Kind.OUTPUT) return "output:" + port;
        return kind.toString().toLowerCase().replace('_', '-');
    }
}

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

package uk.ac.lancs.stacking.config;

import uk.ac.lancs.stacking.PortRef;

/**
 * Declares a tunnel from a datapath to a port on another datapath.
 * 
 * @author simpsons
 */
public final class TunnelConfig {
    private final String id;
    private final String source;
    private final PortRef destination;

    /**
     * Declare a tunnel.
     * 
     * @param id the tunnel identifier
     * 
     * @param source the name of the datapath where traffic enters
     * 
     * @param destination the port where traffic leaves
     */
    public TunnelConfig(String id, String source, PortRef destination) {
        if (id == null) throw new NullPointerException("id");
        if (source == null) throw new NullPointerException("source");
        if (destination == null)
            throw new NullPointerException("destination");
        this.id = id;
        this.source = source;
        this.destination = destination;
    }

    /**
     * Get the tunnel identifier.
     * 
     * @return the identifier
     */
    public String id() {
        return id;
    }

    /**
     * Get the datapath where traffic enters.
     * 
     * @return the source datapath name
     */
    public String source() {
        return source;
    }

    /**
     * Get the port where traffic leaves.
     * 
     * @return the destination port
     */
    public PortRef destination() {
        return destination;
    }

    @Override
    public String toString() {
        return id + "(" + source + "->" + destination + ")";
    }
}

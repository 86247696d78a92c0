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
 * Identifies a flood rule of a datapath by ingress port and the state
 * of the external mark it matches.
 * 
 * @author simpsons
 */
public final class FloodRuleKey implements Comparable<FloodRuleKey> {
    private final int inPort;
    private final boolean externalDone;

    /**
     * Identify a flood rule.
     * 
     * @param inPort the ingress port, or 0 for the controller
     * 
     * @param externalDone the external mark matched
     */
    public FloodRuleKey(int inPort, boolean externalDone) {
        this.inPort = inPort;
        this.externalDone = externalDone;
    }

    /**
     * Get the ingress port.
     * 
     * @return the ingress port number
     */
    public int inPort() {
        return inPort;
    }

    /**
     * Get the external mark matched.
     * 
     * @return {@code true} if frames already flooded externally are
     * matched
     */
    public boolean externalDone() {
        return externalDone;
    }

    @Override
    public int compareTo(FloodRuleKey other) {
        int rc = Integer.compare(inPort, other.inPort);
        if (rc != 0) return rc;
        return Boolean.compare(externalDone, other.externalDone);
    }

    @Override
    public int hashCode() {
        return inPort * 2 + (externalDone ? 1 : 0);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FloodRuleKey)) return false;
        FloodRuleKey other = (FloodRuleKey) obj;
        return inPort == other.inPort && externalDone == other.externalDone;
    }

    @Override
    public String toString() {
        return "flood:" + inPort + (externalDone ? ":noext" : ":ext");
    }
}

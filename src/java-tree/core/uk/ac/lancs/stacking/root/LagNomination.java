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

package uk.ac.lancs.stacking.root;

import java.util.Collection;

/**
 * Nominates the datapath that carries an aggregated link spread over
 * several stacked datapaths. The datapath with the most up member
 * ports wins. A tie is won by the root if it is tied, and otherwise by
 * the lowest datapath id.
 * 
 * @author simpsons
 */
public final class LagNomination {
    /**
     * The nominee had more up member ports than any other.
     */
    public static final String MOST_PORTS = "most LAG ports";

    /**
     * The nominee is the root, and tied on up member ports.
     */
    public static final String ROOT = "root dp";

    /**
     * The nominee has the lowest id of those tied on up member ports.
     */
    public static final String LOWEST_ID = "lowest dpid";

    private final String datapath;
    private final long id;
    private final String reason;

    private LagNomination(RootCandidate dp, String reason) {
        this.datapath = dp.name();
        this.id = dp.id();
        this.reason = reason;
    }

    /**
     * Nominate a datapath for an aggregated link.
     * 
     * @param lag the aggregated-link id
     * 
     * @param datapaths the live state of all stacked datapaths
     * 
     * @param root the current root, or {@code null} if none
     * 
     * @return the nomination, or {@code null} if no datapath has an up
     * member of the aggregated link
     * 
     * @constructor
     */
    public static LagNomination nominate(int lag,
                                         Collection<? extends RootCandidate> datapaths,
                                         String root) {
        int most = 0;
        for (RootCandidate dp : datapaths) {
            Integer up = dp.lagsUp().get(lag);
            if (up != null) most = Math.max(most, up);
        }
        if (most == 0) return null;

        RootCandidate lowest = null;
        int tied = 0;
        for (RootCandidate dp : datapaths) {
            Integer up = dp.lagsUp().get(lag);
            if (up == null || up != most) continue;
            tied++;
            if (lowest == null || dp.id() < lowest.id()) lowest = dp;
        }
        if (tied == 1) return new LagNomination(lowest, MOST_PORTS);
        for (RootCandidate dp : datapaths) {
            Integer up = dp.lagsUp().get(lag);
            if (up != null && up == most && dp.name().equals(root))
                return new LagNomination(dp, ROOT);
        }
        return new LagNomination(lowest, LOWEST_ID);
    }

    /**
     * Get the nominated datapath.
     * 
     * @return the datapath name
     */
    public String datapath() {
        return datapath;
    }

    /**
     * Get the nominated datapath's id.
     * 
     * @return the datapath id
     */
    public long id() {
        return id;
    }

    /**
     * Get the reason for the nomination.
     * 
     * @return {@link #MOST_PORTS}, {@link #ROOT} or {@link #LOWEST_ID}
     */
    public String reason() {
        return reason;
    }

    @Override
    public String toString() {
        return datapath + " (" + reason + ")";
    }
}

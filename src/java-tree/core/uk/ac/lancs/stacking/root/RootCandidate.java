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

import java.util.Map;

/**
 * Exposes the live state of a datapath that root election needs.
 * 
 * @author simpsons
 */
public interface RootCandidate {
    /**
     * Get the datapath's name.
     * 
     * @return the datapath name
     */
    String name();

    /**
     * Get the datapath's numeric id.
     * 
     * @return the datapath id
     */
    long id();

    /**
     * Get the last time the controller heard from the datapath.
     * 
     * @return the time in milliseconds, or {@code null} if never
     */
    Long lastLive();

    /**
     * Get the number of health intervals the datapath may be silent
     * for before it is considered down.
     * 
     * @return the down-time multiple
     */
    int downTimeMultiple();

    /**
     * Get the number of up member ports of each of the datapath's
     * aggregated links.
     * 
     * @return the number of up ports keyed by aggregated-link id,
     * including aggregates with none up
     */
    Map<Integer, Integer> lagsUp();

    /**
     * Determine whether any of the datapath's stack ports is up.
     * 
     * @return {@code true} if a stack port is up
     */
    boolean anyStackPortUp();

    /**
     * Get the root that the datapath's current roles were computed
     * with.
     * 
     * @return the cached root, or {@code null} if none
     */
    String cachedRoot();
}

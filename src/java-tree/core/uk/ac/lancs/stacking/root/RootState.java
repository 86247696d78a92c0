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

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Records the outcome of one root election.
 * 
 * @author simpsons
 */
public final class RootState {
    private final String previous;
    private final String root;
    private final List<String> candidates;
    private final List<String> healthy;
    private final List<String> unhealthy;
    private final List<String> inconsistent;

    RootState(String previous, String root, List<String> candidates,
              List<String> healthy, List<String> unhealthy,
              List<String> inconsistent) {
        this.previous = previous;
        this.root = root;
        this.candidates = Collections.unmodifiableList(candidates);
        this.healthy = Collections.unmodifiableList(healthy);
        this.unhealthy = Collections.unmodifiableList(unhealthy);
        this.inconsistent = Collections.unmodifiableList(inconsistent);
    }

    /**
     * Get the root before the election.
     * 
     * @return the previous root, or {@code null} if there was none
     */
    public String previous() {
        return previous;
    }

    /**
     * Get the elected root.
     * 
     * @return the root, or {@code null} if there are no candidates
     */
    public String root() {
        return root;
    }

    /**
     * Get all root candidates in order of preference.
     * 
     * @return the candidates
     */
    public List<String> candidates() {
        return candidates;
    }

    /**
     * Get the healthy candidates in order of preference.
     * 
     * @return the healthy candidates
     */
    public List<String> healthy() {
        return healthy;
    }

    /**
     * Get the unhealthy candidates in order of preference.
     * 
     * @return the unhealthy candidates
     */
    public List<String> unhealthy() {
        return unhealthy;
    }

    /**
     * Get the datapaths whose cached root disagrees with the elected
     * one.
     * 
     * @return the inconsistent datapaths
     */
    public List<String> inconsistent() {
        return inconsistent;
    }

    /**
     * Determine whether the root differs from before, including a
     * first assignment.
     * 
     * @return {@code true} if the root is new
     */
    public boolean rootChanged() {
        return !Objects.equals(previous, root);
    }

    /**
     * Determine whether the stack must be reconfigured. This is so if
     * a previous root was replaced, or if any datapath has a stale
     * root.
     * 
     * @return {@code true} if every datapath must be recomputed
     */
    public boolean stackChange() {
        if (rootChanged()) return previous != null;
        return !inconsistent.isEmpty();
    }

    @Override
    public String toString() {
        return "root " + root + " (previous " + previous + ") healthy "
            + healthy + " unhealthy " + unhealthy;
    }
}

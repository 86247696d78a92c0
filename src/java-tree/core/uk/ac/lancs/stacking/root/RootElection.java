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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;

/**
 * Chooses the stack root from configured candidates according to
 * their health.
 * 
 * <p>
 * A candidate is healthy if it has been heard from within its
 * down-time multiple of the health interval, if it is not the case
 * that it has aggregated links and all of them are fully down, and if
 * at least one of its stack ports is up. A healthy current root is
 * kept. Otherwise, the first healthy candidate is chosen, or the first
 * candidate if none is healthy, so there is always a root while there
 * are candidates.
 * 
 * @author simpsons
 */
public final class RootElection {
    private interface PrettyLogger extends FormattedLogger {
        @Format("stack root changed from %s to %s")
        @Detail(ShadowLevel.INFO)
        void changed(String from, String to);

        @Format("stack root on %s inconsistent")
        @Detail(ShadowLevel.INFO)
        void inconsistent(List<String> datapaths);

        @Format("no healthy root candidate; using %s")
        @Detail(ShadowLevel.WARNING)
        void noneHealthy(String root);

        @Format("candidate %s healthy=%b")
        @Detail(ShadowLevel.FINE)
        void health(String name, boolean healthy);
    }

    private static final PrettyLogger logger =
        FormattedLogger.get(RootElection.class.getName(), PrettyLogger.class);

    private final List<String> candidates;
    private final long healthInterval;
    private String root;

    /**
     * Prepare to elect a root.
     * 
     * @param candidates the candidate datapath names in order of
     * preference
     * 
     * @param healthInterval the health-check interval in milliseconds
     */
    public RootElection(List<String> candidates, long healthInterval) {
        if (healthInterval <= 0)
            throw new IllegalArgumentException("bad health interval "
                + healthInterval);
        this.candidates =
            Collections.unmodifiableList(new ArrayList<>(candidates));
        this.healthInterval = healthInterval;
    }

    /**
     * Get the current root.
     * 
     * @return the root, or {@code null} if no election has chosen one
     */
    public String root() {
        return root;
    }

    /**
     * Get the candidates.
     * 
     * @return the candidate datapath names in order of preference
     */
    public List<String> candidates() {
        return candidates;
    }

    /**
     * Determine whether a candidate is healthy.
     * 
     * @param dp the candidate's live state
     * 
     * @param now the current time in milliseconds
     * 
     * @return {@code true} if the candidate is fit to be root
     */
    public boolean isHealthy(RootCandidate dp, long now) {
        Long last = dp.lastLive();
        if (last == null) return false;
        if (now - last > dp.downTimeMultiple() * healthInterval)
            return false;
        Map<Integer, Integer> lags = dp.lagsUp();
        if (!lags.isEmpty()) {
            boolean anyUp = false;
            for (int up : lags.values())
                if (up > 0) anyUp = true;
            if (!anyUp) return false;
        }
        return dp.anyStackPortUp();
    }

    /**
     * Elect a root, and retain it as current.
     * 
     * @param datapaths the live state of every datapath, keyed by
     * name; candidates missing from it are unhealthy
     * 
     * @param now the current time in milliseconds
     * 
     * @return the election's outcome
     */
    public RootState elect(Map<String, ? extends RootCandidate> datapaths,
                           long now) {
        final String previous = root;
        List<String> healthy = new ArrayList<>();
        List<String> unhealthy = new ArrayList<>();
        for (String name : candidates) {
            RootCandidate dp = datapaths.get(name);
            boolean ok = dp != null && isHealthy(dp, now);
            logger.health(name, ok);
            (ok ? healthy : unhealthy).add(name);
        }

        String chosen;
        if (candidates.isEmpty()) {
            chosen = null;
        } else if (previous != null && healthy.contains(previous)) {
            chosen = previous;
        } else if (!healthy.isEmpty()) {
            chosen = healthy.get(0);
        } else {
            chosen = candidates.get(0);
            logger.noneHealthy(chosen);
        }

        List<String> inconsistent = new ArrayList<>();
        for (RootCandidate dp : datapaths.values()) {
            String cached = dp.cachedRoot();
            if (chosen != null && !chosen.equals(cached))
                inconsistent.add(dp.name());
        }
        Collections.sort(inconsistent);

        root = chosen;
        RootState result = new RootState(previous, chosen, candidates,
                                         healthy, unhealthy, inconsistent);
        if (result.rootChanged())
            logger.changed(previous, chosen);
        else if (!inconsistent.isEmpty())
            logger.inconsistent(inconsistent);
        return result;
    }
}

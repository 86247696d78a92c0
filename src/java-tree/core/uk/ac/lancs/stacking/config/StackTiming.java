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

/**
 * Holds the periods that govern liveness detection. All periods are in
 * milliseconds.
 * 
 * @author simpsons
 */
public final class StackTiming {
    private final long probeInterval;
    private final int lostProbes;
    private final long healthInterval;

    /**
     * Default interval between keepalive probes, in seconds
     */
    public static final int DEFAULT_PROBE_INTERVAL = 5;

    /**
     * Default number of probe intervals without a valid probe before a
     * port is deemed gone
     */
    public static final int DEFAULT_LOST_PROBES = 3;

    /**
     * Default interval between root health checks, in seconds
     */
    public static final int DEFAULT_HEALTH_INTERVAL = 10;

    /**
     * Create a set of periods.
     * 
     * @param probeInterval the interval between keepalive probes
     * 
     * @param lostProbes the number of intervals without a valid probe
     * before a port is deemed gone
     * 
     * @param healthInterval the interval between root health checks
     * 
     * @throws IllegalArgumentException if any value is not positive
     */
    public StackTiming(long probeInterval, int lostProbes,
                       long healthInterval) {
        if (probeInterval <= 0)
            throw new IllegalArgumentException("probe interval "
                + probeInterval);
        if (lostProbes <= 0)
            throw new IllegalArgumentException("lost probes " + lostProbes);
        if (healthInterval <= 0)
            throw new IllegalArgumentException("health interval "
                + healthInterval);
        this.probeInterval = probeInterval;
        this.lostProbes = lostProbes;
        this.healthInterval = healthInterval;
    }

    /**
     * Get the default periods.
     * 
     * @return the default periods
     */
    public static StackTiming defaults() {
        return new StackTiming(DEFAULT_PROBE_INTERVAL * 1000L,
                               DEFAULT_LOST_PROBES,
                               DEFAULT_HEALTH_INTERVAL * 1000L);
    }

    /**
     * Get the interval between keepalive probes.
     * 
     * @return the probe interval
     */
    public long probeInterval() {
        return probeInterval;
    }

    /**
     * Get the number of probe intervals tolerated without a valid
     * probe.
     * 
     * @return the lost-probe multiplier
     */
    public int lostProbes() {
        return lostProbes;
    }

    /**
     * Get the period after which a port with no valid probe is deemed
     * gone.
     * 
     * @return the probe interval multiplied by the lost-probe count
     */
    public long probeTimeout() {
        return probeInterval * lostProbes;
    }

    /**
     * Get the interval between root health checks.
     * 
     * @return the health-check interval
     */
    public long healthInterval() {
        return healthInterval;
    }
}

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

package uk.ac.lancs.stacking.metrics;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackState;

/**
 * Publishes stacking counters and gauges to a meter registry.
 * 
 * <p>
 * Counters are tagged by datapath name as <samp>dp</samp>. Gauges hold
 * the last value set, and port-state gauges are also tagged by
 * <samp>port</samp>.
 * 
 * @author simpsons
 */
public final class StackMetrics {
    /**
     * Counts probes from an unexpected peer
     */
    public static final String CABLING_ERRORS = "stack.cabling.errors";

    /**
     * Counts probes received on stack ports
     */
    public static final String PROBES_RECEIVED = "stack.probes.received";

    /**
     * Counts flow-rule deliveries that failed
     */
    public static final String RULE_FAILURES = "stack.rules.failures";

    /**
     * Holds the numeric id of the elected root
     */
    public static final String ROOT_DPID = "stack.root.dpid";

    /**
     * Holds the state code of each stack port
     */
    public static final String PORT_STATE = "stack.port.state";

    /**
     * Holds the port each datapath uses towards the root, or 0
     */
    public static final String ROOT_HOP_PORT = "stack.dp.root.hop.port";

    /**
     * Holds 1 for the root datapath, and 0 for others
     */
    public static final String IS_ROOT = "stack.dp.is.root";

    private final MeterRegistry registry;
    private final AtomicLong rootDpid = new AtomicLong();
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    /**
     * Create a set of stacking metrics.
     * 
     * @param registry the registry to publish to
     */
    public StackMetrics(MeterRegistry registry) {
        if (registry == null) throw new NullPointerException("registry");
        this.registry = registry;
        registry.gauge(ROOT_DPID, Tags.empty(), rootDpid);
    }

    /**
     * Get the registry the metrics are published to.
     * 
     * @return the meter registry
     */
    public MeterRegistry registry() {
        return registry;
    }

    private AtomicLong gauge(String name, Tags tags) {
        String key = name + tags;
        return gauges.computeIfAbsent(key, k -> registry
            .gauge(name, tags, new AtomicLong()));
    }

    /**
     * Count a probe from an unexpected peer.
     * 
     * @param datapath the datapath that received the probe
     */
    public void cablingError(String datapath) {
        registry.counter(CABLING_ERRORS, "dp", datapath).increment();
    }

    /**
     * Count a received probe.
     * 
     * @param datapath the datapath that received the probe
     */
    public void probeReceived(String datapath) {
        registry.counter(PROBES_RECEIVED, "dp", datapath).increment();
    }

    /**
     * Count a failure to deliver flow rules.
     * 
     * @param datapath the datapath the rules were for
     */
    public void ruleFailure(String datapath) {
        registry.counter(RULE_FAILURES, "dp", datapath).increment();
    }

    /**
     * Record the elected root.
     * 
     * @param dpid the root's numeric id
     */
    public void stackRoot(long dpid) {
        rootDpid.set(dpid);
    }

    /**
     * Record the state of a stack port.
     * 
     * @param port the port
     * 
     * @param state the port's new state
     */
    public void portState(PortRef port, StackState state) {
        gauge(PORT_STATE,
              Tags.of("dp", port.datapath(), "port",
                      Integer.toString(port.port())))
                  .set(state.code());
    }

    /**
     * Record the port a datapath uses towards the root.
     * 
     * @param datapath the datapath name
     * 
     * @param port the port number, or 0 if there is none
     */
    public void rootHopPort(String datapath, int port) {
        gauge(ROOT_HOP_PORT, Tags.of("dp", datapath)).set(port);
    }

    /**
     * Record whether a datapath is the root.
     * 
     * @param datapath the datapath name
     * 
     * @param root {@code true} if the datapath is root
     */
    public void isRoot(String datapath, boolean root) {
        gauge(IS_ROOT, Tags.of("dp", datapath)).set(root ? 1 : 0);
    }
}

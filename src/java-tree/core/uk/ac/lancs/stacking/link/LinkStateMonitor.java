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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.config.DatapathConfig;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.config.StackPortConfig;
import uk.ac.lancs.stacking.metrics.StackMetrics;

/**
 * Drives the stack state of every configured stack port from probes
 * sent, probes received and physical port status.
 * 
 * <p>
 * A port starts in {@link StackState#NONE}, and enters
 * {@link StackState#INIT} when the first probe is sent from it. A
 * probe from the configured peer makes it {@link StackState#UP} if the
 * peer reports itself initializing or up, and keeps it initializing
 * otherwise. A probe from anywhere else makes it {@link StackState#BAD}
 * and counts as a cabling error. A port that has received no valid
 * probe within the configured number of probe intervals, or that is
 * physically down, is {@link StackState#GONE}.
 * 
 * <p>
 * Each change is returned as a {@link PortTransition} saying whether
 * the link should now be in the stack graph. This class does not
 * touch the graph itself.
 * 
 * @author simpsons
 */
public final class LinkStateMonitor {
    private final StackConfiguration config;
    private final StackMetrics metrics;
    private final SortedMap<PortRef, StackPort> ports = new TreeMap<>();

    /**
     * Create a monitor for all stack ports of a configuration. All
     * ports start in {@link StackState#NONE}.
     * 
     * @param config the stacking configuration
     * 
     * @param metrics the metrics to count probes and cabling errors in
     */
    public LinkStateMonitor(StackConfiguration config, StackMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        for (DatapathConfig dp : config.datapaths().values())
            for (StackPortConfig sp : dp.stackPorts().values())
                ports.put(sp.local(), new StackPort(sp));
    }

    /**
     * Get a stack port.
     * 
     * @param ref the port reference
     * 
     * @return the port, or {@code null} if it is not a stack port
     */
    public StackPort port(PortRef ref) {
        return ports.get(ref);
    }

    /**
     * Get all stack ports.
     * 
     * @return an unmodifiable collection of ports in reference order
     */
    public Collection<StackPort> ports() {
        return Collections.unmodifiableCollection(ports.values());
    }

    /**
     * Get the stack ports of one datapath.
     * 
     * @param datapath the datapath name
     * 
     * @return the datapath's stack ports in port order
     */
    public List<StackPort> portsOf(String datapath) {
        List<StackPort> result = new ArrayList<>();
        for (StackPort port : ports.values())
            if (port.local().datapath().equals(datapath)) result.add(port);
        return result;
    }

    /**
     * Record that probes have been sent from the stack ports of some
     * datapaths, and expire ports whose peers have fallen silent.
     * 
     * @param datapaths the names of the datapaths that sent probes
     * 
     * @param now the current time in milliseconds
     * 
     * @return the resulting transitions in port order
     */
    public List<PortTransition> probe(Collection<String> datapaths,
                                      long now) {
        List<PortTransition> result = new ArrayList<>();
        for (StackPort port : ports.values()) {
            if (!datapaths.contains(port.local().datapath())) continue;
            if (!port.isPhysicallyUp()) continue;
            port.sent(now);
            if (port.state() == StackState.NONE) {
                result.add(change(port, StackState.INIT, "probing started",
                                  now));
                continue;
            }
            PortTransition t = update(port, now);
            if (t != null) result.add(t);
        }
        return result;
    }

    /**
     * Process a probe received on a port. The sender's claimed identity
     * is checked against the port's configured peer. A mismatch is
     * logged and counted, and never thrown.
     * 
     * @param probe the received probe
     * 
     * @return the resulting transition, or {@code null} if the port's
     * state did not change or the port is not a stack port
     */
    public PortTransition receive(Keepalive probe) {
        StackPort port = ports.get(probe.receivedOn());
        if (port == null) {
            logger.notStacked(probe.receivedOn());
            return null;
        }
        String dp = port.local().datapath();
        metrics.probeReceived(dp);

        PortRef expected = port.peer();
        DatapathConfig expectedDp = config.datapath(expected.datapath());
        boolean correct = expectedDp.id() == probe.remoteId()
            && expectedDp.name().equals(probe.remoteName())
            && expected.port() == probe.remotePort();
        if (!correct) {
            metrics.cablingError(dp);
            logger.cablingError(port.local(),
                                "0x" + Long.toHexString(expectedDp.id()),
                                expectedDp.name(), expected.port(),
                                probe.remoteIdentity());
        }
        port.received(probe, correct);
        return update(port, probe.time());
    }

    /**
     * Process a change of physical status of a stack port.
     * 
     * @param ref the port
     * 
     * @param up {@code true} if the port is now physically up
     * 
     * @param now the current time in milliseconds
     * 
     * @return the resulting transition, or {@code null} if the port's
     * state did not change or the port is not a stack port
     */
    public PortTransition physical(PortRef ref, boolean up, long now) {
        StackPort port = ports.get(ref);
        if (port == null) return null;
        if (port.isPhysicallyUp() == up) return null;
        port.physical(up);
        port.forget();
        if (up) {
            if (port.state() == StackState.NONE) return null;
            return change(port, StackState.INIT, "port up", now);
        }
        if (port.state() == StackState.GONE) return null;
        return change(port, StackState.GONE, "port down", now);
    }

    /**
     * Mark all stack ports of a datapath as gone, as when the
     * controller loses contact with it.
     * 
     * @param datapath the datapath name
     * 
     * @param now the current time in milliseconds
     * 
     * @return the resulting transitions in port order
     */
    public List<PortTransition> disconnect(String datapath, long now) {
        List<PortTransition> result = new ArrayList<>();
        for (StackPort port : portsOf(datapath)) {
            port.forget();
            if (port.state() == StackState.GONE
                || port.state() == StackState.NONE) continue;
            result.add(change(port, StackState.GONE, "datapath disconnected",
                              now));
        }
        return result;
    }

    private PortTransition update(StackPort port, long now) {
        if (port.state() == StackState.NONE) return null;
        final StackState next;
        final String reason;
        Keepalive last = port.lastKeepalive();
        long heard = last == null ? port.stateSince() : last.time();
        if (!port.isPhysicallyUp()) {
            next = StackState.GONE;
            reason = "port down";
        } else if (now - heard > config.timing().probeTimeout()) {
            next = StackState.GONE;
            reason = "no valid probe for " + (now - heard) + "ms";
        } else if (last == null) {
            return null;
        } else if (!port.isCorrect()) {
            next = StackState.BAD;
            reason = "remote identity " + last.remoteIdentity()
                + " does not match " + port.peer();
        } else if (last.remoteState() == StackState.UP
            || last.remoteState() == StackState.INIT) {
            next = StackState.UP;
            reason = "probe from " + port.peer() + " in state "
                + last.remoteState();
        } else {
            next = StackState.INIT;
            reason = "remote port " + port.peer() + " is "
                + last.remoteState();
        }
        if (next == port.state()) return null;
        if (next == StackState.GONE) port.forget();
        return change(port, next, reason, now);
    }

    private PortTransition change(StackPort port, StackState next,
                                  String reason, long now) {
        StackState before = port.state();
        port.enter(next, now);
        metrics.portState(port.local(), next);
        logger.transition(port.local(), next, before, reason);

        /* The link is usable if this end is up, or if it is still
         * initializing but the far end is up. */
        StackPort remote = ports.get(port.peer());
        boolean linkUp = next == StackState.UP
            || (next == StackState.INIT && remote != null && remote.isUp());
        return new PortTransition(port.local(), port.peer(), before, next,
                                  reason, linkUp);
    }

    private interface PrettyLogger extends FormattedLogger {
        @Format("Stack %s state %s (previous state %s): %s")
        @Detail(ShadowLevel.INFO)
        void transition(PortRef port, StackState after, StackState before,
                        String reason);

        @Format("Stack %s cabling incorrect, expected %s:%s:%d, actual %s")
        @Detail(ShadowLevel.SEVERE)
        void cablingError(PortRef port, String expectedId,
                          String expectedName, int expectedPort,
                          String actual);

        @Format("probe on non-stack port %s ignored")
        @Detail(ShadowLevel.FINE)
        void notStacked(PortRef port);
    }

    private static final PrettyLogger logger = FormattedLogger
        .get(LinkStateMonitor.class.getName(), PrettyLogger.class);
}

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackFixtures;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.metrics.StackMetrics;

public class LinkStateMonitorTest {
    private static final PortRef S1_1 = PortRef.of("s1", 1);
    private static final PortRef S2_2 = PortRef.of("s2", 2);

    private SimpleMeterRegistry registry;
    private StackConfiguration config;
    private LinkStateMonitor monitor;

    @BeforeEach
    public void setUp() throws Exception {
        registry = new SimpleMeterRegistry();
        config = StackFixtures.ring(3);
        monitor = new LinkStateMonitor(config, new StackMetrics(registry));
    }

    private PortTransition fromPeer(StackState remote, long time) {
        return monitor.receive(StackFixtures.probe(config, S2_2, S1_1,
                                                   remote, time));
    }

    private double cablingErrors() {
        return registry.counter(StackMetrics.CABLING_ERRORS, "dp", "s1")
            .count();
    }

    @Test
    public void portsStartUnprobed() {
        assertEquals(6, monitor.ports().size());
        assertEquals(2, monitor.portsOf("s1").size());
        assertEquals(StackState.NONE, monitor.port(S1_1).state());
        assertNull(monitor.port(PortRef.of("s1", 10)));
    }

    @Test
    public void fullLifecycle() {
        List<PortTransition> sent =
            monitor.probe(Collections.singleton("s1"), 0L);
        assertEquals(2, sent.size());
        assertEquals(StackState.INIT, sent.get(0).after());
        assertFalse(sent.get(0).linkUp());

        PortTransition t = fromPeer(StackState.INIT, 1000L);
        assertEquals(StackState.INIT, t.before());
        assertEquals(StackState.UP, t.after());
        assertTrue(t.linkUp());
        assertEquals(S2_2, t.peer());

        /* A repeat probe changes nothing. */
        assertNull(fromPeer(StackState.UP, 2000L));

        t = monitor.receive(new Keepalive(S1_1, 3L, "s3", 1, StackState.UP,
                                          3000L));
        assertEquals(StackState.BAD, t.after());
        assertFalse(t.linkUp());
        assertEquals(1.0, cablingErrors());

        t = fromPeer(StackState.UP, 4000L);
        assertEquals(StackState.UP, t.after());

        List<PortTransition> expired =
            monitor.probe(Collections.singleton("s1"), 20000L);
        assertEquals(StackState.GONE, monitor.port(S1_1).state());
        boolean found = false;
        for (PortTransition x : expired)
            if (x.port().equals(S1_1)) {
                found = true;
                assertFalse(x.linkUp());
            }
        assertTrue(found);

        t = fromPeer(StackState.UP, 21000L);
        assertEquals(StackState.GONE, t.before());
        assertEquals(StackState.UP, t.after());
    }

    @Test
    public void miscablingIsBadAndCounted() {
        monitor.probe(Collections.singleton("s1"), 0L);
        PortTransition t = monitor
            .receive(new Keepalive(S1_1, 5L, "s5", 7, StackState.UP, 500L));
        assertEquals(StackState.BAD, t.after());
        assertEquals(1.0, cablingErrors());
        assertEquals(StackState.BAD.code(),
                     registry.find(StackMetrics.PORT_STATE)
                         .tags("dp", "s1", "port", "1").gauge().value());
    }

    @Test
    public void remoteDownKeepsInitializing() {
        monitor.probe(Collections.singleton("s1"), 0L);
        assertNull(fromPeer(StackState.GONE, 1000L));
        assertEquals(StackState.INIT, monitor.port(S1_1).state());
    }

    @Test
    public void physicalStatus() {
        monitor.probe(Collections.singleton("s1"), 0L);
        fromPeer(StackState.UP, 1000L);
        PortTransition t = monitor.physical(S1_1, false, 2000L);
        assertEquals(StackState.GONE, t.after());
        assertFalse(monitor.port(S1_1).isPhysicallyUp());

        /* Down ports are not probed. */
        for (PortTransition x : monitor.probe(Collections.singleton("s1"),
                                              3000L))
            assertFalse(x.port().equals(S1_1));

        t = monitor.physical(S1_1, true, 4000L);
        assertEquals(StackState.INIT, t.after());
        assertNull(monitor.physical(S1_1, true, 5000L));
    }

    @Test
    public void initEndIsUsableWhenFarEndUp() {
        monitor.probe(Collections.singleton("s2"), 0L);
        monitor.receive(StackFixtures.probe(config, S1_1, S2_2,
                                            StackState.INIT, 500L));
        assertTrue(monitor.port(S2_2).isUp());
        List<PortTransition> sent =
            monitor.probe(Collections.singleton("s1"), 1000L);
        for (PortTransition x : sent)
            if (x.port().equals(S1_1)) assertTrue(x.linkUp());
    }

    @Test
    public void disconnectMarksGone() {
        monitor.probe(Collections.singleton("s1"), 0L);
        fromPeer(StackState.UP, 1000L);
        List<PortTransition> gone = monitor.disconnect("s1", 2000L);
        assertEquals(2, gone.size());
        for (PortTransition x : gone)
            assertEquals(StackState.GONE, x.after());
        assertTrue(monitor.disconnect("s1", 3000L).isEmpty());
    }

    @Test
    public void probesCounted() {
        monitor.probe(Collections.singleton("s1"), 0L);
        fromPeer(StackState.UP, 1000L);
        fromPeer(StackState.UP, 2000L);
        assertEquals(2.0, registry
            .counter(StackMetrics.PROBES_RECEIVED, "dp", "s1").count());
    }
}

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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackState;

public class StackMetricsTest {
    private SimpleMeterRegistry registry;
    private StackMetrics metrics;

    @BeforeEach
    public void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new StackMetrics(registry);
    }

    private double gauge(String name, String... tags) {
        return registry.find(name).tags(tags).gauge().value();
    }

    @Test
    public void countersByDatapath() {
        metrics.cablingError("s1");
        metrics.cablingError("s1");
        metrics.probeReceived("s2");
        assertEquals(2.0, registry
            .counter(StackMetrics.CABLING_ERRORS, "dp", "s1").count());
        assertEquals(1.0, registry
            .counter(StackMetrics.PROBES_RECEIVED, "dp", "s2").count());
    }

    @Test
    public void gaugesHoldLastValue() {
        metrics.stackRoot(2L);
        metrics.portState(PortRef.of("s1", 3), StackState.INIT);
        metrics.portState(PortRef.of("s1", 3), StackState.UP);
        metrics.rootHopPort("s2", 4);
        metrics.isRoot("s1", true);
        metrics.isRoot("s1", false);
        assertEquals(2.0, gauge(StackMetrics.ROOT_DPID));
        assertEquals(3.0, gauge(StackMetrics.PORT_STATE, "dp", "s1",
                                "port", "3"));
        assertEquals(4.0, gauge(StackMetrics.ROOT_HOP_PORT, "dp", "s2"));
        assertEquals(0.0, gauge(StackMetrics.IS_ROOT, "dp", "s1"));
    }
}

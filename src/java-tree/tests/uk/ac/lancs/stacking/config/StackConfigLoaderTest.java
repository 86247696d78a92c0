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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Properties;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackFixtures;

public class StackConfigLoaderTest {
    @Test
    public void ringLoads() throws Exception {
        StackConfiguration c = StackFixtures.ring(4);
        assertEquals(4, c.stackedDatapaths().size());
        assertEquals(Arrays.asList("s1"), c.rootCandidates());
        assertEquals("s1", c.defaultRoot());
        assertEquals(3, c.declaredDepth());
        assertEquals(PortRef.of("s2", 2), c.peerOf(PortRef.of("s1", 1)));
        assertFalse(c.hasExternals());
        DatapathConfig s3 = c.datapath("s3");
        assertEquals(3L, s3.id());
        assertFalse(s3.isRootCandidate());
        assertEquals(2, s3.stackPorts().size());
    }

    @Test
    public void timingDefaultsAndOverrides() throws Exception {
        StackTiming t = StackFixtures.ring(3).timing();
        assertEquals(5000L, t.probeInterval());
        assertEquals(15000L, t.probeTimeout());
        assertEquals(10000L, t.healthInterval());

        Properties p = StackFixtures.ringProps(3);
        p.setProperty("timing.probe-interval", "2");
        p.setProperty("timing.lost-probes", "4");
        p.setProperty("timing.health-interval", "30");
        t = StackFixtures.load(p).timing();
        assertEquals(2000L, t.probeInterval());
        assertEquals(8000L, t.probeTimeout());
        assertEquals(30000L, t.healthInterval());
    }

    @Test
    public void candidatesOrderByPriority() throws Exception {
        Properties p = StackFixtures.ringProps(3);
        p.setProperty("dp.s3.priority", "1");
        p.setProperty("dp.s1.priority", "2");
        StackConfiguration c = StackFixtures.load(p);
        assertEquals(Arrays.asList("s3", "s1"), c.rootCandidates());
        assertTrue(c.datapath("s1").isRootCandidate());
    }

    @Test
    public void externalsAndLags() throws Exception {
        Properties p = StackFixtures.ringProps(3);
        p.setProperty("dp.s2.ports", "1 2 10 11");
        p.setProperty("dp.s2.port.11.external", "true");
        p.setProperty("dp.s2.port.11.lag", "7");
        p.setProperty("dp.s2.port.10.lag", "7");
        StackConfiguration c = StackFixtures.load(p);
        assertTrue(c.hasExternals());
        DatapathConfig s2 = c.datapath("s2");
        assertTrue(s2.externalPorts().contains(11));
        assertEquals(Integer.valueOf(7), s2.lags().get(11));
        assertEquals(Integer.valueOf(7), s2.lags().get(10));
    }

    @Test
    public void tunnelsLoad() throws Exception {
        Properties p = StackFixtures.ringProps(3);
        p.setProperty("tunnels", "t1");
        p.setProperty("tunnel.t1.src", "s1");
        p.setProperty("tunnel.t1.dst", "s3:10");
        StackConfiguration c = StackFixtures.load(p);
        TunnelConfig t = c.tunnels().get("t1");
        assertEquals("s1", t.source());
        assertEquals(PortRef.of("s3", 10), t.destination());
    }

    @Test
    public void oneSidedLinkRejected() {
        Properties p = StackFixtures.ringProps(3);
        p.setProperty("dp.s2.port.2.stack", "s1:9");
        StackConfigurationException ex =
            assertThrows(StackConfigurationException.class,
                         () -> StackFixtures.load(p));
        assertTrue(ex.getKey().startsWith("dp.s"));
    }

    @Test
    public void unknownPeerRejected() {
        Properties p = StackFixtures.ringProps(3);
        p.setProperty("dp.s2.port.1.stack", "s9:2");
        assertThrows(StackConfigurationException.class,
                     () -> StackFixtures.load(p));
    }

    @Test
    public void missingRootRejected() {
        Properties p = StackFixtures.ringProps(3);
        p.remove("dp.s1.priority");
        StackConfigurationException ex =
            assertThrows(StackConfigurationException.class,
                         () -> StackFixtures.load(p));
        assertNull(ex.getKey());
    }

    @Test
    public void unlistedPortRejected() {
        Properties p = StackFixtures.ringProps(3);
        p.setProperty("dp.s1.port.12.external", "true");
        StackConfigurationException ex =
            assertThrows(StackConfigurationException.class,
                         () -> StackFixtures.load(p));
        assertEquals("dp.s1.port.12.external", ex.getKey());
    }

    @Test
    public void malformedValuesRejected() {
        Properties p = StackFixtures.ringProps(3);
        p.setProperty("dp.s1.priority", "high");
        assertThrows(StackConfigurationException.class,
                     () -> StackFixtures.load(p));

        Properties q = StackFixtures.ringProps(3);
        q.setProperty("dp.s1.port.10.external", "true");
        q.setProperty("dp.s1.port.1.external", "true");
        assertThrows(StackConfigurationException.class,
                     () -> StackFixtures.load(q));

        Properties r = StackFixtures.ringProps(3);
        r.setProperty("dps", "s1 s2 s3 s1");
        assertThrows(StackConfigurationException.class,
                     () -> StackFixtures.load(r));
    }

    @Test
    public void loadsFromFileWithInheritedTiming() throws Exception {
        Configuration conf = new ConfigurationContext()
            .get(getClass().getResource("/stacking/ring3.properties")
                .toURI());
        StackConfiguration c = StackConfigLoader.load(conf.subview("stack"));
        assertEquals(Arrays.asList("s1", "s2"), c.rootCandidates());
        assertEquals(1L, c.datapath("s1").id());
        assertTrue(c.hasExternals());
        assertEquals(PortRef.of("s3", 10),
                     c.tunnels().get("vid100").destination());
        assertEquals(1000L, c.timing().probeInterval());
        assertEquals(5000L, c.timing().probeTimeout());
        assertEquals(15000L, c.timing().healthInterval());
    }
}

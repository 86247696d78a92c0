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

package uk.ac.lancs.stacking.tunnel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackFixtures;
import uk.ac.lancs.stacking.StackFixtures.GraphView;
import uk.ac.lancs.stacking.config.TunnelConfig;
import uk.ac.lancs.stacking.graph.StackGraph;
import uk.ac.lancs.stacking.roles.PortOrder;
import uk.ac.lancs.stacking.roles.StackView;

public class TunnelPathResolverTest {
    private GraphView view;
    private TunnelPathResolver resolver;

    @BeforeEach
    public void setUp() throws Exception {
        view = new GraphView(StackFixtures.ring(4).declaredGraph(), "s1");
        resolver = new TunnelPathResolver(view, PortOrder.ASCENDING);
    }

    @Test
    public void followsShortestPath() {
        assertEquals(Integer.valueOf(1), resolver.outputPort("s1", "s1", "s3",
                                                             10));
        assertEquals(Integer.valueOf(1), resolver.outputPort("s2", "s1", "s3",
                                                             10));
        assertEquals(Integer.valueOf(10),
                     resolver.outputPort("s3", "s1", "s3", 10));
        assertNull(resolver.outputPort("s4", "s1", "s3", 10));
    }

    @Test
    public void localTunnel() {
        assertEquals(Integer.valueOf(10),
                     resolver.outputPort("s2", "s2", "s2", 10));
        assertNull(resolver.outputPort("s1", "s2", "s2", 10));
    }

    @Test
    public void reroutesAfterLinkLoss() {
        view.graph().removeLink(PortRef.of("s1", 1), PortRef.of("s2", 2));
        assertEquals(Integer.valueOf(2), resolver.outputPort("s1", "s1", "s3",
                                                             10));
        assertEquals(Integer.valueOf(2), resolver.outputPort("s4", "s1", "s3",
                                                             10));
        assertNull(resolver.outputPort("s2", "s1", "s3", 10));
    }

    @Test
    public void unreachableDestination() {
        view.graph().removeLink(PortRef.of("s2", 1), PortRef.of("s3", 2));
        view.graph().removeLink(PortRef.of("s3", 1), PortRef.of("s4", 2));
        assertNull(resolver.outputPort("s1", "s1", "s3", 10));
    }

    @Test
    public void resolvesOnlyParticipants() {
        TunnelConfig t =
            new TunnelConfig("t1", "s1", PortRef.of("s3", 10));
        Map<String, Integer> s2 =
            resolver.resolve("s2", Collections.singleton(t));
        assertEquals(Collections.singletonMap("t1", 1), s2);
        assertTrue(resolver.resolve("s4", Collections.singleton(t))
            .isEmpty());
    }

    /* The link is in the graph once either end is up, but only a port
     * confirmed up at this end is used. */
    @Test
    public void waitsForLocalEndOfLink() {
        final PortRef pending = PortRef.of("s1", 1);
        StackView halfUp = new StackView() {
            @Override
            public StackGraph graph() {
                return view.graph();
            }

            @Override
            public String root() {
                return view.root();
            }

            @Override
            public Collection<PortRef> upPorts(String datapath) {
                List<PortRef> result =
                    new ArrayList<>(view.upPorts(datapath));
                result.remove(pending);
                return result;
            }

            @Override
            public PortRef peerOf(PortRef port) {
                return view.peerOf(port);
            }
        };
        TunnelPathResolver waiting =
            new TunnelPathResolver(halfUp, PortOrder.ASCENDING);
        assertNull(waiting.outputPort("s1", "s1", "s3", 10));
        assertEquals(Integer.valueOf(1),
                     waiting.outputPort("s2", "s1", "s3", 10));
        assertEquals(Integer.valueOf(1),
                     resolver.outputPort("s1", "s1", "s3", 10));
    }
}

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

package uk.ac.lancs.stacking.control;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.config.ConfigurationContext;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackFixtures;
import uk.ac.lancs.stacking.StackFixtures.EventLog;
import uk.ac.lancs.stacking.StackFixtures.RuleLog;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.config.DatapathConfig;
import uk.ac.lancs.stacking.config.StackConfigLoader;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.config.StackPortConfig;
import uk.ac.lancs.stacking.flood.FloodContext;
import uk.ac.lancs.stacking.link.Keepalive;
import uk.ac.lancs.stacking.metrics.StackMetrics;
import uk.ac.lancs.stacking.roles.PortOrder;
import uk.ac.lancs.stacking.roles.PortRoleClassifier;
import uk.ac.lancs.stacking.roles.PortRoleSets;
import uk.ac.lancs.stacking.rules.FlowRule;
import uk.ac.lancs.stacking.rules.FlowRuleSynthesizer;
import uk.ac.lancs.stacking.tunnel.TunnelPathResolver;

/**
 * Checks that the roles published in snapshots and the rules sent to
 * each datapath always match what a fresh computation over the
 * coordinator's current state would give.
 */
public class StackCoordinatorConsistencyTest {
    static Stream<Arguments> stacks() throws Exception {
        Configuration file = new ConfigurationContext()
            .get(StackCoordinatorConsistencyTest.class
                .getResource("/stacking/ring3.properties").toURI());
        return Stream
            .of(Arguments.of("ring3", StackFixtures.ring(3)),
                Arguments.of("ring5", StackFixtures.ring(5)),
                Arguments.of("doubled",
                             StackFixtures
                                 .load(StackFixtures.doubledRingProps())),
                Arguments.of("file",
                             StackConfigLoader.load(file.subview("stack"))));
    }

    private static void assertConsistent(StackConfiguration config,
                                         StackCoordinator coord,
                                         String when) {
        TopologySnapshot snap = coord.snapshot();
        assertNotNull(snap, when);
        TunnelPathResolver tunnels =
            new TunnelPathResolver(coord, PortOrder.ASCENDING);
        for (String dp : config.stackedDatapaths()) {
            String where = when + " at " + dp;
            PortRoleSets fresh = new PortRoleClassifier(dp).recompute(coord);
            DatapathStatus status = snap.datapath(dp);
            assertEquals(fresh, status.roles(), where);

            SortedMap<String, FlowRule> expected = new TreeMap<>();
            if (status.isConnected()) {
                FloodContext ctx =
                    new FloodContext(config.datapath(dp), fresh,
                                     coord.floodContext(dp).localPorts(),
                                     config.hasExternals());
                List<FlowRule> wanted = new ArrayList<>();
                wanted.addAll(FlowRuleSynthesizer
                    .floodRules(dp, coord.flooding().plans(ctx)));
                wanted.addAll(FlowRuleSynthesizer
                    .tunnelRules(dp, tunnels
                        .resolve(dp, config.tunnels().values())));
                for (FlowRule rule : wanted)
                    expected.put(rule.key(), rule);
            }
            assertEquals(expected, coord.installedRules(dp), where);
        }
    }

    private static Keepalive keepaliveFrom(StackConfiguration config,
                                       StackPortConfig sp, long now) {
        return StackFixtures.probe(config, sp.peer(), sp.local(),
                                   StackState.INIT, now);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("stacks")
    public void rolesAndRulesFollowEveryStep(String name,
                                             StackConfiguration config) {
        StackCoordinator coord =
            new StackCoordinator(config,
                                 new StackMetrics(new SimpleMeterRegistry()),
                                 new EventLog(), new RuleLog());
        assertConsistent(config, coord, "start");

        for (String dp : config.stackedDatapaths()) {
            coord.datapathConnected(dp, config.datapath(dp).ports(), 0L);
            assertConsistent(config, coord, "connecting " + dp);
        }
        coord.probeTick(0L);
        assertConsistent(config, coord, "first keepalive round");

        for (DatapathConfig dp : config.datapaths().values()) {
            for (StackPortConfig sp : dp.stackPorts().values()) {
                coord.keepalive(keepaliveFrom(config, sp, 1000L));
                assertConsistent(config, coord,
                                 "keepalive at " + sp.local());
            }
        }
        assertEquals(config.declaredGraph().links().size(),
                     coord.graph().links().size());

        long now = 1000L;
        for (DatapathConfig dp : config.datapaths().values()) {
            for (StackPortConfig sp : dp.stackPorts().values()) {
                PortRef port = sp.local();
                now += 10L;
                coord.portStatus(port, false, now);
                assertConsistent(config, coord, port + " down");
                assertEquals(StackState.GONE, coord.snapshot()
                    .datapath(port.datapath()).portStates()
                    .get(port.port()));

                now += 10L;
                coord.portStatus(port, true, now);
                assertConsistent(config, coord, port + " restored");
                coord.keepalive(keepaliveFrom(config, sp, now));
                assertConsistent(config, coord, port + " up again");
                assertEquals(StackState.UP, coord.snapshot()
                    .datapath(port.datapath()).portStates()
                    .get(port.port()));
            }
        }

        for (String dp : config.stackedDatapaths()) {
            assertTrue(coord.snapshot().datapath(dp).roles().pathToRoot()
                .size() > 0, dp);
            assertTrue(coord.installedRules(dp).size() > 0, dp);
        }
    }
}

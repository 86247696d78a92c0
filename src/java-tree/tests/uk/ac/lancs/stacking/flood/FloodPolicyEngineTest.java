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

package uk.ac.lancs.stacking.flood;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.SortedMap;
import java.util.TreeSet;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackFixtures;
import uk.ac.lancs.stacking.StackFixtures.GraphView;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.roles.PortRoleClassifier;

public class FloodPolicyEngineTest {
    private static FloodContext context(StackConfiguration config,
                                        GraphView view, String dp) {
        return new FloodContext(config.datapath(dp),
                                new PortRoleClassifier(dp).recompute(view),
                                config.datapath(dp).ports(),
                                config.hasExternals());
    }

    private static GraphView view(StackConfiguration config) {
        return new GraphView(config.declaredGraph(), config.defaultRoot());
    }

    /**
     * Flood a frame from a host port of one datapath through the whole
     * stack, and count deliveries to the host port of each datapath.
     */
    private static Map<String, Integer> flood(StackConfiguration config,
                                              FloodPolicyEngine engine,
                                              String origin) {
        GraphView view = view(config);
        Map<String, FloodContext> contexts = new HashMap<>();
        for (String dp : config.stackedDatapaths())
            contexts.put(dp, context(config, view, dp));

        Map<String, Integer> delivered = new HashMap<>();
        Deque<PortRef> pending = new ArrayDeque<>();
        pending.add(PortRef.of(origin, StackFixtures.HOST));
        int steps = 0;
        while (!pending.isEmpty()) {
            if (++steps > 1000) fail("flood did not terminate from " + origin);
            PortRef in = pending.remove();
            FloodContext ctx = contexts.get(in.datapath());
            int source = in.datapath().equals(origin) ? StackFixtures.HOST
                : FloodPolicyEngine.NO_PORT;
            FloodPlan plan = engine.plan(ctx, in.port(), source, false);
            for (FloodAction act : plan.actions()) {
                final int out;
                switch (act.kind()) {
                case OUTPUT:
                    out = act.port();
                    assertNotEquals(in.port(), out,
                                    "explicit output to ingress at " + in);
                    break;
                case OUTPUT_IN_PORT:
                    out = in.port();
                    break;
                default:
                    continue;
                }
                if (ctx.isStackPort(out)) {
                    pending.add(ctx.peerOf(out));
                } else {
                    assertNotEquals(in, ctx.ref(out),
                                    "host echo at " + in);
                    delivered.merge(in.datapath(), 1, Integer::sum);
                }
            }
        }
        return delivered;
    }

    private static void assertDeliveredOnce(StackConfiguration config,
                                            FloodPolicyEngine engine) {
        for (String origin : config.stackedDatapaths()) {
            Map<String, Integer> delivered = flood(config, engine, origin);
            for (String dp : config.stackedDatapaths()) {
                Integer n = delivered.get(dp);
                if (dp.equals(origin))
                    assertEquals(null, n, "echo to " + origin);
                else
                    assertEquals(Integer.valueOf(1), n,
                                 "from " + origin + " to " + dp);
            }
        }
    }

    @ParameterizedTest
    @ValueSource(ints = { 3, 4, 5, 6 })
    public void reflectedRingsFloodOnce(int n) throws Exception {
        assertDeliveredOnce(StackFixtures.ring(n),
                            new FloodPolicyEngine(new ReflectedFlooding()));
    }

    @ParameterizedTest
    @ValueSource(ints = { 3, 4, 5, 6 })
    public void directRingsFloodOnce(int n) throws Exception {
        assertDeliveredOnce(StackFixtures.ring(n),
                            new FloodPolicyEngine(new DirectFlooding()));
    }

    @Test
    public void parallelLinksFloodOnce() throws Exception {
        StackConfiguration config =
            StackFixtures.load(StackFixtures.doubledRingProps());
        assertDeliveredOnce(config,
                            FloodPolicyEngine.forDepth(config.declaredDepth()));
        assertDeliveredOnce(config,
                            new FloodPolicyEngine(new ReflectedFlooding()));
    }

    @Test
    public void strategyFollowsDepth() {
        assertTrue(FloodPolicyEngine.forDepth(2)
            .strategy() instanceof DirectFlooding);
        assertTrue(FloodPolicyEngine.forDepth(3)
            .strategy() instanceof ReflectedFlooding);
    }

    @Test
    public void rootReflects() throws Exception {
        StackConfiguration config = StackFixtures.ring(4);
        FloodContext s1 = context(config, view(config), "s1");
        FloodPlan plan = FloodPolicyEngine.forDepth(config.declaredDepth())
            .plan(s1, 1, FloodPolicyEngine.NO_PORT, false);
        assertFalse(plan.isPruned());
        assertTrue(plan.actions().contains(FloodAction.OUTPUT_IN_PORT));
        assertEquals(new TreeSet<>(Arrays.asList(1, 2, 10)), plan.outputs());
    }

    @Test
    public void secondaryTowardsPortsDrop() throws Exception {
        StackConfiguration config =
            StackFixtures.load(StackFixtures.doubledRingProps());
        FloodContext s2 = context(config, view(config), "s2");
        FloodPolicyEngine engine = FloodPolicyEngine.forDepth(2);
        assertFalse(engine.isPruned(s2, 1));
        assertTrue(engine.isPruned(s2, 2));
        assertTrue(engine.isPruned(s2, 4));
        assertFalse(engine.isPruned(s2, StackFixtures.HOST));
        FloodPlan plan = engine.plan(s2, 2, FloodPolicyEngine.NO_PORT, false);
        assertTrue(plan.isPruned());
        assertTrue(plan.actions().isEmpty());
    }

    @Test
    public void learningWithReflection() throws Exception {
        StackConfiguration config = StackFixtures.ring(4);
        GraphView view = view(config);
        FloodPolicyEngine engine =
            FloodPolicyEngine.forDepth(config.declaredDepth());
        FloodContext s2 = context(config, view, "s2");
        assertFalse(engine.learnsFromBroadcast(s2, 1));
        assertTrue(engine.learnsFromBroadcast(s2, 2));
        assertTrue(engine.learnsFromBroadcast(s2, StackFixtures.HOST));
        FloodContext s3 = context(config, view, "s3");
        assertTrue(engine.learnsFromBroadcast(s3, 2));
        assertFalse(engine.learnsFromBroadcast(s3, 1));
    }

    @Test
    public void externalsFloodOncePerMark() throws Exception {
        Properties p = StackFixtures.ringProps(4);
        p.setProperty("dp.s3.ports", "1 2 10 11");
        p.setProperty("dp.s3.port.11.external", "true");
        StackConfiguration config = StackFixtures.load(p);
        FloodContext s3 = context(config, view(config), "s3");
        FloodPolicyEngine engine =
            FloodPolicyEngine.forDepth(config.declaredDepth());

        FloodPlan fresh = engine.plan(s3, 2, FloodPolicyEngine.NO_PORT, false);
        assertTrue(fresh.outputs().contains(11));
        FloodPlan done = engine.plan(s3, 2, FloodPolicyEngine.NO_PORT, true);
        assertFalse(done.outputs().contains(11));
        assertTrue(done.outputs().contains(10));

        /* Frames from an external port never reach another. */
        FloodPlan fromExternal =
            engine.plan(s3, 11, FloodPolicyEngine.NO_PORT, false);
        assertFalse(fromExternal.outputs().contains(11));
        assertEquals(FloodAction.SET_NO_EXTERNAL, fromExternal.mark());

        SortedMap<FloodRuleKey, FloodPlan> all = engine.plans(s3);
        assertEquals(10, all.size());
        assertTrue(all.containsKey(new FloodRuleKey(11, true)));
        assertEquals("flood:11:noext", new FloodRuleKey(11, true).toString());
    }
}

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

package uk.ac.lancs.stacking.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import uk.ac.lancs.stacking.StackFixtures.RuleLog;
import uk.ac.lancs.stacking.flood.FloodAction;
import uk.ac.lancs.stacking.metrics.StackMetrics;

public class FlowRuleSynthesizerTest {
    private SimpleMeterRegistry registry;
    private RuleLog sink;
    private FlowRuleSynthesizer synth;

    @BeforeEach
    public void setUp() {
        registry = new SimpleMeterRegistry();
        sink = new RuleLog();
        synth = new FlowRuleSynthesizer(sink, new StackMetrics(registry));
    }

    private static FlowRule rule(String key, int... ports) {
        FloodAction[] acts = new FloodAction[ports.length];
        for (int i = 0; i < ports.length; i++)
            acts[i] = FloodAction.output(ports[i]);
        return new FlowRule("s1", key, Arrays.asList(acts));
    }

    @Test
    public void onlyDifferencesAreSent() {
        List<FlowRuleDelta> first =
            synth.synthesize("s1", Arrays.asList(rule("b", 1), rule("a", 2)));
        assertEquals(2, first.size());
        assertEquals(FlowRuleDelta.Op.INSTALL, first.get(0).op());
        assertEquals("a", first.get(0).rule().key());

        assertTrue(synth.synthesize("s1", Arrays.asList(rule("a", 2),
                                                        rule("b", 1)))
            .isEmpty());
        assertEquals(2, sink.deltas.size());

        List<FlowRuleDelta> second =
            synth.synthesize("s1", Arrays.asList(rule("a", 3), rule("c", 1)));
        assertEquals(3, second.size());
        assertEquals(FlowRuleDelta.Op.DELETE, second.get(0).op());
        assertEquals("b", second.get(0).rule().key());
        assertEquals(FlowRuleDelta.Op.REPLACE, second.get(1).op());
        assertEquals(FlowRuleDelta.Op.INSTALL, second.get(2).op());
        assertEquals(2, synth.installed("s1").size());
    }

    @Test
    public void failuresAreCountedNotThrown() {
        sink.failing = true;
        List<FlowRuleDelta> deltas =
            synth.synthesize("s1", Collections.singleton(rule("a", 1)));
        assertEquals(1, deltas.size());
        assertEquals(1.0, registry
            .counter(StackMetrics.RULE_FAILURES, "dp", "s1").count());
        assertEquals(1, synth.installed("s1").size());
    }

    @Test
    public void forgettingResends() {
        synth.synthesize("s1", Collections.singleton(rule("a", 1)));
        synth.forget("s1");
        assertTrue(synth.installed("s1").isEmpty());
        assertEquals(1, synth
            .synthesize("s1", Collections.singleton(rule("a", 1))).size());
    }

    @Test
    public void foreignRulesRejected() {
        assertThrows(IllegalArgumentException.class, () -> synth
            .synthesize("s2", Collections.singleton(rule("a", 1))));
    }

    @Test
    public void tunnelRulesAreKeyed() {
        Map<String, Integer> ports = new TreeMap<>();
        ports.put("t1", 4);
        List<FlowRule> rules = FlowRuleSynthesizer.tunnelRules("s1", ports);
        assertEquals(1, rules.size());
        assertEquals("tunnel:t1", rules.get(0).key());
        assertEquals(Collections.singletonList(FloodAction.output(4)),
                     rules.get(0).actions());
    }
}

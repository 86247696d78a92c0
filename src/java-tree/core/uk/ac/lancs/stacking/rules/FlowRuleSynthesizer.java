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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;
import uk.ac.lancs.stacking.flood.FloodAction;
import uk.ac.lancs.stacking.flood.FloodPlan;
import uk.ac.lancs.stacking.flood.FloodRuleKey;
import uk.ac.lancs.stacking.metrics.StackMetrics;

/**
 * Turns the desired rule set of each datapath into changes against the
 * set last sent, and delivers them. Delivery is attempted once. A
 * failure is logged and counted, and the desired set is still taken as
 * sent.
 * 
 * @author simpsons
 */
public final class FlowRuleSynthesizer {
    private interface PrettyLogger extends FormattedLogger {
        @Format("%s: failed to send %d rule changes")
        @Detail(ShadowLevel.WARNING)
        void sendFailed(String datapath, int count, Throwable t);

        @Format("%s: %d rule changes")
        @Detail(ShadowLevel.FINE)
        void sent(String datapath, int count);
    }

    private static final PrettyLogger logger = FormattedLogger
        .get(FlowRuleSynthesizer.class.getName(), PrettyLogger.class);

    private final FlowRuleSink sink;
    private final StackMetrics metrics;
    private final Map<String, SortedMap<String, FlowRule>> sent =
        new HashMap<>();

    /**
     * Create a synthesizer delivering to a sink.
     * 
     * @param sink the destination of rule changes
     * 
     * @param metrics the metrics to count failures in
     */
    public FlowRuleSynthesizer(FlowRuleSink sink, StackMetrics metrics) {
        if (sink == null) throw new NullPointerException("sink");
        this.sink = sink;
        this.metrics = metrics;
    }

    /**
     * Compute the changes that take a datapath from its last sent rules
     * to a desired set, and deliver them. Deletions come first, then
     * installations and replacements in key order.
     * 
     * @param datapath the datapath name
     * 
     * @param rules the complete desired rule set of the datapath
     * 
     * @return the changes delivered, empty if there were none
     */
    public List<FlowRuleDelta> synthesize(String datapath,
                                          Collection<? extends FlowRule> rules) {
        SortedMap<String, FlowRule> desired = new TreeMap<>();
        for (FlowRule rule : rules) {
            if (!rule.datapath().equals(datapath))
                throw new IllegalArgumentException("rule " + rule
                    + " not for " + datapath);
            desired.put(rule.key(), rule);
        }
        SortedMap<String, FlowRule> previous = sent.get(datapath);
        if (previous == null) previous = Collections.emptySortedMap();

        List<FlowRuleDelta> deltas = new ArrayList<>();
        for (Map.Entry<String, FlowRule> entry : previous.entrySet())
            if (!desired.containsKey(entry.getKey()))
                deltas.add(new FlowRuleDelta(FlowRuleDelta.Op.DELETE,
                                             entry.getValue()));
        for (Map.Entry<String, FlowRule> entry : desired.entrySet()) {
            FlowRule old = previous.get(entry.getKey());
            if (old == null)
                deltas.add(new FlowRuleDelta(FlowRuleDelta.Op.INSTALL,
                                             entry.getValue()));
            else if (!old.equals(entry.getValue()))
                deltas.add(new FlowRuleDelta(FlowRuleDelta.Op.REPLACE,
                                             entry.getValue()));
        }
        sent.put(datapath, desired);
        if (deltas.isEmpty()) return deltas;

        try {
            sink.send(datapath, Collections.unmodifiableList(deltas));
            logger.sent(datapath, deltas.size());
        } catch (IOException | RuntimeException ex) {
            logger.sendFailed(datapath, deltas.size(), ex);
            if (metrics != null) metrics.ruleFailure(datapath);
        }
        return deltas;
    }

    /**
     * Forget the rules last sent to a datapath, so that its whole rule
     * set is installed afresh next time.
     * 
     * @param datapath the datapath name
     */
    public void forget(String datapath) {
        sent.remove(datapath);
    }

    /**
     * Get the rules last sent to a datapath.
     * 
     * @param datapath the datapath name
     * 
     * @return the rules keyed by rule key, empty if none
     */
    public SortedMap<String, FlowRule> installed(String datapath) {
        SortedMap<String, FlowRule> result = sent.get(datapath);
        if (result == null) return Collections.emptySortedMap();
        return Collections.unmodifiableSortedMap(result);
    }

    /**
     * Express flood plans as rules.
     * 
     * @param datapath the datapath the plans belong to
     * 
     * @param plans the plans keyed by ingress and external mark
     * 
     * @return a rule per plan
     */
    public static List<FlowRule>
        floodRules(String datapath, Map<FloodRuleKey, FloodPlan> plans) {
        List<FlowRule> result = new ArrayList<>();
        for (Map.Entry<FloodRuleKey, FloodPlan> entry : plans.entrySet())
            result.add(new FlowRule(datapath, entry.getKey().toString(),
                                    entry.getValue().actions()));
        return result;
    }

    /**
     * Express tunnel output ports as rules.
     * 
     * @param datapath the datapath the ports belong to
     * 
     * @param ports the output port of each tunnel keyed by tunnel id
     * 
     * @return a rule per tunnel
     */
    public static List<FlowRule> tunnelRules(String datapath,
                                             Map<String, Integer> ports) {
        List<FlowRule> result = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : ports.entrySet())
            result.add(new FlowRule(datapath, "tunnel:" + entry.getKey(),
                                    Collections.singletonList(FloodAction
                                        .output(entry.getValue()))));
        return result;
    }
}

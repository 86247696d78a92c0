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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.roles.PortRoleSets;

/**
 * Decides where flooded frames go within a stack.
 * 
 * <p>
 * The engine gathers three groups of candidate outputs for a frame:
 * the chosen root-ward port, the active away ports not leading back to
 * the datapath the frame came from, and the up local ports other than
 * the ingress and source ports. Its strategy then decides which groups
 * to use. Broadcasts arriving on redundant stack ports are dropped
 * before any of this.
 * 
 * @author simpsons
 */
public final class FloodPolicyEngine {
    /**
     * Stands for the controller as ingress port, or for no source port.
     */
    public static final int NO_PORT = 0;

    private final FloodStrategy strategy;

    /**
     * Create an engine using a given strategy.
     * 
     * @param strategy the strategy to compose actions with
     */
    public FloodPolicyEngine(FloodStrategy strategy) {
        if (strategy == null) throw new NullPointerException("strategy");
        this.strategy = strategy;
    }

    /**
     * Create an engine suitable for a stack of a given depth. Stacks
     * whose longest path from the root includes more than two
     * datapaths reflect floods off the root.
     * 
     * @param depth the number of datapaths in the longest shortest
     * path from the root
     * 
     * @return the new engine
     * 
     * @constructor
     */
    public static FloodPolicyEngine forDepth(int depth) {
        return new FloodPolicyEngine(depth > 2 ? new ReflectedFlooding()
            : new DirectFlooding());
    }

    /**
     * Get the strategy in use.
     * 
     * @return the strategy
     */
    public FloodStrategy strategy() {
        return strategy;
    }

    /**
     * Determine whether flooded frames arriving on a port are dropped.
     * A stack port is pruned if it is not up, if it is a towards-root
     * port other than the chosen one, or if it is a pruned away port.
     * Local ports are never pruned.
     * 
     * @param ctx the datapath's flood planning inputs
     * 
     * @param inPort the ingress port
     * 
     * @return {@code true} if broadcasts from the port are dropped
     */
    public boolean isPruned(FloodContext ctx, int inPort) {
        if (inPort == NO_PORT || !ctx.isStackPort(inPort)) return false;
        final PortRoleSets roles = ctx.roles();
        final PortRef ref = ctx.ref(inPort);
        if (roles.towards().contains(ref)) return !ref.equals(roles.chosen());
        if (roles.away().contains(ref))
            return roles.prunedAway().contains(ref);
        return true;
    }

    /**
     * Determine whether source addresses of broadcasts arriving on a
     * port are learned. With reflection, a non-root datapath that is
     * not at the edge learns only from its towards-root ports, as it
     * otherwise sees frames before the root has reflected them.
     * 
     * @param ctx the datapath's flood planning inputs
     * 
     * @param inPort the ingress port
     * 
     * @return {@code true} if broadcasts are learned from
     */
    public boolean learnsFromBroadcast(FloodContext ctx, int inPort) {
        if (inPort == NO_PORT || !ctx.isStackPort(inPort)) return true;
        if (isPruned(ctx, inPort)) return false;
        final PortRoleSets roles = ctx.roles();
        if (roles.isRoot() || !strategy.reflects()) return true;
        return roles.isEdge() || roles.towards().contains(ctx.ref(inPort));
    }

    /**
     * Plan the flooding of a frame.
     * 
     * @param ctx the datapath's flood planning inputs
     * 
     * @param inPort the port the frame arrived on, or {@link #NO_PORT}
     * if from the controller
     * 
     * @param sourcePort the local port the frame's source was learned
     * on, or {@link #NO_PORT}
     * 
     * @param externalDone whether the frame is marked as already
     * flooded to external ports
     * 
     * @return the flood plan
     */
    public FloodPlan plan(FloodContext ctx, int inPort, int sourcePort,
                          boolean externalDone) {
        if (isPruned(ctx, inPort)) return FloodPlan.drop(inPort);
        final PortRoleSets roles = ctx.roles();

        List<FloodAction> toward = new ArrayList<>();
        PortRef chosen = roles.chosen();
        if (chosen != null && chosen.port() != inPort)
            toward.add(FloodAction.output(chosen.port()));

        /* Never flood back to the datapath the frame came from. The
         * root's reflection is explicit. */
        PortRef inPeer = ctx.peerOf(inPort);
        List<FloodAction> away = new ArrayList<>();
        for (PortRef p : roles.activeAway()) {
            if (p.port() == inPort) continue;
            if (inPeer != null
                && ctx.peerOf(p.port()).datapath().equals(inPeer.datapath()))
                continue;
            away.add(FloodAction.output(p.port()));
        }

        boolean skipExternal = ctx.externalRootOnly()
            || (ctx.stackHasExternals() && externalDone)
            || (inPort != NO_PORT && ctx.isExternal(inPort));
        List<FloodAction> local = new ArrayList<>();
        for (int p : ctx.localPorts()) {
            if (p == inPort || p == sourcePort) continue;
            if (skipExternal && ctx.isExternal(p)) continue;
            local.add(FloodAction.output(p));
        }

        return new FloodPlan(inPort, false,
                             strategy.compose(ctx, inPort, toward, away,
                                              local));
    }

    /**
     * Plan flooding for every ingress port of a datapath. There is one
     * plan per up local port, per configured stack port, and for the
     * controller. When external marking is in use, there are two plans
     * per ingress, one for each state of the external mark.
     * 
     * @param ctx the datapath's flood planning inputs
     * 
     * @return the plans, keyed by ingress port and external mark
     */
    public SortedMap<FloodRuleKey, FloodPlan> plans(FloodContext ctx) {
        SortedSet<Integer> ingress = new TreeSet<>();
        ingress.add(NO_PORT);
        ingress.addAll(ctx.localPorts());
        ingress.addAll(ctx.stackPorts());
        List<Boolean> marks = ctx.stackHasExternals()
            ? Arrays.asList(false, true)
            : Collections.singletonList(false);
        SortedMap<FloodRuleKey, FloodPlan> result = new TreeMap<>();
        for (int in : ingress)
            for (boolean done : marks)
                result.put(new FloodRuleKey(in, done),
                           plan(ctx, in, NO_PORT, done));
        return result;
    }

    @Override
    public String toString() {
        return "flood:" + strategy;
    }
}

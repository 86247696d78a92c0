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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.RootStatus;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.config.DatapathConfig;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.events.StackEventSink;
import uk.ac.lancs.stacking.events.StackEvents;
import uk.ac.lancs.stacking.flood.FloodContext;
import uk.ac.lancs.stacking.flood.FloodPolicyEngine;
import uk.ac.lancs.stacking.graph.StackGraph;
import uk.ac.lancs.stacking.link.Keepalive;
import uk.ac.lancs.stacking.link.LinkStateMonitor;
import uk.ac.lancs.stacking.link.PortTransition;
import uk.ac.lancs.stacking.link.StackPort;
import uk.ac.lancs.stacking.metrics.StackMetrics;
import uk.ac.lancs.stacking.roles.PortOrder;
import uk.ac.lancs.stacking.roles.PortRoleClassifier;
import uk.ac.lancs.stacking.roles.PortRoleSets;
import uk.ac.lancs.stacking.roles.StackPaths;
import uk.ac.lancs.stacking.roles.StackView;
import uk.ac.lancs.stacking.root.LagNomination;
import uk.ac.lancs.stacking.root.RootElection;
import uk.ac.lancs.stacking.root.RootState;
import uk.ac.lancs.stacking.rules.FlowRule;
import uk.ac.lancs.stacking.rules.FlowRuleSink;
import uk.ac.lancs.stacking.rules.FlowRuleSynthesizer;
import uk.ac.lancs.stacking.tunnel.TunnelPathResolver;

/**
 * Maintains the stack graph and root of a set of stacked datapaths, and
 * keeps their flood and tunnel rules up to date.
 * 
 * <p>
 * Each externally delivered event is queued, and the queue is drained
 * by the first caller, so a transition raised while handling one event
 * is handled after it rather than within it. Once the queue is empty,
 * port roles of every datapath are recomputed if the graph, the root
 * or any stack port's state has changed. Rules are then regenerated for
 * the datapaths affected, a topology notification is published if
 * warranted, and a new snapshot is taken.
 * 
 * <p>
 * This class is not thread-safe. {@link StackControllerService} confines
 * it to one thread.
 * 
 * @author simpsons
 */
public final class StackCoordinator implements StackView {
    private interface PrettyLogger extends FormattedLogger {
        @Format("%d stack ports changed state")
        @Detail(ShadowLevel.INFO)
        void portsChanged(int count);

        @Format("Stack root changed to %s (previous %s)")
        @Detail(ShadowLevel.INFO)
        void rootChanged(String root, String previous);

        @Format("%s connected with ports %s")
        @Detail(ShadowLevel.INFO)
        void connected(String datapath, Collection<Integer> ports);

        @Format("%s disconnected")
        @Detail(ShadowLevel.INFO)
        void disconnected(String datapath);

        @Format("%s: shortest path to root is via %s")
        @Detail(ShadowLevel.FINE)
        void towards(String datapath, Collection<PortRef> ports);

        @Format("LAG %d nominated on %s")
        @Detail(ShadowLevel.INFO)
        void lagNominated(int lag, LagNomination nomination);

        @Format("LAG %d has no ports up")
        @Detail(ShadowLevel.INFO)
        void lagDown(int lag);

        @Format("event for unknown datapath %s ignored")
        @Detail(ShadowLevel.WARNING)
        void unknownDatapath(String datapath);
    }

    private static final PrettyLogger logger = FormattedLogger
        .get(StackCoordinator.class.getName(), PrettyLogger.class);

    private final StackConfiguration config;
    private final StackMetrics metrics;
    private final StackEventSink events;
    private final FlowRuleSynthesizer rules;
    private final LinkStateMonitor monitor;
    private final StackGraph graph = new StackGraph();
    private final RootElection election;
    private final FloodPolicyEngine flooding;
    private final TunnelPathResolver tunnels;
    private final StackPaths paths;
    private final SortedMap<String, DatapathState> states = new TreeMap<>();
    private final SortedSet<Integer> lagIds = new TreeSet<>();
    private SortedMap<Integer, LagNomination> lags = new TreeMap<>();

    private final Deque<Runnable> queue = new ArrayDeque<>();
    private boolean draining;

    private long computedVersion = -1;
    private boolean rootDirty;
    private boolean notifyTopology;
    private int portChanges;
    private final SortedSet<String> dirty = new TreeSet<>();

    private volatile TopologySnapshot snapshot;

    /**
     * Create a coordinator for a stack. An initial root is chosen from
     * the candidates at once, although none is yet healthy.
     * 
     * @param config the stack's configuration
     * 
     * @param metrics the metrics to record in
     * 
     * @param events the recipient of notifications
     * 
     * @param sink the recipient of rule changes
     * 
     * @param order the order deciding which of several ports is first
     */
    public StackCoordinator(StackConfiguration config, StackMetrics metrics,
                            StackEventSink events, FlowRuleSink sink,
                            Comparator<? super PortRef> order) {
        this.config = config;
        this.metrics = metrics;
        this.events = events;
        this.rules = new FlowRuleSynthesizer(sink, metrics);
        this.monitor = new LinkStateMonitor(config, metrics);
        this.election = new RootElection(config.rootCandidates(),
                                         config.timing().healthInterval());
        this.flooding = FloodPolicyEngine.forDepth(config.declaredDepth());
        this.tunnels = new TunnelPathResolver(this, order);
        this.paths = new StackPaths(this, order);
        for (String name : config.stackedDatapaths()) {
            graph.addDatapath(name);
            states.put(name,
                       new DatapathState(config.datapath(name), monitor,
                                         new PortRoleClassifier(name,
                                                                order)));
            lagIds.addAll(config.datapath(name).lags().values());
        }
        healthCheck(0L);
    }

    /**
     * Create a coordinator for a stack, choosing ports in ascending
     * port-number order.
     * 
     * @param config the stack's configuration
     * 
     * @param metrics the metrics to record in
     * 
     * @param events the recipient of notifications
     * 
     * @param sink the recipient of rule changes
     */
    public StackCoordinator(StackConfiguration config, StackMetrics metrics,
                            StackEventSink events, FlowRuleSink sink) {
        this(config, metrics, events, sink, PortOrder.ASCENDING);
    }

    private void submit(Runnable event) {
        queue.add(event);
        if (draining) return;
        draining = true;
        try {
            Runnable next;
            while ((next = queue.poll()) != null)
                next.run();
            settle();
        } finally {
            draining = false;
        }
    }

    private DatapathState state(String name) {
        DatapathState st = states.get(name);
        if (st == null) logger.unknownDatapath(name);
        return st;
    }

    private void transition(PortTransition t) {
        if (t == null) return;
        queue.add(() -> linkChanged(t));
    }

    private void linkChanged(PortTransition t) {
        portChanges++;
        DatapathConfig dp = config.datapath(t.port().datapath());
        events.publish(StackEvents.stackState(t.port(), dp.id(), t.after()));
        if (t.linkUp())
            graph.addLink(t.port(), t.peer());
        else
            graph.removeLink(t.port(), t.peer());
    }

    /**
     * Record that a datapath has connected to the controller.
     * 
     * @param datapath the datapath name
     * 
     * @param upPorts the datapath's ports that are physically up
     * 
     * @param now the current time in milliseconds
     */
    public void datapathConnected(String datapath,
                                  Collection<Integer> upPorts, long now) {
        submit(() -> {
            DatapathState st = state(datapath);
            if (st == null) return;
            logger.connected(datapath, upPorts);
            st.connect(upPorts, now);
            for (StackPort sp : monitor.portsOf(datapath))
                transition(monitor.physical(sp.local(),
                                            upPorts.contains(sp.local()
                                                .port()),
                                            now));
            rules.forget(datapath);
            dirty.add(datapath);
        });
    }

    /**
     * Record that a datapath has lost contact with the controller. Its
     * stack ports become gone.
     * 
     * @param datapath the datapath name
     * 
     * @param now the current time in milliseconds
     */
    public void datapathDisconnected(String datapath, long now) {
        submit(() -> {
            DatapathState st = state(datapath);
            if (st == null) return;
            logger.disconnected(datapath);
            st.disconnect();
            for (PortTransition t : monitor.disconnect(datapath, now))
                transition(t);
            rules.forget(datapath);
        });
    }

    /**
     * Record that the controller has heard from a datapath.
     * 
     * @param datapath the datapath name
     * 
     * @param now the current time in milliseconds
     */
    public void datapathLive(String datapath, long now) {
        submit(() -> {
            DatapathState st = state(datapath);
            if (st != null) st.live(now);
        });
    }

    /**
     * Process a keepalive probe received by a datapath. The receiving
     * datapath is taken to be live.
     * 
     * @param probe the probe
     */
    public void keepalive(Keepalive probe) {
        submit(() -> {
            DatapathState st = state(probe.receivedOn().datapath());
            if (st == null) return;
            st.live(probe.time());
            transition(monitor.receive(probe));
        });
    }

    /**
     * Process a change in a port's physical status.
     * 
     * @param port the port
     * 
     * @param up whether the port is now up
     * 
     * @param now the current time in milliseconds
     */
    public void portStatus(PortRef port, boolean up, long now) {
        submit(() -> {
            DatapathState st = state(port.datapath());
            if (st == null) return;
            if (monitor.port(port) != null) {
                transition(monitor.physical(port, up, now));
            } else {
                st.localPort(port.port(), up);
                dirty.add(port.datapath());
            }
        });
    }

    /**
     * Record that probes have been sent from all connected datapaths,
     * and expire links that have fallen silent.
     * 
     * @param now the current time in milliseconds
     */
    public void probeTick(long now) {
        submit(() -> {
            List<String> connected = new ArrayList<>();
            for (DatapathState st : states.values())
                if (st.isConnected()) connected.add(st.name());
            for (PortTransition t : monitor.probe(connected, now))
                transition(t);
        });
    }

    /**
     * Re-elect the root.
     * 
     * @param now the current time in milliseconds
     */
    public void healthTick(long now) {
        submit(() -> healthCheck(now));
    }

    private void healthCheck(long now) {
        RootState result = election.elect(states, now);
        if (result.rootChanged()) {
            rootDirty = true;
            if (result.previous() != null)
                metrics.isRoot(result.previous(), false);
            if (result.root() != null) {
                metrics.stackRoot(config.datapath(result.root()).id());
                metrics.isRoot(result.root(), true);
            }
        }
        if (result.stackChange()) {
            logger.rootChanged(result.root(), result.previous());
            rootDirty = true;
            notifyTopology = true;
        }
        if (!draining) settle();
    }

    private void settle() {
        /* A port going up at the second end of a link leaves the graph
         * unchanged, but changes the up set that roles depend on. */
        final boolean portsChanged = portChanges > 0;
        if (portsChanged) {
            logger.portsChanged(portChanges);
            portChanges = 0;
        }
        boolean graphChanged = graph.version() != computedVersion;
        if (graphChanged || rootDirty || portsChanged) {
            if (computedVersion >= 0 && graphChanged) notifyTopology = true;
            recomputeAll();
        } else {
            for (String name : dirty)
                synthesize(states.get(name));
        }
        dirty.clear();
        nominateLags();

        if (notifyTopology) {
            notifyTopology = false;
            SortedMap<String, Integer> hops = new TreeMap<>();
            for (DatapathState st : states.values())
                if (st.isConnected()) hops.put(st.name(), rootHopPort(st));
            events.publish(StackEvents.topologyChange(election.root(), graph,
                                                      hops));
        }
        snapshot = takeSnapshot();
    }

    private void nominateLags() {
        SortedMap<Integer, LagNomination> result = new TreeMap<>();
        for (int lag : lagIds) {
            LagNomination nom =
                LagNomination.nominate(lag, states.values(), election.root());
            LagNomination old = lags.get(lag);
            String was = old == null ? null : old.datapath();
            if (nom == null) {
                if (was != null) logger.lagDown(lag);
                continue;
            }
            result.put(lag, nom);
            if (!Objects.equals(was, nom.datapath()))
                logger.lagNominated(lag, nom);
        }
        lags = result;
    }

    private int rootHopPort(DatapathState st) {
        String root = election.root();
        if (root == null) return 0;
        PortRef hop = paths.shortestPathPort(st.name(), root);
        return hop == null ? 0 : hop.port();
    }

    private void recomputeAll() {
        final String root = election.root();
        for (DatapathState st : states.values()) {
            PortRoleSets roles = st.classifier.recompute(this);
            st.cachedRoot(root);
            metrics.rootHopPort(st.name(), rootHopPort(st));
            if (!roles.chosenTowards().isEmpty())
                logger.towards(st.name(), roles.chosenTowards());
            synthesize(st);
        }
        computedVersion = graph.version();
        rootDirty = false;
    }

    private void synthesize(DatapathState st) {
        if (st == null || !st.isConnected()) return;
        FloodContext ctx = floodContext(st);
        List<FlowRule> wanted = new ArrayList<>();
        wanted.addAll(FlowRuleSynthesizer
            .floodRules(st.name(), flooding.plans(ctx)));
        wanted.addAll(FlowRuleSynthesizer
            .tunnelRules(st.name(), tunnels
                .resolve(st.name(), config.tunnels().values())));
        rules.synthesize(st.name(), wanted);
    }

    private FloodContext floodContext(DatapathState st) {
        return new FloodContext(st.config(), st.classifier.recompute(this),
                                st.localUp(), config.hasExternals());
    }

    private TopologySnapshot takeSnapshot() {
        final String root = election.root();
        SortedMap<String, DatapathStatus> dps = new TreeMap<>();
        for (DatapathState st : states.values()) {
            final RootStatus status;
            if (st.name().equals(root))
                status = RootStatus.CHOSEN;
            else if (st.config().isRootCandidate())
                status = RootStatus.CANDIDATE;
            else
                status = RootStatus.NOT_CONFIGURED;
            SortedMap<Integer, StackState> portStates = new TreeMap<>();
            for (StackPort sp : monitor.portsOf(st.name()))
                portStates.put(sp.local().port(), sp.state());
            dps.put(st.name(),
                    new DatapathStatus(st.name(), st.id(), st.isConnected(),
                                       st.lastLive(), status,
                                       rootHopPort(st),
                                       st.classifier.current(),
                                       portStates,
                                       rules.installed(st.name())));
        }
        return new TopologySnapshot(root, graph, dps, lags);
    }

    /**
     * Get the state of the stack after the last event.
     * 
     * @return the latest snapshot
     */
    public TopologySnapshot snapshot() {
        return snapshot;
    }

    /**
     * Get the current roles of a datapath's stack ports.
     * 
     * @param datapath the datapath name
     * 
     * @return the roles, or {@code null} if the datapath is not
     * stacked
     */
    public PortRoleSets roles(String datapath) {
        DatapathState st = states.get(datapath);
        if (st == null) return null;
        return st.classifier.recompute(this);
    }

    /**
     * Get the current flood planning inputs of a datapath.
     * 
     * @param datapath the datapath name
     * 
     * @return the inputs, or {@code null} if the datapath is not
     * stacked
     */
    public FloodContext floodContext(String datapath) {
        DatapathState st = states.get(datapath);
        if (st == null) return null;
        return floodContext(st);
    }

    /**
     * Get the flood policy in force.
     * 
     * @return the flood policy engine
     */
    public FloodPolicyEngine flooding() {
        return flooding;
    }

    /**
     * Get the stack port state machine.
     * 
     * @return the link state monitor
     */
    public LinkStateMonitor monitor() {
        return monitor;
    }

    /**
     * Get the rules last sent to a datapath.
     * 
     * @param datapath the datapath name
     * 
     * @return the rules keyed by rule key
     */
    public SortedMap<String, FlowRule> installedRules(String datapath) {
        return rules.installed(datapath);
    }

    @Override
    public StackGraph graph() {
        return graph;
    }

    @Override
    public String root() {
        return election.root();
    }

    @Override
    public Collection<PortRef> upPorts(String datapath) {
        List<PortRef> result = new ArrayList<>();
        for (StackPort sp : monitor.portsOf(datapath))
            if (sp.isUp()) result.add(sp.local());
        return result;
    }

    @Override
    public PortRef peerOf(PortRef port) {
        return config.peerOf(port);
    }

    @Override
    public String toString() {
        return "stack root " + election.root() + " graph " + graph;
    }
}

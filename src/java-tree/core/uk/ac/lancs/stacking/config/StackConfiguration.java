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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.graph.StackGraph;

/**
 * Holds a validated stacking configuration. Every stack link is
 * declared from both ends, every stacked datapath is reachable from the
 * default root over declared links, and datapath ids are unique.
 * 
 * @author simpsons
 */
public final class StackConfiguration {
    private final SortedMap<String, DatapathConfig> datapaths;
    private final Map<Long, DatapathConfig> byId = new HashMap<>();
    private final SortedMap<String, TunnelConfig> tunnels;
    private final StackTiming timing;
    private final List<String> rootCandidates;
    private final Map<PortRef, StackPortConfig> stackPorts = new HashMap<>();
    private final StackGraph declared = new StackGraph();
    private final boolean hasExternals;

    /**
     * Orders root candidates by ascending priority, then by name
     */
    public static final Comparator<DatapathConfig> CANDIDATE_ORDER =
        Comparator.comparing(DatapathConfig::priority)
            .thenComparing(DatapathConfig::name);

    private StackConfiguration(Collection<? extends DatapathConfig> datapaths,
                               Collection<? extends TunnelConfig> tunnels,
                               StackTiming timing) {
        SortedMap<String, DatapathConfig> dps = new TreeMap<>();
        for (DatapathConfig dp : datapaths)
            dps.put(dp.name(), dp);
        this.datapaths = Collections.unmodifiableSortedMap(dps);
        SortedMap<String, TunnelConfig> tuns = new TreeMap<>();
        for (TunnelConfig tun : tunnels)
            tuns.put(tun.id(), tun);
        this.tunnels = Collections.unmodifiableSortedMap(tuns);
        this.timing = timing;

        List<DatapathConfig> cands = new ArrayList<>();
        boolean ext = false;
        for (DatapathConfig dp : dps.values()) {
            if (dp.isRootCandidate()) cands.add(dp);
            if (!dp.externalPorts().isEmpty()) ext = true;
            for (StackPortConfig sp : dp.stackPorts().values())
                stackPorts.put(sp.local(), sp);
        }
        this.hasExternals = ext;
        Collections.sort(cands, CANDIDATE_ORDER);
        List<String> names = new ArrayList<>(cands.size());
        for (DatapathConfig dp : cands)
            names.add(dp.name());
        this.rootCandidates = Collections.unmodifiableList(names);
    }

    /**
     * Validate and assemble a stacking configuration.
     * 
     * @param datapaths the datapaths
     * 
     * @param tunnels the tunnels
     * 
     * @param timing the liveness periods
     * 
     * @return the validated configuration
     * 
     * @throws StackConfigurationException if the configuration is
     * inconsistent
     */
    public static StackConfiguration
        create(Collection<? extends DatapathConfig> datapaths,
               Collection<? extends TunnelConfig> tunnels,
               StackTiming timing)
            throws StackConfigurationException {
        StackConfiguration result =
            new StackConfiguration(datapaths, tunnels, timing);
        result.validate();
        return result;
    }

    private void validate() throws StackConfigurationException {
        for (DatapathConfig dp : datapaths.values()) {
            DatapathConfig clash = byId.put(dp.id(), dp);
            if (clash != null)
                throw new StackConfigurationException("dp." + dp.name()
                    + ".id", "id shared with " + clash.name());
        }

        /* Every stack link must be declared identically from both
         * ends. */
        for (DatapathConfig dp : datapaths.values()) {
            declared.addDatapath(dp.name());
            for (StackPortConfig sp : dp.stackPorts().values()) {
                String key = "dp." + dp.name() + ".port."
                    + sp.local().port() + ".stack";
                PortRef peer = sp.peer();
                DatapathConfig peerDp = datapaths.get(peer.datapath());
                if (peerDp == null)
                    throw new StackConfigurationException(key,
                                                          "unknown peer datapath "
                                                              + peer.datapath());
                if (peerDp == dp)
                    throw new StackConfigurationException(key,
                                                          "stack port loops back to "
                                                              + dp.name());
                StackPortConfig reverse = peerDp.stackPort(peer.port());
                if (reverse == null)
                    throw new StackConfigurationException(key, "link to "
                        + peer + " defined only in one direction");
                if (!reverse.peer().equals(sp.local()))
                    throw new StackConfigurationException(key, "peer "
                        + peer + " is declared to reach " + reverse.peer());
                declared.addLink(sp.local(), peer);
            }
        }

        SortedSet<String> stacked = stackedDatapaths();
        if (stacked.isEmpty()) return;
        if (rootCandidates.isEmpty())
            throw new StackConfigurationException(null,
                                                  "stack ports declared, but no root candidate");
        for (String name : rootCandidates) {
            if (!stacked.contains(name))
                throw new StackConfigurationException("dp." + name
                    + ".priority", "root candidate has no stack ports");
        }
        String root = defaultRoot();
        for (String name : stacked) {
            if (declared.shortestPath(name, root).isEmpty())
                throw new StackConfigurationException("dp." + name
                    + ".ports", "not connected to root " + root);
        }

        for (TunnelConfig tun : tunnels.values()) {
            String prefix = "tunnel." + tun.id();
            if (!stacked.contains(tun.source()))
                throw new StackConfigurationException(prefix + ".src",
                                                      "unknown stacked datapath "
                                                          + tun.source());
            PortRef dst = tun.destination();
            DatapathConfig dstDp = datapaths.get(dst.datapath());
            if (dstDp == null || !stacked.contains(dst.datapath()))
                throw new StackConfigurationException(prefix + ".dst",
                                                      "unknown stacked datapath "
                                                          + dst.datapath());
            if (!dstDp.ports().contains(dst.port()))
                throw new StackConfigurationException(prefix + ".dst",
                                                      "unknown port "
                                                          + dst);
        }
    }

    /**
     * Get all datapaths.
     * 
     * @return an immutable map from datapath name to configuration
     */
    public SortedMap<String, DatapathConfig> datapaths() {
        return datapaths;
    }

    /**
     * Get a datapath by name.
     * 
     * @param name the datapath name
     * 
     * @return the datapath's configuration, or {@code null} if unknown
     */
    public DatapathConfig datapath(String name) {
        return datapaths.get(name);
    }

    /**
     * Get a datapath by numeric id.
     * 
     * @param id the datapath id
     * 
     * @return the datapath's configuration, or {@code null} if unknown
     */
    public DatapathConfig datapathById(long id) {
        return byId.get(id);
    }

    /**
     * Get the names of datapaths with at least one stack port.
     * 
     * @return a fresh sorted set of names
     */
    public SortedSet<String> stackedDatapaths() {
        SortedSet<String> result = new TreeSet<>();
        for (DatapathConfig dp : datapaths.values())
            if (dp.isStacked()) result.add(dp.name());
        return result;
    }

    /**
     * Get a stack port by reference.
     * 
     * @param port the port reference
     * 
     * @return the stack port, or {@code null} if the port is not a
     * stack port
     */
    public StackPortConfig stackPort(PortRef port) {
        return stackPorts.get(port);
    }

    /**
     * Get the declared peer of a stack port.
     * 
     * @param port the stack port
     * 
     * @return the peer port
     * 
     * @throws IllegalStateException if the port is not a stack port
     */
    public PortRef peerOf(PortRef port) {
        StackPortConfig sp = stackPorts.get(port);
        if (sp == null)
            throw new IllegalStateException("no peer for " + port);
        return sp.peer();
    }

    /**
     * Get the root candidates.
     * 
     * @return an immutable list of candidate names by ascending
     * priority, ties broken by name
     */
    public List<String> rootCandidates() {
        return rootCandidates;
    }

    /**
     * Get the candidate assumed to be root before any election.
     * 
     * @return the name of the first candidate, or {@code null} if
     * there are none
     */
    public String defaultRoot() {
        return rootCandidates.isEmpty() ? null : rootCandidates.get(0);
    }

    /**
     * Get the number of datapaths in the longest shortest path from the
     * default root, with all declared links up.
     * 
     * @return the declared stack depth in datapaths, or 0 with no
     * root candidate
     */
    public int declaredDepth() {
        String root = defaultRoot();
        if (root == null) return 0;
        return declared.longestPathFrom(root);
    }

    /**
     * Get a copy of the graph with every declared link present.
     * 
     * @return a fresh graph
     */
    public StackGraph declaredGraph() {
        return new StackGraph(declared);
    }

    /**
     * Determine whether any datapath has loop-protected external
     * ports.
     * 
     * @return {@code true} if external ports exist anywhere
     */
    public boolean hasExternals() {
        return hasExternals;
    }

    /**
     * Get the tunnels.
     * 
     * @return an immutable map from tunnel id to configuration
     */
    public SortedMap<String, TunnelConfig> tunnels() {
        return tunnels;
    }

    /**
     * Get the liveness periods.
     * 
     * @return the periods
     */
    public StackTiming timing() {
        return timing;
    }
}

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

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

import uk.ac.lancs.stacking.graph.StackGraph;
import uk.ac.lancs.stacking.root.LagNomination;

/**
 * Captures the stack as it stood after an event was processed.
 * Snapshots are not changed once published, so they may be read from
 * any thread.
 * 
 * @author simpsons
 */
public final class TopologySnapshot {
    private final String root;
    private final StackGraph graph;
    private final SortedMap<String, DatapathStatus> datapaths;
    private final SortedMap<Integer, LagNomination> lags;

    TopologySnapshot(String root, StackGraph graph,
                     SortedMap<String, DatapathStatus> datapaths,
                     SortedMap<Integer, LagNomination> lags) {
        this.root = root;
        this.graph = new StackGraph(graph);
        this.datapaths =
            Collections.unmodifiableSortedMap(new TreeMap<>(datapaths));
        this.lags = Collections.unmodifiableSortedMap(new TreeMap<>(lags));
    }

    /**
     * Get the root.
     * 
     * @return the root's name, or {@code null} if there is none
     */
    public String root() {
        return root;
    }

    /**
     * Get a copy of the stack graph. Callers must not modify it.
     * 
     * @return the stack graph
     */
    public StackGraph graph() {
        return graph;
    }

    /**
     * Get the status of every stacked datapath.
     * 
     * @return the datapath statuses keyed by name
     */
    public SortedMap<String, DatapathStatus> datapaths() {
        return datapaths;
    }

    /**
     * Get the status of a datapath.
     * 
     * @param name the datapath name
     * 
     * @return the datapath's status, or {@code null} if it is not a
     * stacked datapath
     */
    public DatapathStatus datapath(String name) {
        return datapaths.get(name);
    }

    /**
     * Get the datapath nominated to serve each link aggregation group.
     * Groups with no port up anywhere are absent.
     * 
     * @return the nominations keyed by group identifier
     */
    public SortedMap<Integer, LagNomination> lagNominations() {
        return lags;
    }
}

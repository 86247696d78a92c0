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

import uk.ac.lancs.stacking.RootStatus;
import uk.ac.lancs.stacking.StackPlacement;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.roles.PortRoleSets;
import uk.ac.lancs.stacking.rules.FlowRule;

/**
 * Describes one datapath as of a topology snapshot.
 * 
 * @author simpsons
 */
public final class DatapathStatus {
    private final String name;
    private final long id;
    private final boolean connected;
    private final Long lastLive;
    private final RootStatus rootStatus;
    private final int rootHopPort;
    private final PortRoleSets roles;
    private final SortedMap<Integer, StackState> portStates;
    private final SortedMap<String, FlowRule> rules;

    DatapathStatus(String name, long id, boolean connected, Long lastLive,
                   RootStatus rootStatus, int rootHopPort,
                   PortRoleSets roles,
                   SortedMap<Integer, StackState> portStates,
                   SortedMap<String, FlowRule> rules) {
        this.name = name;
        this.id = id;
        this.connected = connected;
        this.lastLive = lastLive;
        this.rootStatus = rootStatus;
        this.rootHopPort = rootHopPort;
        this.roles = roles;
        this.portStates = Collections.unmodifiableSortedMap(portStates);
        this.rules = Collections.unmodifiableSortedMap(new TreeMap<>(rules));
    }

    /**
     * @return the datapath name
     */
    public String name() {
        return name;
    }

    /**
     * @return the datapath id
     */
    public long id() {
        return id;
    }

    /**
     * @return whether the datapath is connected to the controller
     */
    public boolean isConnected() {
        return connected;
    }

    /**
     * @return the last time the datapath was heard from, or
     * {@code null} if never
     */
    public Long lastLive() {
        return lastLive;
    }

    /**
     * @return the datapath's standing in root election
     */
    public RootStatus rootStatus() {
        return rootStatus;
    }

    /**
     * @return the port towards the root, or 0 if none
     */
    public int rootHopPort() {
        return rootHopPort;
    }

    /**
     * @return the datapath's place in the stack
     */
    public StackPlacement placement() {
        return roles.placement();
    }

    /**
     * @return the roles of the datapath's stack ports
     */
    public PortRoleSets roles() {
        return roles;
    }

    /**
     * @return the state of each stack port, keyed by port number
     */
    public SortedMap<Integer, StackState> portStates() {
        return portStates;
    }

    /**
     * @return the rules last sent to the datapath, keyed by rule key
     */
    public SortedMap<String, FlowRule> rules() {
        return rules;
    }
}

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

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.config.DatapathConfig;
import uk.ac.lancs.stacking.config.StackPortConfig;
import uk.ac.lancs.stacking.roles.PortRoleSets;

/**
 * Holds what flood planning needs to know about one datapath at one
 * moment.
 * 
 * @author simpsons
 */
public final class FloodContext {
    private final DatapathConfig config;
    private final PortRoleSets roles;
    private final SortedSet<Integer> localPorts;
    private final boolean stackHasExternals;
    private final Map<Integer, PortRef> peers = new HashMap<>();

    /**
     * Gather flood planning inputs for a datapath.
     * 
     * @param config the datapath's configuration
     * 
     * @param roles the current roles of the datapath's stack ports
     * 
     * @param localUp the datapath's non-stack ports that are
     * currently up
     * 
     * @param stackHasExternals whether any datapath in the stack has
     * external ports
     * 
     * @throws IllegalArgumentException if the roles belong to another
     * datapath
     */
    public FloodContext(DatapathConfig config, PortRoleSets roles,
                        Collection<Integer> localUp,
                        boolean stackHasExternals) {
        if (!config.name().equals(roles.datapath()))
            throw new IllegalArgumentException("roles for "
                + roles.datapath() + " applied to " + config.name());
        this.config = config;
        this.roles = roles;
        this.stackHasExternals = stackHasExternals;
        SortedSet<Integer> local = new TreeSet<>(localUp);
        local.removeAll(config.stackPorts().keySet());
        this.localPorts = Collections.unmodifiableSortedSet(local);
        for (StackPortConfig sp : config.stackPorts().values())
            peers.put(sp.local().port(), sp.peer());
    }

    /**
     * Get the datapath's name.
     * 
     * @return the datapath name
     */
    public String datapath() {
        return config.name();
    }

    /**
     * Refer to one of the datapath's ports.
     * 
     * @param port the port number
     * 
     * @return a reference to the port
     */
    public PortRef ref(int port) {
        return PortRef.of(config.name(), port);
    }

    /**
     * Get the current port roles.
     * 
     * @return the port roles
     */
    public PortRoleSets roles() {
        return roles;
    }

    /**
     * Get the up non-stack ports.
     * 
     * @return the local port numbers
     */
    public SortedSet<Integer> localPorts() {
        return localPorts;
    }

    /**
     * Determine whether a port is a configured stack port.
     * 
     * @param port the port number
     * 
     * @return {@code true} if the port is a stack port
     */
    public boolean isStackPort(int port) {
        return peers.containsKey(port);
    }

    /**
     * Get the peer of a stack port.
     * 
     * @param port the port number
     * 
     * @return the peer, or {@code null} if the port is not a stack
     * port
     */
    public PortRef peerOf(int port) {
        return peers.get(port);
    }

    /**
     * Get the configured stack port numbers.
     * 
     * @return the stack port numbers in ascending order
     */
    public SortedSet<Integer> stackPorts() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(peers.keySet()));
    }

    /**
     * Determine whether a port is a loop-protected external port.
     * 
     * @param port the port number
     * 
     * @return {@code true} if the port is external
     */
    public boolean isExternal(int port) {
        return config.externalPorts().contains(port);
    }

    /**
     * Determine whether this datapath has external ports.
     * 
     * @return {@code true} if the datapath has external ports
     */
    public boolean hasExternals() {
        return !config.externalPorts().isEmpty();
    }

    /**
     * Determine whether any datapath in the stack has external ports,
     * so frames must carry an external mark.
     * 
     * @return {@code true} if external marking is in use
     */
    public boolean stackHasExternals() {
        return stackHasExternals;
    }

    /**
     * Determine whether external ports of this datapath are left for
     * the root to flood to. This applies to root candidates other than
     * the current root while external marking is in use.
     * 
     * @return {@code true} if this datapath never floods to its
     * external ports
     */
    public boolean externalRootOnly() {
        return stackHasExternals && config.isRootCandidate()
            && !roles.isRoot();
    }
}

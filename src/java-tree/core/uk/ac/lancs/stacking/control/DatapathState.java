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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.config.DatapathConfig;
import uk.ac.lancs.stacking.link.LinkStateMonitor;
import uk.ac.lancs.stacking.link.StackPort;
import uk.ac.lancs.stacking.roles.PortRoleClassifier;
import uk.ac.lancs.stacking.root.RootCandidate;

/**
 * Holds the live state of one stacked datapath.
 * 
 * @author simpsons
 */
final class DatapathState implements RootCandidate {
    private final DatapathConfig config;
    private final LinkStateMonitor monitor;
    final PortRoleClassifier classifier;
    private final SortedSet<Integer> localUp = new TreeSet<>();
    private boolean connected;
    private Long lastLive;
    private String cachedRoot;

    DatapathState(DatapathConfig config, LinkStateMonitor monitor,
                  PortRoleClassifier classifier) {
        this.config = config;
        this.monitor = monitor;
        this.classifier = classifier;
    }

    DatapathConfig config() {
        return config;
    }

    void connect(Collection<Integer> upPorts, long now) {
        connected = true;
        localUp.clear();
        for (int p : upPorts)
            if (!config.stackPorts().containsKey(p)) localUp.add(p);
        live(now);
    }

    void disconnect() {
        connected = false;
        localUp.clear();
    }

    boolean isConnected() {
        return connected;
    }

    void live(long now) {
        if (lastLive == null || now > lastLive) lastLive = now;
    }

    void localPort(int port, boolean up) {
        if (up)
            localUp.add(port);
        else
            localUp.remove(port);
    }

    SortedSet<Integer> localUp() {
        return Collections.unmodifiableSortedSet(localUp);
    }

    void cachedRoot(String root) {
        this.cachedRoot = root;
    }

    @Override
    public String name() {
        return config.name();
    }

    @Override
    public long id() {
        return config.id();
    }

    @Override
    public Long lastLive() {
        return lastLive;
    }

    @Override
    public int downTimeMultiple() {
        return config.downTimeMultiple();
    }

    @Override
    public Map<Integer, Integer> lagsUp() {
        Map<Integer, Integer> result = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : config.lags().entrySet()) {
            int port = entry.getKey();
            int lag = entry.getValue();
            int count = result.containsKey(lag) ? result.get(lag) : 0;
            if (portUp(port)) count++;
            result.put(lag, count);
        }
        return result;
    }

    private boolean portUp(int port) {
        if (!connected) return false;
        if (config.stackPorts().containsKey(port)) {
            StackPort sp = monitor.port(PortRef.of(config.name(), port));
            return sp != null && sp.isUp();
        }
        return localUp.contains(port);
    }

    @Override
    public boolean anyStackPortUp() {
        for (StackPort sp : monitor.portsOf(config.name()))
            if (sp.isUp()) return true;
        return false;
    }

    @Override
    public String cachedRoot() {
        return cachedRoot;
    }

    @Override
    public String toString() {
        return config.name() + (connected ? " connected" : " disconnected")
            + " live " + lastLive + " root " + cachedRoot;
    }
}

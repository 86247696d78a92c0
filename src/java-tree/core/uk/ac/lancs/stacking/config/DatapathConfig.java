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

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import uk.ac.lancs.stacking.PortRef;

/**
 * Describes a datapath as configured: its identity, root candidacy and
 * ports.
 * 
 * @author simpsons
 */
public final class DatapathConfig {
    private final String name;
    private final long id;
    private final Integer priority;
    private final int downTimeMultiple;
    private final SortedSet<Integer> ports;
    private final SortedMap<Integer, StackPortConfig> stackPorts;
    private final SortedSet<Integer> externalPorts;
    private final SortedMap<Integer, Integer> lags;

    /**
     * Default multiple of the health-check interval after which a
     * silent root candidate is unhealthy
     */
    public static final int DEFAULT_DOWN_TIME_MULTIPLE = 3;

    private DatapathConfig(Builder builder) {
        this.name = builder.name;
        this.id = builder.id;
        this.priority = builder.priority;
        this.downTimeMultiple = builder.downTimeMultiple;
        this.ports =
            Collections.unmodifiableSortedSet(new TreeSet<>(builder.ports));
        this.stackPorts = Collections
            .unmodifiableSortedMap(new TreeMap<>(builder.stackPorts));
        this.externalPorts = Collections
            .unmodifiableSortedSet(new TreeSet<>(builder.externalPorts));
        this.lags =
            Collections.unmodifiableSortedMap(new TreeMap<>(builder.lags));
    }

    /**
     * Collects the settings of a datapath.
     * 
     * @author simpsons
     */
    public static final class Builder {
        final String name;
        final long id;
        Integer priority;
        int downTimeMultiple = DEFAULT_DOWN_TIME_MULTIPLE;
        final SortedSet<Integer> ports = new TreeSet<>();
        final SortedMap<Integer, StackPortConfig> stackPorts =
            new TreeMap<>();
        final SortedSet<Integer> externalPorts = new TreeSet<>();
        final SortedMap<Integer, Integer> lags = new TreeMap<>();

        Builder(String name, long id) {
            this.name = name;
            this.id = id;
        }

        /**
         * Make the datapath a root candidate.
         * 
         * @param priority the candidacy rank, lower winning
         * 
         * @return this object
         */
        public Builder priority(int priority) {
            if (priority <= 0)
                throw new IllegalArgumentException("priority " + priority);
            this.priority = priority;
            return this;
        }

        /**
         * Set the multiple of the health interval after which a silent
         * candidate is unhealthy.
         * 
         * @param multiple the multiple
         * 
         * @return this object
         */
        public Builder downTimeMultiple(int multiple) {
            if (multiple <= 0)
                throw new IllegalArgumentException("down-time multiple "
                    + multiple);
            this.downTimeMultiple = multiple;
            return this;
        }

        /**
         * Add a port that is not stacked.
         * 
         * @param port the port number
         * 
         * @return this object
         */
        public Builder port(int port) {
            PortRef.of(name, port);
            ports.add(port);
            return this;
        }

        /**
         * Add a stack port.
         * 
         * @param port the port number
         * 
         * @param peer the port it should be cabled to
         * 
         * @return this object
         */
        public Builder stackPort(int port, PortRef peer) {
            port(port);
            stackPorts.put(port,
                           new StackPortConfig(PortRef.of(name, port), peer));
            return this;
        }

        /**
         * Add a loop-protected external port.
         * 
         * @param port the port number
         * 
         * @return this object
         */
        public Builder externalPort(int port) {
            port(port);
            externalPorts.add(port);
            return this;
        }

        /**
         * Place a port in an aggregated-link group.
         * 
         * @param port the port number
         * 
         * @param lag the group identifier
         * 
         * @return this object
         */
        public Builder lag(int port, int lag) {
            port(port);
            lags.put(port, lag);
            return this;
        }

        /**
         * Create the configuration.
         * 
         * @return the datapath configuration
         */
        public DatapathConfig done() {
            return new DatapathConfig(this);
        }
    }

    /**
     * Start describing a datapath.
     * 
     * @param name the datapath name
     * 
     * @param id the numeric datapath id
     * 
     * @return a fresh builder
     */
    public static Builder start(String name, long id) {
        if (name == null) throw new NullPointerException("name");
        return new Builder(name, id);
    }

    /**
     * Get the datapath's name.
     * 
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Get the datapath's numeric id.
     * 
     * @return the id
     */
    public long id() {
        return id;
    }

    /**
     * Get the datapath's root priority.
     * 
     * @return the priority, or {@code null} if the datapath is not a
     * root candidate
     */
    public Integer priority() {
        return priority;
    }

    /**
     * Determine whether the datapath may become root.
     * 
     * @return {@code true} if a priority is configured
     */
    public boolean isRootCandidate() {
        return priority != null;
    }

    /**
     * Get the multiple of the health interval after which a silent
     * candidate is unhealthy.
     * 
     * @return the down-time multiple
     */
    public int downTimeMultiple() {
        return downTimeMultiple;
    }

    /**
     * Get all configured port numbers, stacked or not.
     * 
     * @return an immutable sorted set of port numbers
     */
    public SortedSet<Integer> ports() {
        return ports;
    }

    /**
     * Get the stack ports, indexed by port number.
     * 
     * @return an immutable map of stack ports
     */
    public SortedMap<Integer, StackPortConfig> stackPorts() {
        return stackPorts;
    }

    /**
     * Determine whether the datapath has stack ports.
     * 
     * @return {@code true} if at least one stack port is declared
     */
    public boolean isStacked() {
        return !stackPorts.isEmpty();
    }

    /**
     * Get a stack port.
     * 
     * @param port the port number
     * 
     * @return the stack port, or {@code null} if the port is not a
     * stack port
     */
    public StackPortConfig stackPort(int port) {
        return stackPorts.get(port);
    }

    /**
     * Get the loop-protected external ports.
     * 
     * @return an immutable sorted set of port numbers
     */
    public SortedSet<Integer> externalPorts() {
        return externalPorts;
    }

    /**
     * Get the aggregated-link group of each grouped port.
     * 
     * @return an immutable map from port number to group identifier
     */
    public SortedMap<Integer, Integer> lags() {
        return lags;
    }

    /**
     * Get the ports of an aggregated-link group.
     * 
     * @param lag the group identifier
     * 
     * @return the member port numbers
     */
    public SortedSet<Integer> lagPorts(int lag) {
        SortedSet<Integer> result = new TreeSet<>();
        for (Map.Entry<Integer, Integer> entry : lags.entrySet())
            if (entry.getValue() == lag) result.add(entry.getKey());
        return result;
    }

    @Override
    public String toString() {
        return name + "(0x" + Long.toHexString(id) + ")";
    }
}

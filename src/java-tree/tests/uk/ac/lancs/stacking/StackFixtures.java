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

package uk.ac.lancs.stacking;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Random;

import uk.ac.lancs.config.ConfigurationContext;
import uk.ac.lancs.stacking.config.StackConfigLoader;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.config.StackConfigurationException;
import uk.ac.lancs.stacking.events.StackEvent;
import uk.ac.lancs.stacking.events.StackEventSink;
import uk.ac.lancs.stacking.graph.StackGraph;
import uk.ac.lancs.stacking.graph.StackLink;
import uk.ac.lancs.stacking.link.Keepalive;
import uk.ac.lancs.stacking.roles.StackView;
import uk.ac.lancs.stacking.rules.FlowRuleDelta;
import uk.ac.lancs.stacking.rules.FlowRuleSink;

/**
 * Builds stack configurations and collaborators for tests.
 * 
 * @author simpsons
 */
public final class StackFixtures {
    private StackFixtures() {}

    /**
     * Port of every datapath in a generated stack that leads to the
     * next datapath in sequence
     */
    public static final int NEXT = 1;

    /**
     * Port of every datapath in a generated stack that leads to the
     * previous datapath in sequence
     */
    public static final int PREV = 2;

    /**
     * Local port of every datapath in a generated stack
     */
    public static final int HOST = 10;

    /**
     * Build properties from alternating keys and values.
     * 
     * @param kv keys and values
     * 
     * @return the properties
     */
    public static Properties props(String... kv) {
        Properties result = new Properties();
        for (int i = 0; i + 1 < kv.length; i += 2)
            result.setProperty(kv[i], kv[i + 1]);
        return result;
    }

    /**
     * Load a stacking configuration from properties.
     * 
     * @param props the stacking keys
     * 
     * @return the validated configuration
     * 
     * @throws StackConfigurationException if the configuration is
     * invalid
     */
    public static StackConfiguration load(Properties props)
        throws StackConfigurationException {
        try {
            return StackConfigLoader.load(new ConfigurationContext(new Properties())
                .get(props));
        } catch (IOException ex) {
            throw new AssertionError("unexpected", ex);
        }
    }

    /**
     * Create properties for a ring of datapaths <samp>s1</samp> to
     * <samp>s<var>n</var></samp>, with <samp>s1</samp> the only root
     * candidate. Port {@value #NEXT} of each datapath connects to port
     * {@value #PREV} of the next. Each datapath has a local port
     * {@value #HOST}.
     * 
     * @param n the number of datapaths
     * 
     * @return the stacking keys
     */
    public static Properties ringProps(int n) {
        Properties p = new Properties();
        StringBuilder dps = new StringBuilder();
        for (int i = 1; i <= n; i++) {
            String name = "s" + i;
            String next = "s" + (i % n + 1);
            String prev = "s" + ((i + n - 2) % n + 1);
            dps.append(' ').append(name);
            p.setProperty("dp." + name + ".id", Integer.toString(i));
            p.setProperty("dp." + name + ".ports",
                          NEXT + " " + PREV + " " + HOST);
            p.setProperty("dp." + name + ".port." + NEXT + ".stack",
                          next + ":" + PREV);
            p.setProperty("dp." + name + ".port." + PREV + ".stack",
                          prev + ":" + NEXT);
        }
        p.setProperty("dps", dps.toString().trim());
        p.setProperty("dp.s1.priority", "1");
        return p;
    }

    /**
     * Create a ring configuration.
     * 
     * @param n the number of datapaths
     * 
     * @return the configuration
     * 
     * @throws StackConfigurationException if the configuration is
     * invalid
     */
    public static StackConfiguration ring(int n)
        throws StackConfigurationException {
        return load(ringProps(n));
    }

    /**
     * Create properties for a ring of three datapaths joined by pairs
     * of parallel links, with <samp>s1</samp> the only root candidate.
     * <samp>s1</samp> ports 1 and 2 reach <samp>s2</samp> ports 1 and
     * 2, <samp>s2</samp> ports 3 and 4 reach <samp>s3</samp> ports 3
     * and 4, and <samp>s3</samp> ports 5 and 6 reach <samp>s1</samp>
     * ports 5 and 6. Each datapath has a local port {@value #HOST}.
     * 
     * @return the stacking keys
     */
    public static Properties doubledRingProps() {
        Properties p = props("dps", "s1 s2 s3", "dp.s1.id", "1",
                             "dp.s2.id", "2", "dp.s3.id", "3",
                             "dp.s1.priority", "1",
                             "dp.s1.ports", "1 2 5 6 10",
                             "dp.s2.ports", "1 2 3 4 10",
                             "dp.s3.ports", "3 4 5 6 10");
        pair(p, "s1", "s2", 1);
        pair(p, "s1", "s2", 2);
        pair(p, "s2", "s3", 3);
        pair(p, "s2", "s3", 4);
        pair(p, "s3", "s1", 5);
        pair(p, "s3", "s1", 6);
        return p;
    }

    private static void pair(Properties p, String a, String b, int port) {
        p.setProperty("dp." + a + ".port." + port + ".stack", b + ":" + port);
        p.setProperty("dp." + b + ".port." + port + ".stack", a + ":" + port);
    }

    /**
     * Create a graph with every declared link of a configuration.
     * 
     * @param config the configuration
     * 
     * @return the graph
     */
    public static StackGraph fullGraph(StackConfiguration config) {
        return new StackGraph(config.declaredGraph());
    }

    /**
     * Create a random graph over datapaths <samp>a</samp> to
     * <samp>g</samp>. Pairs are sometimes joined by two links.
     * 
     * @param rng the source of randomness
     * 
     * @return the graph
     */
    public static StackGraph randomGraph(Random rng) {
        StackGraph g = new StackGraph();
        Map<String, Integer> nextPort = new HashMap<>();
        List<String> names = new ArrayList<>();
        for (char c = 'a'; c <= 'g'; c++) {
            names.add(Character.toString(c));
            g.addDatapath(Character.toString(c));
            nextPort.put(Character.toString(c), 1);
        }
        for (int i = 0; i < names.size(); i++) {
            for (int j = i + 1; j < names.size(); j++) {
                int links = rng.nextInt(10) < 3 ? 1 : 0;
                if (links > 0 && rng.nextInt(5) == 0) links++;
                for (int k = 0; k < links; k++) {
                    String x = names.get(i), y = names.get(j);
                    int px = nextPort.put(x, nextPort.get(x) + 1);
                    int py = nextPort.put(y, nextPort.get(y) + 1);
                    g.addLink(PortRef.of(x, px), PortRef.of(y, py));
                }
            }
        }
        return g;
    }

    /**
     * Create a probe as sent by a port to its peer.
     * 
     * @param config the stack configuration
     * 
     * @param sender the sending port
     * 
     * @param receiver the receiving port
     * 
     * @param state the sending port's state
     * 
     * @param time the time of receipt
     * 
     * @return the probe
     */
    public static Keepalive probe(StackConfiguration config, PortRef sender,
                                  PortRef receiver, StackState state,
                                  long time) {
        return new Keepalive(receiver,
                             config.datapath(sender.datapath()).id(),
                             sender.datapath(), sender.port(), state, time);
    }

    /**
     * Presents a fixed graph and root, with every port at the end of a
     * link in the graph taken to be up.
     */
    public static final class GraphView implements StackView {
        private final StackGraph graph;
        private String root;

        /**
         * Create a view.
         * 
         * @param graph the graph
         * 
         * @param root the root
         */
        public GraphView(StackGraph graph, String root) {
            this.graph = graph;
            this.root = root;
        }

        /**
         * Change the root.
         * 
         * @param root the new root
         */
        public void root(String root) {
            this.root = root;
        }

        @Override
        public StackGraph graph() {
            return graph;
        }

        @Override
        public String root() {
            return root;
        }

        @Override
        public Collection<PortRef> upPorts(String datapath) {
            List<PortRef> result = new ArrayList<>();
            for (StackLink link : graph.linksOf(datapath))
                result.add(link.endAt(datapath));
            return result;
        }

        @Override
        public PortRef peerOf(PortRef port) {
            for (StackLink link : graph.linksOf(port.datapath()))
                if (link.endAt(port.datapath()).equals(port))
                    return link.opposite(port);
            throw new IllegalStateException("no peer for " + port);
        }
    }

    /**
     * Records events published to it.
     */
    public static final class EventLog implements StackEventSink {
        /**
         * The events published so far
         */
        public final List<StackEvent> events = new ArrayList<>();

        @Override
        public void publish(StackEvent event) {
            events.add(event);
        }

        /**
         * Count events of a type.
         * 
         * @param type the event type
         * 
         * @return the number of such events
         */
        public int count(StackEvent.Type type) {
            int n = 0;
            for (StackEvent ev : events)
                if (ev.type() == type) n++;
            return n;
        }
    }

    /**
     * Records rule changes sent to it, optionally failing.
     */
    public static final class RuleLog implements FlowRuleSink {
        /**
         * The changes sent so far, with the datapath name
         */
        public final List<FlowRuleDelta> deltas = new ArrayList<>();

        /**
         * Whether sending fails
         */
        public boolean failing;

        @Override
        public void send(String datapath, List<FlowRuleDelta> deltas)
            throws IOException {
            if (failing) throw new IOException("unreachable " + datapath);
            this.deltas.addAll(deltas);
        }
    }
}

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
import java.util.HashSet;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

import uk.ac.lancs.config.Configuration;
import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;
import uk.ac.lancs.stacking.PortRef;

/**
 * Reads a stacking configuration from properties. Keys are relative to
 * the supplied configuration view:
 * 
 * <dl>
 * 
 * <dt><samp>dps</samp>
 * 
 * <dd>Space- or comma-separated datapath names.
 * 
 * <dt><samp>dp.<var>name</var>.id</samp>
 * 
 * <dd>Numeric datapath id, decimal or <samp>0x</samp>-prefixed hex.
 * 
 * <dt><samp>dp.<var>name</var>.priority</samp>
 * 
 * <dd>Positive root priority, lower winning. If absent, the datapath is
 * not a root candidate.
 * 
 * <dt><samp>dp.<var>name</var>.down-time-multiple</samp>
 * 
 * <dd>Multiple of the health interval after which a silent candidate is
 * unhealthy. Default {@value DatapathConfig#DEFAULT_DOWN_TIME_MULTIPLE}.
 * 
 * <dt><samp>dp.<var>name</var>.ports</samp>
 * 
 * <dd>Port numbers of the datapath.
 * 
 * <dt><samp>dp.<var>name</var>.port.<var>n</var>.stack</samp>
 * 
 * <dd><samp><var>peer</var>:<var>port</var></samp> of the port's
 * intended stack peer.
 * 
 * <dt><samp>dp.<var>name</var>.port.<var>n</var>.external</samp>
 * 
 * <dd><samp>true</samp> if the port is a loop-protected external port.
 * 
 * <dt><samp>dp.<var>name</var>.port.<var>n</var>.lag</samp>
 * 
 * <dd>Aggregated-link group of the port.
 * 
 * <dt><samp>tunnels</samp>
 * 
 * <dd>Tunnel ids, each with <samp>tunnel.<var>id</var>.src</samp> (a
 * datapath name) and <samp>tunnel.<var>id</var>.dst</samp>
 * (<samp><var>dp</var>:<var>port</var></samp>).
 * 
 * <dt><samp>timing.probe-interval</samp>,
 * <samp>timing.lost-probes</samp>,
 * <samp>timing.health-interval</samp>
 * 
 * <dd>Liveness periods in seconds, and the lost-probe multiplier.
 * 
 * </dl>
 * 
 * @author simpsons
 */
public final class StackConfigLoader {
    private StackConfigLoader() {}

    /**
     * Load and validate a stacking configuration.
     * 
     * @param conf the configuration view containing the stacking keys
     * 
     * @return the validated configuration
     * 
     * @throws StackConfigurationException if a value is malformed or
     * the configuration is inconsistent
     */
    public static StackConfiguration load(Configuration conf)
        throws StackConfigurationException {
        final String base = conf.prefix();
        List<DatapathConfig> datapaths = new ArrayList<>();
        Collection<String> seen = new HashSet<>();
        for (String name : conf.getList("dps")) {
            if (!seen.add(name))
                throw new StackConfigurationException(base + "dps",
                                                      "duplicate datapath "
                                                          + name);
            datapaths.add(loadDatapath(conf.subview("dp." + name), name,
                                       base + "dp." + name + "."));
        }

        List<TunnelConfig> tunnels = new ArrayList<>();
        for (String id : conf.getList("tunnels")) {
            String prefix = base + "tunnel." + id + ".";
            Configuration tunConf = conf.subview("tunnel." + id);
            String src = require(tunConf, "src", prefix);
            PortRef dst = portRef(require(tunConf, "dst", prefix),
                                  prefix + "dst");
            tunnels.add(new TunnelConfig(id, src, dst));
        }

        Configuration timingConf = conf.subview("timing");
        String tprefix = base + "timing.";
        int probeInterval = positive(timingConf, "probe-interval", tprefix,
                                     StackTiming.DEFAULT_PROBE_INTERVAL);
        int lostProbes = positive(timingConf, "lost-probes", tprefix,
                                  StackTiming.DEFAULT_LOST_PROBES);
        int healthInterval =
            positive(timingConf, "health-interval", tprefix,
                     StackTiming.DEFAULT_HEALTH_INTERVAL);
        StackTiming timing = new StackTiming(probeInterval * 1000L,
                                             lostProbes,
                                             healthInterval * 1000L);

        StackConfiguration result =
            StackConfiguration.create(datapaths, tunnels, timing);
        logger.loaded(datapaths.size(), result.stackedDatapaths().size(),
                      tunnels.size(), result.rootCandidates());
        return result;
    }

    private static DatapathConfig loadDatapath(Configuration dpConf,
                                               String name, String prefix)
        throws StackConfigurationException {
        long id = datapathId(require(dpConf, "id", prefix), prefix + "id");
        DatapathConfig.Builder builder = DatapathConfig.start(name, id);
        if (dpConf.get("priority") != null)
            builder.priority(positive(dpConf, "priority", prefix, 0));
        builder.downTimeMultiple(positive(dpConf, "down-time-multiple",
                                          prefix,
                                          DatapathConfig.DEFAULT_DOWN_TIME_MULTIPLE));

        SortedSet<Integer> listed = new TreeSet<>();
        for (String text : dpConf.getList("ports")) {
            int port = integer(text, prefix + "ports");
            if (port <= 0 || !listed.add(port))
                throw new StackConfigurationException(prefix + "ports",
                                                      "bad or repeated port "
                                                          + text);
            String pprefix = prefix + "port." + port + ".";
            Configuration portConf = dpConf.subview("port." + port);
            String stack = portConf.get("stack");
            boolean external =
                Boolean.parseBoolean(portConf.get("external", "false"));
            if (stack != null) {
                if (external)
                    throw new StackConfigurationException(pprefix
                        + "external", "stack port cannot be external");
                builder.stackPort(port, portRef(stack, pprefix + "stack"));
            } else if (external) {
                builder.externalPort(port);
            } else {
                builder.port(port);
            }
            String lag = portConf.get("lag");
            if (lag != null) builder.lag(port, integer(lag, pprefix + "lag"));
        }

        /* Reject settings for ports that were not listed. */
        for (String key : dpConf.selectedKeys(k -> k.startsWith("port."))) {
            String[] parts = key.split("\\.", 3);
            if (parts.length < 3) continue;
            Integer port = null;
            try {
                port = Integer.valueOf(parts[1]);
            } catch (NumberFormatException ex) {
                /* Reported below as unlisted. */
            }
            if (port == null || !listed.contains(port))
                throw new StackConfigurationException(prefix + key,
                                                      "port not listed in "
                                                          + prefix + "ports");
        }
        return builder.done();
    }

    private static String require(Configuration conf, String key,
                                  String prefix)
        throws StackConfigurationException {
        String value = conf.get(key);
        if (value == null || value.trim().isEmpty())
            throw new StackConfigurationException(prefix + key, "missing");
        return value.trim();
    }

    private static int integer(String text, String key)
        throws StackConfigurationException {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException ex) {
            throw new StackConfigurationException(key, "not an integer: "
                + text, ex);
        }
    }

    private static int positive(Configuration conf, String key,
                                String prefix, int defaultValue)
        throws StackConfigurationException {
        String text = conf.get(key);
        if (text == null) return defaultValue;
        int value = integer(text, prefix + key);
        if (value <= 0)
            throw new StackConfigurationException(prefix + key,
                                                  "not positive: " + text);
        return value;
    }

    private static long datapathId(String text, String key)
        throws StackConfigurationException {
        try {
            if (text.startsWith("0x") || text.startsWith("0X"))
                return Long.parseUnsignedLong(text.substring(2), 16);
            return Long.parseUnsignedLong(text);
        } catch (NumberFormatException ex) {
            throw new StackConfigurationException(key, "bad datapath id: "
                + text, ex);
        }
    }

    private static PortRef portRef(String text, String key)
        throws StackConfigurationException {
        try {
            return PortRef.parse(text);
        } catch (IllegalArgumentException ex) {
            throw new StackConfigurationException(key, ex.getMessage(), ex);
        }
    }

    private interface PrettyLogger extends FormattedLogger {
        @Format("loaded %d datapaths (%d stacked), %d tunnels;"
            + " root candidates %s")
        @Detail(ShadowLevel.CONFIG)
        void loaded(int datapaths, int stacked, int tunnels,
                    List<String> candidates);
    }

    private static final PrettyLogger logger = FormattedLogger
        .get(StackConfigLoader.class.getName(), PrettyLogger.class);
}

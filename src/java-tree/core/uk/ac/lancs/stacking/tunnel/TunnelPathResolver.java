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

package uk.ac.lancs.stacking.tunnel;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.config.TunnelConfig;
import uk.ac.lancs.stacking.roles.StackPaths;
import uk.ac.lancs.stacking.roles.StackView;

/**
 * Resolves the output port of each datapath along a tunnel. A datapath
 * on the shortest path from the tunnel's source to its destination
 * forwards along that path, and the destination outputs to the
 * tunnel's port. Other datapaths have no part in the tunnel.
 * 
 * <p>
 * Results depend only on the graph and up ports at the time of the
 * call, so callers re-resolve every tunnel whenever either changes. A
 * link enters the graph when one end comes up. Until the other end
 * follows, the datapath at that end has no output for tunnels crossing
 * the link.
 * 
 * @author simpsons
 */
public final class TunnelPathResolver {
    private interface PrettyLogger extends FormattedLogger {
        @Format("tunnel %s on %s outputs to %s")
        @Detail(ShadowLevel.FINE)
        void resolved(String tunnel, String datapath, Integer port);
    }

    private static final PrettyLogger logger = FormattedLogger
        .get(TunnelPathResolver.class.getName(), PrettyLogger.class);

    private final StackView view;
    private final StackPaths paths;

    /**
     * Create a resolver over a view of the stack.
     * 
     * @param view the current graph, root and port states
     * 
     * @param order the order deciding which of several parallel ports
     * is used
     */
    public TunnelPathResolver(StackView view,
                              Comparator<? super PortRef> order) {
        this.view = view;
        this.paths = new StackPaths(view, order);
    }

    /**
     * Get the port a datapath outputs tunnelled traffic to.
     * 
     * @param self the datapath forwarding the traffic
     * 
     * @param src the tunnel's source datapath
     * 
     * @param dst the tunnel's destination datapath
     * 
     * @param dstPort the port on the destination datapath that the
     * tunnel ends at
     * 
     * @return the output port number, or {@code null} if the
     * datapath is not on a path from source to destination, or if the
     * next hop's link is in the graph but its port at this end is not
     * yet up
     */
    public Integer outputPort(String self, String src, String dst,
                              int dstPort) {
        List<String> path = view.graph().shortestPath(src, dst);
        if (src.equals(dst) && self.equals(dst)) return dstPort;
        if (!path.contains(self)) return null;
        if (self.equals(dst)) return dstPort;
        PortRef out = paths.shortestPathPort(self, dst);
        return out == null ? null : out.port();
    }

    /**
     * Resolve the output ports of a datapath for several tunnels.
     * 
     * @param self the datapath forwarding the traffic
     * 
     * @param tunnels the tunnels to resolve
     * 
     * @return the output port of each tunnel the datapath takes part
     * in, keyed by tunnel id
     */
    public SortedMap<String, Integer>
        resolve(String self, Collection<? extends TunnelConfig> tunnels) {
        SortedMap<String, Integer> result = new TreeMap<>();
        for (TunnelConfig tun : tunnels) {
            Integer port = outputPort(self, tun.source(),
                                      tun.destination().datapath(),
                                      tun.destination().port());
            logger.resolved(tun.id(), self, port);
            if (port != null) result.put(tun.id(), port);
        }
        return result;
    }
}

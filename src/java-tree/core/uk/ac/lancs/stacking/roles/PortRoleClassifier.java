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

package uk.ac.lancs.stacking.roles;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import uk.ac.lancs.logging.Detail;
import uk.ac.lancs.logging.Format;
import uk.ac.lancs.logging.FormattedLogger;
import uk.ac.lancs.logging.ShadowLevel;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackPlacement;
import uk.ac.lancs.stacking.graph.StackGraph;

/**
 * Classifies the up stack ports of one datapath by their relation to
 * the root. The last result is retained, and returned again if the
 * graph, root and up ports are unchanged.
 * 
 * <p>
 * On the root, every up port is an away port. Elsewhere, the ports
 * whose peers are nearest the root are towards-root ports, and the
 * rest are away. Of the towards-root ports, those leading to the next
 * hop on this datapath's own path to the root are chosen, and the
 * first of them is the single root-ward port. An away port is inactive
 * if its peer does not reach the root through this datapath. Of
 * several away ports reaching the same peer datapath, all but the one
 * reaching the peer's first port are pruned.
 * 
 * @author simpsons
 */
public final class PortRoleClassifier {
    private interface PrettyLogger extends FormattedLogger {
        @Format("%s has no path to root %s")
        @Detail(ShadowLevel.INFO)
        void noPathToRoot(String datapath, String root);
    }

    private static final PrettyLogger logger = FormattedLogger
        .get(PortRoleClassifier.class.getName(), PrettyLogger.class);

    private final String datapath;
    private final Comparator<? super PortRef> order;

    private StackGraph memoGraph;
    private List<Object> memoKey;
    private PortRoleSets memo;

    /**
     * Create a classifier for a datapath.
     * 
     * @param datapath the datapath name
     * 
     * @param order the order deciding which of several ports is first
     */
    public PortRoleClassifier(String datapath,
                              Comparator<? super PortRef> order) {
        if (datapath == null) throw new NullPointerException("datapath");
        if (order == null) throw new NullPointerException("order");
        this.datapath = datapath;
        this.order = order;
    }

    /**
     * Create a classifier for a datapath, choosing ports in ascending
     * port-number order.
     * 
     * @param datapath the datapath name
     */
    public PortRoleClassifier(String datapath) {
        this(datapath, PortOrder.ASCENDING);
    }

    /**
     * Get the datapath this classifier serves.
     * 
     * @return the datapath name
     */
    public String datapath() {
        return datapath;
    }

    /**
     * Get the last computed roles.
     * 
     * @return the last roles, or {@code null} if none have been
     * computed
     */
    public PortRoleSets current() {
        return memo;
    }

    /**
     * Classify the datapath's up stack ports against a view of the
     * stack.
     * 
     * @param view the current graph, root and port states
     * 
     * @return the port roles
     */
    public PortRoleSets recompute(StackView view) {
        final StackGraph graph = view.graph();
        final String root = view.root();
        final SortedSet<PortRef> up = new TreeSet<>(order);
        up.addAll(view.upPorts(datapath));

        List<Object> key = Arrays.asList(graph.version(), root, up);
        if (memo != null && memoGraph == graph && key.equals(memoKey))
            return memo;

        PortRoleSets result = classify(view, graph, root, up);
        memoGraph = graph;
        memoKey = key;
        memo = result;
        return result;
    }

    private PortRoleSets classify(StackView view, StackGraph graph,
                                  String root, SortedSet<PortRef> up) {
        SortedSet<PortRef> towards = new TreeSet<>(order);
        SortedSet<PortRef> chosenTowards = new TreeSet<>(order);
        SortedSet<PortRef> away = new TreeSet<>(order);
        SortedSet<PortRef> inactive = new TreeSet<>(order);
        PortRef chosen = null;
        final List<String> path;
        final StackPlacement placement;

        if (root == null) {
            path = Collections.emptyList();
            placement = StackPlacement.PENDING;
        } else if (root.equals(datapath)) {
            path = Collections.singletonList(datapath);
            placement = StackPlacement.ROOT;
        } else {
            path = graph.shortestPath(datapath, root);
            if (path.isEmpty()) {
                logger.noPathToRoot(datapath, root);
                placement = StackPlacement.PENDING;
            } else if (path.size() == graph.longestPathFrom(root)) {
                placement = StackPlacement.EDGE;
            } else {
                placement = StackPlacement.TRANSIT;
            }
        }

        if (placement == StackPlacement.EDGE
            || placement == StackPlacement.TRANSIT) {
            /* Find the ports whose peers are nearest the root. Peers
             * that do not reach the root are never towards it. */
            Map<PortRef, Integer> distances = new HashMap<>();
            int best = Integer.MAX_VALUE;
            for (PortRef p : up) {
                String peerDp = view.peerOf(p).datapath();
                int len = graph.shortestPath(peerDp, root).size();
                if (len == 0) continue;
                distances.put(p, len);
                best = Math.min(best, len);
            }
            for (Map.Entry<PortRef, Integer> entry : distances.entrySet())
                if (entry.getValue() == best) towards.add(entry.getKey());

            if (!towards.isEmpty()) {
                String chosenPeer = path.size() > 1 ? path.get(1)
                    : view.peerOf(towards.first()).datapath();
                for (PortRef p : towards)
                    if (view.peerOf(p).datapath().equals(chosenPeer))
                        chosenTowards.add(p);
                if (chosenTowards.isEmpty()) {
                    /* The path's next hop is not reached by a usable
                     * port, so fall back on the first towards port. */
                    chosenPeer = view.peerOf(towards.first()).datapath();
                    for (PortRef p : towards)
                        if (view.peerOf(p).datapath().equals(chosenPeer))
                            chosenTowards.add(p);
                }
                chosen = chosenTowards.first();
            }
        }

        away.addAll(up);
        away.removeAll(towards);

        /* An away port is active only if its peer reaches the root
         * through us. */
        for (PortRef p : away) {
            String peerDp = view.peerOf(p).datapath();
            if (root == null || !graph.isInPath(datapath, peerDp, root))
                inactive.add(p);
        }

        SortedSet<PortRef> pruned = prune(view, away);

        return new PortRoleSets(datapath, root, placement,
                                new ArrayList<>(path), towards,
                                chosenTowards, chosen, away, inactive,
                                pruned);
    }

    /* Of the away ports reaching each peer datapath, keep only the one
     * whose remote end comes first. */
    private SortedSet<PortRef> prune(StackView view,
                                     SortedSet<PortRef> away) {
        Map<String, PortRef> keptRemote = new HashMap<>();
        for (PortRef p : away) {
            PortRef remote = view.peerOf(p);
            PortRef kept = keptRemote.get(remote.datapath());
            if (kept == null || order.compare(remote, kept) < 0)
                keptRemote.put(remote.datapath(), remote);
        }
        SortedSet<PortRef> pruned = new TreeSet<>(order);
        for (PortRef p : away) {
            PortRef remote = view.peerOf(p);
            if (!remote.equals(keptRemote.get(remote.datapath())))
                pruned.add(p);
        }
        return pruned;
    }
}

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

package uk.ac.lancs.stacking.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import uk.ac.lancs.stacking.PortRef;

/**
 * Records which stack links are currently usable, as an undirected
 * multigraph over datapath names. Parallel links between the same pair
 * of datapaths are distinct, as each is keyed by its pair of ports.
 * 
 * <p>
 * Datapaths are held in an arena: each name maps to an index, and
 * per-index sets record the incident links. Shortest paths are found
 * by breadth-first search from the destination, and ties are broken by
 * stepping to the neighbour with the lexicographically least name, so
 * every caller obtains the same path for the same pair.
 * 
 * <p>
 * This class is not thread-safe. Use {@link #StackGraph(StackGraph)}
 * to obtain a snapshot for use by other threads.
 * 
 * @author simpsons
 */
public final class StackGraph {
    private final Map<String, Integer> index = new HashMap<>();
    private final List<String> names = new ArrayList<>();
    private final List<SortedSet<StackLink>> incident = new ArrayList<>();
    private final SortedSet<StackLink> links = new TreeSet<>();
    private final Map<Integer, int[]> distanceCache = new HashMap<>();
    private long version;

    /**
     * Create an empty graph.
     */
    public StackGraph() {}

    /**
     * Copy a graph. The copy has the same version as the original.
     * 
     * @param other the graph to copy
     */
    public StackGraph(StackGraph other) {
        for (String name : other.names)
            addDatapath(name);
        for (StackLink link : other.links)
            insert(link);
        this.version = other.version;
    }

    /**
     * Ensure that a datapath is a vertex of the graph, even if it has
     * no links.
     * 
     * @param name the datapath name
     * 
     * @return {@code true} if the datapath was not already present
     */
    public boolean addDatapath(String name) {
        if (name == null) throw new NullPointerException("name");
        if (index.containsKey(name)) return false;
        index.put(name, names.size());
        names.add(name);
        incident.add(new TreeSet<>());
        changed();
        return true;
    }

    /**
     * Add a link between two ports. Adding a link already present, from
     * either end, has no effect.
     * 
     * @param end one end of the link
     * 
     * @param peer the other end of the link
     * 
     * @return {@code true} if the link was not already present
     */
    public boolean addLink(PortRef end, PortRef peer) {
        StackLink link = StackLink.of(end, peer);
        if (links.contains(link)) return false;
        addDatapath(end.datapath());
        addDatapath(peer.datapath());
        insert(link);
        changed();
        return true;
    }

    private void insert(StackLink link) {
        links.add(link);
        incident.get(index.get(link.first().datapath())).add(link);
        incident.get(index.get(link.second().datapath())).add(link);
    }

    /**
     * Remove a link between two ports. The datapaths remain in the
     * graph.
     * 
     * @param end one end of the link
     * 
     * @param peer the other end of the link
     * 
     * @return {@code true} if the link was present
     */
    public boolean removeLink(PortRef end, PortRef peer) {
        StackLink link = StackLink.of(end, peer);
        if (!links.remove(link)) return false;
        incident.get(index.get(link.first().datapath())).remove(link);
        incident.get(index.get(link.second().datapath())).remove(link);
        changed();
        return true;
    }

    private void changed() {
        version++;
        distanceCache.clear();
    }

    /**
     * Determine whether a link is present.
     * 
     * @param end one end of the link
     * 
     * @param peer the other end of the link
     * 
     * @return {@code true} if the link is present
     */
    public boolean contains(PortRef end, PortRef peer) {
        return links.contains(StackLink.of(end, peer));
    }

    /**
     * Determine whether a datapath is a vertex of the graph.
     * 
     * @param name the datapath name
     * 
     * @return {@code true} if the datapath is present
     */
    public boolean contains(String name) {
        return index.containsKey(name);
    }

    /**
     * Get the datapaths of the graph.
     * 
     * @return an immutable sorted set of datapath names
     */
    public SortedSet<String> datapaths() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(names));
    }

    /**
     * Get the links of the graph.
     * 
     * @return an unmodifiable view of the links in canonical order
     */
    public SortedSet<StackLink> links() {
        return Collections.unmodifiableSortedSet(links);
    }

    /**
     * Get the links touching a datapath.
     * 
     * @param name the datapath name
     * 
     * @return an unmodifiable view of the datapath's links, empty if
     * the datapath is unknown
     */
    public SortedSet<StackLink> linksOf(String name) {
        Integer i = index.get(name);
        if (i == null) return Collections.emptySortedSet();
        return Collections.unmodifiableSortedSet(incident.get(i));
    }

    /**
     * Get the datapaths adjacent to a datapath.
     * 
     * @param name the datapath name
     * 
     * @return the names of adjacent datapaths in lexicographic order
     */
    public SortedSet<String> neighbours(String name) {
        SortedSet<String> result = new TreeSet<>();
        for (StackLink link : linksOf(name))
            result.add(link.opposite(link.endAt(name)).datapath());
        return result;
    }

    /**
     * Get the number of links touching a datapath. Parallel links each
     * count.
     * 
     * @param name the datapath name
     * 
     * @return the datapath's degree
     */
    public int degree(String name) {
        return linksOf(name).size();
    }

    /**
     * Get every port that is an end of a link in the graph.
     * 
     * @return a fresh sorted set of ports
     */
    public SortedSet<PortRef> allUpPorts() {
        SortedSet<PortRef> result = new TreeSet<>();
        for (StackLink link : links) {
            result.add(link.first());
            result.add(link.second());
        }
        return result;
    }

    private int[] distancesTo(int dst) {
        int[] cached = distanceCache.get(dst);
        if (cached != null) return cached;
        int[] dist = new int[names.size()];
        Arrays.fill(dist, -1);
        dist[dst] = 0;
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(dst);
        while (!queue.isEmpty()) {
            int v = queue.remove();
            for (String n : neighbours(names.get(v))) {
                int ni = index.get(n);
                if (dist[ni] >= 0) continue;
                dist[ni] = dist[v] + 1;
                queue.add(ni);
            }
        }
        distanceCache.put(dst, dist);
        return dist;
    }

    /**
     * Get the shortest path between two datapaths. Of several shortest
     * paths, the one whose sequence of names is lexicographically least
     * is chosen.
     * 
     * @param src the starting datapath
     * 
     * @param dst the finishing datapath
     * 
     * @return an immutable list of datapath names starting with the
     * source and ending with the destination, a singleton if they are
     * the same, or an empty list if either is unknown or the
     * destination is unreachable
     */
    public List<String> shortestPath(String src, String dst) {
        Integer si = index.get(src);
        Integer di = index.get(dst);
        if (si == null || di == null) return Collections.emptyList();
        int[] dist = distancesTo(di);
        if (dist[si] < 0) return Collections.emptyList();

        List<String> path = new ArrayList<>(dist[si] + 1);
        String cur = src;
        path.add(cur);
        while (!cur.equals(dst)) {
            int want = dist[index.get(cur)] - 1;
            String next = null;
            for (String n : neighbours(cur)) {
                if (dist[index.get(n)] != want) continue;
                next = n;
                break;
            }
            assert next != null;
            cur = next;
            path.add(cur);
        }
        return Collections.unmodifiableList(path);
    }

    /**
     * Determine whether a datapath lies on the shortest path between
     * two others.
     * 
     * @param name the datapath to look for
     * 
     * @param src the starting datapath
     * 
     * @param dst the finishing datapath
     * 
     * @return {@code true} if the path exists and includes the
     * datapath
     */
    public boolean isInPath(String name, String src, String dst) {
        return shortestPath(src, dst).contains(name);
    }

    /**
     * Get the number of datapaths in the longest of the shortest paths
     * from a datapath to all others.
     * 
     * @param root the datapath to measure from
     * 
     * @return the largest path length in datapaths, or 0 if the
     * datapath is unknown
     */
    public int longestPathFrom(String root) {
        Integer ri = index.get(root);
        if (ri == null) return 0;
        int max = -1;
        for (int d : distancesTo(ri))
            max = Math.max(max, d);
        return max + 1;
    }

    /**
     * Get a counter that increases on every change.
     * 
     * @return the graph version
     */
    public long version() {
        return version;
    }

    /**
     * Compute a hash over the degrees of all datapaths. Graphs with
     * the same datapaths and degrees have the same hash.
     * 
     * @return the topology hash
     */
    public int topologyHash() {
        List<String> degrees = new ArrayList<>();
        for (String name : new TreeSet<>(names))
            degrees.add(name + "=" + degree(name));
        return degrees.hashCode();
    }

    @Override
    public String toString() {
        return datapaths() + links.toString();
    }
}

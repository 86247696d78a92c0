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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackFixtures;

public class StackGraphTest {
    private static PortRef p(String dp, int port) {
        return PortRef.of(dp, port);
    }

    @Test
    public void linksAreUndirected() {
        StackGraph g = new StackGraph();
        assertTrue(g.addLink(p("s1", 1), p("s2", 2)));
        assertFalse(g.addLink(p("s2", 2), p("s1", 1)));
        assertTrue(g.contains(p("s2", 2), p("s1", 1)));
        assertEquals(1, g.links().size());
        assertEquals(1, g.degree("s1"));
        assertEquals(Collections.singleton("s2"), g.neighbours("s1"));
    }

    @Test
    public void removalKeepsDatapaths() {
        StackGraph g = new StackGraph();
        g.addLink(p("s1", 1), p("s2", 2));
        long v = g.version();
        assertTrue(g.removeLink(p("s2", 2), p("s1", 1)));
        assertTrue(g.version() > v);
        assertFalse(g.removeLink(p("s1", 1), p("s2", 2)));
        assertTrue(g.contains("s1"));
        assertTrue(g.contains("s2"));
        assertEquals(0, g.degree("s1"));
        assertTrue(g.shortestPath("s1", "s2").isEmpty());
    }

    @Test
    public void parallelLinksCountSeparately() {
        StackGraph g = new StackGraph();
        g.addLink(p("s1", 1), p("s2", 1));
        g.addLink(p("s1", 2), p("s2", 2));
        assertEquals(2, g.degree("s1"));
        assertEquals(1, g.neighbours("s1").size());
        assertEquals(4, g.allUpPorts().size());
    }

    @Test
    public void shortestPathPrefersLeastNames() throws Exception {
        StackGraph g = StackFixtures.ring(4).declaredGraph();
        assertEquals(Arrays.asList("s1", "s2", "s3"),
                     g.shortestPath("s1", "s3"));
        assertEquals(Arrays.asList("s3", "s2", "s1"),
                     g.shortestPath("s3", "s1"));
        assertEquals(Collections.singletonList("s1"),
                     g.shortestPath("s1", "s1"));
        assertTrue(g.shortestPath("s1", "nowhere").isEmpty());
        assertTrue(g.isInPath("s2", "s1", "s3"));
        assertFalse(g.isInPath("s4", "s1", "s3"));
    }

    @Test
    public void longestPathCountsDatapaths() throws Exception {
        assertEquals(2, StackFixtures.ring(3).declaredGraph()
            .longestPathFrom("s1"));
        assertEquals(3, StackFixtures.ring(4).declaredGraph()
            .longestPathFrom("s1"));
        assertEquals(4, StackFixtures.ring(6).declaredGraph()
            .longestPathFrom("s1"));
        assertEquals(0, new StackGraph().longestPathFrom("s1"));
    }

    @Test
    public void pathsFollowLinkRemoval() throws Exception {
        StackGraph g = StackFixtures.ring(4).declaredGraph();
        g.removeLink(p("s1", 1), p("s2", 2));
        assertEquals(Arrays.asList("s1", "s4", "s3", "s2"),
                     g.shortestPath("s1", "s2"));
        assertEquals(4, g.longestPathFrom("s1"));
    }

    @Test
    public void copyIsIndependent() {
        StackGraph g = new StackGraph();
        g.addLink(p("s1", 1), p("s2", 2));
        StackGraph copy = new StackGraph(g);
        g.removeLink(p("s1", 1), p("s2", 2));
        assertTrue(copy.contains(p("s1", 1), p("s2", 2)));
        assertEquals(1, copy.degree("s2"));
    }

    @Test
    public void hashTracksDegrees() {
        StackGraph a = new StackGraph();
        a.addLink(p("s1", 1), p("s2", 2));
        StackGraph b = new StackGraph();
        b.addLink(p("s1", 5), p("s2", 6));
        assertEquals(a.topologyHash(), b.topologyHash());
        b.addLink(p("s1", 7), p("s2", 8));
        assertNotEquals(a.topologyHash(), b.topologyHash());
    }

    private static int compareSequences(List<String> a, List<String> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    }

    private static void allSimplePaths(StackGraph g, List<String> sofar,
                                       String dst,
                                       List<List<String>> found) {
        String cur = sofar.get(sofar.size() - 1);
        if (cur.equals(dst)) {
            found.add(new ArrayList<>(sofar));
            return;
        }
        for (String n : g.neighbours(cur)) {
            if (sofar.contains(n)) continue;
            sofar.add(n);
            allSimplePaths(g, sofar, dst, found);
            sofar.remove(sofar.size() - 1);
        }
    }

    /* Every datapath must compute the same path, so among equally
     * short paths the least sequence of names wins. */
    @Test
    public void pathsAreShortestAndLeast() {
        Random rng = new Random(20190318L);
        for (int round = 0; round < 40; round++) {
            StackGraph g = StackFixtures.randomGraph(rng);
            for (String src : g.datapaths()) {
                for (String dst : g.datapaths()) {
                    List<List<String>> found = new ArrayList<>();
                    List<String> start = new ArrayList<>();
                    start.add(src);
                    allSimplePaths(g, start, dst, found);

                    List<String> best = null;
                    for (List<String> cand : found) {
                        if (best == null || cand.size() < best.size()
                            || (cand.size() == best.size()
                                && compareSequences(cand, best) < 0))
                            best = cand;
                    }
                    List<String> expected = best == null
                        ? Collections.<String>emptyList() : best;
                    assertEquals(expected, g.shortestPath(src, dst),
                                 "round " + round + " " + src + " to "
                                     + dst + " in " + g);
                }
            }
        }
    }
}

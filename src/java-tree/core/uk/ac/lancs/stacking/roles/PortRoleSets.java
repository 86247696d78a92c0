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

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackPlacement;

/**
 * Partitions a datapath's up stack ports by their relation to the
 * root. Instances are immutable, and equal when all sets are equal.
 * 
 * @author simpsons
 */
public final class PortRoleSets {
    private final String datapath;
    private final String root;
    private final StackPlacement placement;
    private final List<String> pathToRoot;
    private final SortedSet<PortRef> towards;
    private final SortedSet<PortRef> chosenTowards;
    private final PortRef chosen;
    private final SortedSet<PortRef> away;
    private final SortedSet<PortRef> inactiveAway;
    private final SortedSet<PortRef> prunedAway;

    PortRoleSets(String datapath, String root, StackPlacement placement,
                 List<String> pathToRoot, SortedSet<PortRef> towards,
                 SortedSet<PortRef> chosenTowards, PortRef chosen,
                 SortedSet<PortRef> away, SortedSet<PortRef> inactiveAway,
                 SortedSet<PortRef> prunedAway) {
        this.datapath = datapath;
        this.root = root;
        this.placement = placement;
        this.pathToRoot = Collections.unmodifiableList(pathToRoot);
        this.towards = Collections.unmodifiableSortedSet(towards);
        this.chosenTowards = Collections.unmodifiableSortedSet(chosenTowards);
        this.chosen = chosen;
        this.away = Collections.unmodifiableSortedSet(away);
        this.inactiveAway = Collections.unmodifiableSortedSet(inactiveAway);
        this.prunedAway = Collections.unmodifiableSortedSet(prunedAway);
    }

    /**
     * Get the datapath these roles belong to.
     * 
     * @return the datapath name
     */
    public String datapath() {
        return datapath;
    }

    /**
     * Get the root these roles were computed against.
     * 
     * @return the root's name, or {@code null} if there was none
     */
    public String root() {
        return root;
    }

    /**
     * Get the datapath's place in the stack.
     * 
     * @return the placement
     */
    public StackPlacement placement() {
        return placement;
    }

    /**
     * Get the datapath's shortest path to the root.
     * 
     * @return the path, starting with this datapath, or empty if there
     * is none
     */
    public List<String> pathToRoot() {
        return pathToRoot;
    }

    /**
     * Get the ports whose peers are nearest the root.
     * 
     * @return the towards-root ports
     */
    public SortedSet<PortRef> towards() {
        return towards;
    }

    /**
     * Get the towards-root ports leading to the next hop on the path to
     * the root.
     * 
     * @return the chosen towards-root ports
     */
    public SortedSet<PortRef> chosenTowards() {
        return chosenTowards;
    }

    /**
     * Get the single port used for root-ward traffic.
     * 
     * @return the chosen port, or {@code null} if this datapath is
     * the root or has no path to it
     */
    public PortRef chosen() {
        return chosen;
    }

    /**
     * Get the up ports that are not towards the root.
     * 
     * @return the away ports
     */
    public SortedSet<PortRef> away() {
        return away;
    }

    /**
     * Get the away ports whose peers do not reach the root through
     * this datapath.
     * 
     * @return the inactive away ports
     */
    public SortedSet<PortRef> inactiveAway() {
        return inactiveAway;
    }

    /**
     * Get the away ports that duplicate a kept link to the same peer.
     * 
     * @return the pruned away ports
     */
    public SortedSet<PortRef> prunedAway() {
        return prunedAway;
    }

    /**
     * Get the away ports that carry flooded traffic, neither inactive
     * nor pruned.
     * 
     * @return a fresh set of active away ports
     */
    public SortedSet<PortRef> activeAway() {
        SortedSet<PortRef> result = new TreeSet<>(away);
        result.removeAll(inactiveAway);
        result.removeAll(prunedAway);
        return result;
    }

    /**
     * Determine whether the datapath is the root.
     * 
     * @return {@code true} if the datapath is the root
     */
    public boolean isRoot() {
        return placement == StackPlacement.ROOT;
    }

    /**
     * Determine whether the datapath is at the edge of the stack.
     * 
     * @return {@code true} if the datapath is an edge
     */
    public boolean isEdge() {
        return placement == StackPlacement.EDGE;
    }

    @Override
    public int hashCode() {
        return Objects.hash(datapath, root, placement, pathToRoot, towards,
                            chosenTowards, chosen, away, inactiveAway,
                            prunedAway);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PortRoleSets)) return false;
        PortRoleSets other = (PortRoleSets) obj;
        return datapath.equals(other.datapath)
            && Objects.equals(root, other.root)
            && placement == other.placement
            && pathToRoot.equals(other.pathToRoot)
            && towards.equals(other.towards)
            && chosenTowards.equals(other.chosenTowards)
            && Objects.equals(chosen, other.chosen)
            && away.equals(other.away)
            && inactiveAway.equals(other.inactiveAway)
            && prunedAway.equals(other.prunedAway);
    }

    @Override
    public String toString() {
        return datapath + "[" + placement + " root=" + root + " towards="
            + towards + " chosen=" + chosen + " away=" + away + " inactive="
            + inactiveAway + " pruned=" + prunedAway + "]";
    }
}

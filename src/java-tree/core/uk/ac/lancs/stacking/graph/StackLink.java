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

import uk.ac.lancs.stacking.PortRef;

/**
 * Describes an undirected stack link between two datapath ports and is
 * suitable as a hash key. The ends are held in a canonical order, the
 * lesser {@link PortRef} first, so the same physical link has the same
 * representation regardless of which end reports it.
 * 
 * @author simpsons
 */
public final class StackLink implements Comparable<StackLink> {
    private final PortRef first, second;

    private StackLink(PortRef first, PortRef second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Create a link between two ports. The supplied arguments are
     * canonicalized, and so might not match the eventual field values.
     * 
     * @param end one end of the link
     * 
     * @param peer the other end of the link
     * 
     * @return the canonical link between the two ports
     * 
     * @throws NullPointerException if either end is {@code null}
     * 
     * @throws IllegalArgumentException if both ends are on the same
     * datapath
     * 
     * @constructor
     */
    public static StackLink of(PortRef end, PortRef peer) {
        if (end == null) throw new NullPointerException("end");
        if (peer == null) throw new NullPointerException("peer");
        if (end.datapath().equals(peer.datapath()))
            throw new IllegalArgumentException("link " + end + " to " + peer
                + " loops on one datapath");
        if (end.compareTo(peer) < 0) return new StackLink(end, peer);
        return new StackLink(peer, end);
    }

    /**
     * Get the lesser end of the link.
     * 
     * @return the end that sorts first
     */
    public PortRef first() {
        return first;
    }

    /**
     * Get the greater end of the link.
     * 
     * @return the end that sorts second
     */
    public PortRef second() {
        return second;
    }

    /**
     * Get the end of this link on a given datapath.
     * 
     * @param datapath the datapath name
     * 
     * @return the end on that datapath, or {@code null} if the link
     * does not touch it
     */
    public PortRef endAt(String datapath) {
        if (first.datapath().equals(datapath)) return first;
        if (second.datapath().equals(datapath)) return second;
        return null;
    }

    /**
     * Get the end opposite to a given end.
     * 
     * @param end one of the link's ends
     * 
     * @return the other end
     * 
     * @throws IllegalArgumentException if the supplied end does not
     * belong to this link
     */
    public PortRef opposite(PortRef end) {
        if (first.equals(end)) return second;
        if (second.equals(end)) return first;
        throw new IllegalArgumentException(end + " not on " + this);
    }

    /**
     * Get the key of this link, which is also its string form.
     * 
     * @return <samp><var>dp</var>:<var>port</var>-<var>dp</var>:<var>port</var></samp>,
     * lesser end first
     */
    public String key() {
        return first + "-" + second;
    }

    @Override
    public int compareTo(StackLink other) {
        int rc = first.compareTo(other.first);
        if (rc != 0) return rc;
        return second.compareTo(other.second);
    }

    @Override
    public int hashCode() {
        return first.hashCode() * 31 + second.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof StackLink)) return false;
        StackLink other = (StackLink) obj;
        return first.equals(other.first) && second.equals(other.second);
    }

    @Override
    public String toString() {
        return key();
    }
}

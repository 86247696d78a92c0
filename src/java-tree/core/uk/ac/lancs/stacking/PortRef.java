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

/**
 * Identifies a port of a named datapath. References order by datapath
 * name, then by port number.
 * 
 * @author simpsons
 */
public final class PortRef implements Comparable<PortRef> {
    private final String datapath;
    private final int port;

    private PortRef(String datapath, int port) {
        this.datapath = datapath;
        this.port = port;
    }

    /**
     * Refer to a datapath's port.
     * 
     * @param datapath the datapath name
     * 
     * @param port the port number
     * 
     * @return the requested reference
     * 
     * @throws NullPointerException if the datapath name is
     * {@code null}
     * 
     * @throws IllegalArgumentException if the port number is not
     * positive
     * 
     * @constructor
     */
    public static PortRef of(String datapath, int port) {
        if (datapath == null) throw new NullPointerException("datapath");
        if (port <= 0)
            throw new IllegalArgumentException("bad port number " + port
                + " on " + datapath);
        return new PortRef(datapath, port);
    }

    /**
     * Parse a reference of the form <samp><var>dp</var>:<var>port</var></samp>.
     * 
     * @param text the text to parse
     * 
     * @return the parsed reference
     * 
     * @throws IllegalArgumentException if the text is malformed
     * 
     * @constructor
     */
    public static PortRef parse(String text) {
        int colon = text.lastIndexOf(':');
        if (colon <= 0 || colon == text.length() - 1)
            throw new IllegalArgumentException("not dp:port: " + text);
        try {
            return of(text.substring(0, colon).trim(),
                      Integer.parseInt(text.substring(colon + 1).trim()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("not dp:port: " + text, ex);
        }
    }

    /**
     * Get the datapath name.
     * 
     * @return the datapath name
     */
    public String datapath() {
        return datapath;
    }

    /**
     * Get the port number.
     * 
     * @return the port number
     */
    public int port() {
        return port;
    }

    @Override
    public int compareTo(PortRef other) {
        int rc = datapath.compareTo(other.datapath);
        if (rc != 0) return rc;
        return Integer.compare(port, other.port);
    }

    @Override
    public int hashCode() {
        return datapath.hashCode() * 31 + port;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PortRef)) return false;
        PortRef other = (PortRef) obj;
        return port == other.port && datapath.equals(other.datapath);
    }

    /**
     * Get the string representation of this reference.
     * 
     * @return <samp><var>dp</var>:<var>port</var></samp>
     */
    @Override
    public String toString() {
        return datapath + ":" + port;
    }
}

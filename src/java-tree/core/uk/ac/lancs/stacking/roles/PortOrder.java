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

import java.util.Collection;
import java.util.Comparator;

import uk.ac.lancs.stacking.PortRef;

/**
 * Defines which port is canonically first among several. The chosen
 * root-ward port and the kept link of a parallel group are the first
 * in this order.
 * 
 * @author simpsons
 */
public final class PortOrder {
    private PortOrder() {}

    /**
     * Orders ports by ascending port number, then by datapath name
     */
    public static final Comparator<PortRef> ASCENDING = Comparator
        .comparingInt(PortRef::port).thenComparing(PortRef::datapath);

    /**
     * Get the first of a collection of ports.
     * 
     * @param order the order to apply
     * 
     * @param ports the candidate ports
     * 
     * @return the first port, or {@code null} if there are none
     */
    public static PortRef first(Comparator<? super PortRef> order,
                                Collection<? extends PortRef> ports) {
        PortRef best = null;
        for (PortRef p : ports)
            if (best == null || order.compare(p, best) < 0) best = p;
        return best;
    }
}

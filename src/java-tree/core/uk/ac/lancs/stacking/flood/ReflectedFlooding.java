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

package uk.ac.lancs.stacking.flood;

import java.util.ArrayList;
import java.util.List;

/**
 * Floods in a stack deeper than one hop by reflecting off the root.
 * 
 * <p>
 * A non-root datapath sends locally originated frames only towards the
 * root, and passes frames from further away on towards the root
 * without flooding them. The root floods to every active away port,
 * and sends the frame back out of the port it came in on. A frame
 * arriving from the root-ward side is flooded locally and onward to
 * datapaths further away, and never back towards the root.
 * 
 * @author simpsons
 */
public final class ReflectedFlooding implements FloodStrategy {
    @Override
    public List<FloodAction> compose(FloodContext ctx, int inPort,
                                     List<FloodAction> toward,
                                     List<FloodAction> away,
                                     List<FloodAction> local) {
        final boolean marking = ctx.stackHasExternals();
        List<FloodAction> result = new ArrayList<>();

        if (ctx.roles().isRoot()) {
            if (marking)
                result.add(ctx.hasExternals() ? FloodAction.SET_NO_EXTERNAL
                    : FloodAction.SET_EXTERNAL);
            result.addAll(away);
            if (inPort != 0 && ctx.isStackPort(inPort))
                result.add(FloodAction.OUTPUT_IN_PORT);
            result.addAll(local);
            return result;
        }

        if (inPort != 0 && ctx.isStackPort(inPort)) {
            /* Towards-root ports that are not chosen drop floods before
             * they get here, so any non-away stack port is from the
             * root side. */
            if (ctx.roles().away().contains(ctx.ref(inPort))) {
                result.addAll(toward);
                return result;
            }
            if (marking) result.add(FloodAction.SET_NO_EXTERNAL);
            result.addAll(away);
            result.addAll(local);
            return result;
        }

        if (marking) {
            boolean done = inPort == 0 ? ctx.hasExternals()
                : ctx.isExternal(inPort);
            result.add(done ? FloodAction.SET_NO_EXTERNAL
                : FloodAction.SET_EXTERNAL);
        }
        result.addAll(toward);
        return result;
    }

    @Override
    public boolean reflects() {
        return true;
    }

    @Override
    public String toString() {
        return "reflected";
    }
}

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
 * Floods in a stack where every datapath is adjacent to the root. Each
 * datapath floods in every direction except back whence the frame
 * came.
 * 
 * @author simpsons
 */
public final class DirectFlooding implements FloodStrategy {
    @Override
    public List<FloodAction> compose(FloodContext ctx, int inPort,
                                     List<FloodAction> toward,
                                     List<FloodAction> away,
                                     List<FloodAction> local) {
        List<FloodAction> result = new ArrayList<>();
        if (ctx.stackHasExternals() && inPort != 0
            && !ctx.isStackPort(inPort))
            result.add(ctx.hasExternals() ? FloodAction.SET_NO_EXTERNAL
                : FloodAction.SET_EXTERNAL);
        result.addAll(toward);
        result.addAll(away);
        result.addAll(local);
        return result;
    }

    @Override
    public boolean reflects() {
        return false;
    }

    @Override
    public String toString() {
        return "direct";
    }
}

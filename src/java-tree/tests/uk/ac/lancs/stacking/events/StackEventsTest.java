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

package uk.ac.lancs.stacking.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;

import javax.json.JsonArray;
import javax.json.JsonObject;

import org.junit.jupiter.api.Test;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.graph.StackGraph;

public class StackEventsTest {
    @Test
    public void portStateEvent() {
        StackEvent ev =
            StackEvents.stackState(PortRef.of("s1", 3), 1L, StackState.UP);
        assertEquals(StackEvent.Type.STACK_STATE, ev.type());
        JsonObject json = ev.toJson();
        assertEquals("s1", json.getString("dp_name"));
        assertEquals(1L, json.getJsonNumber("dp_id").longValue());
        JsonObject body = json.getJsonObject("STACK_STATE");
        assertEquals(3, body.getInt("port"));
        assertEquals(StackState.UP.code(), body.getInt("state"));
    }

    @Test
    public void topologyEvent() {
        StackGraph g = new StackGraph();
        g.addLink(PortRef.of("s2", 2), PortRef.of("s1", 1));
        g.addDatapath("s3");
        StackEvent ev = StackEvents
            .topologyChange("s1", g, Collections.singletonMap("s2", 2));
        assertNull(ev.datapath());
        JsonObject json = ev.toJson();
        assertFalse(json.containsKey("dp_name"));
        JsonObject body = json.getJsonObject("STACK_TOPO_CHANGE");
        assertEquals("s1", body.getString("stack_root"));
        assertEquals(2, body.getJsonObject("dps").getJsonObject("s2")
            .getInt("root_hop_port"));

        JsonObject graph = body.getJsonObject("graph");
        assertFalse(graph.getBoolean("directed"));
        assertTrue(graph.getBoolean("multigraph"));
        assertEquals(3, graph.getJsonArray("nodes").size());
        JsonArray links = graph.getJsonArray("links");
        assertEquals(1, links.size());
        JsonObject map = links.getJsonObject(0).getJsonObject("port_map");
        assertEquals("s1", map.getString("dp_a"));
        assertEquals(1, map.getInt("port_a"));
        assertEquals("s2", map.getString("dp_z"));
        assertEquals(2, map.getInt("port_z"));
    }

    @Test
    public void missingRootIsNull() {
        StackEvent ev = StackEvents.topologyChange(null, new StackGraph(),
                                                   Collections
                                                       .<String, Integer>emptyMap());
        assertTrue(ev.body().isNull("stack_root"));
    }
}

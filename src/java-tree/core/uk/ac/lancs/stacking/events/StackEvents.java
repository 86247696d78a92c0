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

import java.util.Map;

import javax.json.Json;
import javax.json.JsonArrayBuilder;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;

import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.graph.StackGraph;
import uk.ac.lancs.stacking.graph.StackLink;

/**
 * Builds stack notifications.
 * 
 * @author simpsons
 */
public final class StackEvents {
    private StackEvents() {}

    /**
     * Announce a stack port's new state.
     * 
     * @param port the port
     * 
     * @param datapathId the id of the port's datapath
     * 
     * @param state the port's new state
     * 
     * @return the notification
     */
    public static StackEvent stackState(PortRef port, long datapathId,
                                        StackState state) {
        JsonObject body = Json.createObjectBuilder()
            .add("port", port.port()).add("state", state.code()).build();
        return new StackEvent(StackEvent.Type.STACK_STATE, port.datapath(),
                              datapathId, body);
    }

    /**
     * Announce a new stack graph or root.
     * 
     * @param root the current root, or {@code null} if none
     * 
     * @param graph the current stack graph
     * 
     * @param rootHopPorts the port each datapath uses to reach the
     * root, 0 if none, keyed by datapath name
     * 
     * @return the notification
     */
    public static StackEvent topologyChange(String root, StackGraph graph,
                                            Map<String, Integer> rootHopPorts) {
        JsonObjectBuilder dps = Json.createObjectBuilder();
        for (Map.Entry<String, Integer> entry : rootHopPorts.entrySet())
            dps.add(entry.getKey(), Json.createObjectBuilder()
                .add("root_hop_port", entry.getValue()));
        JsonObjectBuilder body = Json.createObjectBuilder();
        if (root == null)
            body.addNull("stack_root");
        else
            body.add("stack_root", root);
        body.add("graph", nodeLink(graph));
        body.add("dps", dps);
        return new StackEvent(StackEvent.Type.STACK_TOPO_CHANGE, null, null,
                              body.build());
    }

    /**
     * Express a stack graph as an undirected multigraph in node-link
     * form. Each link is keyed by its canonical name, and carries a
     * port map giving its two ends.
     * 
     * @param graph the graph to express
     * 
     * @return the graph as JSON
     */
    public static JsonObject nodeLink(StackGraph graph) {
        JsonArrayBuilder nodes = Json.createArrayBuilder();
        for (String dp : graph.datapaths())
            nodes.add(Json.createObjectBuilder().add("id", dp));
        JsonArrayBuilder links = Json.createArrayBuilder();
        for (StackLink link : graph.links()) {
            PortRef a = link.first();
            PortRef z = link.second();
            links.add(Json.createObjectBuilder()
                .add("source", a.datapath()).add("target", z.datapath())
                .add("key", link.key())
                .add("port_map", Json.createObjectBuilder()
                    .add("dp_a", a.datapath()).add("port_a", a.port())
                    .add("dp_z", z.datapath()).add("port_z", z.port())));
        }
        return Json.createObjectBuilder().add("directed", false)
            .add("multigraph", true)
            .add("graph", Json.createObjectBuilder())
            .add("nodes", nodes).add("links", links).build();
    }
}

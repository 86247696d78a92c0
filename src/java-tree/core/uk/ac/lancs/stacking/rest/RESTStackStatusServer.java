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

package uk.ac.lancs.stacking.rest;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.function.Supplier;

import javax.json.Json;
import javax.json.JsonArrayBuilder;
import javax.json.JsonObjectBuilder;
import javax.json.JsonStructure;
import javax.json.JsonWriter;
import javax.json.JsonWriterFactory;

import org.apache.http.HttpEntity;
import org.apache.http.HttpException;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.protocol.HttpContext;

import uk.ac.lancs.rest.RESTContext;
import uk.ac.lancs.rest.RESTField;
import uk.ac.lancs.rest.RESTRegistration;
import uk.ac.lancs.rest.RESTRequestHandlerMapper;
import uk.ac.lancs.stacking.PortRef;
import uk.ac.lancs.stacking.RootStatus;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.control.DatapathStatus;
import uk.ac.lancs.stacking.control.TopologySnapshot;
import uk.ac.lancs.stacking.events.StackEvents;
import uk.ac.lancs.stacking.flood.FloodAction;
import uk.ac.lancs.stacking.roles.PortRoleSets;
import uk.ac.lancs.stacking.root.LagNomination;
import uk.ac.lancs.stacking.rules.FlowRule;

/**
 * Implements a read-only REST API reporting stack status. Use
 * {@link #bind(RESTRequestHandlerMapper, String)} to attach it to an
 * HTTP server.
 * 
 * <p>
 * The following requests are defined:
 * 
 * <dl>
 * 
 * <dt><code>GET <var>prefix</var>/root</code>
 * 
 * <dd>Yield an object giving the current root's name
 * <samp>root</samp> and id <samp>root-dpid</samp>, and the candidates
 * in order of preference <samp>candidates</samp>. The root fields are
 * null if there is no root. A field <samp>lags</samp> maps each link
 * aggregation group with a port up to the datapath nominated to serve
 * it, giving <samp>dp</samp>, <samp>dpid</samp> and
 * <samp>reason</samp>.
 * 
 * <dt><code>GET <var>prefix</var>/graph</code>
 * 
 * <dd>Yield the stack graph in node-link form, with an additional
 * field <samp>topology-hash</samp>.
 * 
 * <dt><code>GET <var>prefix</var>/dp/<var>name</var></code>
 * 
 * <dd>Yield the status of the named datapath, including the state and
 * role of each stack port, and the actions of each rule last sent to it
 * under <samp>rules</samp>. The response is 404 if the datapath is not
 * stacked.
 * 
 * </dl>
 * 
 * <p>
 * The <samp><var>prefix</var></samp> should begin with a forward slash
 * but not end in one, for example, <samp>/stack</samp>.
 * 
 * @author simpsons
 */
public class RESTStackStatusServer {
    private static final ContentType JSON =
        ContentType.create("application/json", StandardCharsets.UTF_8);

    private static final RESTField<String> DP =
        RESTField.ofString().from("dp").done();

    private final Supplier<? extends TopologySnapshot> status;

    /**
     * Create a REST adaptation of stack status.
     * 
     * @param status a source of the latest stack snapshot
     */
    public RESTStackStatusServer(Supplier<? extends TopologySnapshot> status) {
        this.status = status;
    }

    /**
     * Bind this status server to a prefix in a mapper.
     * 
     * @param mapper the mapper consulted by the HTTP server
     * 
     * @param prefix the path prefix, e.g., <samp>/stack</samp>
     */
    public void bind(RESTRequestHandlerMapper mapper, String prefix) {
        RESTRegistration.start().on("GET").at(prefix + "/root")
            .register(mapper, this::getRoot);
        RESTRegistration.start().on("GET").at(prefix + "/graph")
            .register(mapper, this::getGraph);
        RESTRegistration.start().on("GET")
            .at(prefix + "/dp/(?<dp>[^/]+)").with(DP)
            .register(mapper, this::getDatapath);
    }

    private void getRoot(HttpRequest request, HttpResponse response,
                         HttpContext context, RESTContext rest)
        throws HttpException,
            IOException {
        TopologySnapshot snap = status.get();
        JsonObjectBuilder rsp = Json.createObjectBuilder();
        DatapathStatus root =
            snap.root() == null ? null : snap.datapath(snap.root());
        if (root == null) {
            rsp.addNull("root");
            rsp.addNull("root-dpid");
        } else {
            rsp.add("root", root.name());
            rsp.add("root-dpid", root.id());
        }
        JsonArrayBuilder candidates = Json.createArrayBuilder();
        for (DatapathStatus dp : snap.datapaths().values())
            if (dp.rootStatus() != RootStatus.NOT_CONFIGURED)
                candidates.add(dp.name());
        rsp.add("candidates", candidates);
        JsonObjectBuilder lags = Json.createObjectBuilder();
        for (Map.Entry<Integer, LagNomination> entry : snap.lagNominations()
            .entrySet()) {
            LagNomination nom = entry.getValue();
            lags.add(Integer.toString(entry.getKey()),
                     Json.createObjectBuilder().add("dp", nom.datapath())
                         .add("dpid", nom.id()).add("reason", nom.reason()));
        }
        rsp.add("lags", lags);
        setResponseObject(response, rsp.build());
        response.setStatusCode(HttpStatus.SC_OK);
    }

    private void getGraph(HttpRequest request, HttpResponse response,
                          HttpContext context, RESTContext rest)
        throws HttpException,
            IOException {
        TopologySnapshot snap = status.get();
        JsonObjectBuilder rsp = Json
            .createObjectBuilder(StackEvents.nodeLink(snap.graph()));
        rsp.add("topology-hash", snap.graph().topologyHash());
        setResponseObject(response, rsp.build());
        response.setStatusCode(HttpStatus.SC_OK);
    }

    private void getDatapath(HttpRequest request, HttpResponse response,
                             HttpContext context, RESTContext rest)
        throws HttpException,
            IOException {
        String name = rest.get(DP);
        DatapathStatus dp = status.get().datapath(name);
        if (dp == null) {
            response.setStatusCode(HttpStatus.SC_NOT_FOUND);
            return;
        }
        PortRoleSets roles = dp.roles();
        JsonArrayBuilder ports = Json.createArrayBuilder();
        for (Map.Entry<Integer, StackState> entry : dp.portStates()
            .entrySet()) {
            PortRef ref = PortRef.of(dp.name(), entry.getKey());
            ports.add(Json.createObjectBuilder().add("port", entry.getKey())
                .add("state", entry.getValue().toString())
                .add("role", roleOf(roles, ref)));
        }
        JsonObjectBuilder rsp = Json.createObjectBuilder()
            .add("name", dp.name()).add("dpid", dp.id())
            .add("connected", dp.isConnected())
            .add("root-status", dp.rootStatus().toString())
            .add("placement", dp.placement().toString())
            .add("root-hop-port", dp.rootHopPort()).add("ports", ports)
            .add("towards", portList(roles.towards()))
            .add("away", portList(roles.away()))
            .add("inactive", portList(roles.inactiveAway()))
            .add("pruned", portList(roles.prunedAway()));
        if (roles.chosen() == null)
            rsp.addNull("chosen");
        else
            rsp.add("chosen", roles.chosen().port());
        JsonObjectBuilder rules = Json.createObjectBuilder();
        for (FlowRule rule : dp.rules().values()) {
            JsonArrayBuilder actions = Json.createArrayBuilder();
            for (FloodAction action : rule.actions())
                actions.add(action.toString());
            rules.add(rule.key(), actions);
        }
        rsp.add("rules", rules);
        setResponseObject(response, rsp.build());
        response.setStatusCode(HttpStatus.SC_OK);
    }

    private static String roleOf(PortRoleSets roles, PortRef port) {
        if (port.equals(roles.chosen())) return "chosen";
        if (roles.towards().contains(port)) return "towards";
        if (roles.prunedAway().contains(port)) return "pruned";
        if (roles.inactiveAway().contains(port)) return "inactive";
        if (roles.away().contains(port)) return "away";
        return "down";
    }

    private static JsonArrayBuilder portList(Collection<PortRef> ports) {
        JsonArrayBuilder result = Json.createArrayBuilder();
        for (PortRef p : ports)
            result.add(p.port());
        return result;
    }

    private void setResponseObject(HttpResponse response, JsonStructure rsp) {
        final JsonWriterFactory factory =
            Json.createWriterFactory(Collections.emptyMap());
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (JsonWriter writer =
            factory.createWriter(buffer, StandardCharsets.UTF_8)) {
            writer.write(rsp);
        }
        byte[] buf = buffer.toByteArray();
        HttpEntity entity = new ByteArrayEntity(buf, JSON);
        response.setEntity(entity);
    }
}

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.util.Arrays;

import javax.json.Json;
import javax.json.JsonObject;
import javax.json.JsonReader;

import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.HttpVersion;
import org.apache.http.message.BasicHttpRequest;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.protocol.BasicHttpContext;
import org.apache.http.protocol.HttpRequestHandler;
import org.apache.http.util.EntityUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import uk.ac.lancs.rest.RESTRequestHandlerMapper;
import uk.ac.lancs.stacking.StackFixtures;
import uk.ac.lancs.stacking.StackState;
import uk.ac.lancs.stacking.config.DatapathConfig;
import uk.ac.lancs.stacking.config.StackConfiguration;
import uk.ac.lancs.stacking.config.StackPortConfig;
import uk.ac.lancs.stacking.control.StackCoordinator;
import uk.ac.lancs.stacking.metrics.StackMetrics;

public class RESTStackStatusServerTest {
    private RESTRequestHandlerMapper mapper;

    @BeforeEach
    public void setUp() throws Exception {
        StackConfiguration config = StackFixtures.ring(4);
        StackCoordinator coord =
            new StackCoordinator(config,
                                 new StackMetrics(new SimpleMeterRegistry()),
                                 new StackFixtures.EventLog(),
                                 new StackFixtures.RuleLog());
        for (String dp : config.stackedDatapaths())
            coord.datapathConnected(dp, Arrays.asList(1, 2, 10), 0L);
        coord.probeTick(0L);
        for (DatapathConfig dp : config.datapaths().values())
            for (StackPortConfig sp : dp.stackPorts().values())
                coord.keepalive(StackFixtures.probe(config, sp.peer(),
                                                    sp.local(),
                                                    StackState.INIT, 1000L));
        mapper = new RESTRequestHandlerMapper();
        new RESTStackStatusServer(coord::snapshot).bind(mapper, "/stack");
    }

    private HttpResponse get(String path) throws Exception {
        BasicHttpRequest req = new BasicHttpRequest("GET", path);
        HttpRequestHandler handler = mapper.lookup(req);
        assertNotNull(handler, path);
        HttpResponse rsp =
            new BasicHttpResponse(HttpVersion.HTTP_1_1, HttpStatus.SC_OK,
                                  "OK");
        handler.handle(req, rsp, new BasicHttpContext());
        return rsp;
    }

    private JsonObject body(HttpResponse rsp) throws Exception {
        try (JsonReader in = Json.createReader(new StringReader(EntityUtils
            .toString(rsp.getEntity())))) {
            return in.readObject();
        }
    }

    @Test
    public void root() throws Exception {
        JsonObject rsp = body(get("/stack/root"));
        assertEquals("s1", rsp.getString("root"));
        assertEquals(1L, rsp.getJsonNumber("root-dpid").longValue());
        assertEquals(1, rsp.getJsonArray("candidates").size());
        assertTrue(rsp.getJsonObject("lags").isEmpty());
    }

    @Test
    public void graph() throws Exception {
        JsonObject rsp = body(get("/stack/graph/"));
        assertEquals(4, rsp.getJsonArray("nodes").size());
        assertEquals(4, rsp.getJsonArray("links").size());
        assertTrue(rsp.containsKey("topology-hash"));
    }

    @Test
    public void datapath() throws Exception {
        JsonObject rsp = body(get("/stack/dp/s4"));
        assertEquals("s4", rsp.getString("name"));
        assertEquals("TRANSIT", rsp.getString("placement"));
        assertEquals(1, rsp.getInt("chosen"));
        assertEquals(1, rsp.getInt("root-hop-port"));
        assertEquals(2, rsp.getJsonArray("inactive").getInt(0));
        JsonObject port2 = rsp.getJsonArray("ports").getJsonObject(1);
        assertEquals(2, port2.getInt("port"));
        assertEquals("UP", port2.getString("state"));
        assertEquals("inactive", port2.getString("role"));
        assertEquals("output:10", rsp.getJsonObject("rules")
            .getJsonArray("flood:1:ext").getString(0));
    }

    @Test
    public void unknownDatapath() throws Exception {
        assertEquals(HttpStatus.SC_NOT_FOUND,
                     get("/stack/dp/s9").getStatusLine().getStatusCode());
        assertNull(mapper.lookup(new BasicHttpRequest("POST", "/stack/root")));
        assertEquals(3, mapper.count("GET"));
    }
}

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

package uk.ac.lancs.rest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.ArrayList;
import java.util.List;

import org.apache.http.HttpStatus;
import org.apache.http.HttpVersion;
import org.apache.http.message.BasicHttpRequest;
import org.apache.http.message.BasicHttpResponse;
import org.apache.http.protocol.BasicHttpContext;
import org.apache.http.protocol.HttpRequestHandler;
import org.junit.jupiter.api.Test;

public class RESTRequestHandlerMapperTest {
    private static final RESTField<Integer> PORT =
        RESTField.ofInt().from("port").or(-1).done();

    private static void call(HttpRequestHandler handler, String path)
        throws Exception {
        handler.handle(new BasicHttpRequest("GET", path),
                       new BasicHttpResponse(HttpVersion.HTTP_1_1,
                                             HttpStatus.SC_OK, "OK"),
                       new BasicHttpContext());
    }

    @Test
    public void moreSpecificPatternsWin() throws Exception {
        List<String> seen = new ArrayList<>();
        RESTRequestHandlerMapper mapper = new RESTRequestHandlerMapper();
        RESTRegistration.start().on("GET").at("/dp")
            .register(mapper, (req, rsp, ctx, rest) -> seen.add("all"));
        RESTRegistration.start().on("GET").at("/dp/port/(?<port>[0-9]+)")
            .with(PORT).register(mapper, (req, rsp, ctx, rest) -> seen
                .add("port " + rest.get(PORT)));

        HttpRequestHandler h = mapper.lookup(new BasicHttpRequest("GET",
                                                                  "/dp/port/7"));
        assertNotNull(h);
        call(h, "/dp/port/7");
        call(mapper.lookup(new BasicHttpRequest("GET", "/dp")), "/dp");
        assertEquals("port 7", seen.get(0));
        assertEquals("all", seen.get(1));

        assertNull(mapper.lookup(new BasicHttpRequest("GET", "/other")));
        assertNull(mapper.lookup(new BasicHttpRequest("GET",
                                                      "http://host/dp")));
        assertEquals(2, mapper.count("GET"));
        assertEquals(0, mapper.count("PUT"));
    }

    @Test
    public void unregistration() {
        RESTRequestHandlerMapper mapper = new RESTRequestHandlerMapper();
        RESTRegistration reg = RESTRegistration.start().on("GET", "POST")
            .at("/x");
        reg.register(mapper, (req, rsp, ctx, rest) -> {});
        assertEquals(1, mapper.count("POST"));
        reg.unregister(mapper);
        assertEquals(0, mapper.count("GET"));
        assertNull(mapper.lookup(new BasicHttpRequest("GET", "/x")));
    }
}

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

import java.io.StringWriter;
import java.util.Collections;

import javax.json.Json;
import javax.json.JsonObject;
import javax.json.JsonObjectBuilder;
import javax.json.JsonWriter;

/**
 * Notifies an external party of a change in the stack.
 * 
 * @author simpsons
 */
public final class StackEvent {
    /**
     * Identifies the kind of change.
     */
    public enum Type {
        /**
         * A stack port changed state.
         */
        STACK_STATE,

        /**
         * The stack graph or root changed.
         */
        STACK_TOPO_CHANGE;
    }

    private final Type type;
    private final String datapath;
    private final Long datapathId;
    private final JsonObject body;

    StackEvent(Type type, String datapath, Long datapathId,
               JsonObject body) {
        this.type = type;
        this.datapath = datapath;
        this.datapathId = datapathId;
        this.body = body;
    }

    /**
     * Get the kind of change.
     * 
     * @return the event type
     */
    public Type type() {
        return type;
    }

    /**
     * Get the datapath the event concerns.
     * 
     * @return the datapath name, or {@code null} if the event concerns
     * the whole stack
     */
    public String datapath() {
        return datapath;
    }

    /**
     * Get the id of the datapath the event concerns.
     * 
     * @return the datapath id, or {@code null} if the event concerns
     * the whole stack
     */
    public Long datapathId() {
        return datapathId;
    }

    /**
     * Get the event's details.
     * 
     * @return the details
     */
    public JsonObject body() {
        return body;
    }

    /**
     * Express the event as a JSON object, with the details under a
     * field named after the event type.
     * 
     * @return the event as JSON
     */
    public JsonObject toJson() {
        JsonObjectBuilder result = Json.createObjectBuilder();
        if (datapath != null) {
            result.add("dp_name", datapath);
            result.add("dp_id", datapathId.longValue());
        }
        result.add(type.toString(), body);
        return result.build();
    }

    @Override
    public String toString() {
        StringWriter out = new StringWriter();
        try (JsonWriter writer = Json
            .createWriterFactory(Collections.<String, Object>emptyMap())
            .createWriter(out)) {
            writer.writeObject(toJson());
        }
        return out.toString();
    }
}

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

package uk.ac.lancs.config;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Holds the properties of one loaded source, and the sources it
 * inherits from.
 * 
 * @author simpsons
 */
final class BaseConfiguration implements Configuration {
    private final ConfigurationContext context;
    private final URI location;
    private final Map<String, String> values = new HashMap<>();
    private final Map<String, List<Configuration>> inheritance =
        new HashMap<>();

    private static final Pattern URI_SEPARATOR = Pattern.compile("\\s+");
    private static final Pattern INHERITANCE =
        Pattern.compile("^((?:[^.]+\\.)*)inherit$");
    private static final Pattern COMPONENT_SEPARATOR = Pattern.compile("\\.");

    /**
     * Create an empty configuration.
     * 
     * @param context the context used to resolve inheritance
     * 
     * @param location the location of the source, against which
     * inherited sources are resolved, or {@code null} if the source is
     * in memory
     */
    BaseConfiguration(ConfigurationContext context, URI location) {
        this.context = context;
        this.location = location;
    }

    void init(Properties props) throws IOException {
        /* Record all inheritance. */
        for (String key : props.stringPropertyNames()) {
            String value = props.getProperty(key);
            Matcher m = INHERITANCE.matcher(key);
            if (!m.matches()) {
                values.put(key, value);
                continue;
            }
            if (location == null)
                throw new IOException("cannot inherit from in-memory "
                    + "configuration: " + key);
            String prefix = m.group(1);
            List<Configuration> delegates = new ArrayList<>();
            for (String loc : URI_SEPARATOR.split(value.trim())) {
                if (loc.isEmpty()) continue;
                delegates.add(context.get(location.resolve(loc)));
            }
            inheritance.put(prefix, delegates);
        }
    }

    static URI defragment(URI location) {
        try {
            return new URI(location.getScheme(), location.getRawUserInfo(),
                           location.getHost(), location.getPort(),
                           location.getRawPath(), location.getRawQuery(),
                           null);
        } catch (URISyntaxException ex) {
            throw new AssertionError("unreachable", ex);
        }
    }

    @Override
    public String get(String key) {
        if (values.containsKey(key)) return values.get(key);

        /* Look for a parameter inherited from another configuration (or
         * just from another location in this one). */
        List<String> components =
            Arrays.asList(COMPONENT_SEPARATOR.split(key));
        final int len = components.size();
        for (int i = len - 1; i >= 0; i--) {
            String parentKey = i == 0 ? "" :
                String.join(".", components.subList(0, i)) + ".";
            String appendage = String.join(".", components.subList(i, len));
            List<Configuration> subconfs = inheritance.get(parentKey);
            if (subconfs == null) continue;
            for (Configuration subconf : subconfs) {
                String value = subconf.get(appendage);
                if (value != null) return value;
            }
        }
        return null;
    }

    @Override
    public Configuration subview(String prefix) {
        prefix = Configuration.normalizePrefix(prefix);
        if (prefix.isEmpty()) return this;
        return new PrefixConfiguration(this, prefix);
    }

    @Override
    public String prefix() {
        return "";
    }

    @Override
    public Iterable<String> keys() {
        /* Own keys hide inherited ones, and earlier sources hide later
         * ones. */
        Collection<String> result = new LinkedHashSet<>(values.keySet());
        for (Map.Entry<String, List<Configuration>> entry : inheritance
            .entrySet()) {
            String prepend = entry.getKey();
            for (Configuration conf : entry.getValue())
                for (String key : conf.keys())
                    result.add(prepend + key);
        }
        return result;
    }

    @Override
    public String toString() {
        return location == null ? "<memory>" : location.toString();
    }
}

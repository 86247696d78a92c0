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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ConfigurationTest {
    private static File write(Path dir, String name, String... lines)
        throws IOException {
        Path file = dir.resolve(name);
        Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
        return file.toFile();
    }

    @Test
    public void subviewsAndLists() throws Exception {
        Properties p = new Properties();
        p.setProperty("a.b.c", "x, y  z");
        p.setProperty("a.d", "1");
        Configuration conf = new ConfigurationContext().get(p);
        Configuration a = conf.subview("a");
        assertEquals("a.", a.prefix());
        assertEquals("1", a.get("d"));
        assertEquals(Arrays.asList("x", "y", "z"), a.subview("b")
            .getList("c"));
        assertTrue(a.getList("missing").isEmpty());
        assertEquals("dflt", a.get("missing", "dflt"));
        Set<String> keys = new HashSet<>();
        for (String k : a.keys())
            keys.add(k);
        assertEquals(new HashSet<>(Arrays.asList("b.c", "d")), keys);
    }

    @Test
    public void defaultsApplyBeneath() throws Exception {
        Properties dflt = new Properties();
        dflt.setProperty("rest.port", "4753");
        dflt.setProperty("x", "old");
        Properties p = new Properties();
        p.setProperty("x", "new");
        Configuration conf = new ConfigurationContext(dflt).get(p);
        assertEquals("4753", conf.get("rest.port"));
        assertEquals("new", conf.get("x"));
    }

    @Test
    public void keysNormalize() {
        assertEquals("a.b", Configuration.normalizeKey("..a..b."));
        assertEquals("a.", Configuration.normalizePrefix("a"));
        assertEquals("", Configuration.normalizePrefix("."));
        assertNull(Configuration.normalizeKey(null));
    }

    @Test
    public void fileInheritance(@TempDir Path dir) throws Exception {
        write(dir, "base.properties", "probe-interval=3", "lost-probes=4");
        File top = write(dir, "top.properties", "timing.inherit=base.properties",
                         "timing.lost-probes=6");
        Configuration conf = new ConfigurationContext().get(top);
        Configuration timing = conf.subview("timing");
        assertEquals("3", timing.get("probe-interval"));
        assertEquals("6", timing.get("lost-probes"));
        assertEquals("3", conf.get("timing.probe-interval"));
    }

    @Test
    public void memoryCannotInherit() {
        Properties p = new Properties();
        p.setProperty("inherit", "elsewhere.properties");
        assertThrows(IOException.class,
                     () -> new ConfigurationContext().get(p));
    }
}

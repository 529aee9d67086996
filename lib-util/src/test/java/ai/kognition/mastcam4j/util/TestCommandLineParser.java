/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.mastcam4j.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Set;

import org.junit.Test;

public class TestCommandLineParser {

    @Test
    public void testOptionsAndNonOptionArgs() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"./sol_042","label.xml","-o","./processed","--bayer","gbrg","-help"});

        assertEquals(7, clp.getTotalArgCount());
        assertEquals(List.of("./sol_042", "label.xml"), clp.getNonOptionArgs());
        assertEquals("./processed", clp.getProperty("o", "output"));
        assertEquals("gbrg", clp.getProperty("b", "bayer"));
        assertEquals("true", clp.getProperty("help"));
        assertEquals(3, clp.getOptionCount());
    }

    @Test
    public void testAliasesFirstPresentWins() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"--output","one","-o","two"});
        assertEquals("two", clp.getProperty("o", "output"));
        assertEquals("one", clp.getProperty("output", "o"));
        assertNull(clp.getProperty("bayer", "b"));
        assertFalse(clp.hasOption("bayer", "b"));
        assertTrue(clp.hasOption("o"));
    }

    @Test
    public void testNullArgs() {
        final CommandLineParser clp = new CommandLineParser(null);
        assertEquals(0, clp.getTotalArgCount());
        assertTrue(clp.getNonOptionArgs().isEmpty());
    }

    @Test
    public void testIntOption() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"-threads","4","-bad","four"});
        assertEquals(4, clp.getInt(1, "threads"));
        assertEquals(7, clp.getInt(7, "missing"));
        assertThrows(IllegalArgumentException.class, () -> clp.getInt(1, "bad"));
    }

    @Test
    public void testUnknownOptions() {
        final CommandLineParser clp = new CommandLineParser(new String[] {"in","-o","out","-zzz","-aaa"});
        assertEquals(List.of("aaa", "zzz"), clp.unknownOptions(Set.of("o", "output")));
    }
}

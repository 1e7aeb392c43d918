/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.arbo.run;

import static org.apache.jackrabbit.arbo.run.AvailableModes.MODES;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableList;
import org.junit.Test;

public class MainTest {

    @Test
    public void modes() {
        assertEquals(ImmutableList.of("format", "check", "select", "json", "help"),
                ImmutableList.copyOf(MODES.getModes()));
    }

    @Test
    public void help() throws Exception {
        CommandOutput result = CommandOutput.run(args -> Main.run());
        assertEquals(0, result.exitCode);
        assertTrue(result.out, result.out.contains("Available modes: format, check, select, json, help"));
    }

    @Test
    public void unknownMode() throws Exception {
        CommandOutput result = CommandOutput.run(args -> Main.run("frobnicate"));
        assertEquals(1, result.exitCode);
        assertEquals("Unknown mode: frobnicate" + System.lineSeparator(), result.err);
        assertTrue(result.out, result.out.contains("Available modes"));
    }

    @Test
    public void dispatch() throws Exception {
        CommandOutput result = CommandOutput.runWithInput("a\n\tb\n", args -> Main.run("FORMAT", "-"));
        assertEquals(0, result.exitCode);
        assertEquals("a b\n", result.out);
    }
}

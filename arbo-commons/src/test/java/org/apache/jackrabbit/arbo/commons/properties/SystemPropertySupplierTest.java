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
package org.apache.jackrabbit.arbo.commons.properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.apache.jackrabbit.arbo.commons.junit.LogCustomizer;
import org.junit.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;

public class SystemPropertySupplierTest {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplierTest.class);

    @Test
    public void testBoolean() {
        assertEquals(Boolean.FALSE,
                SystemPropertySupplier.create("foo", Boolean.FALSE).usingSystemPropertyReader((n) -> null).get());
        assertEquals(Boolean.TRUE,
                SystemPropertySupplier.create("foo", Boolean.FALSE).usingSystemPropertyReader((n) -> "true").get());
    }

    @Test
    public void testIntegerAndLong() {
        assertEquals(Integer.valueOf(80),
                SystemPropertySupplier.create("foo", 0).usingSystemPropertyReader((n) -> "80").get());
        assertEquals(Long.valueOf(7),
                SystemPropertySupplier.create("foo", Long.MAX_VALUE).usingSystemPropertyReader((n) -> "7").get());
    }

    @Test
    public void testString() {
        assertEquals("?", SystemPropertySupplier.create("arbo.run.uri", "?").usingSystemPropertyReader((n) -> null).get());
        assertEquals("stdin",
                SystemPropertySupplier.create("arbo.run.uri", "?").usingSystemPropertyReader((n) -> "stdin").get());
    }

    @Test
    public void testInvalidValueFallsBackToDefault() {
        LogCustomizer logs = LogCustomizer.forLogger(SystemPropertySupplierTest.class.getName())
                .enable(Level.ERROR).contains("Ignoring invalid value").create();
        logs.starting();
        try {
            int lineLength = SystemPropertySupplier.create("arbo.json.lineLength", 0).loggingTo(LOG)
                    .usingSystemPropertyReader((n) -> "-1").validateWith(n -> n >= 0).get();
            assertEquals(0, lineLength);
            assertEquals(1, logs.getLogs().size());
        } finally {
            logs.finished();
        }
    }

    @Test
    public void testMalformedValueFallsBackToDefault() {
        LogCustomizer logs = LogCustomizer.forLogger(SystemPropertySupplierTest.class.getName())
                .enable(Level.ERROR).contains("Ignoring malformed value").create();
        logs.starting();
        try {
            int lineLength = SystemPropertySupplier.create("arbo.json.lineLength", 0).loggingTo(LOG)
                    .usingSystemPropertyReader((n) -> "wide").get();
            assertEquals(0, lineLength);
            assertEquals(1, logs.getLogs().size());
        } finally {
            logs.finished();
        }
    }

    @Test
    public void testOverrideIsLogged() {
        LogCustomizer logs = LogCustomizer.forLogger(SystemPropertySupplierTest.class.getName())
                .enable(Level.DEBUG).create();
        logs.starting();
        try {
            SystemPropertySupplier.create("arbo.json.lineLength", 0).loggingTo(LOG)
                    .logSuccessAs(org.slf4j.event.Level.DEBUG)
                    .usingSystemPropertyReader((n) -> "72").get();
            assertTrue(logs.getLogs().contains("System property arbo.json.lineLength found to be '72'"));
        } finally {
            logs.finished();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedType() {
        SystemPropertySupplier.create("foo", new Object());
    }
}

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

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;

import org.apache.jackrabbit.arbo.run.commons.Command;

/**
 * Runs a command with captured standard streams. Standard output encodes
 * in US-ASCII, the charset of a C locale, to catch output that relies on
 * the platform charset.
 */
class CommandOutput {

    final int exitCode;

    final String out;

    final byte[] outBytes;

    final String err;

    private CommandOutput(int exitCode, byte[] outBytes, String err) {
        this.exitCode = exitCode;
        this.outBytes = outBytes;
        this.out = new String(outBytes, UTF_8);
        this.err = err;
    }

    static CommandOutput run(Command command, String... args) throws Exception {
        return runWithInput("", command, args);
    }

    static CommandOutput runWithInput(String input, Command command, String... args) throws Exception {
        InputStream oldIn = System.in;
        PrintStream oldOut = System.out;
        PrintStream oldErr = System.err;
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        try {
            System.setIn(new ByteArrayInputStream(input.getBytes(UTF_8)));
            System.setOut(new PrintStream(out, true, US_ASCII.name()));
            System.setErr(new PrintStream(err, true, UTF_8.name()));
            int exitCode = command.execute(args);
            System.out.flush();
            System.err.flush();
            return new CommandOutput(exitCode, out.toByteArray(), err.toString(UTF_8.name()));
        } finally {
            System.setIn(oldIn);
            System.setOut(oldOut);
            System.setErr(oldErr);
        }
    }
}

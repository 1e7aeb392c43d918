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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.asList;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import com.google.common.io.Files;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.jackrabbit.arbo.api.Span;
import org.apache.jackrabbit.arbo.api.Tree;
import org.apache.jackrabbit.arbo.commons.properties.SystemPropertySupplier;
import org.apache.jackrabbit.arbo.notation.StringToTree;
import org.apache.jackrabbit.arbo.notation.StringToTreeException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Option handling and input reading shared by the modes that read trees.
 * An input is a file name, or {@code -} for standard input.
 */
final class Inputs {

    private static final Logger LOG = LoggerFactory.getLogger(Inputs.class);

    static final String STDIN = "-";

    private static final SystemPropertySupplier<String> STDIN_URI =
            SystemPropertySupplier.create("arbo.run.uri", Span.UNKNOWN_URI).loggingTo(LOG);

    private final String mode;

    private final OptionParser parser = new OptionParser();

    private final OptionSpec<?> helpSpec;

    private final OptionSpec<String> inputSpec;

    Inputs(@NotNull String mode) {
        this.mode = mode;
        this.helpSpec = parser.acceptsAll(asList("h", "?", "help"), "show help").forHelp();
        this.inputSpec = parser.nonOptions("files to read, - or none for standard input")
                .ofType(String.class);
    }

    /**
     * The parser, for the modes to declare their own options.
     */
    @NotNull
    OptionParser getParser() {
        return parser;
    }

    /**
     * Parses the arguments. Prints the usage if they are invalid.
     *
     * @return the options, or {@code null} if the arguments are invalid
     */
    @Nullable
    OptionSet parse(String... args) throws IOException {
        try {
            return parser.parse(args);
        } catch (OptionException e) {
            System.err.println(e.getMessage());
            printUsage(System.err);
            return null;
        }
    }

    boolean isHelp(@NotNull OptionSet options) {
        return options.has(helpSpec);
    }

    void printUsage(PrintStream out) throws IOException {
        out.println("Mode: " + mode);
        out.println();
        parser.printHelpOn(out);
    }

    @NotNull
    List<String> getInputs(@NotNull OptionSet options) {
        List<String> inputs = options.valuesOf(inputSpec);
        return inputs.isEmpty() ? ImmutableList.of(STDIN) : inputs;
    }

    /**
     * The uri the spans of an input refer to.
     */
    @NotNull
    static String getUri(@NotNull String input) {
        return STDIN.equals(input) ? STDIN_URI.get() : input;
    }

    /**
     * Standard output, encoded in UTF-8 like the inputs regardless of the
     * platform charset. The stream is not closed by the caller.
     */
    @NotNull
    static PrintStream stdout() {
        return new PrintStream(System.out, true, UTF_8);
    }

    @NotNull
    static String read(@NotNull String input) throws IOException {
        if (STDIN.equals(input)) {
            return CharStreams.toString(new InputStreamReader(System.in, UTF_8));
        }
        return Files.asCharSource(new File(input), UTF_8).read();
    }

    /**
     * Reads and parses an input. Failures are reported on standard error.
     *
     * @return the tree, or {@code null} if the input can't be read or parsed
     */
    @Nullable
    static Tree readTree(@NotNull String input) {
        String uri = getUri(input);
        try {
            Tree tree = StringToTree.parse(read(input), uri);
            LOG.debug("Read {} top level nodes from {}", tree.getKids().size(), uri);
            return tree;
        } catch (IOException e) {
            LOG.debug("Failed to read {}", uri, e);
            System.err.println(uri + ": " + e.getMessage());
        } catch (StringToTreeException e) {
            LOG.debug("Failed to parse {}", uri, e);
            System.err.println(uri + ": " + e.getMessage());
        }
        return null;
    }
}

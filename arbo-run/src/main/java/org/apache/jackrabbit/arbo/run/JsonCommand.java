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

import java.io.PrintStream;

import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.jackrabbit.arbo.api.Tree;
import org.apache.jackrabbit.arbo.commons.json.JsopBuilder;
import org.apache.jackrabbit.arbo.commons.properties.SystemPropertySupplier;
import org.apache.jackrabbit.arbo.json.TreeToJson;
import org.apache.jackrabbit.arbo.run.commons.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints every input as one Json document.
 */
class JsonCommand implements Command {

    static final String NAME = "json";

    private static final Logger LOG = LoggerFactory.getLogger(JsonCommand.class);

    private static final SystemPropertySupplier<Integer> LINE_LENGTH =
            SystemPropertySupplier.create("arbo.json.lineLength", 0)
                    .loggingTo(LOG)
                    .validateWith(length -> length >= 0);

    @Override
    public int execute(String... args) throws Exception {
        Inputs inputs = new Inputs(NAME);
        OptionSpec<Void> noSpansSpec = inputs.getParser().accepts("no-spans",
                "leave out the source positions");
        OptionSet options = inputs.parse(args);
        if (options == null) {
            return 1;
        }
        if (inputs.isHelp(options)) {
            inputs.printUsage(System.out);
            return 0;
        }

        boolean spans = !options.has(noSpansSpec);
        JsopBuilder json = new JsopBuilder();
        json.setLineLength(LINE_LENGTH.get());
        PrintStream out = Inputs.stdout();
        int failures = 0;
        for (String input : inputs.getInputs(options)) {
            Tree tree = Inputs.readTree(input);
            if (tree == null) {
                failures++;
                continue;
            }
            json.resetWriter();
            TreeToJson.serialize(tree, json, spans);
            out.println(json);
        }
        out.flush();
        return failures == 0 ? 0 : 1;
    }
}

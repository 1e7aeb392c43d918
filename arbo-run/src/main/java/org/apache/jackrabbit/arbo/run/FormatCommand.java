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

import java.io.IOException;
import java.io.PrintStream;

import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.jackrabbit.arbo.api.Tree;
import org.apache.jackrabbit.arbo.notation.StringToTree;
import org.apache.jackrabbit.arbo.notation.StringToTreeException;
import org.apache.jackrabbit.arbo.notation.TreeToString;
import org.apache.jackrabbit.arbo.run.commons.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the canonical form of the inputs, or with {@code --check} the
 * names of the inputs that are not in canonical form.
 */
class FormatCommand implements Command {

    static final String NAME = "format";

    private static final Logger LOG = LoggerFactory.getLogger(FormatCommand.class);

    @Override
    public int execute(String... args) throws Exception {
        Inputs inputs = new Inputs(NAME);
        OptionSpec<Void> checkSpec = inputs.getParser().accepts("check",
                "only list the inputs that are not in canonical form");
        OptionSet options = inputs.parse(args);
        if (options == null) {
            return 1;
        }
        if (inputs.isHelp(options)) {
            inputs.printUsage(System.out);
            return 0;
        }

        boolean check = options.has(checkSpec);
        PrintStream out = Inputs.stdout();
        int failures = 0;
        for (String input : inputs.getInputs(options)) {
            String uri = Inputs.getUri(input);
            String text;
            Tree tree;
            try {
                text = Inputs.read(input);
                tree = StringToTree.parse(text, uri);
            } catch (IOException | StringToTreeException e) {
                LOG.debug("Failed to format {}", uri, e);
                System.err.println(uri + ": " + e.getMessage());
                failures++;
                continue;
            }
            String canonical = TreeToString.serialize(tree);
            if (!check) {
                out.print(canonical);
            } else if (!canonical.equals(text)) {
                LOG.debug("{} is not in canonical form", uri);
                out.println(uri);
                failures++;
            }
        }
        out.flush();
        return failures == 0 ? 0 : 1;
    }
}

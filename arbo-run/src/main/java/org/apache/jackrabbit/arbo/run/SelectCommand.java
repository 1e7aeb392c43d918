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
import java.util.List;

import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import org.apache.jackrabbit.arbo.api.Tree;
import org.apache.jackrabbit.arbo.api.TreePath;
import org.apache.jackrabbit.arbo.notation.TreeToString;
import org.apache.jackrabbit.arbo.run.commons.Command;
import org.apache.jackrabbit.arbo.util.TreePaths;

/**
 * Prints the nodes a path selects, for example
 * {@code select --path config/user/* app.tree}.
 */
class SelectCommand implements Command {

    static final String NAME = "select";

    @Override
    public int execute(String... args) throws Exception {
        Inputs inputs = new Inputs(NAME);
        OptionSpec<String> pathSpec = inputs.getParser().accepts("path",
                "path of the nodes to print: type labels, indexes and * separated by /")
                .withRequiredArg()
                .ofType(String.class)
                .required();
        OptionSet options = inputs.parse(args);
        if (options == null) {
            return 1;
        }
        if (inputs.isHelp(options)) {
            inputs.printUsage(System.out);
            return 0;
        }

        List<TreePath> path;
        try {
            path = TreePaths.parse(pathSpec.value(options));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 1;
        }

        PrintStream out = Inputs.stdout();
        int failures = 0;
        for (String input : inputs.getInputs(options)) {
            Tree tree = Inputs.readTree(input);
            if (tree == null) {
                failures++;
            } else {
                out.print(TreeToString.serialize(tree.select(path)));
            }
        }
        out.flush();
        return failures == 0 ? 0 : 1;
    }
}

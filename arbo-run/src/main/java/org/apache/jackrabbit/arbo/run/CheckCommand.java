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

import joptsimple.OptionSet;
import org.apache.jackrabbit.arbo.run.commons.Command;

/**
 * Parses the inputs and reports syntax errors.
 */
class CheckCommand implements Command {

    static final String NAME = "check";

    @Override
    public int execute(String... args) throws Exception {
        Inputs inputs = new Inputs(NAME);
        OptionSet options = inputs.parse(args);
        if (options == null) {
            return 1;
        }
        if (inputs.isHelp(options)) {
            inputs.printUsage(System.out);
            return 0;
        }

        int failures = 0;
        for (String input : inputs.getInputs(options)) {
            if (Inputs.readTree(input) == null) {
                failures++;
            }
        }
        return failures == 0 ? 0 : 1;
    }
}

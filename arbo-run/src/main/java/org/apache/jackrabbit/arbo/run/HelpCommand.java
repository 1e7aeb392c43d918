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

import com.google.common.base.Joiner;
import org.apache.jackrabbit.arbo.run.commons.Command;

class HelpCommand implements Command {

    static final String NAME = "help";

    @Override
    public int execute(String... args) {
        System.out.println("usage: java -jar arbo-run.jar <mode> [options] [files]");
        System.out.println();
        System.out.println("Available modes: " + Joiner.on(", ").join(MODES.getModes()));
        System.out.println("Use <mode> --help for the options of a mode.");
        return 0;
    }
}

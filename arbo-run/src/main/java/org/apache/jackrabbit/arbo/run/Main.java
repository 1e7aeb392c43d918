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

import static java.util.Arrays.copyOfRange;
import static org.apache.jackrabbit.arbo.run.AvailableModes.MODES;

import java.util.Locale;

import org.apache.jackrabbit.arbo.run.commons.Command;

public final class Main {

    private Main() {
        // Prevent instantiation.
    }

    public static void main(String[] args) throws Exception {
        System.exit(run(args));
    }

    /**
     * Runs the mode named by the first argument with the remaining ones.
     * Without arguments, or for an unknown mode, the help is shown.
     *
     * @return the exit code
     */
    static int run(String... args) throws Exception {
        if (args.length == 0) {
            return MODES.getCommand(HelpCommand.NAME).execute();
        }
        Command command = MODES.getCommand(args[0].toLowerCase(Locale.ENGLISH));
        if (command == null) {
            System.err.println("Unknown mode: " + args[0]);
            MODES.getCommand(HelpCommand.NAME).execute();
            return 1;
        }
        return command.execute(copyOfRange(args, 1, args.length));
    }
}

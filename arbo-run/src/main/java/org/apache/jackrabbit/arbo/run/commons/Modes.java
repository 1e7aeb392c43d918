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
package org.apache.jackrabbit.arbo.run.commons;

import java.util.Set;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The commands of the tool by mode name.
 */
public final class Modes {

    private final ImmutableMap<String, Command> modes;

    public Modes(@NotNull ImmutableMap<String, Command> modes) {
        this.modes = modes;
    }

    @Nullable
    public Command getCommand(@NotNull String name) {
        return modes.get(name);
    }

    /**
     * @return the mode names in registration order
     */
    @NotNull
    public Set<String> getModes() {
        return modes.keySet();
    }
}

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
package org.apache.jackrabbit.arbo.api;

import java.util.List;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Rewrites a single node into zero or more replacement nodes. A handler
 * decides itself whether to descend, usually by calling
 * {@link Tree#hack(Belt, Object)} on the node it was given.
 *
 * @param <C> type of the context passed through a rewrite pass
 */
@FunctionalInterface
public interface Handler<C> {

    /**
     * @param node the node to rewrite
     * @param belt the belt of the running pass
     * @param context the context of the running pass, may be {@code null}
     * @return the replacements of {@code node}, in order; empty to delete it
     */
    @NotNull
    List<Tree> handle(@NotNull Tree node, @NotNull Belt<C> belt, @Nullable C context);

}

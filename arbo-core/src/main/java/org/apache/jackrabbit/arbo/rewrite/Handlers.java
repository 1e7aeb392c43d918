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
package org.apache.jackrabbit.arbo.rewrite;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.arbo.api.Belt;
import org.apache.jackrabbit.arbo.api.Handler;
import org.apache.jackrabbit.arbo.api.Tree;
import org.jetbrains.annotations.NotNull;

/**
 * Common {@link Handler}s for use in a {@link Belt}:
 * <pre>
 * Belt&lt;Void&gt; belt = Belt.&lt;Void&gt;builder()
 *         .add("password", Handlers.&lt;Void&gt;replace(Tree.data("***")))
 *         .add("comment", Handlers.&lt;Void&gt;drop())
 *         .build();
 * </pre>
 */
public final class Handlers {

    private Handlers() {
    }

    /**
     * Keeps the node as it is, children included.
     */
    @NotNull
    public static <C> Handler<C> keep() {
        return (node, belt, context) -> ImmutableList.of(node);
    }

    /**
     * Keeps the node and rewrites its children. This is what happens to a
     * node the belt has no handler for.
     */
    @NotNull
    public static <C> Handler<C> recurse() {
        return (node, belt, context) -> ImmutableList.of(node.clone(node.hack(belt, context)));
    }

    /**
     * Removes the node with all its children.
     */
    @NotNull
    public static <C> Handler<C> drop() {
        return (node, belt, context) -> ImmutableList.of();
    }

    /**
     * Replaces the node by a structural node of the given type over its
     * rewritten children, keeping the span.
     *
     * @throws org.apache.jackrabbit.arbo.api.TreeException if {@code type}
     *             is not a valid type label
     */
    @NotNull
    public static <C> Handler<C> rename(@NotNull String type) {
        // validates the label
        Tree.struct(type);
        return (node, belt, context) ->
                ImmutableList.of(Tree.struct(type, node.hack(belt, context), node.getSpan()));
    }

    /**
     * Replaces the node by the given nodes.
     */
    @NotNull
    public static <C> Handler<C> replace(@NotNull Tree... nodes) {
        ImmutableList<Tree> replacement = ImmutableList.copyOf(checkNotNull(nodes));
        return (node, belt, context) -> replacement;
    }

    /**
     * Replaces the node by its rewritten children.
     */
    @NotNull
    public static <C> Handler<C> unwrap() {
        return (node, belt, context) -> node.hack(belt, context);
    }
}

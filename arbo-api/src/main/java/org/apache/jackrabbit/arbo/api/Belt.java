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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Map;

import com.google.common.collect.ImmutableMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable mapping from type labels to the {@link Handler}s of a rewrite
 * pass. The entry under the empty label {@link #FALLBACK} applies to nodes
 * whose type has no entry of its own, including data and list nodes.
 *
 * @param <C> type of the context passed through a rewrite pass
 */
public final class Belt<C> {

    /**
     * Label of the fallback entry.
     */
    public static final String FALLBACK = "";

    private static final Belt<Object> EMPTY = new Belt<Object>(ImmutableMap.<String, Handler<Object>>of());

    private final ImmutableMap<String, Handler<C>> handlers;

    private Belt(ImmutableMap<String, Handler<C>> handlers) {
        this.handlers = handlers;
    }

    /**
     * A belt without handlers: every node is kept and descended into.
     */
    @SuppressWarnings("unchecked")
    @NotNull
    public static <C> Belt<C> empty() {
        return (Belt<C>) EMPTY;
    }

    @NotNull
    public static <C> Belt<C> of(@NotNull Map<String, ? extends Handler<C>> handlers) {
        return new Belt<C>(ImmutableMap.copyOf(handlers));
    }

    @NotNull
    public static <C> Builder<C> builder() {
        return new Builder<C>();
    }

    /**
     * The handler of a type label: its own entry, else the fallback entry,
     * else {@code null}, meaning the node is kept and its children are
     * rewritten.
     */
    @Nullable
    public Handler<C> getHandler(@NotNull String type) {
        Handler<C> handler = handlers.get(type);
        return handler != null ? handler : handlers.get(FALLBACK);
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    @Override
    public String toString() {
        return "Belt" + handlers.keySet();
    }

    public static final class Builder<C> {

        private final ImmutableMap.Builder<String, Handler<C>> handlers = ImmutableMap.builder();

        private Builder() {
        }

        /**
         * Adds the handler of a type label.
         */
        @NotNull
        public Builder<C> add(@NotNull String type, @NotNull Handler<C> handler) {
            handlers.put(checkNotNull(type), checkNotNull(handler));
            return this;
        }

        /**
         * Adds the handler of nodes without an entry of their own.
         */
        @NotNull
        public Builder<C> fallback(@NotNull Handler<C> handler) {
            return add(FALLBACK, handler);
        }

        /**
         * @throws IllegalArgumentException if a label was added twice
         */
        @NotNull
        public Belt<C> build() {
            return new Belt<C>(handlers.build());
        }
    }
}

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
import static org.apache.jackrabbit.arbo.commons.conditions.Checks.checkArgument;

import java.util.List;

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One segment of a path addressing children of a {@link Tree}. A segment is
 * exactly one of:
 * <ul>
 *     <li>{@link Type}: the children with a given type label,</li>
 *     <li>{@link Index}: the child at a given position,</li>
 *     <li>{@link Any}: all children.</li>
 * </ul>
 * Consumers switch over {@link #getKind()}.
 */
public abstract class TreePath {

    /**
     * The kinds of path segments.
     */
    public enum Kind {
        TYPE, INDEX, ANY
    }

    private TreePath() {
    }

    @NotNull
    public abstract Kind getKind();

    @NotNull
    public static TreePath type(@NotNull String name) {
        return new Type(name);
    }

    @NotNull
    public static TreePath index(int index) {
        return new Index(index);
    }

    @NotNull
    public static TreePath any() {
        return Any.INSTANCE;
    }

    /**
     * Converts loosely typed segments: a {@code String} becomes a {@link Type},
     * an {@code Integer} an {@link Index}, {@code null} is {@link Any} and a
     * {@code TreePath} is taken as is.
     *
     * @throws IllegalArgumentException for segments of any other class
     */
    @NotNull
    public static List<TreePath> of(@Nullable Object... segments) {
        if (segments == null) {
            // a single null passed as varargs array
            return ImmutableList.of(any());
        }
        ImmutableList.Builder<TreePath> path = ImmutableList.builder();
        for (Object segment : segments) {
            path.add(valueOf(segment));
        }
        return path.build();
    }

    @NotNull
    private static TreePath valueOf(@Nullable Object segment) {
        if (segment == null) {
            return any();
        } else if (segment instanceof TreePath) {
            return (TreePath) segment;
        } else if (segment instanceof String) {
            return type((String) segment);
        } else if (segment instanceof Integer) {
            return index((Integer) segment);
        }
        throw new IllegalArgumentException("Not a path segment: " + segment + " (" + segment.getClass().getName() + ')');
    }

    /**
     * Selects the children with a type label.
     */
    public static final class Type extends TreePath {

        private final String name;

        private Type(@NotNull String name) {
            this.name = checkNotNull(name);
        }

        @NotNull
        @Override
        public Kind getKind() {
            return Kind.TYPE;
        }

        @NotNull
        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Type && name.equals(((Type) other).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * Selects the child at a position.
     */
    public static final class Index extends TreePath {

        private final int index;

        private Index(int index) {
            checkArgument(index >= 0, "Index must not be negative: %s", index);
            this.index = index;
        }

        @NotNull
        @Override
        public Kind getKind() {
            return Kind.INDEX;
        }

        public int getIndex() {
            return index;
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Index && index == ((Index) other).index;
        }

        @Override
        public int hashCode() {
            return index;
        }

        @Override
        public String toString() {
            return Integer.toString(index);
        }
    }

    /**
     * Selects every child.
     */
    public static final class Any extends TreePath {

        private static final Any INSTANCE = new Any();

        private Any() {
        }

        @NotNull
        @Override
        public Kind getKind() {
            return Kind.ANY;
        }

        @Override
        public String toString() {
            return "*";
        }
    }
}

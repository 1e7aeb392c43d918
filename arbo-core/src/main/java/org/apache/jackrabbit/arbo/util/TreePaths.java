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
package org.apache.jackrabbit.arbo.util;

import static org.apache.jackrabbit.arbo.commons.conditions.Checks.checkArgument;

import java.util.List;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.arbo.api.TreePath;
import org.jetbrains.annotations.NotNull;

/**
 * Utility methods to parse and write paths like {@code config/0/*}: segments
 * are separated by {@code /}, a segment of digits only is an index, a single
 * {@code *} matches any child and every other segment is a type label.
 * Type labels that contain a {@code /}, consist of digits only or equal
 * {@code *} can't be written this way.
 */
public final class TreePaths {

    private static final String ANY = "*";

    private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

    private static final Splitter SPLITTER = Splitter.on('/').omitEmptyStrings();

    private static final Joiner JOINER = Joiner.on('/');

    private TreePaths() {
    }

    /**
     * Parses a path. Empty segments are ignored, so {@code ""} and
     * {@code "/"} are the empty path.
     *
     * @throws IllegalArgumentException if an index is too large
     */
    @NotNull
    public static List<TreePath> parse(@NotNull String path) {
        ImmutableList.Builder<TreePath> segments = ImmutableList.builder();
        for (String segment : SPLITTER.split(path)) {
            if (ANY.equals(segment)) {
                segments.add(TreePath.any());
            } else if (DIGITS.matchesAllOf(segment)) {
                try {
                    segments.add(TreePath.index(Integer.parseInt(segment)));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Index out of range: " + segment + " in " + path, e);
                }
            } else {
                segments.add(TreePath.type(segment));
            }
        }
        return segments.build();
    }

    /**
     * Writes a path in the form read by {@link #parse(String)}.
     *
     * @throws IllegalArgumentException if a type label can't be written
     */
    @NotNull
    public static String toString(@NotNull List<TreePath> path) {
        for (TreePath segment : path) {
            if (segment.getKind() == TreePath.Kind.TYPE) {
                String name = ((TreePath.Type) segment).getName();
                checkArgument(!ANY.equals(name) && !DIGITS.matchesAllOf(name) && name.indexOf('/') < 0,
                        "Type label can't be written as path segment: %s", name);
            }
        }
        return JOINER.join(path);
    }
}

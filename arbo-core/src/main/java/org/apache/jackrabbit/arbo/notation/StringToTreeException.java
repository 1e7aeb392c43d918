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
package org.apache.jackrabbit.arbo.notation;

import org.apache.jackrabbit.arbo.api.Span;
import org.jetbrains.annotations.NotNull;

/**
 * Syntax error in notation text. The message names the {@link Kind}, the
 * offending text and its {@link Span}, for example
 * {@code Too many tabs \t\tb config.tree#2:1/2}.
 */
public class StringToTreeException extends IllegalArgumentException {

    private static final long serialVersionUID = 2905633425468211763L;

    public enum Kind {

        /**
         * A line is indented less than the first line.
         */
        TOO_FEW_TABS("Too few tabs"),

        /**
         * A line is indented more than one level below the previous line.
         */
        TOO_MANY_TABS("Too many tabs"),

        /**
         * Type labels are separated by something else than a single space.
         */
        WRONG_SEPARATOR("Wrong nodes separator"),

        /**
         * The last line is not terminated by a newline.
         */
        UNEXPECTED_EOF("Unexpected EOF, LF required");

        private final String description;

        Kind(String description) {
            this.description = description;
        }

        @NotNull
        public String getDescription() {
            return description;
        }
    }

    private final Kind kind;

    private final String fragment;

    private final Span span;

    public StringToTreeException(@NotNull Kind kind, @NotNull String fragment, @NotNull Span span) {
        super(kind.getDescription() + ' ' + fragment + ' ' + span);
        this.kind = kind;
        this.fragment = fragment;
        this.span = span;
    }

    @NotNull
    public Kind getKind() {
        return kind;
    }

    /**
     * @return the raw text of the offending line, or its remainder
     */
    @NotNull
    public String getFragment() {
        return fragment;
    }

    @NotNull
    public Span getSpan() {
        return span;
    }
}

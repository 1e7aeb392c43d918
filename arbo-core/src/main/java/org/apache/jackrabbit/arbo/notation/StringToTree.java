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

import static org.apache.jackrabbit.arbo.notation.StringToTreeException.Kind.TOO_FEW_TABS;
import static org.apache.jackrabbit.arbo.notation.StringToTreeException.Kind.TOO_MANY_TABS;
import static org.apache.jackrabbit.arbo.notation.StringToTreeException.Kind.UNEXPECTED_EOF;
import static org.apache.jackrabbit.arbo.notation.StringToTreeException.Kind.WRONG_SEPARATOR;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.arbo.api.Span;
import org.apache.jackrabbit.arbo.api.Tree;
import org.jetbrains.annotations.NotNull;

/**
 * Reads the tree notation. Every line holds a chain of type labels separated
 * by single spaces, optionally followed by a backslash and a data value
 * running to the end of the line:
 * <pre>
 * user
 * 	name \Jin
 * 	roles admin
 * </pre>
 * A line is a child of the nearest preceding line indented by one tab less.
 * Each label on a line is the parent of the next one, and the last node of
 * a line is the parent of the lines below it. The indentation of the first
 * line is the base indentation of the text. Every line, including the last
 * one, must end with a newline.
 * <p>
 * The result is a list node over the top level nodes, spanning the entire
 * text.
 */
public final class StringToTree {

    private final String text;

    private final Span span;

    private final int length;

    private int pos;

    private int row;

    private int lineStart;

    private StringToTree(String text, String uri) {
        this.text = text;
        this.span = Span.entire(uri, text);
        this.length = text.length();
    }

    /**
     * Same as {@code parse(text, Span.UNKNOWN_URI)}.
     */
    @NotNull
    public static Tree parse(@NotNull String text) throws StringToTreeException {
        return parse(text, Span.UNKNOWN_URI);
    }

    /**
     * Parses {@code text}, attributing all spans to {@code uri}.
     *
     * @throws StringToTreeException on the first syntax error
     */
    @NotNull
    public static Tree parse(@NotNull String text, @NotNull String uri) throws StringToTreeException {
        return new StringToTree(text, uri).read();
    }

    private Tree read() {
        Draft root = new Draft("", "", span);
        List<Draft> stack = new ArrayList<Draft>();
        stack.add(root);
        int baseIndent = 0;
        while (pos < length) {
            row++;
            lineStart = pos;
            int indent = 0;
            while (pos < length && text.charAt(pos) == '\t') {
                indent++;
                pos++;
            }
            if (root.kids.isEmpty()) {
                baseIndent = indent;
            }
            indent -= baseIndent;

            if (indent < 0 || indent >= stack.size()) {
                Span tabs = span.span(row, 1, pos - lineStart);
                pos = lineEnd(pos);
                String line = text.substring(lineStart, pos);
                if (indent >= 0) {
                    throw new StringToTreeException(TOO_MANY_TABS, line, tabs);
                } else if (pos < length) {
                    throw new StringToTreeException(TOO_FEW_TABS, line, tabs);
                }
                throw new StringToTreeException(UNEXPECTED_EOF, line, span.span(row, pos - lineStart + 1, 1));
            }

            stack.subList(indent + 1, stack.size()).clear();
            Draft parent = stack.get(indent);

            while (pos < length && text.charAt(pos) != '\\' && text.charAt(pos) != '\n') {
                int separatorStart = pos;
                while (pos < length && isBlank(text.charAt(pos))) {
                    pos++;
                }
                if (pos > separatorStart) {
                    String line = text.substring(lineStart, lineEnd(pos));
                    Span separator = span.span(row, separatorStart - lineStart + 1, pos - separatorStart);
                    throw new StringToTreeException(WRONG_SEPARATOR, line, separator);
                }

                int typeStart = pos;
                while (pos < length && !isBlank(text.charAt(pos))
                        && text.charAt(pos) != '\\' && text.charAt(pos) != '\n') {
                    pos++;
                }
                Draft next = new Draft(text.substring(typeStart, pos), "",
                        span.span(row, typeStart - lineStart + 1, pos - typeStart));
                parent.kids.add(next);
                parent = next;

                if (pos < length && text.charAt(pos) == ' ') {
                    pos++;
                }
            }

            if (pos < length && text.charAt(pos) == '\\') {
                int dataStart = pos;
                pos = lineEnd(pos);
                Draft next = new Draft("", text.substring(dataStart + 1, pos),
                        span.span(row, dataStart - lineStart + 2, pos - dataStart - 1));
                parent.kids.add(next);
                parent = next;
            }

            if (pos == length) {
                throw new StringToTreeException(UNEXPECTED_EOF, text.substring(lineStart),
                        span.span(row, pos - lineStart + 1, 1));
            }

            stack.add(parent);
            pos++;
        }
        return root.build();
    }

    private int lineEnd(int from) {
        int end = text.indexOf('\n', from);
        return end < 0 ? length : end;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    /**
     * Mutable node collecting children while the text is read.
     */
    private static final class Draft {

        private final String type;

        private final String value;

        private final Span span;

        private final List<Draft> kids = new ArrayList<Draft>();

        private final ImmutableList.Builder<Tree> frozen = ImmutableList.builder();

        private int next;

        Draft(String type, String value, Span span) {
            this.type = type;
            this.value = value;
            this.span = span;
        }

        /**
         * Freezes this draft and its descendants in post-order, using an
         * explicit stack instead of recursion.
         */
        Tree build() {
            Deque<Draft> stack = new ArrayDeque<Draft>();
            stack.push(this);
            while (true) {
                Draft top = stack.peek();
                if (top.next < top.kids.size()) {
                    stack.push(top.kids.get(top.next++));
                    continue;
                }
                stack.pop();
                Tree tree = top.freeze();
                if (stack.isEmpty()) {
                    return tree;
                }
                stack.peek().frozen.add(tree);
            }
        }

        private Tree freeze() {
            if (type.isEmpty()) {
                return Tree.data(value, frozen.build(), span);
            }
            return Tree.struct(type, frozen.build(), span);
        }
    }
}

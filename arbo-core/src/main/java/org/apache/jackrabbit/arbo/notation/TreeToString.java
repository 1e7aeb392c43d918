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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

import org.apache.jackrabbit.arbo.api.Tree;
import org.jetbrains.annotations.NotNull;

/**
 * Writes a tree in the notation read by {@link StringToTree}. A structural
 * node with a single child continues on the same line, all other children
 * go on their own lines one tab deeper. The top level node itself is not
 * written, only its children.
 * <p>
 * For every tree read by {@link StringToTree}, writing it and reading the
 * result back gives an equal tree.
 */
public final class TreeToString {

    private TreeToString() {
    }

    @NotNull
    public static String serialize(@NotNull Tree tree) {
        StringBuilder buff = new StringBuilder();
        Deque<Frame> stack = new ArrayDeque<Frame>();
        stack.push(line(tree, "", buff));
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.kids.hasNext()) {
                stack.pop();
                continue;
            }
            buff.append(frame.prefix);
            stack.push(line(frame.kids.next(), frame.prefix + '\t', buff));
        }
        return buff.toString();
    }

    /**
     * Writes a node followed by the chain of single children sharing its
     * line.
     *
     * @return the children of the last node of the line, still to be written
     */
    private static Frame line(Tree tree, String prefix, StringBuilder buff) {
        while (true) {
            if (tree.isStruct()) {
                if (prefix.isEmpty()) {
                    prefix = "\t";
                }
                buff.append(tree.getType());
                if (tree.getKids().size() == 1) {
                    buff.append(' ');
                    tree = tree.getKids().get(0);
                    continue;
                }
                buff.append('\n');
            } else if (!tree.getValue().isEmpty() || !prefix.isEmpty()) {
                buff.append('\\').append(tree.getValue()).append('\n');
            }
            return new Frame(tree.getKids().iterator(), prefix);
        }
    }

    private static final class Frame {

        private final Iterator<Tree> kids;

        private final String prefix;

        Frame(Iterator<Tree> kids, String prefix) {
            this.kids = kids;
            this.prefix = prefix;
        }
    }
}

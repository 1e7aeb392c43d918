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

import static org.apache.jackrabbit.arbo.api.Tree.data;
import static org.apache.jackrabbit.arbo.api.Tree.struct;
import static org.apache.jackrabbit.arbo.api.Tree.wrap;
import static org.apache.jackrabbit.arbo.notation.TreeToString.serialize;
import static org.junit.Assert.assertEquals;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.arbo.api.Tree;
import org.junit.Test;

public class TreeToStringTest {

    private static final String[] CANONICAL = {
            "",
            "a\n",
            "a b c d\n",
            "a\nb\n",
            "user\n\tname \\Jin\n\troles\n\t\tadmin\n\t\tdev\nhost \\local\n",
            "text\n\t\\first line\n\t\\ second  line \n\t\\\n",
            "\\top level\n",
            "a \\x\n\tb\n\tc\n",
            "a b \\\n\tx\n",
            "all numbers is string: \\35\n\t\\171\n",
    };

    @Test
    public void empty() {
        assertEquals("", serialize(wrap()));
    }

    @Test
    public void singleChildOnSameLine() {
        assertEquals("a b\n", serialize(wrap(ImmutableList.of(
                struct("a", ImmutableList.of(struct("b")))))));
        assertEquals("a \\x\n", serialize(wrap(ImmutableList.of(
                struct("a", ImmutableList.of(data("x")))))));
    }

    @Test
    public void severalChildrenIndented() {
        Tree tree = wrap(ImmutableList.of(
                struct("a", ImmutableList.of(
                        struct("b", ImmutableList.of(data("1"))),
                        struct("c", ImmutableList.of(struct("d"), struct("e")))))));
        assertEquals("a\n\tb \\1\n\tc\n\t\td\n\t\te\n", serialize(tree));
    }

    @Test
    public void multiLineData() {
        Tree tree = wrap(ImmutableList.of(struct("text", ImmutableList.of(data("one\ntwo")))));
        assertEquals("text \\\n\t\\one\n\t\\two\n", serialize(tree));
        assertEquals("one\ntwo", StringToTree.parse(serialize(tree)).select("text", 0).getKids().get(0).text());
    }

    @Test
    public void structuralRoot() {
        assertEquals("a\n\tb\n\tc\n", serialize(struct("a", ImmutableList.of(struct("b"), struct("c")))));
    }

    @Test
    public void nestedList() {
        Tree tree = wrap(ImmutableList.of(struct("a", ImmutableList.of(
                wrap(ImmutableList.of(struct("x"), struct("y")))))));
        assertEquals("a \\\n\tx\n\ty\n", serialize(tree));
    }

    @Test
    public void canonicalFormsAreStable() {
        for (String text : CANONICAL) {
            assertEquals(text, serialize(StringToTree.parse(text)));
        }
    }

    @Test
    public void deepNesting() {
        int depth = 4000;
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < depth - 1; i++) {
            text.append(Strings.repeat("\t", i)).append("a\n");
            text.append(Strings.repeat("\t", i + 1)).append("x\n");
        }
        text.append(Strings.repeat("\t", depth - 1)).append("a x\n");
        assertEquals(text.toString(), serialize(StringToTree.parse(text.toString())));
    }

    @Test
    public void roundTrip() {
        String[] texts = {
                "\t\ta\n\t\t\tb\n",
                "a\n\n\tb\n",
                "a\n\tb\n\t\tc\n",
        };
        for (String text : texts) {
            Tree tree = StringToTree.parse(text);
            String canonical = serialize(tree);
            assertEquals(tree, StringToTree.parse(canonical));
            assertEquals(canonical, serialize(StringToTree.parse(canonical)));
        }
    }
}

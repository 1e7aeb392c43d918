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
import static org.apache.jackrabbit.arbo.notation.StringToTree.parse;
import static org.apache.jackrabbit.arbo.notation.TreeToString.serialize;
import static org.junit.Assert.assertEquals;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import org.apache.jackrabbit.arbo.api.Belt;
import org.apache.jackrabbit.arbo.api.Tree;
import org.apache.jackrabbit.arbo.api.TreePath;
import org.junit.Test;

/**
 * Edits parsed text and checks the written result.
 */
public class TreeEditingTest {

    @Test
    public void insertByType() {
        assertEquals("a b x\n", serialize(parse("a b c d\n").insert(struct("x"), "a", "b", "c")));
        assertEquals("a b c x\n", serialize(parse("a b\n").insert(struct("x"), "a", "b", "c", "d")));
    }

    @Test
    public void insertByIndex() {
        assertEquals("a b x\n", serialize(parse("a b c d\n").insert(struct("x"), 0, 0, 0)));
        assertEquals("a b \\\n\tx\n", serialize(parse("a b\n").insert(struct("x"), 0, 0, 0, 0)));
    }

    @Test
    public void insertAny() {
        assertEquals("a b x\n", serialize(parse("a b c d\n").insert(struct("x"), null, null, null)));
        assertEquals("a b \\\n\tx\n", serialize(parse("a b\n").insert(struct("x"), null, null, null, null)));
    }

    @Test
    public void delete() {
        assertEquals("a b\n", serialize(parse("a b c d\n").insert(null, "a", "b", "c")));
        assertEquals("a b\n", serialize(parse("a b c d\n").delete(0, 0, 0)));
        assertEquals("a c\n", serialize(parse("a\n\tb\n\tc\n").delete("a", "b")));
    }

    @Test
    public void replaceData() {
        Tree config = parse("password @password\n");
        Belt<Void> belt = Belt.<Void>builder()
                .add("@password", (node, b, context) -> ImmutableList.of(data("qwerty")))
                .build();
        assertEquals("password \\qwerty\n", serialize(wrap(config.hack(belt))));
    }

    @Test
    public void relabelRecursively() {
        Tree sample = parse("spam egg xxx xxx\n");
        Belt<Void> belt = Belt.<Void>builder()
                .add("xxx", (node, b, context) -> ImmutableList.of(struct("777", node.hack(b, context))))
                .build();
        assertEquals("spam egg 777 777\n", serialize(wrap(sample.hack(belt))));
    }

    @Test
    public void numbersToData() {
        Tree caster = parse("all numbers is string: 35 171\n");
        Belt<Void> belt = Belt.<Void>builder()
                .fallback((node, b, context) -> !node.getType().isEmpty()
                        && CharMatcher.inRange('0', '9').matchesAllOf(node.getType())
                        ? ImmutableList.of(data(node.getType(), node.hack(b, context)))
                        : ImmutableList.of(node.clone(node.hack(b, context))))
                .build();
        assertEquals("all numbers is string: \\35\n\t\\171\n", serialize(wrap(caster.hack(belt))));
    }

    @Test
    public void selectAndFilter() {
        Tree users = parse("user\n\tname \\Jin\n\trole \\admin\nuser\n\tname \\Kim\n\trole \\dev\n");
        assertEquals("\\Jin\n", serialize(users.select("user", "name", null)));
        assertEquals("\\Kim\n", serialize(users.select(1, "name", null)));

        Tree admins = users.filter(ImmutableList.of(
                TreePath.type("role"),
                TreePath.any()), "admin");
        assertEquals("user\n\tname \\Jin\n\trole \\admin\n", serialize(admins));
    }
}

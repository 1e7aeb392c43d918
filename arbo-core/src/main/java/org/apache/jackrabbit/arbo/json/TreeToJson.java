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
package org.apache.jackrabbit.arbo.json;

import org.apache.jackrabbit.arbo.api.Tree;
import org.apache.jackrabbit.arbo.commons.json.JsopBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * Renders a tree as Json. Every node becomes an object with the keys
 * {@code type}, {@code value}, {@code span} and {@code kids}, in this order.
 * An empty type, an empty value or an empty list of children is left out:
 * <pre>
 * {"type":"user","span":{"uri":"?","row":1,"col":1,"length":4},"kids":[
 *     {"value":"Jin","span":{..}}]}
 * </pre>
 */
public final class TreeToJson {

    private TreeToJson() {
    }

    @NotNull
    public static String serialize(@NotNull Tree tree) {
        return serialize(tree, true);
    }

    @NotNull
    public static String serialize(@NotNull Tree tree, boolean spans) {
        JsopBuilder json = new JsopBuilder();
        serialize(tree, json, spans);
        return json.toString();
    }

    /**
     * Appends the rendering of {@code tree} to {@code json}.
     *
     * @param spans whether to include the {@code span} of every node
     */
    public static void serialize(@NotNull Tree tree, @NotNull JsopBuilder json, boolean spans) {
        json.object();
        if (!tree.getType().isEmpty()) {
            json.key("type").value(tree.getType());
        }
        if (!tree.getValue().isEmpty()) {
            json.key("value").value(tree.getValue());
        }
        if (spans) {
            json.key("span");
            tree.getSpan().toJson(json);
        }
        if (!tree.getKids().isEmpty()) {
            json.key("kids").array();
            for (Tree kid : tree.getKids()) {
                serialize(kid, json, spans);
            }
            json.endArray();
        }
        json.endObject();
    }
}

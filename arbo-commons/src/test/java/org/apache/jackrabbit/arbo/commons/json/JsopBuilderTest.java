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
package org.apache.jackrabbit.arbo.commons.json;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class JsopBuilderTest {

    @Test
    public void objectsAndArrays() {
        JsopBuilder buff = new JsopBuilder();
        buff.object()
                .key("type").value("a")
                .key("row").value(3)
                .key("kids").array().object().endObject().value((String) null).endArray()
                .endObject();
        assertEquals("{\"type\":\"a\",\"row\":3,\"kids\":[{},null]}", buff.toString());
    }

    @Test
    public void encode() {
        assertEquals("null", JsopBuilder.encode(null));
        assertEquals("\"\\\\qwerty\"", JsopBuilder.encode("\\qwerty"));
        assertEquals("\"a\\tb\\nc\"", JsopBuilder.encode("a\tb\nc"));
        assertEquals("\"\\u00e9/\\\"\"", JsopBuilder.encode("é/\""));
    }

    @Test
    public void lineLength() {
        JsopBuilder buff = new JsopBuilder();
        buff.setLineLength(4);
        buff.array().value(1).value(2).value(3).endArray();
        assertEquals("[1,2,\n3]", buff.toString());
    }

    @Test
    public void reset() {
        JsopBuilder buff = new JsopBuilder();
        buff.array().value("x");
        buff.resetWriter();
        buff.object().endObject();
        assertEquals("{}", buff.toString());
    }

    @Test(expected = IllegalStateException.class)
    public void unbalanced() {
        new JsopBuilder().object().endArray();
    }

    @Test(expected = IllegalStateException.class)
    public void keyOutsideObject() {
        new JsopBuilder().array().key("x");
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeLineLength() {
        new JsopBuilder().setLineLength(-1);
    }
}

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

import static org.apache.jackrabbit.arbo.commons.conditions.Checks.checkArgument;
import static org.apache.jackrabbit.arbo.commons.conditions.Checks.checkState;

import org.jetbrains.annotations.Nullable;

/**
 * A builder for Json strings. It encodes string values and inserts commas
 * between elements as needed. Nesting is tracked so that unbalanced
 * {@link #endObject()} and {@link #endArray()} calls are rejected.
 */
public class JsopBuilder {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final StringBuilder buff = new StringBuilder();
    private final StringBuilder open = new StringBuilder();
    private boolean needComma;
    private int lineLength;
    private int lineStart;

    /**
     * Resets this builder.
     */
    public void resetWriter() {
        needComma = false;
        buff.setLength(0);
        open.setLength(0);
        lineStart = 0;
    }

    /**
     * Set the line length hint: when a line grows beyond this length, the
     * next element starts on a new line. 0 (the default) disables wrapping.
     *
     * @param length the line length
     */
    public void setLineLength(int length) {
        checkArgument(length >= 0, "Line length must not be negative: %s", length);
        lineLength = length;
    }

    /**
     * Append the key (in quotes) plus a colon.
     *
     * @param name the key
     * @return this
     */
    public JsopBuilder key(String name) {
        checkState(isIn('{'), "Key %s outside of an object", name);
        optionalCommaAndNewline();
        buff.append(encode(name)).append(':');
        needComma = false;
        return this;
    }

    /**
     * Append a string or null. Strings are encoded.
     *
     * @param value the value
     * @return this
     */
    public JsopBuilder value(@Nullable String value) {
        return encodedValue(encode(value));
    }

    /**
     * Append a number.
     *
     * @param value the value
     * @return this
     */
    public JsopBuilder value(long value) {
        return encodedValue(Long.toString(value));
    }

    /**
     * Append an already encoded value, for example a nested Json document.
     *
     * @param value the encoded value
     * @return this
     */
    public JsopBuilder encodedValue(String value) {
        optionalCommaAndNewline();
        buff.append(value);
        needComma = true;
        return this;
    }

    /**
     * Start an object.
     *
     * @return this
     */
    public JsopBuilder object() {
        optionalCommaAndNewline();
        buff.append('{');
        open.append('{');
        needComma = false;
        return this;
    }

    /**
     * End an object.
     *
     * @return this
     */
    public JsopBuilder endObject() {
        close('{', '}');
        return this;
    }

    /**
     * Start an array.
     *
     * @return this
     */
    public JsopBuilder array() {
        optionalCommaAndNewline();
        buff.append('[');
        open.append('[');
        needComma = false;
        return this;
    }

    /**
     * End an array.
     *
     * @return this
     */
    public JsopBuilder endArray() {
        close('[', ']');
        return this;
    }

    /**
     * Append a newline character.
     *
     * @return this
     */
    public JsopBuilder newline() {
        buff.append('\n');
        lineStart = buff.length();
        return this;
    }

    private void close(char expected, char closing) {
        checkState(isIn(expected), "Unbalanced '%s'", closing);
        open.setLength(open.length() - 1);
        buff.append(closing);
        needComma = true;
    }

    private boolean isIn(char c) {
        return open.length() > 0 && open.charAt(open.length() - 1) == c;
    }

    private void optionalCommaAndNewline() {
        if (needComma) {
            buff.append(',');
            if (lineLength > 0 && buff.length() - lineStart > lineLength) {
                newline();
            }
        }
    }

    /**
     * Get the generated string.
     */
    @Override
    public String toString() {
        return buff.toString();
    }

    /**
     * Convert a string to a quoted Json literal using the correct escape
     * sequences. The literal is enclosed in double quotes. Characters outside
     * the range 32..127 are encoded (backslash u xxxx). The forward slash
     * (solidus) is not escaped. Null is encoded as "null" (without quotes).
     *
     * @param s the text to convert
     * @return the Json representation (including double quotes)
     */
    public static String encode(@Nullable String s) {
        if (s == null) {
            return "null";
        }
        StringBuilder buff = new StringBuilder(s.length() + 2);
        buff.append('\"');
        escape(s, buff);
        return buff.append('\"').toString();
    }

    /**
     * Escape a string into the target buffer.
     *
     * @param s the string to escape
     * @param buff the target buffer
     */
    public static void escape(String s, StringBuilder buff) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':
                    buff.append("\\\"");
                    break;
                case '\\':
                    buff.append("\\\\");
                    break;
                case '\b':
                    buff.append("\\b");
                    break;
                case '\f':
                    buff.append("\\f");
                    break;
                case '\n':
                    buff.append("\\n");
                    break;
                case '\r':
                    buff.append("\\r");
                    break;
                case '\t':
                    buff.append("\\t");
                    break;
                default:
                    if (c < ' ' || c > 127) {
                        buff.append("\\u")
                                .append(HEX[(c >>> 12) & 15])
                                .append(HEX[(c >>> 8) & 15])
                                .append(HEX[(c >>> 4) & 15])
                                .append(HEX[c & 15]);
                    } else {
                        buff.append(c);
                    }
            }
        }
    }
}

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

import java.util.Objects;

import org.apache.jackrabbit.arbo.commons.json.JsopBuilder;
import org.jetbrains.annotations.NotNull;

/**
 * Immutable position of a range of characters in a source text: the
 * {@code length} characters starting at the 1-based {@code row} and
 * {@code col}. The {@code uri} identifies the source in diagnostics.
 * <p>
 * Derived spans ({@link #span(int, int, int)}, {@link #after(int)},
 * {@link #slice(int, int)}) share uri and source with the span they are
 * derived from.
 */
public final class Span {

    /**
     * The uri of spans whose origin is not known.
     */
    public static final String UNKNOWN_URI = "?";

    private static final Span UNKNOWN = begin(UNKNOWN_URI);

    private final String uri;
    private final String source;
    private final int row;
    private final int col;
    private final int length;

    public Span(@NotNull String uri, @NotNull String source, int row, int col, int length) {
        checkArgument(row >= 1, "Row must be positive: %s", row);
        checkArgument(col >= 1, "Column must be positive: %s", col);
        checkArgument(length >= 0, "Length must not be negative: %s", length);
        this.uri = checkNotNull(uri);
        this.source = checkNotNull(source);
        this.row = row;
        this.col = col;
        this.length = length;
    }

    /**
     * Zero length span at the start of an empty source.
     */
    @NotNull
    public static Span begin(@NotNull String uri) {
        return begin(uri, "");
    }

    /**
     * Zero length span at the start of the source.
     */
    @NotNull
    public static Span begin(@NotNull String uri, @NotNull String source) {
        return new Span(uri, source, 1, 1, 0);
    }

    /**
     * Zero length span just past the end of the source.
     */
    @NotNull
    public static Span end(@NotNull String uri, @NotNull String source) {
        return new Span(uri, source, 1, source.length() + 1, 0);
    }

    /**
     * Span covering the whole source.
     */
    @NotNull
    public static Span entire(@NotNull String uri, @NotNull String source) {
        return new Span(uri, source, 1, 1, source.length());
    }

    /**
     * The placeholder span of synthesized nodes.
     */
    @NotNull
    public static Span unknown() {
        return UNKNOWN;
    }

    @NotNull
    public String getUri() {
        return uri;
    }

    @NotNull
    public String getSource() {
        return source;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public int getLength() {
        return length;
    }

    /**
     * A span over the same source at the given position.
     */
    @NotNull
    public Span span(int row, int col, int length) {
        return new Span(uri, source, row, col, length);
    }

    /**
     * The zero length span immediately following this one.
     */
    @NotNull
    public Span after() {
        return after(0);
    }

    /**
     * The span of {@code length} characters immediately following this one on
     * the same row.
     */
    @NotNull
    public Span after(int length) {
        return span(row, col + this.length, length);
    }

    /**
     * Same as {@code slice(begin, -1)}.
     */
    @NotNull
    public Span slice(int begin) {
        return slice(begin, -1);
    }

    /**
     * A sub span from offset {@code begin} (inclusive) to offset {@code end}
     * (exclusive). Negative offsets count back from {@link #getLength()}, so
     * {@code -1} denotes {@code length - 1}.
     *
     * @throws SpanException if an offset falls outside {@code [0, length]} or
     *             {@code end} is before {@code begin}
     */
    @NotNull
    public Span slice(int begin, int end) throws SpanException {
        if (begin < 0) {
            begin += length;
        }
        if (end < 0) {
            end += length;
        }
        if (begin < 0 || begin > length) {
            throw new SpanException("Begin value " + begin + " out of range " + this, this);
        }
        if (end < 0 || end > length) {
            throw new SpanException("End value " + end + " out of range " + this, this);
        }
        if (end < begin) {
            throw new SpanException("End value " + end + " can't be less than begin value, " + this, this);
        }
        return span(row, col + begin, end - begin);
    }

    /**
     * Writes this span as a Json object with the keys {@code uri},
     * {@code row}, {@code col} and {@code length}.
     */
    public void toJson(@NotNull JsopBuilder json) {
        json.object()
                .key("uri").value(uri)
                .key("row").value(row)
                .key("col").value(col)
                .key("length").value(length)
                .endObject();
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        } else if (other instanceof Span) {
            Span that = (Span) other;
            return row == that.row && col == that.col && length == that.length
                    && uri.equals(that.uri);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(uri, row, col, length);
    }

    @Override
    public String toString() {
        return uri + '#' + row + ':' + col + '/' + length;
    }
}

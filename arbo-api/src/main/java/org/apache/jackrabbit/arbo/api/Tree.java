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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable node of an ordered tree. A node is one of
 * <ul>
 *     <li><em>structural</em>: a non-empty type label and no value,</li>
 *     <li><em>data</em>: no type label, a value,</li>
 *     <li><em>list</em>: neither type label nor value, a plain group of
 *     children.</li>
 * </ul>
 * Every node carries the {@link Span} it was read from, or
 * {@link Span#unknown()} when it was synthesized.
 * <p>
 * Edits never modify a tree. {@link #insert(Tree, List)},
 * {@link #filter(List, String)} and the rewrite methods return new trees that
 * share all unmodified subtrees with the receiver; {@link #clone(List)} is
 * the primitive all of them are built on.
 * <p>
 * Equality is structural: type, value and children. Spans are ignored.
 */
public final class Tree {

    private static final CharMatcher FORBIDDEN_IN_TYPE = CharMatcher.anyOf(" \t\n\\");

    private final String type;

    private final String value;

    private final ImmutableList<Tree> kids;

    private final Span span;

    private Tree(String type, String value, ImmutableList<Tree> kids, Span span) {
        assert type.isEmpty() || value.isEmpty();
        this.type = type;
        this.value = value;
        this.kids = kids;
        this.span = checkNotNull(span);
    }

    //-----------------------------------------------------------< factories >--

    @NotNull
    public static Tree struct(@NotNull String type) {
        return struct(type, ImmutableList.<Tree>of());
    }

    @NotNull
    public static Tree struct(@NotNull String type, @NotNull List<Tree> kids) {
        return struct(type, kids, Span.unknown());
    }

    /**
     * Creates a structural node.
     *
     * @throws TreeException if {@code type} is empty or contains a space, a
     *             tab, a newline or a backslash
     */
    @NotNull
    public static Tree struct(@NotNull String type, @NotNull List<Tree> kids, @NotNull Span span)
            throws TreeException {
        if (type.isEmpty() || FORBIDDEN_IN_TYPE.matchesAnyOf(type)) {
            throw new TreeException("Wrong type '" + type + "'", type);
        }
        return new Tree(type, "", ImmutableList.copyOf(kids), span);
    }

    @NotNull
    public static Tree data(@NotNull String value) {
        return data(value, ImmutableList.<Tree>of());
    }

    @NotNull
    public static Tree data(@NotNull String value, @NotNull List<Tree> kids) {
        return data(value, kids, Span.unknown());
    }

    /**
     * Creates a data node. A multi-line {@code value} is stored as one data
     * child per line, placed before {@code kids}, and the node itself gets an
     * empty value. {@link #text()} joins the lines again.
     */
    @NotNull
    public static Tree data(@NotNull String value, @NotNull List<Tree> kids, @NotNull Span span) {
        List<String> lines = Splitter.on('\n').splitToList(value);
        if (lines.size() == 1) {
            return new Tree("", value, ImmutableList.copyOf(kids), span);
        }
        Span start = span.span(span.getRow(), span.getCol(), 0);
        ImmutableList.Builder<Tree> children = ImmutableList.builder();
        for (String line : lines) {
            children.add(new Tree("", line, ImmutableList.<Tree>of(), start.after(line.length())));
        }
        children.addAll(kids);
        return new Tree("", "", children.build(), span);
    }

    @NotNull
    public static Tree wrap() {
        return wrap(ImmutableList.<Tree>of());
    }

    @NotNull
    public static Tree wrap(@NotNull List<Tree> kids) {
        return wrap(kids, Span.unknown());
    }

    /**
     * Creates a list node grouping {@code kids}.
     */
    @NotNull
    public static Tree wrap(@NotNull List<Tree> kids, @NotNull Span span) {
        return new Tree("", "", ImmutableList.copyOf(kids), span);
    }

    /**
     * A node with the type and value of this one and the given children.
     */
    @NotNull
    public Tree clone(@NotNull List<Tree> kids) {
        return clone(kids, span);
    }

    /**
     * A node with the type and value of this one and the given children and
     * span.
     */
    @NotNull
    public Tree clone(@NotNull List<Tree> kids, @NotNull Span span) {
        return new Tree(type, value, ImmutableList.copyOf(kids), span);
    }

    //-----------------------------------------------------------< accessors >--

    /**
     * @return the type label, empty for data and list nodes
     */
    @NotNull
    public String getType() {
        return type;
    }

    /**
     * @return the value, empty for structural and list nodes
     */
    @NotNull
    public String getValue() {
        return value;
    }

    @NotNull
    public List<Tree> getKids() {
        return kids;
    }

    @NotNull
    public Span getSpan() {
        return span;
    }

    public boolean isStruct() {
        return !type.isEmpty();
    }

    public boolean isData() {
        return type.isEmpty() && !value.isEmpty();
    }

    public boolean isList() {
        return type.isEmpty() && value.isEmpty();
    }

    /**
     * The value of this node followed by the newline separated values of its
     * untyped children. Reverses the line splitting of
     * {@link #data(String, List, Span)}.
     */
    @NotNull
    public String text() {
        List<String> values = new ArrayList<String>();
        for (Tree kid : kids) {
            if (kid.type.isEmpty()) {
                values.add(kid.value);
            }
        }
        return value + Joiner.on('\n').join(values);
    }

    //--------------------------------------------------------------< select >--

    /**
     * Same as {@code select(TreePath.of(path))}.
     */
    @NotNull
    public Tree select(@Nullable Object... path) {
        return select(TreePath.of(path));
    }

    /**
     * Collects the nodes a path addresses, starting from this node. A
     * {@link TreePath.Type} segment narrows the candidates to the children
     * of that type of the first candidate, a {@link TreePath.Index} segment
     * to the child at that position of the first candidate and
     * {@link TreePath.Any} to all children of every candidate.
     *
     * @return a list node over the selected nodes, this node alone for the
     *         empty path
     */
    @NotNull
    public Tree select(@NotNull List<TreePath> path) {
        List<Tree> next = ImmutableList.of(this);
        for (TreePath segment : path) {
            if (next.isEmpty()) {
                break;
            }
            ImmutableList.Builder<Tree> found = ImmutableList.builder();
            Tree first = next.get(0);
            switch (segment.getKind()) {
                case TYPE:
                    String name = ((TreePath.Type) segment).getName();
                    for (Tree kid : first.kids) {
                        if (kid.type.equals(name)) {
                            found.add(kid);
                        }
                    }
                    break;
                case INDEX:
                    int index = ((TreePath.Index) segment).getIndex();
                    if (index < first.kids.size()) {
                        found.add(first.kids.get(index));
                    }
                    break;
                case ANY:
                    for (Tree item : next) {
                        found.addAll(item.kids);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown path segment " + segment);
            }
            next = found.build();
        }
        return wrap(next, span);
    }

    //--------------------------------------------------------------< insert >--

    /**
     * Same as {@code insert(value, TreePath.of(path))}.
     */
    @Nullable
    public Tree insert(@Nullable Tree value, @Nullable Object... path) {
        return insert(value, TreePath.of(path));
    }

    /**
     * Places {@code value} at every position {@code path} addresses, creating
     * missing structural nodes for {@link TreePath.Type} segments and padding
     * with empty list nodes for {@link TreePath.Index} segments. A
     * {@code null} value deletes the addressed nodes instead.
     *
     * @return the edited copy of this node; {@code value} itself for the
     *         empty path
     */
    @Nullable
    public Tree insert(@Nullable Tree value, @NotNull List<TreePath> path) {
        if (path.isEmpty()) {
            return value;
        }
        TreePath head = path.get(0);
        List<TreePath> rest = path.subList(1, path.size());
        switch (head.getKind()) {
            case TYPE:
                return insertType(value, ((TreePath.Type) head).getName(), rest);
            case INDEX:
                return insertIndex(value, ((TreePath.Index) head).getIndex(), rest);
            case ANY:
                return insertAny(value, rest);
            default:
                throw new IllegalStateException("Unknown path segment " + head);
        }
    }

    /**
     * Same as {@code insert(null, TreePath.of(path))}.
     */
    @Nullable
    public Tree delete(@Nullable Object... path) {
        return insert(null, TreePath.of(path));
    }

    @NotNull
    private Tree insertType(@Nullable Tree value, String name, List<TreePath> rest) {
        List<Tree> sub = new ArrayList<Tree>(kids.size() + 1);
        boolean matched = false;
        for (Tree item : kids) {
            if (!item.type.equals(name)) {
                sub.add(item);
                continue;
            }
            matched = true;
            Tree elem = item.insert(value, rest);
            if (elem != null) {
                sub.add(elem);
            }
        }
        if (!matched && value != null) {
            Tree elem = struct(name, ImmutableList.<Tree>of(), span).insert(value, rest);
            if (elem != null) {
                sub.add(elem);
            }
        }
        return clone(sub);
    }

    @NotNull
    private Tree insertIndex(@Nullable Tree value, int index, List<TreePath> rest) {
        if (value == null && index >= kids.size()) {
            // nothing to delete
            return clone(kids);
        }
        List<Tree> sub = new ArrayList<Tree>(kids);
        while (sub.size() <= index) {
            sub.add(wrap(ImmutableList.<Tree>of(), span));
        }
        Tree elem = sub.get(index).insert(value, rest);
        if (elem == null) {
            sub.remove(index);
        } else {
            sub.set(index, elem);
        }
        return clone(sub);
    }

    @NotNull
    private Tree insertAny(@Nullable Tree value, List<TreePath> rest) {
        List<Tree> targets = kids;
        if (targets.isEmpty() && value != null) {
            targets = ImmutableList.of(wrap());
        }
        List<Tree> sub = new ArrayList<Tree>(targets.size());
        for (Tree item : targets) {
            Tree elem = item.insert(value, rest);
            if (elem != null) {
                sub.add(elem);
            }
        }
        return clone(sub);
    }

    //--------------------------------------------------------------< filter >--

    /**
     * Keeps the children for which {@code path} selects at least one node
     * ({@code value} is {@code null}) or at least one node with the given
     * value.
     *
     * @return a copy of this node with the remaining children
     */
    @NotNull
    public Tree filter(@NotNull List<TreePath> path, @Nullable String value) {
        ImmutableList.Builder<Tree> sub = ImmutableList.builder();
        for (Tree item : kids) {
            List<Tree> found = item.select(path).kids;
            if (value == null) {
                if (!found.isEmpty()) {
                    sub.add(item);
                }
            } else {
                for (Tree child : found) {
                    if (child.value.equals(value)) {
                        sub.add(item);
                        break;
                    }
                }
            }
        }
        return clone(sub.build());
    }

    //---------------------------------------------------------------< hack >--

    /**
     * Same as {@code hack(belt, null)}.
     */
    @NotNull
    public <C> List<Tree> hack(@NotNull Belt<C> belt) {
        return hack(belt, null);
    }

    /**
     * Rewrites the children of this node: the concatenation of
     * {@link #hackSelf(Belt, Object)} over every child, in order.
     */
    @NotNull
    public <C> List<Tree> hack(@NotNull Belt<C> belt, @Nullable C context) {
        ImmutableList.Builder<Tree> result = ImmutableList.builder();
        for (Tree kid : kids) {
            result.addAll(kid.hackSelf(belt, context));
        }
        return result.build();
    }

    /**
     * Rewrites this node with the handler the belt has for its type. Without
     * one the node is kept with its children rewritten.
     */
    @NotNull
    public <C> List<Tree> hackSelf(@NotNull Belt<C> belt, @Nullable C context) {
        Handler<C> handler = belt.getHandler(type);
        if (handler == null) {
            return ImmutableList.of(clone(hack(belt, context)));
        }
        return checkNotNull(handler.handle(this, belt, context),
                "Handler for '%s' returned null", type);
    }

    //------------------------------------------------------------< Object >--

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        } else if (other instanceof Tree) {
            Tree that = (Tree) other;
            return type.equals(that.type) && value.equals(that.value) && kids.equals(that.kids);
        } else {
            return false;
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, kids);
    }

    @Override
    public String toString() {
        return type.isEmpty() ? '\\' + value : type;
    }
}

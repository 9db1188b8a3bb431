/*
 * Copyright 2026 LINE Corporation
 *
 * LINE Corporation licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package com.linecorp.subdoc.internal.path;

import static java.util.Objects.requireNonNull;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * An immutable sequence of {@link PathComponent}s. The empty path addresses the document root.
 */
public final class ParsedPath {

    private static final ParsedPath ROOT = new ParsedPath(ImmutableList.of());

    public static ParsedPath root() {
        return ROOT;
    }

    public static ParsedPath of(PathComponent... components) {
        return of(ImmutableList.copyOf(requireNonNull(components, "components")));
    }

    public static ParsedPath of(List<PathComponent> components) {
        requireNonNull(components, "components");
        if (components.isEmpty()) {
            return ROOT;
        }
        return new ParsedPath(ImmutableList.copyOf(components));
    }

    private final List<PathComponent> components;

    private ParsedPath(List<PathComponent> components) {
        this.components = components;
    }

    public List<PathComponent> components() {
        return components;
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    public PathComponent get(int index) {
        return components.get(index);
    }

    /**
     * Returns the last component.
     *
     * @throws IllegalStateException if this path is empty
     */
    public PathComponent last() {
        if (components.isEmpty()) {
            throw new IllegalStateException("the root path has no components");
        }
        return components.get(components.size() - 1);
    }

    /**
     * Returns the level of the value this path addresses. The root is at level 1.
     */
    public int level() {
        return components.size() + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ParsedPath && components.equals(((ParsedPath) o).components);
    }

    @Override
    public int hashCode() {
        return components.hashCode();
    }

    /**
     * Returns the path in its textual form, e.g. {@code a.b[0][-1].c}.
     */
    @Override
    public String toString() {
        final StringBuilder buf = new StringBuilder();
        for (PathComponent c : components) {
            if (c.isKey()) {
                if (buf.length() > 0) {
                    buf.append('.');
                }
                buf.append(c.key());
            } else {
                buf.append('[').append(c.index()).append(']');
            }
        }
        return buf.toString();
    }
}

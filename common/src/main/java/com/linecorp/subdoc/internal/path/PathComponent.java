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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * A component of a {@link ParsedPath}: an object key such as {@code foo} or an array index such as
 * {@code [3]}. The index {@code [-1]} addresses the last element of an array.
 */
public final class PathComponent {

    /**
     * The type of a {@link PathComponent}.
     */
    public enum Type {
        KEY, INDEX
    }

    private static final int LAST_INDEX = -1;
    private static final PathComponent LAST = new PathComponent(Type.INDEX, null, LAST_INDEX);

    public static PathComponent ofKey(String key) {
        return new PathComponent(Type.KEY, requireNonNull(key, "key"), 0);
    }

    public static PathComponent ofIndex(int index) {
        checkArgument(index >= 0, "index: %s (expected: >= 0)", index);
        return new PathComponent(Type.INDEX, null, index);
    }

    /**
     * Returns the {@code [-1]} component.
     */
    public static PathComponent last() {
        return LAST;
    }

    private final Type type;
    @Nullable
    private final String key;
    private final int index;

    private PathComponent(Type type, @Nullable String key, int index) {
        this.type = type;
        this.key = key;
        this.index = index;
    }

    public Type type() {
        return type;
    }

    public boolean isKey() {
        return type == Type.KEY;
    }

    public boolean isIndex() {
        return type == Type.INDEX;
    }

    /**
     * Returns {@code true} if this is the {@code [-1]} component.
     */
    public boolean isLast() {
        return type == Type.INDEX && index == LAST_INDEX;
    }

    /**
     * Returns the object key.
     *
     * @throws IllegalStateException if this is an array index
     */
    public String key() {
        if (key == null) {
            throw new IllegalStateException("not a key: " + this);
        }
        return key;
    }

    /**
     * Returns the array index, or {@code -1} for the {@code [-1]} component.
     *
     * @throws IllegalStateException if this is an object key
     */
    public int index() {
        if (type != Type.INDEX) {
            throw new IllegalStateException("not an index: " + this);
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathComponent)) {
            return false;
        }
        final PathComponent that = (PathComponent) o;
        return type == that.type && index == that.index &&
               (key == null ? that.key == null : key.equals(that.key));
    }

    @Override
    public int hashCode() {
        return type == Type.KEY ? key.hashCode() : index;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("type", type)
                          .add("key", key)
                          .add("index", type == Type.INDEX ? index : null)
                          .omitNullValues()
                          .toString();
    }
}

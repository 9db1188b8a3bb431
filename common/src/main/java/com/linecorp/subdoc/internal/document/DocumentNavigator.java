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

package com.linecorp.subdoc.internal.document;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.internal.path.ParsedPath;
import com.linecorp.subdoc.internal.path.PathComponent;

/**
 * Resolves a {@link ParsedPath} against a JSON document tree.
 *
 * <ul>
 *   <li>A key applied to a non-object, or an index applied to a non-array, fails with
 *       {@link SubdocStatus#PATH_MISMATCH}.</li>
 *   <li>A missing intermediate value fails with {@link SubdocStatus#PATH_NOT_FOUND}, unless
 *       {@code createParents} is set and every missing ancestor, as well as the last component, is an
 *       object key. Arrays are never created.</li>
 *   <li>A missing last component is not a failure. The returned {@link Location} tells whether it exists.</li>
 * </ul>
 *
 * <p>The tree is never modified by navigation.
 */
public final class DocumentNavigator {

    /**
     * Resolves {@code path} against {@code root}.
     *
     * @param createParents whether missing intermediate objects may be created later
     */
    public static Location navigate(JsonNode root, ParsedPath path, boolean createParents) {
        requireNonNull(root, "root");
        requireNonNull(path, "path");
        if (path.isEmpty()) {
            return Location.root(root);
        }

        final int lastIndex = path.size() - 1;
        JsonNode current = root;
        for (int i = 0; i < lastIndex; i++) {
            final PathComponent component = path.get(i);
            final JsonNode child = child(current, component);
            if (child == null) {
                if (createParents && canCreate(path, i)) {
                    final List<String> missingKeys = new ArrayList<>(lastIndex - i);
                    for (int j = i; j < lastIndex; j++) {
                        missingKeys.add(path.get(j).key());
                    }
                    return Location.missingParents((ObjectNode) current, missingKeys, path.last());
                }
                throw notFound(path, i);
            }
            current = child;
        }

        final PathComponent last = path.last();
        final JsonNode value = child(current, last);
        final int index;
        if (last.isIndex()) {
            index = last.isLast() ? current.size() - 1 : last.index();
        } else {
            index = -1;
        }
        return Location.of(current, last, value, index);
    }

    /**
     * Returns the child of {@code container} addressed by {@code component}, or {@code null} if absent.
     */
    @Nullable
    private static JsonNode child(JsonNode container, PathComponent component) {
        if (component.isKey()) {
            if (!container.isObject()) {
                throw new SubdocException(SubdocStatus.PATH_MISMATCH,
                                          "not an object: " + container.getNodeType(), false);
            }
            return container.get(component.key());
        }

        if (!container.isArray()) {
            throw new SubdocException(SubdocStatus.PATH_MISMATCH,
                                      "not an array: " + container.getNodeType(), false);
        }
        final int size = container.size();
        if (component.isLast()) {
            return size == 0 ? null : container.get(size - 1);
        }
        final int index = component.index();
        return index < size ? container.get(index) : null;
    }

    /**
     * Returns {@code true} if the components from {@code from} to the end of {@code path} are all keys.
     */
    private static boolean canCreate(ParsedPath path, int from) {
        for (int i = from; i < path.size(); i++) {
            if (!path.get(i).isKey()) {
                return false;
            }
        }
        return true;
    }

    private static SubdocException notFound(ParsedPath path, int componentIndex) {
        return new SubdocException(SubdocStatus.PATH_NOT_FOUND,
                                   "path not found: " + path + " (missing component: " + componentIndex + ')',
                                   false);
    }

    private DocumentNavigator() {}
}

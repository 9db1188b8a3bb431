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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.google.common.primitives.Ints;

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocLimits;
import com.linecorp.subdoc.common.SubdocStatus;

/**
 * Parses a path such as {@code foo.bar[0][-1].baz} into a {@link ParsedPath}.
 *
 * <pre>{@code
 * path      := component (component)*
 * component := ['.'] key | '[' index ']'
 * key       := a non-empty run of characters other than '.' and '['
 * index     := digits | "-1"
 * }</pre>
 *
 * <p>A key must be preceded by a {@code .} unless it is the first component. The empty string is the
 * path of the document root.
 */
public final class PathParser {

    /**
     * Parses the specified {@code path}.
     *
     * @throws SubdocException with {@link SubdocStatus#INVALID_ARGUMENTS} if the path is too long,
     *                         {@link SubdocStatus#PATH_INVALID} if the path is malformed or
     *                         {@link SubdocStatus#PATH_TOO_BIG} if the path has too many components
     */
    public static ParsedPath parse(String path) {
        requireNonNull(path, "path");
        if (path.length() > SubdocLimits.MAX_PATH_LENGTH ||
            path.getBytes(StandardCharsets.UTF_8).length > SubdocLimits.MAX_PATH_LENGTH) {
            throw new SubdocException(SubdocStatus.INVALID_ARGUMENTS,
                                      "path too long (expected: <= " + SubdocLimits.MAX_PATH_LENGTH +
                                      " bytes)", false);
        }
        if (path.isEmpty()) {
            return ParsedPath.root();
        }

        final List<PathComponent> components = new ArrayList<>();
        final int length = path.length();
        int i = 0;
        while (i < length) {
            final char ch = path.charAt(i);
            if (ch == '[') {
                final int end = path.indexOf(']', i + 1);
                if (end < 0) {
                    throw invalid(path, "unmatched '['");
                }
                components.add(parseIndex(path, path.substring(i + 1, end)));
                i = end + 1;
            } else {
                if (ch == '.') {
                    if (components.isEmpty()) {
                        throw invalid(path, "empty key");
                    }
                    i++;
                } else if (!components.isEmpty()) {
                    // A key right after ']'.
                    throw invalid(path, "missing '.' before a key");
                }
                final int start = i;
                while (i < length) {
                    final char c = path.charAt(i);
                    if (c == '.' || c == '[') {
                        break;
                    }
                    i++;
                }
                if (start == i) {
                    throw invalid(path, "empty key");
                }
                components.add(PathComponent.ofKey(path.substring(start, i)));
            }

            if (components.size() > SubdocLimits.MAX_PATH_COMPONENTS) {
                throw new SubdocException(SubdocStatus.PATH_TOO_BIG,
                                          "too many path components (expected: <= " +
                                          SubdocLimits.MAX_PATH_COMPONENTS + ')', false);
            }
        }
        return ParsedPath.of(components);
    }

    private static PathComponent parseIndex(String path, String token) {
        if ("-1".equals(token)) {
            return PathComponent.last();
        }
        if (token.isEmpty()) {
            throw invalid(path, "empty index");
        }
        for (int i = 0; i < token.length(); i++) {
            final char c = token.charAt(i);
            if (c < '0' || c > '9') {
                throw invalid(path, "not an index: " + token + " (expected: a non-negative integer or -1)");
            }
        }
        final Integer index = Ints.tryParse(token);
        if (index == null) {
            throw invalid(path, "index out of range: " + token);
        }
        return PathComponent.ofIndex(index);
    }

    private static SubdocException invalid(String path, String reason) {
        return new SubdocException(SubdocStatus.PATH_INVALID, "invalid path: " + path + " (" + reason + ')',
                                   false);
    }

    private PathParser() {}
}

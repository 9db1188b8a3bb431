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

import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.exc.StreamConstraintsException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Longs;

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocFlags;
import com.linecorp.subdoc.common.SubdocLimits;
import com.linecorp.subdoc.common.SubdocOpcode;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.internal.Jackson;
import com.linecorp.subdoc.internal.path.ParsedPath;
import com.linecorp.subdoc.internal.path.PathComponent;
import com.linecorp.subdoc.internal.path.PathParser;

/**
 * Applies a single-path lookup or mutation to a parsed JSON document.
 *
 * <p>A mutation modifies the specified tree in place, and only after every check has passed, so the
 * tree is left untouched when a {@link SubdocException} is raised.
 */
public final class SubdocOperations {

    private static final byte[] EMPTY = new byte[0];

    /**
     * Parses a stored document. The root of a document must be an object or an array.
     *
     * @throws SubdocException with {@link SubdocStatus#DOC_NOT_JSON} or {@link SubdocStatus#DOC_TOO_DEEP}
     */
    public static JsonNode parseDocument(byte[] content) {
        requireNonNull(content, "content");
        final JsonNode root;
        try {
            root = Jackson.readTree(content);
        } catch (StreamConstraintsException e) {
            throw new SubdocException(SubdocStatus.DOC_TOO_DEEP, "document too deep", e);
        } catch (JsonProcessingException e) {
            throw new SubdocException(SubdocStatus.DOC_NOT_JSON, "document is not JSON", e);
        }
        if (!root.isContainerNode()) {
            throw new SubdocException(SubdocStatus.DOC_NOT_JSON,
                                      "document root is not a container: " + root.getNodeType(), false);
        }
        return root;
    }

    /**
     * Checks the arguments of a single-path command or of a spec of a multi-path command, before the
     * document is fetched.
     *
     * @throws SubdocException with {@link SubdocStatus#INVALID_ARGUMENTS}
     */
    public static void checkArguments(SubdocOpcode opcode, String path, byte[] value, int flags) {
        requireNonNull(opcode, "opcode");
        requireNonNull(path, "path");
        requireNonNull(value, "value");
        if (opcode.isMulti()) {
            throw new IllegalArgumentException("not a single-path opcode: " + opcode);
        }
        if (path.length() > SubdocLimits.MAX_PATH_LENGTH ||
            path.getBytes(StandardCharsets.UTF_8).length > SubdocLimits.MAX_PATH_LENGTH) {
            throw invalidArguments("path too long (expected: <= " + SubdocLimits.MAX_PATH_LENGTH + " bytes)");
        }
        if (!SubdocFlags.isValid(flags)) {
            throw invalidArguments("unknown flags: 0x" + Integer.toHexString(flags));
        }
        if (SubdocFlags.isMkdirP(flags) && !opcode.acceptsMkdirP()) {
            throw invalidArguments("MKDIR_P not allowed for " + opcode);
        }
        if (path.isEmpty() && !opcode.allowsEmptyPath()) {
            throw invalidArguments("empty path not allowed for " + opcode);
        }
        if (opcode.requiresValue()) {
            if (value.length == 0) {
                throw invalidArguments("missing value for " + opcode);
            }
        } else if (value.length != 0) {
            throw invalidArguments("unexpected value for " + opcode);
        }
    }

    /**
     * Performs a {@link SubdocOpcode#GET} or {@link SubdocOpcode#EXISTS}.
     *
     * @return the serialized fragment for {@link SubdocOpcode#GET}, or an empty array
     */
    public static byte[] lookup(SubdocOpcode opcode, JsonNode root, String path) {
        requireNonNull(opcode, "opcode");
        requireNonNull(root, "root");
        final ParsedPath parsedPath = PathParser.parse(requireNonNull(path, "path"));
        final Location location = DocumentNavigator.navigate(root, parsedPath, false);
        final JsonNode value = location.value();
        if (value == null) {
            throw pathNotFound(parsedPath);
        }

        switch (opcode) {
            case GET:
                return Jackson.writeValueAsBytes(value);
            case EXISTS:
                return EMPTY;
            default:
                throw new IllegalArgumentException("not a lookup: " + opcode);
        }
    }

    /**
     * Performs a mutation on {@code root}.
     *
     * @return the result fragment, or {@code null} if the operation yields none
     */
    @Nullable
    public static byte[] mutate(SubdocOpcode opcode, JsonNode root, String path, byte[] value, int flags) {
        requireNonNull(opcode, "opcode");
        requireNonNull(root, "root");
        requireNonNull(value, "value");
        final ParsedPath parsedPath = PathParser.parse(requireNonNull(path, "path"));
        final boolean mkdirP = SubdocFlags.isMkdirP(flags);

        switch (opcode) {
            case DICT_ADD:
                dictSet(root, parsedPath, value, mkdirP, false);
                return null;
            case DICT_UPSERT:
                dictSet(root, parsedPath, value, mkdirP, true);
                return null;
            case DELETE:
                delete(root, parsedPath);
                return null;
            case REPLACE:
                replace(root, parsedPath, value);
                return null;
            case ARRAY_PUSH_LAST:
                push(root, parsedPath, value, mkdirP, false);
                return null;
            case ARRAY_PUSH_FIRST:
                push(root, parsedPath, value, mkdirP, true);
                return null;
            case ARRAY_INSERT:
                insert(root, parsedPath, value);
                return null;
            case ARRAY_ADD_UNIQUE:
                addUnique(root, parsedPath, value, mkdirP);
                return null;
            case COUNTER:
                return counter(root, parsedPath, value, mkdirP);
            default:
                throw new IllegalArgumentException("not a mutation: " + opcode);
        }
    }

    private static void dictSet(JsonNode root, ParsedPath path, byte[] value, boolean mkdirP,
                                boolean overwrite) {
        requireNonEmpty(path);
        if (!path.last().isKey()) {
            throw new SubdocException(SubdocStatus.PATH_INVALID,
                                      "the last path component must be a key: " + path, false);
        }
        final Location location = DocumentNavigator.navigate(root, path, mkdirP);
        if (!overwrite && location.exists()) {
            throw new SubdocException(SubdocStatus.PATH_EXISTS, "path exists: " + path, false);
        }
        final JsonNode node = parseValue(value);
        checkDepth(path.level(), node);

        final ObjectNode container = (ObjectNode) location.materializeContainer();
        container.set(path.last().key(), node);
    }

    private static void delete(JsonNode root, ParsedPath path) {
        requireNonEmpty(path);
        final Location location = DocumentNavigator.navigate(root, path, false);
        if (!location.exists()) {
            throw pathNotFound(path);
        }
        final JsonNode container = location.container();
        if (container.isObject()) {
            ((ObjectNode) container).remove(location.component().key());
        } else {
            ((ArrayNode) container).remove(location.index());
        }
    }

    private static void replace(JsonNode root, ParsedPath path, byte[] value) {
        requireNonEmpty(path);
        final Location location = DocumentNavigator.navigate(root, path, false);
        if (!location.exists()) {
            throw pathNotFound(path);
        }
        final JsonNode node = parseValue(value);
        checkDepth(path.level(), node);

        final JsonNode container = location.container();
        if (container.isObject()) {
            ((ObjectNode) container).set(location.component().key(), node);
        } else {
            ((ArrayNode) container).set(location.index(), node);
        }
    }

    private static void push(JsonNode root, ParsedPath path, byte[] value, boolean mkdirP, boolean first) {
        final Location location = DocumentNavigator.navigate(root, path, mkdirP);
        final List<JsonNode> nodes = parseValues(value);
        for (JsonNode node : nodes) {
            checkDepth(path.level() + 1, node);
        }

        final JsonNode target = location.value();
        if (target == null) {
            createArray(location, path, mkdirP).addAll(nodes);
            return;
        }
        if (!target.isArray()) {
            throw notAnArray(path, target);
        }
        final ArrayNode array = (ArrayNode) target;
        if (first) {
            for (int i = nodes.size() - 1; i >= 0; i--) {
                array.insert(0, nodes.get(i));
            }
        } else {
            array.addAll(nodes);
        }
    }

    private static void insert(JsonNode root, ParsedPath path, byte[] value) {
        requireNonEmpty(path);
        final PathComponent last = path.last();
        if (!last.isIndex() || last.isLast()) {
            throw new SubdocException(SubdocStatus.PATH_INVALID,
                                      "the last path component must be a non-negative index: " + path,
                                      false);
        }
        final Location location = DocumentNavigator.navigate(root, path, false);
        final ArrayNode array = (ArrayNode) location.container();
        final int index = location.index();
        if (index > array.size()) {
            throw pathNotFound(path);
        }
        final JsonNode node = parseValue(value);
        checkDepth(path.level(), node);

        array.insert(index, node);
    }

    private static void addUnique(JsonNode root, ParsedPath path, byte[] value, boolean mkdirP) {
        final Location location = DocumentNavigator.navigate(root, path, mkdirP);
        final JsonNode node = parseValue(value);
        if (!node.isValueNode()) {
            throw new SubdocException(SubdocStatus.PATH_MISMATCH,
                                      "only a scalar can be added as a unique value: " + node.getNodeType(),
                                      false);
        }
        checkDepth(path.level() + 1, node);

        final JsonNode target = location.value();
        if (target == null) {
            createArray(location, path, mkdirP).add(node);
            return;
        }
        if (!target.isArray()) {
            throw notAnArray(path, target);
        }
        for (JsonNode element : target) {
            if (!element.isValueNode()) {
                throw new SubdocException(SubdocStatus.PATH_MISMATCH,
                                          "array has a non-scalar element: " + path, false);
            }
            if (element.equals(node)) {
                throw new SubdocException(SubdocStatus.PATH_EXISTS, "value exists in " + path, false);
            }
        }
        ((ArrayNode) target).add(node);
    }

    private static byte[] counter(JsonNode root, ParsedPath path, byte[] value, boolean mkdirP) {
        requireNonEmpty(path);
        final Location location = DocumentNavigator.navigate(root, path, mkdirP);
        final long delta = parseDelta(value);

        final JsonNode target = location.value();
        final long base;
        if (target == null) {
            if (!location.component().isKey()) {
                throw pathNotFound(path);
            }
            base = 0;
        } else {
            if (!target.isIntegralNumber()) {
                throw new SubdocException(SubdocStatus.PATH_MISMATCH,
                                          "not an integer: " + target.getNodeType(), false);
            }
            if (!target.canConvertToLong()) {
                throw new SubdocException(SubdocStatus.NUM_RANGE,
                                          "number out of range: " + target.asText(), false);
            }
            base = target.longValue();
        }

        final long result;
        try {
            result = Math.addExact(base, delta);
        } catch (ArithmeticException e) {
            throw new SubdocException(SubdocStatus.VALUE_CANT_INSERT,
                                      "counter overflow: " + base + " + " + delta, false);
        }

        final JsonNode container = location.materializeContainer();
        if (container.isObject()) {
            ((ObjectNode) container).set(location.component().key(), LongNode.valueOf(result));
        } else {
            ((ArrayNode) container).set(location.index(), LongNode.valueOf(result));
        }
        return Long.toString(result).getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Creates a new empty array at an absent location, together with its missing parents.
     */
    private static ArrayNode createArray(Location location, ParsedPath path, boolean mkdirP) {
        if (!mkdirP || location.isRoot() || !location.component().isKey()) {
            throw pathNotFound(path);
        }
        return ((ObjectNode) location.materializeContainer()).putArray(location.component().key());
    }

    static JsonNode parseValue(byte[] value) {
        final JsonNode node;
        try {
            node = Jackson.readTree(value);
        } catch (StreamConstraintsException e) {
            throw new SubdocException(SubdocStatus.VALUE_TOO_DEEP, "value too deep", e);
        } catch (JsonProcessingException e) {
            throw new SubdocException(SubdocStatus.VALUE_CANT_INSERT, "value is not JSON", e);
        }
        if (node.isMissingNode()) {
            throw new SubdocException(SubdocStatus.VALUE_CANT_INSERT, "value is empty", false);
        }
        return node;
    }

    /**
     * Parses a comma-separated list of JSON values, e.g. {@code 1,"two",{"three":3}}.
     */
    static List<JsonNode> parseValues(byte[] value) {
        final byte[] wrapped = new byte[value.length + 2];
        wrapped[0] = '[';
        System.arraycopy(value, 0, wrapped, 1, value.length);
        wrapped[wrapped.length - 1] = ']';

        final JsonNode array = parseValue(wrapped);
        if (array.isEmpty()) {
            throw new SubdocException(SubdocStatus.VALUE_CANT_INSERT, "no values", false);
        }
        return ImmutableList.copyOf(array);
    }

    /**
     * Parses a counter delta: a non-zero signed 64-bit decimal integer without a leading {@code +}.
     */
    static long parseDelta(byte[] value) {
        final String text = new String(value, StandardCharsets.US_ASCII);
        final Long delta = text.startsWith("+") ? null : Longs.tryParse(text);
        if (delta == null) {
            throw new SubdocException(SubdocStatus.DELTA_INVALID, "not an integer delta: " + text, false);
        }
        if (delta == 0) {
            throw new SubdocException(SubdocStatus.DELTA_INVALID, "zero delta", false);
        }
        return delta;
    }

    /**
     * Ensures that {@code value} placed at {@code level} does not exceed {@link SubdocLimits#MAX_DEPTH}.
     */
    private static void checkDepth(int level, JsonNode value) {
        final int limit = SubdocLimits.MAX_DEPTH - level + 1;
        if (limit < 1 || DocumentDepth.depth(value, limit) > limit) {
            throw new SubdocException(SubdocStatus.VALUE_TOO_DEEP,
                                      "value too deep (expected: <= " + SubdocLimits.MAX_DEPTH + " levels)",
                                      false);
        }
    }

    private static void requireNonEmpty(ParsedPath path) {
        if (path.isEmpty()) {
            throw invalidArguments("empty path");
        }
    }

    private static SubdocException pathNotFound(ParsedPath path) {
        return new SubdocException(SubdocStatus.PATH_NOT_FOUND, "path not found: " + path, false);
    }

    private static SubdocException notAnArray(ParsedPath path, JsonNode target) {
        return new SubdocException(SubdocStatus.PATH_MISMATCH,
                                   "not an array: " + path + " (" + target.getNodeType() + ')', false);
    }

    private static SubdocException invalidArguments(String message) {
        return new SubdocException(SubdocStatus.INVALID_ARGUMENTS, message, false);
    }

    private SubdocOperations() {}
}

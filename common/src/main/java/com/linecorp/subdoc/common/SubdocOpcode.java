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

package com.linecorp.subdoc.common;

import javax.annotation.Nullable;

/**
 * Subdocument command opcodes.
 */
public enum SubdocOpcode {
    GET(0xc5, Kind.LOOKUP, true, false),
    EXISTS(0xc6, Kind.LOOKUP, true, false),
    DICT_ADD(0xc7, Kind.MUTATION, false, true),
    DICT_UPSERT(0xc8, Kind.MUTATION, false, true),
    DELETE(0xc9, Kind.MUTATION, false, false),
    REPLACE(0xca, Kind.MUTATION, false, true),
    ARRAY_PUSH_LAST(0xcb, Kind.MUTATION, true, true),
    ARRAY_PUSH_FIRST(0xcc, Kind.MUTATION, true, true),
    ARRAY_INSERT(0xcd, Kind.MUTATION, false, true),
    ARRAY_ADD_UNIQUE(0xce, Kind.MUTATION, true, true),
    COUNTER(0xcf, Kind.MUTATION, false, true),
    MULTI_LOOKUP(0xd0, Kind.MULTI_LOOKUP, false, false),
    MULTI_MUTATION(0xd1, Kind.MULTI_MUTATION, false, false);

    private enum Kind {
        LOOKUP, MUTATION, MULTI_LOOKUP, MULTI_MUTATION
    }

    private final int code;
    private final Kind kind;
    private final boolean allowsEmptyPath;
    private final boolean requiresValue;

    SubdocOpcode(int code, Kind kind, boolean allowsEmptyPath, boolean requiresValue) {
        this.code = code;
        this.kind = kind;
        this.allowsEmptyPath = allowsEmptyPath;
        this.requiresValue = requiresValue;
    }

    /**
     * Returns the 8-bit wire value of this opcode.
     */
    public int code() {
        return code;
    }

    /**
     * Returns {@code true} if this is a single-path read-only opcode.
     */
    public boolean isLookup() {
        return kind == Kind.LOOKUP;
    }

    /**
     * Returns {@code true} if this is a single-path opcode that modifies the document.
     */
    public boolean isMutation() {
        return kind == Kind.MUTATION;
    }

    public boolean isMulti() {
        return kind == Kind.MULTI_LOOKUP || kind == Kind.MULTI_MUTATION;
    }

    /**
     * Returns {@code true} if this opcode may address the document root with an empty path.
     */
    public boolean allowsEmptyPath() {
        return allowsEmptyPath;
    }

    /**
     * Returns {@code true} if this opcode takes a value fragment.
     */
    public boolean requiresValue() {
        return requiresValue;
    }

    /**
     * Returns {@code true} if {@link SubdocFlags#MKDIR_P} is meaningful for this opcode.
     */
    public boolean acceptsMkdirP() {
        return isMutation() && this != ARRAY_INSERT;
    }

    /**
     * Returns the {@link SubdocOpcode} whose wire value is {@code code}, or {@code null} if unknown.
     */
    @Nullable
    public static SubdocOpcode of(int code) {
        for (SubdocOpcode opcode : values()) {
            if (opcode.code == code) {
                return opcode;
            }
        }
        return null;
    }
}

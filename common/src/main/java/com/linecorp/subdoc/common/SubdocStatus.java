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
 * The status of a subdocument command or of a single spec in a multi-path command, with its wire value.
 */
public enum SubdocStatus {
    SUCCESS(0x00),
    KEY_NOT_FOUND(0x01),
    KEY_EXISTS(0x02),
    INVALID_ARGUMENTS(0x04),
    NOT_MY_PARTITION(0x07),
    TEMPORARY_FAILURE(0x86),
    /**
     * The path does not exist in the document.
     */
    PATH_NOT_FOUND(0xc0),
    /**
     * One of the path components addresses a value of a different type.
     */
    PATH_MISMATCH(0xc1),
    /**
     * The path has a syntax error or an illegal array index.
     */
    PATH_INVALID(0xc2),
    /**
     * The path has too many components.
     */
    PATH_TOO_BIG(0xc3),
    DOC_TOO_DEEP(0xc4),
    /**
     * The value cannot be inserted, because it is not valid JSON or because the arithmetic overflowed.
     */
    VALUE_CANT_INSERT(0xc5),
    DOC_NOT_JSON(0xc6),
    /**
     * The existing number is outside the signed 64-bit range.
     */
    NUM_RANGE(0xc7),
    /**
     * The counter delta is not a non-zero signed 64-bit integer.
     */
    DELTA_INVALID(0xc8),
    PATH_EXISTS(0xc9),
    /**
     * Inserting the value would make the document deeper than allowed.
     */
    VALUE_TOO_DEEP(0xca),
    INVALID_COMBO(0xcb),
    /**
     * One of the specs of a multi-mutation failed. The failing index and status are in the body.
     */
    MULTI_PATH_FAILURE(0xcc);

    private final int code;

    SubdocStatus(int code) {
        this.code = code;
    }

    /**
     * Returns the 16-bit wire value of this status.
     */
    public int code() {
        return code;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * Returns the {@link SubdocStatus} whose wire value is {@code code}, or {@code null} if unknown.
     */
    @Nullable
    public static SubdocStatus of(int code) {
        for (SubdocStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return null;
    }
}

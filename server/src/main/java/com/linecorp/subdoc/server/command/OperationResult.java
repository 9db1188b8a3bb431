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

package com.linecorp.subdoc.server.command;

import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;

import com.google.common.base.MoreObjects;

import com.linecorp.subdoc.common.SubdocStatus;

/**
 * The outcome of a single spec of a multi-path command.
 */
public final class OperationResult {

    private final int index;
    private final SubdocStatus status;
    private final byte[] value;

    public OperationResult(int index, SubdocStatus status, byte[] value) {
        this.index = index;
        this.status = requireNonNull(status, "status");
        this.value = requireNonNull(value, "value");
    }

    /**
     * Returns the zero-based position of the spec in the command.
     */
    public int index() {
        return index;
    }

    public SubdocStatus status() {
        return status;
    }

    /**
     * Returns the result fragment. Empty if the spec failed or yields no fragment.
     */
    public byte[] value() {
        return value;
    }

    public String valueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("index", index)
                          .add("status", status)
                          .add("value", valueAsString())
                          .toString();
    }
}

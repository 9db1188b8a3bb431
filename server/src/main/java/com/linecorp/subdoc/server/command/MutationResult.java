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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

import com.linecorp.subdoc.server.storage.MutationToken;

/**
 * The result of a {@link MutationCommand}.
 */
public final class MutationResult {

    private final long cas;
    private final MutationToken mutationToken;
    @Nullable
    private final byte[] value;

    public MutationResult(long cas, MutationToken mutationToken, @Nullable byte[] value) {
        this.cas = cas;
        this.mutationToken = requireNonNull(mutationToken, "mutationToken");
        this.value = value;
    }

    /**
     * Returns the CAS of the stored document.
     */
    public long cas() {
        return cas;
    }

    public MutationToken mutationToken() {
        return mutationToken;
    }

    /**
     * Returns the result fragment, which is the new value of a {@code COUNTER}, or {@code null}.
     */
    @Nullable
    public byte[] value() {
        return value;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("cas", cas)
                          .add("mutationToken", mutationToken)
                          .add("value", value != null ? new String(value, StandardCharsets.UTF_8) : null)
                          .toString();
    }
}

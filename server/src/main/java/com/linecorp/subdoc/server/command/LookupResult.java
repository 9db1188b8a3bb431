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

/**
 * The result of a {@link LookupCommand}.
 */
public final class LookupResult {

    private final byte[] value;
    private final long cas;

    public LookupResult(byte[] value, long cas) {
        this.value = requireNonNull(value, "value");
        this.cas = cas;
    }

    /**
     * Returns the serialized fragment, or an empty array for {@code EXISTS}.
     */
    public byte[] value() {
        return value;
    }

    public String valueAsString() {
        return new String(value, StandardCharsets.UTF_8);
    }

    /**
     * Returns the CAS of the document the fragment was read from.
     */
    public long cas() {
        return cas;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("value", valueAsString())
                          .add("cas", cas)
                          .toString();
    }
}

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

package com.linecorp.subdoc.server.protocol;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

/**
 * A subdocument request as it arrives from the framing layer.
 */
public final class SubdocRequest {

    private static final byte[] EMPTY = new byte[0];

    /**
     * Returns a new request without extras and CAS.
     */
    public static SubdocRequest of(int opcode, String key, byte[] body) {
        return new SubdocRequest(opcode, key, EMPTY, body, 0);
    }

    private final int opcode;
    private final String key;
    private final byte[] extras;
    private final byte[] body;
    private final long cas;

    public SubdocRequest(int opcode, String key, byte[] extras, byte[] body, long cas) {
        this.opcode = opcode;
        this.key = requireNonNull(key, "key");
        this.extras = requireNonNull(extras, "extras");
        this.body = requireNonNull(body, "body");
        this.cas = cas;
    }

    /**
     * Returns the 8-bit opcode.
     */
    public int opcode() {
        return opcode;
    }

    public String key() {
        return key;
    }

    public byte[] extras() {
        return extras;
    }

    public byte[] body() {
        return body;
    }

    public long cas() {
        return cas;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("opcode", "0x" + Integer.toHexString(opcode))
                          .add("key", key)
                          .add("extrasLength", extras.length)
                          .add("bodyLength", body.length)
                          .add("cas", cas)
                          .toString();
    }
}

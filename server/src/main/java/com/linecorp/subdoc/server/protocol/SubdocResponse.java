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

import java.nio.charset.StandardCharsets;

import com.google.common.base.MoreObjects;

import com.linecorp.subdoc.common.SubdocStatus;

/**
 * A subdocument response to be written by the framing layer.
 */
public final class SubdocResponse {

    private final SubdocStatus status;
    private final byte[] extras;
    private final byte[] body;
    private final long cas;

    public SubdocResponse(SubdocStatus status, byte[] extras, byte[] body, long cas) {
        this.status = requireNonNull(status, "status");
        this.extras = requireNonNull(extras, "extras");
        this.body = requireNonNull(body, "body");
        this.cas = cas;
    }

    public SubdocStatus status() {
        return status;
    }

    /**
     * Returns the extras, which hold the mutation token if it was negotiated.
     */
    public byte[] extras() {
        return extras;
    }

    public byte[] body() {
        return body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * Returns the CAS of the document, or {@code 0} if the command failed.
     */
    public long cas() {
        return cas;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("status", status)
                          .add("extrasLength", extras.length)
                          .add("bodyLength", body.length)
                          .add("cas", cas)
                          .toString();
    }
}

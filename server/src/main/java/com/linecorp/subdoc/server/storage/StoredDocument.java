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

package com.linecorp.subdoc.server.storage;

import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

/**
 * A snapshot of a document in a {@link DocumentStore}.
 */
public final class StoredDocument {

    private final String key;
    private final byte[] content;
    private final long cas;
    private final int flags;
    private final long expiry;
    private final Datatype datatype;

    /**
     * Creates a new instance.
     *
     * @param key the key of the document
     * @param content the stored bytes
     * @param cas the current CAS of the document
     * @param flags the opaque user flags
     * @param expiry the expiration time in seconds since the epoch, or {@code 0} if the document never expires
     * @param datatype the encoding of {@code content}
     */
    public StoredDocument(String key, byte[] content, long cas, int flags, long expiry, Datatype datatype) {
        this.key = requireNonNull(key, "key");
        this.content = requireNonNull(content, "content");
        this.cas = cas;
        this.flags = flags;
        this.expiry = expiry;
        this.datatype = requireNonNull(datatype, "datatype");
    }

    public String key() {
        return key;
    }

    /**
     * Returns the stored bytes. The returned array must not be modified.
     */
    public byte[] content() {
        return content;
    }

    public long cas() {
        return cas;
    }

    public int flags() {
        return flags;
    }

    /**
     * Returns the expiration time in seconds since the epoch, or {@code 0} if the document never expires.
     */
    public long expiry() {
        return expiry;
    }

    public Datatype datatype() {
        return datatype;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("key", key)
                          .add("length", content.length)
                          .add("cas", cas)
                          .add("flags", flags)
                          .add("expiry", expiry)
                          .add("datatype", datatype)
                          .toString();
    }
}

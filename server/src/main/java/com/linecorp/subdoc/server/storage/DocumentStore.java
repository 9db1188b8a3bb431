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

import javax.annotation.Nullable;

import com.linecorp.subdoc.common.NotOwnerException;

/**
 * A key-value store that holds documents and supports conditional updates.
 *
 * <p>Both methods may raise a {@link NotOwnerException} if the key does not belong to this node.
 */
public interface DocumentStore {

    /**
     * Returns the document with the specified {@code key}, or {@code null} if it does not exist or has
     * expired.
     */
    @Nullable
    StoredDocument get(String key);

    /**
     * Replaces the content of the document with the specified {@code key} if its CAS is still
     * {@code expectedCas}. The flags and the datatype of the document are kept.
     *
     * @param expiry the new time to live in seconds ({@code 0} means never), or {@code null} to keep
     *               the current expiration time
     * @return the new CAS, which is different from {@code expectedCas}, and the {@link MutationToken}
     * @throws CasConflictException if the document has been modified or removed since it was fetched
     */
    StoreResult casStore(String key, byte[] content, long expectedCas, @Nullable Integer expiry);
}

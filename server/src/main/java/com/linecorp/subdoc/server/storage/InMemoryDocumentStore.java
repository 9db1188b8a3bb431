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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;

/**
 * A {@link DocumentStore} that keeps the documents in memory. Every store gets a CAS that has never been
 * used before, and expired documents are treated as absent.
 */
public final class InMemoryDocumentStore implements DocumentStore {

    private final ConcurrentMap<String, StoredDocument> documents = new ConcurrentHashMap<>();
    private final AtomicLong lastCas = new AtomicLong();
    private final AtomicLong lastSeqno = new AtomicLong();
    private final long partitionUuid;
    private final Clock clock;

    public InMemoryDocumentStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDocumentStore(Clock clock) {
        this.clock = requireNonNull(clock, "clock");
        partitionUuid = ThreadLocalRandom.current().nextLong();
    }

    /**
     * Stores a JSON document unconditionally.
     *
     * @return the CAS of the stored document
     */
    public long store(String key, String json) {
        requireNonNull(json, "json");
        return store(key, json.getBytes(StandardCharsets.UTF_8), 0, Datatype.JSON, 0);
    }

    /**
     * Stores a document unconditionally.
     *
     * @param ttlSeconds the time to live in seconds, or {@code 0} if the document never expires
     * @return the CAS of the stored document
     */
    public long store(String key, byte[] content, int flags, Datatype datatype, int ttlSeconds) {
        requireNonNull(key, "key");
        requireNonNull(content, "content");
        requireNonNull(datatype, "datatype");
        checkArgument(ttlSeconds >= 0, "ttlSeconds: %s (expected: >= 0)", ttlSeconds);
        final long cas = lastCas.incrementAndGet();
        documents.put(key, new StoredDocument(key, content.clone(), cas, flags, expiryOf(ttlSeconds),
                                              datatype));
        return cas;
    }

    /**
     * Removes the document with the specified {@code key}.
     *
     * @return {@code true} if the document existed
     */
    public boolean remove(String key) {
        return documents.remove(requireNonNull(key, "key")) != null;
    }

    /**
     * Returns the UUID reported in the {@link MutationToken}s of this store.
     */
    public long partitionUuid() {
        return partitionUuid;
    }

    @Nullable
    @Override
    public StoredDocument get(String key) {
        requireNonNull(key, "key");
        final StoredDocument document = documents.get(key);
        if (document == null) {
            return null;
        }
        if (isExpired(document)) {
            documents.remove(key, document);
            return null;
        }
        return document;
    }

    @Override
    public StoreResult casStore(String key, byte[] content, long expectedCas, @Nullable Integer expiry) {
        requireNonNull(key, "key");
        requireNonNull(content, "content");
        checkArgument(expiry == null || expiry >= 0, "expiry: %s (expected: >= 0)", expiry);

        final long[] seqno = new long[1];
        final StoredDocument updated = documents.compute(key, (k, current) -> {
            if (current == null || isExpired(current) || current.cas() != expectedCas) {
                throw new CasConflictException(k);
            }
            seqno[0] = lastSeqno.incrementAndGet();
            return new StoredDocument(k, content.clone(), lastCas.incrementAndGet(), current.flags(),
                                      expiry != null ? expiryOf(expiry) : current.expiry(),
                                      current.datatype());
        });
        return new StoreResult(updated.cas(), new MutationToken(partitionUuid, seqno[0]));
    }

    private long expiryOf(int ttlSeconds) {
        return ttlSeconds == 0 ? 0 : clock.instant().getEpochSecond() + ttlSeconds;
    }

    private boolean isExpired(StoredDocument document) {
        return document.expiry() != 0 && document.expiry() <= clock.instant().getEpochSecond();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("documents", documents.size())
                          .add("lastCas", lastCas.get())
                          .add("partitionUuid", partitionUuid)
                          .toString();
    }
}

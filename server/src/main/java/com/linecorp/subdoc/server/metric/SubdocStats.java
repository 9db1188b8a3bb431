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

package com.linecorp.subdoc.server.metric;

import static java.util.Objects.requireNonNull;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counts the successful subdocument commands and the bytes they involved.
 */
public final class SubdocStats {

    private final Counter lookupCommands;
    private final Counter lookupTotalBytes;
    private final Counter lookupExtractedBytes;
    private final Counter mutationCommands;
    private final Counter mutationTotalBytes;
    private final Counter mutationInsertedBytes;
    private final Counter casRetries;

    public SubdocStats(MeterRegistry registry) {
        requireNonNull(registry, "registry");
        lookupCommands = Counter.builder("subdoc.lookup.commands")
                                .description("The number of successful lookups")
                                .register(registry);
        lookupTotalBytes = Counter.builder("subdoc.lookup.bytes.total")
                                  .description("The total size of the documents read by lookups")
                                  .baseUnit("bytes")
                                  .register(registry);
        lookupExtractedBytes = Counter.builder("subdoc.lookup.bytes.extracted")
                                      .description("The total size of the fragments returned by lookups")
                                      .baseUnit("bytes")
                                      .register(registry);
        mutationCommands = Counter.builder("subdoc.mutation.commands")
                                  .description("The number of successful mutations")
                                  .register(registry);
        mutationTotalBytes = Counter.builder("subdoc.mutation.bytes.total")
                                    .description("The total size of the documents stored by mutations")
                                    .baseUnit("bytes")
                                    .register(registry);
        mutationInsertedBytes = Counter.builder("subdoc.mutation.bytes.inserted")
                                       .description("The total size of the fragments supplied to mutations")
                                       .baseUnit("bytes")
                                       .register(registry);
        casRetries = Counter.builder("subdoc.cas.retries")
                            .description("The number of mutations retried after a CAS conflict")
                            .register(registry);
    }

    /**
     * Records a successful lookup.
     *
     * @param documentBytes the size of the document the lookup read
     * @param extractedBytes the size of the fragments returned
     */
    public void lookup(long documentBytes, long extractedBytes) {
        lookupCommands.increment();
        lookupTotalBytes.increment(documentBytes);
        lookupExtractedBytes.increment(extractedBytes);
    }

    /**
     * Records a successful mutation.
     *
     * @param documentBytes the size of the stored document
     * @param insertedBytes the size of the value fragments supplied
     */
    public void mutation(long documentBytes, long insertedBytes) {
        mutationCommands.increment();
        mutationTotalBytes.increment(documentBytes);
        mutationInsertedBytes.increment(insertedBytes);
    }

    public void casRetried() {
        casRetries.increment();
    }
}

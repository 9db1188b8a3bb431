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

package com.linecorp.subdoc.server;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import javax.annotation.Nullable;

import com.linecorp.subdoc.server.command.SubdocCommandExecutor;
import com.linecorp.subdoc.server.storage.DocumentStore;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;

/**
 * Builds a new {@link SubdocEngine}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * SubdocEngine engine = new SubdocEngineBuilder()
 *         .store(store)
 *         .numWorkers(4)
 *         .build();
 * }</pre>
 */
public final class SubdocEngineBuilder {

    static final int DEFAULT_NUM_WORKERS = 16;

    @Nullable
    private DocumentStore store;
    private MeterRegistry meterRegistry = Metrics.globalRegistry;
    private int numWorkers = DEFAULT_NUM_WORKERS;
    private int maxCasAttempts = SubdocCommandExecutor.DEFAULT_MAX_CAS_ATTEMPTS;

    /**
     * Creates a new builder with the default settings.
     */
    public SubdocEngineBuilder() {}

    /**
     * Creates a new builder seeded with the settings of the specified {@link SubdocConfig}.
     */
    public SubdocEngineBuilder(SubdocConfig config) {
        requireNonNull(config, "config");
        numWorkers = config.numWorkers();
        maxCasAttempts = config.maxCasAttempts();
    }

    /**
     * Sets the {@link DocumentStore} which holds the documents. Required.
     */
    public SubdocEngineBuilder store(DocumentStore store) {
        this.store = requireNonNull(store, "store");
        return this;
    }

    /**
     * Sets the {@link MeterRegistry} the statistics are registered to.
     * If unspecified, {@link Metrics#globalRegistry} is used.
     */
    public SubdocEngineBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meterRegistry");
        return this;
    }

    /**
     * Sets the number of threads which run the commands.
     * If unspecified, {@value #DEFAULT_NUM_WORKERS} threads are created at maximum.
     */
    public SubdocEngineBuilder numWorkers(int numWorkers) {
        checkArgument(numWorkers > 0, "numWorkers: %s (expected: > 0)", numWorkers);
        this.numWorkers = numWorkers;
        return this;
    }

    /**
     * Sets the maximum number of store attempts of a mutation whose CAS keeps changing underneath it.
     * If unspecified, {@value SubdocCommandExecutor#DEFAULT_MAX_CAS_ATTEMPTS} attempts are made.
     */
    public SubdocEngineBuilder maxCasAttempts(int maxCasAttempts) {
        checkArgument(maxCasAttempts > 0, "maxCasAttempts: %s (expected: > 0)", maxCasAttempts);
        this.maxCasAttempts = maxCasAttempts;
        return this;
    }

    /**
     * Returns a newly-created {@link SubdocEngine}.
     */
    public SubdocEngine build() {
        checkState(store != null, "store not set");
        return new SubdocEngine(store, meterRegistry, numWorkers, maxCasAttempts);
    }
}

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

import static java.util.Objects.requireNonNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import com.linecorp.subdoc.server.command.Command;
import com.linecorp.subdoc.server.command.CommandExecutor;
import com.linecorp.subdoc.server.command.SubdocCommandExecutor;
import com.linecorp.subdoc.server.metric.SubdocStats;
import com.linecorp.subdoc.server.protocol.ConnectionFeatures;
import com.linecorp.subdoc.server.protocol.SubdocConnection;
import com.linecorp.subdoc.server.protocol.SubdocResponse;
import com.linecorp.subdoc.server.storage.DocumentStore;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.ExecutorServiceMetrics;

/**
 * Executes subdocument commands against a {@link DocumentStore} on a pool of worker threads.
 * Use {@link SubdocEngineBuilder} to create an instance.
 */
public final class SubdocEngine implements CommandExecutor, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SubdocEngine.class);

    private final ExecutorService worker;
    private final SubdocStats stats;
    private final SubdocCommandExecutor executor;
    private final int numWorkers;

    SubdocEngine(DocumentStore store, MeterRegistry meterRegistry, int numWorkers, int maxCasAttempts) {
        requireNonNull(store, "store");
        requireNonNull(meterRegistry, "meterRegistry");
        this.numWorkers = numWorkers;

        final ThreadPoolExecutor workerImpl = new ThreadPoolExecutor(
                numWorkers, numWorkers, 60, TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("subdoc-worker-%d").setDaemon(true).build());
        workerImpl.allowCoreThreadTimeOut(true);
        worker = ExecutorServiceMetrics.monitor(meterRegistry, workerImpl, "subdocWorker");

        stats = new SubdocStats(meterRegistry);
        executor = new SubdocCommandExecutor(store, worker, stats, maxCasAttempts);
        logger.info("Started a subdocument engine: {}", this);
    }

    @Override
    public <T> CompletableFuture<T> execute(Command<T> command) {
        return executor.execute(command);
    }

    /**
     * Opens a new connection whose responses are delivered to {@code responseSink} in the order the
     * requests were submitted.
     */
    public SubdocConnection newConnection(ConnectionFeatures features, Consumer<SubdocResponse> responseSink) {
        return new SubdocConnection(executor, features, responseSink);
    }

    public SubdocStats stats() {
        return stats;
    }

    /**
     * Stops accepting new commands. The commands already submitted run to completion.
     */
    @Override
    public void close() {
        worker.shutdown();
        logger.info("Stopped a subdocument engine: {}", this);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("numWorkers", numWorkers)
                          .add("executor", executor)
                          .toString();
    }
}

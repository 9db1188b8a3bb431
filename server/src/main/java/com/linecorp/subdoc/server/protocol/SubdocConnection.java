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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;

import com.linecorp.subdoc.server.command.Command;
import com.linecorp.subdoc.server.command.CommandExecutor;

/**
 * A client connection which processes its requests one at a time, in the order they were submitted, and
 * delivers a {@link SubdocResponse} for each of them to the response sink in the same order.
 *
 * <p>Closing a connection does not abort the commands in flight. They run to completion and their
 * responses are discarded.
 */
public final class SubdocConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SubdocConnection.class);

    private final CommandExecutor executor;
    private final ConnectionFeatures features;
    private final SubdocResponseEncoder encoder;
    private final Consumer<SubdocResponse> responseSink;

    // Completes after the response of the last submitted request has been delivered.
    private CompletableFuture<SubdocResponse> tail = CompletableFuture.completedFuture(null);
    private volatile boolean closed;

    public SubdocConnection(CommandExecutor executor, ConnectionFeatures features,
                            Consumer<SubdocResponse> responseSink) {
        this.executor = requireNonNull(executor, "executor");
        this.features = requireNonNull(features, "features");
        this.responseSink = requireNonNull(responseSink, "responseSink");
        encoder = new SubdocResponseEncoder(features);
    }

    public ConnectionFeatures features() {
        return features;
    }

    /**
     * Submits the specified {@link SubdocRequest}. The request is executed after all previously submitted
     * requests have been answered.
     *
     * @return the future which completes with the response after it has been delivered. It never
     *         completes exceptionally. A failure is encoded into the response.
     */
    public CompletableFuture<SubdocResponse> submit(SubdocRequest request) {
        requireNonNull(request, "request");
        checkState(!closed, "connection closed");
        final CompletableFuture<SubdocResponse> response;
        synchronized (this) {
            response = tail.thenCompose(unused -> process(request))
                           .thenApply(res -> {
                               deliver(request, res);
                               return res;
                           });
            tail = response;
        }
        return response;
    }

    private CompletableFuture<SubdocResponse> process(SubdocRequest request) {
        final Command<?> command;
        try {
            command = SubdocRequestDecoder.decode(request);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(encoder.encodeFailure(e));
        }
        final CompletableFuture<?> future;
        try {
            future = executor.execute(command);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(encoder.encodeFailure(e));
        }
        return future.handle((result, cause) -> {
            if (cause != null) {
                return encoder.encodeFailure(cause);
            }
            try {
                return encoder.encode(result);
            } catch (RuntimeException e) {
                return encoder.encodeFailure(e);
            }
        });
    }

    private void deliver(SubdocRequest request, SubdocResponse response) {
        if (closed) {
            logger.warn("Discarding the response to {} of a closed connection: {}", request, response);
            return;
        }
        try {
            responseSink.accept(response);
        } catch (Exception e) {
            logger.warn("Failed to deliver the response to {}: {}", request, response, e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closes this connection. The responses of the requests still in flight are discarded.
     */
    @Override
    public void close() {
        closed = true;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("features", features)
                          .add("closed", closed)
                          .toString();
    }
}

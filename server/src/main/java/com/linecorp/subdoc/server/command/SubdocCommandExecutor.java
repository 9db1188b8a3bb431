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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.MoreObjects;

import com.linecorp.subdoc.common.CasMismatchException;
import com.linecorp.subdoc.common.DocumentNotFoundException;
import com.linecorp.subdoc.common.NotOwnerException;
import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.common.TemporaryFailureException;
import com.linecorp.subdoc.internal.Jackson;
import com.linecorp.subdoc.internal.document.SubdocOperations;
import com.linecorp.subdoc.server.metric.SubdocStats;
import com.linecorp.subdoc.server.storage.CasConflictException;
import com.linecorp.subdoc.server.storage.Datatype;
import com.linecorp.subdoc.server.storage.DocumentStore;
import com.linecorp.subdoc.server.storage.StoreResult;
import com.linecorp.subdoc.server.storage.StoredDocument;

/**
 * A {@link CommandExecutor} which runs the subdocument commands against a {@link DocumentStore}.
 *
 * <p>A mutation is computed against a snapshot of the document and stored with a compare-and-swap. When
 * another writer wins the race and the command has no CAS of its own, the whole computation is repeated
 * against the new document, at most {@code maxCasAttempts} times. A {@link NotOwnerException} raised by
 * the store is never retried.
 */
public class SubdocCommandExecutor implements CommandExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SubdocCommandExecutor.class);

    public static final int DEFAULT_MAX_CAS_ATTEMPTS = 100;

    private final DocumentStore store;
    private final Executor worker;
    private final SubdocStats stats;
    private final int maxCasAttempts;

    /**
     * Creates a new instance.
     *
     * @param store the {@link DocumentStore} which holds the documents
     * @param worker the {@link Executor} which runs the commands
     * @param stats the {@link SubdocStats} updated on every successful command
     * @param maxCasAttempts the maximum number of store attempts of a mutation
     */
    public SubdocCommandExecutor(DocumentStore store, Executor worker, SubdocStats stats,
                                 int maxCasAttempts) {
        this.store = requireNonNull(store, "store");
        this.worker = requireNonNull(worker, "worker");
        this.stats = requireNonNull(stats, "stats");
        checkArgument(maxCasAttempts > 0, "maxCasAttempts: %s (expected: > 0)", maxCasAttempts);
        this.maxCasAttempts = maxCasAttempts;
    }

    @Override
    public <T> CompletableFuture<T> execute(Command<T> command) {
        requireNonNull(command, "command");
        final CompletableFuture<T> future = new CompletableFuture<>();
        try {
            command.checkArguments();
            worker.execute(() -> {
                try {
                    future.complete(doExecute(command));
                } catch (Throwable cause) {
                    future.completeExceptionally(cause);
                }
            });
        } catch (Throwable cause) {
            future.completeExceptionally(cause);
        }
        return future;
    }

    @SuppressWarnings("unchecked")
    private <T> T doExecute(Command<T> command) {
        if (command instanceof LookupCommand) {
            return (T) lookup((LookupCommand) command);
        }

        if (command instanceof MutationCommand) {
            return (T) mutate((MutationCommand) command);
        }

        if (command instanceof MultiLookupCommand) {
            return (T) multiLookup((MultiLookupCommand) command);
        }

        if (command instanceof MultiMutationCommand) {
            return (T) multiMutate((MultiMutationCommand) command);
        }

        throw new UnsupportedOperationException(command.toString());
    }

    private LookupResult lookup(LookupCommand c) {
        final StoredDocument doc = fetch(c);
        final JsonNode root = parse(doc);
        final byte[] value = SubdocOperations.lookup(c.opcode(), root, c.path());
        stats.lookup(doc.content().length, value.length);
        return new LookupResult(value, doc.cas());
    }

    private MultiLookupResult multiLookup(MultiLookupCommand c) {
        final StoredDocument doc = fetch(c);
        List<OperationResult> results;
        try {
            results = BatchCoordinator.lookupAll(parse(doc), c.specs());
        } catch (SubdocException e) {
            // The document is unreadable, so every lookup fails the same way.
            results = BatchCoordinator.failAll(c.specs(), e.status());
        }
        stats.lookup(doc.content().length, BatchCoordinator.resultBytes(results));
        return new MultiLookupResult(results, doc.cas());
    }

    private MutationResult mutate(MutationCommand c) {
        final Committed<byte[]> committed = casLoop(
                c, c.expiry(), c.value().length,
                root -> SubdocOperations.mutate(c.opcode(), root, c.path(), c.value(), c.flags()));
        final StoreResult stored = committed.storeResult;
        return new MutationResult(stored.cas(), stored.mutationToken(), committed.value);
    }

    private MultiMutationResult multiMutate(MultiMutationCommand c) {
        final Committed<List<OperationResult>> committed = casLoop(
                c, c.expiry(), BatchCoordinator.valueBytes(c.specs()),
                root -> BatchCoordinator.mutateAll(root, c.specs()));
        final StoreResult stored = committed.storeResult;
        assert committed.value != null;
        return new MultiMutationResult(committed.value, stored.cas(), stored.mutationToken());
    }

    /**
     * Fetches the document, applies {@code transformation} to a freshly parsed tree and stores the result,
     * starting over when the store reports a conflict.
     */
    private <V> Committed<V> casLoop(Command<?> command, @Nullable Integer expiry, long insertedBytes,
                                     Function<JsonNode, V> transformation) {
        final String key = command.key();
        for (int attempt = 1; attempt <= maxCasAttempts; attempt++) {
            final StoredDocument doc = fetch(command);
            final JsonNode root = parse(doc);
            final V value = transformation.apply(root);
            final byte[] content = Jackson.writeValueAsBytes(root);

            final StoreResult storeResult;
            try {
                storeResult = store.casStore(key, content, doc.cas(), expiry);
            } catch (CasConflictException e) {
                if (command.cas() != 0) {
                    throw new CasMismatchException(key, command.cas());
                }
                stats.casRetried();
                logger.debug("CAS conflict while storing '{}' (attempt {}/{}); retrying",
                             key, attempt, maxCasAttempts);
                continue;
            }

            stats.mutation(content.length, insertedBytes);
            return new Committed<>(value, storeResult);
        }

        logger.warn("Failed to store '{}' after {} attempts due to concurrent modifications",
                    key, maxCasAttempts);
        throw new TemporaryFailureException(
                "too many concurrent modifications: " + key + " (attempts: " + maxCasAttempts + ')');
    }

    private StoredDocument fetch(Command<?> command) {
        final StoredDocument doc = store.get(command.key());
        if (doc == null) {
            throw new DocumentNotFoundException(command.key());
        }
        if (command.cas() != 0 && command.cas() != doc.cas()) {
            throw new CasMismatchException(command.key(), command.cas());
        }
        return doc;
    }

    private static JsonNode parse(StoredDocument doc) {
        if (doc.datatype() != Datatype.JSON) {
            throw new SubdocException(SubdocStatus.DOC_NOT_JSON,
                                      "document is not JSON: " + doc.key() + " (" + doc.datatype() + ')',
                                      false);
        }
        return SubdocOperations.parseDocument(doc.content());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("store", store)
                          .add("maxCasAttempts", maxCasAttempts)
                          .toString();
    }

    private static final class Committed<V> {
        @Nullable
        final V value;
        final StoreResult storeResult;

        Committed(@Nullable V value, StoreResult storeResult) {
            this.value = value;
            this.storeResult = storeResult;
        }
    }
}

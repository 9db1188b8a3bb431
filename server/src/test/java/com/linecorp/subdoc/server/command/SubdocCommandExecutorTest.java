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

import static net.javacrumbs.jsonunit.fluent.JsonFluentAssert.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.util.concurrent.MoreExecutors;

import com.linecorp.subdoc.common.CasMismatchException;
import com.linecorp.subdoc.common.DocumentNotFoundException;
import com.linecorp.subdoc.common.NotOwnerException;
import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocFlags;
import com.linecorp.subdoc.common.SubdocOpcode;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.common.TemporaryFailureException;
import com.linecorp.subdoc.server.metric.SubdocStats;
import com.linecorp.subdoc.server.storage.CasConflictException;
import com.linecorp.subdoc.server.storage.Datatype;
import com.linecorp.subdoc.server.storage.DocumentStore;
import com.linecorp.subdoc.server.storage.InMemoryDocumentStore;
import com.linecorp.subdoc.server.storage.MutationToken;
import com.linecorp.subdoc.server.storage.StoreResult;
import com.linecorp.subdoc.server.storage.StoredDocument;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class SubdocCommandExecutorTest {

    private static final String KEY = "foo";
    private static final byte[] CONTENT = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);

    private SimpleMeterRegistry registry;
    private InMemoryDocumentStore store;
    private SubdocCommandExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new InMemoryDocumentStore();
        executor = newExecutor(store);
    }

    private SubdocCommandExecutor newExecutor(DocumentStore store) {
        return new SubdocCommandExecutor(store, MoreExecutors.directExecutor(), new SubdocStats(registry),
                                         SubdocCommandExecutor.DEFAULT_MAX_CAS_ATTEMPTS);
    }

    private String content() {
        return new String(store.get(KEY).content(), StandardCharsets.UTF_8);
    }

    @Test
    void getAndExists() {
        final long cas = store.store(KEY, "{\"a\":{\"b\":[1,2,3]}}");

        final LookupResult result = executor.execute(Command.get(KEY, "a.b[-1]")).join();
        assertThat(result.valueAsString()).isEqualTo("3");
        assertThat(result.cas()).isEqualTo(cas);

        assertThatJson(executor.execute(Command.get(KEY, "")).join().valueAsString())
                .isEqualTo("{\"a\":{\"b\":[1,2,3]}}");

        assertThat(executor.execute(Command.exists(KEY, "a.b[0]")).join().value()).isEmpty();
        assertThat(failure(executor.execute(Command.exists(KEY, "a.c"))).status())
                .isSameAs(SubdocStatus.PATH_NOT_FOUND);
    }

    @Test
    void counterCreatesMissingKey() {
        store.store(KEY, "{}");
        final MutationResult result =
                executor.execute(Command.mutation(SubdocOpcode.COUNTER, KEY, "key", "1")).join();
        assertThat(result.value()).isEqualTo("1".getBytes(StandardCharsets.UTF_8));
        assertThatJson(content()).isEqualTo("{\"key\":1}");
    }

    @Test
    void deleteThenGetLast() {
        store.store(KEY, "[0,1,2,3,4]");
        final MutationResult result =
                executor.execute(Command.mutation(SubdocOpcode.DELETE, KEY, "[0]", "")).join();
        assertThat(result.value()).isNull();
        assertThatJson(content()).isEqualTo("[1,2,3,4]");
        assertThat(executor.execute(Command.get(KEY, "[-1]")).join().valueAsString()).isEqualTo("4");
    }

    @Test
    void dictAddAndUpsert() {
        store.store(KEY, "{\"key1\":1}");
        assertThat(failure(executor.execute(Command.mutation(SubdocOpcode.DICT_ADD, KEY, "key1", "5")))
                           .status()).isSameAs(SubdocStatus.PATH_EXISTS);
        assertThatJson(content()).isEqualTo("{\"key1\":1}");

        final MutationResult first =
                executor.execute(Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "key1", "5")).join();
        assertThatJson(content()).isEqualTo("{\"key1\":5}");
        final MutationResult second =
                executor.execute(Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "key1", "5")).join();
        assertThatJson(content()).isEqualTo("{\"key1\":5}");
        assertThat(second.cas()).isNotEqualTo(first.cas());
        assertThat(second.mutationToken().seqno()).isEqualTo(first.mutationToken().seqno() + 1);
    }

    @Test
    void replaceThenGetReturnsWrittenFragment() {
        store.store(KEY, "{\"a\":[true]}");
        executor.execute(Command.mutation(SubdocOpcode.REPLACE, KEY, "a[0]", "{\"x\":[1,2]}")).join();
        assertThatJson(executor.execute(Command.get(KEY, "a[0]")).join().valueAsString())
                .isEqualTo("{\"x\":[1,2]}");
    }

    @Test
    void missingDocument() {
        final SubdocException e = failure(executor.execute(Command.get("missing", "a")));
        assertThat(e).isInstanceOf(DocumentNotFoundException.class);
        assertThat(e.status()).isSameAs(SubdocStatus.KEY_NOT_FOUND);
        assertThat(failure(executor.execute(Command.mutation(SubdocOpcode.DICT_UPSERT, "missing", "a", "1")))
                           .status()).isSameAs(SubdocStatus.KEY_NOT_FOUND);
    }

    @Test
    void rawDocumentIsNotJson() {
        store.store(KEY, CONTENT, 0, Datatype.RAW, 0);
        assertThat(failure(executor.execute(Command.get(KEY, "a"))).status())
                .isSameAs(SubdocStatus.DOC_NOT_JSON);
    }

    @Test
    void scalarDocumentIsNotJson() {
        store.store(KEY, "\"string\"");
        assertThat(failure(executor.execute(Command.get(KEY, ""))).status())
                .isSameAs(SubdocStatus.DOC_NOT_JSON);
    }

    @Test
    void invalidArgumentsAreRejectedBeforeFetching() {
        final DocumentStore store = mock(DocumentStore.class);
        final SubdocCommandExecutor executor = newExecutor(store);

        assertThat(failure(executor.execute(Command.mutation(SubdocOpcode.DICT_ADD, KEY, "", "1"))).status())
                .isSameAs(SubdocStatus.INVALID_ARGUMENTS);
        assertThat(failure(executor.execute(Command.lookup(SubdocOpcode.GET, KEY, "a", SubdocFlags.MKDIR_P)))
                           .status()).isSameAs(SubdocStatus.INVALID_ARGUMENTS);
        assertThat(failure(executor.execute(Command.mutation(SubdocOpcode.ARRAY_INSERT, KEY, "a[0]",
                                                             "1".getBytes(StandardCharsets.UTF_8),
                                                             SubdocFlags.MKDIR_P, 0, null))).status())
                .isSameAs(SubdocStatus.INVALID_ARGUMENTS);
        verifyNoInteractions(store);
    }

    @Test
    void explicitCasMismatch() {
        final long cas = store.store(KEY, "{\"a\":1}");
        final SubdocException e = failure(executor.execute(
                Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "a", "2".getBytes(StandardCharsets.UTF_8),
                                 SubdocFlags.NONE, cas + 100, null)));
        assertThat(e).isInstanceOf(CasMismatchException.class);
        assertThat(e.status()).isSameAs(SubdocStatus.KEY_EXISTS);
        assertThatJson(content()).isEqualTo("{\"a\":1}");

        final MutationResult result = executor.execute(
                Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "a", "2".getBytes(StandardCharsets.UTF_8),
                                 SubdocFlags.NONE, cas, null)).join();
        assertThat(result.cas()).isNotEqualTo(cas);
        assertThatJson(content()).isEqualTo("{\"a\":2}");
    }

    @Test
    void mutationKeepsFlagsAndUpdatesExpiryOnlyWhenSpecified() {
        store.store(KEY, CONTENT, 42, Datatype.JSON, 3600);
        final long expiry = store.get(KEY).expiry();

        executor.execute(Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "b", "2")).join();
        assertThat(store.get(KEY).flags()).isEqualTo(42);
        assertThat(store.get(KEY).expiry()).isEqualTo(expiry);

        final byte[] value = "3".getBytes(StandardCharsets.UTF_8);
        executor.execute(Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "c", value, SubdocFlags.NONE, 0, 0))
                .join();
        assertThat(store.get(KEY).flags()).isEqualTo(42);
        assertThat(store.get(KEY).expiry()).isZero();
    }

    @Test
    void retriesUntilStored() {
        final DocumentStore store = conflictingStore(SubdocCommandExecutor.DEFAULT_MAX_CAS_ATTEMPTS - 1);
        final MutationResult result = newExecutor(store).execute(
                Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "a", "2")).join();

        assertThat(result.cas()).isEqualTo(2);
        assertThat(result.mutationToken()).isEqualTo(new MutationToken(7, 1));
        verify(store, times(SubdocCommandExecutor.DEFAULT_MAX_CAS_ATTEMPTS))
                .casStore(eq(KEY), any(), eq(1L), isNull());
        assertThat(registry.get("subdoc.cas.retries").counter().count()).isEqualTo(99);
        assertThat(registry.get("subdoc.mutation.commands").counter().count()).isOne();
    }

    @Test
    void failsTemporarilyWhenAttemptsAreExhausted() {
        final DocumentStore store = conflictingStore(SubdocCommandExecutor.DEFAULT_MAX_CAS_ATTEMPTS);
        final SubdocException e = failure(newExecutor(store).execute(
                Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "a", "2")));

        assertThat(e).isInstanceOf(TemporaryFailureException.class);
        assertThat(e.status()).isSameAs(SubdocStatus.TEMPORARY_FAILURE);
        verify(store, times(SubdocCommandExecutor.DEFAULT_MAX_CAS_ATTEMPTS))
                .casStore(eq(KEY), any(), eq(1L), isNull());
        assertThat(registry.get("subdoc.mutation.commands").counter().count()).isZero();
    }

    @Test
    void conflictWithExplicitCasIsNotRetried() {
        final DocumentStore store = conflictingStore(1);
        final SubdocException e = failure(newExecutor(store).execute(
                Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "a", "2".getBytes(StandardCharsets.UTF_8),
                                 SubdocFlags.NONE, 1, null)));

        assertThat(e.status()).isSameAs(SubdocStatus.KEY_EXISTS);
        verify(store, times(1)).casStore(eq(KEY), any(), eq(1L), isNull());
    }

    @Test
    void failingOperationIsNotRetried() {
        final DocumentStore store = conflictingStore(0);
        final SubdocException e = failure(newExecutor(store).execute(
                Command.mutation(SubdocOpcode.DICT_ADD, KEY, "a", "2")));

        assertThat(e.status()).isSameAs(SubdocStatus.PATH_EXISTS);
        verify(store, times(1)).get(KEY);
        verify(store, never()).casStore(anyString(), any(), anyLong(), any());
    }

    @Test
    void notOwnerIsPropagatedWithRoutingContext() {
        final byte[] routingContext = "{\"rev\":3}".getBytes(StandardCharsets.UTF_8);
        final DocumentStore store = mock(DocumentStore.class);
        when(store.get(KEY)).thenThrow(new NotOwnerException(KEY, routingContext));

        final SubdocException e = failure(newExecutor(store).execute(Command.get(KEY, "a")));
        assertThat(e).isInstanceOf(NotOwnerException.class);
        assertThat(e.status()).isSameAs(SubdocStatus.NOT_MY_PARTITION);
        assertThat(((NotOwnerException) e).routingContext()).isEqualTo(routingContext);
    }

    @Test
    void notOwnerWhileStoringIsNotRetried() {
        final DocumentStore store = mock(DocumentStore.class);
        when(store.get(KEY)).thenReturn(new StoredDocument(KEY, CONTENT, 1, 0, 0, Datatype.JSON));
        when(store.casStore(eq(KEY), any(), eq(1L), isNull())).thenThrow(new NotOwnerException(KEY));

        final SubdocException e = failure(newExecutor(store).execute(
                Command.mutation(SubdocOpcode.DICT_UPSERT, KEY, "a", "2")));
        assertThat(e.status()).isSameAs(SubdocStatus.NOT_MY_PARTITION);
        verify(store, times(1)).casStore(eq(KEY), any(), eq(1L), isNull());
        assertThat(registry.get("subdoc.cas.retries").counter().count()).isZero();
    }

    /**
     * Returns a store whose conditional stores fail {@code conflicts} times before succeeding.
     */
    private static DocumentStore conflictingStore(int conflicts) {
        final DocumentStore store = mock(DocumentStore.class);
        when(store.get(KEY)).thenReturn(new StoredDocument(KEY, CONTENT, 1, 0, 0, Datatype.JSON));
        final AtomicInteger attempts = new AtomicInteger();
        when(store.casStore(eq(KEY), any(), eq(1L), isNull())).thenAnswer(invocation -> {
            if (attempts.incrementAndGet() <= conflicts) {
                throw new CasConflictException(KEY);
            }
            return new StoreResult(2, new MutationToken(7, 1));
        });
        return store;
    }

    static SubdocException failure(CompletableFuture<?> future) {
        final Throwable cause = catchThrowable(future::join);
        assertThat(cause).isInstanceOf(CompletionException.class)
                         .hasCauseInstanceOf(SubdocException.class);
        return (SubdocException) cause.getCause();
    }
}

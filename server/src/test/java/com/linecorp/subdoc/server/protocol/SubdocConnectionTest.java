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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.Test;

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.server.command.Command;
import com.linecorp.subdoc.server.command.CommandExecutor;
import com.linecorp.subdoc.server.command.LookupResult;

class SubdocConnectionTest {

    private final List<SubdocResponse> received = new CopyOnWriteArrayList<>();
    private final ManualExecutor executor = new ManualExecutor();

    @Test
    void requestsAreProcessedOneAtATimeInOrder() {
        final SubdocConnection conn = new SubdocConnection(executor, ConnectionFeatures.none(), received::add);
        final CompletableFuture<SubdocResponse> first = conn.submit(get("a"));
        final CompletableFuture<SubdocResponse> second = conn.submit(get("b"));
        // Malformed, but still answered in order.
        final CompletableFuture<SubdocResponse> third = conn.submit(
                new SubdocRequest(0xc5, "foo", new byte[2], new byte[0], 0));

        assertThat(executor.pending).hasSize(1);
        assertThat(second).isNotDone();

        executor.complete(0, new LookupResult(bytes("1"), 1));
        await().untilAsserted(() -> assertThat(executor.pending).hasSize(2));
        assertThat(received).extracting(SubdocResponse::bodyAsString).containsExactly("1");
        assertThat(first.join().bodyAsString()).isEqualTo("1");

        executor.fail(1, new SubdocException(SubdocStatus.PATH_NOT_FOUND, "not found"));
        await().untilAsserted(() -> assertThat(third).isDone());
        assertThat(received).extracting(SubdocResponse::status).containsExactly(
                SubdocStatus.SUCCESS, SubdocStatus.PATH_NOT_FOUND, SubdocStatus.INVALID_ARGUMENTS);
        assertThat(second.join().status()).isSameAs(SubdocStatus.PATH_NOT_FOUND);
    }

    @Test
    void responsesAfterCloseAreDiscarded() {
        final SubdocConnection conn = new SubdocConnection(executor, ConnectionFeatures.none(), received::add);
        final CompletableFuture<SubdocResponse> response = conn.submit(get("a"));
        conn.close();
        assertThat(conn.isClosed()).isTrue();

        executor.complete(0, new LookupResult(bytes("1"), 1));
        assertThat(response.join().status()).isSameAs(SubdocStatus.SUCCESS);
        assertThat(received).isEmpty();

        assertThatThrownBy(() -> conn.submit(get("b"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failingSinkDoesNotStallTheConnection() {
        final SubdocConnection conn = new SubdocConnection(executor, ConnectionFeatures.none(), response -> {
            throw new IllegalStateException("write failed");
        });
        final CompletableFuture<SubdocResponse> first = conn.submit(get("a"));
        final CompletableFuture<SubdocResponse> second = conn.submit(get("b"));
        executor.complete(0, new LookupResult(bytes("1"), 1));
        await().untilAsserted(() -> assertThat(executor.pending).hasSize(2));
        executor.complete(1, new LookupResult(bytes("2"), 1));
        assertThat(first.join().bodyAsString()).isEqualTo("1");
        assertThat(second.join().bodyAsString()).isEqualTo("2");
    }

    @Test
    void unencodableResultDoesNotStallTheConnection() {
        final SubdocConnection conn = new SubdocConnection(executor, ConnectionFeatures.none(), received::add);
        final CompletableFuture<SubdocResponse> first = conn.submit(get("a"));
        final CompletableFuture<SubdocResponse> second = conn.submit(get("b"));

        executor.complete(0, "not a result");
        assertThat(first.join().status()).isSameAs(SubdocStatus.TEMPORARY_FAILURE);
        await().untilAsserted(() -> assertThat(executor.pending).hasSize(2));
        executor.complete(1, new LookupResult(bytes("2"), 1));
        assertThat(second.join().bodyAsString()).isEqualTo("2");
        assertThat(received).extracting(SubdocResponse::status).containsExactly(
                SubdocStatus.TEMPORARY_FAILURE, SubdocStatus.SUCCESS);
    }

    private static SubdocRequest get(String path) {
        final byte[] pathBytes = bytes(path);
        final byte[] extras = ByteBuffer.allocate(3).putShort((short) pathBytes.length).put((byte) 0).array();
        return new SubdocRequest(0xc5, "foo", extras, pathBytes, 0);
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * A {@link CommandExecutor} whose results are supplied by the test.
     */
    private static final class ManualExecutor implements CommandExecutor {

        final List<CompletableFuture<Object>> pending = new CopyOnWriteArrayList<>();

        @Override
        @SuppressWarnings("unchecked")
        public <T> CompletableFuture<T> execute(Command<T> command) {
            final CompletableFuture<T> future = new CompletableFuture<>();
            pending.add((CompletableFuture<Object>) future);
            return future;
        }

        void complete(int index, Object result) {
            pending.get(index).complete(result);
        }

        void fail(int index, Throwable cause) {
            pending.get(index).completeExceptionally(cause);
        }
    }
}

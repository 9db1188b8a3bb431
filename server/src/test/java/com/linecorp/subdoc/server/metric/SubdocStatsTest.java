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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;

import com.linecorp.subdoc.common.SubdocOpcode;
import com.linecorp.subdoc.server.command.Command;
import com.linecorp.subdoc.server.command.LookupSpec;
import com.linecorp.subdoc.server.command.SubdocCommandExecutor;
import com.linecorp.subdoc.server.storage.InMemoryDocumentStore;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class SubdocStatsTest {

    private static final String KEY = "foo";
    // 30 bytes
    private static final String DOCUMENT = "{\"key\":12,\"pad\":\"0123456789a\"}";

    private SimpleMeterRegistry registry;
    private InMemoryDocumentStore store;
    private SubdocCommandExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new InMemoryDocumentStore();
        store.store(KEY, DOCUMENT);
        executor = new SubdocCommandExecutor(store, MoreExecutors.directExecutor(), new SubdocStats(registry),
                                             SubdocCommandExecutor.DEFAULT_MAX_CAS_ATTEMPTS);
    }

    private double count(String name) {
        return registry.get(name).counter().count();
    }

    @Test
    void lookup() {
        executor.execute(Command.get(KEY, "key")).join();
        assertThat(count("subdoc.lookup.commands")).isEqualTo(1);
        assertThat(count("subdoc.lookup.bytes.total")).isEqualTo(30);
        assertThat(count("subdoc.lookup.bytes.extracted")).isEqualTo(2);
        assertThat(count("subdoc.mutation.commands")).isZero();
    }

    @Test
    void multiLookupCountsOnce() {
        executor.execute(Command.multiLookup(KEY, ImmutableList.of(
                LookupSpec.get("key"), LookupSpec.get("pad"), LookupSpec.get("missing")))).join();
        assertThat(count("subdoc.lookup.commands")).isEqualTo(1);
        assertThat(count("subdoc.lookup.bytes.total")).isEqualTo(30);
        assertThat(count("subdoc.lookup.bytes.extracted")).isEqualTo(2 + 13);
    }

    @Test
    void failedCommandsAreNotCounted() {
        executor.execute(Command.get(KEY, "missing")).exceptionally(cause -> null).join();
        executor.execute(Command.mutation(SubdocOpcode.DICT_ADD, KEY, "key", "1"))
                .exceptionally(cause -> null).join();
        assertThat(count("subdoc.lookup.commands")).isZero();
        assertThat(count("subdoc.mutation.commands")).isZero();
    }

    @Test
    void mutation() {
        executor.execute(Command.mutation(SubdocOpcode.REPLACE, KEY, "key", "345")).join();
        assertThat(count("subdoc.mutation.commands")).isEqualTo(1);
        // {"key":345,"pad":"0123456789a"}
        assertThat(count("subdoc.mutation.bytes.total")).isEqualTo(31);
        assertThat(count("subdoc.mutation.bytes.inserted")).isEqualTo(3);
        assertThat(count("subdoc.lookup.commands")).isZero();
    }
}

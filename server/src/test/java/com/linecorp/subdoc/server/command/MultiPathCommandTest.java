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

import static com.linecorp.subdoc.server.command.SubdocCommandExecutorTest.failure;
import static net.javacrumbs.jsonunit.fluent.JsonFluentAssert.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;

import com.linecorp.subdoc.common.MultiMutationException;
import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocFlags;
import com.linecorp.subdoc.common.SubdocOpcode;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.server.metric.SubdocStats;
import com.linecorp.subdoc.server.storage.Datatype;
import com.linecorp.subdoc.server.storage.InMemoryDocumentStore;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class MultiPathCommandTest {

    private static final String KEY = "foo";

    private InMemoryDocumentStore store;
    private SubdocCommandExecutor executor;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        executor = new SubdocCommandExecutor(store, MoreExecutors.directExecutor(),
                                             new SubdocStats(new SimpleMeterRegistry()), 100);
    }

    private String content() {
        return new String(store.get(KEY).content(), StandardCharsets.UTF_8);
    }

    @Test
    void multiLookupReportsEverySpec() {
        final long cas = store.store(KEY, "{\"a\":1,\"b\":[1,2]}");
        final MultiLookupResult result = executor.execute(Command.multiLookup(KEY, ImmutableList.of(
                LookupSpec.get("a"),
                LookupSpec.exists("c"),
                LookupSpec.get("a[0]"),
                LookupSpec.get("b[-1]"),
                LookupSpec.exists("b")))).join();

        assertThat(result.cas()).isEqualTo(cas);
        final List<OperationResult> results = result.results();
        assertThat(results).extracting(OperationResult::index).containsExactly(0, 1, 2, 3, 4);
        assertThat(results).extracting(OperationResult::status).containsExactly(
                SubdocStatus.SUCCESS, SubdocStatus.PATH_NOT_FOUND, SubdocStatus.PATH_MISMATCH,
                SubdocStatus.SUCCESS, SubdocStatus.SUCCESS);
        assertThat(results).extracting(OperationResult::valueAsString)
                           .containsExactly("1", "", "", "2", "");
    }

    @Test
    void multiLookupOnUnreadableDocument() {
        store.store(KEY, "{\"a\":".getBytes(StandardCharsets.UTF_8), 0, Datatype.JSON, 0);
        final MultiLookupResult result = executor.execute(Command.multiLookup(KEY, ImmutableList.of(
                LookupSpec.get("a"), LookupSpec.exists("b")))).join();
        assertThat(result.results()).extracting(OperationResult::status)
                                    .containsExactly(SubdocStatus.DOC_NOT_JSON, SubdocStatus.DOC_NOT_JSON);
    }

    @Test
    void multiMutationIsAtomic() {
        store.store(KEY, "{\"bogus\":{}}");
        final SubdocException e = failure(executor.execute(Command.multiMutation(KEY, ImmutableList.of(
                MutationSpec.of(SubdocOpcode.DICT_UPSERT, "a", "1"),
                MutationSpec.of(SubdocOpcode.ARRAY_INSERT, "bogus[0]", "2")), 0, null)));

        assertThat(e).isInstanceOf(MultiMutationException.class);
        assertThat(e.status()).isSameAs(SubdocStatus.MULTI_PATH_FAILURE);
        assertThat(((MultiMutationException) e).index()).isOne();
        assertThat(((MultiMutationException) e).specStatus()).isSameAs(SubdocStatus.PATH_MISMATCH);
        assertThatJson(content()).isEqualTo("{\"bogus\":{}}");
    }

    @Test
    void multiMutationReturnsOnlyFragments() {
        final long cas = store.store(KEY, "{\"list\":[1,2]}");
        final MultiMutationResult result = executor.execute(Command.multiMutation(KEY, ImmutableList.of(
                MutationSpec.of(SubdocOpcode.COUNTER, "count", "5"),
                MutationSpec.of(SubdocOpcode.ARRAY_PUSH_LAST, "list", "3"),
                new MutationSpec(SubdocOpcode.DELETE, "list[0]", new byte[0], SubdocFlags.NONE),
                new MutationSpec(SubdocOpcode.DICT_ADD, "x.y", "true".getBytes(StandardCharsets.UTF_8),
                                 SubdocFlags.MKDIR_P),
                MutationSpec.of(SubdocOpcode.COUNTER, "count", "-7")), 0, null)).join();

        assertThat(result.cas()).isNotEqualTo(cas);
        assertThat(result.results()).extracting(OperationResult::index).containsExactly(0, 4);
        assertThat(result.results()).extracting(OperationResult::valueAsString).containsExactly("5", "-2");
        assertThatJson(content()).isEqualTo("{\"list\":[2,3],\"count\":-2,\"x\":{\"y\":true}}");
    }

    @Test
    void laterSpecsSeeEarlierMutations() {
        store.store(KEY, "{}");
        executor.execute(Command.multiMutation(KEY, ImmutableList.of(
                MutationSpec.of(SubdocOpcode.DICT_ADD, "a", "[]"),
                MutationSpec.of(SubdocOpcode.ARRAY_PUSH_FIRST, "a", "1"),
                MutationSpec.of(SubdocOpcode.ARRAY_INSERT, "a[0]", "0"),
                MutationSpec.of(SubdocOpcode.REPLACE, "a[-1]", "\"one\"")), 0, null)).join();
        assertThatJson(content()).isEqualTo("{\"a\":[0,\"one\"]}");
    }

    @Test
    void invalidCombinations() {
        store.store(KEY, "{}");
        assertThat(failure(executor.execute(Command.multiLookup(KEY, Collections.emptyList()))).status())
                .isSameAs(SubdocStatus.INVALID_COMBO);

        final ImmutableList.Builder<LookupSpec> tooMany = ImmutableList.builder();
        for (int i = 0; i < 17; i++) {
            tooMany.add(LookupSpec.exists("a"));
        }
        assertThat(failure(executor.execute(Command.multiLookup(KEY, tooMany.build()))).status())
                .isSameAs(SubdocStatus.INVALID_COMBO);

        assertThat(failure(executor.execute(Command.multiLookup(KEY, ImmutableList.of(
                new LookupSpec(SubdocOpcode.DICT_ADD, "a", SubdocFlags.NONE))))).status())
                .isSameAs(SubdocStatus.INVALID_COMBO);
        assertThat(failure(executor.execute(Command.multiMutation(KEY, ImmutableList.of(
                new MutationSpec(SubdocOpcode.GET, "a", new byte[0], SubdocFlags.NONE)), 0, null))).status())
                .isSameAs(SubdocStatus.INVALID_COMBO);
    }

    @Test
    void invalidSpecArgumentsFailTheWholeCommand() {
        store.store(KEY, "{}");
        assertThat(failure(executor.execute(Command.multiMutation(KEY, ImmutableList.of(
                MutationSpec.of(SubdocOpcode.DICT_UPSERT, "a", "1"),
                new MutationSpec(SubdocOpcode.DICT_UPSERT, "", "1".getBytes(StandardCharsets.UTF_8),
                                 SubdocFlags.NONE)), 0, null))).status())
                .isSameAs(SubdocStatus.INVALID_ARGUMENTS);
        assertThatJson(content()).isEqualTo("{}");
    }

    @Test
    void sixteenSpecsAreAccepted() {
        store.store(KEY, "{}");
        final ImmutableList.Builder<MutationSpec> specs = ImmutableList.builder();
        for (int i = 0; i < 16; i++) {
            specs.add(MutationSpec.of(SubdocOpcode.COUNTER, "n", "1"));
        }
        final MultiMutationResult result =
                executor.execute(Command.multiMutation(KEY, specs.build(), 0, null)).join();
        assertThat(result.results()).hasSize(16);
        assertThat(result.results().get(15).valueAsString()).isEqualTo("16");
        assertThatJson(content()).isEqualTo("{\"n\":16}");
    }
}

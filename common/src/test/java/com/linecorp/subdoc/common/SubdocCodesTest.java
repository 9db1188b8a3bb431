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

package com.linecorp.subdoc.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class SubdocCodesTest {

    @ParameterizedTest
    @EnumSource(SubdocStatus.class)
    void statusCodesAreUnique(SubdocStatus status) {
        assertThat(SubdocStatus.of(status.code())).isSameAs(status);
    }

    @ParameterizedTest
    @EnumSource(SubdocOpcode.class)
    void opcodesAreUnique(SubdocOpcode opcode) {
        assertThat(SubdocOpcode.of(opcode.code())).isSameAs(opcode);
    }

    @Test
    void unknownCodes() {
        assertThat(SubdocStatus.of(0xffff)).isNull();
        assertThat(SubdocOpcode.of(0x01)).isNull();
    }

    @Test
    void opcodeTraits() {
        assertThat(SubdocOpcode.GET.isLookup()).isTrue();
        assertThat(SubdocOpcode.GET.allowsEmptyPath()).isTrue();
        assertThat(SubdocOpcode.GET.requiresValue()).isFalse();
        assertThat(SubdocOpcode.GET.acceptsMkdirP()).isFalse();

        assertThat(SubdocOpcode.ARRAY_PUSH_LAST.allowsEmptyPath()).isTrue();
        assertThat(SubdocOpcode.ARRAY_INSERT.isMutation()).isTrue();
        assertThat(SubdocOpcode.ARRAY_INSERT.acceptsMkdirP()).isFalse();
        assertThat(SubdocOpcode.DELETE.requiresValue()).isFalse();
        assertThat(SubdocOpcode.COUNTER.allowsEmptyPath()).isFalse();

        assertThat(SubdocOpcode.MULTI_LOOKUP.isMulti()).isTrue();
        assertThat(SubdocOpcode.MULTI_MUTATION.isMutation()).isFalse();
    }

    @Test
    void flags() {
        assertThat(SubdocFlags.isValid(SubdocFlags.NONE)).isTrue();
        assertThat(SubdocFlags.isValid(SubdocFlags.MKDIR_P)).isTrue();
        assertThat(SubdocFlags.isValid(0x02)).isFalse();
        assertThat(SubdocFlags.isMkdirP(0x01)).isTrue();
    }

    @Test
    void multiMutationExceptionKeepsTheFailingSpec() {
        final MultiMutationException e = new MultiMutationException(
                3, new SubdocException(SubdocStatus.DELTA_INVALID, "zero delta"));
        assertThat(e.status()).isSameAs(SubdocStatus.MULTI_PATH_FAILURE);
        assertThat(e.index()).isEqualTo(3);
        assertThat(e.specStatus()).isSameAs(SubdocStatus.DELTA_INVALID);
        assertThat(e).hasMessageContaining("zero delta");
    }

    @Test
    void notOwnerExceptionCopiesRoutingContext() {
        final byte[] context = "map".getBytes(StandardCharsets.UTF_8);
        final NotOwnerException e = new NotOwnerException("foo", context);
        context[0] = 'x';
        assertThat(e.routingContext()).isEqualTo("map".getBytes(StandardCharsets.UTF_8));
        assertThat(e.status()).isSameAs(SubdocStatus.NOT_MY_PARTITION);
        assertThat(new NotOwnerException("foo").routingContext()).isEmpty();
    }
}

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

import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;

import com.linecorp.subdoc.common.MultiMutationException;
import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.internal.document.SubdocOperations;

/**
 * Runs the specs of a multi-path command against one parsed document.
 */
final class BatchCoordinator {

    private static final byte[] EMPTY = new byte[0];

    /**
     * Performs every lookup against {@code root}. A failing spec does not stop the others.
     */
    static List<OperationResult> lookupAll(JsonNode root, List<LookupSpec> specs) {
        final ImmutableList.Builder<OperationResult> builder = ImmutableList.builderWithExpectedSize(
                specs.size());
        for (int i = 0; i < specs.size(); i++) {
            final LookupSpec spec = specs.get(i);
            try {
                final byte[] value = SubdocOperations.lookup(spec.opcode(), root, spec.path());
                builder.add(new OperationResult(i, SubdocStatus.SUCCESS, value));
            } catch (SubdocException e) {
                builder.add(new OperationResult(i, e.status(), EMPTY));
            }
        }
        return builder.build();
    }

    /**
     * Reports the same failure for every lookup, when the document itself cannot be read.
     */
    static List<OperationResult> failAll(List<LookupSpec> specs, SubdocStatus status) {
        final ImmutableList.Builder<OperationResult> builder = ImmutableList.builderWithExpectedSize(
                specs.size());
        for (int i = 0; i < specs.size(); i++) {
            builder.add(new OperationResult(i, status, EMPTY));
        }
        return builder.build();
    }

    /**
     * Applies the mutations to {@code root} in order. {@code root} must be a fresh tree which is discarded
     * if this method raises an exception.
     *
     * @return the results of the specs which yield a fragment
     * @throws MultiMutationException if a spec fails
     */
    static List<OperationResult> mutateAll(JsonNode root, List<MutationSpec> specs) {
        final ImmutableList.Builder<OperationResult> builder = ImmutableList.builder();
        for (int i = 0; i < specs.size(); i++) {
            final MutationSpec spec = specs.get(i);
            @Nullable
            final byte[] value;
            try {
                value = SubdocOperations.mutate(spec.opcode(), root, spec.path(), spec.value(), spec.flags());
            } catch (SubdocException e) {
                throw new MultiMutationException(i, e);
            }
            if (value != null) {
                builder.add(new OperationResult(i, SubdocStatus.SUCCESS, value));
            }
        }
        return builder.build();
    }

    /**
     * Returns the total size of the value fragments of {@code specs}.
     */
    static long valueBytes(List<MutationSpec> specs) {
        long sum = 0;
        for (MutationSpec spec : specs) {
            sum += spec.value().length;
        }
        return sum;
    }

    /**
     * Returns the total size of the fragments in {@code results}.
     */
    static long resultBytes(List<OperationResult> results) {
        long sum = 0;
        for (OperationResult result : results) {
            sum += result.value().length;
        }
        return sum;
    }

    private BatchCoordinator() {}
}

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

import static java.util.Objects.requireNonNull;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import javax.annotation.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.linecorp.subdoc.common.MultiMutationException;
import com.linecorp.subdoc.common.NotOwnerException;
import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.server.command.LookupResult;
import com.linecorp.subdoc.server.command.MultiLookupResult;
import com.linecorp.subdoc.server.command.MultiMutationResult;
import com.linecorp.subdoc.server.command.MutationResult;
import com.linecorp.subdoc.server.command.OperationResult;
import com.linecorp.subdoc.server.storage.MutationToken;

/**
 * Encodes the result or the failure of a command into a {@link SubdocResponse}.
 *
 * <p>A multi-lookup body is a sequence of {@code status(2) valueLength(4) value}, one per spec. A
 * multi-mutation body is a sequence of {@code index(1) status(2) valueLength(4) value}, only for the
 * specs which yield a fragment. A failed multi-mutation has the 3-byte body {@code index(1) status(2)}.
 */
public final class SubdocResponseEncoder {

    private static final Logger logger = LoggerFactory.getLogger(SubdocResponseEncoder.class);

    private static final byte[] EMPTY = new byte[0];
    private static final int MUTATION_TOKEN_LENGTH = 16;

    private final ConnectionFeatures features;

    public SubdocResponseEncoder(ConnectionFeatures features) {
        this.features = requireNonNull(features, "features");
    }

    /**
     * Encodes the result of a successful command.
     */
    public SubdocResponse encode(Object result) {
        requireNonNull(result, "result");
        if (result instanceof LookupResult) {
            final LookupResult r = (LookupResult) result;
            return new SubdocResponse(SubdocStatus.SUCCESS, EMPTY, r.value(), r.cas());
        }

        if (result instanceof MutationResult) {
            final MutationResult r = (MutationResult) result;
            final byte[] value = r.value();
            return new SubdocResponse(SubdocStatus.SUCCESS, extras(r.mutationToken()),
                                      value != null ? value : EMPTY, r.cas());
        }

        if (result instanceof MultiLookupResult) {
            final MultiLookupResult r = (MultiLookupResult) result;
            return new SubdocResponse(SubdocStatus.SUCCESS, EMPTY, encodeLookupResults(r.results()), r.cas());
        }

        if (result instanceof MultiMutationResult) {
            final MultiMutationResult r = (MultiMutationResult) result;
            return new SubdocResponse(SubdocStatus.SUCCESS, extras(r.mutationToken()),
                                      encodeMutationResults(r.results()), r.cas());
        }

        throw new IllegalArgumentException("unsupported result: " + result.getClass().getName());
    }

    /**
     * Encodes the failure of a command. A {@link CompletionException} is unwrapped first.
     */
    public SubdocResponse encodeFailure(Throwable cause) {
        final Throwable peeled = peel(requireNonNull(cause, "cause"));
        if (!(peeled instanceof SubdocException)) {
            logger.warn("Unexpected exception while executing a subdocument command:", peeled);
            return new SubdocResponse(SubdocStatus.TEMPORARY_FAILURE, EMPTY,
                                      String.valueOf(peeled).getBytes(StandardCharsets.UTF_8), 0);
        }

        final SubdocException e = (SubdocException) peeled;
        if (e instanceof MultiMutationException) {
            final MultiMutationException mme = (MultiMutationException) e;
            final byte[] body = ByteBuffer.allocate(3)
                                          .put((byte) mme.index())
                                          .putShort((short) mme.specStatus().code())
                                          .array();
            return new SubdocResponse(e.status(), EMPTY, body, 0);
        }

        if (e instanceof NotOwnerException) {
            return new SubdocResponse(e.status(), EMPTY, ((NotOwnerException) e).routingContext(), 0);
        }

        @Nullable
        final String message = e.getMessage();
        return new SubdocResponse(e.status(), EMPTY,
                                  message != null ? message.getBytes(StandardCharsets.UTF_8) : EMPTY, 0);
    }

    private byte[] extras(MutationToken token) {
        if (!features.mutationSeqno()) {
            return EMPTY;
        }
        return ByteBuffer.allocate(MUTATION_TOKEN_LENGTH)
                         .putLong(token.partitionUuid())
                         .putLong(token.seqno())
                         .array();
    }

    private static byte[] encodeLookupResults(List<OperationResult> results) {
        int length = 0;
        for (OperationResult result : results) {
            length += 6 + result.value().length;
        }
        final ByteBuffer buf = ByteBuffer.allocate(length);
        for (OperationResult result : results) {
            buf.putShort((short) result.status().code());
            buf.putInt(result.value().length);
            buf.put(result.value());
        }
        return buf.array();
    }

    private static byte[] encodeMutationResults(List<OperationResult> results) {
        int length = 0;
        for (OperationResult result : results) {
            length += 7 + result.value().length;
        }
        final ByteBuffer buf = ByteBuffer.allocate(length);
        for (OperationResult result : results) {
            buf.put((byte) result.index());
            buf.putShort((short) result.status().code());
            buf.putInt(result.value().length);
            buf.put(result.value());
        }
        return buf.array();
    }

    private static Throwable peel(Throwable cause) {
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) &&
               cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }
}

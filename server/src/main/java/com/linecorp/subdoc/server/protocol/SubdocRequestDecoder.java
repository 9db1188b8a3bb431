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
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocOpcode;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.server.command.Command;
import com.linecorp.subdoc.server.command.LookupSpec;
import com.linecorp.subdoc.server.command.MutationSpec;

/**
 * Decodes a {@link SubdocRequest} into a {@link Command}.
 *
 * <p>Single-path requests carry {@code pathLength(2) flags(1) [expiry(4)]} in their extras and the path
 * followed by the value in their body. A multi-lookup body is a sequence of
 * {@code opcode(1) flags(1) pathLength(2) path}, and a multi-mutation body is a sequence of
 * {@code opcode(1) flags(1) pathLength(2) valueLength(4) path value}. All integers are big-endian.
 */
public final class SubdocRequestDecoder {

    private static final int SINGLE_EXTRAS_LENGTH = 3;
    private static final int SINGLE_EXTRAS_WITH_EXPIRY_LENGTH = 7;
    private static final int EXPIRY_LENGTH = 4;
    private static final int LOOKUP_SPEC_HEADER_LENGTH = 4;
    private static final int MUTATION_SPEC_HEADER_LENGTH = 8;

    /**
     * Decodes the specified {@link SubdocRequest}.
     *
     * @throws SubdocException with {@link SubdocStatus#INVALID_ARGUMENTS} if the request is malformed or
     *                         truncated, or with {@link SubdocStatus#INVALID_COMBO} if a multi-path
     *                         request contains an unknown opcode
     */
    public static Command<?> decode(SubdocRequest request) {
        requireNonNull(request, "request");
        final SubdocOpcode opcode = SubdocOpcode.of(request.opcode());
        if (opcode == null) {
            throw invalidArguments("unknown opcode: 0x" + Integer.toHexString(request.opcode()));
        }

        switch (opcode) {
            case MULTI_LOOKUP:
                return decodeMultiLookup(request);
            case MULTI_MUTATION:
                return decodeMultiMutation(request);
            default:
                return decodeSingle(opcode, request);
        }
    }

    private static Command<?> decodeSingle(SubdocOpcode opcode, SubdocRequest request) {
        final byte[] extras = request.extras();
        if (extras.length != SINGLE_EXTRAS_LENGTH && extras.length != SINGLE_EXTRAS_WITH_EXPIRY_LENGTH) {
            throw invalidArguments("extras.length: " + extras.length + " (expected: 3 or 7)");
        }
        if (opcode.isLookup() && extras.length == SINGLE_EXTRAS_WITH_EXPIRY_LENGTH) {
            throw invalidArguments("expiry not allowed for " + opcode);
        }

        final ByteBuffer extrasBuf = ByteBuffer.wrap(extras);
        final int pathLength = Short.toUnsignedInt(extrasBuf.getShort());
        final int flags = Byte.toUnsignedInt(extrasBuf.get());
        @Nullable
        final Integer expiry = extrasBuf.hasRemaining() ? readExpiry(extrasBuf) : null;

        final ByteBuffer body = ByteBuffer.wrap(request.body());
        final String path = readString(body, pathLength, "path");
        final byte[] value = new byte[body.remaining()];
        body.get(value);

        if (opcode.isLookup()) {
            return Command.lookup(opcode, request.key(), path, flags);
        }
        return Command.mutation(opcode, request.key(), path, value, flags, request.cas(), expiry);
    }

    private static Command<?> decodeMultiLookup(SubdocRequest request) {
        if (request.extras().length != 0) {
            throw invalidArguments("extras not allowed for " + SubdocOpcode.MULTI_LOOKUP);
        }

        final ByteBuffer body = ByteBuffer.wrap(request.body());
        final ImmutableList.Builder<LookupSpec> specs = ImmutableList.builder();
        while (body.hasRemaining()) {
            ensureRemaining(body, LOOKUP_SPEC_HEADER_LENGTH, "lookup spec header");
            final SubdocOpcode opcode = specOpcode(Byte.toUnsignedInt(body.get()));
            final int flags = Byte.toUnsignedInt(body.get());
            final int pathLength = Short.toUnsignedInt(body.getShort());
            final String path = readString(body, pathLength, "path");
            specs.add(new LookupSpec(opcode, path, flags));
        }
        return Command.multiLookup(request.key(), specs.build());
    }

    private static Command<?> decodeMultiMutation(SubdocRequest request) {
        final byte[] extras = request.extras();
        if (extras.length != 0 && extras.length != EXPIRY_LENGTH) {
            throw invalidArguments("extras.length: " + extras.length + " (expected: 0 or 4)");
        }
        @Nullable
        final Integer expiry = extras.length != 0 ? readExpiry(ByteBuffer.wrap(extras)) : null;

        final ByteBuffer body = ByteBuffer.wrap(request.body());
        final ImmutableList.Builder<MutationSpec> specs = ImmutableList.builder();
        while (body.hasRemaining()) {
            ensureRemaining(body, MUTATION_SPEC_HEADER_LENGTH, "mutation spec header");
            final SubdocOpcode opcode = specOpcode(Byte.toUnsignedInt(body.get()));
            final int flags = Byte.toUnsignedInt(body.get());
            final int pathLength = Short.toUnsignedInt(body.getShort());
            final int valueLength = body.getInt();
            if (valueLength < 0) {
                throw invalidArguments("valueLength: " + Integer.toUnsignedString(valueLength));
            }
            final String path = readString(body, pathLength, "path");
            ensureRemaining(body, valueLength, "value");
            final byte[] value = new byte[valueLength];
            body.get(value);
            specs.add(new MutationSpec(opcode, path, value, flags));
        }
        return Command.multiMutation(request.key(), specs.build(), request.cas(), expiry);
    }

    private static SubdocOpcode specOpcode(int code) {
        final SubdocOpcode opcode = SubdocOpcode.of(code);
        if (opcode == null) {
            throw new SubdocException(SubdocStatus.INVALID_COMBO,
                                      "unknown opcode in a multi-path request: 0x" + Integer.toHexString(code),
                                      false);
        }
        return opcode;
    }

    private static int readExpiry(ByteBuffer buf) {
        final int expiry = buf.getInt();
        if (expiry < 0) {
            throw invalidArguments("expiry: " + Integer.toUnsignedString(expiry) +
                                   " (expected: <= " + Integer.MAX_VALUE + ')');
        }
        return expiry;
    }

    private static String readString(ByteBuffer buf, int length, String what) {
        ensureRemaining(buf, length, what);
        final ByteBuffer slice = buf.slice();
        slice.limit(length);
        buf.position(buf.position() + length);
        try {
            return StandardCharsets.UTF_8.newDecoder()
                                         .onMalformedInput(CodingErrorAction.REPORT)
                                         .onUnmappableCharacter(CodingErrorAction.REPORT)
                                         .decode(slice)
                                         .toString();
        } catch (CharacterCodingException e) {
            throw new SubdocException(SubdocStatus.PATH_INVALID, "malformed UTF-8 in " + what, false);
        }
    }

    private static void ensureRemaining(ByteBuffer buf, int length, String what) {
        if (buf.remaining() < length) {
            throw invalidArguments("truncated " + what + ": " + buf.remaining() + " byte(s) left" +
                                   " (expected: " + length + ')');
        }
    }

    private static SubdocException invalidArguments(String message) {
        return new SubdocException(SubdocStatus.INVALID_ARGUMENTS, message, false);
    }

    private SubdocRequestDecoder() {}
}

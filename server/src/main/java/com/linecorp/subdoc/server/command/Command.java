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

import java.nio.charset.StandardCharsets;
import java.util.List;

import javax.annotation.Nullable;

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocFlags;
import com.linecorp.subdoc.common.SubdocOpcode;
import com.linecorp.subdoc.common.SubdocStatus;

/**
 * A subdocument command addressed to the document with a certain key.
 *
 * @param <T> the result type of a {@link Command}
 */
public interface Command<T> {

    /**
     * Returns a new {@link Command} which retrieves the fragment at {@code path}.
     */
    static Command<LookupResult> get(String key, String path) {
        return new LookupCommand(SubdocOpcode.GET, key, path, SubdocFlags.NONE);
    }

    /**
     * Returns a new {@link Command} which checks whether {@code path} exists.
     */
    static Command<LookupResult> exists(String key, String path) {
        return new LookupCommand(SubdocOpcode.EXISTS, key, path, SubdocFlags.NONE);
    }

    /**
     * Returns a new single-path lookup {@link Command}.
     *
     * @param opcode {@link SubdocOpcode#GET} or {@link SubdocOpcode#EXISTS}
     */
    static Command<LookupResult> lookup(SubdocOpcode opcode, String key, String path, int flags) {
        return new LookupCommand(opcode, key, path, flags);
    }

    /**
     * Returns a new single-path mutation {@link Command} with no flags, no CAS and no expiry.
     *
     * @param value the JSON fragment, or an empty string for {@link SubdocOpcode#DELETE}
     */
    static Command<MutationResult> mutation(SubdocOpcode opcode, String key, String path, String value) {
        return mutation(opcode, key, path, value.getBytes(StandardCharsets.UTF_8), SubdocFlags.NONE, 0, null);
    }

    /**
     * Returns a new single-path mutation {@link Command}.
     *
     * @param flags the {@link SubdocFlags}
     * @param cas the CAS the document must have, or {@code 0} to retry automatically on a conflict
     * @param expiry the new time to live in seconds, or {@code null} to keep the current expiration time
     */
    static Command<MutationResult> mutation(SubdocOpcode opcode, String key, String path, byte[] value,
                                            int flags, long cas, @Nullable Integer expiry) {
        return new MutationCommand(opcode, key, path, value, flags, cas, expiry);
    }

    /**
     * Returns a new {@link Command} which performs the specified lookups against one snapshot.
     */
    static Command<MultiLookupResult> multiLookup(String key, List<LookupSpec> specs) {
        return new MultiLookupCommand(key, specs);
    }

    /**
     * Returns a new {@link Command} which applies the specified mutations atomically.
     *
     * @param cas the CAS the document must have, or {@code 0} to retry automatically on a conflict
     * @param expiry the new time to live in seconds, or {@code null} to keep the current expiration time
     */
    static Command<MultiMutationResult> multiMutation(String key, List<MutationSpec> specs, long cas,
                                                      @Nullable Integer expiry) {
        return new MultiMutationCommand(key, specs, cas, expiry);
    }

    /**
     * Returns the {@link CommandType} of this {@link Command}.
     */
    CommandType type();

    /**
     * Returns the key of the document.
     */
    String key();

    /**
     * Returns the CAS the document must have, or {@code 0} if unspecified.
     */
    long cas();

    /**
     * Checks the arguments that do not depend on the document.
     *
     * @throws SubdocException with {@link SubdocStatus#INVALID_ARGUMENTS} or
     *                         {@link SubdocStatus#INVALID_COMBO}
     */
    void checkArguments();
}

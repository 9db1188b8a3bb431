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

import java.util.Arrays;
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects.ToStringHelper;

import com.linecorp.subdoc.common.SubdocOpcode;
import com.linecorp.subdoc.internal.document.SubdocOperations;

/**
 * A {@link Command} which modifies a fragment of a document.
 */
public final class MutationCommand extends AbstractCommand<MutationResult> {

    private final SubdocOpcode opcode;
    private final String path;
    private final byte[] value;
    private final int flags;
    @Nullable
    private final Integer expiry;

    MutationCommand(SubdocOpcode opcode, String key, String path, byte[] value, int flags, long cas,
                    @Nullable Integer expiry) {
        super(CommandType.MUTATION, key, cas);
        this.opcode = requireNonNull(opcode, "opcode");
        checkArgument(opcode.isMutation(), "opcode: %s (expected: a single-path mutation)", opcode);
        this.path = requireNonNull(path, "path");
        this.value = requireNonNull(value, "value").clone();
        this.flags = flags;
        this.expiry = expiry;
    }

    public SubdocOpcode opcode() {
        return opcode;
    }

    public String path() {
        return path;
    }

    /**
     * Returns the value fragment. The returned array must not be modified.
     */
    public byte[] value() {
        return value;
    }

    public int flags() {
        return flags;
    }

    /**
     * Returns the new time to live in seconds, or {@code null} to keep the current expiration time.
     */
    @Nullable
    public Integer expiry() {
        return expiry;
    }

    @Override
    public void checkArguments() {
        SubdocOperations.checkArguments(opcode, path, value, flags);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MutationCommand)) {
            return false;
        }
        final MutationCommand that = (MutationCommand) obj;
        return super.equals(that) && opcode == that.opcode && path.equals(that.path) &&
               Arrays.equals(value, that.value) && flags == that.flags && Objects.equals(expiry, that.expiry);
    }

    @Override
    public int hashCode() {
        return ((super.hashCode() * 31 + opcode.hashCode()) * 31 + path.hashCode()) * 31 +
               Arrays.hashCode(value);
    }

    @Override
    ToStringHelper toStringHelper() {
        return super.toStringHelper()
                    .add("opcode", opcode)
                    .add("path", path)
                    .add("valueLength", value.length)
                    .add("flags", flags)
                    .add("expiry", expiry);
    }
}

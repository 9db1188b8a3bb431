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

import static java.util.Objects.requireNonNull;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.base.MoreObjects;

import com.linecorp.subdoc.common.SubdocFlags;
import com.linecorp.subdoc.common.SubdocOpcode;

/**
 * A mutation in a {@link MultiMutationCommand}.
 */
public final class MutationSpec {

    /**
     * Returns a new {@link MutationSpec} with no flags.
     */
    public static MutationSpec of(SubdocOpcode opcode, String path, String value) {
        return new MutationSpec(opcode, path, value.getBytes(StandardCharsets.UTF_8), SubdocFlags.NONE);
    }

    private final SubdocOpcode opcode;
    private final String path;
    private final byte[] value;
    private final int flags;

    public MutationSpec(SubdocOpcode opcode, String path, byte[] value, int flags) {
        this.opcode = requireNonNull(opcode, "opcode");
        this.path = requireNonNull(path, "path");
        this.value = requireNonNull(value, "value").clone();
        this.flags = flags;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MutationSpec)) {
            return false;
        }
        final MutationSpec that = (MutationSpec) o;
        return opcode == that.opcode && path.equals(that.path) && Arrays.equals(value, that.value) &&
               flags == that.flags;
    }

    @Override
    public int hashCode() {
        return (opcode.hashCode() * 31 + path.hashCode()) * 31 + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("opcode", opcode)
                          .add("path", path)
                          .add("valueLength", value.length)
                          .add("flags", flags)
                          .toString();
    }
}

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

import com.google.common.base.MoreObjects.ToStringHelper;

import com.linecorp.subdoc.common.SubdocOpcode;
import com.linecorp.subdoc.internal.document.SubdocOperations;

/**
 * A {@link Command} which reads a fragment of a document, or checks that it exists.
 */
public final class LookupCommand extends AbstractCommand<LookupResult> {

    private static final byte[] NO_VALUE = new byte[0];

    private final SubdocOpcode opcode;
    private final String path;
    private final int flags;

    LookupCommand(SubdocOpcode opcode, String key, String path, int flags) {
        super(CommandType.LOOKUP, key, 0);
        this.opcode = requireNonNull(opcode, "opcode");
        checkArgument(opcode.isLookup(), "opcode: %s (expected: GET or EXISTS)", opcode);
        this.path = requireNonNull(path, "path");
        this.flags = flags;
    }

    public SubdocOpcode opcode() {
        return opcode;
    }

    public String path() {
        return path;
    }

    public int flags() {
        return flags;
    }

    @Override
    public void checkArguments() {
        SubdocOperations.checkArguments(opcode, path, NO_VALUE, flags);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LookupCommand)) {
            return false;
        }
        final LookupCommand that = (LookupCommand) obj;
        return super.equals(that) && opcode == that.opcode && path.equals(that.path) && flags == that.flags;
    }

    @Override
    public int hashCode() {
        return (super.hashCode() * 31 + opcode.hashCode()) * 31 + path.hashCode();
    }

    @Override
    ToStringHelper toStringHelper() {
        return super.toStringHelper()
                    .add("opcode", opcode)
                    .add("path", path)
                    .add("flags", flags);
    }
}

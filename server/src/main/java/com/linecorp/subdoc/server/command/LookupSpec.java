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

import com.google.common.base.MoreObjects;

import com.linecorp.subdoc.common.SubdocFlags;
import com.linecorp.subdoc.common.SubdocOpcode;

/**
 * A lookup in a {@link MultiLookupCommand}.
 */
public final class LookupSpec {

    public static LookupSpec get(String path) {
        return new LookupSpec(SubdocOpcode.GET, path, SubdocFlags.NONE);
    }

    public static LookupSpec exists(String path) {
        return new LookupSpec(SubdocOpcode.EXISTS, path, SubdocFlags.NONE);
    }

    private final SubdocOpcode opcode;
    private final String path;
    private final int flags;

    public LookupSpec(SubdocOpcode opcode, String path, int flags) {
        this.opcode = requireNonNull(opcode, "opcode");
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
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LookupSpec)) {
            return false;
        }
        final LookupSpec that = (LookupSpec) o;
        return opcode == that.opcode && path.equals(that.path) && flags == that.flags;
    }

    @Override
    public int hashCode() {
        return opcode.hashCode() * 31 + path.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("opcode", opcode)
                          .add("path", path)
                          .add("flags", flags)
                          .toString();
    }
}

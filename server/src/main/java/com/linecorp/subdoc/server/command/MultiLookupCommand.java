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

import java.util.List;

import com.google.common.base.MoreObjects.ToStringHelper;
import com.google.common.collect.ImmutableList;

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocLimits;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.internal.document.SubdocOperations;

/**
 * A {@link Command} which performs up to {@value SubdocLimits#MAX_MULTI_PATHS} lookups against a single
 * snapshot of a document.
 */
public final class MultiLookupCommand extends AbstractCommand<MultiLookupResult> {

    private static final byte[] NO_VALUE = new byte[0];

    private final List<LookupSpec> specs;

    MultiLookupCommand(String key, List<LookupSpec> specs) {
        super(CommandType.MULTI_LOOKUP, key, 0);
        this.specs = ImmutableList.copyOf(requireNonNull(specs, "specs"));
    }

    public List<LookupSpec> specs() {
        return specs;
    }

    @Override
    public void checkArguments() {
        if (specs.isEmpty() || specs.size() > SubdocLimits.MAX_MULTI_PATHS) {
            throw new SubdocException(SubdocStatus.INVALID_COMBO,
                                      "specs.size(): " + specs.size() + " (expected: 1.." +
                                      SubdocLimits.MAX_MULTI_PATHS + ')', false);
        }
        for (LookupSpec spec : specs) {
            if (!spec.opcode().isLookup()) {
                throw new SubdocException(SubdocStatus.INVALID_COMBO,
                                          "not a lookup: " + spec.opcode(), false);
            }
        }
        for (LookupSpec spec : specs) {
            SubdocOperations.checkArguments(spec.opcode(), spec.path(), NO_VALUE, spec.flags());
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MultiLookupCommand)) {
            return false;
        }
        final MultiLookupCommand that = (MultiLookupCommand) obj;
        return super.equals(that) && specs.equals(that.specs);
    }

    @Override
    public int hashCode() {
        return super.hashCode() * 31 + specs.hashCode();
    }

    @Override
    ToStringHelper toStringHelper() {
        return super.toStringHelper().add("specs", specs);
    }
}

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
import java.util.Objects;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects.ToStringHelper;
import com.google.common.collect.ImmutableList;

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocLimits;
import com.linecorp.subdoc.common.SubdocStatus;
import com.linecorp.subdoc.internal.document.SubdocOperations;

/**
 * A {@link Command} which applies up to {@value SubdocLimits#MAX_MULTI_PATHS} mutations to a document
 * atomically. Either all of them are stored, or none of them.
 */
public final class MultiMutationCommand extends AbstractCommand<MultiMutationResult> {

    private final List<MutationSpec> specs;
    @Nullable
    private final Integer expiry;

    MultiMutationCommand(String key, List<MutationSpec> specs, long cas, @Nullable Integer expiry) {
        super(CommandType.MULTI_MUTATION, key, cas);
        this.specs = ImmutableList.copyOf(requireNonNull(specs, "specs"));
        this.expiry = expiry;
    }

    public List<MutationSpec> specs() {
        return specs;
    }

    @Nullable
    public Integer expiry() {
        return expiry;
    }

    @Override
    public void checkArguments() {
        if (specs.isEmpty() || specs.size() > SubdocLimits.MAX_MULTI_PATHS) {
            throw new SubdocException(SubdocStatus.INVALID_COMBO,
                                      "specs.size(): " + specs.size() + " (expected: 1.." +
                                      SubdocLimits.MAX_MULTI_PATHS + ')', false);
        }
        for (MutationSpec spec : specs) {
            if (!spec.opcode().isMutation()) {
                throw new SubdocException(SubdocStatus.INVALID_COMBO,
                                          "not a mutation: " + spec.opcode(), false);
            }
        }
        for (MutationSpec spec : specs) {
            SubdocOperations.checkArguments(spec.opcode(), spec.path(), spec.value(), spec.flags());
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MultiMutationCommand)) {
            return false;
        }
        final MultiMutationCommand that = (MultiMutationCommand) obj;
        return super.equals(that) && specs.equals(that.specs) && Objects.equals(expiry, that.expiry);
    }

    @Override
    public int hashCode() {
        return super.hashCode() * 31 + specs.hashCode();
    }

    @Override
    ToStringHelper toStringHelper() {
        return super.toStringHelper()
                    .add("specs", specs)
                    .add("expiry", expiry);
    }
}

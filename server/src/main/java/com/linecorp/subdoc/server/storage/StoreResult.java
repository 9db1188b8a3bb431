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

package com.linecorp.subdoc.server.storage;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.MoreObjects;

/**
 * The result of a successful {@link DocumentStore#casStore}.
 */
public final class StoreResult {

    private final long cas;
    private final MutationToken mutationToken;

    public StoreResult(long cas, MutationToken mutationToken) {
        checkArgument(cas != 0, "cas: %s (expected: != 0)", cas);
        this.cas = cas;
        this.mutationToken = requireNonNull(mutationToken, "mutationToken");
    }

    /**
     * Returns the new CAS of the document.
     */
    public long cas() {
        return cas;
    }

    public MutationToken mutationToken() {
        return mutationToken;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("cas", cas)
                          .add("mutationToken", mutationToken)
                          .toString();
    }
}

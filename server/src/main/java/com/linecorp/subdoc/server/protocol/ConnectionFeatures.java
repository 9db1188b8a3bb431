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

import com.google.common.base.MoreObjects;

/**
 * The features a client negotiated for its connection.
 */
public final class ConnectionFeatures {

    private static final ConnectionFeatures NONE = new ConnectionFeatures(false);
    private static final ConnectionFeatures MUTATION_SEQNO = new ConnectionFeatures(true);

    /**
     * Returns the {@link ConnectionFeatures} with nothing negotiated.
     */
    public static ConnectionFeatures none() {
        return NONE;
    }

    public static ConnectionFeatures of(boolean mutationSeqno) {
        return mutationSeqno ? MUTATION_SEQNO : NONE;
    }

    private final boolean mutationSeqno;

    private ConnectionFeatures(boolean mutationSeqno) {
        this.mutationSeqno = mutationSeqno;
    }

    /**
     * Returns {@code true} if mutation responses carry the mutation token in their extras.
     */
    public boolean mutationSeqno() {
        return mutationSeqno;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("mutationSeqno", mutationSeqno)
                          .toString();
    }
}

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

import com.google.common.base.MoreObjects;

/**
 * Identifies a mutation within the history of a partition, so that a client can tell whether it has been
 * persisted or replicated.
 */
public final class MutationToken {

    private final long partitionUuid;
    private final long seqno;

    public MutationToken(long partitionUuid, long seqno) {
        this.partitionUuid = partitionUuid;
        this.seqno = seqno;
    }

    /**
     * Returns the UUID of the partition history the mutation belongs to.
     */
    public long partitionUuid() {
        return partitionUuid;
    }

    /**
     * Returns the sequence number of the mutation.
     */
    public long seqno() {
        return seqno;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MutationToken)) {
            return false;
        }
        final MutationToken that = (MutationToken) o;
        return partitionUuid == that.partitionUuid && seqno == that.seqno;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(partitionUuid) * 31 + Long.hashCode(seqno);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("partitionUuid", partitionUuid)
                          .add("seqno", seqno)
                          .toString();
    }
}

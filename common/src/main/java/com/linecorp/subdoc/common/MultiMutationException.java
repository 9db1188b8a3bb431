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

package com.linecorp.subdoc.common;

import static java.util.Objects.requireNonNull;

/**
 * A {@link SubdocException} that is raised when one of the specs of a multi-mutation failed.
 * None of the specs in the batch have been applied.
 */
public class MultiMutationException extends SubdocException {

    private static final long serialVersionUID = -4800512934557611066L;

    private final int index;
    private final SubdocStatus specStatus;

    /**
     * Creates a new instance.
     *
     * @param index the index of the failed spec in the batch
     * @param cause the failure of the spec
     */
    public MultiMutationException(int index, SubdocException cause) {
        super(SubdocStatus.MULTI_PATH_FAILURE,
              "spec " + index + " failed: " + requireNonNull(cause, "cause").getMessage(), cause);
        this.index = index;
        specStatus = cause.status();
    }

    /**
     * Returns the index of the failed spec.
     */
    public int index() {
        return index;
    }

    /**
     * Returns the status of the failed spec.
     */
    public SubdocStatus specStatus() {
        return specStatus;
    }
}

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

import javax.annotation.Nullable;

/**
 * A {@link SubdocException} that is raised when the key is not owned by this node anymore.
 */
public class NotOwnerException extends SubdocException {

    private static final long serialVersionUID = 1206183547015391924L;

    private static final byte[] EMPTY = new byte[0];

    private final byte[] routingContext;

    /**
     * Creates a new instance.
     */
    public NotOwnerException(String key) {
        this(key, null);
    }

    /**
     * Creates a new instance.
     *
     * @param key the key of the document
     * @param routingContext the context that tells the client where the key moved, e.g. a cluster map
     */
    public NotOwnerException(String key, @Nullable byte[] routingContext) {
        super(SubdocStatus.NOT_MY_PARTITION, "not my partition: " + key, false);
        this.routingContext = routingContext != null ? routingContext.clone() : EMPTY;
    }

    /**
     * Returns the routing context, or an empty array if none.
     */
    public byte[] routingContext() {
        return routingContext.clone();
    }
}

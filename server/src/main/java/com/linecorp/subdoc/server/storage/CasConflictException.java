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

import com.linecorp.subdoc.common.SubdocException;
import com.linecorp.subdoc.common.SubdocStatus;

/**
 * A {@link SubdocException} that is raised by {@link DocumentStore#casStore} when the document has been
 * modified since it was fetched.
 */
public class CasConflictException extends SubdocException {

    private static final long serialVersionUID = 7213560448206318751L;

    /**
     * Creates a new instance.
     */
    public CasConflictException(String key) {
        super(SubdocStatus.KEY_EXISTS, "document modified concurrently: " + key, false);
    }
}

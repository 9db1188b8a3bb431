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
 * A {@link RuntimeException} that is raised when a subdocument command fails.
 * The {@link SubdocStatus} is what the client receives.
 */
public class SubdocException extends RuntimeException {

    private static final long serialVersionUID = 2184077317236915302L;

    private final SubdocStatus status;

    /**
     * Creates a new instance.
     */
    public SubdocException(SubdocStatus status, String message) {
        super(message);
        this.status = requireNonNull(status, "status");
    }

    /**
     * Creates a new instance.
     */
    public SubdocException(SubdocStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = requireNonNull(status, "status");
    }

    /**
     * Creates a new instance.
     *
     * @param status the status sent to the client
     * @param message the detail message
     * @param writableStackTrace whether or not the stack trace should be writable
     */
    public SubdocException(SubdocStatus status, String message, boolean writableStackTrace) {
        super(message, null, true, writableStackTrace);
        this.status = requireNonNull(status, "status");
    }

    /**
     * Returns the {@link SubdocStatus} of the failure.
     */
    public SubdocStatus status() {
        return status;
    }
}

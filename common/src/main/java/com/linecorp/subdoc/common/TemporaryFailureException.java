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

/**
 * A {@link SubdocException} that is raised when a mutation lost the CAS race too many times in a row.
 * The client may retry later.
 */
public class TemporaryFailureException extends SubdocException {

    private static final long serialVersionUID = -3017398431266470652L;

    /**
     * Creates a new instance.
     */
    public TemporaryFailureException(String message) {
        super(SubdocStatus.TEMPORARY_FAILURE, message);
    }
}

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
 * A {@link SubdocException} that is raised when the CAS supplied by the client does not match
 * the CAS of the stored document.
 */
public class CasMismatchException extends SubdocException {

    private static final long serialVersionUID = 4469284958264702218L;

    /**
     * Creates a new instance.
     */
    public CasMismatchException(String key, long expectedCas) {
        super(SubdocStatus.KEY_EXISTS, "CAS mismatch: " + key + " (expected: " + expectedCas + ')');
    }
}

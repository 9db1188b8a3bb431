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
 * Limits enforced on subdocument commands and documents.
 */
public final class SubdocLimits {

    /**
     * The maximum length of a path in bytes, when encoded in UTF-8.
     */
    public static final int MAX_PATH_LENGTH = 1024;

    /**
     * The maximum nesting level of a document. The root is at level 1.
     */
    public static final int MAX_DEPTH = 32;

    /**
     * The maximum number of components in a path, which addresses a value at level
     * {@code components + 1}.
     */
    public static final int MAX_PATH_COMPONENTS = MAX_DEPTH - 1;

    /**
     * The maximum number of specs in a multi-lookup or multi-mutation.
     */
    public static final int MAX_MULTI_PATHS = 16;

    private SubdocLimits() {}
}

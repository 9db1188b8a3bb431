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
 * The bits of the per-path flags byte.
 */
public final class SubdocFlags {

    public static final int NONE = 0;

    /**
     * Creates the missing intermediate objects along the path. Missing arrays are never created.
     */
    public static final int MKDIR_P = 0x01;

    private static final int ALL = MKDIR_P;

    /**
     * Returns {@code true} if {@code flags} has no bits other than the known ones.
     */
    public static boolean isValid(int flags) {
        return (flags & ~ALL) == 0;
    }

    public static boolean isMkdirP(int flags) {
        return (flags & MKDIR_P) != 0;
    }

    private SubdocFlags() {}
}

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

package com.linecorp.subdoc.server.command;

/**
 * Types of a {@link Command}.
 */
public enum CommandType {
    LOOKUP(LookupResult.class),
    MUTATION(MutationResult.class),
    MULTI_LOOKUP(MultiLookupResult.class),
    MULTI_MUTATION(MultiMutationResult.class);

    /**
     * The type of an object which is returned as a result after executing the command.
     */
    private final Class<?> resultType;

    CommandType(Class<?> resultType) {
        this.resultType = resultType;
    }

    /**
     * Returns the result type of the command.
     */
    public Class<?> resultType() {
        return resultType;
    }
}

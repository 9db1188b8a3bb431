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

import java.util.concurrent.CompletableFuture;

/**
 * An executor interface which executes {@link Command}s.
 */
public interface CommandExecutor {

    /**
     * Executes the specified {@link Command}. The returned future fails with a
     * {@link com.linecorp.subdoc.common.SubdocException} if the command fails.
     *
     * @param command the command which is supposed to be executed
     * @param <T> the type of the result to be returned
     */
    <T> CompletableFuture<T> execute(Command<T> command);
}

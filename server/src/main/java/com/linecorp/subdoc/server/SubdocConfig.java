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

package com.linecorp.subdoc.server;

import static com.google.common.base.MoreObjects.firstNonNull;
import static com.google.common.base.Preconditions.checkArgument;
import static com.linecorp.subdoc.server.SubdocEngineBuilder.DEFAULT_NUM_WORKERS;
import static com.linecorp.subdoc.server.command.SubdocCommandExecutor.DEFAULT_MAX_CAS_ATTEMPTS;
import static java.util.Objects.requireNonNull;

import java.io.File;
import java.nio.charset.StandardCharsets;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.google.common.annotations.VisibleForTesting;

import com.linecorp.subdoc.internal.Jackson;

/**
 * {@link SubdocEngine} configuration.
 *
 * <pre>{@code
 * {
 *   "numWorkers": 16,
 *   "maxCasAttempts": 100
 * }
 * }</pre>
 */
public final class SubdocConfig {

    /**
     * Loads the configuration from the specified {@link File}.
     */
    public static SubdocConfig load(File configFile) throws JsonMappingException, JsonParseException {
        requireNonNull(configFile, "configFile");
        return Jackson.readValue(configFile, SubdocConfig.class);
    }

    /**
     * Loads the configuration from the specified JSON string.
     */
    @VisibleForTesting
    public static SubdocConfig load(String json) throws JsonMappingException, JsonParseException {
        requireNonNull(json, "json");
        return Jackson.readValue(json.getBytes(StandardCharsets.UTF_8), SubdocConfig.class);
    }

    private final int numWorkers;
    private final int maxCasAttempts;

    @JsonCreator
    SubdocConfig(@JsonProperty("numWorkers") @Nullable Integer numWorkers,
                 @JsonProperty("maxCasAttempts") @Nullable Integer maxCasAttempts) {
        this.numWorkers = firstNonNull(numWorkers, DEFAULT_NUM_WORKERS);
        checkArgument(this.numWorkers > 0, "numWorkers: %s (expected: > 0)", this.numWorkers);
        this.maxCasAttempts = firstNonNull(maxCasAttempts, DEFAULT_MAX_CAS_ATTEMPTS);
        checkArgument(this.maxCasAttempts > 0,
                      "maxCasAttempts: %s (expected: > 0)", this.maxCasAttempts);
    }

    /**
     * Returns the number of threads which run the commands.
     */
    @JsonProperty
    public int numWorkers() {
        return numWorkers;
    }

    /**
     * Returns the maximum number of store attempts of a mutation before it fails with a temporary failure.
     */
    @JsonProperty
    public int maxCasAttempts() {
        return maxCasAttempts;
    }

    @Override
    public String toString() {
        return Jackson.writeValueAsString(this);
    }
}

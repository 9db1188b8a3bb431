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

package com.linecorp.subdoc.internal;

import java.io.File;
import java.io.IOError;
import java.io.IOException;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;

public final class Jackson {

    private static final ObjectMapper compactMapper = new ObjectMapper();

    static {
        compactMapper.disable(SerializationFeature.INDENT_OUTPUT);
        // Reject '0x2' or '1 2' instead of reading the first token only.
        compactMapper.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        // Keep floating-point numbers as written, e.g. '1e400' or '2.0'.
        compactMapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        compactMapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    public static <T> T readValue(byte[] data, Class<T> type) throws JsonParseException, JsonMappingException {
        try {
            return compactMapper.readValue(data, type);
        } catch (JsonParseException | JsonMappingException e) {
            throw e;
        } catch (IOException e) {
            throw new IOError(e);
        }
    }

    public static <T> T readValue(File file, Class<T> type) throws JsonParseException, JsonMappingException {
        try {
            return compactMapper.readValue(file, type);
        } catch (JsonParseException | JsonMappingException e) {
            throw e;
        } catch (IOException e) {
            throw new IOError(e);
        }
    }

    public static JsonNode readTree(String data) throws JsonProcessingException {
        return compactMapper.readTree(data);
    }

    /**
     * Parses {@code data} into a tree. A blank input yields a {@code MissingNode}.
     */
    public static JsonNode readTree(byte[] data) throws JsonProcessingException {
        try {
            return compactMapper.readTree(data);
        } catch (JsonProcessingException e) {
            throw e;
        } catch (IOException e) {
            throw new IOError(e);
        }
    }

    public static byte[] writeValueAsBytes(Object value) {
        try {
            return compactMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            // A JsonNode tree is always serializable.
            throw new IllegalStateException(e);
        }
    }

    public static String writeValueAsString(Object value) {
        try {
            return compactMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private Jackson() {}
}

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

package com.linecorp.subdoc.internal.document;

import java.util.ArrayDeque;
import java.util.Deque;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Measures the nesting depth of a {@link JsonNode} tree. A scalar or an empty container has depth 1,
 * and {@code [[1]]} has depth 3.
 */
public final class DocumentDepth {

    /**
     * Returns the depth of {@code node}, or {@code limit + 1} if it is deeper than {@code limit}.
     * The tree is walked with an explicit stack, so hostile input cannot exhaust the thread stack.
     */
    public static int depth(JsonNode node, int limit) {
        int max = 1;
        final Deque<JsonNode> nodes = new ArrayDeque<>();
        final Deque<Integer> levels = new ArrayDeque<>();
        nodes.push(node);
        levels.push(1);
        while (!nodes.isEmpty()) {
            final JsonNode current = nodes.pop();
            final int level = levels.pop();
            if (level > max) {
                max = level;
                if (max > limit) {
                    return limit + 1;
                }
            }
            if (current.isContainerNode()) {
                for (JsonNode child : current) {
                    nodes.push(child);
                    levels.push(level + 1);
                }
            }
        }
        return max;
    }

    private DocumentDepth() {}
}

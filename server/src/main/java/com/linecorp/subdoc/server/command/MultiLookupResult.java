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

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The result of a {@link MultiLookupCommand}. It has one {@link OperationResult} per spec, in order.
 */
public final class MultiLookupResult {

    private final List<OperationResult> results;
    private final long cas;

    public MultiLookupResult(List<OperationResult> results, long cas) {
        this.results = ImmutableList.copyOf(results);
        this.cas = cas;
    }

    public List<OperationResult> results() {
        return results;
    }

    public long cas() {
        return cas;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("results", results)
                          .add("cas", cas)
                          .toString();
    }
}

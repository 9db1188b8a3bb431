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

import static com.google.common.base.Preconditions.checkState;

import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import com.linecorp.subdoc.internal.path.PathComponent;

/**
 * The result of {@link DocumentNavigator#navigate}: where the last component of a path resolves to.
 *
 * <p>A location is either the document root, an existing value in its container, or an absent slot in
 * an existing container. When the navigator was asked to create missing parents, the container may be
 * an ancestor of the slot and {@link #missingKeys()} lists the objects to create in between.
 */
public final class Location {

    static Location root(JsonNode root) {
        return new Location(null, ImmutableList.of(), null, root, -1);
    }

    static Location of(JsonNode container, PathComponent component, @Nullable JsonNode value, int index) {
        return new Location(container, ImmutableList.of(), component, value, index);
    }

    static Location missingParents(ObjectNode ancestor, List<String> missingKeys, PathComponent component) {
        return new Location(ancestor, ImmutableList.copyOf(missingKeys), component, null, -1);
    }

    @Nullable
    private final JsonNode container;
    private final List<String> missingKeys;
    @Nullable
    private final PathComponent component;
    @Nullable
    private final JsonNode value;
    private final int index;

    private Location(@Nullable JsonNode container, List<String> missingKeys,
                     @Nullable PathComponent component, @Nullable JsonNode value, int index) {
        this.container = container;
        this.missingKeys = missingKeys;
        this.component = component;
        this.value = value;
        this.index = index;
    }

    /**
     * Returns {@code true} if this is the location of the document root.
     */
    public boolean isRoot() {
        return component == null;
    }

    /**
     * Returns the existing container the last component was resolved against. If some parents are
     * missing, this is the deepest existing ancestor.
     */
    public JsonNode container() {
        checkState(container != null, "the root has no container");
        return container;
    }

    /**
     * Returns the keys of the missing objects between {@link #container()} and the slot.
     */
    public List<String> missingKeys() {
        return missingKeys;
    }

    public boolean hasMissingParents() {
        return !missingKeys.isEmpty();
    }

    /**
     * Returns the last path component.
     */
    public PathComponent component() {
        checkState(component != null, "the root has no path component");
        return component;
    }

    /**
     * Returns the value at this location, or {@code null} if absent.
     */
    @Nullable
    public JsonNode value() {
        return value;
    }

    public boolean exists() {
        return value != null;
    }

    /**
     * Returns the resolved array index, with {@code [-1]} resolved to the last element.
     * Returns {@code -1} if the container is not an array.
     */
    public int index() {
        return index;
    }

    /**
     * Creates the missing parent objects, if any, and returns the container the slot belongs to.
     * Must be called only when the mutation is certain to succeed.
     */
    JsonNode materializeContainer() {
        JsonNode current = container();
        for (String key : missingKeys) {
            current = ((ObjectNode) current).putObject(key);
        }
        return current;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("component", component)
                          .add("missingKeys", missingKeys)
                          .add("exists", value != null)
                          .add("index", index)
                          .toString();
    }
}

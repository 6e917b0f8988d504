/*
 * Copyright 2019 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"). You may not use this file except
 * in compliance with the License. A copy of the License is located at
 *
 * http://aws.amazon.com/apache2.0
 *
 * or in the "license" file accompanying this file. This file is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations under the License.
 */

package org.rocrate.encryption.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory crate metadata graph: an insertion-ordered table of entities keyed by id.
 * Cross-entity edges are plain id strings resolved through {@link #dereference(String)}.
 * <p>
 * Instances are not thread safe.
 */
public class CrateGraph {

    public static final String DEFAULT_CONTEXT = "https://w3id.org/ro/crate/1.1/context";

    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private Object context;

    public CrateGraph() {
        this(DEFAULT_CONTEXT);
    }

    public CrateGraph(final Object context) {
        this.context = context == null ? DEFAULT_CONTEXT : context;
    }

    /**
     * The JSON-LD {@code @context} of the document this graph is written to.
     */
    public Object getContext() {
        return context;
    }

    public void setContext(final Object context) {
        requireNonNull(context, "context is required");
        this.context = context;
    }

    /**
     * A snapshot of all entities in insertion order.
     */
    public List<Entity> getEntities() {
        return Collections.unmodifiableList(new ArrayList<>(entities.values()));
    }

    /**
     * A snapshot of the entities of the given kind in insertion order.
     */
    public List<Entity> getEntities(final EntityKind kind) {
        final List<Entity> result = new ArrayList<>();
        for (Entity entity : entities.values()) {
            if (entity.getKind() == kind) {
                result.add(entity);
            }
        }
        return result;
    }

    /**
     * Returns the entity with the given id, or {@code null} when the graph has none.
     */
    public Entity dereference(final String id) {
        return id == null ? null : entities.get(id);
    }

    public boolean contains(final String id) {
        return entities.containsKey(id);
    }

    /**
     * Adds the entity, replacing any entity with the same id.
     *
     * @param entity The entity to add.
     * @return The added entity, for chaining.
     */
    public Entity put(final Entity entity) {
        requireNonNull(entity, "entity is required");
        entities.put(entity.getId(), entity);
        return entity;
    }

    public Entity remove(final String id) {
        return entities.remove(id);
    }

    public int size() {
        return entities.size();
    }
}

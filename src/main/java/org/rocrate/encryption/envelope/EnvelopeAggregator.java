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

package org.rocrate.encryption.envelope;

import org.rocrate.encryption.graph.Entity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.isTrue;

/**
 * Partitions sensitive entities into {@link RecipientGroup}s of identical recipient sets so that
 * each distinct set costs one encryption.
 */
public class EnvelopeAggregator {

    private final RecipientResolver resolver;
    private final boolean allowMissingMembers;

    public EnvelopeAggregator(final RecipientResolver resolver, final boolean allowMissingMembers) {
        this.resolver = requireNonNull(resolver, "resolver is required");
        this.allowMissingMembers = allowMissingMembers;
    }

    /**
     * Groups the entities by resolved recipient set. Groups come out in the order their first
     * member was seen and members keep their input order.
     *
     * @param entities The sensitive entities.
     * @return The groups; empty for empty input.
     */
    public List<RecipientGroup> aggregate(final List<Entity> entities) {
        requireNonNull(entities, "entities are required");

        final Map<SortedSet<String>, RecipientGroup> groups = new LinkedHashMap<>();
        for (Entity entity : entities) {
            isTrue(entity.isSensitive(), "Entity %s is not sensitive", entity.getId());
            final SortedSet<String> fingerprints = resolver.resolve(entity, allowMissingMembers);
            groups.computeIfAbsent(fingerprints, RecipientGroup::new).add(entity);
        }
        return new ArrayList<>(groups.values());
    }
}

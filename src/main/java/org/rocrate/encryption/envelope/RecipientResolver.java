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

import org.rocrate.encryption.exception.MissingMemberException;
import org.rocrate.encryption.exception.NoValidKeysException;
import org.rocrate.encryption.graph.CrateGraph;
import org.rocrate.encryption.graph.Entity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Computes the set of public key fingerprints a sensitive entity must be encrypted for.
 * <p>
 * The set is the union of the fingerprints attached to the entity itself and those of every
 * entity it names under {@code recipients}, followed one level deep, combined with the crate-wide
 * default fingerprints according to the {@link CrateKeyPolicy}.
 */
public class RecipientResolver {

    private static final Logger LOGGER = Logger.getLogger(RecipientResolver.class.getName());

    private final CrateGraph graph;
    private final Set<String> crateFingerprints;
    private final CrateKeyPolicy crateKeyPolicy;

    public RecipientResolver(final CrateGraph graph) {
        this(graph, Collections.emptySet(), CrateKeyPolicy.UNION);
    }

    public RecipientResolver(final CrateGraph graph, final Collection<String> crateFingerprints,
                             final CrateKeyPolicy crateKeyPolicy) {
        this.graph = requireNonNull(graph, "graph is required");
        requireNonNull(crateFingerprints, "crateFingerprints are required");
        this.crateFingerprints = Collections.unmodifiableSet(new LinkedHashSet<>(crateFingerprints));
        this.crateKeyPolicy = requireNonNull(crateKeyPolicy, "crateKeyPolicy is required");
    }

    /**
     * Resolves the recipient fingerprints of an entity. Calling it again on an unchanged entity
     * and graph returns an equal set.
     *
     * @param entity       The sensitive entity.
     * @param allowMissing Whether recipients without a usable key may be skipped.
     * @return The sorted, deduplicated fingerprints.
     * @throws MissingMemberException if a recipient is unknown or has no key and {@code allowMissing} is false.
     * @throws NoValidKeysException   if no fingerprint could be found at all.
     */
    public SortedSet<String> resolve(final Entity entity, final boolean allowMissing) {
        requireNonNull(entity, "entity is required");

        final SortedSet<String> fingerprints = new TreeSet<>(entity.getFingerprints());
        final List<String> missing = new ArrayList<>();

        for (String recipientId : entity.getRecipientIds()) {
            final Entity recipient = graph.dereference(recipientId);
            final List<String> recipientKeys = recipient == null ? Collections.emptyList() : recipient.getFingerprints();
            if (recipientKeys.isEmpty()) {
                missing.add(recipientId);
            } else {
                fingerprints.addAll(recipientKeys);
            }
        }

        if (!missing.isEmpty()) {
            if (!allowMissing) {
                throw new MissingMemberException(entity.getId(), missing);
            }
            LOGGER.info(String.format("Recipients %s of %s have no usable key and are skipped", missing, entity.getId()));
        }

        crateKeyPolicy.apply(fingerprints, crateFingerprints);

        if (fingerprints.isEmpty()) {
            throw new NoValidKeysException(entity.getId());
        }
        return Collections.unmodifiableSortedSet(fingerprints);
    }

    public Set<String> getCrateFingerprints() {
        return crateFingerprints;
    }

    public CrateKeyPolicy getCrateKeyPolicy() {
        return crateKeyPolicy;
    }
}

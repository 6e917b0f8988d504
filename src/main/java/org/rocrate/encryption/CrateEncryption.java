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

package org.rocrate.encryption;

import org.rocrate.encryption.envelope.CrateKeyPolicy;
import org.rocrate.encryption.envelope.EncodeResult;
import org.rocrate.encryption.envelope.EnvelopeAggregator;
import org.rocrate.encryption.envelope.EnvelopeDecoder;
import org.rocrate.encryption.envelope.EnvelopeEncoder;
import org.rocrate.encryption.envelope.EnvelopeRecord;
import org.rocrate.encryption.envelope.RecipientDescriptor;
import org.rocrate.encryption.envelope.RecipientGroup;
import org.rocrate.encryption.envelope.RecipientResolver;
import org.rocrate.encryption.exception.BackendFailureException;
import org.rocrate.encryption.exception.MalformedEnvelopeException;
import org.rocrate.encryption.exception.MissingMemberException;
import org.rocrate.encryption.exception.NoValidKeysException;
import org.rocrate.encryption.graph.CrateGraph;
import org.rocrate.encryption.graph.Entity;
import org.rocrate.encryption.graph.EntityKind;
import org.rocrate.encryption.keys.CryptoBackend;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Provides the primary entry-point for encrypting the sensitive entities of a crate graph and for
 * reading them back.
 * <p>
 * {@link #seal(CrateGraph)} turns every {@link EntityKind#SENSITIVE} entity into envelopes:
 * <ol>
 * <li>a {@link RecipientResolver} finds the public keys each entity is meant for,</li>
 * <li>an {@link EnvelopeAggregator} groups entities with identical recipients,</li>
 * <li>an {@link EnvelopeEncoder} encrypts each group once through the {@link CryptoBackend}.</li>
 * </ol>
 * {@link #open(CrateGraph)} reverses the process with whatever private keys the backend holds;
 * envelopes meant for others stay sealed and are carried through a later {@code seal} unchanged.
 */
public class CrateEncryption {

    private static final Logger LOGGER = Logger.getLogger(CrateEncryption.class.getName());

    private final CryptoBackend backend;
    private final Set<String> crateFingerprints;
    private final CrateKeyPolicy crateKeyPolicy;
    private final boolean allowMissingMembers;
    private final String keyserverUrl;

    private CrateEncryption(Builder b) {
        requireNonNull(b.backend, "backend is required");
        requireNonNull(b.crateKeyPolicy, "crateKeyPolicy is required");
        this.backend = b.backend;
        this.crateFingerprints = Collections.unmodifiableSet(new LinkedHashSet<>(b.crateFingerprints));
        this.crateKeyPolicy = b.crateKeyPolicy;
        this.allowMissingMembers = b.allowMissingMembers;
        this.keyserverUrl = b.keyserverUrl;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the sealed form of a graph: plain entities, recipient descriptors and envelopes, with
     * no sensitive entity left. The given graph is not modified.
     *
     * @param graph The graph to seal.
     * @return A new graph ready to be written.
     * @throws NoValidKeysException    if a sensitive entity has no recipient key.
     * @throws MissingMemberException  if a recipient lacks a key and missing members are not allowed.
     * @throws BackendFailureException if the backend refuses to encrypt a group.
     */
    public CrateGraph seal(final CrateGraph graph) {
        requireNonNull(graph, "graph is required");

        final List<RecipientGroup> groups = new EnvelopeAggregator(resolver(graph), allowMissingMembers)
                .aggregate(graph.getEntities(EntityKind.SENSITIVE));
        final EncodeResult encoded = new EnvelopeEncoder(backend, keyserverUrl).encode(groups);

        final CrateGraph sealed = new CrateGraph(graph.getContext());
        for (Entity entity : graph.getEntities()) {
            if (!entity.isSensitive()) {
                sealed.put(entity.copy());
            }
        }
        for (RecipientDescriptor descriptor : encoded.getRecipients()) {
            mergeRecipient(sealed, descriptor.toEntity());
        }
        for (EnvelopeRecord envelope : encoded.getEnvelopes()) {
            sealed.put(envelope.toEntity());
        }
        return sealed;
    }

    /**
     * Decrypts the envelopes the local keys can open and puts their entities into the graph.
     *
     * @param graph The graph read from a document; modified in place.
     * @return The recovered sensitive entities.
     * @throws MalformedEnvelopeException if an envelope is structurally invalid.
     */
    public List<Entity> open(final CrateGraph graph) {
        return new EnvelopeDecoder(backend).decode(graph);
    }

    /**
     * Resolves the recipient fingerprints of one sensitive entity with this instance's settings.
     */
    public SortedSet<String> resolveRecipients(final CrateGraph graph, final Entity entity) {
        return resolver(graph).resolve(entity, allowMissingMembers);
    }

    private RecipientResolver resolver(final CrateGraph graph) {
        return new RecipientResolver(graph, crateFingerprints, crateKeyPolicy);
    }

    // a descriptor of a still-sealed envelope may already exist under the same identity
    private static void mergeRecipient(final CrateGraph sealed, final Entity descriptor) {
        final Entity existing = sealed.dereference(descriptor.getId());
        if (existing == null) {
            sealed.put(descriptor);
            return;
        }
        if (existing.getKind() != EntityKind.RECIPIENT) {
            LOGGER.warning(String.format("Entity %s is a %s, not a recipient; keeping it without a descriptor",
                    descriptor.getId(), existing.getKind()));
            return;
        }
        existing.addFingerprints(descriptor.getFingerprints());
        final Object actions = descriptor.get(RecipientDescriptor.ACTION);
        if (actions instanceof List) {
            for (Object action : (List<?>) actions) {
                existing.appendTo(RecipientDescriptor.ACTION, action);
            }
        }
    }

    public CryptoBackend getBackend() {
        return backend;
    }

    public Set<String> getCrateFingerprints() {
        return crateFingerprints;
    }

    public CrateKeyPolicy getCrateKeyPolicy() {
        return crateKeyPolicy;
    }

    public boolean isAllowMissingMembers() {
        return allowMissingMembers;
    }

    public String getKeyserverUrl() {
        return keyserverUrl;
    }

    public static class Builder {
        private CryptoBackend backend;
        private List<String> crateFingerprints = new ArrayList<>();
        private CrateKeyPolicy crateKeyPolicy = CrateKeyPolicy.UNION;
        private boolean allowMissingMembers = false;
        private String keyserverUrl;

        private Builder() {
        }

        public Builder backend(CryptoBackend backend) {
            this.backend = backend;
            return this;
        }

        /**
         * Sets fingerprints every sensitive entity of the crate is encrypted for, subject to the
         * {@link CrateKeyPolicy}.
         */
        public Builder crateFingerprints(Collection<String> crateFingerprints) {
            requireNonNull(crateFingerprints, "crateFingerprints are required");
            crateFingerprints.forEach(fingerprint -> notBlank(fingerprint, "fingerprint must not be blank"));
            this.crateFingerprints = new ArrayList<>(crateFingerprints);
            return this;
        }

        public Builder crateKeyPolicy(CrateKeyPolicy crateKeyPolicy) {
            this.crateKeyPolicy = crateKeyPolicy;
            return this;
        }

        /**
         * Whether recipients without a usable key are skipped instead of failing the seal.
         */
        public Builder allowMissingMembers(boolean allowMissingMembers) {
            this.allowMissingMembers = allowMissingMembers;
            return this;
        }

        public Builder keyserverUrl(String keyserverUrl) {
            this.keyserverUrl = keyserverUrl;
            return this;
        }

        public CrateEncryption build() {
            return new CrateEncryption(this);
        }
    }
}

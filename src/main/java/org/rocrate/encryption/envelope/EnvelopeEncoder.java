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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.rocrate.encryption.exception.BackendFailureException;
import org.rocrate.encryption.exception.CrateEncryptionException;
import org.rocrate.encryption.graph.Entity;
import org.rocrate.encryption.keys.CryptoBackend;
import org.rocrate.encryption.keys.KeyIdentity;
import org.rocrate.encryption.keys.KeyImportResult;
import org.rocrate.encryption.keys.KeyserverWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Encrypts each {@link RecipientGroup} into one {@link EnvelopeRecord} and builds the
 * {@link RecipientDescriptor}s of the keys involved.
 * <p>
 * Recipient keys are described with the metadata the backend lists locally. Keys missing locally
 * are first fetched from the configured key server, if any; key server problems are logged as
 * warnings and never stop the encoding.
 */
public class EnvelopeEncoder {

    private final CryptoBackend backend;
    private final String keyserverUrl;
    private final ObjectMapper mapper = new ObjectMapper();

    public EnvelopeEncoder(final CryptoBackend backend) {
        this(backend, null);
    }

    /**
     * @param backend      The cryptography backend.
     * @param keyserverUrl Key server to fetch unknown recipient keys from, or {@code null}.
     */
    public EnvelopeEncoder(final CryptoBackend backend, final String keyserverUrl) {
        this.backend = requireNonNull(backend, "backend is required");
        this.keyserverUrl = keyserverUrl;
    }

    /**
     * Encodes the groups, invoking the backend once per group.
     *
     * @param groups The recipient groups.
     * @return The envelopes, in group order, and the merged recipient descriptors.
     * @throws BackendFailureException if the backend cannot encrypt a group; nothing is returned.
     */
    public EncodeResult encode(final List<RecipientGroup> groups) {
        requireNonNull(groups, "groups are required");
        if (groups.isEmpty()) {
            return new EncodeResult(Collections.emptyList(), Collections.emptyList());
        }

        final Set<String> allFingerprints = new LinkedHashSet<>();
        groups.forEach(group -> allFingerprints.addAll(group.getFingerprints()));
        final Map<String, KeyIdentity> knownKeys = describeKeys(allFingerprints);

        final List<EnvelopeRecord> envelopes = new ArrayList<>();
        final Map<String, RecipientDescriptor> descriptors = new LinkedHashMap<>();
        for (RecipientGroup group : groups) {
            final List<KeyIdentity> recipients = new ArrayList<>();
            for (String fingerprint : group.getFingerprints()) {
                recipients.add(knownKeys.get(fingerprint));
            }

            final String ciphertext = backend.encrypt(serialize(group), group.getFingerprints());
            final EnvelopeRecord envelope = EnvelopeRecord.builder()
                    .ciphertext(ciphertext)
                    .recipients(recipients)
                    .build();
            envelopes.add(envelope);

            for (KeyIdentity recipient : recipients) {
                descriptors.computeIfAbsent(recipient.getPrimaryIdentity(), RecipientDescriptor::new)
                        .addEnvelope(recipient, envelope.getId());
            }
        }
        return new EncodeResult(envelopes, new ArrayList<>(descriptors.values()));
    }

    /**
     * The JSON array of the members' property-sets, in member order.
     */
    byte[] serialize(final RecipientGroup group) {
        final List<Map<String, Object>> fragment = new ArrayList<>();
        for (Entity member : group.getMembers()) {
            fragment.add(member.toJsonLd());
        }
        try {
            return mapper.writeValueAsBytes(fragment);
        } catch (JsonProcessingException e) {
            throw new CrateEncryptionException("Unable to serialize sensitive entities", e);
        }
    }

    private Map<String, KeyIdentity> describeKeys(final Set<String> fingerprints) {
        Map<String, KeyIdentity> localKeys = backend.listLocalKeys();

        final List<String> unknown = new ArrayList<>();
        for (String fingerprint : fingerprints) {
            if (lookup(localKeys, fingerprint) == null) {
                unknown.add(fingerprint);
            }
        }
        if (!unknown.isEmpty() && StringUtils.isNotBlank(keyserverUrl)) {
            localKeys = fetchFromKeyserver(unknown, localKeys);
        }

        final Map<String, KeyIdentity> described = new LinkedHashMap<>();
        for (String fingerprint : fingerprints) {
            final KeyIdentity local = lookup(localKeys, fingerprint);
            described.put(fingerprint, local == null ? KeyIdentity.bare(fingerprint) : local);
        }
        return described;
    }

    private Map<String, KeyIdentity> fetchFromKeyserver(final List<String> unknown, final Map<String, KeyIdentity> localKeys) {
        try {
            final KeyImportResult imported = backend.fetchKeys(keyserverUrl, unknown);
            return imported.getFingerprints().isEmpty() ? localKeys : backend.listLocalKeys();
        } catch (RuntimeException e) {
            KeyserverWarning.report(String.join(",", unknown), "key server lookup failed: " + e);
            return localKeys;
        }
    }

    private static KeyIdentity lookup(final Map<String, KeyIdentity> keys, final String fingerprint) {
        final KeyIdentity exact = keys.get(fingerprint);
        return exact != null ? exact : keys.get(fingerprint.toUpperCase(Locale.ROOT));
    }
}

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

package org.rocrate.encryption.keys;

import org.apache.commons.lang3.StringUtils;
import org.rocrate.encryption.graph.Entity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Factory methods for keyholder entities: plaintext contact points that carry the public key
 * fingerprints of a recipient, so that sensitive entities can name them under {@code recipients}.
 */
public final class Keyholder {

    public static final String INDEX_LOOKUP = "/pks/lookup?op=index&exact=true&search=";
    public static final List<String> TYPES = Arrays.asList("ContactPoint", "EncryptionKeyholder");
    public static final String KEYSERVER = "keyserver";

    private Keyholder() {
    }

    public static Entity create(final KeyIdentity key) {
        return create(null, key, null);
    }

    public static Entity create(final KeyIdentity key, final String keyserver) {
        return create(null, key, keyserver);
    }

    /**
     * Builds a keyholder entity. Without an explicit id the entity is identified by its key server
     * index URL when a key server is given, and by {@code "#" + fingerprint} otherwise.
     *
     * @param id        An explicit id, or {@code null}.
     * @param key       The holder's key, or {@code null} for a keyholder without a key.
     * @param keyserver The key server the key is published on, or {@code null}.
     * @return The keyholder entity.
     * @throws IllegalArgumentException if neither an id nor a key is supplied.
     */
    public static Entity create(final String id, final KeyIdentity key, final String keyserver) {
        if (StringUtils.isBlank(id) && key == null) {
            throw new IllegalArgumentException("No valid identifier combination supplied for keyholder");
        }
        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(Entity.TYPE, TYPES);
        String identifier = id;
        if (key != null) {
            final List<Object> names = new ArrayList<>();
            final List<Object> emails = new ArrayList<>();
            for (UserId userId : key.getUserIds()) {
                names.add(userId.getDisplayName());
                emails.add(userId.getContactAddress());
            }
            properties.put(Entity.PUBKEY_FINGERPRINTS, key.getFingerprint());
            properties.put("name", names);
            properties.put("email", emails);
            if (StringUtils.isNotBlank(keyserver)) {
                final String url = StringUtils.removeEnd(keyserver, "/") + INDEX_LOOKUP + key.getFingerprint();
                properties.put(KEYSERVER, keyserver);
                properties.put("url", url);
                identifier = StringUtils.isBlank(identifier) ? url : identifier;
            }
            identifier = StringUtils.isBlank(identifier) ? "#" + key.getFingerprint() : identifier;
        }
        return Entity.plain(identifier, properties);
    }

    /**
     * Imports the keyholder's keys from its key server.
     *
     * @param keyholder The keyholder entity.
     * @param backend   The backend to import into.
     * @return The import result, or empty when the keyholder names no fingerprint or key server.
     */
    public static Optional<KeyImportResult> retrieveKeys(final Entity keyholder, final CryptoBackend backend) {
        requireNonNull(keyholder, "keyholder is required");
        requireNonNull(backend, "backend is required");

        final List<String> fingerprints = keyholder.getFingerprints();
        final Object keyserver = keyholder.get(KEYSERVER);
        if (fingerprints.isEmpty() || !(keyserver instanceof String) || StringUtils.isBlank((String) keyserver)) {
            return Optional.empty();
        }
        return Optional.of(backend.fetchKeys((String) keyserver, fingerprints));
    }
}

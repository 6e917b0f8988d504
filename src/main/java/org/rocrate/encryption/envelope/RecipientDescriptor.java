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
import org.rocrate.encryption.graph.EntityKind;
import org.rocrate.encryption.keys.KeyIdentity;
import org.rocrate.encryption.keys.UserId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * The audience entity of one recipient identity, linking it to every envelope addressed to it.
 * Keys sharing a primary identity string are merged into one descriptor. Descriptors are only
 * extended by the {@link EnvelopeEncoder} while it encodes.
 */
public final class RecipientDescriptor {

    public static final String AUDIENCE = "Audience";
    public static final String AUDIENCE_TYPE = "audienceType";
    public static final String ENCRYPTED_MESSAGE_RECIPIENTS = "encrypted message recipients";
    public static final String ACTION = "action";
    public static final String IDENTIFIER = "identifier";

    private final String id;
    private final List<KeyIdentity> keys = new ArrayList<>();
    private final Set<String> envelopeIds = new LinkedHashSet<>();

    RecipientDescriptor(final String id) {
        notBlank(id, "id is required");
        this.id = id;
    }

    void addEnvelope(final KeyIdentity key, final String envelopeId) {
        requireNonNull(key, "key is required");
        notBlank(envelopeId, "envelopeId is required");
        boolean known = false;
        for (KeyIdentity existing : keys) {
            known |= existing.getFingerprint().equals(key.getFingerprint());
        }
        if (!known) {
            keys.add(key);
        }
        envelopeIds.add(envelopeId);
    }

    /**
     * The primary identity string shared by this descriptor's keys.
     */
    public String getId() {
        return id;
    }

    public List<KeyIdentity> getKeys() {
        return Collections.unmodifiableList(keys);
    }

    public List<String> getEnvelopeIds() {
        return Collections.unmodifiableList(new ArrayList<>(envelopeIds));
    }

    public Entity toEntity() {
        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(Entity.TYPE, AUDIENCE);
        properties.put(AUDIENCE_TYPE, ENCRYPTED_MESSAGE_RECIPIENTS);

        final List<Object> fingerprints = new ArrayList<>();
        final Set<Object> secondary = new LinkedHashSet<>();
        for (KeyIdentity key : keys) {
            fingerprints.add(key.getFingerprint());
            secondary.addAll(key.getSecondaryIdentities());
        }
        properties.put(Entity.PUBKEY_FINGERPRINTS, fingerprints);

        final KeyIdentity primary = keys.isEmpty() ? null : keys.get(0);
        if (primary != null && !primary.getIdentities().isEmpty()) {
            final UserId userId = KeyIdentity.parseIdentity(primary.getPrimaryIdentity());
            properties.put("name", userId.getDisplayName());
            properties.put("email", userId.getContactAddress());
        }
        if (!secondary.isEmpty()) {
            properties.put(IDENTIFIER, new ArrayList<>(secondary));
        }

        final List<Object> actions = new ArrayList<>();
        for (String envelopeId : envelopeIds) {
            actions.add(Entity.reference(envelopeId));
        }
        properties.put(ACTION, actions);
        return Entity.of(EntityKind.RECIPIENT, id, properties);
    }
}

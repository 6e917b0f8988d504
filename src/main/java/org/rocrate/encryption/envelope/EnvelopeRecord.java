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

import org.apache.commons.lang3.StringUtils;
import org.rocrate.encryption.exception.MalformedEnvelopeException;
import org.rocrate.encryption.graph.Entity;
import org.rocrate.encryption.graph.EntityKind;
import org.rocrate.encryption.keys.KeyIdentity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notBlank;
import static org.apache.commons.lang3.Validate.notEmpty;

/**
 * An encrypted graph message: one ciphertext holding the properties of every member of a
 * {@link RecipientGroup}, addressed to the group's keys.
 */
public final class EnvelopeRecord {

    public static final String SEND_ACTION = "SendAction";
    public static final String MESSAGE_TYPE = "EncryptedGraphMessage";
    public static final String OPENPGP_DELIVERY_METHOD = "https://doi.org/10.17487/RFC4880";

    public static final String ACTION_STATUS = "actionStatus";
    public static final String POTENTIAL_ACTION_STATUS = "PotentialActionStatus";
    public static final String DELIVERY_METHOD = "deliveryMethod";
    public static final String RECIPIENTS = "recipients";
    public static final String ENCRYPTED_GRAPH = "encryptedGraph";

    private final String id;
    private final String actionType;
    private final String ciphertext;
    private final List<KeyIdentity> recipients;
    private final String deliveryMethod;

    private EnvelopeRecord(Builder b) {
        notBlank(b.ciphertext, "ciphertext is required");
        notEmpty(b.recipients, "At least one recipient is required");

        this.id = StringUtils.isBlank(b.id) ? "#" + UUID.randomUUID() : b.id;
        this.actionType = StringUtils.isBlank(b.actionType) ? SEND_ACTION : b.actionType;
        this.ciphertext = b.ciphertext;
        this.recipients = Collections.unmodifiableList(new ArrayList<>(b.recipients));
        this.deliveryMethod = b.deliveryMethod;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getActionType() {
        return actionType;
    }

    /**
     * The ASCII-armored ciphertext.
     */
    public String getCiphertext() {
        return ciphertext;
    }

    /**
     * The keys this envelope was encrypted for, in fingerprint order.
     */
    public List<KeyIdentity> getRecipients() {
        return recipients;
    }

    public String getDeliveryMethod() {
        return deliveryMethod;
    }

    /**
     * The envelope as a graph entity. Each recipient is referenced by the id of its
     * {@link RecipientDescriptor}.
     */
    public Entity toEntity() {
        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(Entity.TYPE, Arrays.asList(actionType, MESSAGE_TYPE));
        properties.put(ACTION_STATUS, POTENTIAL_ACTION_STATUS);
        properties.put(DELIVERY_METHOD, deliveryMethod);
        final List<Object> references = new ArrayList<>();
        for (KeyIdentity recipient : recipients) {
            final Map<String, Object> reference = Entity.reference(recipient.getPrimaryIdentity());
            if (!references.contains(reference)) {
                references.add(reference);
            }
        }
        properties.put(RECIPIENTS, references);
        properties.put(ENCRYPTED_GRAPH, ciphertext);
        return Entity.of(EntityKind.ENVELOPE, id, properties);
    }

    /**
     * Reads the ciphertext of an envelope entity.
     *
     * @throws MalformedEnvelopeException if the entity is not an envelope or holds no ciphertext.
     */
    public static String ciphertextOf(final Entity envelope) {
        requireNonNull(envelope, "envelope is required");
        if (envelope.getKind() != EntityKind.ENVELOPE) {
            throw new MalformedEnvelopeException(String.format("Entity %s is not an envelope", envelope.getId()));
        }
        final Object ciphertext = envelope.get(ENCRYPTED_GRAPH);
        if (!(ciphertext instanceof String) || StringUtils.isBlank((String) ciphertext)) {
            throw new MalformedEnvelopeException(String.format(
                    "Envelope %s has no %s ciphertext", envelope.getId(), ENCRYPTED_GRAPH));
        }
        return (String) ciphertext;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnvelopeRecord that = (EnvelopeRecord) o;
        return id.equals(that.id) &&
                actionType.equals(that.actionType) &&
                ciphertext.equals(that.ciphertext) &&
                recipients.equals(that.recipients) &&
                Objects.equals(deliveryMethod, that.deliveryMethod);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, actionType, ciphertext, recipients, deliveryMethod);
    }

    public static class Builder {
        private String id;
        private String actionType = SEND_ACTION;
        private String ciphertext;
        private List<KeyIdentity> recipients = new ArrayList<>();
        private String deliveryMethod = OPENPGP_DELIVERY_METHOD;

        private Builder() {
        }

        /**
         * Sets an explicit id. When none is set a fresh {@code "#" + UUID} is used.
         */
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder actionType(String actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder ciphertext(String ciphertext) {
            this.ciphertext = ciphertext;
            return this;
        }

        public Builder recipients(List<KeyIdentity> recipients) {
            requireNonNull(recipients, "recipients are required");
            this.recipients = new ArrayList<>(recipients);
            return this;
        }

        public Builder deliveryMethod(String deliveryMethod) {
            notBlank(deliveryMethod, "deliveryMethod is required");
            this.deliveryMethod = deliveryMethod;
            return this;
        }

        public EnvelopeRecord build() {
            return new EnvelopeRecord(this);
        }
    }
}

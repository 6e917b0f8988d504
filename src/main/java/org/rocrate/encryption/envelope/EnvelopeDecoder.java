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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.rocrate.encryption.exception.BackendFailureException;
import org.rocrate.encryption.exception.MalformedEnvelopeException;
import org.rocrate.encryption.graph.CrateGraph;
import org.rocrate.encryption.graph.Entity;
import org.rocrate.encryption.graph.EntityKind;
import org.rocrate.encryption.keys.CryptoBackend;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static java.util.Objects.requireNonNull;

/**
 * Opens the envelopes of a graph with the locally available private keys and puts the recovered
 * sensitive entities back into the graph.
 * <p>
 * An envelope that cannot be decrypted is not addressed to any local key: it is left in the graph
 * untouched and produces no entity and no error.
 */
public class EnvelopeDecoder {

    private static final Logger LOGGER = Logger.getLogger(EnvelopeDecoder.class.getName());
    private static final TypeReference<List<Object>> FRAGMENT_TYPE = new TypeReference<List<Object>>() {};

    private final CryptoBackend backend;
    private final ObjectMapper mapper = new ObjectMapper();

    public EnvelopeDecoder(final CryptoBackend backend) {
        this.backend = requireNonNull(backend, "backend is required");
    }

    /**
     * Decodes every envelope of the graph that a local key can open. Opened envelopes are removed
     * from the graph along with their links from recipient descriptors.
     *
     * @param graph The graph to decode in place.
     * @return The recovered sensitive entities, in envelope order.
     * @throws MalformedEnvelopeException if an envelope, or the fragment it decrypts to, is malformed.
     */
    public List<Entity> decode(final CrateGraph graph) {
        requireNonNull(graph, "graph is required");

        final List<Entity> decoded = new ArrayList<>();
        for (Entity envelope : graph.getEntities(EntityKind.ENVELOPE)) {
            final String ciphertext = EnvelopeRecord.ciphertextOf(envelope);
            final byte[] plaintext;
            try {
                plaintext = backend.decrypt(ciphertext);
            } catch (BackendFailureException e) {
                LOGGER.fine("Could not open envelope " + envelope.getId() + " due to: " + e.getMessage());
                continue;
            }

            final List<Entity> members = parseFragment(envelope.getId(), plaintext);
            members.forEach(graph::put);
            graph.remove(envelope.getId());
            detachRecipients(graph, envelope.getId());
            decoded.addAll(members);
        }
        return decoded;
    }

    List<Entity> parseFragment(final String envelopeId, final byte[] plaintext) {
        final List<Object> fragment;
        try {
            fragment = mapper.readValue(plaintext, FRAGMENT_TYPE);
        } catch (IOException e) {
            throw new MalformedEnvelopeException("Envelope " + envelopeId + " does not hold a JSON graph fragment", e);
        }
        final List<Entity> members = new ArrayList<>();
        for (Object item : fragment) {
            if (!(item instanceof Map) || !(((Map<?, ?>) item).get(Entity.ID) instanceof String)) {
                throw new MalformedEnvelopeException("Envelope " + envelopeId + " holds an unidentified entity: " + item);
            }
            @SuppressWarnings("unchecked")
            final Map<String, Object> jsonLd = (Map<String, Object>) item;
            members.add(Entity.fromJsonLd(EntityKind.SENSITIVE, jsonLd));
        }
        return members;
    }

    private static void detachRecipients(final CrateGraph graph, final String envelopeId) {
        for (Entity recipient : graph.getEntities(EntityKind.RECIPIENT)) {
            final Object actions = recipient.get(RecipientDescriptor.ACTION);
            if (!(actions instanceof List)) {
                continue;
            }
            final List<Object> remaining = new ArrayList<>();
            for (Object action : (List<?>) actions) {
                if (!envelopeId.equals(Entity.referenceId(action))) {
                    remaining.add(action);
                }
            }
            if (remaining.size() == ((List<?>) actions).size()) {
                continue;
            }
            if (remaining.isEmpty()) {
                graph.remove(recipient.getId());
            } else {
                recipient.put(RecipientDescriptor.ACTION, remaining);
            }
        }
    }
}

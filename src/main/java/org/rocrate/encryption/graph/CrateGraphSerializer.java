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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.rocrate.encryption.exception.MalformedEnvelopeException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Converts a {@link CrateGraph} to and from its JSON-LD document form.
 * <p>
 * Plain entities and recipient audiences go in {@code "@graph"}; envelopes go in the reserved
 * top-level {@code "@encrypted"} list. Sensitive entities are never written: a graph has to be
 * sealed before it can be serialized.
 */
public class CrateGraphSerializer {

    public static final String CONTEXT = "@context";
    public static final String GRAPH = "@graph";
    public static final String ENCRYPTED = "@encrypted";
    public static final String AUDIENCE_TYPE = "Audience";
    public static final String ENCRYPTED_MESSAGE_TYPE = "EncryptedGraphMessage";

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<Map<String, Object>>() {};

    private final ObjectMapper mapper;

    public CrateGraphSerializer() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public CrateGraphSerializer(final ObjectMapper mapper) {
        this.mapper = requireNonNull(mapper, "mapper is required");
    }

    /**
     * Builds the JSON-LD document of a sealed graph.
     *
     * @throws IllegalStateException if the graph still holds sensitive entities.
     */
    public Map<String, Object> toDocument(final CrateGraph graph) {
        requireNonNull(graph, "graph is required");
        final List<Object> plain = new ArrayList<>();
        final List<Object> encrypted = new ArrayList<>();
        for (Entity entity : graph.getEntities()) {
            switch (entity.getKind()) {
                case SENSITIVE:
                    throw new IllegalStateException(String.format(
                            "Entity %s is sensitive; seal the graph before writing it", entity.getId()));
                case ENVELOPE:
                    encrypted.add(entity.toJsonLd());
                    break;
                default:
                    plain.add(entity.toJsonLd());
            }
        }
        final Map<String, Object> document = new LinkedHashMap<>();
        document.put(CONTEXT, graph.getContext());
        document.put(GRAPH, plain);
        if (!encrypted.isEmpty()) {
            document.put(ENCRYPTED, encrypted);
        }
        return document;
    }

    /**
     * Rebuilds a graph from a JSON-LD document.
     *
     * @throws IllegalArgumentException    if the document has no {@code @context} or {@code @graph},
     *                                     or a {@code @graph} entry is not an identified object.
     * @throws MalformedEnvelopeException if an {@code @encrypted} entry is not an identified object.
     */
    public CrateGraph fromDocument(final Map<String, Object> document) {
        requireNonNull(document, "document is required");
        if (!document.containsKey(CONTEXT) || !(document.get(GRAPH) instanceof List)) {
            throw new IllegalArgumentException("Crate metadata must have a @context and a @graph");
        }
        final CrateGraph graph = new CrateGraph(document.get(CONTEXT));
        for (Object item : (List<?>) document.get(GRAPH)) {
            final Map<String, Object> jsonLd = asObject(item);
            if (jsonLd == null) {
                throw new IllegalArgumentException("@graph entry is not an object: " + item);
            }
            graph.put(Entity.fromJsonLd(kindOf(jsonLd), jsonLd));
        }
        final Object encrypted = document.get(ENCRYPTED);
        if (encrypted == null) {
            return graph;
        }
        if (!(encrypted instanceof List)) {
            throw new MalformedEnvelopeException("@encrypted must be a list of envelopes");
        }
        for (Object item : (List<?>) encrypted) {
            final Map<String, Object> jsonLd = asObject(item);
            if (jsonLd == null || !(jsonLd.get(Entity.ID) instanceof String)) {
                throw new MalformedEnvelopeException("@encrypted entry is not an identified object: " + item);
            }
            graph.put(Entity.fromJsonLd(EntityKind.ENVELOPE, jsonLd));
        }
        return graph;
    }

    public String write(final CrateGraph graph) {
        try {
            return mapper.writeValueAsString(toDocument(graph));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public void write(final CrateGraph graph, final OutputStream out) throws IOException {
        mapper.writeValue(out, toDocument(graph));
    }

    public void write(final CrateGraph graph, final Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            write(graph, out);
        }
    }

    public CrateGraph read(final String json) {
        try {
            return fromDocument(mapper.readValue(json, DOCUMENT_TYPE));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a JSON crate metadata document", e);
        }
    }

    public CrateGraph read(final InputStream in) throws IOException {
        return fromDocument(mapper.readValue(in, DOCUMENT_TYPE));
    }

    public CrateGraph read(final Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    // envelopes written inline in @graph are accepted as well
    private static EntityKind kindOf(final Map<String, Object> jsonLd) {
        final List<String> types = Entity.stringValues(jsonLd.get(Entity.TYPE));
        if (types.contains(ENCRYPTED_MESSAGE_TYPE)) {
            return EntityKind.ENVELOPE;
        }
        return types.contains(AUDIENCE_TYPE) ? EntityKind.RECIPIENT : EntityKind.PLAIN;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(final Object item) {
        return item instanceof Map ? (Map<String, Object>) item : null;
    }
}

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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rocrate.encryption.exception.BackendFailureException;
import org.rocrate.encryption.exception.MalformedEnvelopeException;
import org.rocrate.encryption.graph.CrateGraph;
import org.rocrate.encryption.graph.Entity;
import org.rocrate.encryption.graph.EntityKind;
import org.rocrate.encryption.keys.CryptoBackend;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.singletonList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnvelopeDecoderTest {

    @Mock CryptoBackend backend;

    private CrateGraph graph;

    @BeforeEach
    void setup() {
        graph = new CrateGraph();
        graph.put(Entity.plain("./", null));
        graph.put(envelope("#for-alice", "ciphertext-1"));
        graph.put(envelope("#for-both", "ciphertext-2"));
        graph.put(descriptor("Alice", "#for-alice", "#for-both"));
        graph.put(descriptor("Bob", "#for-both"));
    }

    private static Entity envelope(final String id, final Object ciphertext) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(Entity.TYPE, Arrays.asList(EnvelopeRecord.SEND_ACTION, EnvelopeRecord.MESSAGE_TYPE));
        if (ciphertext != null) {
            properties.put(EnvelopeRecord.ENCRYPTED_GRAPH, ciphertext);
        }
        return Entity.of(EntityKind.ENVELOPE, id, properties);
    }

    private static Entity descriptor(final String id, final String... envelopeIds) {
        final Entity descriptor = Entity.of(EntityKind.RECIPIENT, id, null);
        for (String envelopeId : envelopeIds) {
            descriptor.appendTo(RecipientDescriptor.ACTION, Entity.reference(envelopeId));
        }
        return descriptor;
    }

    private static byte[] json(final String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testDecodeSkipsForeignEnvelopes() {
        when(backend.decrypt("ciphertext-1")).thenThrow(new BackendFailureException("no secret key"));
        when(backend.decrypt("ciphertext-2")).thenReturn(json("[{\"@id\": \"#secret\", \"name\": \"hidden\"}]"));

        List<Entity> decoded = new EnvelopeDecoder(backend).decode(graph);

        assertEquals(1, decoded.size());
        Entity secret = graph.dereference("#secret");
        assertEquals(decoded.get(0), secret);
        assertEquals(EntityKind.SENSITIVE, secret.getKind());
        assertEquals("hidden", secret.get("name"));

        assertTrue(graph.contains("#for-alice"));
        assertFalse(graph.contains("#for-both"));
        assertEquals(Collections.singletonList(Entity.reference("#for-alice")),
                graph.dereference("Alice").get(RecipientDescriptor.ACTION));
        assertFalse(graph.contains("Bob"));
    }

    @Test
    void testDecodedEntitiesReplaceExisting() {
        graph.put(Entity.plain("#secret", Collections.singletonMap("name", "stale")));
        when(backend.decrypt("ciphertext-1")).thenReturn(json("[{\"@id\": \"#secret\", \"name\": \"fresh\"}, {\"@id\": \"#other\"}]"));
        when(backend.decrypt("ciphertext-2")).thenReturn(json("[]"));

        List<Entity> decoded = new EnvelopeDecoder(backend).decode(graph);

        assertEquals(2, decoded.size());
        assertEquals("fresh", graph.dereference("#secret").get("name"));
        assertTrue(graph.getEntities(EntityKind.ENVELOPE).isEmpty());
        assertTrue(graph.getEntities(EntityKind.RECIPIENT).isEmpty());
    }

    @Test
    void testNothingDecryptable() {
        when(backend.decrypt("ciphertext-1")).thenThrow(new BackendFailureException("no secret key"));
        when(backend.decrypt("ciphertext-2")).thenThrow(new BackendFailureException("no secret key"));

        assertTrue(new EnvelopeDecoder(backend).decode(graph).isEmpty());
        assertEquals(5, graph.size());
    }

    @Test
    void testEnvelopeWithoutCiphertext() {
        CrateGraph broken = new CrateGraph();
        broken.put(envelope("#broken", null));

        assertThrows(MalformedEnvelopeException.class, () -> new EnvelopeDecoder(backend).decode(broken));
        verifyNoInteractions(backend);
    }

    @Test
    void testEnvelopeWithNonStringCiphertext() {
        CrateGraph broken = new CrateGraph();
        broken.put(envelope("#broken", Collections.singletonList("ciphertext")));

        assertThrows(MalformedEnvelopeException.class, () -> new EnvelopeDecoder(backend).decode(broken));
        verifyNoInteractions(backend);
    }

    @Test
    void testFragmentKeepsNumericValues() throws Exception {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("age", 42L);
        properties.put("size", 3_000_000_000L);
        properties.put("score", 0.75f);
        Entity member = Entity.sensitive("#person", properties);
        byte[] fragment = new ObjectMapper().writeValueAsBytes(singletonList(member.toJsonLd()));

        List<Entity> parsed = new EnvelopeDecoder(backend).parseFragment("#e", fragment);

        assertEquals(singletonList(member), parsed);
    }

    @Test
    void testMalformedFragment() {
        EnvelopeDecoder decoder = new EnvelopeDecoder(backend);

        assertThrows(MalformedEnvelopeException.class, () -> decoder.parseFragment("#e", json("not json")));
        assertThrows(MalformedEnvelopeException.class, () -> decoder.parseFragment("#e", json("{\"@id\": \"#object\"}")));
        assertThrows(MalformedEnvelopeException.class, () -> decoder.parseFragment("#e", json("[{\"name\": \"no id\"}]")));
        assertThrows(MalformedEnvelopeException.class, () -> decoder.parseFragment("#e", json("[\"#string\"]")));
    }
}

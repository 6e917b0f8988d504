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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rocrate.encryption.exception.BackendFailureException;
import org.rocrate.encryption.graph.Entity;
import org.rocrate.encryption.keys.CryptoBackend;
import org.rocrate.encryption.keys.KeyIdentity;
import org.rocrate.encryption.keys.KeyImportResult;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EnvelopeEncoderTest {

    private static final String A = "AAAA000000000000000000000000000000000000";
    private static final String B = "BBBB000000000000000000000000000000000000";
    private static final String KEYSERVER = "https://keys.example.org";
    private static final KeyIdentity ALICE = new KeyIdentity("1", A,
            Arrays.asList("Alice Tester <alice@example.org>", "Alice Work <alice@work.example>"));
    private static final KeyIdentity BOB = new KeyIdentity("1", B, Collections.singletonList("Bob Tester <bob@example.org>"));

    @Mock CryptoBackend backend;

    private static RecipientGroup group(final List<String> fingerprints, final Entity... members) {
        return new RecipientGroup(new TreeSet<>(fingerprints), Arrays.asList(members));
    }

    private static Entity member(final String id, final String name) {
        return Entity.sensitive(id, Collections.singletonMap("name", name));
    }

    @Test
    void testOneEnvelopePerGroup() {
        RecipientGroup first = group(Collections.singletonList(A), member("#one", "first"), member("#two", "second"));
        RecipientGroup second = group(Arrays.asList(A, B), member("#three", "third"));
        when(backend.listLocalKeys()).thenReturn(Collections.singletonMap(A, ALICE));
        when(backend.encrypt(any(byte[].class), eq(first.getFingerprints()))).thenReturn("ciphertext-1");
        when(backend.encrypt(any(byte[].class), eq(second.getFingerprints()))).thenReturn("ciphertext-2");

        EncodeResult result = new EnvelopeEncoder(backend).encode(Arrays.asList(first, second));

        assertEquals(2, result.getEnvelopes().size());
        EnvelopeRecord firstEnvelope = result.getEnvelopes().get(0);
        EnvelopeRecord secondEnvelope = result.getEnvelopes().get(1);
        assertEquals("ciphertext-1", firstEnvelope.getCiphertext());
        assertEquals(Collections.singletonList(ALICE), firstEnvelope.getRecipients());
        assertEquals(Arrays.asList(ALICE, KeyIdentity.bare(B)), secondEnvelope.getRecipients());
        verify(backend, times(1)).listLocalKeys();

        assertEquals(2, result.getRecipients().size());
        RecipientDescriptor alice = result.getRecipients().get(0);
        assertEquals(ALICE.getPrimaryIdentity(), alice.getId());
        assertEquals(Arrays.asList(firstEnvelope.getId(), secondEnvelope.getId()), alice.getEnvelopeIds());
        RecipientDescriptor bob = result.getRecipients().get(1);
        assertEquals(B, bob.getId());
        assertEquals(Collections.singletonList(secondEnvelope.getId()), bob.getEnvelopeIds());
    }

    @Test
    void testPlaintextIsMemberArray() throws Exception {
        RecipientGroup group = group(Collections.singletonList(A), member("#one", "first"), member("#two", "second"));
        when(backend.listLocalKeys()).thenReturn(Collections.emptyMap());
        ArgumentCaptor<byte[]> plaintext = ArgumentCaptor.forClass(byte[].class);
        when(backend.encrypt(plaintext.capture(), eq(group.getFingerprints()))).thenReturn("ciphertext");

        new EnvelopeEncoder(backend).encode(Collections.singletonList(group));

        List<Map<String, Object>> fragment = new ObjectMapper()
                .readValue(plaintext.getValue(), new TypeReference<List<Map<String, Object>>>() {});
        assertEquals(2, fragment.size());
        assertEquals("#one", fragment.get(0).get(Entity.ID));
        assertEquals("second", fragment.get(1).get("name"));
    }

    @Test
    void testBackendFailurePropagates() {
        RecipientGroup group = group(Collections.singletonList(A), member("#one", "first"));
        when(backend.listLocalKeys()).thenReturn(Collections.emptyMap());
        when(backend.encrypt(any(byte[].class), eq(group.getFingerprints())))
                .thenThrow(new BackendFailureException("INV_RECP"));

        BackendFailureException ex = assertThrows(BackendFailureException.class,
                () -> new EnvelopeEncoder(backend).encode(Collections.singletonList(group)));
        assertEquals("INV_RECP", ex.getStatus());
    }

    @Test
    void testEmptyInputSkipsBackend() {
        EncodeResult result = new EnvelopeEncoder(backend).encode(Collections.emptyList());

        assertTrue(result.getEnvelopes().isEmpty());
        assertTrue(result.getRecipients().isEmpty());
        verifyNoInteractions(backend);
    }

    @Test
    void testUnknownKeysAreFetchedFromKeyserver() {
        RecipientGroup group = group(Collections.singletonList(B), member("#one", "first"));
        when(backend.listLocalKeys()).thenReturn(Collections.emptyMap(), Collections.singletonMap(B, BOB));
        when(backend.fetchKeys(KEYSERVER, Collections.singletonList(B)))
                .thenReturn(new KeyImportResult(Collections.singletonList(B), Collections.emptyList()));
        when(backend.encrypt(any(byte[].class), eq(group.getFingerprints()))).thenReturn("ciphertext");

        EncodeResult result = new EnvelopeEncoder(backend, KEYSERVER).encode(Collections.singletonList(group));

        assertEquals(BOB.getPrimaryIdentity(), result.getRecipients().get(0).getId());
        InOrder inOrder = inOrder(backend);
        inOrder.verify(backend).listLocalKeys();
        inOrder.verify(backend).fetchKeys(KEYSERVER, Collections.singletonList(B));
        inOrder.verify(backend).listLocalKeys();
        inOrder.verify(backend).encrypt(any(byte[].class), eq(group.getFingerprints()));
    }

    @Test
    void testKeyserverFailureIsNotFatal() {
        RecipientGroup group = group(Collections.singletonList(B), member("#one", "first"));
        when(backend.listLocalKeys()).thenReturn(Collections.emptyMap());
        when(backend.fetchKeys(KEYSERVER, Collections.singletonList(B))).thenThrow(new IllegalStateException("offline"));
        when(backend.encrypt(any(byte[].class), eq(group.getFingerprints()))).thenReturn("ciphertext");

        EncodeResult result = new EnvelopeEncoder(backend, KEYSERVER).encode(Collections.singletonList(group));

        assertEquals(Collections.singletonList(KeyIdentity.bare(B)), result.getEnvelopes().get(0).getRecipients());
        verify(backend, times(1)).listLocalKeys();
    }

    @Test
    void testKnownKeysSkipKeyserver() {
        RecipientGroup group = group(Collections.singletonList(A), member("#one", "first"));
        when(backend.listLocalKeys()).thenReturn(Collections.singletonMap(A, ALICE));
        when(backend.encrypt(any(byte[].class), eq(group.getFingerprints()))).thenReturn("ciphertext");

        new EnvelopeEncoder(backend, KEYSERVER).encode(Collections.singletonList(group));

        verify(backend, times(0)).fetchKeys(any(), any());
    }

    @Test
    void testDescriptorEntity() {
        RecipientGroup group = group(Collections.singletonList(A), member("#one", "first"));
        when(backend.listLocalKeys()).thenReturn(Collections.singletonMap(A, ALICE));
        when(backend.encrypt(any(byte[].class), eq(group.getFingerprints()))).thenReturn("ciphertext");

        EncodeResult result = new EnvelopeEncoder(backend).encode(Collections.singletonList(group));
        Entity descriptor = result.getRecipients().get(0).toEntity();

        assertEquals(RecipientDescriptor.AUDIENCE, descriptor.get(Entity.TYPE));
        assertEquals(RecipientDescriptor.ENCRYPTED_MESSAGE_RECIPIENTS, descriptor.get(RecipientDescriptor.AUDIENCE_TYPE));
        assertEquals("Alice Tester", descriptor.get("name"));
        assertEquals("alice@example.org", descriptor.get("email"));
        assertEquals(Collections.singletonList(A), descriptor.getFingerprints());
        assertEquals(Collections.singletonList("Alice Work <alice@work.example>"), descriptor.get(RecipientDescriptor.IDENTIFIER));
        assertEquals(Collections.singletonList(Entity.reference(result.getEnvelopes().get(0).getId())),
                descriptor.get(RecipientDescriptor.ACTION));
    }
}

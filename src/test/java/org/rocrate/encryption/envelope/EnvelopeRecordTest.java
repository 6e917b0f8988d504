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

import org.junit.jupiter.api.Test;
import org.rocrate.encryption.exception.MalformedEnvelopeException;
import org.rocrate.encryption.graph.Entity;
import org.rocrate.encryption.graph.EntityKind;
import org.rocrate.encryption.keys.KeyIdentity;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeRecordTest {

    private static final String A = "AAAA000000000000000000000000000000000000";
    private static final String B = "BBBB000000000000000000000000000000000000";
    private static final KeyIdentity JOE = new KeyIdentity("1", A, Collections.singletonList("Joe Tester <joe@foo.bar>"));
    // second key of the same person
    private static final KeyIdentity JOE_AGAIN = new KeyIdentity("1", B, Collections.singletonList("Joe Tester <joe@foo.bar>"));

    @Test
    void testDefaults() {
        EnvelopeRecord first = EnvelopeRecord.builder().ciphertext("ciphertext").recipients(Collections.singletonList(JOE)).build();
        EnvelopeRecord second = EnvelopeRecord.builder().ciphertext("ciphertext").recipients(Collections.singletonList(JOE)).build();

        assertTrue(first.getId().startsWith("#"));
        assertNotEquals(first.getId(), second.getId());
        assertEquals(EnvelopeRecord.SEND_ACTION, first.getActionType());
        assertEquals(EnvelopeRecord.OPENPGP_DELIVERY_METHOD, first.getDeliveryMethod());
    }

    @Test
    void testToEntity() {
        Entity entity = EnvelopeRecord.builder()
                .id("#envelope")
                .ciphertext("ciphertext")
                .recipients(Arrays.asList(JOE, JOE_AGAIN))
                .build()
                .toEntity();

        assertEquals(EntityKind.ENVELOPE, entity.getKind());
        assertEquals("#envelope", entity.getId());
        assertEquals(Arrays.asList(EnvelopeRecord.SEND_ACTION, EnvelopeRecord.MESSAGE_TYPE), entity.getTypes());
        assertEquals(EnvelopeRecord.POTENTIAL_ACTION_STATUS, entity.get(EnvelopeRecord.ACTION_STATUS));
        assertEquals("https://doi.org/10.17487/RFC4880", entity.get(EnvelopeRecord.DELIVERY_METHOD));
        assertEquals(Collections.singletonList(Entity.reference("Joe Tester <joe@foo.bar>")), entity.get(EnvelopeRecord.RECIPIENTS));
        assertEquals("ciphertext", EnvelopeRecord.ciphertextOf(entity));
    }

    @Test
    void testBuilderValidation() {
        assertThrows(NullPointerException.class,
                () -> EnvelopeRecord.builder().recipients(Collections.singletonList(JOE)).build());
        assertThrows(IllegalArgumentException.class,
                () -> EnvelopeRecord.builder().ciphertext("ciphertext").build());
        assertThrows(IllegalArgumentException.class, () -> EnvelopeRecord.builder().deliveryMethod(""));
    }

    @Test
    void testCiphertextOfRejectsOtherEntities() {
        Entity plain = Entity.plain("#plain", Collections.singletonMap(EnvelopeRecord.ENCRYPTED_GRAPH, "ciphertext"));
        Entity blank = Entity.of(EntityKind.ENVELOPE, "#blank", Collections.singletonMap(EnvelopeRecord.ENCRYPTED_GRAPH, " "));

        assertThrows(MalformedEnvelopeException.class, () -> EnvelopeRecord.ciphertextOf(plain));
        assertThrows(MalformedEnvelopeException.class, () -> EnvelopeRecord.ciphertextOf(blank));
    }

    @Test
    void testDescriptorMergesKeysOfOneIdentity() {
        RecipientDescriptor descriptor = new RecipientDescriptor(JOE.getPrimaryIdentity());
        descriptor.addEnvelope(JOE, "#first");
        descriptor.addEnvelope(JOE_AGAIN, "#first");
        descriptor.addEnvelope(JOE, "#second");

        Entity entity = descriptor.toEntity();

        assertEquals(Arrays.asList(A, B), entity.getFingerprints());
        assertEquals(Arrays.asList(Entity.reference("#first"), Entity.reference("#second")), entity.get(RecipientDescriptor.ACTION));
        assertEquals("Joe Tester", entity.get("name"));
        assertEquals(EntityKind.RECIPIENT, entity.getKind());
    }

    @Test
    void testDescriptorOfBareKey() {
        RecipientDescriptor descriptor = new RecipientDescriptor(A);
        descriptor.addEnvelope(KeyIdentity.bare(A), "#first");

        Entity entity = descriptor.toEntity();

        assertEquals(A, entity.getId());
        assertTrue(!entity.has("name") && !entity.has("email") && !entity.has(RecipientDescriptor.IDENTIFIER));
    }
}

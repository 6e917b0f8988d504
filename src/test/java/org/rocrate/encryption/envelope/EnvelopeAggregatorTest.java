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
import org.rocrate.encryption.exception.NoValidKeysException;
import org.rocrate.encryption.graph.CrateGraph;
import org.rocrate.encryption.graph.Entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeAggregatorTest {

    private static final String A = "AAAA000000000000000000000000000000000000";
    private static final String B = "BBBB000000000000000000000000000000000000";

    private final EnvelopeAggregator aggregator = new EnvelopeAggregator(new RecipientResolver(new CrateGraph()), false);

    private static Entity sensitive(final String id, final String... fingerprints) {
        return Entity.sensitive(id, null).addFingerprints(Arrays.asList(fingerprints));
    }

    @Test
    void testPartitionsBySetEqualFingerprints() {
        Entity first = sensitive("#first", A);
        Entity shared = sensitive("#shared", A, B);
        Entity third = sensitive("#third", A);
        Entity reversed = sensitive("#reversed", B, A);

        List<RecipientGroup> groups = aggregator.aggregate(Arrays.asList(first, shared, third, reversed));

        assertEquals(2, groups.size());
        assertEquals(new TreeSet<>(Collections.singleton(A)), groups.get(0).getFingerprints());
        assertEquals(Arrays.asList(first, third), groups.get(0).getMembers());
        assertEquals(new TreeSet<>(Arrays.asList(A, B)), groups.get(1).getFingerprints());
        assertEquals(Arrays.asList(shared, reversed), groups.get(1).getMembers());
    }

    @Test
    void testEmptyInput() {
        assertTrue(aggregator.aggregate(Collections.emptyList()).isEmpty());
    }

    @Test
    void testOnlySensitiveEntities() {
        Entity plain = Entity.plain("#plain", null).addFingerprint(A);

        assertThrows(IllegalArgumentException.class, () -> aggregator.aggregate(Collections.singletonList(plain)));
    }

    @Test
    void testResolutionFailureAborts() {
        List<Entity> entities = Arrays.asList(sensitive("#ok", A), Entity.sensitive("#unkeyed", null));

        assertThrows(NoValidKeysException.class, () -> aggregator.aggregate(entities));
    }

    @Test
    void testGroupRequiresFingerprints() {
        assertThrows(IllegalArgumentException.class, () -> new RecipientGroup(new TreeSet<>()));
    }
}

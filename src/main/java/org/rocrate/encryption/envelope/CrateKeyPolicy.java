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

import java.util.Set;
import java.util.SortedSet;

/**
 * Governs how crate-wide default fingerprints combine with the fingerprints resolved for an
 * individual sensitive entity.
 */
public enum CrateKeyPolicy {
    /**
     * Crate-wide fingerprints are added to every sensitive entity's recipients.
     */
    UNION,
    /**
     * Crate-wide fingerprints are used only for entities whose own resolution found no keys.
     */
    FALLBACK;

    /**
     * Adds the crate-wide fingerprints to the resolved set as this policy requires.
     *
     * @param resolved          The fingerprints resolved for the entity; modified in place.
     * @param crateFingerprints The crate-wide default fingerprints.
     */
    public void apply(SortedSet<String> resolved, Set<String> crateFingerprints) {
        switch (this) {
            case UNION:
                resolved.addAll(crateFingerprints);
                break;
            case FALLBACK:
                if (resolved.isEmpty()) {
                    resolved.addAll(crateFingerprints);
                }
                break;
            default:
                throw new UnsupportedOperationException("Support for crate key policy " + this + " not yet built.");
        }
    }
}

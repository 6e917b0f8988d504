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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The outcome of a key server fetch: the fingerprints that were imported, and a warning for each
 * key that could not be.
 */
public final class KeyImportResult {

    private final List<String> fingerprints;
    private final List<KeyserverWarning> warnings;

    public KeyImportResult(final List<String> fingerprints, final List<KeyserverWarning> warnings) {
        this.fingerprints = Collections.unmodifiableList(new ArrayList<>(fingerprints));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public List<String> getFingerprints() {
        return fingerprints;
    }

    public List<KeyserverWarning> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}

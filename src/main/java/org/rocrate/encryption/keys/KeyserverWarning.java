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

import java.util.Objects;
import java.util.logging.Logger;

/**
 * A non-fatal problem reported while fetching a key from a key server.
 */
public final class KeyserverWarning {

    private static final Logger LOGGER = Logger.getLogger(KeyserverWarning.class.getName());

    private final String fingerprint;
    private final String message;

    public KeyserverWarning(final String fingerprint, final String message) {
        this.fingerprint = fingerprint;
        this.message = message;
    }

    /**
     * Creates a warning and logs it at {@code WARNING} level.
     */
    public static KeyserverWarning report(final String fingerprint, final String message) {
        final KeyserverWarning warning = new KeyserverWarning(fingerprint, message);
        LOGGER.warning(warning.toString());
        return warning;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyserverWarning that = (KeyserverWarning) o;
        return Objects.equals(fingerprint, that.fingerprint) &&
                Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprint, message);
    }

    @Override
    public String toString() {
        return String.format("invalid response from keyserver for key %s: %s", fingerprint, message);
    }
}

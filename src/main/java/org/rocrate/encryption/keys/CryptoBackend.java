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

import org.rocrate.encryption.exception.BackendFailureException;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * The asymmetric cryptography the envelope subsystem relies on. Implementations hold the local
 * key store; the subsystem never handles key material itself.
 */
public interface CryptoBackend {

    /**
     * Encrypts the plaintext once for all of the given recipients.
     *
     * @param plaintext             The bytes to encrypt.
     * @param recipientFingerprints Fingerprints of the public keys to encrypt for.
     * @return The ASCII-armored ciphertext.
     * @throws BackendFailureException if a recipient key is unknown or unusable, or encryption fails.
     */
    String encrypt(byte[] plaintext, Set<String> recipientFingerprints);

    /**
     * Decrypts an ASCII-armored ciphertext with whichever local private key it was addressed to.
     *
     * @param ciphertext The ASCII-armored ciphertext.
     * @return The plaintext bytes.
     * @throws BackendFailureException if no usable private key is available locally or the
     *                                 ciphertext cannot be processed.
     */
    byte[] decrypt(String ciphertext);

    /**
     * Lists the public keys known locally, keyed by fingerprint.
     */
    Map<String, KeyIdentity> listLocalKeys();

    /**
     * Imports public keys from a key server. Problems with individual keys are reported as
     * warnings on the result rather than thrown.
     *
     * @param keyserverUrl The base URL of the key server.
     * @param fingerprints The fingerprints to fetch.
     * @return The fingerprints imported and any warnings.
     */
    KeyImportResult fetchKeys(String keyserverUrl, Collection<String> fingerprints);
}

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

package org.rocrate.encryption.exception;

/**
 * This exception is thrown when recipient resolution for a sensitive entity ends with no
 * public key fingerprints at all.
 */
public class NoValidKeysException extends CrateEncryptionException {

    private static final long serialVersionUID = -1L;

    private final String entityId;

    public NoValidKeysException(final String entityId) {
        super(String.format("No recipient of %s has a valid public key for encryption", entityId));
        this.entityId = entityId;
    }

    public String getEntityId() {
        return entityId;
    }
}

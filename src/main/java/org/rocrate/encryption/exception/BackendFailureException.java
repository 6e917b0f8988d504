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
 * This exception is thrown when the cryptography backend refuses to encrypt or is unable to
 * decrypt a message. The {@code status} carries the backend's own description of the failure.
 */
public class BackendFailureException extends CrateEncryptionException {

    private static final long serialVersionUID = -1L;

    private final String status;

    public BackendFailureException(final String status) {
        super(status);
        this.status = status;
    }

    public BackendFailureException(final String status, final Throwable cause) {
        super(status, cause);
        this.status = status;
    }

    public String getStatus() {
        return status;
    }
}

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
 * This exception is thrown when an envelope record, or the graph fragment recovered from it,
 * does not have the expected structure.
 */
public class MalformedEnvelopeException extends CrateEncryptionException {

    private static final long serialVersionUID = -1L;

    public MalformedEnvelopeException() {
        super();
    }

    public MalformedEnvelopeException(final String message) {
        super(message);
    }

    public MalformedEnvelopeException(final Throwable cause) {
        super(cause);
    }

    public MalformedEnvelopeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}

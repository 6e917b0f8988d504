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

package org.rocrate.encryption.graph;

/**
 * Enum representing the kinds of entity a crate graph holds. The encryption
 * subsystem dispatches on the kind rather than on the entity's class.
 */
public enum EntityKind {

    /**
     * An ordinary entity, written to the document in plaintext.
     */
    PLAIN,

    /**
     * An entity whose properties must only be readable by its recipients.
     * It never appears in a written document in plaintext.
     */
    SENSITIVE,

    /**
     * An encrypted message holding the aggregated properties of one or more
     * sensitive entities.
     */
    ENVELOPE,

    /**
     * An audience entity describing one recipient key of one or more envelopes.
     */
    RECIPIENT
}

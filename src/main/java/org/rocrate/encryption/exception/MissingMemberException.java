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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * This exception is thrown when at least one declared recipient of a sensitive entity cannot be
 * found or carries no key, and missing members are not tolerated.
 */
public class MissingMemberException extends CrateEncryptionException {

    private static final long serialVersionUID = -1L;

    private final String entityId;
    private final List<String> missingMembers;

    public MissingMemberException(final String entityId, final List<String> missingMembers) {
        super(String.format("At least one recipient of %s lacks a valid key. Missing recipients %s",
                entityId, missingMembers));
        this.entityId = entityId;
        this.missingMembers = Collections.unmodifiableList(new ArrayList<>(missingMembers));
    }

    public String getEntityId() {
        return entityId;
    }

    public List<String> getMissingMembers() {
        return missingMembers;
    }
}

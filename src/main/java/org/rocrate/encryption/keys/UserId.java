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

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import java.util.Objects;

/**
 * A key identity string split into a display name and a contact address.
 */
public final class UserId {

    private final String displayName;
    private final String contactAddress;

    public UserId(final String displayName, final String contactAddress) {
        this.displayName = Objects.requireNonNull(displayName, "displayName is required");
        this.contactAddress = Objects.requireNonNull(contactAddress, "contactAddress is required");
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getContactAddress() {
        return contactAddress;
    }

    /**
     * Returns false when the identity string held no usable email address, in which case
     * {@link #getContactAddress()} is {@link KeyIdentity#NO_VALID_CONTACT}.
     */
    public boolean hasValidContact() {
        return !KeyIdentity.NO_VALID_CONTACT.equals(contactAddress);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UserId that = (UserId) o;
        return displayName.equals(that.displayName) &&
                contactAddress.equals(that.contactAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(displayName, contactAddress);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("displayName", displayName)
                .append("contactAddress", contactAddress)
                .toString();
    }
}

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

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Public key metadata as it is written into a crate: the key algorithm, its fingerprint and the
 * raw identity strings ("uids") it was published with.
 */
public final class KeyIdentity {

    /**
     * Contact address given to identity strings that hold no valid email address.
     */
    public static final String NO_VALID_CONTACT = "No Valid Email";
    public static final String UNKNOWN_ALGORITHM = "unknown";

    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9_.+-]+@[a-zA-Z0-9-]+\\.[a-zA-Z0-9-.]+$");
    private static final String ADDRESS_DELIMITERS = "<> ";

    private final String algorithm;
    private final String fingerprint;
    private final List<String> identities;

    public KeyIdentity(final String algorithm, final String fingerprint, final List<String> identities) {
        notBlank(fingerprint, "fingerprint is required");

        this.algorithm = StringUtils.isBlank(algorithm) ? UNKNOWN_ALGORITHM : algorithm;
        this.fingerprint = fingerprint;
        this.identities = identities == null ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(identities));
    }

    /**
     * A key known only by its fingerprint.
     */
    public static KeyIdentity bare(final String fingerprint) {
        return new KeyIdentity(UNKNOWN_ALGORITHM, fingerprint, Collections.emptyList());
    }

    /**
     * Splits a raw identity string such as {@code "Joe Tester <joe@foo.bar>"} into a display name
     * and a contact address. When the last token is not a valid email address the whole string
     * becomes the display name and the address is {@link #NO_VALID_CONTACT}. Never fails.
     *
     * @param raw The identity string.
     * @return The parsed identity.
     */
    public static UserId parseIdentity(final String raw) {
        final String uid = raw == null ? "" : raw;
        final String[] sections = uid.trim().split("\\s+");
        final String name;
        final String address;
        if (sections.length > 1) {
            address = StringUtils.strip(sections[sections.length - 1], ADDRESS_DELIMITERS);
            name = String.join(" ", Arrays.asList(sections).subList(0, sections.length - 1)).trim();
        } else {
            name = StringUtils.strip(uid, ADDRESS_DELIMITERS);
            address = name;
        }
        if (!EMAIL.matcher(address).matches()) {
            return new UserId(uid, NO_VALID_CONTACT);
        }
        return new UserId(name, address);
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public List<String> getIdentities() {
        return identities;
    }

    /**
     * The first identity string, or the fingerprint when the key has none. Recipients are merged on it.
     */
    public String getPrimaryIdentity() {
        if (identities.isEmpty() || StringUtils.isBlank(identities.get(0))) {
            return fingerprint;
        }
        return identities.get(0);
    }

    public List<String> getSecondaryIdentities() {
        return identities.size() < 2 ? Collections.emptyList() : identities.subList(1, identities.size());
    }

    public List<UserId> getUserIds() {
        final List<UserId> userIds = new ArrayList<>();
        for (String identity : identities) {
            userIds.add(parseIdentity(identity));
        }
        return userIds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KeyIdentity that = (KeyIdentity) o;
        return algorithm.equals(that.algorithm) &&
                fingerprint.equals(that.fingerprint) &&
                identities.equals(that.identities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, fingerprint, identities);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("algorithm", algorithm)
                .append("fingerprint", fingerprint)
                .append("identities", identities)
                .toString();
    }
}

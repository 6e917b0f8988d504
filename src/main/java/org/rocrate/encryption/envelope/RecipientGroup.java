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

package org.rocrate.encryption.envelope;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;
import org.rocrate.encryption.graph.Entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.notEmpty;

/**
 * Sensitive entities that share one resolved recipient set and so are encrypted together.
 */
public final class RecipientGroup {

    private final SortedSet<String> fingerprints;
    private final List<Entity> members = new ArrayList<>();

    public RecipientGroup(final SortedSet<String> fingerprints) {
        notEmpty(fingerprints, "At least one fingerprint is required");
        this.fingerprints = Collections.unmodifiableSortedSet(new TreeSet<>(fingerprints));
    }

    public RecipientGroup(final SortedSet<String> fingerprints, final List<Entity> members) {
        this(fingerprints);
        requireNonNull(members, "members are required");
        members.forEach(this::add);
    }

    void add(final Entity member) {
        requireNonNull(member, "member is required");
        members.add(member);
    }

    public SortedSet<String> getFingerprints() {
        return fingerprints;
    }

    public List<Entity> getMembers() {
        return Collections.unmodifiableList(members);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecipientGroup that = (RecipientGroup) o;
        return fingerprints.equals(that.fingerprints) &&
                members.equals(that.members);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fingerprints, members);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("fingerprints", fingerprints)
                .append("members", members.size())
                .toString();
    }
}

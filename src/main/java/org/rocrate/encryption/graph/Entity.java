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

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.util.Objects.requireNonNull;
import static org.apache.commons.lang3.Validate.isTrue;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * An identified node of a crate graph holding an ordered bag of JSON-LD properties.
 * <p>
 * Property values are plain JSON values: {@code String}, {@code Number}, {@code Boolean},
 * {@code List} and {@code Map}. A map with a single {@code "@id"} entry is a reference
 * to another entity. Numbers are stored the way a JSON reader returns them: integers as the
 * narrowest of {@code Integer}, {@code Long} and {@code BigInteger}, and {@code Float} as
 * {@code Double}. The keys {@link #RECIPIENTS} and {@link #PUBKEY_FINGERPRINTS} are
 * inspected by the encryption subsystem; all other properties are carried opaquely.
 */
public final class Entity {

    public static final String ID = "@id";
    public static final String TYPE = "@type";
    public static final String RECIPIENTS = "recipients";
    public static final String PUBKEY_FINGERPRINTS = "pubkey_fingerprints";

    private final EntityKind kind;
    private final String id;
    private final Map<String, Object> properties;

    private Entity(final EntityKind kind, final String id, final Map<String, Object> properties) {
        requireNonNull(kind, "kind is required");
        notBlank(id, "id is required");

        this.kind = kind;
        this.id = id;
        this.properties = new LinkedHashMap<>();
        if (properties != null) {
            properties.forEach((name, value) -> {
                if (!ID.equals(name)) {
                    this.properties.put(name, copyValue(value));
                }
            });
        }
    }

    public static Entity of(final EntityKind kind, final String id, final Map<String, Object> properties) {
        return new Entity(kind, id, properties);
    }

    public static Entity plain(final String id, final Map<String, Object> properties) {
        return new Entity(EntityKind.PLAIN, id, properties);
    }

    public static Entity sensitive(final String id, final Map<String, Object> properties) {
        return new Entity(EntityKind.SENSITIVE, id, properties);
    }

    /**
     * Rebuilds an entity from its JSON-LD form. The {@code "@id"} entry is required.
     *
     * @param kind   The kind to give the entity.
     * @param jsonLd The JSON-LD object.
     * @return The entity.
     * @throws IllegalArgumentException if the object carries no string {@code "@id"}.
     */
    public static Entity fromJsonLd(final EntityKind kind, final Map<String, Object> jsonLd) {
        requireNonNull(jsonLd, "jsonLd is required");
        final Object id = jsonLd.get(ID);
        isTrue(id instanceof String, "JSON-LD entity has no @id: %s", jsonLd);
        return new Entity(kind, (String) id, jsonLd);
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public boolean isSensitive() {
        return kind == EntityKind.SENSITIVE;
    }

    /**
     * Returns a copy of this entity with the same id and properties and the given kind.
     */
    public Entity withKind(final EntityKind newKind) {
        return new Entity(newKind, id, properties);
    }

    public Entity copy() {
        return withKind(kind);
    }

    /**
     * An unmodifiable view of the properties, not including {@code "@id"}.
     */
    public Map<String, Object> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public Object get(final String name) {
        return properties.get(name);
    }

    public boolean has(final String name) {
        return properties.containsKey(name);
    }

    public Entity put(final String name, final Object value) {
        notBlank(name, "name is required");
        isTrue(!ID.equals(name), "The @id of an entity cannot be changed");
        properties.put(name, toValue(value));
        return this;
    }

    public Object remove(final String name) {
        return properties.remove(name);
    }

    /**
     * Appends a value to a multi-valued property. A single existing value is turned into a list
     * first. An {@link Entity} is appended as a reference to its id.
     *
     * @param name  The property name.
     * @param value The value to append.
     * @return This entity.
     */
    public Entity appendTo(final String name, final Object value) {
        notBlank(name, "name is required");
        requireNonNull(value, "value is required");
        final Object current = properties.get(name);
        final List<Object> values = new ArrayList<>();
        if (current instanceof List) {
            values.addAll((List<?>) current);
        } else if (current != null) {
            values.add(current);
        }
        values.add(toValue(value));
        properties.put(name, values);
        return this;
    }

    /**
     * The {@code "@type"} values of this entity, in order.
     */
    public List<String> getTypes() {
        return stringValues(properties.get(TYPE));
    }

    public boolean hasType(final String type) {
        return getTypes().contains(type);
    }

    /**
     * The public key fingerprints attached directly to this entity, without duplicates.
     */
    public List<String> getFingerprints() {
        return new ArrayList<>(new LinkedHashSet<>(stringValues(properties.get(PUBKEY_FINGERPRINTS))));
    }

    /**
     * Attaches one or more public key fingerprints to this entity, keeping them unique.
     */
    public Entity addFingerprints(final Collection<String> fingerprints) {
        requireNonNull(fingerprints, "fingerprints are required");
        final Set<String> merged = new LinkedHashSet<>(getFingerprints());
        for (String fingerprint : fingerprints) {
            notBlank(fingerprint, "fingerprint must not be blank");
            merged.add(fingerprint);
        }
        properties.put(PUBKEY_FINGERPRINTS, new ArrayList<Object>(merged));
        return this;
    }

    public Entity addFingerprint(final String fingerprint) {
        return addFingerprints(Collections.singletonList(fingerprint));
    }

    /**
     * The ids referenced by the {@code recipients} property, in order. Both references and bare
     * id strings are accepted.
     */
    public List<String> getRecipientIds() {
        final List<String> ids = new ArrayList<>();
        for (Object value : asList(properties.get(RECIPIENTS))) {
            final String ref = referenceId(value);
            if (ref != null) {
                ids.add(ref);
            }
        }
        return ids;
    }

    /**
     * Returns this entity as a JSON-LD object with {@code "@id"} first. The result is a deep copy.
     */
    public Map<String, Object> toJsonLd() {
        final Map<String, Object> jsonLd = new LinkedHashMap<>();
        jsonLd.put(ID, id);
        properties.forEach((name, value) -> jsonLd.put(name, copyValue(value)));
        return jsonLd;
    }

    /**
     * Returns a JSON-LD reference to the given id.
     */
    public static Map<String, Object> reference(final String id) {
        notBlank(id, "id is required");
        final Map<String, Object> ref = new LinkedHashMap<>();
        ref.put(ID, id);
        return ref;
    }

    /**
     * Returns the id a value refers to: the value itself when it is a string, the {@code "@id"}
     * of a reference object, or {@code null} otherwise.
     */
    public static String referenceId(final Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Map) {
            final Object ref = ((Map<?, ?>) value).get(ID);
            return ref instanceof String ? (String) ref : null;
        }
        return null;
    }

    /**
     * Reads a property value that may be a single string or a list of strings.
     */
    public static List<String> stringValues(final Object value) {
        final List<String> strings = new ArrayList<>();
        for (Object item : asList(value)) {
            if (item instanceof String && !((String) item).isEmpty()) {
                strings.add((String) item);
            }
        }
        return strings;
    }

    private static List<?> asList(final Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof List) {
            return (List<?>) value;
        }
        return Collections.singletonList(value);
    }

    private static Object toValue(final Object value) {
        if (value instanceof Entity) {
            return reference(((Entity) value).getId());
        }
        return copyValue(value);
    }

    private static Object copyValue(final Object value) {
        if (value instanceof Map) {
            final Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(String.valueOf(k), copyValue(v)));
            return copy;
        }
        if (value instanceof Collection) {
            final List<Object> copy = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                copy.add(toValue(item));
            }
            return copy;
        }
        if (value instanceof Entity) {
            return reference(((Entity) value).getId());
        }
        if (value instanceof Number) {
            return normalizeNumber((Number) value);
        }
        return value;
    }

    private static Number normalizeNumber(final Number number) {
        if (number instanceof Byte || number instanceof Short || number instanceof Integer || number instanceof Long) {
            return narrow(number.longValue());
        }
        if (number instanceof BigInteger) {
            final BigInteger big = (BigInteger) number;
            return big.bitLength() < Long.SIZE ? narrow(big.longValue()) : big;
        }
        if (number instanceof Float) {
            return Double.valueOf(number.toString());
        }
        return number;
    }

    private static Number narrow(final long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return (int) value;
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity that = (Entity) o;
        return kind == that.kind &&
                Objects.equals(id, that.id) &&
                Objects.equals(properties, that.properties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, properties);
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE)
                .append("kind", kind)
                .append("id", id)
                .append("properties", properties)
                .toString();
    }
}

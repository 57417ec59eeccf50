package io.etadata.core.schema;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.etadata.core.attributes.Attribute;
import io.etadata.core.attributes.AttributeType;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/// The constraints observed for one attribute name.
///
/// ## Payloads
///
/// The payload depends on the schema's [AttributeType]:
///
/// | Type | Payload | Valid values |
/// |------|---------|--------------|
/// | categorical | set of categories | members of the set |
/// | numeric | optional `[min, max]` range | values inside the range; none while unset |
/// | boolean | none | any boolean |
///
/// ## Growth
///
/// A schema starts empty (or from stored data) and only grows: [#addAttribute]
/// folds one observed value in and [#mergeSchema] folds another schema in.
/// Categories and ranges are never narrowed.
///
/// ```java
/// AttributeSchema speed = AttributeSchema.numeric("speed");
/// speed.addAttribute(Attribute.numeric("speed", 3.0));
/// speed.addAttribute(Attribute.numeric("speed", 7.0));
/// speed.isValidValue(5.0);   // true
/// speed.isValidValue(8.0);   // false
/// ```
public final class AttributeSchema {

    private final AttributeType type;
    private final String name;
    private final String uuid;
    private final Set<String> categories;
    private NumericRange range;

    private AttributeSchema(AttributeType type, String name, String uuid,
                            Collection<String> categories, NumericRange range) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.uuid = uuid != null ? uuid : UUID.randomUUID().toString();
        this.categories = type == AttributeType.CATEGORICAL ? new LinkedHashSet<>() : null;
        if (categories != null && !categories.isEmpty()) {
            if (type != AttributeType.CATEGORICAL) {
                throw new IllegalArgumentException("Only categorical schemas hold categories, not " + type.discriminator());
            }
            this.categories.addAll(categories);
        }
        if (range != null && type != AttributeType.NUMERIC) {
            throw new IllegalArgumentException("Only numeric schemas hold a range, not " + type.discriminator());
        }
        this.range = range;
    }

    /// Creates an empty schema of the given type.
    ///
    /// @param type the attribute variant the schema describes
    /// @param name the attribute name
    /// @return a schema with a fresh UUID and an empty payload
    public static AttributeSchema forType(AttributeType type, String name) {
        return new AttributeSchema(type, name, null, null, null);
    }

    public static AttributeSchema categorical(String name) {
        return forType(AttributeType.CATEGORICAL, name);
    }

    public static AttributeSchema categorical(String name, String uuid, Collection<String> categories) {
        return new AttributeSchema(AttributeType.CATEGORICAL, name, uuid, categories, null);
    }

    public static AttributeSchema numeric(String name) {
        return forType(AttributeType.NUMERIC, name);
    }

    public static AttributeSchema numeric(String name, String uuid, NumericRange range) {
        return new AttributeSchema(AttributeType.NUMERIC, name, uuid, null, range);
    }

    public static AttributeSchema bool(String name) {
        return forType(AttributeType.BOOLEAN, name);
    }

    public static AttributeSchema bool(String name, String uuid) {
        return new AttributeSchema(AttributeType.BOOLEAN, name, uuid, null, null);
    }

    /// Creates a schema from stored parts. Payload parts that do not belong to
    /// the type must be null or empty.
    ///
    /// @param type the attribute variant
    /// @param name the attribute name
    /// @param uuid the stored identifier, or null to generate one
    /// @param categories the stored categories, or null
    /// @param range the stored range, or null
    /// @return the restored schema
    public static AttributeSchema restore(AttributeType type, String name, String uuid,
                                          Collection<String> categories, NumericRange range) {
        return new AttributeSchema(type, name, uuid, categories, range);
    }

    /// @return the attribute variant this schema describes
    public AttributeType getAttributeType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getUuid() {
        return uuid;
    }

    /// @return the categories of a categorical schema, empty for other types
    public Set<String> getCategories() {
        return categories == null ? Collections.emptySet() : Collections.unmodifiableSet(categories);
    }

    /// @return the range of a numeric schema, empty while unset or for other types
    public Optional<NumericRange> getRange() {
        return Optional.ofNullable(range);
    }

    /// Checks that an attribute has the variant this schema describes.
    ///
    /// @param attr the attribute
    /// @throws TypeMismatchException if the variants differ
    public void validateType(Attribute attr) {
        if (attr.type() != type) {
            throw new TypeMismatchException(
                "Expected attribute '" + attr.name() + "' to have type '" + type.discriminator()
                    + "'; found '" + attr.type().discriminator() + "'");
        }
    }

    /// @param value a candidate value
    /// @return whether the value is allowed by this schema
    public boolean isValidValue(Object value) {
        return switch (type) {
            case CATEGORICAL -> value instanceof String && categories.contains(value);
            case NUMERIC -> range != null && value instanceof Number
                && range.contains(((Number) value).doubleValue());
            case BOOLEAN -> value instanceof Boolean;
        };
    }

    /// Incorporates an observed attribute into this schema.
    ///
    /// @param attr an attribute of this schema's type
    /// @throws TypeMismatchException if the attribute has another type
    public void addAttribute(Attribute attr) {
        validateType(attr);
        switch (type) {
            case CATEGORICAL -> categories.add(attr.categoricalValue());
            case NUMERIC -> range = range == null
                ? NumericRange.of(attr.numericValue())
                : range.including(attr.numericValue());
            case BOOLEAN -> {
                // nothing to record
            }
        }
    }

    /// Incorporates another schema of the same type into this schema.
    ///
    /// @param other the schema to merge in
    /// @throws TypeMismatchException if the other schema has another type
    public void mergeSchema(AttributeSchema other) {
        if (other.type != type) {
            throw new TypeMismatchException(
                "Cannot merge " + other.type.discriminator() + " schema '" + other.name
                    + "' into " + type.discriminator() + " schema '" + name + "'");
        }
        switch (type) {
            case CATEGORICAL -> categories.addAll(other.categories);
            case NUMERIC -> {
                if (range == null) {
                    range = other.range;
                } else if (other.range != null) {
                    range = range.union(other.range);
                }
            }
            case BOOLEAN -> {
                // nothing to merge
            }
        }
    }

    /// @return an independent schema with the same identity and payload
    public AttributeSchema copy() {
        return new AttributeSchema(type, name, uuid, categories, range);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        AttributeSchema that = (AttributeSchema) obj;
        return type == that.type
            && name.equals(that.name)
            && uuid.equals(that.uuid)
            && Objects.equals(categories, that.categories)
            && Objects.equals(range, that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, uuid, categories, range);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("AttributeSchema{type=").append(type.discriminator())
            .append(", name='").append(name).append('\'');
        if (categories != null) {
            sb.append(", categories=").append(categories);
        }
        if (range != null) {
            sb.append(", range=[").append(range.min()).append(", ").append(range.max()).append(']');
        }
        return sb.append('}').toString();
    }
}

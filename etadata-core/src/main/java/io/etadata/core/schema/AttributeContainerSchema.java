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

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// A schema for an attribute container: one [AttributeSchema] per attribute name.
///
/// The type of each entry is fixed by the first attribute observed under its
/// name. Later attributes with the same name but another type are rejected
/// with [TypeMismatchException].
///
/// Batch operations ([#addAttributes], [#mergeSchema]) check for type
/// conflicts before changing anything, so a failed call leaves the schema as
/// it was.
public class AttributeContainerSchema {

    private final Map<String, AttributeSchema> schema = new LinkedHashMap<>();

    public AttributeContainerSchema() {
    }

    /// @param schemas the entries, keyed by attribute name
    /// @throws IllegalArgumentException if a key differs from its entry's name
    public AttributeContainerSchema(Map<String, AttributeSchema> schemas) {
        for (Map.Entry<String, AttributeSchema> entry : schemas.entrySet()) {
            if (!entry.getKey().equals(entry.getValue().getName())) {
                throw new IllegalArgumentException(
                    "Schema key '" + entry.getKey() + "' does not match schema name '" + entry.getValue().getName() + "'");
            }
            schema.put(entry.getKey(), entry.getValue());
        }
    }

    /// Builds the schema describing the given attributes.
    ///
    /// @param attrs the attributes to describe
    /// @return a new schema that validates every given attribute
    /// @throws TypeMismatchException if one name is used with two types
    public static AttributeContainerSchema buildActiveSchema(Iterable<Attribute> attrs) {
        return new AttributeContainerSchema().addAttributes(attrs);
    }

    public boolean hasAttribute(String name) {
        return schema.containsKey(name);
    }

    /// @param name an attribute name
    /// @return the type declared for the name
    /// @throws NameNotFoundException if the schema has no entry for the name
    public AttributeType getAttributeType(String name) {
        return getAttributeSchema(name).getAttributeType();
    }

    /// @param name an attribute name
    /// @return the entry for the name
    /// @throws NameNotFoundException if the schema has no entry for the name
    public AttributeSchema getAttributeSchema(String name) {
        AttributeSchema attrSchema = schema.get(name);
        if (attrSchema == null) {
            throw new NameNotFoundException("Attribute '" + name + "' is not allowed by the schema");
        }
        return attrSchema;
    }

    /// @return the attribute names, in the order they were first seen
    public Set<String> names() {
        return Collections.unmodifiableSet(schema.keySet());
    }

    /// @return a read-only view of the entries
    public Map<String, AttributeSchema> entries() {
        return Collections.unmodifiableMap(schema);
    }

    public int size() {
        return schema.size();
    }

    public boolean isEmpty() {
        return schema.isEmpty();
    }

    /// Incorporates an attribute, creating its entry on first sight.
    ///
    /// @param attr the attribute
    /// @throws TypeMismatchException if the name is already declared with another type
    public void addAttribute(Attribute attr) {
        AttributeSchema existing = schema.get(attr.name());
        if (existing == null) {
            AttributeSchema created = AttributeSchema.forType(attr.type(), attr.name());
            created.addAttribute(attr);
            schema.put(attr.name(), created);
        } else {
            existing.addAttribute(attr);
        }
    }

    /// Incorporates every given attribute.
    ///
    /// @param attrs the attributes
    /// @return this schema
    /// @throws TypeMismatchException if a name is used with two types, either
    ///     among the attributes or against an existing entry; nothing is added then
    public AttributeContainerSchema addAttributes(Iterable<Attribute> attrs) {
        Map<String, AttributeType> declared = new HashMap<>();
        schema.forEach((name, entry) -> declared.put(name, entry.getAttributeType()));
        for (Attribute attr : attrs) {
            AttributeType seen = declared.putIfAbsent(attr.name(), attr.type());
            if (seen != null && seen != attr.type()) {
                throw new TypeMismatchException(
                    "Expected attribute '" + attr.name() + "' to have type '" + seen.discriminator()
                        + "'; found '" + attr.type().discriminator() + "'");
            }
        }
        for (Attribute attr : attrs) {
            addAttribute(attr);
        }
        return this;
    }

    /// Merges another container schema into this one. Names unknown here are
    /// copied in; shared names are merged entry by entry.
    ///
    /// @param other the schema to merge in
    /// @throws TypeMismatchException if a shared name has different types; nothing is merged then
    public void mergeSchema(AttributeContainerSchema other) {
        for (Map.Entry<String, AttributeSchema> entry : other.schema.entrySet()) {
            AttributeSchema mine = schema.get(entry.getKey());
            if (mine != null && mine.getAttributeType() != entry.getValue().getAttributeType()) {
                throw new TypeMismatchException(
                    "Cannot merge " + entry.getValue().getAttributeType().discriminator() + " schema for '"
                        + entry.getKey() + "' into " + mine.getAttributeType().discriminator() + " schema");
            }
        }
        for (Map.Entry<String, AttributeSchema> entry : other.schema.entrySet()) {
            AttributeSchema mine = schema.get(entry.getKey());
            if (mine == null) {
                schema.put(entry.getKey(), entry.getValue().copy());
            } else {
                mine.mergeSchema(entry.getValue());
            }
        }
    }

    /// Checks that an attribute complies with this schema.
    ///
    /// @param attr the attribute
    /// @throws NameNotFoundException if the name has no entry
    /// @throws TypeMismatchException if the entry declares another type
    /// @throws ValueNotAllowedException if the entry does not allow the value
    public void validateAttribute(Attribute attr) {
        AttributeSchema attrSchema = getAttributeSchema(attr.name());
        attrSchema.validateType(attr);
        if (!attrSchema.isValidValue(attr.value())) {
            throw new ValueNotAllowedException(
                "Value '" + attr.value() + "' of attribute '" + attr.name() + "' is not allowed by the schema");
        }
    }

    /// @param attr the attribute
    /// @return whether [#validateAttribute] would accept it
    public boolean isValid(Attribute attr) {
        AttributeSchema attrSchema = schema.get(attr.name());
        return attrSchema != null
            && attrSchema.getAttributeType() == attr.type()
            && attrSchema.isValidValue(attr.value());
    }

    /// @return an independent deep copy of this schema
    public AttributeContainerSchema copy() {
        AttributeContainerSchema copy = new AttributeContainerSchema();
        schema.forEach((name, entry) -> copy.schema.put(name, entry.copy()));
        return copy;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        return schema.equals(((AttributeContainerSchema) obj).schema);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema);
    }

    @Override
    public String toString() {
        return "AttributeContainerSchema" + schema.values();
    }
}

package io.etadata.core.attributes;

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

import java.util.Objects;
import java.util.Optional;

/// A named, typed value with an optional confidence.
///
/// ## Construction
///
/// The raw value is parsed by the attribute's [AttributeType] when the
/// attribute is created, so the stored value always has the type's value
/// class:
///
/// ```java
/// Attribute color = Attribute.categorical("color", "red");
/// Attribute speed = Attribute.numeric("speed", "12.5", 0.9);   // stored as 12.5d
/// Attribute moving = Attribute.bool("moving", "yes");          // stored as true
/// ```
///
/// ## Immutability
///
/// Attributes never change after construction; use [#withValue] or
/// [#withConfidence] to derive a replacement.
///
/// ## Serialized form
///
/// ```json
/// {"type": "numeric", "name": "speed", "value": 12.5, "confidence": 0.9}
/// ```
///
/// The `confidence` field is omitted when no confidence was given. Its range
/// is not checked here.
public final class Attribute {

    private final AttributeType type;
    private final String name;
    private final Object value;
    private final Double confidence;

    /// Creates an attribute, parsing the raw value for the given type.
    ///
    /// @param type the attribute variant
    /// @param name the attribute name
    /// @param rawValue the value to parse
    /// @param confidence the confidence of the value, or null for none
    /// @throws ValueParseException if the value cannot be parsed for the type
    public Attribute(AttributeType type, String name, Object rawValue, Double confidence) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.value = type.parseValue(rawValue);
        this.confidence = confidence;
    }

    public Attribute(AttributeType type, String name, Object rawValue) {
        this(type, name, rawValue, null);
    }

    public static Attribute categorical(String name, Object value) {
        return new Attribute(AttributeType.CATEGORICAL, name, value);
    }

    public static Attribute categorical(String name, Object value, double confidence) {
        return new Attribute(AttributeType.CATEGORICAL, name, value, confidence);
    }

    public static Attribute numeric(String name, Object value) {
        return new Attribute(AttributeType.NUMERIC, name, value);
    }

    public static Attribute numeric(String name, Object value, double confidence) {
        return new Attribute(AttributeType.NUMERIC, name, value, confidence);
    }

    public static Attribute bool(String name, Object value) {
        return new Attribute(AttributeType.BOOLEAN, name, value);
    }

    public static Attribute bool(String name, Object value, double confidence) {
        return new Attribute(AttributeType.BOOLEAN, name, value, confidence);
    }

    public AttributeType type() {
        return type;
    }

    public String name() {
        return name;
    }

    /// @return the parsed value; a [String], [Double] or [Boolean] according to [#type()]
    public Object value() {
        return value;
    }

    public Optional<Double> confidence() {
        return Optional.ofNullable(confidence);
    }

    public boolean hasConfidence() {
        return confidence != null;
    }

    /// @return the value of a categorical attribute
    /// @throws IllegalStateException if this attribute is not categorical
    public String categoricalValue() {
        return typedValue(AttributeType.CATEGORICAL, String.class);
    }

    /// @return the value of a numeric attribute
    /// @throws IllegalStateException if this attribute is not numeric
    public double numericValue() {
        return typedValue(AttributeType.NUMERIC, Double.class);
    }

    /// @return the value of a boolean attribute
    /// @throws IllegalStateException if this attribute is not boolean
    public boolean booleanValue() {
        return typedValue(AttributeType.BOOLEAN, Boolean.class);
    }

    /// @param rawValue the replacement value, parsed for this attribute's type
    /// @return a new attribute with the same type, name and confidence
    public Attribute withValue(Object rawValue) {
        return new Attribute(type, name, rawValue, confidence);
    }

    /// @param confidence the replacement confidence, or null to drop it
    /// @return a new attribute with the same type, name and value
    public Attribute withConfidence(Double confidence) {
        return new Attribute(type, name, value, confidence);
    }

    private <T> T typedValue(AttributeType expected, Class<T> valueClass) {
        if (type != expected) {
            throw new IllegalStateException(
                "Attribute '" + name + "' is " + type.discriminator() + ", not " + expected.discriminator());
        }
        return valueClass.cast(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Attribute that = (Attribute) obj;
        return type == that.type
            && name.equals(that.name)
            && value.equals(that.value)
            && Objects.equals(confidence, that.confidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, value, confidence);
    }

    @Override
    public String toString() {
        return "Attribute{type=" + type.discriminator() + ", name='" + name + "', value=" + value
            + (confidence != null ? ", confidence=" + confidence : "") + '}';
    }
}

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

import java.util.Locale;

/// The closed set of attribute variants.
///
/// Each constant owns the coercion of raw values into its value type, so an
/// [Attribute] can never hold a value whose runtime type disagrees with its
/// declared type.
///
/// | Type | Value type | Discriminator |
/// |------|------------|---------------|
/// | [#CATEGORICAL] | [String] | `categorical` |
/// | [#NUMERIC] | [Double] | `numeric` |
/// | [#BOOLEAN] | [Boolean] | `boolean` |
///
/// Discriminators are resolved back into types through [AttributeTypeRegistry].
public enum AttributeType {

    /// A label drawn from a set of categories. Raw values are kept in string form.
    CATEGORICAL(String.class),

    /// A 64-bit floating point measurement.
    NUMERIC(Double.class),

    /// A flag.
    BOOLEAN(Boolean.class);

    private final Class<?> valueClass;

    AttributeType(Class<?> valueClass) {
        this.valueClass = valueClass;
    }

    /// @return the runtime class of values held by attributes of this type
    public Class<?> valueClass() {
        return valueClass;
    }

    /// @return the string stored in the `type` field of serialized attributes and schemas
    public String discriminator() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Coerces a raw value into this type's value type.
    ///
    /// - categorical: any non-null value, stored in its string form
    /// - numeric: numbers, booleans (as 1 or 0), or strings holding a decimal
    ///   number; NaN is rejected
    /// - boolean: booleans; numbers are true when non-zero; the strings
    ///   `true`, `false`, `yes`, `no`, `1` and `0` in any case
    ///
    /// @param rawValue the value to coerce
    /// @return the parsed value, an instance of [#valueClass()]
    /// @throws ValueParseException if the value cannot be coerced
    public Object parseValue(Object rawValue) {
        if (rawValue == null) {
            throw new ValueParseException(this, null);
        }
        return switch (this) {
            case CATEGORICAL -> rawValue instanceof String ? rawValue : String.valueOf(rawValue);
            case NUMERIC -> parseNumeric(rawValue);
            case BOOLEAN -> parseBoolean(rawValue);
        };
    }

    /// @param value a candidate value
    /// @return whether the value already has this type's value type
    public boolean accepts(Object value) {
        return valueClass.isInstance(value);
    }

    private Double parseNumeric(Object rawValue) {
        if (rawValue instanceof Number) {
            return requireComparable(((Number) rawValue).doubleValue(), rawValue);
        }
        if (rawValue instanceof Boolean) {
            return ((Boolean) rawValue) ? 1.0d : 0.0d;
        }
        if (rawValue instanceof CharSequence) {
            double parsed;
            try {
                parsed = Double.parseDouble(rawValue.toString().trim());
            } catch (NumberFormatException e) {
                throw new ValueParseException(this, rawValue, e);
            }
            return requireComparable(parsed, rawValue);
        }
        throw new ValueParseException(this, rawValue);
    }

    // NaN has no place in a numeric range
    private Double requireComparable(double value, Object rawValue) {
        if (Double.isNaN(value)) {
            throw new ValueParseException(this, rawValue);
        }
        return value;
    }

    private Boolean parseBoolean(Object rawValue) {
        if (rawValue instanceof Boolean) {
            return (Boolean) rawValue;
        }
        if (rawValue instanceof Number) {
            return ((Number) rawValue).doubleValue() != 0.0d;
        }
        if (rawValue instanceof CharSequence) {
            switch (rawValue.toString().trim().toLowerCase(Locale.ROOT)) {
                case "true":
                case "yes":
                case "1":
                    return Boolean.TRUE;
                case "false":
                case "no":
                case "0":
                    return Boolean.FALSE;
                default:
                    break;
            }
        }
        throw new ValueParseException(this, rawValue);
    }
}

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

/// An inclusive `[min, max]` interval of numeric attribute values.
///
/// @param min the smallest allowed value
/// @param max the largest allowed value
public record NumericRange(double min, double max) {

    public NumericRange {
        if (Double.isNaN(min) || Double.isNaN(max)) {
            throw new IllegalArgumentException("Range bounds cannot be NaN");
        }
        if (min > max) {
            throw new IllegalArgumentException("Range minimum " + min + " exceeds maximum " + max);
        }
    }

    /// @param value a single value
    /// @return the degenerate range `[value, value]`
    public static NumericRange of(double value) {
        return new NumericRange(value, value);
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /// @param value a value to cover
    /// @return the smallest range covering this range and the value
    public NumericRange including(double value) {
        return contains(value) ? this : new NumericRange(Math.min(min, value), Math.max(max, value));
    }

    /// @param other another range
    /// @return the convex hull of both ranges
    public NumericRange union(NumericRange other) {
        return new NumericRange(Math.min(min, other.min), Math.max(max, other.max));
    }
}

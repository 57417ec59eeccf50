package io.etadata.core.records;

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

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/// A record field that is either absent or present with a value, where the
/// value itself may be null.
///
/// Unlike [java.util.Optional], "present with null" is a valid state distinct
/// from "absent".
///
/// @param <T> the value type
public final class OptionalField<T> {

    private static final OptionalField<?> ABSENT = new OptionalField<>(false, null);

    private final boolean present;
    private final T value;

    private OptionalField(boolean present, T value) {
        this.present = present;
        this.value = value;
    }

    @SuppressWarnings("unchecked")
    public static <T> OptionalField<T> absent() {
        return (OptionalField<T>) ABSENT;
    }

    /// @param value the value, possibly null
    /// @return a present field
    public static <T> OptionalField<T> of(T value) {
        return new OptionalField<>(true, value);
    }

    public boolean isPresent() {
        return present;
    }

    public boolean isAbsent() {
        return !present;
    }

    /// @return the value, possibly null
    /// @throws NoSuchElementException if the field is absent
    public T get() {
        if (!present) {
            throw new NoSuchElementException("Field is absent");
        }
        return value;
    }

    public T orElse(T other) {
        return present ? value : other;
    }

    public <U> OptionalField<U> map(Function<? super T, ? extends U> mapper) {
        return present ? of(mapper.apply(value)) : absent();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        OptionalField<?> that = (OptionalField<?>) obj;
        return present == that.present && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, value);
    }

    @Override
    public String toString() {
        return present ? "OptionalField[" + value + "]" : "OptionalField.absent";
    }
}

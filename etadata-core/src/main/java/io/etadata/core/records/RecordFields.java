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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// The field values handed to a [RecordKind]'s factory: every required field,
/// plus each optional field that was present in the input.
public final class RecordFields {

    private final Map<String, Object> values;

    RecordFields(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    /// @param name a required field name
    /// @return the field value, possibly null
    /// @throws MissingFieldException if the field was not supplied
    public Object get(String name) {
        if (!values.containsKey(name)) {
            throw new MissingFieldException("Field '" + name + "' was not supplied");
        }
        return values.get(name);
    }

    /// @param name a required field name
    /// @return the field value in string form, or null
    public String getString(String name) {
        return asString(get(name));
    }

    /// @param name an optional field name
    /// @return the field, absent when it was not supplied
    public OptionalField<Object> optional(String name) {
        return values.containsKey(name) ? OptionalField.of(values.get(name)) : OptionalField.absent();
    }

    /// @param name an optional field name
    /// @return the field in string form, absent when it was not supplied
    public OptionalField<String> optionalString(String name) {
        return optional(name).map(RecordFields::asString);
    }

    /// @return the supplied values, in input order
    public Map<String, Object> asMap() {
        return values;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}

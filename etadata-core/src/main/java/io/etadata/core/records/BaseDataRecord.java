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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Base class for data records: typed aggregates whose fields can also be read by name.
///
/// A subclass exposes its [RecordKind] and maps each declared field name to
/// its current state through [#field]. Required fields are always present;
/// optional fields are held as [OptionalField] so that "absent" and "present
/// with null" stay distinct.
public abstract class BaseDataRecord {

    /// @return the kind describing this record's fields
    public abstract RecordKind<? extends BaseDataRecord> kind();

    /// Reads one declared field.
    ///
    /// @param name a name declared by [#kind()]
    /// @return the field's state
    protected abstract OptionalField<?> field(String name);

    /// @param name a field name
    /// @return whether the field is declared and currently present
    public boolean hasField(String name) {
        return kind().declares(name) && field(name).isPresent();
    }

    /// Reads a field by name.
    ///
    /// @param name a field name
    /// @return the field value, possibly null
    /// @throws FieldNotFoundException if the field is not declared or is absent
    public Object get(String name) {
        if (!kind().declares(name)) {
            throw new FieldNotFoundException(
                "Record kind '" + kind().name() + "' has no field '" + name + "'");
        }
        OptionalField<?> value = field(name);
        if (value.isAbsent()) {
            throw new FieldNotFoundException(
                "Field '" + name + "' is not set on this " + kind().name() + " record");
        }
        return value.get();
    }

    /// @return the present, non-excluded fields in declaration order
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        RecordKind<?> kind = kind();
        for (String name : kind.required()) {
            map.put(name, field(name).orElse(null));
        }
        for (String name : kind.optional()) {
            OptionalField<?> value = field(name);
            if (value.isPresent()) {
                map.put(name, value.get());
            }
        }
        return map;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        BaseDataRecord that = (BaseDataRecord) obj;
        for (String name : kind().fieldNames()) {
            if (!Objects.equals(field(name), that.field(name))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = getClass().hashCode();
        for (String name : kind().fieldNames()) {
            hash = 31 * hash + Objects.hashCode(field(name));
        }
        return hash;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + toMap();
    }
}

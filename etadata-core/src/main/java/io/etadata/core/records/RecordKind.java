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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/// Describes one type of data record: its name, class, field sets and factory.
///
/// | Field set | Parsing | Serialization |
/// |-----------|---------|---------------|
/// | required | must be present, else [MissingFieldException] | emitted |
/// | optional | copied only when present | emitted when present |
/// | excluded | ignored | never emitted |
///
/// ```java
/// public static final RecordKind<LabeledVideoRecord> KIND =
///     RecordKind.builder("labeled_video", LabeledVideoRecord.class)
///         .required("video_path", "label")
///         .optional("group")
///         .factory(fields -> new LabeledVideoRecord(...))
///         .build();
/// ```
///
/// @param <R> the record class
public final class RecordKind<R extends BaseDataRecord> {

    private final String name;
    private final Class<R> recordClass;
    private final List<String> required;
    private final List<String> optional;
    private final Set<String> excluded;
    private final Function<RecordFields, R> factory;

    private RecordKind(Builder<R> builder) {
        this.name = builder.name;
        this.recordClass = builder.recordClass;
        this.required = List.copyOf(builder.required);
        this.optional = List.copyOf(builder.optional);
        this.excluded = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excluded));
        this.factory = Objects.requireNonNull(builder.factory, "factory cannot be null");
        Set<String> seen = new LinkedHashSet<>();
        for (String field : fieldNames()) {
            if (!seen.add(field)) {
                throw new IllegalArgumentException("Field '" + field + "' is declared twice in record kind '" + name + "'");
            }
        }
    }

    public static <R extends BaseDataRecord> Builder<R> builder(String name, Class<R> recordClass) {
        return new Builder<>(name, recordClass);
    }

    /// @return the name stored as the record kind discriminator
    public String name() {
        return name;
    }

    public Class<R> recordClass() {
        return recordClass;
    }

    public List<String> required() {
        return required;
    }

    public List<String> optional() {
        return optional;
    }

    public Set<String> excluded() {
        return excluded;
    }

    /// @return every readable field: required, then optional, then excluded
    public List<String> fieldNames() {
        List<String> names = new ArrayList<>(required);
        names.addAll(optional);
        names.addAll(excluded);
        return names;
    }

    /// @param field a field name
    /// @return whether records of this kind declare the field
    public boolean declares(String field) {
        return required.contains(field) || optional.contains(field) || excluded.contains(field);
    }

    /// Parses one record from plain field values.
    ///
    /// @param values the input fields
    /// @return the record
    /// @throws MissingFieldException if a required field is missing
    public R parse(Map<String, ?> values) {
        Map<String, Object> supplied = new LinkedHashMap<>();
        for (String field : required) {
            if (!values.containsKey(field)) {
                throw new MissingFieldException(
                    "Required field '" + field + "' is missing from " + name + " record " + values.keySet());
            }
            supplied.put(field, values.get(field));
        }
        for (String field : optional) {
            if (values.containsKey(field)) {
                supplied.put(field, values.get(field));
            }
        }
        return factory.apply(new RecordFields(supplied));
    }

    @Override
    public String toString() {
        return "RecordKind{" + name + ", " + recordClass.getSimpleName() + '}';
    }

    public static final class Builder<R extends BaseDataRecord> {
        private final String name;
        private final Class<R> recordClass;
        private final List<String> required = new ArrayList<>();
        private final List<String> optional = new ArrayList<>();
        private final List<String> excluded = new ArrayList<>();
        private Function<RecordFields, R> factory;

        private Builder(String name, Class<R> recordClass) {
            this.name = Objects.requireNonNull(name, "name cannot be null");
            this.recordClass = Objects.requireNonNull(recordClass, "recordClass cannot be null");
        }

        public Builder<R> required(String... fields) {
            required.addAll(Arrays.asList(fields));
            return this;
        }

        public Builder<R> optional(String... fields) {
            optional.addAll(Arrays.asList(fields));
            return this;
        }

        public Builder<R> excluded(String... fields) {
            excluded.addAll(Arrays.asList(fields));
            return this;
        }

        public Builder<R> factory(Function<RecordFields, R> factory) {
            this.factory = factory;
            return this;
        }

        public RecordKind<R> build() {
            return new RecordKind<>(this);
        }
    }
}

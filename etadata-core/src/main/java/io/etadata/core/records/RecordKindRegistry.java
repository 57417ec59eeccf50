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
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Maps record kind discriminators to [RecordKind] descriptors.
///
/// Serialized [DataRecords] embed the name of their kind; reading them back
/// without an explicit kind resolves that name here. Kinds are only added by
/// explicit registration.
public final class RecordKindRegistry {

    private static final RecordKindRegistry GLOBAL = create();

    private final Map<String, RecordKind<?>> kinds = new LinkedHashMap<>();

    private RecordKindRegistry() {
    }

    /// @return a new registry holding the built-in kinds
    public static RecordKindRegistry create() {
        return new RecordKindRegistry().register(LabeledVideoRecord.KIND);
    }

    /// @return the process-wide registry used when no registry is given
    public static RecordKindRegistry global() {
        return GLOBAL;
    }

    /// @param kind the kind to register under its name
    /// @return this registry
    /// @throws IllegalArgumentException if another kind already uses the name
    public synchronized RecordKindRegistry register(RecordKind<?> kind) {
        RecordKind<?> existing = kinds.get(kind.name());
        if (existing != null && existing != kind) {
            throw new IllegalArgumentException(
                "Record kind '" + kind.name() + "' is already registered to " + existing.recordClass().getName());
        }
        kinds.put(kind.name(), kind);
        return this;
    }

    /// @param name a stored kind name
    /// @return the registered kind, if any
    public synchronized Optional<RecordKind<?>> find(String name) {
        return Optional.ofNullable(kinds.get(name));
    }

    /// @return the registered names, in registration order
    public synchronized Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(kinds.keySet()));
    }
}

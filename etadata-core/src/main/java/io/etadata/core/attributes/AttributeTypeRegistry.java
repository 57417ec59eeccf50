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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/// Maps stored discriminator strings to [AttributeType] values.
///
/// Entries are only added through [#register]; nothing is resolved by class
/// name. [#create()] returns a registry that already knows the canonical
/// discriminator of every type, and further names can be registered to read
/// data written under other conventions:
///
/// ```java
/// AttributeTypeRegistry registry = AttributeTypeRegistry.create()
///     .register("label", AttributeType.CATEGORICAL);
/// AttributeType type = registry.resolve("label");
/// ```
public final class AttributeTypeRegistry {

    private final Map<String, AttributeType> types = new LinkedHashMap<>();

    private AttributeTypeRegistry() {
    }

    /// Creates a registry holding the canonical discriminator of every type.
    ///
    /// @return a registry that can be extended with further names
    public static AttributeTypeRegistry create() {
        AttributeTypeRegistry registry = new AttributeTypeRegistry();
        for (AttributeType type : AttributeType.values()) {
            registry.register(type.discriminator(), type);
        }
        return registry;
    }

    /// Registers a discriminator.
    ///
    /// @param discriminator the stored name
    /// @param type the type it resolves to
    /// @return this registry
    /// @throws IllegalArgumentException if the name is already bound to another type
    public synchronized AttributeTypeRegistry register(String discriminator, AttributeType type) {
        AttributeType existing = types.get(discriminator);
        if (existing != null && existing != type) {
            throw new IllegalArgumentException(
                "Discriminator '" + discriminator + "' is already registered to " + existing);
        }
        types.put(discriminator, type);
        return this;
    }

    /// Resolves a stored discriminator.
    ///
    /// @param discriminator the stored name
    /// @return the registered type
    /// @throws UnknownVariantException if the name is not registered
    public synchronized AttributeType resolve(String discriminator) {
        AttributeType type = discriminator == null ? null : types.get(discriminator);
        if (type == null) {
            throw new UnknownVariantException(
                "Unknown attribute type: '" + discriminator + "'. Known types: " + types.keySet());
        }
        return type;
    }

    /// @return the registered discriminators, in registration order
    public synchronized Set<String> discriminators() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(types.keySet()));
    }
}

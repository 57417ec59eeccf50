package io.etadata.core.serial;

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

import com.google.gson.Gson;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import io.etadata.core.attributes.Attribute;
import io.etadata.core.attributes.AttributeTypeRegistry;
import io.etadata.core.containers.AttributeContainer;
import io.etadata.core.schema.AttributeContainerSchema;
import io.etadata.core.schema.AttributeSchema;
import io.etadata.core.sequence.DataFileSequence;

/// Gson [TypeAdapterFactory] for the data core's serialized forms.
///
/// ## Architecture
///
/// ```text
///  SERIALIZE                              DESERIALIZE
///  ─────────                              ───────────
///  Attribute(NUMERIC, "speed", 12.5)      {"type": "numeric", ...}
///        │                                         │
///        ▼                                         ▼
///  1. Write type discriminator            1. Read "type" field
///  2. Write name and typed value          2. Resolve it in the AttributeTypeRegistry
///  3. Write confidence when present       3. Parse the value for that type
///        │                                         │
///        ▼                                         ▼
///  {"type": "numeric",                    Attribute(NUMERIC, "speed", 12.5)
///   "name": "speed", "value": 12.5}
/// ```
///
/// Unregistered discriminators fail with
/// [io.etadata.core.attributes.UnknownVariantException].
///
/// ## Handled types
///
/// - [Attribute]
/// - [AttributeSchema]
/// - [AttributeContainerSchema]
/// - [AttributeContainer]
/// - [DataFileSequence]
///
/// Data records are not handled here, since reading them needs a record
/// kind; see [io.etadata.core.records.DataRecords].
///
/// @see DataCoreGsonConfig
public final class DataCoreTypeAdapterFactory implements TypeAdapterFactory {

    private final AttributeTypeRegistry registry;

    private DataCoreTypeAdapterFactory(AttributeTypeRegistry registry) {
        this.registry = registry;
    }

    /// @return a factory resolving the canonical attribute discriminators
    public static DataCoreTypeAdapterFactory create() {
        return create(AttributeTypeRegistry.create());
    }

    /// @param registry the registry resolving stored discriminators
    /// @return a factory using the registry
    public static DataCoreTypeAdapterFactory create(AttributeTypeRegistry registry) {
        return new DataCoreTypeAdapterFactory(registry);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        Class<? super T> raw = type.getRawType();
        if (raw == Attribute.class) {
            return (TypeAdapter<T>) attributeAdapter(gson);
        }
        if (raw == AttributeSchema.class) {
            return (TypeAdapter<T>) schemaAdapter(gson);
        }
        if (raw == AttributeContainerSchema.class) {
            return (TypeAdapter<T>) containerSchemaAdapter(gson);
        }
        if (raw == AttributeContainer.class) {
            return (TypeAdapter<T>) new AttributeContainerTypeAdapter(
                gson, attributeAdapter(gson), containerSchemaAdapter(gson));
        }
        if (raw == DataFileSequence.class) {
            return (TypeAdapter<T>) new DataFileSequenceTypeAdapter(gson);
        }
        return null;
    }

    private AttributeTypeAdapter attributeAdapter(Gson gson) {
        return new AttributeTypeAdapter(gson, registry);
    }

    private AttributeSchemaTypeAdapter schemaAdapter(Gson gson) {
        return new AttributeSchemaTypeAdapter(gson, registry);
    }

    private AttributeContainerSchemaTypeAdapter containerSchemaAdapter(Gson gson) {
        return new AttributeContainerSchemaTypeAdapter(gson, schemaAdapter(gson));
    }
}

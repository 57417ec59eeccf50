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
import com.google.gson.GsonBuilder;
import com.google.gson.ToNumberPolicy;
import io.etadata.core.attributes.AttributeTypeRegistry;

/// Centralized Gson configuration for the data core's serialized forms.
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled ([#gson()] only) | Human-readable files |
/// | Serialize nulls | Enabled | Keep record fields that are present with null |
/// | HTML escaping | Disabled | Cleaner paths and labels |
/// | Special floats | Enabled | NaN and infinite numeric values |
/// | Untyped numbers | Long or double | Integral record fields stay integral |
/// | Data core adapters | Registered | Discriminated attributes and schemas |
///
/// ## Usage
///
/// ```java
/// Gson gson = DataCoreGsonConfig.gson();
/// String json = gson.toJson(Attribute.numeric("speed", 12.5), Attribute.class);
/// Attribute restored = gson.fromJson(json, Attribute.class);
/// ```
///
/// The [Gson] instances are thread-safe and shared.
///
/// @see DataCoreTypeAdapterFactory
public final class DataCoreGsonConfig {

    private static final Gson INSTANCE = builder().setPrettyPrinting().create();
    private static final Gson COMPACT = builder().create();

    private DataCoreGsonConfig() {
        // Utility class
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// @return the shared single-line Gson instance
    public static Gson compactGson() {
        return COMPACT;
    }

    /// Creates a new GsonBuilder with the data core defaults, minus pretty printing.
    ///
    /// @return a new builder
    public static GsonBuilder builder() {
        return builder(AttributeTypeRegistry.create());
    }

    /// Creates a new GsonBuilder with the data core defaults, resolving
    /// attribute discriminators through the given registry.
    ///
    /// @param registry the discriminator registry
    /// @return a new builder
    public static GsonBuilder builder(AttributeTypeRegistry registry) {
        return new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .registerTypeAdapterFactory(DataCoreTypeAdapterFactory.create(registry));
    }
}

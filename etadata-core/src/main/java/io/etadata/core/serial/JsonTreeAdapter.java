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
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;

/// A [TypeAdapter] that converts through a [JsonElement] tree, so subclasses
/// only map between their type and a [JsonObject].
///
/// @param <T> the adapted type
abstract class JsonTreeAdapter<T> extends TypeAdapter<T> {

    protected final Gson gson;

    protected JsonTreeAdapter(Gson gson) {
        this.gson = gson;
    }

    /// @param value a non-null value
    /// @return its tree form
    abstract JsonObject toTree(T value);

    /// @param tree an object tree
    /// @return the value it describes
    abstract T fromTree(JsonObject tree);

    @Override
    public void write(JsonWriter out, T value) throws IOException {
        if (value == null) {
            out.nullValue();
            return;
        }
        gson.getAdapter(JsonElement.class).write(out, toTree(value));
    }

    @Override
    public T read(JsonReader in) throws IOException {
        JsonElement element = JsonParser.parseReader(in);
        if (element.isJsonNull()) {
            return null;
        }
        return fromTree(asObject(element, "value"));
    }

    static JsonObject asObject(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new JsonParseException("Expected a JSON object for " + what + "; found " + element);
        }
        return element.getAsJsonObject();
    }

    static JsonArray asArray(JsonElement element, String what) {
        if (element == null || !element.isJsonArray()) {
            throw new JsonParseException("Expected a JSON array for " + what + "; found " + element);
        }
        return element.getAsJsonArray();
    }

    /// @return the named member, which must be present
    static JsonElement member(JsonObject tree, String name) {
        JsonElement element = tree.get(name);
        if (element == null) {
            throw new JsonParseException("Missing '" + name + "' field in JSON: " + tree);
        }
        return element;
    }

    /// @return the named string member, which must be present
    static String stringMember(JsonObject tree, String name) {
        JsonElement element = member(tree, name);
        if (!element.isJsonPrimitive()) {
            throw new JsonParseException("Field '" + name + "' must be a string in JSON: " + tree);
        }
        return element.getAsString();
    }

    /// @return whether the named member is present and not null
    static boolean hasValue(JsonObject tree, String name) {
        JsonElement element = tree.get(name);
        return element != null && !(element instanceof JsonNull);
    }
}

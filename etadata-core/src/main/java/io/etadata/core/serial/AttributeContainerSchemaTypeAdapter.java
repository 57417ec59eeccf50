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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import io.etadata.core.schema.AttributeContainerSchema;
import io.etadata.core.schema.AttributeSchema;

import java.util.LinkedHashMap;
import java.util.Map;

/// `{"schema": {"<name>": <attribute schema>, ...}}`
final class AttributeContainerSchemaTypeAdapter extends JsonTreeAdapter<AttributeContainerSchema> {

    static final String SCHEMA = "schema";

    private final AttributeSchemaTypeAdapter schemaAdapter;

    AttributeContainerSchemaTypeAdapter(Gson gson, AttributeSchemaTypeAdapter schemaAdapter) {
        super(gson);
        this.schemaAdapter = schemaAdapter;
    }

    @Override
    JsonObject toTree(AttributeContainerSchema schema) {
        JsonObject entries = new JsonObject();
        schema.entries().forEach((name, entry) -> entries.add(name, schemaAdapter.toTree(entry)));
        JsonObject tree = new JsonObject();
        tree.add(SCHEMA, entries);
        return tree;
    }

    @Override
    AttributeContainerSchema fromTree(JsonObject tree) {
        Map<String, AttributeSchema> schemas = new LinkedHashMap<>();
        if (hasValue(tree, SCHEMA)) {
            for (Map.Entry<String, JsonElement> entry : asObject(tree.get(SCHEMA), SCHEMA).entrySet()) {
                schemas.put(entry.getKey(), schemaAdapter.fromTree(asObject(entry.getValue(), entry.getKey())));
            }
        }
        return new AttributeContainerSchema(schemas);
    }
}

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
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.etadata.core.attributes.AttributeType;
import io.etadata.core.attributes.AttributeTypeRegistry;
import io.etadata.core.schema.AttributeSchema;
import io.etadata.core.schema.NumericRange;

import java.util.ArrayList;
import java.util.List;

/// Attribute schemas carry the discriminator of the attribute type they describe:
///
/// ```json
/// {"type": "categorical", "name": "weather", "uuid": "...", "categories": ["rain", "sun"]}
/// {"type": "numeric", "name": "speed", "uuid": "...", "range": [0.0, 30.0]}
/// {"type": "boolean", "name": "moving", "uuid": "..."}
/// ```
///
/// A numeric schema without a range omits the `range` field.
final class AttributeSchemaTypeAdapter extends JsonTreeAdapter<AttributeSchema> {

    static final String TYPE = "type";
    static final String NAME = "name";
    static final String UUID = "uuid";
    static final String CATEGORIES = "categories";
    static final String RANGE = "range";

    private final AttributeTypeRegistry registry;

    AttributeSchemaTypeAdapter(Gson gson, AttributeTypeRegistry registry) {
        super(gson);
        this.registry = registry;
    }

    @Override
    JsonObject toTree(AttributeSchema schema) {
        JsonObject tree = new JsonObject();
        tree.addProperty(TYPE, schema.getAttributeType().discriminator());
        tree.addProperty(NAME, schema.getName());
        tree.addProperty(UUID, schema.getUuid());
        switch (schema.getAttributeType()) {
            case CATEGORICAL -> {
                JsonArray categories = new JsonArray();
                schema.getCategories().forEach(categories::add);
                tree.add(CATEGORIES, categories);
            }
            case NUMERIC -> schema.getRange().ifPresent(range -> {
                JsonArray bounds = new JsonArray();
                bounds.add(range.min());
                bounds.add(range.max());
                tree.add(RANGE, bounds);
            });
            case BOOLEAN -> {
                // no payload
            }
        }
        return tree;
    }

    @Override
    AttributeSchema fromTree(JsonObject tree) {
        AttributeType type = registry.resolve(stringMember(tree, TYPE));
        String name = stringMember(tree, NAME);
        String uuid = hasValue(tree, UUID) ? tree.get(UUID).getAsString() : null;

        List<String> categories = null;
        if (type == AttributeType.CATEGORICAL && hasValue(tree, CATEGORIES)) {
            categories = new ArrayList<>();
            for (JsonElement category : asArray(tree.get(CATEGORIES), CATEGORIES)) {
                categories.add(category.getAsString());
            }
        }

        NumericRange range = null;
        if (type == AttributeType.NUMERIC && hasValue(tree, RANGE)) {
            JsonArray bounds = asArray(tree.get(RANGE), RANGE);
            if (bounds.size() == 2) {
                range = new NumericRange(bounds.get(0).getAsDouble(), bounds.get(1).getAsDouble());
            } else if (bounds.size() != 0) {
                throw new JsonParseException("Field 'range' must hold [min, max]; found " + bounds);
            }
        }
        return AttributeSchema.restore(type, name, uuid, categories, range);
    }
}

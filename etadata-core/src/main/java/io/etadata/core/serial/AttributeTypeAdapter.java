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
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import io.etadata.core.attributes.Attribute;
import io.etadata.core.attributes.AttributeType;
import io.etadata.core.attributes.AttributeTypeRegistry;

/// `{"type": "numeric", "name": "speed", "value": 12.5, "confidence": 0.9}`
final class AttributeTypeAdapter extends JsonTreeAdapter<Attribute> {

    static final String TYPE = "type";
    static final String NAME = "name";
    static final String VALUE = "value";
    static final String CONFIDENCE = "confidence";

    private final AttributeTypeRegistry registry;

    AttributeTypeAdapter(Gson gson, AttributeTypeRegistry registry) {
        super(gson);
        this.registry = registry;
    }

    @Override
    JsonObject toTree(Attribute attr) {
        JsonObject tree = new JsonObject();
        tree.addProperty(TYPE, attr.type().discriminator());
        tree.addProperty(NAME, attr.name());
        switch (attr.type()) {
            case CATEGORICAL -> tree.addProperty(VALUE, attr.categoricalValue());
            case NUMERIC -> tree.addProperty(VALUE, attr.numericValue());
            case BOOLEAN -> tree.addProperty(VALUE, attr.booleanValue());
        }
        attr.confidence().ifPresent(c -> tree.addProperty(CONFIDENCE, c));
        return tree;
    }

    @Override
    Attribute fromTree(JsonObject tree) {
        AttributeType type = registry.resolve(stringMember(tree, TYPE));
        String name = stringMember(tree, NAME);
        JsonElement valueElement = member(tree, VALUE);
        Object rawValue = type == AttributeType.CATEGORICAL && valueElement.isJsonPrimitive()
            ? valueElement.getAsString()
            : primitiveValue(valueElement, VALUE);
        Double confidence = hasValue(tree, CONFIDENCE) ? tree.get(CONFIDENCE).getAsDouble() : null;
        return new Attribute(type, name, rawValue, confidence);
    }

    static Object primitiveValue(JsonElement element, String what) {
        if (element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive()) {
            throw new JsonParseException("Field '" + what + "' must be a string, number or boolean: " + element);
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        if (primitive.isBoolean()) {
            return primitive.getAsBoolean();
        }
        if (primitive.isNumber()) {
            return primitive.getAsDouble();
        }
        return primitive.getAsString();
    }
}

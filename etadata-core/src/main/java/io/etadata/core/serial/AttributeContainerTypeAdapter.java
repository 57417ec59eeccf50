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
import io.etadata.core.attributes.Attribute;
import io.etadata.core.containers.AttributeContainer;

import java.util.ArrayList;
import java.util.List;

/// `{"attrs": [<attribute>, ...], "schema": <container schema>}`; `schema` only
/// when one is enforced. Reading restores the attributes first and then
/// enforces the schema, which must accept all of them.
final class AttributeContainerTypeAdapter extends JsonTreeAdapter<AttributeContainer> {

    static final String SCHEMA = "schema";

    private final AttributeTypeAdapter attributeAdapter;
    private final AttributeContainerSchemaTypeAdapter schemaAdapter;

    AttributeContainerTypeAdapter(Gson gson, AttributeTypeAdapter attributeAdapter,
                                  AttributeContainerSchemaTypeAdapter schemaAdapter) {
        super(gson);
        this.attributeAdapter = attributeAdapter;
        this.schemaAdapter = schemaAdapter;
    }

    @Override
    JsonObject toTree(AttributeContainer container) {
        JsonArray attrs = new JsonArray();
        for (Attribute attr : container) {
            attrs.add(attributeAdapter.toTree(attr));
        }
        JsonObject tree = new JsonObject();
        tree.add(AttributeContainer.ELEMENTS_FIELD, attrs);
        container.getSchema().ifPresent(schema -> tree.add(SCHEMA, schemaAdapter.toTree(schema)));
        return tree;
    }

    @Override
    AttributeContainer fromTree(JsonObject tree) {
        List<Attribute> attrs = new ArrayList<>();
        if (hasValue(tree, AttributeContainer.ELEMENTS_FIELD)) {
            for (JsonElement element : asArray(tree.get(AttributeContainer.ELEMENTS_FIELD), AttributeContainer.ELEMENTS_FIELD)) {
                attrs.add(attributeAdapter.fromTree(asObject(element, "attribute")));
            }
        }
        AttributeContainer container = new AttributeContainer();
        container.addAll(attrs);
        if (hasValue(tree, SCHEMA)) {
            container.setSchema(schemaAdapter.fromTree(asObject(tree.get(SCHEMA), SCHEMA)));
        }
        return container;
    }
}

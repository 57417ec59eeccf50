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
import com.google.gson.JsonObject;
import io.etadata.core.sequence.DataFileSequence;

/// `{"sequence": "/path/to/%05d.png", "immutable_bounds": true}`. Reading
/// scans the filesystem again, so the bounds reflect the files present then.
final class DataFileSequenceTypeAdapter extends JsonTreeAdapter<DataFileSequence> {

    static final String SEQUENCE = "sequence";
    static final String IMMUTABLE_BOUNDS = "immutable_bounds";

    DataFileSequenceTypeAdapter(Gson gson) {
        super(gson);
    }

    @Override
    JsonObject toTree(DataFileSequence sequence) {
        JsonObject tree = new JsonObject();
        tree.addProperty(SEQUENCE, sequence.sequence());
        tree.addProperty(IMMUTABLE_BOUNDS, sequence.isImmutableBounds());
        return tree;
    }

    @Override
    DataFileSequence fromTree(JsonObject tree) {
        boolean immutable = !hasValue(tree, IMMUTABLE_BOUNDS) || tree.get(IMMUTABLE_BOUNDS).getAsBoolean();
        return new DataFileSequence(stringMember(tree, SEQUENCE), immutable);
    }
}

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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.etadata.core.containers.DataContainer;
import io.etadata.core.serial.DataCoreGsonConfig;
import io.etadata.core.serial.SerialFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// An ordered collection of records of one [RecordKind], with operations keyed
/// by a field name.
///
/// Every field-keyed operation reads the named field from each record first.
/// A record that does not declare the field, or holds it absent, fails the
/// call with [FieldNotFoundException] before anything changes.
///
/// ## Serialized form
///
/// ```json
/// {
///   "record_kind": "labeled_video",
///   "records": [
///     {"video_path": "clips/0001.mp4", "label": "cat", "group": "v1"},
///     {"video_path": "clips/0002.mp4", "label": "dog"}
///   ]
/// }
/// ```
///
/// Reading needs a kind: either one passed by the caller or the embedded
/// `record_kind`, resolved through a [RecordKindRegistry].
///
/// @param <R> the record class
public class DataRecords<R extends BaseDataRecord> extends DataContainer<R> {

    private static final Logger logger = LogManager.getLogger(DataRecords.class);

    public static final String ELEMENTS_FIELD = "records";
    public static final String KIND_FIELD = "record_kind";
    public static final String DEFAULT_FILENAME = "records.json";

    private final RecordKind<R> kind;

    public DataRecords(RecordKind<R> kind) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
    }

    public DataRecords(RecordKind<R> kind, Collection<? extends R> records) {
        this(kind);
        addAll(records);
    }

    @Override
    protected void checkElement(R record) {
        super.checkElement(record);
        if (!kind.recordClass().isInstance(record)) {
            throw new IllegalArgumentException(
                "Expected a " + kind.recordClass().getSimpleName() + " record, got " + record.getClass().getSimpleName());
        }
    }

    public RecordKind<R> recordKind() {
        return kind;
    }

    /// @param field a field name
    /// @return the field's value for every record, in record order
    /// @throws FieldNotFoundException if any record lacks the field
    public List<Object> slice(String field) {
        List<Object> values = new ArrayList<>(size());
        for (R record : this) {
            values.add(record.get(field));
        }
        return values;
    }

    /// @param field a field name
    /// @return the distinct values of the field, in first-seen order
    public Set<Object> buildKeyset(String field) {
        return new LinkedHashSet<>(slice(field));
    }

    /// @param field a field name
    /// @return each distinct value mapped to the positions of the records holding it
    public Map<Object, List<Integer>> buildLookup(String field) {
        List<Object> values = slice(field);
        Map<Object, List<Integer>> lookup = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            lookup.computeIfAbsent(values.get(i), k -> new ArrayList<>()).add(i);
        }
        return lookup;
    }

    /// The records are shared with this collection, not copied.
    ///
    /// @param field a field name
    /// @return each distinct value mapped to the records holding it
    public Map<Object, List<R>> buildSubsets(String field) {
        List<Object> values = slice(field);
        Map<Object, List<R>> subsets = new LinkedHashMap<>();
        for (int i = 0; i < values.size(); i++) {
            subsets.computeIfAbsent(values.get(i), k -> new ArrayList<>()).add(get(i));
        }
        return subsets;
    }

    /// Retains only the records whose field value is kept.
    ///
    /// Exactly one of `keep` and `remove` must be given. A `remove` collection
    /// keeps every distinct value it does not name. Kept records stay in their
    /// original relative order.
    ///
    /// @param field a field name
    /// @param keep the values to keep, or null
    /// @param remove the values to remove, or null
    /// @return the number of records left
    /// @throws IllegalArgumentException if both or neither of keep and remove
    ///     are given, either one is empty, or nothing would be kept
    /// @throws FieldNotFoundException if any record lacks the field
    public int cull(String field, Collection<?> keep, Collection<?> remove) {
        if ((keep == null) == (remove == null)) {
            throw new IllegalArgumentException("cull needs exactly one of keep or remove values");
        }
        if (remove != null && remove.isEmpty()) {
            throw new IllegalArgumentException("cull on '" + field + "' needs at least one value to remove");
        }
        List<Object> values = slice(field);
        Set<Object> keepSet;
        if (keep != null) {
            keepSet = new HashSet<>(keep);
        } else {
            keepSet = new LinkedHashSet<>(values);
            keepSet.removeAll(remove);
        }
        if (keepSet.isEmpty()) {
            throw new IllegalArgumentException("cull on '" + field + "' would keep no values");
        }

        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            if (keepSet.contains(values.get(i))) {
                kept.add(i);
            }
        }
        int before = size();
        keepIndices(kept);
        logger.debug("Culled {} on '{}': {} -> {} records", kind.name(), field, before, size());
        return size();
    }

    public int cullKeep(String field, Collection<?> keep) {
        return cull(field, Objects.requireNonNull(keep, "keep cannot be null"), null);
    }

    public int cullRemove(String field, Collection<?> remove) {
        return cull(field, null, Objects.requireNonNull(remove, "remove cannot be null"));
    }

    /// @param indices positions in this collection; may repeat or reorder
    /// @return a new collection of the same kind with exactly those records, in that order
    public DataRecords<R> subsetFromIndices(List<Integer> indices) {
        return new DataRecords<>(kind, extractIndices(indices));
    }

    /// @return the serialized tree, always naming the record kind
    public JsonObject toJsonTree() {
        Gson gson = DataCoreGsonConfig.compactGson();
        JsonArray records = new JsonArray();
        for (R record : this) {
            JsonObject entry = new JsonObject();
            record.toMap().forEach((name, value) -> entry.add(name, gson.toJsonTree(value)));
            records.add(entry);
        }
        JsonObject tree = new JsonObject();
        tree.addProperty(KIND_FIELD, kind.name());
        tree.add(ELEMENTS_FIELD, records);
        return tree;
    }

    public String toJson() {
        return DataCoreGsonConfig.gson().toJson(toJsonTree());
    }

    /// Appends the records of a serialized collection, parsed as this collection's kind.
    ///
    /// @param json the serialized form
    /// @return the new number of records
    public int addJson(String json) {
        return addJson(json, kind);
    }

    /// Appends the records of a serialized collection, parsed with the given kind.
    ///
    /// Nothing is added if any record fails to parse.
    ///
    /// @param json the serialized form
    /// @param parseKind the kind to parse the records as
    /// @return the new number of records
    public int addJson(String json, RecordKind<? extends R> parseKind) {
        return addTree(JsonParser.parseString(json), parseKind);
    }

    /// Appends the records of a JSON or YAML file, parsed as this collection's kind.
    ///
    /// @param path a file, or a directory holding [#DEFAULT_FILENAME]
    /// @return the new number of records
    /// @throws IOException if reading fails
    public int addFile(Path path) throws IOException {
        return addFile(path, kind);
    }

    /// @param path a file, or a directory holding [#DEFAULT_FILENAME]
    /// @param parseKind the kind to parse the records as
    /// @return the new number of records
    /// @throws IOException if reading fails
    public int addFile(Path path, RecordKind<? extends R> parseKind) throws IOException {
        Path file = resolveFile(path);
        int added = addTree(SerialFiles.readTree(file), parseKind);
        logger.info("Loaded {} records from {}", kind.name(), file);
        return added;
    }

    /// Writes this collection as JSON, or YAML for `.yaml`/`.yml` files.
    ///
    /// @param path a file, or a directory to write [#DEFAULT_FILENAME] into
    /// @return the file written
    /// @throws IOException if writing fails
    public Path writeFile(Path path) throws IOException {
        Path file = resolveFile(path);
        SerialFiles.writeTree(file, toJsonTree());
        return file;
    }

    private int addTree(JsonElement tree, RecordKind<? extends R> parseKind) {
        JsonObject object = recordsObject(tree);
        checkEmbeddedKind(object, parseKind);
        addAll(parseRecords(object, parseKind));
        return size();
    }

    /// Reads a serialized collection whose records all have the given kind.
    ///
    /// @param json the serialized form
    /// @param kind the record kind
    /// @param <R> the record class
    /// @return the records
    public static <R extends BaseDataRecord> DataRecords<R> fromJson(String json, RecordKind<R> kind) {
        DataRecords<R> records = new DataRecords<>(kind);
        records.addJson(json);
        return records;
    }

    /// Reads a serialized collection, resolving its embedded `record_kind`
    /// through the [RecordKindRegistry#global()] registry.
    ///
    /// @param json the serialized form
    /// @return the records
    /// @throws MissingRecordKindException if no registered kind is named
    public static DataRecords<?> fromJson(String json) {
        return fromJson(json, null, RecordKindRegistry.global());
    }

    /// Reads a serialized collection with an explicit kind, or else the
    /// embedded one resolved through the registry.
    ///
    /// @param json the serialized form
    /// @param kind the record kind, or null to use the embedded one
    /// @param registry resolves embedded kind names
    /// @return the records
    /// @throws MissingRecordKindException if neither kind source is available
    public static DataRecords<?> fromJson(String json, RecordKind<?> kind, RecordKindRegistry registry) {
        return fromTree(JsonParser.parseString(json), kind, registry);
    }

    /// Reads a JSON or YAML file, as [#fromJson(String, RecordKind, RecordKindRegistry)].
    ///
    /// @param path a file, or a directory holding [#DEFAULT_FILENAME]
    /// @param kind the record kind, or null to use the embedded one
    /// @return the records
    /// @throws IOException if reading fails
    public static DataRecords<?> fromFile(Path path, RecordKind<?> kind) throws IOException {
        Path file = resolveFile(path);
        DataRecords<?> records = fromTree(SerialFiles.readTree(file), kind, RecordKindRegistry.global());
        logger.info("Loaded {} {} records from {}", records.size(), records.recordKind().name(), file);
        return records;
    }

    public static DataRecords<?> fromFile(Path path) throws IOException {
        return fromFile(path, null);
    }

    private static DataRecords<?> fromTree(JsonElement tree, RecordKind<?> kind, RecordKindRegistry registry) {
        JsonObject object = recordsObject(tree);
        RecordKind<?> resolved = kind != null ? kind : embeddedKind(object, registry);
        return build(object, resolved);
    }

    private static <R extends BaseDataRecord> DataRecords<R> build(JsonObject object, RecordKind<R> kind) {
        checkEmbeddedKind(object, kind);
        return new DataRecords<>(kind, parseRecords(object, kind));
    }

    private static RecordKind<?> embeddedKind(JsonObject object, RecordKindRegistry registry) {
        JsonElement name = object.get(KIND_FIELD);
        if (name == null || name.isJsonNull()) {
            throw new MissingRecordKindException(
                "No record kind was given and the data has no '" + KIND_FIELD + "' field");
        }
        return registry.find(name.getAsString()).orElseThrow(() -> new MissingRecordKindException(
            "Record kind '" + name.getAsString() + "' is not registered; known kinds are " + registry.names()));
    }

    private static void checkEmbeddedKind(JsonObject object, RecordKind<?> kind) {
        JsonElement name = object.get(KIND_FIELD);
        if (name != null && !name.isJsonNull() && !name.getAsString().equals(kind.name())) {
            logger.warn("Data names record kind '{}' but is being read as '{}'", name.getAsString(), kind.name());
        }
    }

    private static <R extends BaseDataRecord> List<R> parseRecords(JsonObject object, RecordKind<R> kind) {
        JsonElement elements = object.get(ELEMENTS_FIELD);
        List<R> parsed = new ArrayList<>();
        if (elements == null || elements.isJsonNull()) {
            return parsed;
        }
        if (!elements.isJsonArray()) {
            throw new JsonParseException("'" + ELEMENTS_FIELD + "' must be an array, got " + elements);
        }
        Gson gson = DataCoreGsonConfig.compactGson();
        for (JsonElement element : elements.getAsJsonArray()) {
            if (!element.isJsonObject()) {
                throw new JsonParseException("Each record must be an object, got " + element);
            }
            Map<String, Object> values = new LinkedHashMap<>();
            for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                values.put(entry.getKey(), gson.fromJson(entry.getValue(), Object.class));
            }
            parsed.add(kind.parse(values));
        }
        return parsed;
    }

    private static JsonObject recordsObject(JsonElement tree) {
        if (tree == null || !tree.isJsonObject()) {
            throw new JsonParseException("Serialized records must be an object, got " + tree);
        }
        return tree.getAsJsonObject();
    }

    private static Path resolveFile(Path path) {
        Objects.requireNonNull(path, "path cannot be null");
        return Files.isDirectory(path) ? path.resolve(DEFAULT_FILENAME) : path;
    }

    @Override
    public boolean equals(Object obj) {
        if (!super.equals(obj)) return false;
        return kind.equals(((DataRecords<?>) obj).kind);
    }

    @Override
    public int hashCode() {
        return 31 * super.hashCode() + kind.hashCode();
    }

    @Override
    public String toString() {
        return "DataRecords{" + kind.name() + ", " + size() + " records}";
    }
}

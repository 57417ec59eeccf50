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
import com.google.gson.JsonNull;
import com.google.gson.JsonParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Objects;

/// Reads and writes serialized data core values as JSON or YAML files.
///
/// The format follows the file name: `.yaml` and `.yml` files hold YAML, and
/// everything else holds JSON. Both carry the same tree; YAML content is
/// converted to a Gson tree on read and back to plain maps and lists on write.
///
/// ## Atomic Save
///
/// ```text
///   1. Write content to <name>.tmp next to the target
///   2. Rename the temp file onto the target (atomic on POSIX)
/// ```
///
/// An interrupted save leaves any existing file intact.
public final class SerialFiles {

    private static final Logger logger = LogManager.getLogger(SerialFiles.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private static final LoadSettings LOAD_SETTINGS = LoadSettings.builder().setLabel("etadata").build();
    private static final DumpSettings DUMP_SETTINGS =
        DumpSettings.builder().setDefaultFlowStyle(FlowStyle.BLOCK).build();

    private SerialFiles() {
        // Utility class
    }

    /// @param path a file path
    /// @return whether the file is read and written as YAML
    public static boolean isYaml(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }

    /// Reads a file into a JSON tree.
    ///
    /// @param path the file to read
    /// @return the tree; [JsonNull] for an empty file
    /// @throws IOException if reading fails
    /// @throws com.google.gson.JsonParseException if the content is malformed JSON
    public static JsonElement readTree(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        logger.debug("Reading {}", path);
        if (isYaml(path)) {
            Object loaded;
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                loaded = new Load(LOAD_SETTINGS).loadFromReader(reader);
            }
            return loaded == null ? JsonNull.INSTANCE : DataCoreGsonConfig.compactGson().toJsonTree(loaded);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return JsonParser.parseReader(reader);
        }
    }

    /// Writes a JSON tree to a file, replacing it atomically.
    ///
    /// @param path the file to write
    /// @param tree the content
    /// @throws IOException if writing fails
    public static void writeTree(Path path, JsonElement tree) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(tree, "tree cannot be null");
        Gson gson = DataCoreGsonConfig.gson();
        String content;
        if (isYaml(path)) {
            content = new Dump(DUMP_SETTINGS).dumpToString(gson.fromJson(tree, Object.class));
        } else {
            content = gson.toJson(tree);
        }

        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try {
            try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
                writer.write(content);
            }
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        logger.info("Wrote {} ({} chars)", path, content.length());
    }

    /// Reads a file as a value of the given type.
    ///
    /// @param path the file to read
    /// @param type the value type, usually one handled by [DataCoreTypeAdapterFactory]
    /// @param <T> the value type
    /// @return the value
    /// @throws IOException if reading fails
    public static <T> T read(Path path, Class<T> type) throws IOException {
        return DataCoreGsonConfig.gson().fromJson(readTree(path), type);
    }

    /// Writes a value to a file, replacing it atomically.
    ///
    /// @param path the file to write
    /// @param value the value, usually one handled by [DataCoreTypeAdapterFactory]
    /// @throws IOException if writing fails
    public static void write(Path path, Object value) throws IOException {
        Objects.requireNonNull(value, "value cannot be null");
        writeTree(path, DataCoreGsonConfig.gson().toJsonTree(value));
    }
}

package io.tabfields.schema.json;

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

import com.google.gson.JsonParseException;
import io.tabfields.codec.errors.InvalidFieldConfigException;
import io.tabfields.schema.FieldSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/// Loads and saves [FieldSchema] definitions as JSON files.
///
/// ## File Format
///
/// ```json
/// {
///   "fields": [
///     { "type": "continuous", "name": "duration", "min_value": 0.0, "max_value": 10.0,
///       "normalization": "ZERO_ONE", "width": 1 },
///     { "type": "discrete", "name": "protocol", "vocabulary": ["TCP", "UDP", "ICMP"] },
///     { "type": "bit", "name": "src_port", "num_bits": 16 }
///   ]
/// }
/// ```
///
/// Field parameters are validated by the field constructors on load; any
/// structural or parameter problem surfaces as an [InvalidFieldConfigException].
public final class FieldSchemaIO {

    private static final Logger logger = LogManager.getLogger(FieldSchemaIO.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private FieldSchemaIO() {
        // Utility class
    }

    /// Saves a schema to a file atomically: it is written to a sibling temporary
    /// file first, then renamed over the target.
    ///
    /// @param path the path to save the schema to
    /// @param schema the schema to save
    /// @throws IOException if writing fails
    public static void save(Path path, FieldSchema schema) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(schema, "schema cannot be null");

        String json = toJson(schema);
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(json);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Saved schema with {} fields to {}", schema.size(), path);
    }

    /// Loads a schema from a file.
    ///
    /// @param path the path to load the schema from
    /// @return the loaded schema
    /// @throws NoSuchFileException if the file does not exist
    /// @throws IOException if reading fails
    /// @throws InvalidFieldConfigException if the content is not a valid schema
    public static FieldSchema load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "Schema file not found");
        }

        FieldSchema schema;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            schema = parse(TabfieldsGsonConfig.gson().fromJson(reader, FieldSchema.class), path.toString());
        } catch (JsonParseException e) {
            throw new InvalidFieldConfigException("Invalid schema JSON in " + path + ": " + e.getMessage(), e);
        }
        logger.info("Loaded schema with {} fields (width {}) from {}", schema.size(), schema.width(), path);
        return schema;
    }

    /// Parses a schema from a JSON string.
    ///
    /// @param json the schema JSON
    /// @return the schema
    /// @throws InvalidFieldConfigException if the content is not a valid schema
    public static FieldSchema fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return parse(TabfieldsGsonConfig.gson().fromJson(json, FieldSchema.class), "JSON string");
        } catch (JsonParseException e) {
            throw new InvalidFieldConfigException("Invalid schema JSON: " + e.getMessage(), e);
        }
    }

    /// @param schema the schema
    /// @return the pretty-printed JSON form of the schema
    public static String toJson(FieldSchema schema) {
        return TabfieldsGsonConfig.gson().toJson(schema, FieldSchema.class);
    }

    private static FieldSchema parse(FieldSchema schema, String source) {
        if (schema == null) {
            throw new InvalidFieldConfigException("Schema " + source + " is empty or null");
        }
        return schema;
    }
}

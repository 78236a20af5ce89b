package io.nosqlbench.divstats.io;

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

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.stream.JsonReader;
import io.nosqlbench.divstats.dataset.PartitionRecord;
import io.nosqlbench.divstats.frame.CategoricalColumn;
import io.nosqlbench.divstats.frame.Column;
import io.nosqlbench.divstats.frame.DatetimeColumn;
import io.nosqlbench.divstats.frame.Frame;
import io.nosqlbench.divstats.frame.NumericColumn;
import io.nosqlbench.divstats.frame.OpaqueColumn;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Reads a dataset stored as one JSON file per partition.
///
/// ## File format
///
/// ```json
/// {
///   "key": "region=east",
///   "columns": [
///     {"name": "price", "type": "numeric", "values": [1.5, null, 3.0]},
///     {"name": "item", "type": "categorical", "values": ["a", "b", null]},
///     {"name": "when", "type": "datetime", "values": ["2024-01-01T00:00:00Z", null, null]},
///     {"name": "blob", "type": "other", "values": [{"x": 1}, [2], "3"]}
///   ]
/// }
/// ```
///
/// A file with `columns` becomes a [Frame] partition value; every column must have the
/// same length, and the optional `rows` member gives the row count of a frame without
/// columns. A file without `columns` uses its `value` member as an opaque partition
/// value. `null` entries are missing values. Files are read in file-name order.
public final class PartitionFiles {

    private static final Logger logger = LogManager.getLogger(PartitionFiles.class);

    private PartitionFiles() {
    }

    /// Reads every `*.json` partition file in a directory.
    ///
    /// @param directory the dataset directory
    /// @param excludedNames file names to skip, such as the attribute file
    /// @return the partitions in file-name order
    /// @throws IOException if a file cannot be read or is malformed
    public static List<PartitionRecord> readDirectory(Path directory, Set<String> excludedNames) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("Not a dataset directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .filter(p -> !excludedNames.contains(p.getFileName().toString()))
                .sorted()
                .collect(Collectors.toList());
        }
        List<PartitionRecord> records = new ArrayList<>(files.size());
        for (Path file : files) {
            records.add(readFile(file));
        }
        logger.debug("Read {} partition files from {}", records.size(), directory);
        return records;
    }

    /// Reads one partition file.
    ///
    /// @param file the file
    /// @return the partition
    /// @throws IOException if the file cannot be read or is malformed
    public static PartitionRecord readFile(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);
            JsonElement element = JsonParser.parseReader(jsonReader);
            return toRecord(element);
        } catch (JsonParseException | IllegalArgumentException | IllegalStateException e) {
            throw new IOException("Invalid partition file " + file + ": " + e.getMessage(), e);
        }
    }

    static PartitionRecord toRecord(JsonElement element) {
        if (!element.isJsonObject()) {
            throw new JsonParseException("partition must be a JSON object");
        }
        JsonObject obj = element.getAsJsonObject();
        JsonElement keyElement = obj.get("key");
        if (keyElement == null || keyElement.isJsonNull()) {
            throw new JsonParseException("partition has no key");
        }
        Object key = toPlain(keyElement);
        if (obj.has("columns")) {
            int rows = obj.has("rows") ? obj.get("rows").getAsInt() : -1;
            return new PartitionRecord(key, toFrame(obj.getAsJsonArray("columns"), rows));
        }
        JsonElement value = obj.get("value");
        return new PartitionRecord(key, value == null ? null : toPlain(value));
    }

    private static Frame toFrame(JsonArray columns, int declaredRows) {
        Frame.Builder builder = Frame.builder();
        int rows = declaredRows;
        if (rows >= 0) {
            builder.rows(rows);
        }
        for (JsonElement columnElement : columns) {
            JsonObject column = columnElement.getAsJsonObject();
            String name = column.get("name").getAsString();
            String type = column.has("type") ? column.get("type").getAsString() : "other";
            JsonArray values = column.getAsJsonArray("values");
            if (values == null) {
                throw new JsonParseException("column '" + name + "' has no values");
            }
            Column parsed = toColumn(name, type, values);
            if (rows < 0) {
                rows = parsed.size();
                builder.rows(rows);
            }
            builder.add(parsed);
        }
        return rows < 0 ? Frame.empty(0) : builder.build();
    }

    private static Column toColumn(String name, String type, JsonArray values) {
        int n = values.size();
        switch (type) {
            case "numeric": {
                double[] data = new double[n];
                for (int i = 0; i < n; i++) {
                    JsonElement v = values.get(i);
                    data[i] = v.isJsonNull() ? Double.NaN : v.getAsDouble();
                }
                return NumericColumn.of(name, data);
            }
            case "categorical": {
                String[] data = new String[n];
                for (int i = 0; i < n; i++) {
                    JsonElement v = values.get(i);
                    data[i] = v.isJsonNull() ? null : v.getAsString();
                }
                return CategoricalColumn.of(name, data);
            }
            case "datetime": {
                Instant[] data = new Instant[n];
                for (int i = 0; i < n; i++) {
                    JsonElement v = values.get(i);
                    try {
                        data[i] = v.isJsonNull() ? null : Instant.parse(v.getAsString());
                    } catch (DateTimeParseException e) {
                        throw new JsonParseException("column '" + name + "' row " + i + ": " + e.getMessage(), e);
                    }
                }
                return DatetimeColumn.of(name, data);
            }
            case "other": {
                Object[] data = new Object[n];
                for (int i = 0; i < n; i++) {
                    data[i] = toPlain(values.get(i));
                }
                return OpaqueColumn.of(name, data);
            }
            default:
                throw new JsonParseException("column '" + name + "' has unknown type '" + type
                    + "'; expected numeric, categorical, datetime or other");
        }
    }

    private static Object toPlain(JsonElement element) {
        if (element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            return element.getAsString();
        }
        return DivstatsGsonConfig.compactGson().fromJson(element, Object.class);
    }
}

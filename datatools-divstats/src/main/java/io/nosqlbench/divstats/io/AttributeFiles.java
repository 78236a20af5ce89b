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

import com.google.gson.JsonParseException;
import io.nosqlbench.divstats.attrs.GlobalAttributes;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/// Reads and writes the attribute file of a dataset directory.
///
/// Saving is atomic: the JSON is written next to the target and renamed over it, so
/// an interrupted save never leaves a partial attribute file behind.
public final class AttributeFiles {

    /// Default attribute file name inside a dataset directory.
    public static final String DEFAULT_FILE_NAME = "_attributes.json";

    private static final String TEMP_SUFFIX = ".tmp";

    private AttributeFiles() {
    }

    /// Saves attributes to a file.
    ///
    /// @param path the target file
    /// @param attributes the attributes to write
    /// @throws IOException if writing fails
    public static void save(Path path, GlobalAttributes attributes) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(attributes, "attributes cannot be null");

        String json = DivstatsGsonConfig.gson().toJson(attributes, GlobalAttributes.class);
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(json);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    /// Loads attributes from a file.
    ///
    /// @param path the attribute file
    /// @return the attributes, empty if the file does not exist
    /// @throws IOException if the file cannot be read or is not a valid attribute file
    public static GlobalAttributes load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        if (!Files.exists(path)) {
            return GlobalAttributes.builder().build();
        }
        GlobalAttributes attributes;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            attributes = DivstatsGsonConfig.gson().fromJson(reader, GlobalAttributes.class);
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new IOException("Invalid attribute file " + path + ": " + e.getMessage(), e);
        }
        return attributes == null ? GlobalAttributes.builder().build() : attributes;
    }
}

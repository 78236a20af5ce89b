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

import io.nosqlbench.divstats.accumulate.PercentileTable;
import io.nosqlbench.divstats.attrs.GlobalAttributes;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AttributeFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void saveAndLoad_restoresAttributes() throws IOException {
        Path file = tempDir.resolve(AttributeFiles.DEFAULT_FILE_NAME);
        GlobalAttributes attrs = GlobalAttributes.builder()
            .nDiv(3)
            .keys(List.of("a", "b", "c"))
            .splitRowDistn(PercentileTable.estimate(new double[] {10, 0, 5}))
            .summary(Map.of())
            .build();

        AttributeFiles.save(file, attrs);

        assertEquals(attrs, AttributeFiles.load(file));
        assertFalse(Files.exists(tempDir.resolve(AttributeFiles.DEFAULT_FILE_NAME + ".tmp")));
    }

    @Test
    void save_replacesExistingFile() throws IOException {
        Path file = tempDir.resolve("attrs.json");
        AttributeFiles.save(file, GlobalAttributes.builder().nDiv(1).build());

        AttributeFiles.save(file, GlobalAttributes.builder().nRow(9).build());

        GlobalAttributes loaded = AttributeFiles.load(file);
        assertTrue(loaded.nDiv().isEmpty());
        assertEquals(9, loaded.nRow().orElseThrow());
    }

    @Test
    void load_missingFileIsEmpty() throws IOException {
        assertTrue(AttributeFiles.load(tempDir.resolve("absent.json")).isEmpty());
    }

    @Test
    void load_rejectsMalformedFile() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.writeString(file, "{\"nDiv\": \"many\"}");

        assertThrows(IOException.class, () -> AttributeFiles.load(file));
    }
}

package io.nosqlbench.divstats.dataset;

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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class InMemoryDatasetTest {

    @Test
    void withAttributes_mergesAndLeavesOriginalUnchanged() {
        InMemoryDataset dataset = InMemoryDataset.builder(DatasetKind.DDO)
            .partition("a", 1)
            .attribute("nDiv", 1L)
            .attribute("keys", List.of("a"))
            .build();

        InMemoryDataset updated = dataset.withAttributes(Map.of("nDiv", 2L, "totObjectSize", 8.0));

        assertEquals(Map.of("nDiv", 1L, "keys", List.of("a")), dataset.attributes());
        assertEquals(2L, updated.getAttribute("nDiv").orElseThrow());
        assertEquals(List.of("a"), updated.getAttribute("keys").orElseThrow());
        assertEquals(8.0, updated.getAttribute("totObjectSize").orElseThrow());
        assertEquals(DatasetKind.DDO, updated.kind());
    }

    @Test
    void partitions_canBeStreamedRepeatedly() {
        InMemoryDataset dataset = InMemoryDataset.builder(DatasetKind.DDO)
            .partition("a", 1)
            .partition("b", 2)
            .build();

        List<Object> first = dataset.partitions().stream().map(PartitionRecord::key).collect(Collectors.toList());
        List<Object> second = dataset.partitions().stream().map(PartitionRecord::key).collect(Collectors.toList());

        assertEquals(List.of("a", "b"), first);
        assertEquals(first, second);
    }

    @Test
    void deferredView_keepsPartitionsAndMarksView() {
        InMemoryDataset dataset = InMemoryDataset.builder(DatasetKind.DDF).partition("a", 1).build();
        PartitionTransform pending = (key, value) -> value;

        InMemoryDataset view = dataset.deferredView(pending);

        assertFalse(dataset.isDeferredView());
        assertTrue(view.isDeferredView());
        assertSame(pending, view.transform().orElseThrow());
        assertEquals(1, view.partitions().stream().count());
    }

    @Test
    void builder_rejectsNullKeyAndAttributeValue() {
        InMemoryDataset.Builder builder = InMemoryDataset.builder(DatasetKind.DDO);

        assertThrows(NullPointerException.class, () -> builder.partition(null, 1));
        assertThrows(NullPointerException.class, () -> builder.attribute("nDiv", null));
    }

    @Test
    void fromLabel_isCaseInsensitive() {
        assertEquals(DatasetKind.DDF, DatasetKind.fromLabel("DDF"));
        assertThrows(IllegalArgumentException.class, () -> DatasetKind.fromLabel("table"));
    }
}

package io.nosqlbench.divstats.attrs;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class GlobalAttributesTest {

    @Test
    void toAttributeMap_containsOnlyPresentAttributes() {
        GlobalAttributes attrs = GlobalAttributes.builder().nDiv(3).nRow(15).build();

        assertThat(attrs.toAttributeMap()).containsOnlyKeys("nDiv", "nRow");
        assertEquals(3L, attrs.nDiv().getAsLong());
        assertTrue(attrs.totObjectSize().isEmpty());
        assertTrue(attrs.summary().isEmpty());
    }

    @Test
    void fromAttributeMap_acceptsAnyNumberAndIgnoresUnknown() {
        GlobalAttributes attrs = GlobalAttributes.fromAttributeMap(Map.of(
            "nRow", 12,
            "totObjectSize", 40L,
            "custom", "kept elsewhere"));

        assertEquals(12L, attrs.nRow().getAsLong());
        assertEquals(40.0, attrs.totObjectSize().getAsDouble());
        assertThat(attrs.toAttributeMap()).doesNotContainKey("custom");
    }

    @Test
    void fromAttributeMap_rejectsWrongType() {
        assertThrows(IllegalArgumentException.class,
            () -> GlobalAttributes.fromAttributeMap(Map.of("splitRowDistn", "not a table")));
    }

    @Test
    void mergedWith_newerValuesWin() {
        PercentileTable table = PercentileTable.estimate(new double[]{1, 2, 3});
        GlobalAttributes stored = GlobalAttributes.builder().nDiv(2).keys(List.of("a", "b")).build();
        GlobalAttributes fresh = GlobalAttributes.builder().nDiv(3).splitRowDistn(table).build();

        GlobalAttributes merged = stored.mergedWith(fresh);

        assertEquals(3L, merged.nDiv().getAsLong());
        assertEquals(List.of("a", "b"), merged.keys().orElseThrow());
        assertEquals(table, merged.splitRowDistn().orElseThrow());
    }
}

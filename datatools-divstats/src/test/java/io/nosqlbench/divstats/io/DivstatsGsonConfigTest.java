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

import com.google.gson.Gson;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import io.nosqlbench.divstats.accumulate.FrequencyAccumulator;
import io.nosqlbench.divstats.accumulate.MomentAccumulator;
import io.nosqlbench.divstats.accumulate.PercentileTable;
import io.nosqlbench.divstats.attrs.CategoricalSummary;
import io.nosqlbench.divstats.attrs.DatetimeSummary;
import io.nosqlbench.divstats.attrs.GlobalAttributes;
import io.nosqlbench.divstats.attrs.NumericSummary;
import io.nosqlbench.divstats.attrs.SummaryEntry;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DivstatsGsonConfigTest {

    private static GlobalAttributes sampleAttributes() {
        Map<String, SummaryEntry> summary = new LinkedHashMap<>();
        summary.put("price", new NumericSummary(1, MomentAccumulator.of(1, 2, 4).toStatistics(), 1.0, 4.0));
        summary.put("single", new NumericSummary(0, MomentAccumulator.of(7).toStatistics(), 7.0, 7.0));
        summary.put("empty", new NumericSummary(3, MomentAccumulator.empty().toStatistics(), null, null));
        summary.put("item", CategoricalSummary.from(
            FrequencyAccumulator.tabulate(Arrays.asList("a", "b", "a", null), 10)));
        summary.put("when", new DatetimeSummary(0,
            Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-02-01T12:30:00Z")));
        return GlobalAttributes.builder()
            .totObjectSize(1024.0)
            .nDiv(2)
            .nRow(7)
            .keys(List.of("east", "west"))
            .keyHashes(List.of("h1", "h2"))
            .splitSizeDistn(PercentileTable.estimate(new double[] {400, 624}))
            .splitRowDistn(PercentileTable.estimate(new double[0]))
            .summary(summary)
            .build();
    }

    @Test
    void gson_roundTripsEveryAttribute() {
        Gson gson = DivstatsGsonConfig.gson();
        GlobalAttributes original = sampleAttributes();

        String json = gson.toJson(original, GlobalAttributes.class);
        GlobalAttributes restored = gson.fromJson(json, GlobalAttributes.class);

        assertEquals(original, restored);
        assertThat(restored.summary().orElseThrow().keySet())
            .containsExactly("price", "single", "empty", "item", "when");
    }

    @Test
    void gson_writesUndefinedStatisticsAsNaN() {
        String json = DivstatsGsonConfig.compactGson().toJson(sampleAttributes(), GlobalAttributes.class);

        assertThat(json).contains("NaN");
        assertThat(json).contains("\"type\":\"numeric\"");
        assertThat(json).contains("\"type\":\"categorical\"");
        assertThat(json).contains("\"2024-02-01T12:30:00Z\"");
    }

    @Test
    void gson_skipsUnknownAttributes() {
        String json = "{\"nDiv\": 3, \"futureAttribute\": {\"x\": [1, 2]}, \"keys\": [\"a\", 2]}";

        GlobalAttributes attrs = DivstatsGsonConfig.gson().fromJson(json, GlobalAttributes.class);

        assertEquals(3, attrs.nDiv().orElseThrow());
        assertEquals(List.of("a", 2.0), attrs.keys().orElseThrow());
        assertTrue(attrs.summary().isEmpty());
    }

    @Test
    void summaryEntry_writesTypeDiscriminatorFirst() {
        SummaryEntry entry = new DatetimeSummary(2, null, null);

        JsonObject obj = JsonParser.parseString(DivstatsGsonConfig.compactGson().toJson(entry, SummaryEntry.class))
            .getAsJsonObject();

        assertEquals("type", obj.keySet().iterator().next());
        assertEquals("datetime", obj.get("type").getAsString());
        assertEquals(2, obj.get("naCount").getAsLong());
    }

    @Test
    void summaryEntry_rejectsUnknownType() {
        assertThrows(JsonParseException.class,
            () -> DivstatsGsonConfig.gson().fromJson("{\"type\":\"geo\",\"naCount\":0}", SummaryEntry.class));
    }

    @Test
    void getTypeName_namesRegisteredVariants() {
        SummaryEntryTypeAdapterFactory factory = SummaryEntryTypeAdapterFactory.create();

        assertEquals("numeric", factory.getTypeName(NumericSummary.class));
        assertEquals("categorical", factory.getTypeName(CategoricalSummary.class));
        assertEquals("datetime", factory.getTypeName(DatetimeSummary.class));
    }
}

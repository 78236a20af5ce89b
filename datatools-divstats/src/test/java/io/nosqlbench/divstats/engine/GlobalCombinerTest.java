package io.nosqlbench.divstats.engine;

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

import io.nosqlbench.divstats.accumulate.Count;
import io.nosqlbench.divstats.accumulate.FrequencyAccumulator;
import io.nosqlbench.divstats.accumulate.KeyList;
import io.nosqlbench.divstats.accumulate.PercentileTable;
import io.nosqlbench.divstats.accumulate.ScalarSum;
import io.nosqlbench.divstats.accumulate.ValuePool;
import io.nosqlbench.divstats.attrs.CategoricalSummary;
import io.nosqlbench.divstats.attrs.DatetimeSummary;
import io.nosqlbench.divstats.attrs.FrequencyRow;
import io.nosqlbench.divstats.attrs.NumericSummary;
import io.nosqlbench.divstats.config.DivstatsConfig;
import io.nosqlbench.divstats.dataset.DatasetAttribute;
import io.nosqlbench.divstats.frame.ColumnFamily;
import io.nosqlbench.divstats.frame.DatetimeColumn;
import io.nosqlbench.divstats.frame.NumericColumn;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class GlobalCombinerTest {

    private final GlobalCombiner combiner = new GlobalCombiner(DivstatsConfig.defaults());

    private static final int BATCH = 256;

    private static void foldInBatches(ReduceFold fold, List<?> contributions) {
        for (int i = 0; i < contributions.size(); i += BATCH) {
            fold.fold(contributions.subList(i, Math.min(i + BATCH, contributions.size())));
        }
    }

    private static List<NumericPartial> numericPartials(int partitions, long seed) {
        Random random = new Random(seed);
        List<NumericPartial> partials = new ArrayList<>();
        for (int p = 0; p < partitions; p++) {
            double[] values = new double[1 + random.nextInt(20)];
            for (int i = 0; i < values.length; i++) {
                values[i] = random.nextInt(10) == 0 ? Double.NaN : random.nextGaussian() * 10 + 50;
            }
            partials.add(NumericPartial.compute(NumericColumn.of("x", values)));
        }
        return partials;
    }

    @Test
    void fold_resultIndependentOfBatchingAndOrder() {
        ContributionKey key = ContributionKey.summary(ColumnFamily.NUMERIC, "x");
        List<NumericPartial> partials = numericPartials(40, 7L);

        ReduceFold whole = combiner.open(key);
        whole.fold(partials);
        NumericSummary expected = (NumericSummary) whole.finish();

        List<NumericPartial> shuffled = new ArrayList<>(partials);
        Collections.shuffle(shuffled, new Random(11L));
        ReduceFold left = combiner.open(key);
        ReduceFold right = combiner.open(key);
        for (int i = 0; i < shuffled.size(); i += 3) {
            List<NumericPartial> batch = shuffled.subList(i, Math.min(i + 3, shuffled.size()));
            (i % 2 == 0 ? left : right).fold(batch);
        }
        right.merge(left);
        NumericSummary actual = (NumericSummary) right.finish();

        assertEquals(expected.naCount(), actual.naCount());
        assertEquals(expected.stats().count(), actual.stats().count());
        assertEquals(expected.stats().mean(), actual.stats().mean(), 1e-9);
        assertEquals(expected.stats().variance(), actual.stats().variance(), 1e-9);
        assertEquals(expected.stats().skewness(), actual.stats().skewness(), 1e-9);
        assertEquals(expected.stats().kurtosis(), actual.stats().kurtosis(), 1e-9);
        assertEquals(expected.min(), actual.min());
        assertEquals(expected.max(), actual.max());
    }

    @Test
    void finish_shapeAttributes() {
        ReduceFold nDiv = combiner.open(ContributionKey.shape(DatasetAttribute.N_DIV));
        nDiv.fold(List.of(Count.of(1), Count.of(1), Count.of(1)));
        assertEquals(3L, nDiv.finish());

        ReduceFold size = combiner.open(ContributionKey.shape(DatasetAttribute.TOT_OBJECT_SIZE));
        size.fold(List.of(ScalarSum.of(10), ScalarSum.of(2.5)));
        assertEquals(12.5, (Double) size.finish(), 1e-12);

        ReduceFold keys = combiner.open(ContributionKey.shape(DatasetAttribute.KEYS));
        keys.fold(List.of(KeyList.of("a"), KeyList.of("b")));
        assertEquals(List.of("a", "b"), keys.finish());

        ReduceFold rows = combiner.open(ContributionKey.shape(DatasetAttribute.SPLIT_ROW_DISTN));
        rows.fold(List.of(ValuePool.of(10), ValuePool.of(0), ValuePool.of(5)));
        PercentileTable table = (PercentileTable) rows.finish();
        assertEquals(101, table.size());
        assertEquals(5.0, table.median(), 1e-12);
    }

    @Test
    void finish_withoutContributionsGivesIdentity() {
        assertEquals(0L, combiner.open(ContributionKey.shape(DatasetAttribute.N_DIV)).finish());
        assertEquals(List.of(), combiner.open(ContributionKey.shape(DatasetAttribute.KEYS)).finish());
        PercentileTable table = (PercentileTable) combiner.open(
            ContributionKey.shape(DatasetAttribute.SPLIT_SIZE_DISTN)).finish();
        assertTrue(Double.isNaN(table.median()));
    }

    @Test
    void finish_categoricalUsesConfiguredCap() {
        GlobalCombiner capped = new GlobalCombiner(DivstatsConfig.builder().maxCategories(2).build());
        ReduceFold fold = capped.open(ContributionKey.summary(ColumnFamily.CATEGORICAL, "c"));

        fold.fold(List.of(
            FrequencyAccumulator.tabulate(List.of("a", "a", "b"), 2),
            FrequencyAccumulator.tabulate(List.of("c"), 2)));
        CategoricalSummary summary = (CategoricalSummary) fold.finish();

        assertEquals(List.of(new FrequencyRow("a", 2), new FrequencyRow("b", 1)), summary.freqTable());
        assertFalse(summary.complete());
    }

    @Test
    void fold_rejectsWrongContributionType() {
        ReduceFold fold = combiner.open(ContributionKey.shape(DatasetAttribute.N_ROW));

        assertThrows(IllegalArgumentException.class, () -> fold.fold(List.of(ScalarSum.of(1))));
        assertThrows(IllegalArgumentException.class, () -> fold.fold(Collections.singletonList(null)));
    }

    @Test
    void merge_rejectsFoldOfOtherKey() {
        ReduceFold nRow = combiner.open(ContributionKey.shape(DatasetAttribute.N_ROW));
        ReduceFold nDiv = combiner.open(ContributionKey.shape(DatasetAttribute.N_DIV));

        assertThrows(IllegalArgumentException.class, () -> nRow.merge(nDiv));
    }

    @Test
    void merge_combinesIndependentFolds() {
        ReduceFold a = combiner.open(ContributionKey.shape(DatasetAttribute.N_ROW));
        ReduceFold b = combiner.open(ContributionKey.shape(DatasetAttribute.N_ROW));
        a.fold(List.of(Count.of(4)));
        b.fold(List.of(Count.of(6), Count.of(1)));

        a.merge(b);

        assertEquals(11L, a.finish());
    }

    @Test
    void finish_datetimeRangeAndMissingAcrossPartitions() {
        Instant t1 = Instant.parse("2020-01-01T00:00:00Z");
        Instant t2 = Instant.parse("2021-06-15T12:00:00Z");
        Instant t3 = Instant.parse("2023-12-31T23:59:59Z");
        ContributionKey key = ContributionKey.summary(ColumnFamily.DATETIME, "ts");

        ReduceFold fold = combiner.open(key);
        fold.fold(List.of(
            DatetimePartial.compute(DatetimeColumn.of("ts", t2, null, t1)),
            DatetimePartial.compute(DatetimeColumn.of("ts", null, null))));
        ReduceFold other = combiner.open(key);
        other.fold(List.of(DatetimePartial.compute(DatetimeColumn.of("ts", t3))));
        fold.merge(other);

        assertEquals(new DatetimeSummary(3, t1, t3), fold.finish());
    }

    /// Folding must not rebuild the accumulated state for each contribution; at these
    /// sizes a copying fold takes tens of seconds.
    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void fold_manyPartitionsInLinearTime() {
        int partitions = 200_000;
        List<ValuePool> rowCounts = new ArrayList<>(partitions);
        List<KeyList> keys = new ArrayList<>(partitions);
        for (int p = 0; p < partitions; p++) {
            rowCounts.add(ValuePool.of(p));
            keys.add(KeyList.of("k" + p));
        }

        ReduceFold rows = combiner.open(ContributionKey.shape(DatasetAttribute.SPLIT_ROW_DISTN));
        foldInBatches(rows, rowCounts);
        PercentileTable table = (PercentileTable) rows.finish();
        assertEquals(0.0, table.min());
        assertEquals((double) (partitions - 1), table.max());

        ReduceFold keyFold = combiner.open(ContributionKey.shape(DatasetAttribute.KEYS));
        foldInBatches(keyFold, keys.subList(0, partitions / 2));
        ReduceFold keyTail = combiner.open(ContributionKey.shape(DatasetAttribute.KEYS));
        foldInBatches(keyTail, keys.subList(partitions / 2, partitions));
        keyFold.merge(keyTail);
        List<?> finishedKeys = (List<?>) keyFold.finish();
        assertEquals(partitions, finishedKeys.size());
        assertEquals("k0", finishedKeys.get(0));
        assertEquals("k" + (partitions - 1), finishedKeys.get(partitions - 1));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    void fold_manyNewCategoriesPastTheCap() {
        int partitions = 20_000;
        List<FrequencyAccumulator> tables = new ArrayList<>(partitions);
        for (int p = 0; p < partitions; p++) {
            List<String> values = new ArrayList<>(10);
            for (int c = 0; c < 10; c++) {
                values.add("p" + p + "c" + c);
            }
            tables.add(FrequencyAccumulator.tabulate(values, FrequencyAccumulator.DEFAULT_CAP));
        }

        ReduceFold fold = combiner.open(ContributionKey.summary(ColumnFamily.CATEGORICAL, "c"));
        foldInBatches(fold, tables);
        CategoricalSummary summary = (CategoricalSummary) fold.finish();

        assertEquals(FrequencyAccumulator.DEFAULT_CAP, summary.freqTable().size());
        assertEquals(FrequencyAccumulator.DEFAULT_CAP, summary.tabulatedCount());
        assertFalse(summary.complete());
    }
}

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

import io.nosqlbench.divstats.accumulate.PercentileTable;
import io.nosqlbench.divstats.attrs.CategoricalSummary;
import io.nosqlbench.divstats.attrs.DatetimeSummary;
import io.nosqlbench.divstats.attrs.GlobalAttributes;
import io.nosqlbench.divstats.attrs.NumericSummary;
import io.nosqlbench.divstats.attrs.SummaryEntry;
import io.nosqlbench.divstats.dataset.DatasetAttribute;
import io.nosqlbench.divstats.dataset.DividedDataset;
import io.nosqlbench.divstats.plan.AttributeNeed;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;

/// Builds the [GlobalAttributes] record from finished reduce values.
///
/// ## Steps
///
/// 1. Shape values (`totObjectSize`, `nDiv`, `nRow`, `keys`, the distributions) are
///    copied over, and `keyHashes` is derived from `keys` in the same order.
/// 2. Column summaries are collected per column and ordered by the dataset's declared
///    columns; summarized columns the dataset no longer declares are dropped. A
///    dataset that declares no columns keeps every summary, ordered by name.
/// 3. Categorical completeness is checked against the row count, taken from this run
///    or, failing that, from the dataset's stored `nRow`.
///
/// A needed summary is always present, even when no column could be summarized.
public final class ResultAssembler {

    private static final Logger logger = LogManager.getLogger(ResultAssembler.class);

    /// Assembles the record.
    ///
    /// @param finished finished values by contribution key
    /// @param dataset the dataset being updated, for column order and stored attributes
    /// @param need the attributes computed in this run
    /// @return the attributes computed in this run
    public GlobalAttributes assemble(Map<ContributionKey, Object> finished, DividedDataset dataset,
                                     AttributeNeed need) {
        Objects.requireNonNull(finished, "finished cannot be null");
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(need, "need cannot be null");

        GlobalAttributes.Builder builder = GlobalAttributes.builder();
        Map<String, SummaryEntry> byColumn = new TreeMap<>();

        for (Map.Entry<ContributionKey, Object> entry : new TreeMap<>(finished).entrySet()) {
            ContributionKey key = entry.getKey();
            Object value = entry.getValue();
            if (key.isSummary()) {
                String column = key.column().orElseThrow();
                SummaryEntry previous = byColumn.putIfAbsent(column, expect(SummaryEntry.class, key, value));
                if (previous != null) {
                    logger.warn("Column '{}' was summarized as both {} and {}; keeping {}",
                        column, previous.family(), key.family().orElseThrow(), previous.family());
                }
                continue;
            }
            switch (key.attribute()) {
                case TOT_OBJECT_SIZE:
                    builder.totObjectSize(expect(Number.class, key, value).doubleValue());
                    break;
                case N_DIV:
                    builder.nDiv(expect(Number.class, key, value).longValue());
                    break;
                case N_ROW:
                    builder.nRow(expect(Number.class, key, value).longValue());
                    break;
                case KEYS:
                    List<?> keys = expect(List.class, key, value);
                    builder.keys(keys);
                    builder.keyHashes(KeyHasher.hashAll(keys));
                    break;
                case SPLIT_SIZE_DISTN:
                    builder.splitSizeDistn(expect(PercentileTable.class, key, value));
                    break;
                case SPLIT_ROW_DISTN:
                    builder.splitRowDistn(expect(PercentileTable.class, key, value));
                    break;
                default:
                    throw new IllegalArgumentException("Unexpected finished value for " + key);
            }
        }

        if (need.isNeeded(DatasetAttribute.SUMMARY)) {
            OptionalLong nRow = finishedRowCount(finished);
            if (nRow.isEmpty()) {
                nRow = storedRowCount(dataset);
            }
            builder.summary(orderSummary(byColumn, dataset.columnNames(), nRow));
        }
        return builder.build();
    }

    private Map<String, SummaryEntry> orderSummary(Map<String, SummaryEntry> byColumn, List<String> declared,
                                                   OptionalLong nRow) {
        Map<String, SummaryEntry> ordered = new LinkedHashMap<>();
        if (declared.isEmpty()) {
            ordered.putAll(byColumn);
        } else {
            for (String column : declared) {
                SummaryEntry entry = byColumn.get(column);
                if (entry != null) {
                    ordered.put(column, entry);
                }
            }
            if (ordered.size() < byColumn.size()) {
                logger.debug("Dropped summaries of {} undeclared columns", byColumn.size() - ordered.size());
            }
        }
        for (Map.Entry<String, SummaryEntry> entry : ordered.entrySet()) {
            entry.setValue(settle(entry.getKey(), entry.getValue(), nRow));
        }
        return ordered;
    }

    private SummaryEntry settle(String column, SummaryEntry entry, OptionalLong nRow) {
        if (entry instanceof CategoricalSummary) {
            CategoricalSummary categorical = (CategoricalSummary) entry;
            if (nRow.isPresent()) {
                categorical = categorical.withRowCount(nRow.getAsLong());
            }
            if (!categorical.complete()) {
                logger.info("Column '{}' has more distinct categories than the frequency table keeps; "
                    + "its frequency table is incomplete ({} categories kept)", column, categorical.freqTable().size());
            }
            return categorical;
        }
        if (entry instanceof NumericSummary && ((NumericSummary) entry).min().isEmpty()) {
            logger.debug("Numeric column '{}' has no non-missing values", column);
        } else if (entry instanceof DatetimeSummary && ((DatetimeSummary) entry).min().isEmpty()) {
            logger.debug("Datetime column '{}' has no non-missing values", column);
        }
        return entry;
    }

    private static OptionalLong finishedRowCount(Map<ContributionKey, Object> finished) {
        Object value = finished.get(ContributionKey.shape(DatasetAttribute.N_ROW));
        return value instanceof Number ? OptionalLong.of(((Number) value).longValue()) : OptionalLong.empty();
    }

    private static OptionalLong storedRowCount(DividedDataset dataset) {
        Optional<Object> stored = dataset.getAttribute(DatasetAttribute.N_ROW.attrName());
        if (stored.isPresent() && stored.get() instanceof Number) {
            return OptionalLong.of(((Number) stored.get()).longValue());
        }
        return OptionalLong.empty();
    }

    private static <T> T expect(Class<T> type, ContributionKey key, Object value) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Finished value for " + key + " should be a " + type.getSimpleName()
                + " but was " + (value == null ? "null" : value.getClass().getName()));
        }
        return type.cast(value);
    }
}

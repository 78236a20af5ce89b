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
import io.nosqlbench.divstats.accumulate.ScalarSum;
import io.nosqlbench.divstats.accumulate.ValuePool;
import io.nosqlbench.divstats.config.SizeEstimator;
import io.nosqlbench.divstats.dataset.DatasetAttribute;
import io.nosqlbench.divstats.dataset.PartitionRecord;
import io.nosqlbench.divstats.dataset.PartitionTransform;
import io.nosqlbench.divstats.frame.CategoricalColumn;
import io.nosqlbench.divstats.frame.Column;
import io.nosqlbench.divstats.frame.DatetimeColumn;
import io.nosqlbench.divstats.frame.Frame;
import io.nosqlbench.divstats.frame.NumericColumn;
import io.nosqlbench.divstats.plan.AttributeNeed;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Map stage of an attribute update.
///
/// For each partition, emits the local partial aggregate of every needed attribute:
///
/// | Attribute | Contribution | Computed on |
/// |-----------|--------------|-------------|
/// | `totObjectSize` | [ScalarSum] of the estimated size | stored value |
/// | `splitSizeDistn` | [ValuePool] of the estimated size | stored value |
/// | `nDiv` | [Count] of 1 | - |
/// | `keys` | [KeyList] of the key | - |
/// | `nRow` | [Count] of rows | row data |
/// | `splitRowDistn` | [ValuePool] of rows | row data |
/// | `summary` | one partial per supported column | row data |
///
/// Row data is the stored value, or the result of the configured
/// [PartitionTransform] when there is one. Row data must be a [Frame].
///
/// Columns of an unsupported family are skipped. The builder holds no mutable state
/// and never modifies the partition.
public final class LocalContributionBuilder implements PartitionMapper {

    private static final Logger logger = LogManager.getLogger(LocalContributionBuilder.class);

    private final AttributeNeed need;
    private final PartitionTransform transform;
    private final SizeEstimator sizeEstimator;
    private final int maxCategories;

    /// Creates a builder.
    ///
    /// @param need the attributes to compute
    /// @param transform the row-data transform, or null for none
    /// @param sizeEstimator estimates the size of stored values
    /// @param maxCategories frequency cap applied to each partition's categorical columns
    public LocalContributionBuilder(AttributeNeed need, PartitionTransform transform,
                                    SizeEstimator sizeEstimator, int maxCategories) {
        this.need = Objects.requireNonNull(need, "need cannot be null");
        this.transform = transform;
        this.sizeEstimator = Objects.requireNonNull(sizeEstimator, "sizeEstimator cannot be null");
        if (maxCategories < 1) {
            throw new IllegalArgumentException("maxCategories must be at least 1, got: " + maxCategories);
        }
        this.maxCategories = maxCategories;
    }

    @Override
    public void map(PartitionRecord partition, ContributionCollector collector) {
        Object key = partition.key();
        Object value = partition.value();

        boolean wantTotal = need.isNeeded(DatasetAttribute.TOT_OBJECT_SIZE);
        boolean wantSizes = need.isNeeded(DatasetAttribute.SPLIT_SIZE_DISTN);
        if (wantTotal || wantSizes) {
            double size = sizeEstimator.estimateSize(value);
            if (wantTotal) {
                collector.collect(ContributionKey.shape(DatasetAttribute.TOT_OBJECT_SIZE), ScalarSum.of(size));
            }
            if (wantSizes) {
                collector.collect(ContributionKey.shape(DatasetAttribute.SPLIT_SIZE_DISTN), ValuePool.of(size));
            }
        }
        if (need.isNeeded(DatasetAttribute.N_DIV)) {
            collector.collect(ContributionKey.shape(DatasetAttribute.N_DIV), Count.of(1));
        }
        if (need.isNeeded(DatasetAttribute.KEYS)) {
            collector.collect(ContributionKey.shape(DatasetAttribute.KEYS), KeyList.of(key));
        }

        if (!need.needsRowData()) {
            return;
        }
        Frame frame = rowData(key, value);
        if (need.isNeeded(DatasetAttribute.N_ROW)) {
            collector.collect(ContributionKey.shape(DatasetAttribute.N_ROW), Count.of(frame.rowCount()));
        }
        if (need.isNeeded(DatasetAttribute.SPLIT_ROW_DISTN)) {
            collector.collect(ContributionKey.shape(DatasetAttribute.SPLIT_ROW_DISTN), ValuePool.of(frame.rowCount()));
        }
        if (need.isNeeded(DatasetAttribute.SUMMARY)) {
            for (Column column : frame.columns()) {
                summarize(key, column, collector);
            }
        }
    }

    private Frame rowData(Object key, Object value) {
        Object view = transform == null ? value : transform.apply(key, value);
        if (!(view instanceof Frame)) {
            throw new IllegalArgumentException("Partition " + key + " has no row data: expected a Frame but got "
                + (view == null ? "null" : view.getClass().getName()));
        }
        return (Frame) view;
    }

    private void summarize(Object key, Column column, ContributionCollector collector) {
        switch (column.family()) {
            case NUMERIC:
                collector.collect(ContributionKey.summary(column.family(), column.name()),
                    NumericPartial.compute(cast(column, NumericColumn.class)));
                break;
            case CATEGORICAL:
                collector.collect(ContributionKey.summary(column.family(), column.name()),
                    FrequencyAccumulator.tabulate(cast(column, CategoricalColumn.class).asList(), maxCategories));
                break;
            case DATETIME:
                collector.collect(ContributionKey.summary(column.family(), column.name()),
                    DatetimePartial.compute(cast(column, DatetimeColumn.class)));
                break;
            default:
                logger.trace("Skipping unsupported column '{}' in partition {}", column.name(), key);
        }
    }

    private static <C extends Column> C cast(Column column, Class<C> type) {
        if (!type.isInstance(column)) {
            throw new IllegalArgumentException("Column '" + column.name() + "' reports family " + column.family()
                + " but is a " + column.getClass().getSimpleName());
        }
        return type.cast(column);
    }
}

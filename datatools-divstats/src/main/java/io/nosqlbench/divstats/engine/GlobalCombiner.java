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

import io.nosqlbench.divstats.accumulate.Combinable;
import io.nosqlbench.divstats.accumulate.CombineBuffer;
import io.nosqlbench.divstats.accumulate.Count;
import io.nosqlbench.divstats.accumulate.FrequencyAccumulator;
import io.nosqlbench.divstats.accumulate.KeyList;
import io.nosqlbench.divstats.accumulate.ScalarSum;
import io.nosqlbench.divstats.accumulate.ValuePool;
import io.nosqlbench.divstats.attrs.CategoricalSummary;
import io.nosqlbench.divstats.config.DivstatsConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Function;

/// Reduce stage of an attribute update.
///
/// Each key gets a fold over the partial type its contributions carry, starting from
/// that type's identity:
///
/// | Key | Partial | Finished value |
/// |-----|---------|----------------|
/// | `totObjectSize` | [ScalarSum] | [Double] |
/// | `nDiv`, `nRow` | [Count] | [Long] |
/// | `keys` | [KeyList] | `List<Object>` |
/// | `splitSizeDistn`, `splitRowDistn` | [ValuePool] | [io.nosqlbench.divstats.accumulate.PercentileTable] |
/// | `summary_quant_*` | [NumericPartial] | [io.nosqlbench.divstats.attrs.NumericSummary] |
/// | `summary_categ_*` | [FrequencyAccumulator] | [CategoricalSummary] |
/// | `summary_datetime_*` | [DatetimePartial] | [io.nosqlbench.divstats.attrs.DatetimeSummary] |
///
/// Categorical completeness is settled later, once the row count is known.
public final class GlobalCombiner implements ContributionReducer {

    private static final Logger logger = LogManager.getLogger(GlobalCombiner.class);

    private final int maxCategories;
    private final double percentileStep;

    public GlobalCombiner(DivstatsConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.maxCategories = config.maxCategories();
        this.percentileStep = config.percentileStep();
    }

    @Override
    public ReduceFold open(ContributionKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        switch (key.attribute()) {
            case TOT_OBJECT_SIZE:
                return new TypedFold<>(key, ScalarSum.class, CombineBuffer.folding(ScalarSum.zero()), ScalarSum::sum);
            case N_DIV:
            case N_ROW:
                return new TypedFold<>(key, Count.class, CombineBuffer.folding(Count.zero()), Count::value);
            case KEYS:
                return new TypedFold<>(key, KeyList.class, KeyList.buffer(), KeyList::keys);
            case SPLIT_SIZE_DISTN:
            case SPLIT_ROW_DISTN:
                return new TypedFold<>(key, ValuePool.class, ValuePool.buffer(),
                    p -> p.percentiles(percentileStep));
            case SUMMARY:
                return openSummary(key);
            default:
                throw new IllegalArgumentException("No combine rule for " + key);
        }
    }

    private ReduceFold openSummary(ContributionKey key) {
        switch (key.family().orElseThrow()) {
            case NUMERIC:
                return new TypedFold<>(key, NumericPartial.class, CombineBuffer.folding(NumericPartial.empty()),
                    NumericPartial::toSummary);
            case CATEGORICAL:
                return new TypedFold<>(key, FrequencyAccumulator.class, FrequencyAccumulator.buffer(maxCategories),
                    CategoricalSummary::from);
            case DATETIME:
                return new TypedFold<>(key, DatetimePartial.class, CombineBuffer.folding(DatetimePartial.empty()),
                    DatetimePartial::toSummary);
            default:
                throw new IllegalArgumentException("No combine rule for " + key);
        }
    }

    /// Fold over one [Combinable] partial type.
    ///
    /// Contributions go into a [CombineBuffer]; growable partials are appended in place
    /// and the immutable value is built once, when the fold is merged or finished.
    private static final class TypedFold<P extends Combinable<P>> implements ReduceFold {

        private final ContributionKey key;
        private final Class<P> type;
        private final Function<P, Object> finisher;
        private final CombineBuffer<P> buffer;
        private long folded;

        TypedFold(ContributionKey key, Class<P> type, CombineBuffer<P> buffer, Function<P, Object> finisher) {
            this.key = key;
            this.type = type;
            this.buffer = buffer;
            this.finisher = finisher;
        }

        @Override
        public ContributionKey key() {
            return key;
        }

        @Override
        public void fold(Collection<?> batch) {
            for (Object contribution : batch) {
                if (!type.isInstance(contribution)) {
                    throw new IllegalArgumentException("Contribution for " + key + " must be a "
                        + type.getSimpleName() + " but was "
                        + (contribution == null ? "null" : contribution.getClass().getName()));
                }
                buffer.add(type.cast(contribution));
                folded++;
            }
        }

        @Override
        public void merge(ReduceFold other) {
            if (!(other instanceof TypedFold) || !key.equals(other.key())) {
                throw new IllegalArgumentException("Cannot merge fold of " + other.key() + " into fold of " + key);
            }
            TypedFold<?> that = (TypedFold<?>) other;
            buffer.add(type.cast(that.buffer.build()));
            folded += that.folded;
        }

        @Override
        public Object finish() {
            logger.debug("Combined {} contributions for {}", folded, key);
            return finisher.apply(buffer.build());
        }
    }
}

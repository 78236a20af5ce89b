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
import io.nosqlbench.divstats.accumulate.MomentAccumulator;
import io.nosqlbench.divstats.accumulate.RangeAccumulator;
import io.nosqlbench.divstats.attrs.NumericSummary;
import io.nosqlbench.divstats.frame.NumericColumn;

import java.util.Objects;

/// Partial summary of a numeric column: missing count, moments and range.
public final class NumericPartial implements Combinable<NumericPartial> {

    private static final NumericPartial EMPTY =
        new NumericPartial(0, MomentAccumulator.empty(), RangeAccumulator.empty());

    private final long naCount;
    private final MomentAccumulator moments;
    private final RangeAccumulator<Double> range;

    public NumericPartial(long naCount, MomentAccumulator moments, RangeAccumulator<Double> range) {
        if (naCount < 0) {
            throw new IllegalArgumentException("naCount must be non-negative, got: " + naCount);
        }
        this.naCount = naCount;
        this.moments = Objects.requireNonNull(moments, "moments cannot be null");
        this.range = Objects.requireNonNull(range, "range cannot be null");
    }

    public static NumericPartial empty() {
        return EMPTY;
    }

    /// Summarizes one partition's column in a single pass.
    ///
    /// @param column the column
    /// @return the partial; moments and range are empty if every value is missing
    public static NumericPartial compute(NumericColumn column) {
        MomentAccumulator.Builder builder = MomentAccumulator.builder();
        long na = 0;
        double min = Double.NaN;
        double max = Double.NaN;
        for (int row = 0; row < column.size(); row++) {
            double value = column.get(row);
            if (Double.isNaN(value)) {
                na++;
                continue;
            }
            builder.accept(value);
            if (Double.isNaN(min) || value < min) min = value;
            if (Double.isNaN(max) || value > max) max = value;
        }
        RangeAccumulator<Double> range = Double.isNaN(min) ? RangeAccumulator.empty() : RangeAccumulator.of(min, max);
        return new NumericPartial(na, builder.build(), range);
    }

    public long naCount() {
        return naCount;
    }

    public MomentAccumulator moments() {
        return moments;
    }

    public RangeAccumulator<Double> range() {
        return range;
    }

    @Override
    public boolean isEmpty() {
        return naCount == 0 && moments.isEmpty() && range.isEmpty();
    }

    @Override
    public NumericPartial combine(NumericPartial other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        return new NumericPartial(naCount + other.naCount, moments.combine(other.moments), range.combine(other.range));
    }

    public NumericSummary toSummary() {
        return new NumericSummary(naCount, moments.toStatistics(), range.min().orElse(null), range.max().orElse(null));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericPartial)) return false;
        NumericPartial that = (NumericPartial) o;
        return naCount == that.naCount && moments.equals(that.moments) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(naCount, moments, range);
    }

    @Override
    public String toString() {
        return "NumericPartial[na=" + naCount + ", " + moments + ", " + range + "]";
    }
}

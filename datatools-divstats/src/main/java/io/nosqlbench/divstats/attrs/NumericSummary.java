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

import io.nosqlbench.divstats.accumulate.MomentStatistics;
import io.nosqlbench.divstats.frame.ColumnFamily;

import java.util.Objects;
import java.util.Optional;

/// Summary of a numeric column: missing count, moment statistics and range.
///
/// The range bounds are absent when the column has no non-missing value.
public final class NumericSummary extends SummaryEntry {

    private final MomentStatistics stats;
    private final Double min;
    private final Double max;

    public NumericSummary(long naCount, MomentStatistics stats, Double min, Double max) {
        super(naCount);
        this.stats = Objects.requireNonNull(stats, "stats cannot be null");
        this.min = min;
        this.max = max;
    }

    @Override
    public ColumnFamily family() {
        return ColumnFamily.NUMERIC;
    }

    public MomentStatistics stats() {
        return stats;
    }

    public Optional<Double> min() {
        return Optional.ofNullable(min);
    }

    public Optional<Double> max() {
        return Optional.ofNullable(max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericSummary)) return false;
        NumericSummary that = (NumericSummary) o;
        return naCount() == that.naCount()
            && stats.equals(that.stats)
            && Objects.equals(min, that.min)
            && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(naCount(), stats, min, max);
    }

    @Override
    public String toString() {
        return "NumericSummary[na=" + naCount() + ", " + stats + ", range=[" + min + ", " + max + "]]";
    }
}

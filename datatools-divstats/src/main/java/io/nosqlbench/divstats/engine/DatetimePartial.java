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
import io.nosqlbench.divstats.accumulate.RangeAccumulator;
import io.nosqlbench.divstats.attrs.DatetimeSummary;
import io.nosqlbench.divstats.frame.DatetimeColumn;

import java.time.Instant;
import java.util.Objects;

/// Partial summary of a datetime column: missing count and range.
public final class DatetimePartial implements Combinable<DatetimePartial> {

    private static final DatetimePartial EMPTY = new DatetimePartial(0, RangeAccumulator.empty());

    private final long naCount;
    private final RangeAccumulator<Instant> range;

    public DatetimePartial(long naCount, RangeAccumulator<Instant> range) {
        if (naCount < 0) {
            throw new IllegalArgumentException("naCount must be non-negative, got: " + naCount);
        }
        this.naCount = naCount;
        this.range = Objects.requireNonNull(range, "range cannot be null");
    }

    public static DatetimePartial empty() {
        return EMPTY;
    }

    public static DatetimePartial compute(DatetimeColumn column) {
        return new DatetimePartial(column.missingCount(), RangeAccumulator.over(column.asList()));
    }

    public long naCount() {
        return naCount;
    }

    public RangeAccumulator<Instant> range() {
        return range;
    }

    @Override
    public boolean isEmpty() {
        return naCount == 0 && range.isEmpty();
    }

    @Override
    public DatetimePartial combine(DatetimePartial other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        return new DatetimePartial(naCount + other.naCount, range.combine(other.range));
    }

    public DatetimeSummary toSummary() {
        return new DatetimeSummary(naCount, range.min().orElse(null), range.max().orElse(null));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatetimePartial)) return false;
        DatetimePartial that = (DatetimePartial) o;
        return naCount == that.naCount && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(naCount, range);
    }

    @Override
    public String toString() {
        return "DatetimePartial[na=" + naCount + ", " + range + "]";
    }
}

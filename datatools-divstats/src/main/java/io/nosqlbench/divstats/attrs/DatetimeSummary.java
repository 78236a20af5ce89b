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

import io.nosqlbench.divstats.frame.ColumnFamily;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/// Summary of a datetime column: missing count and range.
public final class DatetimeSummary extends SummaryEntry {

    private final Instant min;
    private final Instant max;

    public DatetimeSummary(long naCount, Instant min, Instant max) {
        super(naCount);
        this.min = min;
        this.max = max;
    }

    @Override
    public ColumnFamily family() {
        return ColumnFamily.DATETIME;
    }

    public Optional<Instant> min() {
        return Optional.ofNullable(min);
    }

    public Optional<Instant> max() {
        return Optional.ofNullable(max);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatetimeSummary)) return false;
        DatetimeSummary that = (DatetimeSummary) o;
        return naCount() == that.naCount() && Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(naCount(), min, max);
    }

    @Override
    public String toString() {
        return "DatetimeSummary[na=" + naCount() + ", range=[" + min + ", " + max + "]]";
    }
}

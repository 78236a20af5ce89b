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

/// Summary of one column of a divided data frame.
///
/// The set of variants is closed:
///
/// | Variant | Family | Contents |
/// |---------|--------|----------|
/// | [NumericSummary] | numeric | NA count, moment statistics, range |
/// | [CategoricalSummary] | categorical | NA count, frequency table, completeness |
/// | [DatetimeSummary] | datetime | NA count, range |
///
/// Serialized with a `type` discriminator by
/// [io.nosqlbench.divstats.io.SummaryEntryTypeAdapterFactory].
public abstract class SummaryEntry {

    private final long naCount;

    SummaryEntry(long naCount) {
        if (naCount < 0) {
            throw new IllegalArgumentException("naCount must be non-negative, got: " + naCount);
        }
        this.naCount = naCount;
    }

    /// Returns the number of missing values in the column.
    ///
    /// @return missing count over all partitions
    public long naCount() {
        return naCount;
    }

    /// @return the column family this entry summarizes
    public abstract ColumnFamily family();
}

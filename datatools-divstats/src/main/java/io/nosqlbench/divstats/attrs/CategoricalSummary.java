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

import io.nosqlbench.divstats.accumulate.FrequencyAccumulator;
import io.nosqlbench.divstats.frame.ColumnFamily;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Summary of a categorical column: missing count, frequency table and completeness.
///
/// `complete` is false when the distinct-category cap was exceeded and the table is
/// known to be truncated. Once the dataset's row count is known,
/// [#withRowCount(long)] settles it as `nRow == Σ freq + naCount`.
public final class CategoricalSummary extends SummaryEntry {

    private final List<FrequencyRow> freqTable;
    private final boolean complete;

    public CategoricalSummary(long naCount, List<FrequencyRow> freqTable, boolean complete) {
        super(naCount);
        this.freqTable = List.copyOf(Objects.requireNonNull(freqTable, "freqTable cannot be null"));
        this.complete = complete;
    }

    /// Builds a summary from a combined frequency accumulator.
    ///
    /// Rows are ordered by descending frequency, then by value.
    ///
    /// @param accumulator the combined accumulator
    /// @return the summary, complete unless categories were dropped
    public static CategoricalSummary from(FrequencyAccumulator accumulator) {
        List<FrequencyRow> rows = new ArrayList<>(accumulator.distinctCount());
        for (Map.Entry<String, Long> entry : accumulator.counts().entrySet()) {
            rows.add(new FrequencyRow(entry.getKey(), entry.getValue()));
        }
        rows.sort(Comparator.comparingLong(FrequencyRow::freq).reversed().thenComparing(FrequencyRow::value));
        return new CategoricalSummary(accumulator.naCount(), rows, !accumulator.isTruncated());
    }

    @Override
    public ColumnFamily family() {
        return ColumnFamily.CATEGORICAL;
    }

    public List<FrequencyRow> freqTable() {
        return freqTable;
    }

    public boolean complete() {
        return complete;
    }

    /// Returns Σ freq over the retained categories.
    ///
    /// @return the tabulated observation count
    public long tabulatedCount() {
        long total = 0;
        for (FrequencyRow row : freqTable) {
            total += row.freq();
        }
        return total;
    }

    /// Returns a copy whose completeness is checked against the dataset row count.
    ///
    /// @param nRow total rows of the dataset
    /// @return the summary with `complete = (nRow == Σ freq + naCount)`
    public CategoricalSummary withRowCount(long nRow) {
        boolean settled = nRow == tabulatedCount() + naCount();
        return settled == complete ? this : new CategoricalSummary(naCount(), freqTable, settled);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CategoricalSummary)) return false;
        CategoricalSummary that = (CategoricalSummary) o;
        return naCount() == that.naCount() && complete == that.complete && freqTable.equals(that.freqTable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(naCount(), freqTable, complete);
    }

    @Override
    public String toString() {
        return "CategoricalSummary[na=" + naCount() + ", distinct=" + freqTable.size()
            + ", complete=" + complete + "]";
    }
}

package io.nosqlbench.divstats.accumulate;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable, capped category frequency table for one categorical column.
///
/// # Cap
///
/// At most `cap` distinct categories are tracked. When a merge would add a category
/// beyond the cap, that category is dropped and its observations are added to
/// [#droppedCount()]. Existing categories are never evicted, so once the cap binds
/// the retained set depends on the order in which partitions were combined:
///
/// ```text
///   cap = 2
///   {a:2, b:1} ⊕ {c:1}  →  {a:2, b:1}   dropped = 1
///   {c:1} ⊕ {a:2, b:1}  →  {c:1, a:2}   dropped = 1
/// ```
///
/// Below the cap, combination is exact, associative and commutative.
///
/// Missing values are tallied separately in [#naCount()].
public final class FrequencyAccumulator implements Combinable<FrequencyAccumulator> {

    /// Default number of distinct categories tracked per column.
    public static final int DEFAULT_CAP = 10_000;

    private final Map<String, Long> counts;
    private final long naCount;
    private final long droppedCount;
    private final int cap;

    private FrequencyAccumulator(Map<String, Long> counts, long naCount, long droppedCount, int cap) {
        this.counts = counts;
        this.naCount = naCount;
        this.droppedCount = droppedCount;
        this.cap = cap;
    }

    /// Returns an empty table with the given cap.
    ///
    /// @param cap maximum number of distinct categories, at least 1
    /// @return the empty table
    public static FrequencyAccumulator empty(int cap) {
        checkCap(cap);
        return new FrequencyAccumulator(Collections.emptyMap(), 0, 0, cap);
    }

    /// Tabulates a sequence of observations; null is missing.
    ///
    /// @param values the observations in partition order
    /// @param cap maximum number of distinct categories
    /// @return the local frequency table
    public static FrequencyAccumulator tabulate(Iterable<String> values, int cap) {
        Objects.requireNonNull(values, "values cannot be null");
        checkCap(cap);
        Map<String, Long> counts = new LinkedHashMap<>();
        long na = 0;
        long dropped = 0;
        for (String value : values) {
            if (value == null) {
                na++;
            } else if (counts.containsKey(value) || counts.size() < cap) {
                counts.merge(value, 1L, Long::sum);
            } else {
                dropped++;
            }
        }
        return new FrequencyAccumulator(Collections.unmodifiableMap(counts), na, dropped, cap);
    }

    /// Creates a table from known counts, applying the cap in iteration order.
    ///
    /// @param counts category counts
    /// @param naCount number of missing observations
    /// @param cap maximum number of distinct categories
    /// @return the table
    public static FrequencyAccumulator of(Map<String, Long> counts, long naCount, int cap) {
        Objects.requireNonNull(counts, "counts cannot be null");
        if (naCount < 0) {
            throw new IllegalArgumentException("naCount must be non-negative, got: " + naCount);
        }
        return empty(cap).combine(new FrequencyAccumulator(new LinkedHashMap<>(counts), naCount, 0, Integer.MAX_VALUE));
    }

    /// Returns a buffer that merges tables into one working map.
    ///
    /// @param cap maximum number of distinct categories
    /// @return an empty buffer
    public static Buffer buffer(int cap) {
        checkCap(cap);
        return new Buffer(cap);
    }

    private static void checkCap(int cap) {
        if (cap < 1) {
            throw new IllegalArgumentException("cap must be at least 1, got: " + cap);
        }
    }

    /// Returns the retained category counts in insertion order.
    ///
    /// @return an unmodifiable view of the counts
    public Map<String, Long> counts() {
        return counts;
    }

    public long naCount() {
        return naCount;
    }

    /// Returns the number of observations whose category was dropped because of the cap.
    ///
    /// @return dropped observation count
    public long droppedCount() {
        return droppedCount;
    }

    public int cap() {
        return cap;
    }

    public int distinctCount() {
        return counts.size();
    }

    /// Returns the sum of retained category counts.
    ///
    /// @return Σ counts
    public long totalCount() {
        long total = 0;
        for (long c : counts.values()) {
            total += c;
        }
        return total;
    }

    /// Returns true if some category has been dropped.
    ///
    /// @return true when the table is known to be truncated
    public boolean isTruncated() {
        return droppedCount > 0;
    }

    @Override
    public boolean isEmpty() {
        return counts.isEmpty() && naCount == 0 && droppedCount == 0;
    }

    /// Merges another table into a new one, keeping this table's cap.
    ///
    /// Shared categories are summed; unseen categories are inserted only while
    /// fewer than `cap` are tracked.
    ///
    /// @param other the table to merge
    /// @return the merged table
    @Override
    public FrequencyAccumulator combine(FrequencyAccumulator other) {
        Objects.requireNonNull(other, "other cannot be null");
        if (other.isEmpty()) {
            return this;
        }
        Map<String, Long> merged = new LinkedHashMap<>(this.counts);
        long dropped = this.droppedCount + other.droppedCount;
        for (Map.Entry<String, Long> entry : other.counts.entrySet()) {
            String category = entry.getKey();
            long count = entry.getValue();
            if (merged.containsKey(category)) {
                merged.merge(category, count, Long::sum);
            } else if (merged.size() < cap) {
                merged.put(category, count);
            } else {
                dropped += count;
            }
        }
        return new FrequencyAccumulator(Collections.unmodifiableMap(merged),
            this.naCount + other.naCount, dropped, cap);
    }

    /// Working frequency table with the same cap rule as [#combine(FrequencyAccumulator)];
    /// see [CombineBuffer].
    public static final class Buffer implements CombineBuffer<FrequencyAccumulator> {

        private final Map<String, Long> counts = new LinkedHashMap<>();
        private final int cap;
        private long naCount;
        private long droppedCount;

        private Buffer(int cap) {
            this.cap = cap;
        }

        @Override
        public void add(FrequencyAccumulator partial) {
            naCount += partial.naCount;
            droppedCount += partial.droppedCount;
            for (Map.Entry<String, Long> entry : partial.counts.entrySet()) {
                String category = entry.getKey();
                long count = entry.getValue();
                if (counts.containsKey(category)) {
                    counts.merge(category, count, Long::sum);
                } else if (counts.size() < cap) {
                    counts.put(category, count);
                } else {
                    droppedCount += count;
                }
            }
        }

        @Override
        public FrequencyAccumulator build() {
            if (counts.isEmpty() && naCount == 0 && droppedCount == 0) {
                return empty(cap);
            }
            return new FrequencyAccumulator(Collections.unmodifiableMap(new LinkedHashMap<>(counts)),
                naCount, droppedCount, cap);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrequencyAccumulator)) return false;
        FrequencyAccumulator that = (FrequencyAccumulator) o;
        return naCount == that.naCount
            && droppedCount == that.droppedCount
            && cap == that.cap
            && counts.equals(that.counts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(counts, naCount, droppedCount, cap);
    }

    @Override
    public String toString() {
        return "FrequencyAccumulator[distinct=" + counts.size() + ", na=" + naCount
            + ", dropped=" + droppedCount + ", cap=" + cap + "]";
    }
}

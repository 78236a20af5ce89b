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

import java.util.Arrays;
import java.util.Objects;

/// Immutable pool of per-partition scalar values (partition sizes, row counts).
///
/// The pool holds one value per partition, so its size is bounded by the number of
/// partitions rather than the number of rows and it is kept in full. Combination is
/// concatenation; the pool is treated as a multiset, and [#percentiles(double)] is
/// independent of concatenation order.
public final class ValuePool implements Combinable<ValuePool> {

    private static final ValuePool EMPTY = new ValuePool(new double[0]);

    private final double[] values;

    private ValuePool(double[] values) {
        this.values = values;
    }

    public static ValuePool empty() {
        return EMPTY;
    }

    /// Creates a pool from values; `NaN` marks a missing measurement.
    ///
    /// @param values the values
    /// @return the pool
    public static ValuePool of(double... values) {
        Objects.requireNonNull(values, "values cannot be null");
        return values.length == 0 ? EMPTY : new ValuePool(values.clone());
    }

    /// Returns a buffer that appends values in place.
    ///
    /// @return an empty buffer
    public static Buffer buffer() {
        return new Buffer();
    }

    public int size() {
        return values.length;
    }

    /// Returns a copy of the pooled values in pool order.
    ///
    /// @return the values
    public double[] values() {
        return values.clone();
    }

    @Override
    public boolean isEmpty() {
        return values.length == 0;
    }

    @Override
    public ValuePool combine(ValuePool other) {
        Objects.requireNonNull(other, "other cannot be null");
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        double[] merged = Arrays.copyOf(values, values.length + other.values.length);
        System.arraycopy(other.values, 0, merged, values.length, other.values.length);
        return new ValuePool(merged);
    }

    /// Estimates the percentile table of the pooled values, ignoring missing values.
    ///
    /// @param step probability increment, for example `0.01`
    /// @return the percentile table
    public PercentileTable percentiles(double step) {
        return PercentileTable.estimate(values, step);
    }

    /// Growable value array; see [CombineBuffer].
    public static final class Buffer implements CombineBuffer<ValuePool> {

        private double[] values = new double[16];
        private int size;

        private Buffer() {
        }

        @Override
        public void add(ValuePool partial) {
            int needed = size + partial.values.length;
            if (needed > values.length) {
                values = Arrays.copyOf(values, Math.max(needed, values.length * 2));
            }
            System.arraycopy(partial.values, 0, values, size, partial.values.length);
            size = needed;
        }

        @Override
        public ValuePool build() {
            return size == 0 ? EMPTY : new ValuePool(Arrays.copyOf(values, size));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValuePool)) return false;
        return Arrays.equals(values, ((ValuePool) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ValuePool[size=" + values.length + "]";
    }
}

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

/// Quantile table at evenly spaced probabilities from 0 to 1.
///
/// # Estimation
///
/// Values are sorted and each probability `p` is mapped to a linear interpolation
/// between order statistics (Hyndman and Fan type 7):
///
/// ```text
///   h  = (n - 1) * p
///   lo = floor(h)
///   q(p) = x[lo] + (h - lo) * (x[lo + 1] - x[lo])
/// ```
///
/// With the default step of `0.01` the table has 101 points, `p = 0.00 … 1.00`.
/// The estimate is exact over the pool, no sampling is involved.
///
/// Missing (`NaN`) values are removed first. An empty pool produces a table of
/// `NaN` values with the same probabilities.
public final class PercentileTable {

    /// Default probability increment.
    public static final double DEFAULT_STEP = 0.01;

    private final double[] probabilities;
    private final double[] values;

    private PercentileTable(double[] probabilities, double[] values) {
        this.probabilities = probabilities;
        this.values = values;
    }

    /// Estimates a percentile table.
    ///
    /// @param pool the values, `NaN` entries are ignored
    /// @param step probability increment; `1 / step` must be a whole number
    /// @return the table
    public static PercentileTable estimate(double[] pool, double step) {
        Objects.requireNonNull(pool, "pool cannot be null");
        int intervals = intervalsFor(step);

        double[] sorted = Arrays.stream(pool).filter(v -> !Double.isNaN(v)).sorted().toArray();
        double[] probabilities = new double[intervals + 1];
        double[] values = new double[intervals + 1];

        for (int i = 0; i <= intervals; i++) {
            double p = (double) i / intervals;
            probabilities[i] = p;
            values[i] = quantile(sorted, p);
            // interpolation rounding must not break monotonicity
            if (i > 0 && values[i] < values[i - 1]) {
                values[i] = values[i - 1];
            }
        }
        return new PercentileTable(probabilities, values);
    }

    /// Estimates a percentile table at the default step.
    ///
    /// @param pool the values
    /// @return the 101-point table
    public static PercentileTable estimate(double[] pool) {
        return estimate(pool, DEFAULT_STEP);
    }

    /// Returns the number of intervals for a probability step, validating it.
    ///
    /// @param step probability increment
    /// @return `1 / step`
    /// @throws IllegalArgumentException if the step is outside (0, 1] or does not divide 1
    public static int intervalsFor(double step) {
        if (!(step > 0 && step <= 1)) {
            throw new IllegalArgumentException("step must be in (0, 1], got: " + step);
        }
        double intervals = 1.0 / step;
        long rounded = Math.round(intervals);
        if (Math.abs(intervals - rounded) > 1e-9) {
            throw new IllegalArgumentException("1 / step must be a whole number, got step: " + step);
        }
        return (int) rounded;
    }

    private static double quantile(double[] sorted, double p) {
        int n = sorted.length;
        if (n == 0) {
            return Double.NaN;
        }
        double h = (n - 1) * p;
        int lo = (int) Math.floor(h);
        if (lo >= n - 1) {
            return sorted[n - 1];
        }
        double fraction = h - lo;
        return sorted[lo] + fraction * (sorted[lo + 1] - sorted[lo]);
    }

    public int size() {
        return values.length;
    }

    public double probability(int index) {
        return probabilities[index];
    }

    public double value(int index) {
        return values[index];
    }

    /// Returns a copy of the probabilities.
    ///
    /// @return probabilities in increasing order
    public double[] probabilities() {
        return probabilities.clone();
    }

    /// Returns a copy of the quantile values.
    ///
    /// @return values, non-decreasing
    public double[] values() {
        return values.clone();
    }

    /// Looks up the value at a tabulated probability.
    ///
    /// @param probability one of the tabulated probabilities
    /// @return the value
    /// @throws IllegalArgumentException if the probability is not tabulated
    public double valueAt(double probability) {
        for (int i = 0; i < probabilities.length; i++) {
            if (Math.abs(probabilities[i] - probability) < 1e-9) {
                return values[i];
            }
        }
        throw new IllegalArgumentException("probability " + probability + " is not in the table");
    }

    public double min() {
        return values[0];
    }

    public double median() {
        return valueAt(0.5);
    }

    public double max() {
        return values[values.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PercentileTable)) return false;
        PercentileTable that = (PercentileTable) o;
        return Arrays.equals(probabilities, that.probabilities) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(probabilities) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return String.format("PercentileTable[points=%d, min=%s, max=%s]", values.length, min(), max());
    }
}

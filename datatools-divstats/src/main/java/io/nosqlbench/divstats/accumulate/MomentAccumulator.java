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

import java.util.Objects;

/// Immutable central-moment sums `(n, mean, M2, M3, M4)` for one numeric column.
///
/// # Local accumulation
///
/// Within a partition, values are folded with the extended Welford update through
/// a single-threaded [Builder]:
///
/// ```text
///   For each new value x:
///
///     n = n + 1
///     delta = x - mean
///     deltaN = delta / n
///     term1 = delta * deltaN * (n - 1)
///
///     mean = mean + deltaN
///     M4 += term1 * deltaN² * (n² - 3n + 3) + 6*deltaN²*M2 - 4*deltaN*M3
///     M3 += term1 * deltaN * (n - 2) - 3*deltaN*M2
///     M2 += term1
/// ```
///
/// # Combination
///
/// Partitions are merged with the pairwise update of Bennett et al. (2009):
///
/// ```text
/// n = nA + nB
/// δ = meanB - meanA
/// mean = meanA + δ * nB / n
///
/// M2 = M2A + M2B + δ² * nA * nB / n
/// M3 = M3A + M3B + δ³ * nA * nB * (nA - nB) / n²
///      + 3 * δ * (nA * M2B - nB * M2A) / n
/// M4 = M4A + M4B + δ⁴ * nA * nB * (nA² - nA*nB + nB²) / n³
///      + 6 * δ² * (nA² * M2B + nB² * M2A) / n²
///      + 4 * δ * (nA * M3B - nB * M3A) / n
/// ```
///
/// An accumulator with `n = 0` is the identity: combining with it returns the other operand.
///
/// @see MomentStatistics
public final class MomentAccumulator implements Combinable<MomentAccumulator> {

    private static final MomentAccumulator EMPTY = new MomentAccumulator(0, 0, 0, 0, 0);

    private final long count;
    private final double mean;
    private final double m2;
    private final double m3;
    private final double m4;

    /// Creates an accumulator from raw moment sums.
    ///
    /// @param count number of observations, never negative
    /// @param mean mean of the observations
    /// @param m2 sum of squared deviations
    /// @param m3 sum of cubed deviations
    /// @param m4 sum of fourth-power deviations
    public MomentAccumulator(long count, double mean, double m2, double m3, double m4) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + count);
        }
        this.count = count;
        this.mean = count == 0 ? 0 : mean;
        this.m2 = count == 0 ? 0 : m2;
        this.m3 = count == 0 ? 0 : m3;
        this.m4 = count == 0 ? 0 : m4;
    }

    /// Returns the identity accumulator.
    ///
    /// @return an accumulator with no observations
    public static MomentAccumulator empty() {
        return EMPTY;
    }

    /// Computes moments over the given values in one pass, skipping `NaN`.
    ///
    /// @param values the observations
    /// @return the accumulated moments
    public static MomentAccumulator of(double... values) {
        Objects.requireNonNull(values, "values cannot be null");
        Builder builder = builder();
        for (double value : values) {
            builder.accept(value);
        }
        return builder.build();
    }

    /// Starts a single-threaded Welford accumulation.
    ///
    /// @return a new builder
    public static Builder builder() {
        return new Builder();
    }

    public long count() {
        return count;
    }

    public double mean() {
        return mean;
    }

    public double m2() {
        return m2;
    }

    public double m3() {
        return m3;
    }

    public double m4() {
        return m4;
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    @Override
    public MomentAccumulator combine(MomentAccumulator other) {
        Objects.requireNonNull(other, "other cannot be null");
        if (other.count == 0) {
            return this;
        }
        if (this.count == 0) {
            return other;
        }

        double nA = this.count;
        double nB = other.count;
        double n = nA + nB;

        double delta = other.mean - this.mean;
        double delta2 = delta * delta;
        double delta3 = delta2 * delta;
        double delta4 = delta2 * delta2;

        double combinedMean = this.mean + delta * nB / n;

        double combinedM2 = this.m2 + other.m2 + delta2 * nA * nB / n;

        double combinedM3 = this.m3 + other.m3
            + delta3 * nA * nB * (nA - nB) / (n * n)
            + 3.0 * delta * (nA * other.m2 - nB * this.m2) / n;

        double combinedM4 = this.m4 + other.m4
            + delta4 * nA * nB * (nA * nA - nA * nB + nB * nB) / (n * n * n)
            + 6.0 * delta2 * (nA * nA * other.m2 + nB * nB * this.m2) / (n * n)
            + 4.0 * delta * (nA * other.m3 - nB * this.m3) / n;

        return new MomentAccumulator(this.count + other.count, combinedMean, combinedM2, combinedM3, combinedM4);
    }

    /// Converts the moment sums into reportable statistics.
    ///
    /// - `variance = M2 / (n - 1)`, `NaN` when `n < 2`
    /// - `skewness = √n · M3 / M2^1.5`, `NaN` when `M2 = 0`
    /// - `kurtosis = n · M4 / M2² - 3` (excess), `NaN` when `M2 = 0`
    ///
    /// @return the finalized statistics
    public MomentStatistics toStatistics() {
        if (count == 0) {
            return MomentStatistics.undefined();
        }
        double n = count;
        double variance = count < 2 ? Double.NaN : m2 / (n - 1);
        double skewness = Double.NaN;
        double kurtosis = Double.NaN;
        if (m2 > 0) {
            skewness = Math.sqrt(n) * m3 / Math.pow(m2, 1.5);
            kurtosis = n * m4 / (m2 * m2) - 3.0;
        }
        return new MomentStatistics(count, mean, variance, skewness, kurtosis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MomentAccumulator)) return false;
        MomentAccumulator that = (MomentAccumulator) o;
        return count == that.count
            && Double.compare(that.mean, mean) == 0
            && Double.compare(that.m2, m2) == 0
            && Double.compare(that.m3, m3) == 0
            && Double.compare(that.m4, m4) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, mean, m2, m3, m4);
    }

    @Override
    public String toString() {
        return String.format("MomentAccumulator[n=%d, mean=%.6g, M2=%.6g, M3=%.6g, M4=%.6g]",
            count, mean, m2, m3, m4);
    }

    /// Single-threaded Welford accumulator used while scanning one partition.
    ///
    /// Not thread-safe. Each builder belongs to one partition scan.
    public static final class Builder {

        private long count = 0;
        private double mean = 0;
        private double m2 = 0;
        private double m3 = 0;
        private double m4 = 0;

        private Builder() {
        }

        /// Accepts one observation; `NaN` is treated as missing and ignored.
        ///
        /// @param value the observation
        /// @return this builder
        public Builder accept(double value) {
            if (Double.isNaN(value)) {
                return this;
            }
            count++;
            double n = count;
            double delta = value - mean;
            double deltaN = delta / n;
            double deltaN2 = deltaN * deltaN;
            double term1 = delta * deltaN * (n - 1);

            mean += deltaN;

            // M4 before M3 before M2, each uses the previous values of the lower moments
            m4 += term1 * deltaN2 * (n * n - 3 * n + 3) + 6 * deltaN2 * m2 - 4 * deltaN * m3;
            m3 += term1 * deltaN * (n - 2) - 3 * deltaN * m2;
            m2 += term1;
            return this;
        }

        public long count() {
            return count;
        }

        /// Freezes the accumulated moments.
        ///
        /// @return an immutable accumulator
        public MomentAccumulator build() {
            return count == 0 ? EMPTY : new MomentAccumulator(count, mean, m2, m3, m4);
        }
    }
}

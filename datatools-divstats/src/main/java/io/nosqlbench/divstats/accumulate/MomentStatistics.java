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

/// Reportable statistics derived from a [MomentAccumulator].
///
/// Undefined values are `NaN`: `variance` when fewer than two observations,
/// `skewness` and `kurtosis` when all observations are equal.
///
/// @param count number of non-missing observations
/// @param mean arithmetic mean
/// @param variance sample variance, `M2 / (n - 1)`
/// @param skewness `√n · M3 / M2^1.5`
/// @param kurtosis excess kurtosis, `n · M4 / M2² - 3`
public record MomentStatistics(long count, double mean, double variance, double skewness, double kurtosis) {

    /// Statistics of a column with no non-missing values.
    ///
    /// @return all-undefined statistics with zero count
    public static MomentStatistics undefined() {
        return new MomentStatistics(0, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }

    /// Returns the sample standard deviation.
    ///
    /// @return `√variance`
    public double stdDev() {
        return Math.sqrt(variance);
    }
}

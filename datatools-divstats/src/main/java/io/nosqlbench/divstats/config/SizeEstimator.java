package io.nosqlbench.divstats.config;

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

/// Estimates the stored size of one partition value in bytes.
///
/// The estimate is platform-specific and only needs to be consistent within one
/// dataset, so it is injected rather than fixed.
@FunctionalInterface
public interface SizeEstimator {

    /// Estimates the size of a partition value.
    ///
    /// @param value the untransformed partition value
    /// @return estimated bytes, or `NaN` if unknown
    double estimateSize(Object value);
}

package io.nosqlbench.divstats.dataset;

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

/// Per-partition transformation applied to a partition before its row data is summarized.
///
/// Receives the key and value of one partition and returns the logical row-data
/// view, typically a [io.nosqlbench.divstats.frame.Frame]. Implementations must be
/// pure: the engine may call them from any worker thread.
@FunctionalInterface
public interface PartitionTransform {

    /// Transforms one partition value.
    ///
    /// @param key the partition key
    /// @param value the stored partition value
    /// @return the transformed value
    Object apply(Object key, Object value);
}

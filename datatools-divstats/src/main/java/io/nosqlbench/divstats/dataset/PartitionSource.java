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

import java.util.List;
import java.util.stream.Stream;

/// Supplies the partitions of a divided dataset to an executor.
@FunctionalInterface
public interface PartitionSource {

    /// Streams the partitions. Each call starts a new stream.
    ///
    /// @return the partitions, in no guaranteed order
    Stream<PartitionRecord> stream();

    /// Creates a source over a fixed list of partitions.
    ///
    /// @param partitions the partitions
    /// @return the source
    static PartitionSource of(List<PartitionRecord> partitions) {
        List<PartitionRecord> copy = List.copyOf(partitions);
        return copy::stream;
    }
}

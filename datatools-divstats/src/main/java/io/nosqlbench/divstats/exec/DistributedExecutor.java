package io.nosqlbench.divstats.exec;

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

import io.nosqlbench.divstats.engine.ContributionKey;

import java.util.Map;

/// Runs a map/reduce job over the partitions of a dataset.
///
/// An executor maps every partition, groups the contributions by key, folds each
/// group with the job's reducer and returns the finished values. How partitions are
/// distributed and how partial folds are merged is up to the implementation; the
/// reducer guarantees the result does not depend on it.
public interface DistributedExecutor {

    /// Executes a job.
    ///
    /// @param job the job
    /// @return finished value per contribution key, ordered by key
    /// @throws ExecutionFailedException if a map or reduce task fails
    Map<ContributionKey, Object> execute(JobSpec job);
}

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

/// Execution tuning of a job.
///
/// @param batchSize contributions buffered per key before they are folded
/// @param parallelism number of concurrent map tasks
public record ExecutionControl(int batchSize, int parallelism) {

    /// Default number of contributions per fold batch.
    public static final int DEFAULT_BATCH_SIZE = 256;

    public ExecutionControl {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got: " + batchSize);
        }
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got: " + parallelism);
        }
    }

    /// Returns the default control: 256 per batch, one task per available processor.
    ///
    /// @return the defaults
    public static ExecutionControl defaults() {
        return new ExecutionControl(DEFAULT_BATCH_SIZE, Runtime.getRuntime().availableProcessors());
    }

    public ExecutionControl withParallelism(int parallelism) {
        return new ExecutionControl(batchSize, parallelism);
    }

    public ExecutionControl withBatchSize(int batchSize) {
        return new ExecutionControl(batchSize, parallelism);
    }
}

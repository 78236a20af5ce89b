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

import io.nosqlbench.divstats.engine.PartitionMapper;

/// Creates the map stage of a job from the job's [JobParameters].
///
/// Executors call the factory once per worker, after the worker's setup has run.
@FunctionalInterface
public interface MapperFactory {

    /// Creates the mapper for one worker.
    ///
    /// @param parameters the parameters shipped with the job
    /// @return the mapper this worker uses for every partition it maps
    PartitionMapper create(JobParameters parameters);
}

package io.nosqlbench.divstats.engine;

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

/// The reduce stage: opens a combine state for each contribution key.
@FunctionalInterface
public interface ContributionReducer {

    /// Opens an empty combine state.
    ///
    /// @param key the contribution key
    /// @return a fold positioned at the combine identity
    ReduceFold open(ContributionKey key);
}

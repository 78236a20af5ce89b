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

/// Receives the keyed contributions emitted while mapping one partition.
@FunctionalInterface
public interface ContributionCollector {

    /// Emits one contribution.
    ///
    /// @param key the routing key
    /// @param value the local partial aggregate
    void collect(ContributionKey key, Object value);
}

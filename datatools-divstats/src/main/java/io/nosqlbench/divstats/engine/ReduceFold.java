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

import java.util.Collection;

/// Combine state of one contribution key.
///
/// A fold is confined to the thread that uses it. Contributions may arrive in any
/// number of batches and in any order, and independent folds of the same key may be
/// merged; the finished value does not depend on either.
public interface ReduceFold {

    ContributionKey key();

    /// Folds a batch of contributions into this state.
    ///
    /// @param batch local contributions of this fold's key
    /// @throws IllegalArgumentException if a contribution has the wrong type
    void fold(Collection<?> batch);

    /// Merges another fold of the same key into this one.
    ///
    /// @param other a fold opened by the same reducer for the same key
    void merge(ReduceFold other);

    /// Finalizes the state into its reportable value.
    ///
    /// @return the finished value
    Object finish();
}

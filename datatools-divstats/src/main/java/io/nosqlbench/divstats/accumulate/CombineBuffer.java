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

import java.util.Objects;

/// Mutable, single-threaded accumulation of many partials into one.
///
/// Adding partials `p1, p2, … pn` to a buffer and calling [#build()] yields the same
/// value as `identity.combine(p1).combine(p2)…combine(pn)`. Growable aggregates
/// ([KeyList], [ValuePool], [FrequencyAccumulator]) supply buffers that append in
/// place, so a long fold costs time linear in the number of partials rather than
/// rebuilding the accumulated state on every step.
///
/// A buffer is not thread-safe. [#build()] may be called more than once; later
/// additions do not affect values already built.
///
/// @param <P> the aggregate type
public interface CombineBuffer<P extends Combinable<P>> {

    /// Adds one partial to the buffer.
    ///
    /// @param partial the partial, never null
    void add(P partial);

    /// Returns the immutable aggregate of everything added so far.
    ///
    /// @return the aggregate
    P build();

    /// Returns a buffer that combines each partial as it arrives.
    ///
    /// Suited to aggregates of constant size, for which a combine is already cheap.
    ///
    /// @param identity the starting value
    /// @param <P> the aggregate type
    /// @return the buffer
    static <P extends Combinable<P>> CombineBuffer<P> folding(P identity) {
        Objects.requireNonNull(identity, "identity cannot be null");
        return new CombineBuffer<>() {
            private P state = identity;

            @Override
            public void add(P partial) {
                state = state.combine(Objects.requireNonNull(partial, "partial cannot be null"));
            }

            @Override
            public P build() {
                return state;
            }
        };
    }
}

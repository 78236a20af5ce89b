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

/// A partial aggregate that can be merged with another partial aggregate of the same kind.
///
/// # Contract
///
/// Implementations are immutable. [#combine(Combinable)] never modifies either operand;
/// it returns a new instance (or one of the operands, when the other is empty).
///
/// ```text
///   combine(A, combine(B, C)) ≈ combine(combine(A, B), C)     associativity
///   combine(A, B)             ≈ combine(B, A)                 commutativity
///   combine(A, empty)         = A                             identity
/// ```
///
/// The `≈` allows for floating-point rounding. [FrequencyAccumulator] is the one
/// exception to commutativity once its category cap binds; see its documentation.
///
/// @param <P> the concrete aggregate type
public interface Combinable<P extends Combinable<P>> {

    /// Merges this partial aggregate with another.
    ///
    /// @param other the aggregate to merge with
    /// @return the merged aggregate
    P combine(P other);

    /// Returns true if this aggregate has observed nothing and acts as the identity.
    ///
    /// @return true when empty
    boolean isEmpty();
}

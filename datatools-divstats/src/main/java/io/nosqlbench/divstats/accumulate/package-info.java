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

/// # Accumulator Primitives
///
/// Immutable partial aggregates for the four statistic families used when
/// summarizing a divided dataset. Each one is [Combinable]: partial results from
/// any number of partitions can be merged pairwise, in a tree, or sequentially,
/// and give the same answer.
///
/// | Class | Family | Finalized form |
/// |-------|--------|----------------|
/// | [MomentAccumulator] | running moments | [MomentStatistics] |
/// | [RangeAccumulator] | min / max | bounds, possibly absent |
/// | [FrequencyAccumulator] | capped category counts | frequency table |
/// | [ValuePool] | one scalar per partition | [PercentileTable] |
/// | [ScalarSum] | summed measurements | total |
/// | [Count] | partitions, rows | total |
/// | [KeyList] | partition keys | key list |
///
/// ```text
///   partition 1 ──► local accumulator ─┐
///   partition 2 ──► local accumulator ─┼──► combine ──► combine ──► finalize
///   partition 3 ──► local accumulator ─┘
/// ```
package io.nosqlbench.divstats.accumulate;

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
import java.util.Optional;

/// Immutable observed `[min, max]` range over comparable values.
///
/// Both bounds are absent until a non-missing value has been observed, so a range
/// built from an all-missing column stays empty and acts as the combine identity.
///
/// @param <T> the value type, for example [Double] or [java.time.Instant]
public final class RangeAccumulator<T extends Comparable<? super T>> implements Combinable<RangeAccumulator<T>> {

    private static final RangeAccumulator<?> EMPTY = new RangeAccumulator<>(null, null);

    private final T min;
    private final T max;

    private RangeAccumulator(T min, T max) {
        this.min = min;
        this.max = max;
    }

    /// Returns the empty range.
    ///
    /// @param <T> the value type
    /// @return a range with both bounds absent
    @SuppressWarnings("unchecked")
    public static <T extends Comparable<? super T>> RangeAccumulator<T> empty() {
        return (RangeAccumulator<T>) EMPTY;
    }

    /// Creates a range from known bounds.
    ///
    /// @param min the lower bound
    /// @param max the upper bound
    /// @param <T> the value type
    /// @return the range
    /// @throws IllegalArgumentException if `min > max`
    public static <T extends Comparable<? super T>> RangeAccumulator<T> of(T min, T max) {
        Objects.requireNonNull(min, "min cannot be null");
        Objects.requireNonNull(max, "max cannot be null");
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("min " + min + " is greater than max " + max);
        }
        return new RangeAccumulator<>(min, max);
    }

    /// Computes the range of the non-null values.
    ///
    /// @param values the observations, nulls are missing
    /// @param <T> the value type
    /// @return the observed range, empty if every value is null
    public static <T extends Comparable<? super T>> RangeAccumulator<T> over(Iterable<? extends T> values) {
        Objects.requireNonNull(values, "values cannot be null");
        T min = null;
        T max = null;
        for (T value : values) {
            if (value == null) {
                continue;
            }
            if (min == null || value.compareTo(min) < 0) min = value;
            if (max == null || value.compareTo(max) > 0) max = value;
        }
        return min == null ? empty() : new RangeAccumulator<>(min, max);
    }

    public Optional<T> min() {
        return Optional.ofNullable(min);
    }

    public Optional<T> max() {
        return Optional.ofNullable(max);
    }

    @Override
    public boolean isEmpty() {
        return min == null;
    }

    @Override
    public RangeAccumulator<T> combine(RangeAccumulator<T> other) {
        Objects.requireNonNull(other, "other cannot be null");
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        T lo = other.min.compareTo(this.min) < 0 ? other.min : this.min;
        T hi = other.max.compareTo(this.max) > 0 ? other.max : this.max;
        if (lo == this.min && hi == this.max) {
            return this;
        }
        return new RangeAccumulator<>(lo, hi);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RangeAccumulator)) return false;
        RangeAccumulator<?> that = (RangeAccumulator<?>) o;
        return Objects.equals(min, that.min) && Objects.equals(max, that.max);
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return isEmpty() ? "RangeAccumulator[empty]" : "RangeAccumulator[" + min + ", " + max + "]";
    }
}

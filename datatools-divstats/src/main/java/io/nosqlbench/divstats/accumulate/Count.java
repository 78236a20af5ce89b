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

/// Immutable non-negative count, such as partitions or rows.
public final class Count implements Combinable<Count> {

    private static final Count ZERO = new Count(0);

    private final long value;

    private Count(long value) {
        this.value = value;
    }

    public static Count zero() {
        return ZERO;
    }

    /// Creates a count.
    ///
    /// @param value the count
    /// @return the count
    /// @throws IllegalArgumentException if the value is negative
    public static Count of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("count must be non-negative, got: " + value);
        }
        return value == 0 ? ZERO : new Count(value);
    }

    public long value() {
        return value;
    }

    /// A zero count; adding it changes nothing.
    @Override
    public boolean isEmpty() {
        return value == 0;
    }

    @Override
    public Count combine(Count other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        return new Count(Math.addExact(value, other.value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Count)) return false;
        return value == ((Count) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return "Count[" + value + "]";
    }
}

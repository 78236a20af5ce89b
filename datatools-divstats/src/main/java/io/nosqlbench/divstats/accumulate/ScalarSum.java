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

/// Immutable running sum of partition measurements, such as estimated sizes.
///
/// The sum of nothing is `0.0`, which is also the combine identity.
public final class ScalarSum implements Combinable<ScalarSum> {

    private static final ScalarSum ZERO = new ScalarSum(0.0, 0);

    private final double sum;
    private final long terms;

    private ScalarSum(double sum, long terms) {
        this.sum = sum;
        this.terms = terms;
    }

    public static ScalarSum zero() {
        return ZERO;
    }

    public static ScalarSum of(double value) {
        return new ScalarSum(value, 1);
    }

    public double sum() {
        return sum;
    }

    /// @return number of measurements summed
    public long terms() {
        return terms;
    }

    @Override
    public boolean isEmpty() {
        return terms == 0;
    }

    @Override
    public ScalarSum combine(ScalarSum other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        return new ScalarSum(sum + other.sum, terms + other.terms);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScalarSum)) return false;
        ScalarSum that = (ScalarSum) o;
        return Double.compare(sum, that.sum) == 0 && terms == that.terms;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(sum) + Long.hashCode(terms);
    }

    @Override
    public String toString() {
        return "ScalarSum[" + sum + ", terms=" + terms + "]";
    }
}

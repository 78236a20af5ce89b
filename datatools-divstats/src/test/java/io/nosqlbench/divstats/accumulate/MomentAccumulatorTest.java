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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/// Moment accumulation and pairwise merging.
@Tag("unit")
public class MomentAccumulatorTest {

    private static final double TOLERANCE = 1e-10;

    @Test
    void combine_twoPartitionsMatchesKnownStatistics() {
        MomentAccumulator a = MomentAccumulator.of(1, 2, 3);
        MomentAccumulator b = MomentAccumulator.of(4, 5);

        MomentStatistics stats = a.combine(b).toStatistics();

        assertEquals(5, stats.count());
        assertEquals(3.0, stats.mean(), TOLERANCE);
        assertEquals(2.5, stats.variance(), TOLERANCE);
        assertEquals(0.0, stats.skewness(), TOLERANCE);
        assertEquals(-1.3, stats.kurtosis(), TOLERANCE);
    }

    @Test
    void combine_equivalentToSinglePass() {
        Random rng = new Random(42L);
        double[] data = new double[5000];
        for (int i = 0; i < data.length; i++) {
            data[i] = rng.nextGaussian() * 3 + 7 + (rng.nextDouble() < 0.1 ? rng.nextDouble() * 40 : 0);
        }
        double[] first = new double[1234];
        double[] second = new double[data.length - first.length];
        System.arraycopy(data, 0, first, 0, first.length);
        System.arraycopy(data, first.length, second, 0, second.length);

        MomentStatistics sequential = MomentAccumulator.of(data).toStatistics();
        MomentStatistics combined = MomentAccumulator.of(first).combine(MomentAccumulator.of(second)).toStatistics();

        assertEquals(sequential.count(), combined.count());
        assertEquals(sequential.mean(), combined.mean(), TOLERANCE);
        assertEquals(sequential.variance(), combined.variance(), 1e-9);
        assertEquals(sequential.skewness(), combined.skewness(), 1e-8);
        assertEquals(sequential.kurtosis(), combined.kurtosis(), 1e-6);
    }

    @Test
    void combine_isAssociativeAndCommutative() {
        Random rng = new Random(7L);
        MomentAccumulator a = MomentAccumulator.of(randomData(rng, 100));
        MomentAccumulator b = MomentAccumulator.of(randomData(rng, 250));
        MomentAccumulator c = MomentAccumulator.of(randomData(rng, 17));

        MomentStatistics left = a.combine(b.combine(c)).toStatistics();
        MomentStatistics right = a.combine(b).combine(c).toStatistics();
        MomentStatistics swapped = c.combine(a).combine(b).toStatistics();

        for (MomentStatistics other : new MomentStatistics[]{right, swapped}) {
            assertEquals(left.count(), other.count());
            assertEquals(left.mean(), other.mean(), TOLERANCE);
            assertEquals(left.variance(), other.variance(), TOLERANCE);
            assertEquals(left.skewness(), other.skewness(), 1e-8);
            assertEquals(left.kurtosis(), other.kurtosis(), 1e-6);
        }
    }

    @Test
    void empty_isIdentity() {
        MomentAccumulator a = MomentAccumulator.of(3, 9, 27);

        assertSame(a, a.combine(MomentAccumulator.empty()));
        assertSame(a, MomentAccumulator.empty().combine(a));
        assertTrue(MomentAccumulator.empty().combine(MomentAccumulator.empty()).isEmpty());
    }

    @Test
    void of_skipsMissingValues() {
        MomentAccumulator acc = MomentAccumulator.of(1, Double.NaN, 3, Double.NaN);

        assertEquals(2, acc.count());
        assertEquals(2.0, acc.mean(), TOLERANCE);
        assertTrue(MomentAccumulator.of(Double.NaN, Double.NaN).isEmpty());
    }

    @Test
    void toStatistics_undefinedValuesAreNaN() {
        MomentStatistics none = MomentAccumulator.empty().toStatistics();
        assertEquals(0, none.count());
        assertTrue(Double.isNaN(none.mean()));
        assertTrue(Double.isNaN(none.variance()));

        MomentStatistics single = MomentAccumulator.of(4).toStatistics();
        assertEquals(4.0, single.mean(), TOLERANCE);
        assertTrue(Double.isNaN(single.variance()));
        assertTrue(Double.isNaN(single.skewness()));

        MomentStatistics constant = MomentAccumulator.of(2, 2, 2).toStatistics();
        assertEquals(0.0, constant.variance(), TOLERANCE);
        assertTrue(Double.isNaN(constant.skewness()));
        assertTrue(Double.isNaN(constant.kurtosis()));
    }

    @Test
    void combine_stableWithLargeOffset() {
        double offset = 1e9;
        MomentAccumulator a = MomentAccumulator.of(offset + 4, offset + 7);
        MomentAccumulator b = MomentAccumulator.of(offset + 13, offset + 16);

        MomentStatistics stats = a.combine(b).toStatistics();

        assertEquals(offset + 10, stats.mean(), 1e-6);
        assertEquals(30.0, stats.variance(), 1e-6);
        assertEquals(0.0, stats.skewness(), 1e-6);
    }

    @Test
    void builder_matchesVarargsFactory() {
        MomentAccumulator.Builder builder = MomentAccumulator.builder();
        builder.accept(1).accept(Double.NaN).accept(5).accept(9);

        assertEquals(3, builder.count());
        assertEquals(MomentAccumulator.of(1, 5, 9), builder.build());
    }

    @Test
    void constructor_rejectsNegativeCount() {
        assertThrows(IllegalArgumentException.class, () -> new MomentAccumulator(-1, 0, 0, 0, 0));
    }

    private static double[] randomData(Random rng, int size) {
        double[] data = new double[size];
        for (int i = 0; i < size; i++) {
            data[i] = rng.nextDouble() * 100 - 20;
        }
        return data;
    }
}

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

import java.time.Instant;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RangeAccumulatorTest {

    @Test
    void combine_takesOuterBounds() {
        RangeAccumulator<Double> a = RangeAccumulator.of(2.0, 5.0);
        RangeAccumulator<Double> b = RangeAccumulator.of(-1.0, 3.0);

        RangeAccumulator<Double> combined = a.combine(b);

        assertEquals(Optional.of(-1.0), combined.min());
        assertEquals(Optional.of(5.0), combined.max());
        assertEquals(combined, b.combine(a));
    }

    @Test
    void empty_isIdentityAndHasNoBounds() {
        RangeAccumulator<Double> a = RangeAccumulator.of(1.0, 2.0);
        RangeAccumulator<Double> empty = RangeAccumulator.empty();

        assertTrue(empty.min().isEmpty());
        assertTrue(empty.max().isEmpty());
        assertSame(a, a.combine(empty));
        assertSame(a, empty.combine(a));
    }

    @Test
    void over_skipsNullsAndWorksForInstants() {
        Instant early = Instant.parse("2020-01-01T00:00:00Z");
        Instant late = Instant.parse("2024-06-30T12:00:00Z");

        RangeAccumulator<Instant> range = RangeAccumulator.over(Arrays.asList(null, late, early, null));

        assertEquals(Optional.of(early), range.min());
        assertEquals(Optional.of(late), range.max());
        assertTrue(RangeAccumulator.<Instant>over(Arrays.asList(null, null)).isEmpty());
    }

    @Test
    void of_rejectsInvertedBounds() {
        assertThrows(IllegalArgumentException.class, () -> RangeAccumulator.of(3.0, 1.0));
    }
}

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

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/// Sums, counts and key lists.
@Tag("unit")
public class ScalarAccumulatorsTest {

    @Test
    void scalarSum_addsTerms() {
        ScalarSum sum = ScalarSum.of(1.5).combine(ScalarSum.of(2.5)).combine(ScalarSum.zero());

        assertEquals(4.0, sum.sum());
        assertEquals(2, sum.terms());
        assertTrue(ScalarSum.zero().isEmpty());
    }

    @Test
    void count_addsAndRejectsNegative() {
        assertEquals(15, Count.of(10).combine(Count.zero()).combine(Count.of(5)).value());
        assertSame(Count.zero(), Count.of(0));
        assertThrows(IllegalArgumentException.class, () -> Count.of(-1));
    }

    @Test
    void keyList_concatenatesInCombineOrder() {
        KeyList keys = KeyList.of("a").combine(KeyList.empty()).combine(KeyList.of(2));

        assertEquals(List.of("a", 2), keys.keys());
        assertThrows(NullPointerException.class, () -> KeyList.of(null));
    }

    @Test
    void keyListBuffer_appendsLikeCombine() {
        KeyList.Buffer buffer = KeyList.buffer();
        assertSame(KeyList.empty(), buffer.build());

        buffer.add(KeyList.of("a"));
        buffer.add(KeyList.empty());
        buffer.add(KeyList.of("b").combine(KeyList.of(3)));
        KeyList built = buffer.build();
        buffer.add(KeyList.of("late"));

        assertEquals(List.of("a", "b", 3), built.keys());
        assertThrows(UnsupportedOperationException.class, () -> built.keys().add("x"));
        assertEquals(4, buffer.build().size());
    }

    @Test
    void foldingBuffer_combinesAsPartialsArrive() {
        CombineBuffer<Count> buffer = CombineBuffer.folding(Count.zero());
        buffer.add(Count.of(2));
        buffer.add(Count.of(3));

        assertEquals(5, buffer.build().value());
        assertThrows(NullPointerException.class, () -> buffer.add(null));
    }
}

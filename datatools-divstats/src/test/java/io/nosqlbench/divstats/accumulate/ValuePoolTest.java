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

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ValuePoolTest {

    @Test
    void combine_concatenates() {
        ValuePool pool = ValuePool.of(1, 2).combine(ValuePool.of(3));

        assertEquals(3, pool.size());
        assertArrayEquals(new double[]{1, 2, 3}, pool.values());
    }

    @Test
    void percentiles_independentOfCombineOrder() {
        ValuePool a = ValuePool.of(10, 0);
        ValuePool b = ValuePool.of(5, Double.NaN);

        assertEquals(a.combine(b).percentiles(0.01), b.combine(a).percentiles(0.01));
    }

    @Test
    void empty_isIdentity() {
        ValuePool a = ValuePool.of(7);

        assertSame(a, a.combine(ValuePool.empty()));
        assertSame(a, ValuePool.empty().combine(a));
        assertTrue(ValuePool.of().isEmpty());
    }

    @Test
    void of_copiesInput() {
        double[] values = {1, 2};
        ValuePool pool = ValuePool.of(values);
        values[0] = 99;

        assertEquals(1.0, pool.values()[0]);
    }

    @Test
    void buffer_matchesCombineChain() {
        ValuePool.Buffer buffer = ValuePool.buffer();
        ValuePool chained = ValuePool.empty();
        for (int i = 0; i < 100; i++) {
            ValuePool partial = i % 7 == 0 ? ValuePool.empty() : ValuePool.of(i, Double.NaN);
            buffer.add(partial);
            chained = chained.combine(partial);
        }

        assertEquals(chained, buffer.build());
    }

    @Test
    void buffer_buildIsUnaffectedByLaterAdds() {
        ValuePool.Buffer buffer = ValuePool.buffer();
        assertSame(ValuePool.empty(), buffer.build());

        buffer.add(ValuePool.of(1, 2));
        ValuePool built = buffer.build();
        buffer.add(ValuePool.of(3));

        assertArrayEquals(new double[]{1, 2}, built.values());
        assertArrayEquals(new double[]{1, 2, 3}, buffer.build().values());
    }
}

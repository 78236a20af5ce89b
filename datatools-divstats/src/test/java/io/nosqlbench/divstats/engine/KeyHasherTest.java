package io.nosqlbench.divstats.engine;

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

@Tag("unit")
public class KeyHasherTest {

    @Test
    void hash_isMd5OfCompactJson() {
        assertEquals("6067924ae1b1832abce3d12fe83755a9", KeyHasher.hash("a"));
        assertEquals("f79408e5ca998cd53faf44af31e6eb45", KeyHasher.hash(List.of(1, 2)));
    }

    @Test
    void hash_isLowercaseHexOfFixedLength() {
        String hash = KeyHasher.hash("year=2024/month=3");
        assertEquals(32, hash.length());
        assertTrue(hash.matches("[0-9a-f]{32}"), hash);
    }

    @Test
    void hashAll_preservesOrder() {
        List<String> hashes = KeyHasher.hashAll(List.of("b", "a", "b"));

        assertEquals(3, hashes.size());
        assertEquals(KeyHasher.hash("b"), hashes.get(0));
        assertEquals(KeyHasher.hash("a"), hashes.get(1));
        assertEquals(hashes.get(0), hashes.get(2));
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Immutable concatenation of partition keys.
///
/// Combination appends, so the order of the final list follows the order in which
/// partial lists were combined. The key set is independent of that order.
public final class KeyList implements Combinable<KeyList> {

    private static final KeyList EMPTY = new KeyList(Collections.emptyList());

    private final List<Object> keys;

    private KeyList(List<Object> keys) {
        this.keys = keys;
    }

    public static KeyList empty() {
        return EMPTY;
    }

    /// Creates a list holding one partition key.
    ///
    /// @param key the key, never null
    /// @return the list
    public static KeyList of(Object key) {
        Objects.requireNonNull(key, "key cannot be null");
        return new KeyList(Collections.singletonList(key));
    }

    /// Returns a buffer that appends keys in place.
    ///
    /// @return an empty buffer
    public static Buffer buffer() {
        return new Buffer();
    }

    /// @return the keys in combination order, unmodifiable
    public List<Object> keys() {
        return keys;
    }

    public int size() {
        return keys.size();
    }

    @Override
    public boolean isEmpty() {
        return keys.isEmpty();
    }

    @Override
    public KeyList combine(KeyList other) {
        if (other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        List<Object> merged = new ArrayList<>(keys.size() + other.keys.size());
        merged.addAll(keys);
        merged.addAll(other.keys);
        return new KeyList(Collections.unmodifiableList(merged));
    }

    /// Growable key list; see [CombineBuffer].
    public static final class Buffer implements CombineBuffer<KeyList> {

        private final List<Object> keys = new ArrayList<>();

        private Buffer() {
        }

        @Override
        public void add(KeyList partial) {
            keys.addAll(partial.keys);
        }

        @Override
        public KeyList build() {
            return keys.isEmpty() ? EMPTY : new KeyList(Collections.unmodifiableList(new ArrayList<>(keys)));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyList)) return false;
        return keys.equals(((KeyList) o).keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return "KeyList[size=" + keys.size() + "]";
    }
}

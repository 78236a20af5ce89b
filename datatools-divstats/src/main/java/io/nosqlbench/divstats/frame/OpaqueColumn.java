package io.nosqlbench.divstats.frame;

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

/// Column of arbitrary objects (lists, nested records, blobs); null is missing.
///
/// Belongs to [ColumnFamily#UNSUPPORTED] and is carried through the frame
/// without being summarized.
public final class OpaqueColumn implements Column {

    private final String name;
    private final Object[] values;

    private OpaqueColumn(String name, Object[] values) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.values = values;
    }

    public static OpaqueColumn of(String name, Object... values) {
        Objects.requireNonNull(values, "values cannot be null");
        return new OpaqueColumn(name, values.clone());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ColumnFamily family() {
        return ColumnFamily.UNSUPPORTED;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isMissing(int row) {
        return values[row] == null;
    }

    public Object get(int row) {
        return values[row];
    }
}

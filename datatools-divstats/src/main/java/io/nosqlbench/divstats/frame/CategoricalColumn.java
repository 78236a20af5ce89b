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

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;

/// Categorical column backed by a `String[]`; null is the missing marker.
public final class CategoricalColumn implements Column {

    private final String name;
    private final String[] values;

    private CategoricalColumn(String name, String[] values) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.values = values;
    }

    /// Creates a column; null entries are missing.
    ///
    /// @param name column name
    /// @param values column values, copied
    /// @return the column
    public static CategoricalColumn of(String name, String... values) {
        Objects.requireNonNull(values, "values cannot be null");
        return new CategoricalColumn(name, values.clone());
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ColumnFamily family() {
        return ColumnFamily.CATEGORICAL;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isMissing(int row) {
        return values[row] == null;
    }

    public String get(int row) {
        return values[row];
    }

    /// Returns a read-only list view of the values, nulls included.
    ///
    /// @return the values
    public List<String> asList() {
        return new AbstractList<>() {
            @Override
            public String get(int index) {
                return values[index];
            }

            @Override
            public int size() {
                return values.length;
            }
        };
    }
}

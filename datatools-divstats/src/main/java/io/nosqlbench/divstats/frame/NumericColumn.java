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

/// Numeric column backed by a `double[]`; `NaN` is the missing marker.
public final class NumericColumn implements Column {

    private final String name;
    private final double[] values;

    private NumericColumn(String name, double[] values) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.values = values;
    }

    /// Creates a column; `NaN` entries are missing.
    ///
    /// @param name column name
    /// @param values column values, copied
    /// @return the column
    public static NumericColumn of(String name, double... values) {
        Objects.requireNonNull(values, "values cannot be null");
        return new NumericColumn(name, values.clone());
    }

    /// Creates a column from boxed values; null entries are missing.
    ///
    /// @param name column name
    /// @param values column values
    /// @return the column
    public static NumericColumn ofNullable(String name, Number... values) {
        Objects.requireNonNull(values, "values cannot be null");
        double[] data = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = values[i] == null ? Double.NaN : values[i].doubleValue();
        }
        return new NumericColumn(name, data);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ColumnFamily family() {
        return ColumnFamily.NUMERIC;
    }

    @Override
    public int size() {
        return values.length;
    }

    @Override
    public boolean isMissing(int row) {
        return Double.isNaN(values[row]);
    }

    public double get(int row) {
        return values[row];
    }
}

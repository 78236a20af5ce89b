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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable columnar row-data view of one partition.
///
/// All columns have the same number of rows. A frame with no columns still has a
/// row count, so partitions that carry only row structure can be counted.
///
/// ```java
/// Frame frame = Frame.builder()
///     .add(NumericColumn.of("x", 1, 2, 3))
///     .add(CategoricalColumn.of("species", "a", "b", null))
///     .build();
/// ```
public final class Frame {

    private final List<Column> columns;
    private final transient Map<String, Column> byName;
    private final int rowCount;

    private Frame(List<Column> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
        Map<String, Column> index = new LinkedHashMap<>();
        for (Column column : columns) {
            index.put(column.name(), column);
        }
        this.byName = index;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Creates a frame with no columns.
    ///
    /// @param rowCount number of rows
    /// @return the frame
    public static Frame empty(int rowCount) {
        return builder().rows(rowCount).build();
    }

    public int rowCount() {
        return rowCount;
    }

    public List<Column> columns() {
        return columns;
    }

    public List<String> columnNames() {
        return List.copyOf(byName.keySet());
    }

    public Optional<Column> column(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    @Override
    public String toString() {
        return "Frame[rows=" + rowCount + ", columns=" + byName.keySet() + "]";
    }

    /// Builder for [Frame].
    public static final class Builder {

        private final List<Column> columns = new ArrayList<>();
        private Integer rows;

        private Builder() {
        }

        /// Sets the row count explicitly; required for frames without columns.
        ///
        /// @param rows number of rows
        /// @return this builder
        public Builder rows(int rows) {
            if (rows < 0) {
                throw new IllegalArgumentException("rows must be non-negative, got: " + rows);
            }
            this.rows = rows;
            return this;
        }

        public Builder add(Column column) {
            Objects.requireNonNull(column, "column cannot be null");
            for (Column existing : columns) {
                if (existing.name().equals(column.name())) {
                    throw new IllegalArgumentException("duplicate column name: " + column.name());
                }
            }
            columns.add(column);
            return this;
        }

        public Frame build() {
            int count = rows != null ? rows : (columns.isEmpty() ? 0 : columns.get(0).size());
            for (Column column : columns) {
                if (column.size() != count) {
                    throw new IllegalArgumentException("column '" + column.name() + "' has "
                        + column.size() + " rows, expected " + count);
                }
            }
            return new Frame(Collections.unmodifiableList(new ArrayList<>(columns)), count);
        }
    }
}

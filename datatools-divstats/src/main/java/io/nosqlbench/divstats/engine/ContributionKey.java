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

import io.nosqlbench.divstats.dataset.DatasetAttribute;
import io.nosqlbench.divstats.frame.ColumnFamily;

import java.util.Objects;
import java.util.Optional;

/// Routing key of a local contribution.
///
/// Shape attributes are keyed by attribute alone. Summary contributions also carry
/// the column family and column name so that every column combines independently:
///
/// ```text
///   nDiv                      shape(N_DIV)
///   summary_quant_price       summary(NUMERIC, "price")
///   summary_categ_item        summary(CATEGORICAL, "item")
/// ```
///
/// The string form is for display only; routing uses [#equals(Object)].
public final class ContributionKey implements Comparable<ContributionKey> {

    private final DatasetAttribute attribute;
    private final ColumnFamily family;
    private final String column;

    private ContributionKey(DatasetAttribute attribute, ColumnFamily family, String column) {
        this.attribute = attribute;
        this.family = family;
        this.column = column;
    }

    /// Creates the key of a dataset-shape attribute.
    ///
    /// @param attribute any attribute other than `summary` and `keyHashes`
    /// @return the key
    public static ContributionKey shape(DatasetAttribute attribute) {
        Objects.requireNonNull(attribute, "attribute cannot be null");
        if (attribute == DatasetAttribute.SUMMARY) {
            throw new IllegalArgumentException("summary contributions are keyed per column");
        }
        if (attribute == DatasetAttribute.KEY_HASHES) {
            throw new IllegalArgumentException("keyHashes is derived from keys and has no contributions");
        }
        return new ContributionKey(attribute, null, null);
    }

    /// Creates the key of one column's summary.
    ///
    /// @param family a supported column family
    /// @param column the column name
    /// @return the key
    public static ContributionKey summary(ColumnFamily family, String column) {
        Objects.requireNonNull(family, "family cannot be null");
        Objects.requireNonNull(column, "column cannot be null");
        if (!family.isSupported()) {
            throw new IllegalArgumentException("column '" + column + "' has an unsupported family");
        }
        return new ContributionKey(DatasetAttribute.SUMMARY, family, column);
    }

    public DatasetAttribute attribute() {
        return attribute;
    }

    public boolean isSummary() {
        return attribute == DatasetAttribute.SUMMARY;
    }

    public Optional<ColumnFamily> family() {
        return Optional.ofNullable(family);
    }

    public Optional<String> column() {
        return Optional.ofNullable(column);
    }

    /// Orders shape keys before summary keys, then by family and column name.
    @Override
    public int compareTo(ContributionKey o) {
        int c = Integer.compare(attribute.ordinal(), o.attribute.ordinal());
        if (c != 0) return c;
        if (family != o.family) {
            return Integer.compare(family.ordinal(), o.family.ordinal());
        }
        return column == null ? 0 : column.compareTo(o.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ContributionKey)) return false;
        ContributionKey that = (ContributionKey) o;
        return attribute == that.attribute && family == that.family && Objects.equals(column, that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attribute, family, column);
    }

    @Override
    public String toString() {
        return isSummary() ? "summary_" + family.tag() + "_" + column : attribute.attrName();
    }
}

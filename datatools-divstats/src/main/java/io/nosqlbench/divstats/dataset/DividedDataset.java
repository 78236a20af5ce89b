package io.nosqlbench.divstats.dataset;

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

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Descriptor of a dataset that is stored as many independent partitions.
///
/// The descriptor owns the dataset's attributes. It is immutable:
/// [#withAttributes(Map)] returns a new descriptor.
public interface DividedDataset {

    DatasetKind kind();

    /// Returns true if this dataset is a view with a pending deferred transformation.
    ///
    /// Attributes are computed on base data only; such views are rejected.
    ///
    /// @return true for an unresolved transformed view
    boolean isDeferredView();

    /// Reads a stored attribute.
    ///
    /// @param name the attribute name
    /// @return the value, or empty if not set
    Optional<Object> getAttribute(String name);

    default boolean hasAttribute(String name) {
        return getAttribute(name).isPresent();
    }

    /// Returns all stored attributes.
    ///
    /// @return an unmodifiable map of attribute name to value
    Map<String, Object> attributes();

    /// Returns a descriptor with the given attributes set, replacing existing values.
    ///
    /// @param attrs the attributes to set
    /// @return the updated descriptor
    DividedDataset withAttributes(Map<String, Object> attrs);

    /// Returns the declared column order of the row data, empty for a ddo.
    ///
    /// @return column names in declaration order
    List<String> columnNames();

    /// Returns the per-partition transform applied before row statistics, if any.
    ///
    /// @return the transform
    Optional<PartitionTransform> transform();

    PartitionSource partitions();
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// [DividedDataset] whose partitions and attributes are held in memory.
///
/// ## Usage
///
/// ```java
/// DividedDataset ddf = InMemoryDataset.builder(DatasetKind.DDF)
///     .columnNames("x", "species")
///     .partition("a", frameA)
///     .partition("b", frameB)
///     .build();
/// ```
///
/// A deferred view created with [#deferredView(PartitionTransform)] wraps this
/// dataset with a pending transformation and reports [#isDeferredView()] as true.
public final class InMemoryDataset implements DividedDataset {

    private final DatasetKind kind;
    private final List<PartitionRecord> partitions;
    private final List<String> columnNames;
    private final Map<String, Object> attributes;
    private final PartitionTransform transform;
    private final boolean deferredView;

    private InMemoryDataset(DatasetKind kind, List<PartitionRecord> partitions, List<String> columnNames,
                            Map<String, Object> attributes, PartitionTransform transform, boolean deferredView) {
        this.kind = kind;
        this.partitions = partitions;
        this.columnNames = columnNames;
        this.attributes = attributes;
        this.transform = transform;
        this.deferredView = deferredView;
    }

    public static Builder builder(DatasetKind kind) {
        return new Builder(kind);
    }

    @Override
    public DatasetKind kind() {
        return kind;
    }

    @Override
    public boolean isDeferredView() {
        return deferredView;
    }

    @Override
    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    @Override
    public Map<String, Object> attributes() {
        return attributes;
    }

    @Override
    public InMemoryDataset withAttributes(Map<String, Object> attrs) {
        Objects.requireNonNull(attrs, "attrs cannot be null");
        Map<String, Object> merged = new LinkedHashMap<>(attributes);
        merged.putAll(attrs);
        return new InMemoryDataset(kind, partitions, columnNames,
            Collections.unmodifiableMap(merged), transform, deferredView);
    }

    @Override
    public List<String> columnNames() {
        return columnNames;
    }

    @Override
    public Optional<PartitionTransform> transform() {
        return Optional.ofNullable(transform);
    }

    @Override
    public PartitionSource partitions() {
        return partitions::stream;
    }

    /// Wraps this dataset in a view whose transformation has not been applied yet.
    ///
    /// @param pending the deferred transformation
    /// @return the view
    public InMemoryDataset deferredView(PartitionTransform pending) {
        Objects.requireNonNull(pending, "pending cannot be null");
        return new InMemoryDataset(kind, partitions, columnNames, attributes, pending, true);
    }

    @Override
    public String toString() {
        return "InMemoryDataset[kind=" + kind.label() + ", partitions=" + partitions.size()
            + ", attributes=" + attributes.keySet() + (deferredView ? ", deferred" : "") + "]";
    }

    /// Builder for [InMemoryDataset].
    public static final class Builder {

        private final DatasetKind kind;
        private final List<PartitionRecord> partitions = new ArrayList<>();
        private final List<String> columnNames = new ArrayList<>();
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private PartitionTransform transform;

        private Builder(DatasetKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        }

        public Builder partition(Object key, Object value) {
            partitions.add(new PartitionRecord(key, value));
            return this;
        }

        public Builder partitions(List<PartitionRecord> records) {
            partitions.addAll(records);
            return this;
        }

        public Builder columnNames(String... names) {
            return columnNames(List.of(names));
        }

        public Builder columnNames(List<String> names) {
            columnNames.clear();
            columnNames.addAll(names);
            return this;
        }

        public Builder attribute(String name, Object value) {
            attributes.put(name, Objects.requireNonNull(value, "attribute value cannot be null"));
            return this;
        }

        public Builder attributes(Map<String, Object> attrs) {
            attrs.forEach(this::attribute);
            return this;
        }

        /// Sets a per-partition transform that is applied before row statistics.
        ///
        /// @param transform the transform
        /// @return this builder
        public Builder transform(PartitionTransform transform) {
            this.transform = transform;
            return this;
        }

        public InMemoryDataset build() {
            return new InMemoryDataset(kind, List.copyOf(partitions), List.copyOf(columnNames),
                Collections.unmodifiableMap(new LinkedHashMap<>(attributes)), transform, false);
        }
    }
}

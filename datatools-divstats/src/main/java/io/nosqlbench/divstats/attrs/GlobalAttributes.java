package io.nosqlbench.divstats.attrs;

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

import io.nosqlbench.divstats.accumulate.PercentileTable;
import io.nosqlbench.divstats.dataset.DatasetAttribute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/// The dataset-level attributes produced by one attribute update.
///
/// Only the attributes computed in that run are present; the others are absent.
/// Instances are immutable and are handed to the dataset's attribute store through
/// [#toAttributeMap()].
///
/// | Field | Attribute | Type |
/// |-------|-----------|------|
/// | totObjectSize | `totObjectSize` | double |
/// | nDiv | `nDiv` | long |
/// | nRow | `nRow` | long |
/// | keys | `keys` | list of opaque keys |
/// | keyHashes | `keyHashes` | list of hex digests, same order as keys |
/// | splitSizeDistn | `splitSizeDistn` | [PercentileTable] |
/// | splitRowDistn | `splitRowDistn` | [PercentileTable] |
/// | summary | `summary` | column name → [SummaryEntry], column order |
public final class GlobalAttributes {

    private final Double totObjectSize;
    private final Long nDiv;
    private final Long nRow;
    private final List<Object> keys;
    private final List<String> keyHashes;
    private final PercentileTable splitSizeDistn;
    private final PercentileTable splitRowDistn;
    private final Map<String, SummaryEntry> summary;

    private GlobalAttributes(Builder builder) {
        this.totObjectSize = builder.totObjectSize;
        this.nDiv = builder.nDiv;
        this.nRow = builder.nRow;
        this.keys = builder.keys == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.keys));
        this.keyHashes = builder.keyHashes == null ? null : List.copyOf(builder.keyHashes);
        this.splitSizeDistn = builder.splitSizeDistn;
        this.splitRowDistn = builder.splitRowDistn;
        this.summary = builder.summary == null ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(builder.summary));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Reads attributes back from a dataset's attribute map.
    ///
    /// Unknown names are ignored; numeric values may be any [Number].
    ///
    /// @param attrs attribute name to value
    /// @return the attributes found
    /// @throws IllegalArgumentException if a known attribute has the wrong type
    @SuppressWarnings("unchecked")
    public static GlobalAttributes fromAttributeMap(Map<String, ?> attrs) {
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : attrs.entrySet()) {
            Optional<DatasetAttribute> attribute = DatasetAttribute.fromName(entry.getKey());
            if (attribute.isEmpty()) {
                continue;
            }
            Object value = entry.getValue();
            switch (attribute.get()) {
                case TOT_OBJECT_SIZE -> builder.totObjectSize(expect(Number.class, entry.getKey(), value).doubleValue());
                case N_DIV -> builder.nDiv(expect(Number.class, entry.getKey(), value).longValue());
                case N_ROW -> builder.nRow(expect(Number.class, entry.getKey(), value).longValue());
                case KEYS -> builder.keys(expect(List.class, entry.getKey(), value));
                case KEY_HASHES -> builder.keyHashes(expect(List.class, entry.getKey(), value));
                case SPLIT_SIZE_DISTN -> builder.splitSizeDistn(expect(PercentileTable.class, entry.getKey(), value));
                case SPLIT_ROW_DISTN -> builder.splitRowDistn(expect(PercentileTable.class, entry.getKey(), value));
                case SUMMARY -> builder.summary(expect(Map.class, entry.getKey(), value));
                default -> throw new IllegalStateException("Unhandled attribute: " + attribute.get());
            }
        }
        return builder.build();
    }

    private static <T> T expect(Class<T> type, String name, Object value) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Attribute '" + name + "' should be a " + type.getSimpleName()
                + " but was " + (value == null ? "null" : value.getClass().getName()));
        }
        return type.cast(value);
    }

    /// Converts the present attributes into a name → value map for the attribute store.
    ///
    /// @return an ordered map containing only the present attributes
    public Map<String, Object> toAttributeMap() {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (totObjectSize != null) attrs.put(DatasetAttribute.TOT_OBJECT_SIZE.attrName(), totObjectSize);
        if (splitSizeDistn != null) attrs.put(DatasetAttribute.SPLIT_SIZE_DISTN.attrName(), splitSizeDistn);
        if (keys != null) attrs.put(DatasetAttribute.KEYS.attrName(), keys);
        if (keyHashes != null) attrs.put(DatasetAttribute.KEY_HASHES.attrName(), keyHashes);
        if (nDiv != null) attrs.put(DatasetAttribute.N_DIV.attrName(), nDiv);
        if (nRow != null) attrs.put(DatasetAttribute.N_ROW.attrName(), nRow);
        if (splitRowDistn != null) attrs.put(DatasetAttribute.SPLIT_ROW_DISTN.attrName(), splitRowDistn);
        if (summary != null) attrs.put(DatasetAttribute.SUMMARY.attrName(), summary);
        return Collections.unmodifiableMap(attrs);
    }

    /// Overlays another set of attributes onto this one; present values in `other` win.
    ///
    /// @param other the newer attributes
    /// @return the merged attributes
    public GlobalAttributes mergedWith(GlobalAttributes other) {
        Map<String, Object> merged = new LinkedHashMap<>(toAttributeMap());
        merged.putAll(other.toAttributeMap());
        return fromAttributeMap(merged);
    }

    public OptionalDouble totObjectSize() {
        return totObjectSize == null ? OptionalDouble.empty() : OptionalDouble.of(totObjectSize);
    }

    public OptionalLong nDiv() {
        return nDiv == null ? OptionalLong.empty() : OptionalLong.of(nDiv);
    }

    public OptionalLong nRow() {
        return nRow == null ? OptionalLong.empty() : OptionalLong.of(nRow);
    }

    public Optional<List<Object>> keys() {
        return Optional.ofNullable(keys);
    }

    public Optional<List<String>> keyHashes() {
        return Optional.ofNullable(keyHashes);
    }

    public Optional<PercentileTable> splitSizeDistn() {
        return Optional.ofNullable(splitSizeDistn);
    }

    public Optional<PercentileTable> splitRowDistn() {
        return Optional.ofNullable(splitRowDistn);
    }

    public Optional<Map<String, SummaryEntry>> summary() {
        return Optional.ofNullable(summary);
    }

    /// Returns true if no attribute is present.
    ///
    /// @return true when empty
    public boolean isEmpty() {
        return toAttributeMap().isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GlobalAttributes)) return false;
        return toAttributeMap().equals(((GlobalAttributes) o).toAttributeMap());
    }

    @Override
    public int hashCode() {
        return toAttributeMap().hashCode();
    }

    @Override
    public String toString() {
        return "GlobalAttributes" + toAttributeMap().keySet();
    }

    /// Builder for [GlobalAttributes].
    public static final class Builder {

        private Double totObjectSize;
        private Long nDiv;
        private Long nRow;
        private List<Object> keys;
        private List<String> keyHashes;
        private PercentileTable splitSizeDistn;
        private PercentileTable splitRowDistn;
        private Map<String, SummaryEntry> summary;

        private Builder() {
        }

        public Builder totObjectSize(double totObjectSize) {
            this.totObjectSize = totObjectSize;
            return this;
        }

        public Builder nDiv(long nDiv) {
            this.nDiv = nDiv;
            return this;
        }

        public Builder nRow(long nRow) {
            this.nRow = nRow;
            return this;
        }

        public Builder keys(List<?> keys) {
            this.keys = new ArrayList<>(Objects.requireNonNull(keys, "keys cannot be null"));
            return this;
        }

        public Builder keyHashes(List<String> keyHashes) {
            this.keyHashes = Objects.requireNonNull(keyHashes, "keyHashes cannot be null");
            return this;
        }

        public Builder splitSizeDistn(PercentileTable splitSizeDistn) {
            this.splitSizeDistn = splitSizeDistn;
            return this;
        }

        public Builder splitRowDistn(PercentileTable splitRowDistn) {
            this.splitRowDistn = splitRowDistn;
            return this;
        }

        public Builder summary(Map<String, SummaryEntry> summary) {
            this.summary = Objects.requireNonNull(summary, "summary cannot be null");
            return this;
        }

        public GlobalAttributes build() {
            return new GlobalAttributes(this);
        }
    }
}

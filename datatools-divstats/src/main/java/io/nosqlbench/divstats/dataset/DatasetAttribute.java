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

import java.util.Optional;

/// Attributes that the statistics engine knows how to compute.
///
/// | Attribute | Kind | Value |
/// |-----------|------|-------|
/// | `totObjectSize` | ddo | total estimated bytes |
/// | `splitSizeDistn` | ddo | percentile table of partition sizes |
/// | `keys` | ddo | list of partition keys |
/// | `nDiv` | ddo | number of partitions |
/// | `keyHashes` | ddo | fingerprints of `keys`, derived with them |
/// | `nRow` | ddf | total rows |
/// | `splitRowDistn` | ddf | percentile table of partition row counts |
/// | `summary` | ddf | per-column summary entries |
public enum DatasetAttribute {

    TOT_OBJECT_SIZE("totObjectSize", DatasetKind.DDO),
    SPLIT_SIZE_DISTN("splitSizeDistn", DatasetKind.DDO),
    KEYS("keys", DatasetKind.DDO),
    N_DIV("nDiv", DatasetKind.DDO),
    KEY_HASHES("keyHashes", DatasetKind.DDO),
    N_ROW("nRow", DatasetKind.DDF),
    SPLIT_ROW_DISTN("splitRowDistn", DatasetKind.DDF),
    SUMMARY("summary", DatasetKind.DDF);

    private final String attrName;
    private final DatasetKind kind;

    DatasetAttribute(String attrName, DatasetKind kind) {
        this.attrName = attrName;
        this.kind = kind;
    }

    /// @return the attribute name as stored on the dataset
    public String attrName() {
        return attrName;
    }

    /// @return the dataset kind that introduces this attribute
    public DatasetKind kind() {
        return kind;
    }

    /// Returns true for attributes computed on the row-data view rather than on the
    /// stored partition values.
    ///
    /// @return true for `nRow`, `splitRowDistn` and `summary`
    public boolean usesRowData() {
        return kind == DatasetKind.DDF;
    }

    /// Looks up an attribute by its stored name.
    ///
    /// @param attrName the name, for example `nRow`
    /// @return the attribute, or empty if the engine does not know it
    public static Optional<DatasetAttribute> fromName(String attrName) {
        for (DatasetAttribute attribute : values()) {
            if (attribute.attrName.equals(attrName)) {
                return Optional.of(attribute);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return attrName;
    }
}

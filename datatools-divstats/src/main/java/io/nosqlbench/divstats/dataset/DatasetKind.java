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

import java.util.Locale;

/// The two kinds of divided dataset.
public enum DatasetKind {

    /// Distributed data object: partitions hold arbitrary values.
    DDO("ddo"),
    /// Distributed data frame: partitions hold row data with named, typed columns.
    DDF("ddf");

    private final String label;

    DatasetKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /// Parses a kind from its label, case-insensitively.
    ///
    /// @param label `ddo` or `ddf`
    /// @return the kind
    /// @throws IllegalArgumentException for an unknown label
    public static DatasetKind fromLabel(String label) {
        String normalized = label.toLowerCase(Locale.ROOT);
        for (DatasetKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown dataset kind: " + label + ", expected ddo or ddf");
    }
}

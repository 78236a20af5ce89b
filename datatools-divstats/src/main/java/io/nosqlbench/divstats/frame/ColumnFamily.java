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

/// Closed set of column families recognized by the summary statistics.
///
/// The family is decided once per column. Columns of an [#UNSUPPORTED] family are
/// skipped by the summary.
public enum ColumnFamily {

    /// Integer and floating-point columns: moments and range.
    NUMERIC("quant"),
    /// String and factor-like columns: capped frequency table.
    CATEGORICAL("categ"),
    /// Timestamp columns: range.
    DATETIME("datetime"),
    /// Anything else; not summarized.
    UNSUPPORTED(null);

    private final String tag;

    ColumnFamily(String tag) {
        this.tag = tag;
    }

    /// Returns the short tag used in the display form of summary keys, such as `quant`.
    ///
    /// @return the tag, or null for [#UNSUPPORTED]
    public String tag() {
        return tag;
    }

    public boolean isSupported() {
        return this != UNSUPPORTED;
    }
}

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

/// One named column of a partition [Frame].
///
/// Each implementation belongs to exactly one [ColumnFamily] and defines its own
/// missing-value marker.
public interface Column {

    /// @return the column name
    String name();

    /// @return the column family
    ColumnFamily family();

    /// @return the number of rows
    int size();

    /// Returns true if the value at the given row is missing.
    ///
    /// @param row the row index
    /// @return true when missing
    boolean isMissing(int row);

    /// Counts missing values.
    ///
    /// @return number of missing rows
    default int missingCount() {
        int missing = 0;
        for (int i = 0; i < size(); i++) {
            if (isMissing(i)) missing++;
        }
        return missing;
    }
}

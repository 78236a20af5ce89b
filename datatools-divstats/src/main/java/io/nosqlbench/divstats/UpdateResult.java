package io.nosqlbench.divstats;

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

import io.nosqlbench.divstats.attrs.GlobalAttributes;
import io.nosqlbench.divstats.dataset.DividedDataset;

import java.util.Objects;

/// Outcome of [AttributeUpdater#update(DividedDataset)].
///
/// @param dataset the dataset carrying the computed attributes, or the input itself when nothing was computed
/// @param computed true if a map/reduce pass ran
/// @param attributes the attributes computed by this call, empty when nothing was computed
public record UpdateResult(DividedDataset dataset, boolean computed, GlobalAttributes attributes) {

    public UpdateResult {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        Objects.requireNonNull(attributes, "attributes cannot be null");
    }

    static UpdateResult unchanged(DividedDataset dataset) {
        return new UpdateResult(dataset, false, GlobalAttributes.builder().build());
    }
}

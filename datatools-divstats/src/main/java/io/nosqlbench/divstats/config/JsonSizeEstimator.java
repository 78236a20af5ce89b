package io.nosqlbench.divstats.config;

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

import com.google.gson.Gson;
import io.nosqlbench.divstats.io.DivstatsGsonConfig;

import java.nio.charset.StandardCharsets;

/// Default [SizeEstimator]: the UTF-8 byte length of the value's compact JSON encoding.
///
/// Deterministic for a given value and independent of JVM object layout, which keeps
/// `totObjectSize` and `splitSizeDistn` comparable across machines.
public final class JsonSizeEstimator implements SizeEstimator {

    private final Gson gson;

    public JsonSizeEstimator() {
        this(DivstatsGsonConfig.compactGson());
    }

    public JsonSizeEstimator(Gson gson) {
        this.gson = gson;
    }

    @Override
    public double estimateSize(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof byte[] bytes) {
            return bytes.length;
        }
        return gson.toJson(value).getBytes(StandardCharsets.UTF_8).length;
    }
}

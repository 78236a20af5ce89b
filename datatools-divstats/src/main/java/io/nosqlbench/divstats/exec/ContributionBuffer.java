package io.nosqlbench.divstats.exec;

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

import io.nosqlbench.divstats.engine.ContributionCollector;
import io.nosqlbench.divstats.engine.ContributionKey;
import io.nosqlbench.divstats.engine.ContributionReducer;
import io.nosqlbench.divstats.engine.ReduceFold;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/// Groups one task's contributions by key and folds them in batches.
///
/// Confined to a single task; not thread-safe.
final class ContributionBuffer implements ContributionCollector {

    private final ContributionReducer reducer;
    private final int batchSize;
    private final Map<ContributionKey, List<Object>> pending = new HashMap<>();
    private final Map<ContributionKey, ReduceFold> folds = new HashMap<>();

    ContributionBuffer(ContributionReducer reducer, int batchSize) {
        this.reducer = reducer;
        this.batchSize = batchSize;
    }

    @Override
    public void collect(ContributionKey key, Object value) {
        List<Object> batch = pending.computeIfAbsent(key, k -> new ArrayList<>());
        batch.add(value);
        if (batch.size() >= batchSize) {
            foldFor(key).fold(batch);
            batch.clear();
        }
    }

    private ReduceFold foldFor(ContributionKey key) {
        return folds.computeIfAbsent(key, reducer::open);
    }

    /// Folds every pending batch and returns the folds.
    ///
    /// @return fold per key seen by this buffer
    Map<ContributionKey, ReduceFold> drain() {
        for (Map.Entry<ContributionKey, List<Object>> entry : pending.entrySet()) {
            if (!entry.getValue().isEmpty()) {
                foldFor(entry.getKey()).fold(entry.getValue());
            }
        }
        pending.clear();
        return folds;
    }

    /// Merges the folds of `from` into `into`, key by key.
    static Map<ContributionKey, ReduceFold> mergeInto(Map<ContributionKey, ReduceFold> into,
                                                      Map<ContributionKey, ReduceFold> from) {
        for (Map.Entry<ContributionKey, ReduceFold> entry : from.entrySet()) {
            ReduceFold existing = into.get(entry.getKey());
            if (existing == null) {
                into.put(entry.getKey(), entry.getValue());
            } else {
                existing.merge(entry.getValue());
            }
        }
        return into;
    }

    /// Finishes every fold, in key order.
    static Map<ContributionKey, Object> finish(Map<ContributionKey, ReduceFold> folds) {
        Map<ContributionKey, Object> finished = new LinkedHashMap<>();
        for (Map.Entry<ContributionKey, ReduceFold> entry : new TreeMap<>(folds).entrySet()) {
            finished.put(entry.getKey(), entry.getValue().finish());
        }
        return finished;
    }
}

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

import io.nosqlbench.divstats.dataset.PartitionTransform;
import io.nosqlbench.divstats.plan.AttributeNeed;

import java.util.Objects;
import java.util.Optional;

/// Parameters shipped with a job to every worker: the need map and the optional
/// row-data transform.
public final class JobParameters {

    private final AttributeNeed need;
    private final PartitionTransform transform;

    public JobParameters(AttributeNeed need, PartitionTransform transform) {
        this.need = Objects.requireNonNull(need, "need cannot be null");
        this.transform = transform;
    }

    public AttributeNeed need() {
        return need;
    }

    public Optional<PartitionTransform> transform() {
        return Optional.ofNullable(transform);
    }

    @Override
    public String toString() {
        return "JobParameters[need=" + need.neededNames() + ", transform=" + (transform != null) + "]";
    }
}

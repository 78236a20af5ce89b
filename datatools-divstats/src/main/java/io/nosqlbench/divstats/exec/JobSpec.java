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

import io.nosqlbench.divstats.dataset.PartitionSource;
import io.nosqlbench.divstats.engine.ContributionReducer;

import java.util.Objects;

/// Everything an executor needs to run one map/reduce pass.
///
/// | Part | Role |
/// |------|------|
/// | setup | run once per worker before it maps anything |
/// | source | the partitions |
/// | mapper | builds, from the parameters, the stage that emits keyed contributions per partition |
/// | reducer | opens a combine state per key |
/// | parameters | need map and transform, handed to the mapper factory on each worker |
/// | control | batch size and parallelism |
public final class JobSpec {

    private final Runnable setup;
    private final PartitionSource source;
    private final MapperFactory mapper;
    private final ContributionReducer reducer;
    private final JobParameters parameters;
    private final ExecutionControl control;

    private JobSpec(Builder builder) {
        this.setup = builder.setup;
        this.source = Objects.requireNonNull(builder.source, "source cannot be null");
        this.mapper = Objects.requireNonNull(builder.mapper, "mapper cannot be null");
        this.reducer = Objects.requireNonNull(builder.reducer, "reducer cannot be null");
        this.parameters = Objects.requireNonNull(builder.parameters, "parameters cannot be null");
        this.control = builder.control;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Runnable setup() {
        return setup;
    }

    public PartitionSource source() {
        return source;
    }

    public MapperFactory mapper() {
        return mapper;
    }

    public ContributionReducer reducer() {
        return reducer;
    }

    public JobParameters parameters() {
        return parameters;
    }

    public ExecutionControl control() {
        return control;
    }

    public static final class Builder {

        private Runnable setup = () -> { };
        private PartitionSource source;
        private MapperFactory mapper;
        private ContributionReducer reducer;
        private JobParameters parameters;
        private ExecutionControl control = ExecutionControl.defaults();

        private Builder() {
        }

        public Builder setup(Runnable setup) {
            this.setup = Objects.requireNonNull(setup, "setup cannot be null");
            return this;
        }

        public Builder source(PartitionSource source) {
            this.source = source;
            return this;
        }

        public Builder mapper(MapperFactory mapper) {
            this.mapper = mapper;
            return this;
        }

        public Builder reducer(ContributionReducer reducer) {
            this.reducer = reducer;
            return this;
        }

        public Builder parameters(JobParameters parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder control(ExecutionControl control) {
            this.control = Objects.requireNonNull(control, "control cannot be null");
            return this;
        }

        public JobSpec build() {
            return new JobSpec(this);
        }
    }
}

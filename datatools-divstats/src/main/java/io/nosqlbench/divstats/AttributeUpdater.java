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
import io.nosqlbench.divstats.config.DivstatsConfig;
import io.nosqlbench.divstats.dataset.DatasetAttribute;
import io.nosqlbench.divstats.dataset.DividedDataset;
import io.nosqlbench.divstats.engine.ContributionKey;
import io.nosqlbench.divstats.engine.GlobalCombiner;
import io.nosqlbench.divstats.engine.LocalContributionBuilder;
import io.nosqlbench.divstats.engine.ResultAssembler;
import io.nosqlbench.divstats.exec.DistributedExecutor;
import io.nosqlbench.divstats.exec.ExecutionControl;
import io.nosqlbench.divstats.exec.JobParameters;
import io.nosqlbench.divstats.exec.JobSpec;
import io.nosqlbench.divstats.plan.AttributeNeed;
import io.nosqlbench.divstats.plan.NeedPlanner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Computes the missing dataset-level attributes of a divided dataset in one pass.
///
/// ## Flow
///
/// ```text
///   NeedPlanner ──► LocalContributionBuilder (per partition) ──► executor groups by key
///        │                                                             │
///        └─ nothing needed: return input                                ▼
///                                    ResultAssembler ◄── GlobalCombiner (per key)
///                                          │
///                                          ▼
///                              dataset.withAttributes(...)
/// ```
///
/// ## Usage
///
/// ```java
/// try (ParallelExecutor executor = new ParallelExecutor()) {
///     AttributeUpdater updater = new AttributeUpdater(DivstatsConfig.defaults(), executor);
///     UpdateResult result = updater.update(dataset);
///     long rows = result.attributes().nRow().orElseThrow();
/// }
/// ```
///
/// The operation is idempotent: once every implemented, required attribute is
/// present, further calls return the input dataset unchanged.
public final class AttributeUpdater {

    private static final Logger logger = LogManager.getLogger(AttributeUpdater.class);

    private final DivstatsConfig config;
    private final DistributedExecutor executor;
    private final ExecutionControl control;
    private final NeedPlanner planner;

    public AttributeUpdater(DivstatsConfig config, DistributedExecutor executor) {
        this(config, executor, ExecutionControl.defaults());
    }

    public AttributeUpdater(DivstatsConfig config, DistributedExecutor executor, ExecutionControl control) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.control = Objects.requireNonNull(control, "control cannot be null");
        this.planner = new NeedPlanner(config);
    }

    /// Computes the attributes the dataset is missing and stores them on a copy of it.
    ///
    /// @param dataset the dataset
    /// @return the updated dataset and the computed attributes
    /// @throws io.nosqlbench.divstats.plan.PreconditionException if the dataset is a deferred view
    /// @throws io.nosqlbench.divstats.exec.ExecutionFailedException if a map or reduce task fails
    public UpdateResult update(DividedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        AttributeNeed need = planner.plan(dataset);
        if (!need.anyNeeded()) {
            logger.info("All (implemented) attributes have already been computed.");
            return UpdateResult.unchanged(dataset);
        }

        logger.info("Running map/reduce to get missing attributes...");
        GlobalCombiner reducer = new GlobalCombiner(config);
        JobSpec job = JobSpec.builder()
            .source(dataset.partitions())
            .mapper(params -> new LocalContributionBuilder(params.need(), params.transform().orElse(null),
                config.sizeEstimator(), config.maxCategories()))
            .reducer(reducer)
            .parameters(new JobParameters(need, dataset.transform().orElse(null)))
            .control(control)
            .build();

        Map<ContributionKey, Object> finished = new LinkedHashMap<>(executor.execute(job));
        // attributes of a dataset without partitions finish at their identity
        for (DatasetAttribute attribute : DatasetAttribute.values()) {
            if (attribute != DatasetAttribute.SUMMARY && attribute != DatasetAttribute.KEY_HASHES
                && need.isNeeded(attribute)) {
                finished.computeIfAbsent(ContributionKey.shape(attribute), key -> reducer.open(key).finish());
            }
        }

        GlobalAttributes attributes = new ResultAssembler().assemble(finished, dataset, need);
        logger.debug("Computed attributes {}", attributes.toAttributeMap().keySet());
        return new UpdateResult(dataset.withAttributes(attributes.toAttributeMap()), true, attributes);
    }
}

package io.nosqlbench.divstats.plan;

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

import io.nosqlbench.divstats.config.DivstatsConfig;
import io.nosqlbench.divstats.dataset.DividedDataset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Decides which attributes of a dataset must be computed.
///
/// An attribute is needed iff it is
/// 1. required for the dataset's kind,
/// 2. not already present on the dataset, and
/// 3. in the implemented-attribute registry.
///
/// Required attributes outside the registry are left out of the need map without
/// error, so datasets created by newer tooling can still be processed.
public final class NeedPlanner {

    private static final Logger logger = LogManager.getLogger(NeedPlanner.class);

    private final DivstatsConfig config;

    public NeedPlanner(DivstatsConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /// Plans the attribute needs of a dataset.
    ///
    /// @param dataset the dataset
    /// @return the need map
    /// @throws PreconditionException if the dataset is a deferred-transform view
    public AttributeNeed plan(DividedDataset dataset) {
        Objects.requireNonNull(dataset, "dataset cannot be null");
        if (dataset.isDeferredView()) {
            throw new PreconditionException(
                "Cannot update attributes of a dataset with a pending deferred transformation; "
                    + "compute attributes on the base data or resolve the transformation first");
        }

        Set<String> required = config.requiredAttributes(dataset.kind());
        Set<String> implemented = config.implementedAttributes();
        Map<String, Boolean> needs = new LinkedHashMap<>();
        for (String name : required) {
            if (!implemented.contains(name)) {
                logger.debug("Required attribute '{}' is not implemented, skipping", name);
                continue;
            }
            needs.put(name, !dataset.hasAttribute(name));
        }

        AttributeNeed need = AttributeNeed.of(needs);
        logger.debug("Planned attribute needs for {} dataset: {}", dataset.kind().label(), need);
        return need;
    }
}

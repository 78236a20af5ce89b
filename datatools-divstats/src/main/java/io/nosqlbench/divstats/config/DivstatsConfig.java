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

import com.google.gson.JsonParseException;
import io.nosqlbench.divstats.accumulate.FrequencyAccumulator;
import io.nosqlbench.divstats.accumulate.PercentileTable;
import io.nosqlbench.divstats.dataset.DatasetAttribute;
import io.nosqlbench.divstats.dataset.DatasetKind;
import io.nosqlbench.divstats.io.DivstatsGsonConfig;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable configuration of the attribute statistics engine.
///
/// ## Contents
///
/// | Setting | Default | Purpose |
/// |---------|---------|---------|
/// | implemented attributes | all computable attributes | attributes the engine may compute |
/// | required attributes | per [DatasetKind] | attributes each dataset kind should carry |
/// | max categories | 10,000 | distinct categories tracked per categorical column |
/// | percentile step | 0.01 | probability increment of size and row distributions |
/// | size estimator | [JsonSizeEstimator] | bytes per partition value |
///
/// A data frame (`ddf`) requires its own attributes plus every `ddo` attribute.
/// Required attributes that are not implemented are ignored by the planner, so the
/// required tables may list attributes that a later engine version will compute.
///
/// ## Loading
///
/// ```json
/// {
///   "implemented": ["nRow", "nDiv", "keys"],
///   "required": { "ddo": ["keys", "nDiv"], "ddf": ["nRow"] },
///   "maxCategories": 500,
///   "percentileStep": 0.05
/// }
/// ```
///
/// Every field is optional; missing fields keep their defaults.
public final class DivstatsConfig {

    private final Set<String> implementedAttributes;
    private final Map<DatasetKind, Set<String>> requiredAttributes;
    private final int maxCategories;
    private final double percentileStep;
    private final SizeEstimator sizeEstimator;

    private DivstatsConfig(Builder builder) {
        this.implementedAttributes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.implemented));
        EnumMap<DatasetKind, Set<String>> required = new EnumMap<>(DatasetKind.class);
        for (DatasetKind kind : DatasetKind.values()) {
            required.put(kind, Collections.unmodifiableSet(
                new LinkedHashSet<>(builder.required.getOrDefault(kind, Set.of()))));
        }
        this.requiredAttributes = Collections.unmodifiableMap(required);
        this.maxCategories = builder.maxCategories;
        this.percentileStep = builder.percentileStep;
        this.sizeEstimator = builder.sizeEstimator;
    }

    /// Returns the default configuration.
    ///
    /// @return defaults
    public static DivstatsConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Loads a configuration file, applying its settings over the defaults.
    ///
    /// @param path the JSON file
    /// @return the configuration
    /// @throws IOException if the file cannot be read or parsed
    public static DivstatsConfig load(Path path) throws IOException {
        ConfigFile file;
        try (Reader reader = Files.newBufferedReader(path)) {
            file = DivstatsGsonConfig.gson().fromJson(reader, ConfigFile.class);
        } catch (JsonParseException e) {
            throw new IOException("Invalid divstats config " + path + ": " + e.getMessage(), e);
        }
        Builder builder = builder();
        if (file == null) {
            return builder.build();
        }
        if (file.implemented != null) {
            builder.implemented(file.implemented);
        }
        if (file.required != null) {
            for (Map.Entry<String, List<String>> entry : file.required.entrySet()) {
                builder.required(DatasetKind.fromLabel(entry.getKey()), entry.getValue());
            }
        }
        if (file.maxCategories != null) {
            builder.maxCategories(file.maxCategories);
        }
        if (file.percentileStep != null) {
            builder.percentileStep(file.percentileStep);
        }
        return builder.build();
    }

    public Set<String> implementedAttributes() {
        return implementedAttributes;
    }

    /// Returns the attributes a dataset of the given kind must carry.
    ///
    /// @param kind the dataset kind
    /// @return `ddo` attributes for a ddo; `ddo` and `ddf` attributes for a ddf
    public Set<String> requiredAttributes(DatasetKind kind) {
        if (kind == DatasetKind.DDO) {
            return requiredAttributes.get(DatasetKind.DDO);
        }
        Set<String> all = new LinkedHashSet<>(requiredAttributes.get(DatasetKind.DDO));
        all.addAll(requiredAttributes.get(DatasetKind.DDF));
        return Collections.unmodifiableSet(all);
    }

    public int maxCategories() {
        return maxCategories;
    }

    public double percentileStep() {
        return percentileStep;
    }

    public SizeEstimator sizeEstimator() {
        return sizeEstimator;
    }

    /// Returns a builder initialized from this configuration.
    ///
    /// @return a builder
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.implemented(implementedAttributes);
        requiredAttributes.forEach(builder::required);
        return builder.maxCategories(maxCategories)
            .percentileStep(percentileStep)
            .sizeEstimator(sizeEstimator);
    }

    @Override
    public String toString() {
        return "DivstatsConfig[implemented=" + implementedAttributes
            + ", required=" + requiredAttributes
            + ", maxCategories=" + maxCategories
            + ", percentileStep=" + percentileStep + "]";
    }

    /// Builder for [DivstatsConfig].
    public static final class Builder {

        private final Set<String> implemented = new LinkedHashSet<>();
        private final Map<DatasetKind, Set<String>> required = new EnumMap<>(DatasetKind.class);
        private int maxCategories = FrequencyAccumulator.DEFAULT_CAP;
        private double percentileStep = PercentileTable.DEFAULT_STEP;
        private SizeEstimator sizeEstimator = new JsonSizeEstimator();

        private Builder() {
            for (DatasetAttribute attribute : DatasetAttribute.values()) {
                // keyHashes is derived from keys, never computed on its own
                if (attribute != DatasetAttribute.KEY_HASHES) {
                    implemented.add(attribute.attrName());
                    required.computeIfAbsent(attribute.kind(), k -> new LinkedHashSet<>()).add(attribute.attrName());
                }
            }
        }

        /// Replaces the implemented-attribute registry.
        ///
        /// @param names attribute names; each must be computable by the engine
        /// @return this builder
        /// @throws IllegalArgumentException for a name the engine cannot compute
        public Builder implemented(Iterable<String> names) {
            Set<String> replacement = new LinkedHashSet<>();
            for (String name : names) {
                DatasetAttribute attribute = DatasetAttribute.fromName(name).orElseThrow(() ->
                    new IllegalArgumentException("Attribute '" + name + "' cannot be implemented; known: "
                        + List.of(DatasetAttribute.values())));
                if (attribute == DatasetAttribute.KEY_HASHES) {
                    throw new IllegalArgumentException("keyHashes is derived from keys and cannot be registered");
                }
                replacement.add(name);
            }
            implemented.clear();
            implemented.addAll(replacement);
            return this;
        }

        /// Replaces the required-attribute table of one dataset kind.
        ///
        /// @param kind the dataset kind
        /// @param names attribute names, possibly not implemented
        /// @return this builder
        public Builder required(DatasetKind kind, Iterable<String> names) {
            Objects.requireNonNull(kind, "kind cannot be null");
            Set<String> set = new LinkedHashSet<>();
            names.forEach(set::add);
            required.put(kind, set);
            return this;
        }

        public Builder maxCategories(int maxCategories) {
            if (maxCategories < 1) {
                throw new IllegalArgumentException("maxCategories must be at least 1, got: " + maxCategories);
            }
            this.maxCategories = maxCategories;
            return this;
        }

        public Builder percentileStep(double percentileStep) {
            PercentileTable.intervalsFor(percentileStep);
            this.percentileStep = percentileStep;
            return this;
        }

        public Builder sizeEstimator(SizeEstimator sizeEstimator) {
            this.sizeEstimator = Objects.requireNonNull(sizeEstimator, "sizeEstimator cannot be null");
            return this;
        }

        public DivstatsConfig build() {
            return new DivstatsConfig(this);
        }
    }

    /// JSON shape of a configuration file.
    private static final class ConfigFile {
        List<String> implemented;
        Map<String, List<String>> required;
        Integer maxCategories;
        Double percentileStep;
    }
}

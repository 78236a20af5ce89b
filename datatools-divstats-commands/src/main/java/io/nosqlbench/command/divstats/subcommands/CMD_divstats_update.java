package io.nosqlbench.command.divstats.subcommands;

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

import io.nosqlbench.divstats.AttributeUpdater;
import io.nosqlbench.divstats.UpdateResult;
import io.nosqlbench.divstats.attrs.GlobalAttributes;
import io.nosqlbench.divstats.config.DivstatsConfig;
import io.nosqlbench.divstats.dataset.DatasetKind;
import io.nosqlbench.divstats.dataset.InMemoryDataset;
import io.nosqlbench.divstats.dataset.PartitionRecord;
import io.nosqlbench.divstats.exec.DistributedExecutor;
import io.nosqlbench.divstats.exec.ExecutionControl;
import io.nosqlbench.divstats.exec.ExecutionFailedException;
import io.nosqlbench.divstats.exec.ParallelExecutor;
import io.nosqlbench.divstats.exec.SequentialExecutor;
import io.nosqlbench.divstats.frame.Frame;
import io.nosqlbench.divstats.io.AttributeFiles;
import io.nosqlbench.divstats.io.PartitionFiles;
import io.nosqlbench.divstats.plan.PreconditionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/// Compute the missing attributes of a dataset stored as a directory of JSON partitions.
///
/// ## Usage
///
/// ```bash
/// # Data frame partitions, attributes written to sales/_attributes.json
/// divstats update --input sales/
///
/// # Object partitions, single-threaded, custom attribute file
/// divstats update --input blobs/ --kind ddo --threads 1 --attributes blobs.attrs.json
/// ```
///
/// Attributes already in the attribute file are not recomputed. When every
/// implemented attribute is present the command changes nothing.
@CommandLine.Command(
    name = "update",
    header = "Compute missing dataset attributes",
    description = "Runs one map/reduce pass over the partition files of a dataset directory and "
        + "stores the computed attributes (sizes, keys, row counts, column summaries) as JSON.",
    exitCodeList = {
        "0: Success, or nothing to compute",
        "1: Error reading partitions or writing attributes",
        "2: Dataset cannot be summarized"
    }
)
public class CMD_divstats_update implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_divstats_update.class);

    @CommandLine.Option(
        names = {"--input", "-i"},
        description = "Dataset directory holding one JSON file per partition",
        required = true
    )
    private Path inputDir;

    @CommandLine.Option(
        names = {"--attributes", "-a"},
        description = "Attribute file to read and update (default: <input>/" + AttributeFiles.DEFAULT_FILE_NAME + ")"
    )
    private Path attributesPath;

    @CommandLine.Option(
        names = {"--kind", "-k"},
        description = "Dataset kind: ddo or ddf (default: ${DEFAULT-VALUE})",
        defaultValue = "ddf"
    )
    private String kind;

    @CommandLine.Option(
        names = {"--max-categories"},
        description = "Distinct categories kept per categorical column"
    )
    private Integer maxCategories;

    @CommandLine.Option(
        names = {"--threads", "-t"},
        description = "Map tasks to run concurrently; 1 runs on the calling thread (default: available processors)"
    )
    private Integer threads;

    @CommandLine.Option(
        names = {"--config", "-c"},
        description = "JSON configuration file with implemented/required attributes and limits"
    )
    private Path configPath;

    @Override
    public Integer call() {
        try {
            if (!Files.isDirectory(inputDir)) {
                System.err.println("Error: Not a directory: " + inputDir);
                return 1;
            }
            DatasetKind datasetKind = DatasetKind.fromLabel(kind);
            DivstatsConfig config = loadConfig();
            Path attrsFile = attributesPath != null ? attributesPath : inputDir.resolve(AttributeFiles.DEFAULT_FILE_NAME);

            GlobalAttributes stored = AttributeFiles.load(attrsFile);
            Set<String> excluded = Set.of(AttributeFiles.DEFAULT_FILE_NAME, attrsFile.getFileName().toString());
            List<PartitionRecord> partitions = PartitionFiles.readDirectory(inputDir, excluded);
            logger.info("Loaded {} partitions from {}", partitions.size(), inputDir);

            InMemoryDataset dataset = InMemoryDataset.builder(datasetKind)
                .partitions(partitions)
                .columnNames(columnNames(partitions))
                .attributes(stored.toAttributeMap())
                .build();

            ExecutionControl control = ExecutionControl.defaults();
            if (threads != null) {
                control = control.withParallelism(threads);
            }
            UpdateResult result;
            if (control.parallelism() == 1) {
                result = run(config, new SequentialExecutor(), control, dataset);
            } else {
                try (ParallelExecutor executor = new ParallelExecutor()) {
                    result = run(config, executor, control, dataset);
                }
            }

            if (!result.computed()) {
                System.out.println("All (implemented) attributes have already been computed: " + attrsFile);
                return 0;
            }
            AttributeFiles.save(attrsFile, stored.mergedWith(result.attributes()));
            System.out.println("Computed " + result.attributes().toAttributeMap().keySet() + " -> " + attrsFile);
            return 0;

        } catch (PreconditionException e) {
            logger.error("Dataset cannot be summarized", e);
            System.err.println("Error: " + e.getMessage());
            return 2;
        } catch (IOException | ExecutionFailedException | IllegalArgumentException e) {
            logger.error("Error updating attributes of {}", inputDir, e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private UpdateResult run(DivstatsConfig config, DistributedExecutor executor, ExecutionControl control,
                             InMemoryDataset dataset) {
        return new AttributeUpdater(config, executor, control).update(dataset);
    }

    private DivstatsConfig loadConfig() throws IOException {
        DivstatsConfig config = configPath != null ? DivstatsConfig.load(configPath) : DivstatsConfig.defaults();
        if (maxCategories != null) {
            config = config.toBuilder().maxCategories(maxCategories).build();
        }
        return config;
    }

    /// Column names in first-seen order across all frame partitions.
    private static List<String> columnNames(List<PartitionRecord> partitions) {
        Set<String> names = new LinkedHashSet<>();
        for (PartitionRecord partition : partitions) {
            if (partition.value() instanceof Frame) {
                names.addAll(((Frame) partition.value()).columnNames());
            }
        }
        return new ArrayList<>(names);
    }
}

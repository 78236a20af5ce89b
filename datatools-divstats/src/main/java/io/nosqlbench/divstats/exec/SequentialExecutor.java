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

import io.nosqlbench.divstats.dataset.PartitionRecord;
import io.nosqlbench.divstats.engine.ContributionKey;
import io.nosqlbench.divstats.engine.PartitionMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/// Runs a job on the calling thread.
///
/// Partitions are mapped in stream order into one buffer, so the job's parallelism
/// setting is ignored. Useful for tests and small datasets.
public final class SequentialExecutor implements DistributedExecutor {

    private static final Logger logger = LogManager.getLogger(SequentialExecutor.class);

    @Override
    public Map<ContributionKey, Object> execute(JobSpec job) {
        Objects.requireNonNull(job, "job cannot be null");
        long start = System.currentTimeMillis();
        ContributionBuffer buffer = new ContributionBuffer(job.reducer(), job.control().batchSize());
        long mapped = 0;
        String phase = "while opening the partition source";
        try (Stream<PartitionRecord> partitions = job.source().stream()) {
            phase = "during setup";
            job.setup().run();
            PartitionMapper mapper = job.mapper().create(job.parameters());
            Iterator<PartitionRecord> it = partitions.iterator();
            while (it.hasNext()) {
                phase = "while reading partitions";
                PartitionRecord partition = it.next();
                phase = "while mapping partition " + partition.key();
                mapper.map(partition, buffer);
                mapped++;
            }
            phase = "while reducing";
            Map<ContributionKey, Object> finished = ContributionBuffer.finish(buffer.drain());
            logger.debug("Mapped {} partitions into {} keys in {} ms",
                mapped, finished.size(), System.currentTimeMillis() - start);
            return finished;
        } catch (RuntimeException e) {
            throw new ExecutionFailedException("Attribute job failed " + phase + ": " + e.getMessage(), e);
        }
    }
}

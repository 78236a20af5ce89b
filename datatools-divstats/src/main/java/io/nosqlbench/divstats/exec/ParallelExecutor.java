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
import io.nosqlbench.divstats.engine.ReduceFold;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/// Runs a job on a thread pool.
///
/// ## Execution
///
/// ```text
///   partitions ──► slice 1 ──► task: setup, map, fold ──┐
///              ──► slice 2 ──► task: setup, map, fold ──┼──► pairwise merge ──► finish
///              ──► slice n ──► task: setup, map, fold ──┘
/// ```
///
/// The partitions are split into `parallelism` contiguous slices. Each task owns its
/// own buffer and folds, so no combine state is shared between threads. When every
/// task is done their folds are merged pairwise, round by round, and finished.
///
/// The first task failure cancels the remaining tasks and is thrown as an
/// [ExecutionFailedException].
///
/// By default the executor creates a work-stealing pool that [#close()] shuts down. A
/// caller-supplied [ExecutorService] is never shut down by this class.
public final class ParallelExecutor implements DistributedExecutor, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(ParallelExecutor.class);

    private final ExecutorService executor;
    private final boolean ownsExecutor;

    /// Creates an executor backed by its own work-stealing pool.
    public ParallelExecutor() {
        this.executor = Executors.newWorkStealingPool();
        this.ownsExecutor = true;
    }

    /// Creates an executor on a caller-managed pool.
    ///
    /// @param executor the pool to submit tasks to
    public ParallelExecutor(ExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.ownsExecutor = false;
    }

    @Override
    public Map<ContributionKey, Object> execute(JobSpec job) {
        Objects.requireNonNull(job, "job cannot be null");
        long start = System.currentTimeMillis();

        List<PartitionRecord> partitions;
        try (Stream<PartitionRecord> stream = job.source().stream()) {
            partitions = stream.collect(Collectors.toList());
        }
        List<List<PartitionRecord>> slices = slice(partitions, job.control().parallelism());

        CompletionService<Map<ContributionKey, ReduceFold>> completion = new ExecutorCompletionService<>(executor);
        List<Future<Map<ContributionKey, ReduceFold>>> futures = new ArrayList<>(slices.size());
        for (List<PartitionRecord> slice : slices) {
            futures.add(completion.submit(mapTask(job, slice)));
        }

        List<Map<ContributionKey, ReduceFold>> partials = new ArrayList<>(slices.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                partials.add(completion.take().get());
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause() instanceof ExecutionFailedException ? e.getCause().getCause() : e.getCause();
            throw new ExecutionFailedException("Attribute job failed: " + e.getCause().getMessage(), cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new ExecutionFailedException("Interrupted while waiting for map tasks", e);
        }

        Map<ContributionKey, Object> finished;
        try {
            finished = ContributionBuffer.finish(mergePairwise(partials));
        } catch (RuntimeException e) {
            throw new ExecutionFailedException("Attribute job failed while reducing: " + e.getMessage(), e);
        }
        logger.debug("Mapped {} partitions in {} tasks into {} keys in {} ms",
            partitions.size(), slices.size(), finished.size(), System.currentTimeMillis() - start);
        return finished;
    }

    private static Callable<Map<ContributionKey, ReduceFold>> mapTask(JobSpec job, List<PartitionRecord> slice) {
        return () -> {
            PartitionMapper mapper;
            try {
                job.setup().run();
                mapper = job.mapper().create(job.parameters());
            } catch (RuntimeException e) {
                throw new ExecutionFailedException("Failed during setup: " + e.getMessage(), e);
            }
            ContributionBuffer buffer = new ContributionBuffer(job.reducer(), job.control().batchSize());
            for (PartitionRecord partition : slice) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("map task cancelled");
                }
                try {
                    mapper.map(partition, buffer);
                } catch (RuntimeException e) {
                    throw new ExecutionFailedException("Failed mapping partition " + partition.key()
                        + ": " + e.getMessage(), e);
                }
            }
            return buffer.drain();
        };
    }

    static <T> List<List<T>> slice(List<T> items, int slices) {
        int count = Math.max(1, Math.min(slices, items.size()));
        List<List<T>> result = new ArrayList<>(count);
        int size = items.size() / count;
        int remainder = items.size() % count;
        int from = 0;
        for (int i = 0; i < count; i++) {
            int to = from + size + (i < remainder ? 1 : 0);
            result.add(items.subList(from, to));
            from = to;
        }
        return result;
    }

    private static Map<ContributionKey, ReduceFold> mergePairwise(List<Map<ContributionKey, ReduceFold>> partials) {
        List<Map<ContributionKey, ReduceFold>> round = partials;
        while (round.size() > 1) {
            List<Map<ContributionKey, ReduceFold>> next = new ArrayList<>((round.size() + 1) / 2);
            for (int i = 0; i < round.size(); i += 2) {
                if (i + 1 < round.size()) {
                    next.add(ContributionBuffer.mergeInto(round.get(i), round.get(i + 1)));
                } else {
                    next.add(round.get(i));
                }
            }
            round = next;
        }
        return round.isEmpty() ? Map.of() : round.get(0);
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        for (Future<?> future : futures) {
            future.cancel(true);
        }
    }

    /// Shuts down the pool if this executor created it.
    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdown();
        }
    }
}

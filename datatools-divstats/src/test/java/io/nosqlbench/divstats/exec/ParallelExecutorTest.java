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

import io.nosqlbench.divstats.config.DivstatsConfig;
import io.nosqlbench.divstats.dataset.DatasetAttribute;
import io.nosqlbench.divstats.dataset.PartitionRecord;
import io.nosqlbench.divstats.dataset.PartitionSource;
import io.nosqlbench.divstats.engine.ContributionKey;
import io.nosqlbench.divstats.engine.GlobalCombiner;
import io.nosqlbench.divstats.plan.AttributeNeed;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ParallelExecutorTest {

    private static PartitionSource source(int partitions) {
        List<PartitionRecord> records = new ArrayList<>();
        for (int i = 0; i < partitions; i++) {
            records.add(SequentialExecutorTest.rows("p" + i, i % 7));
        }
        return PartitionSource.of(records);
    }

    @Test
    void execute_matchesSequentialResult() {
        PartitionSource source = source(50);
        Map<ContributionKey, Object> expected = new SequentialExecutor()
            .execute(SequentialExecutorTest.rowCountJob(source, ExecutionControl.defaults()));

        Map<ContributionKey, Object> actual;
        try (ParallelExecutor executor = new ParallelExecutor()) {
            actual = executor.execute(SequentialExecutorTest.rowCountJob(source, new ExecutionControl(3, 4)));
        }

        assertEquals(expected.get(ContributionKey.shape(DatasetAttribute.N_DIV)),
            actual.get(ContributionKey.shape(DatasetAttribute.N_DIV)));
        assertEquals(expected.get(ContributionKey.shape(DatasetAttribute.N_ROW)),
            actual.get(ContributionKey.shape(DatasetAttribute.N_ROW)));
        List<?> keys = (List<?>) actual.get(ContributionKey.shape(DatasetAttribute.KEYS));
        assertEquals(50, keys.size());
        assertEquals(new HashSet<>((List<?>) expected.get(ContributionKey.shape(DatasetAttribute.KEYS))),
            new HashSet<>(keys));
    }

    @Test
    void execute_surfacesTaskFailure() {
        List<PartitionRecord> records = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            records.add(SequentialExecutorTest.rows("p" + i, 1));
        }
        records.add(new PartitionRecord("broken", 17));

        try (ParallelExecutor executor = new ParallelExecutor()) {
            ExecutionFailedException e = assertThrows(ExecutionFailedException.class, () -> executor.execute(
                SequentialExecutorTest.rowCountJob(PartitionSource.of(records), new ExecutionControl(4, 4))));
            assertTrue(e.getMessage().contains("broken"), e.getMessage());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }
    }

    @Test
    void close_leavesSuppliedPoolRunning() {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            try (ParallelExecutor executor = new ParallelExecutor(pool)) {
                executor.execute(SequentialExecutorTest.rowCountJob(source(5), new ExecutionControl(1, 2)));
            }
            assertFalse(pool.isShutdown());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void slice_splitsContiguouslyAndEvenly() {
        List<List<Integer>> slices = ParallelExecutor.slice(List.of(1, 2, 3, 4, 5, 6, 7), 3);

        assertEquals(List.of(List.of(1, 2, 3), List.of(4, 5), List.of(6, 7)), slices);
        assertEquals(1, ParallelExecutor.slice(List.of(), 4).size());
        assertEquals(2, ParallelExecutor.slice(List.of(1, 2), 8).size());
    }

    @Test
    void execute_createsOneMapperPerTaskFromJobParameters() {
        JobParameters parameters = new JobParameters(AttributeNeed.of(DatasetAttribute.N_ROW), null);
        AtomicInteger created = new AtomicInteger();
        JobSpec job = JobSpec.builder()
            .source(source(9))
            .mapper(params -> {
                assertSame(parameters, params);
                created.incrementAndGet();
                return SequentialExecutorTest.localMapper().create(params);
            })
            .reducer(new GlobalCombiner(DivstatsConfig.defaults()))
            .parameters(parameters)
            .control(new ExecutionControl(2, 3))
            .build();

        Map<ContributionKey, Object> finished;
        try (ParallelExecutor executor = new ParallelExecutor()) {
            finished = executor.execute(job);
        }

        assertEquals(3, created.get());
        assertEquals(Map.of(ContributionKey.shape(DatasetAttribute.N_ROW), 22L), finished);
    }

    @Test
    void execute_labelsSetupFailure() {
        JobSpec job = JobSpec.builder()
            .setup(() -> {
                throw new IllegalStateException("worker context unavailable");
            })
            .source(source(4))
            .mapper(SequentialExecutorTest.localMapper())
            .reducer(new GlobalCombiner(DivstatsConfig.defaults()))
            .parameters(new JobParameters(AttributeNeed.of(DatasetAttribute.N_DIV), null))
            .control(new ExecutionControl(2, 2))
            .build();

        try (ParallelExecutor executor = new ParallelExecutor()) {
            ExecutionFailedException e = assertThrows(ExecutionFailedException.class, () -> executor.execute(job));
            assertTrue(e.getMessage().contains("setup"), e.getMessage());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }
    }
}

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
import io.nosqlbench.divstats.engine.LocalContributionBuilder;
import io.nosqlbench.divstats.frame.Frame;
import io.nosqlbench.divstats.frame.NumericColumn;
import io.nosqlbench.divstats.plan.AttributeNeed;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SequentialExecutorTest {

    static MapperFactory localMapper() {
        return params -> new LocalContributionBuilder(params.need(), params.transform().orElse(null), v -> 0, 10);
    }

    static JobSpec rowCountJob(PartitionSource source, ExecutionControl control) {
        AttributeNeed need = AttributeNeed.of(DatasetAttribute.N_DIV, DatasetAttribute.N_ROW, DatasetAttribute.KEYS);
        return JobSpec.builder()
            .source(source)
            .mapper(localMapper())
            .reducer(new GlobalCombiner(DivstatsConfig.defaults()))
            .parameters(new JobParameters(need, null))
            .control(control)
            .build();
    }

    static PartitionRecord rows(Object key, int rows) {
        return new PartitionRecord(key, Frame.builder().add(NumericColumn.of("x", new double[rows])).build());
    }

    @Test
    void execute_foldsEveryPartition() {
        PartitionSource source = PartitionSource.of(List.of(rows("a", 10), rows("b", 0), rows("c", 5)));

        Map<ContributionKey, Object> finished = new SequentialExecutor()
            .execute(rowCountJob(source, new ExecutionControl(2, 1)));

        assertEquals(3L, finished.get(ContributionKey.shape(DatasetAttribute.N_DIV)));
        assertEquals(15L, finished.get(ContributionKey.shape(DatasetAttribute.N_ROW)));
        assertEquals(List.of("a", "b", "c"), finished.get(ContributionKey.shape(DatasetAttribute.KEYS)));
    }

    @Test
    void execute_runsSetupOnce() {
        AtomicInteger setups = new AtomicInteger();
        AttributeNeed need = AttributeNeed.of(DatasetAttribute.N_DIV);
        JobSpec job = JobSpec.builder()
            .setup(setups::incrementAndGet)
            .source(PartitionSource.of(List.of(rows("a", 1), rows("b", 1))))
            .mapper(localMapper())
            .reducer(new GlobalCombiner(DivstatsConfig.defaults()))
            .parameters(new JobParameters(need, null))
            .build();

        new SequentialExecutor().execute(job);

        assertEquals(1, setups.get());
    }

    @Test
    void execute_emptySourceProducesNoKeys() {
        Map<ContributionKey, Object> finished = new SequentialExecutor()
            .execute(rowCountJob(PartitionSource.of(List.of()), ExecutionControl.defaults()));

        assertTrue(finished.isEmpty());
    }

    @Test
    void execute_wrapsMapperFailureWithPartitionKey() {
        PartitionSource source = PartitionSource.of(List.of(rows("a", 1), new PartitionRecord("bad", "not a frame")));

        ExecutionFailedException e = assertThrows(ExecutionFailedException.class,
            () -> new SequentialExecutor().execute(rowCountJob(source, ExecutionControl.defaults())));

        assertTrue(e.getMessage().contains("bad"), e.getMessage());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void execute_buildsMapperFromJobParameters() {
        AttributeNeed need = AttributeNeed.of(DatasetAttribute.N_DIV);
        JobParameters parameters = new JobParameters(need, null);
        AtomicReference<JobParameters> received = new AtomicReference<>();
        JobSpec job = JobSpec.builder()
            .source(PartitionSource.of(List.of(rows("a", 3), rows("b", 4))))
            .mapper(params -> {
                received.set(params);
                return localMapper().create(params);
            })
            .reducer(new GlobalCombiner(DivstatsConfig.defaults()))
            .parameters(parameters)
            .build();

        Map<ContributionKey, Object> finished = new SequentialExecutor().execute(job);

        assertSame(parameters, received.get());
        assertEquals(Map.of(ContributionKey.shape(DatasetAttribute.N_DIV), 2L), finished);
    }

    @Test
    void execute_labelsSetupFailure() {
        AtomicInteger mappersCreated = new AtomicInteger();
        JobSpec job = JobSpec.builder()
            .setup(() -> {
                throw new IllegalStateException("worker context unavailable");
            })
            .source(PartitionSource.of(List.of(rows("a", 1))))
            .mapper(params -> {
                mappersCreated.incrementAndGet();
                return localMapper().create(params);
            })
            .reducer(new GlobalCombiner(DivstatsConfig.defaults()))
            .parameters(new JobParameters(AttributeNeed.of(DatasetAttribute.N_DIV), null))
            .build();

        ExecutionFailedException e = assertThrows(ExecutionFailedException.class,
            () -> new SequentialExecutor().execute(job));

        assertTrue(e.getMessage().contains("during setup"), e.getMessage());
        assertFalse(e.getMessage().contains("reducing"), e.getMessage());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(0, mappersCreated.get());
    }
}

package dao.ore.bmine.scheduler;

import dao.ore.bmine.TestFixtures;
import dao.ore.bmine.config.MinerConfigValidator;
import dao.ore.bmine.config.SchedulerProperties;
import dao.ore.bmine.model.IdentityBatch;
import dao.ore.bmine.repository.InMemoryBatchArena;
import dao.ore.bmine.service.BatchPipeline;
import dao.ore.bmine.service.IdentityLoader;
import dao.ore.bmine.service.ResourcePool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class PooledBatchSchedulerTest {

    private ResourcePool pool;
    private BatchPipeline pipeline;
    private PooledBatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        pool = new ResourcePool(new InMemoryBatchArena());
        pipeline = mock(BatchPipeline.class);
        SchedulerProperties props = new SchedulerProperties();
        props.getPooled().setIdleSleepMs(0);
        scheduler = new PooledBatchScheduler(mock(IdentityLoader.class), pool, pipeline,
                mock(MinerConfigValidator.class), props);
    }

    @Test
    void drainOnce_takesAtMostMaxDrainBatches() throws Exception {
        pool.register(TestFixtures.batches(6, 1));
        when(pipeline.mineWithBatches(anyList())).thenReturn(Optional.empty());

        scheduler.drainOnce();

        verify(pipeline).mineWithBatches(argThat(b -> b.size() == 4));
        assertEquals(2, pool.parkedBatches());
    }

    @Test
    void drainOnce_retriesReturnedBatchesInPlace() throws Exception {
        pool.register(TestFixtures.batches(2, 1));
        when(pipeline.mineWithBatches(anyList())).thenAnswer(inv -> {
            List<IdentityBatch> batches = inv.getArgument(0);
            return Optional.of(batches);
        }).thenReturn(Optional.empty());

        scheduler.drainOnce();

        verify(pipeline, times(2)).mineWithBatches(argThat(b -> b.size() == 2));
        assertEquals(0, pool.parkedBatches());
        assertEquals(2, pool.inFlightBatches());
    }

    @Test
    void drainOnce_emptyPoolDoesNothing() throws Exception {
        pool.register(TestFixtures.batches(1, 1));
        pool.drainUpTo(1);

        scheduler.drainOnce();

        verifyNoInteractions(pipeline);
    }

    @Test
    void drainOnce_failedPassReturnsBatchesToPool() {
        pool.register(TestFixtures.batches(2, 1));
        when(pipeline.mineWithBatches(anyList())).thenThrow(new IllegalStateException("worker crashed"));

        assertThrows(IllegalStateException.class, () -> scheduler.drainOnce());

        assertEquals(2, pool.parkedBatches());
        assertEquals(0, pool.inFlightBatches());
        assertEquals(2, pool.drainUpTo(4).size());
    }

    @Test
    void drainOnce_failureAfterRetryStillReleasesEveryBatch() {
        pool.register(TestFixtures.batches(3, 2));
        when(pipeline.mineWithBatches(anyList())).thenAnswer(inv -> {
            List<IdentityBatch> batches = inv.getArgument(0);
            return Optional.of(batches);
        }).thenThrow(new RejectedExecutionException("submit pool shut down"));

        assertThrows(RejectedExecutionException.class, () -> scheduler.drainOnce());

        assertEquals(3, pool.parkedBatches());
        assertEquals(6, pool.idleIdentities());
    }
}

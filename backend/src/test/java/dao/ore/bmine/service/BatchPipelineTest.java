package dao.ore.bmine.service;

import dao.ore.bmine.TestFixtures;
import dao.ore.bmine.chain.ChainRpcClient;
import dao.ore.bmine.chain.ChainRpcException;
import dao.ore.bmine.chain.RelayClient;
import dao.ore.bmine.chain.RelayException;
import dao.ore.bmine.config.MinerProperties;
import dao.ore.bmine.config.SchedulerProperties;
import dao.ore.bmine.model.Bundle;
import dao.ore.bmine.model.Bus;
import dao.ore.bmine.model.ChainClock;
import dao.ore.bmine.model.ChainSnapshot;
import dao.ore.bmine.model.IdentityBatch;
import dao.ore.bmine.model.LatestBlockhash;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.SubmissionOutcome;
import dao.ore.bmine.model.SubmissionRecord;
import dao.ore.bmine.model.TipSnapshot;
import dao.ore.bmine.model.Treasury;
import dao.ore.bmine.model.WatchResult;
import dao.ore.bmine.repository.InMemoryBatchArena;
import dao.ore.bmine.tips.TipFeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BatchPipelineTest {

    private static final long NOW = 1_700_000_000L;

    private ChainRpcClient rpc;
    private RelayClient relay;
    private ProofSolver solver;
    private SubmissionWatcher watcher;
    private ResourcePool pool;
    private ExecutorService submitExecutor;
    private ExecutorService watchExecutor;
    private BatchPipeline pipeline;
    private List<IdentityBatch> drained;

    @BeforeEach
    void setUp() {
        rpc = mock(ChainRpcClient.class);
        relay = mock(RelayClient.class);
        solver = mock(ProofSolver.class);
        watcher = mock(SubmissionWatcher.class);
        TipFeed tipFeed = mock(TipFeed.class);
        when(tipFeed.current()).thenReturn(TipSnapshot.EMPTY);

        pool = new ResourcePool(new InMemoryBatchArena());
        pool.register(TestFixtures.batches(2, 5));
        drained = pool.drainUpTo(4);

        MinerProperties minerProps = TestFixtures.minerProperties(1000);
        minerProps.setMaxBuses(2);
        SchedulerProperties schedulerProps = new SchedulerProperties();
        submitExecutor = Executors.newSingleThreadExecutor();
        watchExecutor = Executors.newSingleThreadExecutor();

        BundleBuilder builder = new BundleBuilder(TestFixtures.oreProgram(), new FeePayerPicker(),
                TestFixtures.relayProperties(), TestFixtures.oreProperties());
        pipeline = new BatchPipeline(rpc, relay, solver, new CapacitySelector(), builder,
                new AdaptiveTipPolicy(minerProps), tipFeed, watcher, pool, minerProps, TestFixtures.oreProperties(),
                schedulerProps, submitExecutor, watchExecutor);
    }

    private void stubChain(long lastResetAt) {
        byte[] difficulty = new byte[32];
        Arrays.fill(difficulty, (byte) 0xff);
        when(rpc.fetchSnapshot()).thenReturn(new ChainSnapshot(
                new Treasury(difficulty, lastResetAt, 10),
                new ChainClock(500, NOW),
                List.of(new Bus(0, 1_000_000), new Bus(1, 10), new Bus(2, 2_000_000), new Bus(3, 3_000_000))));
        when(rpc.fetchBalances(anyList())).thenAnswer(inv -> {
            Map<PublicKey, Long> balances = new HashMap<>();
            List<PublicKey> keys = inv.getArgument(0);
            for (PublicKey key : keys) {
                balances.put(key, 5_000_000L);
            }
            return balances;
        });
        when(rpc.fetchRequiredProofs(anyList())).thenAnswer(inv -> {
            List<PublicKey> addresses = inv.getArgument(0);
            List<Proof> proofs = new ArrayList<>();
            for (PublicKey address : addresses) {
                proofs.add(new Proof(address, 0, new byte[32]));
            }
            return proofs;
        });
        when(solver.solve(anyInt(), any(), anyList()))
                .thenAnswer(inv -> TestFixtures.solveResults(((List<?>) inv.getArgument(2)).size()));
        when(rpc.fetchLatestBlockhash()).thenReturn(new LatestBlockhash(new byte[32], 600));
    }

    private void awaitBackground() throws InterruptedException {
        submitExecutor.shutdown();
        assertTrue(submitExecutor.awaitTermination(10, TimeUnit.SECONDS));
        watchExecutor.shutdown();
        assertTrue(watchExecutor.awaitTermination(10, TimeUnit.SECONDS));
    }

    @Test
    void fetchFailure_returnsBatchesForRetry() {
        when(rpc.fetchSnapshot()).thenThrow(new ChainRpcException("connection refused"));

        Optional<List<IdentityBatch>> retry = pipeline.mineWithBatches(drained);

        assertTrue(retry.isPresent());
        assertEquals(drained, retry.get());
        assertEquals(2, pool.inFlightBatches());
        verifyNoInteractions(relay, solver);
    }

    @Test
    void solveOverrunningEpoch_returnsBatchesForRetry() {
        stubChain(NOW - 60);

        Optional<List<IdentityBatch>> retry = pipeline.mineWithBatches(drained);

        assertTrue(retry.isPresent());
        verifyNoInteractions(relay);
    }

    @Test
    void success_sendsOneBundlePerBatchPerBusAndReleasesAfterWatch() throws Exception {
        stubChain(NOW);
        when(relay.sendBundle(any(Bundle.class))).thenReturn("bundle-id");
        when(watcher.watch(any(SubmissionRecord.class)))
                .thenReturn(new WatchResult(SubmissionOutcome.LANDED, List.of("sig"), 610, 1));

        Optional<List<IdentityBatch>> retry = pipeline.mineWithBatches(drained);
        awaitBackground();

        assertTrue(retry.isEmpty());
        // 2 batches x the 2 richest usable buses
        verify(relay, times(4)).sendBundle(any(Bundle.class));
        verify(watcher, times(2)).watch(argThat(r -> r.signatures().size() == 2
                && r.rewardEstimate() == 10 * 5 && r.sentAtSlot() == 600 && r.tipPaid() == 1000));
        assertEquals(2, pool.parkedBatches());
        assertEquals(0, pool.inFlightBatches());
    }

    @Test
    void solverReceivesCombinedIdentitySet() throws Exception {
        stubChain(NOW);
        when(relay.sendBundle(any(Bundle.class))).thenReturn("bundle-id");
        when(watcher.watch(any(SubmissionRecord.class)))
                .thenReturn(new WatchResult(SubmissionOutcome.DROPPED, List.of(), 800, 1));

        pipeline.mineWithBatches(drained);
        awaitBackground();

        verify(solver).solve(eq(0), any(), argThat(requests -> requests.size() == 10));
        assertEquals(2, pool.parkedBatches());
    }

    @Test
    void relayFailure_releasesWithoutWatching() throws Exception {
        stubChain(NOW);
        when(relay.sendBundle(any(Bundle.class))).thenThrow(new RelayException("rate limited"));

        Optional<List<IdentityBatch>> retry = pipeline.mineWithBatches(drained);
        awaitBackground();

        assertTrue(retry.isEmpty());
        verifyNoInteractions(watcher);
        assertEquals(2, pool.parkedBatches());
    }

    @Test
    void missingBalance_releasesBatch() throws Exception {
        stubChain(NOW);
        when(rpc.fetchBalances(anyList())).thenReturn(Map.of());

        pipeline.mineWithBatches(drained);
        awaitBackground();

        verifyNoInteractions(relay, watcher);
        assertEquals(2, pool.parkedBatches());
    }

    @Test
    void watchFailure_stillReleases() throws Exception {
        stubChain(NOW);
        when(relay.sendBundle(any(Bundle.class))).thenReturn("bundle-id");
        when(watcher.watch(any(SubmissionRecord.class))).thenThrow(new IllegalStateException("boom"));

        pipeline.mineWithBatches(drained);
        awaitBackground();

        assertEquals(2, pool.parkedBatches());
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void releaseFailureAfterWatch_isLogged(CapturedOutput output) throws Exception {
        stubChain(NOW);
        when(relay.sendBundle(any(Bundle.class))).thenReturn("bundle-id");
        when(watcher.watch(any(SubmissionRecord.class)))
                .thenReturn(new WatchResult(SubmissionOutcome.LANDED, List.of("sig"), 610, 1));
        TipFeed tipFeed = mock(TipFeed.class);
        when(tipFeed.current()).thenReturn(TipSnapshot.EMPTY);
        ResourcePool brokenPool = mock(ResourcePool.class);
        doThrow(new IllegalStateException("batch released while not in flight")).when(brokenPool).release(any());
        BatchPipeline withBrokenPool = new BatchPipeline(rpc, relay, solver, new CapacitySelector(),
                new BundleBuilder(TestFixtures.oreProgram(), new FeePayerPicker(), TestFixtures.relayProperties(),
                        TestFixtures.oreProperties()),
                new AdaptiveTipPolicy(TestFixtures.minerProperties(1000)), tipFeed, watcher, brokenPool,
                TestFixtures.minerProperties(1000), TestFixtures.oreProperties(), new SchedulerProperties(),
                submitExecutor, watchExecutor);

        withBrokenPool.mineWithBatches(drained);
        awaitBackground();

        verify(brokenPool, times(2)).release(any());
        assertTrue(output.getOut().contains("release failed"));
    }
}

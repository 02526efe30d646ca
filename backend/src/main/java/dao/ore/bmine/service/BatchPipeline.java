package dao.ore.bmine.service;

import dao.ore.bmine.chain.ChainRpcClient;
import dao.ore.bmine.chain.RelayClient;
import dao.ore.bmine.config.MinerProperties;
import dao.ore.bmine.config.OreProperties;
import dao.ore.bmine.config.SchedulerProperties;
import dao.ore.bmine.model.Bundle;
import dao.ore.bmine.model.Bus;
import dao.ore.bmine.model.ChainSnapshot;
import dao.ore.bmine.model.IdentityBatch;
import dao.ore.bmine.model.Identity;
import dao.ore.bmine.model.LatestBlockhash;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.SolveRequest;
import dao.ore.bmine.model.SolveResult;
import dao.ore.bmine.model.SubmissionRecord;
import dao.ore.bmine.model.TipSnapshot;
import dao.ore.bmine.tips.TipFeed;
import dao.ore.bmine.util.OreUnits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * One pooled-mode pass over a drained group of batches.
 * <p>
 * Chain state is fetched once for the group and solving runs over the combined identity set. Submission and
 * confirmation happen in the background; each batch goes back to the {@link ResourcePool} exactly once, when its
 * watch resolves or as soon as it is known nothing was sent for it. When the pass fails before anything is
 * handed to the background, the whole group is returned to the caller for an immediate retry instead.
 */
@Slf4j
@Service
public class BatchPipeline {

    private final ChainRpcClient rpc;
    private final RelayClient relay;
    private final ProofSolver solver;
    private final CapacitySelector capacitySelector;
    private final BundleBuilder bundleBuilder;
    private final AdaptiveTipPolicy tipPolicy;
    private final TipFeed tipFeed;
    private final SubmissionWatcher watcher;
    private final ResourcePool pool;
    private final MinerProperties minerProps;
    private final OreProperties oreProps;
    private final SchedulerProperties.PooledConfig pooledConfig;
    private final ExecutorService submitExecutor;
    private final ExecutorService watchExecutor;

    @Autowired
    public BatchPipeline(ChainRpcClient rpc, RelayClient relay, ProofSolver solver, CapacitySelector capacitySelector,
                         BundleBuilder bundleBuilder, AdaptiveTipPolicy tipPolicy, TipFeed tipFeed,
                         SubmissionWatcher watcher, ResourcePool pool, MinerProperties minerProps,
                         OreProperties oreProps, SchedulerProperties schedulerProps) {
        this(rpc, relay, solver, capacitySelector, bundleBuilder, tipPolicy, tipFeed, watcher, pool, minerProps,
                oreProps, schedulerProps,
                Executors.newFixedThreadPool(Math.max(1, schedulerProps.getPooled().getSubmitParallel())),
                Executors.newCachedThreadPool());
    }

    BatchPipeline(ChainRpcClient rpc, RelayClient relay, ProofSolver solver, CapacitySelector capacitySelector,
                  BundleBuilder bundleBuilder, AdaptiveTipPolicy tipPolicy, TipFeed tipFeed,
                  SubmissionWatcher watcher, ResourcePool pool, MinerProperties minerProps,
                  OreProperties oreProps, SchedulerProperties schedulerProps,
                  ExecutorService submitExecutor, ExecutorService watchExecutor) {
        this.rpc = rpc;
        this.relay = relay;
        this.solver = solver;
        this.capacitySelector = capacitySelector;
        this.bundleBuilder = bundleBuilder;
        this.tipPolicy = tipPolicy;
        this.tipFeed = tipFeed;
        this.watcher = watcher;
        this.pool = pool;
        this.minerProps = minerProps;
        this.oreProps = oreProps;
        this.pooledConfig = schedulerProps.getPooled();
        this.submitExecutor = submitExecutor;
        this.watchExecutor = watchExecutor;
    }

    /**
     * @return the same batches when the pass must be retried right away, empty when they were handed off
     */
    public Optional<List<IdentityBatch>> mineWithBatches(List<IdentityBatch> batches) {
        List<PublicKey> signers = new ArrayList<>();
        List<PublicKey> proofAddresses = new ArrayList<>();
        for (IdentityBatch batch : batches) {
            signers.addAll(batch.publicKeys());
            proofAddresses.addAll(batch.proofAddresses());
        }

        ChainSnapshot snapshot;
        Map<PublicKey, Long> balances;
        List<Proof> proofs;
        try {
            snapshot = rpc.fetchSnapshot();
            balances = rpc.fetchBalances(signers);
            proofs = rpc.fetchRequiredProofs(proofAddresses);
        } catch (RuntimeException e) {
            log.error("fetch chain state failed: {}", e.getMessage());
            return retryAfter(minerProps.getRetryBackoffMs(), batches);
        }

        Duration timeToEpoch = snapshot.timeToNextEpoch(oreProps.getEpochDurationSeconds());
        List<SolveRequest> requests = new ArrayList<>(signers.size());
        for (int i = 0; i < signers.size(); i++) {
            requests.add(new SolveRequest(proofs.get(i).hash(), signers.get(i)));
        }

        long solveStart = System.nanoTime();
        List<SolveResult> results;
        try {
            results = solver.solve(pooledConfig.getThreads(), snapshot.treasury().difficulty(), requests);
        } catch (SolverException e) {
            log.error("solve failed: {}", e.getMessage());
            return retryAfter(minerProps.getRetryBackoffMs(), batches);
        }
        long solveNanos = System.nanoTime() - solveStart;

        if (solveNanos > timeToEpoch.toNanos()) {
            log.warn("mining took too long ({}s), waiting for next epoch", OreUnits.formatSeconds(solveNanos));
            return retryAfter(timeToEpoch.toMillis(), batches);
        }
        log.info("mining done: identities={}, idle={}, mining={}s", signers.size(), pool.idleIdentities(),
                OreUnits.formatSeconds(solveNanos));

        long rewardRate = snapshot.treasury().rewardRate();
        List<Bus> buses = capacitySelector.select(snapshot.buses(),
                        rewardRate * (signers.size() + pooledConfig.getBusHeadroom()))
                .stream().limit(minerProps.getMaxBuses()).toList();
        if (buses.isEmpty()) {
            log.warn("no bus available for mining, waiting for next epoch");
            return retryAfter(timeToEpoch.toMillis(), batches);
        }

        LatestBlockhash blockhash;
        try {
            blockhash = rpc.fetchLatestBlockhash();
        } catch (RuntimeException e) {
            log.error("fetch latest blockhash failed: {}", e.getMessage());
            return retryAfter(timeToEpoch.toMillis(), batches);
        }

        List<SolveResult> solved = results;
        submitExecutor.execute(() -> sendBundles(batches, solved, balances, buses, blockhash, rewardRate, solveNanos));
        return Optional.empty();
    }

    void sendBundles(List<IdentityBatch> batches, List<SolveResult> results, Map<PublicKey, Long> balances,
                     List<Bus> buses, LatestBlockhash blockhash, long rewardRate, long solveNanos) {
        TipSnapshot tips = tipFeed.current();
        long tip = tipPolicy.tipFor(tips);

        int offset = 0;
        for (IdentityBatch batch : batches) {
            List<SolveResult> batchResults = results.subList(offset, offset + batch.size());
            offset += batch.size();
            try {
                sendBatch(batch, batchResults, balances, buses, blockhash, rewardRate, tip, tips, solveNanos);
            } catch (RuntimeException e) {
                log.error("[batch-{}] send bundles failed: {}", batch.id(), e.getMessage());
                pool.release(batch);
            }
        }
    }

    private void sendBatch(IdentityBatch batch, List<SolveResult> results, Map<PublicKey, Long> balances,
                           List<Bus> buses, LatestBlockhash blockhash, long rewardRate, long tip, TipSnapshot tips,
                           long solveNanos) {
        List<Identity> identities = batch.identities();
        long sentAtNanos = System.nanoTime();
        List<String> signatures = new ArrayList<>();

        for (Bus bus : buses) {
            for (Bundle bundle : bundleBuilder.build(identities, results, balances, blockhash.blockhash(), bus, tip)) {
                String signature = bundle.trackingSignature();
                try {
                    String bundleId = relay.sendBundle(bundle);
                    log.debug("[batch-{}] bundle sent: sig={}, bundle={}", batch.id(), signature, bundleId);
                    signatures.add(signature);
                } catch (RuntimeException e) {
                    log.error("[batch-{}] send bundle failed: sig={}, error={}", batch.id(), signature, e.getMessage());
                }
            }
        }

        if (signatures.isEmpty()) {
            log.warn("[batch-{}] nothing sent, releasing", batch.id());
            pool.release(batch);
            return;
        }

        log.info("[batch-{}] bundles sent: mining={}s, tip={}, p25={}, p50={}, slot={}", batch.id(),
                OreUnits.formatSeconds(solveNanos), tip, tips.p25(), tips.p50(), blockhash.slot());

        SubmissionRecord record = new SubmissionRecord("batch-" + batch.id(), signatures, blockhash.slot(),
                rewardRate * batch.size(), tip, sentAtNanos);
        CompletableFuture.supplyAsync(() -> watcher.watch(record), watchExecutor)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("[batch-{}] watch failed: {}", batch.id(), error.getMessage());
                    }
                    try {
                        pool.release(batch);
                    } catch (RuntimeException e) {
                        log.error("[batch-{}] release failed: {}", batch.id(), e.getMessage(), e);
                    }
                });
    }

    private static Optional<List<IdentityBatch>> retryAfter(long millis, List<IdentityBatch> batches) {
        if (millis > 0) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return Optional.of(batches);
    }

    @jakarta.annotation.PreDestroy
    public void shutdown() {
        submitExecutor.shutdownNow();
        watchExecutor.shutdownNow();
    }
}

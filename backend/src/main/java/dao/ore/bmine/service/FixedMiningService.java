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
import dao.ore.bmine.model.LatestBlockhash;
import dao.ore.bmine.model.Proof;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.model.SolveRequest;
import dao.ore.bmine.model.SolveResult;
import dao.ore.bmine.model.SubmissionRecord;
import dao.ore.bmine.model.TipSnapshot;
import dao.ore.bmine.model.WatchResult;
import dao.ore.bmine.tips.TipFeed;
import dao.ore.bmine.util.OreUnits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;

/**
 * One fixed-mode worker cycle: mine under a shared permit, then submit and wait for landing inline.
 * <p>
 * The permit bounds how many workers fetch and solve at the same time; it is released before submission so
 * confirmation waits do not hold back other workers.
 */
@Slf4j
@Service
public class FixedMiningService {

    public enum CycleResult { LANDED, DROPPED, SKIPPED }

    private final ChainRpcClient rpc;
    private final RelayClient relay;
    private final ProofSolver solver;
    private final CapacitySelector capacitySelector;
    private final BundleBuilder bundleBuilder;
    private final AdaptiveTipPolicy tipPolicy;
    private final TipFeed tipFeed;
    private final SubmissionWatcher watcher;
    private final MinerProperties minerProps;
    private final OreProperties oreProps;
    private final SchedulerProperties.FixedConfig fixedConfig;
    private final Semaphore permits;

    public FixedMiningService(ChainRpcClient rpc, RelayClient relay, ProofSolver solver,
                              CapacitySelector capacitySelector, BundleBuilder bundleBuilder,
                              AdaptiveTipPolicy tipPolicy, TipFeed tipFeed, SubmissionWatcher watcher,
                              MinerProperties minerProps, OreProperties oreProps,
                              SchedulerProperties schedulerProps) {
        this.rpc = rpc;
        this.relay = relay;
        this.solver = solver;
        this.capacitySelector = capacitySelector;
        this.bundleBuilder = bundleBuilder;
        this.tipPolicy = tipPolicy;
        this.tipFeed = tipFeed;
        this.watcher = watcher;
        this.minerProps = minerProps;
        this.oreProps = oreProps;
        this.fixedConfig = schedulerProps.getFixed();
        this.permits = new Semaphore(Math.max(1, fixedConfig.getConcurrency()), true);
    }

    public CycleResult mineOnce(IdentityBatch batch) throws InterruptedException {
        String label = "miner-" + batch.id();
        List<PublicKey> signers = batch.publicKeys();

        Map<PublicKey, Long> balances;
        try {
            balances = rpc.fetchBalances(signers);
        } catch (RuntimeException e) {
            log.error("[{}] fetch balances failed: {}", label, e.getMessage());
            Thread.sleep(minerProps.getRetryBackoffMs());
            return CycleResult.SKIPPED;
        }

        long queueStart = System.nanoTime();
        ChainSnapshot snapshot;
        List<SolveResult> results;
        long queueNanos;
        long solveNanos;
        Duration timeToEpoch;
        permits.acquire();
        try {
            queueNanos = System.nanoTime() - queueStart;
            List<Proof> proofs;
            try {
                snapshot = rpc.fetchSnapshot();
                proofs = rpc.fetchRequiredProofs(batch.proofAddresses());
            } catch (RuntimeException e) {
                log.error("[{}] fetch chain state failed: {}", label, e.getMessage());
                Thread.sleep(minerProps.getRetryBackoffMs());
                return CycleResult.SKIPPED;
            }

            timeToEpoch = snapshot.timeToNextEpoch(oreProps.getEpochDurationSeconds());
            List<SolveRequest> requests = new ArrayList<>(signers.size());
            for (int i = 0; i < signers.size(); i++) {
                requests.add(new SolveRequest(proofs.get(i).hash(), signers.get(i)));
            }

            long solveStart = System.nanoTime();
            try {
                results = solver.solve(fixedConfig.getThreads(), snapshot.treasury().difficulty(), requests);
            } catch (SolverException e) {
                log.error("[{}] solve failed: {}", label, e.getMessage());
                Thread.sleep(minerProps.getRetryBackoffMs());
                return CycleResult.SKIPPED;
            }
            solveNanos = System.nanoTime() - solveStart;

            if (solveNanos > timeToEpoch.toNanos()) {
                log.warn("[{}] mining took too long ({}s), waiting for next epoch", label,
                        OreUnits.formatSeconds(solveNanos));
                Thread.sleep(timeToEpoch.toMillis());
                return CycleResult.SKIPPED;
            }
        } finally {
            permits.release();
        }
        log.debug("[{}] mining done: mining={}s, queue={}s", label, OreUnits.formatSeconds(solveNanos),
                OreUnits.formatSeconds(queueNanos));

        long rewardRate = snapshot.treasury().rewardRate();
        List<Bus> buses = capacitySelector.select(snapshot.buses(),
                        rewardRate * (signers.size() + fixedConfig.getBusHeadroom()))
                .stream().limit(minerProps.getMaxBuses()).toList();
        if (buses.isEmpty()) {
            log.warn("[{}] no bus available for mining, waiting for next epoch", label);
            Thread.sleep(timeToEpoch.toMillis());
            return CycleResult.SKIPPED;
        }

        TipSnapshot tips = tipFeed.current();
        long tip = tipPolicy.tipFor(tips);

        LatestBlockhash blockhash;
        try {
            blockhash = rpc.fetchLatestBlockhash();
        } catch (RuntimeException e) {
            log.error("[{}] fetch latest blockhash failed: {}", label, e.getMessage());
            Thread.sleep(minerProps.getRetryBackoffMs());
            return CycleResult.SKIPPED;
        }

        long sentAtNanos = System.nanoTime();
        List<String> signatures = new ArrayList<>();
        try {
            for (Bus bus : buses) {
                for (Bundle bundle : bundleBuilder.build(batch.identities(), results, balances,
                        blockhash.blockhash(), bus, tip)) {
                    if (send(label, bundle, balances)) {
                        signatures.add(bundle.trackingSignature());
                    }
                }
            }
        } catch (MissingBalanceException e) {
            log.error("[{}] skipping cycle: {}", label, e.getMessage());
            Thread.sleep(minerProps.getRetryBackoffMs());
            return CycleResult.SKIPPED;
        }

        if (signatures.isEmpty()) {
            log.warn("[{}] no bundle sent", label);
            return CycleResult.SKIPPED;
        }

        log.info("[{}] bundles sent: mining={}s, queue={}s, tip={}, p25={}, p50={}, slot={}", label,
                OreUnits.formatSeconds(solveNanos), OreUnits.formatSeconds(queueNanos), tip, tips.p25(), tips.p50(),
                blockhash.slot());

        WatchResult result = watcher.watch(new SubmissionRecord(label, signatures, blockhash.slot(),
                rewardRate * signers.size(), tip, sentAtNanos));
        return result.landed() ? CycleResult.LANDED : CycleResult.DROPPED;
    }

    private boolean send(String label, Bundle bundle, Map<PublicKey, Long> balances) {
        String bundleId;
        try {
            bundleId = relay.sendBundle(bundle);
        } catch (RuntimeException e) {
            log.error("[{}] send bundle failed: {}", label, e.getMessage());
            return false;
        }
        bundle.feeCosts().forEach((feePayer, cost) -> {
            long balance = balances.getOrDefault(feePayer, 0L);
            if (balance < cost) {
                log.error("[{}] insufficient balance for fee: feePayer={}, balance={}, cost={}",
                        label, feePayer, balance, cost);
            }
        });
        log.debug("[{}] bundle sent: bundle={}, sig={}", label, bundleId, bundle.trackingSignature());
        return true;
    }
}

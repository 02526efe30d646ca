package dao.ore.bmine.scheduler;

import dao.ore.bmine.config.MinerConfigValidator;
import dao.ore.bmine.model.Identity;
import dao.ore.bmine.model.IdentityBatch;
import dao.ore.bmine.service.FixedMiningService;
import dao.ore.bmine.service.IdentityLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed mode: one persistent worker per static identity batch, each looping forever.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "scheduler", name = "mode", havingValue = "FIXED", matchIfMissing = true)
public class FixedWorkerScheduler {

    private final IdentityLoader identityLoader;
    private final FixedMiningService miningService;
    private final MinerConfigValidator validator;

    private ExecutorService workers;

    public FixedWorkerScheduler(IdentityLoader identityLoader,
                                FixedMiningService miningService,
                                MinerConfigValidator validator) {
        this.identityLoader = identityLoader;
        this.miningService = miningService;
        this.validator = validator;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        List<Identity> identities = identityLoader.identities();
        int batchSize = validator.validate(identities.size());

        List<IdentityBatch> batches = partition(identities, batchSize);
        AtomicInteger threadSeq = new AtomicInteger();
        workers = Executors.newFixedThreadPool(batches.size(), r -> {
            Thread t = new Thread(r, "miner-" + threadSeq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        for (IdentityBatch batch : batches) {
            workers.execute(() -> runWorker(batch));
        }
        log.info("Fixed mode started: workers={}, identities={}", batches.size(), identities.size());
    }

    private void runWorker(IdentityBatch batch) {
        log.info("miner {} started: accounts={}", batch.id(), batch.size());
        while (!Thread.currentThread().isInterrupted()) {
            try {
                miningService.mineOnce(batch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("miner {} cycle failed: {}", batch.id(), e.getMessage(), e);
            }
        }
        log.info("miner {} stopped", batch.id());
    }

    static List<IdentityBatch> partition(List<Identity> identities, int batchSize) {
        List<IdentityBatch> batches = new ArrayList<>();
        for (int from = 0, id = 0; from < identities.size(); from += batchSize, id++) {
            batches.add(new IdentityBatch(id, identities.subList(from, Math.min(from + batchSize, identities.size()))));
        }
        return batches;
    }

    @jakarta.annotation.PreDestroy
    public synchronized void shutdown() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }
}

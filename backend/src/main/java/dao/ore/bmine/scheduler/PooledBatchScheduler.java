package dao.ore.bmine.scheduler;

import dao.ore.bmine.config.MinerConfigValidator;
import dao.ore.bmine.config.SchedulerProperties;
import dao.ore.bmine.model.Identity;
import dao.ore.bmine.model.IdentityBatch;
import dao.ore.bmine.service.BatchPipeline;
import dao.ore.bmine.service.IdentityLoader;
import dao.ore.bmine.service.ResourcePool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Pooled mode: drains parked batches from the {@link ResourcePool} and feeds them to the {@link BatchPipeline}.
 * Batches come back to the pool from background confirmation watches.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "scheduler", name = "mode", havingValue = "POOLED")
public class PooledBatchScheduler {

    private final IdentityLoader identityLoader;
    private final ResourcePool pool;
    private final BatchPipeline pipeline;
    private final MinerConfigValidator validator;
    private final SchedulerProperties.PooledConfig pooledConfig;

    private Thread thread;

    public PooledBatchScheduler(IdentityLoader identityLoader,
                                ResourcePool pool,
                                BatchPipeline pipeline,
                                MinerConfigValidator validator,
                                SchedulerProperties schedulerProps) {
        this.identityLoader = identityLoader;
        this.pool = pool;
        this.pipeline = pipeline;
        this.validator = validator;
        this.pooledConfig = schedulerProps.getPooled();
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        List<Identity> identities = identityLoader.identities();
        int batchSize = validator.validate(identities.size());
        pool.register(FixedWorkerScheduler.partition(identities, batchSize));
        log.info("splitted signers into batches: batches={}, batchSize={}", identities.size() / batchSize, batchSize);

        thread = new Thread(this::drainLoop, "pool-scheduler");
        thread.setDaemon(true);
        thread.start();
    }

    void drainLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            try {
                drainOnce();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("pooled pass failed: {}", e.getMessage(), e);
            }
        }
        log.info("pool scheduler stopped");
    }

    /**
     * One drain plus as many immediate retries as the pipeline asks for. Batches still held when a pass
     * throws go back to the pool before the exception propagates.
     */
    void drainOnce() throws InterruptedException {
        List<IdentityBatch> batches = pool.drainUpTo(pooledConfig.getMaxDrain());
        if (batches.isEmpty()) {
            log.debug("no batch parked, waiting");
            Thread.sleep(pooledConfig.getIdleSleepMs());
            return;
        }
        Optional<List<IdentityBatch>> retry = Optional.of(batches);
        while (retry.isPresent()) {
            List<IdentityBatch> held = retry.get();
            if (Thread.currentThread().isInterrupted()) {
                held.forEach(pool::release);
                throw new InterruptedException("pool scheduler interrupted");
            }
            try {
                retry = pipeline.mineWithBatches(held);
            } catch (RuntimeException e) {
                held.forEach(pool::release);
                log.warn("pooled pass aborted, released {} batches", held.size());
                throw e;
            }
        }
    }

    @jakarta.annotation.PreDestroy
    public synchronized void shutdown() {
        if (thread != null) {
            thread.interrupt();
        }
    }
}

package dao.ore.bmine.service;

import dao.ore.bmine.model.IdentityBatch;
import dao.ore.bmine.repository.BatchArena;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded queue of free batch ids over the {@link BatchArena}.
 * <p>
 * Every registered batch is at any time either parked in the queue or in flight (drained and not yet released).
 * Releasing a batch that is not in flight is a bug and fails loudly.
 */
@Slf4j
@Service
public class ResourcePool {

    private final BatchArena arena;
    private final Set<Integer> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicInteger idleIdentities = new AtomicInteger();

    private volatile BlockingQueue<Integer> freeIds = new ArrayBlockingQueue<>(1);

    public ResourcePool(BatchArena arena) {
        this.arena = arena;
    }

    public synchronized void register(List<IdentityBatch> batches) {
        if (arena.size() > 0) {
            throw new IllegalStateException("pool already registered");
        }
        if (batches.isEmpty()) {
            throw new IllegalArgumentException("no batches to register");
        }
        BlockingQueue<Integer> queue = new ArrayBlockingQueue<>(batches.size());
        for (IdentityBatch batch : batches) {
            arena.save(batch);
            queue.add(batch.id());
            idleIdentities.addAndGet(batch.size());
        }
        freeIds = queue;
        log.info("pool registered: batches={}, identities={}", batches.size(), idleIdentities.get());
    }

    /**
     * Non-blocking: takes whatever is parked, at most {@code max} batches.
     */
    public List<IdentityBatch> drainUpTo(int max) {
        List<Integer> ids = new ArrayList<>(max);
        freeIds.drainTo(ids, max);
        List<IdentityBatch> drained = new ArrayList<>(ids.size());
        for (Integer id : ids) {
            IdentityBatch batch = arena.findById(id)
                    .orElseThrow(() -> new IllegalStateException("unknown batch id " + id));
            inFlight.add(id);
            idleIdentities.addAndGet(-batch.size());
            drained.add(batch);
        }
        return drained;
    }

    public void release(IdentityBatch batch) {
        if (!inFlight.remove(batch.id())) {
            throw new IllegalStateException("batch " + batch.id() + " released while not in flight");
        }
        idleIdentities.addAndGet(batch.size());
        if (!freeIds.offer(batch.id())) {
            throw new IllegalStateException("pool overflow releasing batch " + batch.id());
        }
        log.debug("batch {} released: idle={}", batch.id(), idleIdentities.get());
    }

    public int idleIdentities() {
        return idleIdentities.get();
    }

    public int parkedBatches() {
        return freeIds.size();
    }

    public int inFlightBatches() {
        return inFlight.size();
    }
}

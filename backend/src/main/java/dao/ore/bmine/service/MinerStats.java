package dao.ore.bmine.service;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide landing counters. Pending rewards are swapped out by the periodic report.
 */
@Component
public class MinerStats {

    private final AtomicLong pendingRewards = new AtomicLong();
    private final AtomicLong totalRewards = new AtomicLong();
    private final AtomicLong landed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public void recordLanded(long reward) {
        landed.incrementAndGet();
        pendingRewards.addAndGet(reward);
        totalRewards.addAndGet(reward);
    }

    public void recordDropped() {
        dropped.incrementAndGet();
    }

    public long takePendingRewards() {
        return pendingRewards.getAndSet(0);
    }

    public long getTotalRewards() {
        return totalRewards.get();
    }

    public long getLanded() {
        return landed.get();
    }

    public long getDropped() {
        return dropped.get();
    }
}

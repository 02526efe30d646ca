package dao.ore.bmine.model;

import java.time.Duration;
import java.util.List;

/**
 * Treasury, clock and buses fetched together for one mining cycle. Never mutated, only replaced.
 */
public record ChainSnapshot(Treasury treasury, ChainClock clock, List<Bus> buses) {

    public ChainSnapshot {
        buses = List.copyOf(buses);
    }

    /**
     * Time left before the epoch rolls over and the difficulty in this snapshot goes stale. Zero once past.
     */
    public Duration timeToNextEpoch(long epochDurationSeconds) {
        long resetThreshold = treasury.lastResetAt() + epochDurationSeconds;
        long remaining = resetThreshold - clock.unixTimestamp();
        return Duration.ofSeconds(Math.max(0L, remaining));
    }
}

package dao.ore.bmine.service;

import dao.ore.bmine.config.MinerProperties;
import dao.ore.bmine.model.TipSnapshot;
import org.springframework.stereotype.Component;

/**
 * Bids just above the median landed tip, bounded by a floor and a cap.
 */
@Component
public class AdaptiveTipPolicy {

    private final MinerProperties minerProps;

    public AdaptiveTipPolicy(MinerProperties minerProps) {
        this.minerProps = minerProps;
    }

    public long tipFor(TipSnapshot snapshot) {
        return adaptiveTip(minerProps.requirePriorityFee(), minerProps.getMaxAdaptiveTip(), snapshot,
                minerProps.getAdaptiveTipFloor());
    }

    /**
     * {@code cap == 0} disables adaptive bidding; a cold feed ({@code p50 == 0}) falls back to {@code base}.
     */
    public static long adaptiveTip(long base, long cap, TipSnapshot snapshot, long floor) {
        if (cap == 0) {
            return base;
        }
        if (snapshot.p50() == 0) {
            return base;
        }
        return Math.min(cap, Math.max(floor, snapshot.p50() + 1));
    }
}

package dao.ore.bmine.model;

/**
 * Landed-tip percentiles in lamports. All zero until the feed delivers a first sample.
 */
public record TipSnapshot(long p25, long p50, long p75, long p95, long p99) {

    public static final TipSnapshot EMPTY = new TipSnapshot(0, 0, 0, 0, 0);

    @Override
    public String toString() {
        return "tips(p25=" + p25 + ",p50=" + p50 + ",p75=" + p75 + ",p95=" + p95 + ",p99=" + p99 + ")";
    }
}

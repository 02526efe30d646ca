package dao.ore.bmine.tips;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dao.ore.bmine.model.TipSnapshot;

/**
 * One record of the tip stream. Percentiles arrive in SOL and are converted to lamports.
 *
 * Example:
 * {"time":"2024-05-01T00:00:00Z","landed_tips_25th_percentile":1.0E-5,"landed_tips_50th_percentile":2.0E-5,...}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TipFloorSample(
        @JsonProperty("landed_tips_25th_percentile") double p25Landed,
        @JsonProperty("landed_tips_50th_percentile") double p50Landed,
        @JsonProperty("landed_tips_75th_percentile") double p75Landed,
        @JsonProperty("landed_tips_95th_percentile") double p95Landed,
        @JsonProperty("landed_tips_99th_percentile") double p99Landed
) {

    private static final double LAMPORTS_PER_SOL = 1e9;

    public TipSnapshot toSnapshot() {
        return new TipSnapshot(
                lamports(p25Landed),
                lamports(p50Landed),
                lamports(p75Landed),
                lamports(p95Landed),
                lamports(p99Landed)
        );
    }

    private static long lamports(double sol) {
        return Math.round(sol * LAMPORTS_PER_SOL);
    }
}

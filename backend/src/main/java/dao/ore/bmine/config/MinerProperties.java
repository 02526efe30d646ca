package dao.ore.bmine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "miner")
@Data
public class MinerProperties {

    /**
     * Folder containing one keypair JSON file (64-byte array) per identity.
     */
    private String keyFolder;

    /**
     * Base tip in lamports attached to every bundle. Required.
     */
    private Long priorityFee;

    /**
     * Upper bound for adaptive tips. 0 disables adaptive bidding and always uses priorityFee.
     */
    private long maxAdaptiveTip = 0;

    /**
     * Lower bound applied to adaptive tips once the tip feed is warm.
     */
    private long adaptiveTipFloor = 30_000;

    /**
     * Maximum number of buses to submit to per cycle. Must be greater than 0.
     */
    private int maxBuses = 2;

    /**
     * Backoff after a transient RPC failure.
     */
    private long retryBackoffMs = 500;

    public long requirePriorityFee() {
        if (priorityFee == null) {
            throw new IllegalStateException("miner.priority-fee must be set");
        }
        return priorityFee;
    }
}

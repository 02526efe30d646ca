package dao.ore.bmine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "ore")
@Data
public class OreProperties {

    /**
     * Mining program id (base58).
     */
    private String programId;

    /**
     * Treasury account (base58).
     */
    private String treasuryAddress;

    /**
     * Reward token mint (base58).
     */
    private String mintAddress;

    /**
     * Bus accounts, indexed by bus id. Derived from the program id (seed "bus" + id) when empty.
     */
    private List<String> busAddresses = new ArrayList<>();

    /**
     * Number of buses to derive when busAddresses is empty.
     */
    private int busCount = 8;

    /**
     * Seconds between difficulty/reward resets.
     */
    private long epochDurationSeconds = 60;

    /**
     * Base fee charged per signature, in lamports.
     */
    private long feePerSigner = 5000;
}

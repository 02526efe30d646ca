package dao.ore.bmine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "claim")
@Data
public class ClaimProperties {

    /**
     * Owner of the token account receiving claimed rewards (base58). Claiming is disabled when blank.
     */
    private String beneficiary;

    /**
     * Only send a claim bundle whose total reaches this UI amount.
     */
    private double threshold = 0;

    /**
     * Re-run the claim pass periodically.
     */
    private boolean auto = false;

    private long recheckIntervalMs = 300_000;

    public boolean isConfigured() {
        return beneficiary != null && !beneficiary.isBlank();
    }
}

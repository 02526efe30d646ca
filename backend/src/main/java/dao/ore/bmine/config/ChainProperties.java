package dao.ore.bmine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "chain")
@Data
public class ChainProperties {

    /**
     * JSON-RPC endpoint of the ledger node
     * Example: https://api.mainnet-beta.solana.com
     */
    private String rpcUrl = "https://api.mainnet-beta.solana.com";

    /**
     * Per-request timeout.
     */
    private long requestTimeoutMs = 15_000;

    /**
     * Landing confirmation polling.
     */
    private Polling polling = new Polling();

    @Data
    public static class Polling {
        /**
         * Interval between signature status queries.
         */
        private long pollIntervalMs = 2000;

        /**
         * Slots after the send slot at which an unlanded bundle is considered dropped
         * (blockhash validity of 151 slots plus margin).
         */
        private long slotExpiration = 156;
    }
}

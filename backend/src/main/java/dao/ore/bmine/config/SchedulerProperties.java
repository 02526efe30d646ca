package dao.ore.bmine.config;

import dao.ore.bmine.model.MiningMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {

    /**
     * Relay limits: 5 transactions per bundle, 5 proof instructions per transaction.
     */
    public static final int MAX_BATCH_SIZE = 25;

    private MiningMode mode = MiningMode.FIXED;

    /**
     * How often the landed reward counter is reported.
     * Default: 600000ms (10 minutes)
     */
    private long rewardReportIntervalMs = 600_000;

    private FixedConfig fixed = new FixedConfig();
    private PooledConfig pooled = new PooledConfig();

    @Data
    public static class FixedConfig {
        /**
         * Number of workers allowed to be mining (fetch + solve) at the same time.
         * Default: 1
         */
        private int concurrency = 1;

        /**
         * Solver threads per mining pass.
         * Default: 4
         */
        private int threads = 4;

        /**
         * Identities per worker.
         * Default: 25
         */
        private int batchSize = MAX_BATCH_SIZE;

        /**
         * Extra identities worth of reward a bus must hold beyond the batch to be usable.
         * Default: 4
         */
        private int busHeadroom = 4;
    }

    @Data
    public static class PooledConfig {
        /**
         * Identities per pooled batch. Identity count must be a multiple of it.
         * Default: 25
         */
        private int batchSize = MAX_BATCH_SIZE;

        /**
         * Maximum batches drained from the pool per solving pass.
         * Default: 4
         */
        private int maxDrain = 4;

        /**
         * Sleep when no batch is parked in the pool.
         * Default: 500ms
         */
        private long idleSleepMs = 500;

        /**
         * Extra identities worth of reward a bus must hold beyond the drained group.
         * Default: 20
         */
        private int busHeadroom = 20;

        /**
         * Solver threads; 0 lets the solver decide (GPU workers ignore it).
         */
        private int threads = 0;

        /**
         * Threads building and sending bundles in the background.
         * Default: 4
         */
        private int submitParallel = 4;
    }
}

package dao.ore.bmine.config;

import dao.ore.bmine.model.MiningMode;
import org.springframework.stereotype.Component;

/**
 * Startup checks run before any worker starts. Every failure is an operator error and aborts the process.
 */
@Component
public class MinerConfigValidator {

    private final MinerProperties minerProps;
    private final SchedulerProperties schedulerProps;

    public MinerConfigValidator(MinerProperties minerProps, SchedulerProperties schedulerProps) {
        this.minerProps = minerProps;
        this.schedulerProps = schedulerProps;
    }

    /**
     * @return the batch size of the active mode
     * @throws IllegalStateException on the first violated rule
     */
    public int validate(int identityCount) {
        minerProps.requirePriorityFee();
        if (minerProps.getMaxBuses() <= 0) {
            throw new IllegalStateException("miner.max-buses must be greater than 0");
        }
        if (identityCount == 0) {
            throw new IllegalStateException("no identities loaded");
        }
        int batchSize = schedulerProps.getMode() == MiningMode.POOLED
                ? schedulerProps.getPooled().getBatchSize()
                : schedulerProps.getFixed().getBatchSize();
        if (batchSize <= 0 || batchSize > SchedulerProperties.MAX_BATCH_SIZE) {
            throw new IllegalStateException("batch size must be within 1.." + SchedulerProperties.MAX_BATCH_SIZE
                    + ", got " + batchSize);
        }
        if (schedulerProps.getMode() == MiningMode.POOLED && identityCount % batchSize != 0) {
            throw new IllegalStateException("identity count " + identityCount
                    + " is not a multiple of batch size " + batchSize);
        }
        return batchSize;
    }
}

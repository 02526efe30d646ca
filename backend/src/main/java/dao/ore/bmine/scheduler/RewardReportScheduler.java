package dao.ore.bmine.scheduler;

import dao.ore.bmine.service.MinerStats;
import dao.ore.bmine.util.OreUnits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class RewardReportScheduler {

    private final MinerStats stats;

    public RewardReportScheduler(MinerStats stats) {
        this.stats = stats;
    }

    @Scheduled(fixedDelayString = "${scheduler.reward-report-interval-ms:600000}",
            initialDelayString = "${scheduler.reward-report-interval-ms:600000}")
    public void report() {
        long rewards = stats.takePendingRewards();
        if (rewards > 0) {
            log.info("reward mined: rewards={}, landed={}, dropped={}", OreUnits.format(rewards),
                    stats.getLanded(), stats.getDropped());
        }
    }
}

package dao.ore.bmine.scheduler;

import dao.ore.bmine.config.ClaimProperties;
import dao.ore.bmine.model.ClaimReport;
import dao.ore.bmine.model.PublicKey;
import dao.ore.bmine.service.ClaimService;
import dao.ore.bmine.util.OreUnits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class ClaimScheduler {

    private final ClaimService claimService;
    private final ClaimProperties claimProps;

    public ClaimScheduler(ClaimService claimService, ClaimProperties claimProps) {
        this.claimService = claimService;
        this.claimProps = claimProps;
    }

    @Scheduled(fixedDelayString = "${claim.recheck-interval-ms:300000}",
            initialDelayString = "${claim.recheck-interval-ms:300000}")
    public void autoClaim() {
        if (!claimProps.isAuto() || !claimProps.isConfigured()) {
            return;
        }
        try {
            ClaimReport report = claimService.claimOnce(PublicKey.fromBase58(claimProps.getBeneficiary()),
                    OreUnits.fromUiAmount(claimProps.getThreshold()));
            log.info("Auto claim done: claimed={}, rejected={}, remaining={}", OreUnits.format(report.claimed()),
                    OreUnits.format(report.rejected()), OreUnits.format(report.remaining()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("Auto claim failed: {}", e.getMessage());
        }
    }
}

package dao.ore.bmine.service;

import dao.ore.bmine.chain.ChainRpcClient;
import dao.ore.bmine.config.ChainProperties;
import dao.ore.bmine.model.SignatureStatus;
import dao.ore.bmine.model.SignatureStatuses;
import dao.ore.bmine.model.SubmissionOutcome;
import dao.ore.bmine.model.SubmissionRecord;
import dao.ore.bmine.model.TipSnapshot;
import dao.ore.bmine.model.WatchResult;
import dao.ore.bmine.tips.TipFeed;
import dao.ore.bmine.util.OreUnits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Polls signature statuses of a sent submission until one lands or the slot window expires.
 * <p>
 * Any landed signature resolves the whole submission: bundles are relayed atomically, so one landed
 * transaction implies its siblings landed too.
 */
@Slf4j
@Service
public class SubmissionWatcher {

    private final ChainRpcClient rpc;
    private final TipFeed tipFeed;
    private final MinerStats stats;
    private final long pollIntervalMs;
    private final long slotExpiration;

    public SubmissionWatcher(ChainRpcClient rpc, TipFeed tipFeed, MinerStats stats, ChainProperties chainProps) {
        this.rpc = rpc;
        this.tipFeed = tipFeed;
        this.stats = stats;
        this.pollIntervalMs = chainProps.getPolling().getPollIntervalMs();
        this.slotExpiration = chainProps.getPolling().getSlotExpiration();
    }

    public WatchResult watch(SubmissionRecord record) {
        WatchResult result = awaitOutcome(record);
        if (result.landed()) {
            stats.recordLanded(record.rewardEstimate());
            log.info("[{}] landed: sigs={}, reward={}, confirmTime={}s, slot={}", record.label(),
                    result.landedSignatures(), OreUnits.format(record.rewardEstimate()),
                    OreUnits.formatSeconds(result.elapsedNanos()), result.lastSlot());
        } else {
            stats.recordDropped();
            TipSnapshot tips = tipFeed.current();
            log.warn("[{}] dropped: sigs={}, tip={}, p25={}, p50={}, sentAt={}, lastSlot={}", record.label(),
                    record.signatures().size(), record.tipPaid(), tips.p25(), tips.p50(),
                    record.sentAtSlot(), result.lastSlot());
        }
        return result;
    }

    /**
     * Polls until the submission resolves, without touching the mining counters or logging the outcome.
     */
    public WatchResult awaitOutcome(SubmissionRecord record) {
        long deadline = record.sentAtSlot() + slotExpiration;
        long latestSlot = record.sentAtSlot();
        while (latestSlot < deadline) {
            if (!sleep(pollIntervalMs)) {
                break;
            }
            SignatureStatuses statuses;
            try {
                statuses = rpc.fetchSignatureStatuses(record.signatures());
            } catch (RuntimeException e) {
                log.error("[{}] signature status poll failed: {}", record.label(), e.getMessage());
                continue;
            }
            latestSlot = Math.max(latestSlot, statuses.slot());
            List<String> landed = landedSignatures(record.signatures(), statuses);
            if (!landed.isEmpty()) {
                return new WatchResult(SubmissionOutcome.LANDED, landed, latestSlot,
                        System.nanoTime() - record.sentAtNanos());
            }
            log.debug("[{}] not landed yet: slot={}, deadline={}", record.label(), latestSlot, deadline);
        }
        return new WatchResult(SubmissionOutcome.DROPPED, List.of(), latestSlot,
                System.nanoTime() - record.sentAtNanos());
    }

    private static List<String> landedSignatures(List<String> signatures, SignatureStatuses statuses) {
        List<String> landed = new ArrayList<>();
        List<Optional<SignatureStatus>> list = statuses.statuses();
        for (int i = 0; i < Math.min(signatures.size(), list.size()); i++) {
            if (list.get(i).map(SignatureStatus::isLanded).orElse(false)) {
                landed.add(signatures.get(i));
            }
        }
        return landed;
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

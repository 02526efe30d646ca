package dao.ore.bmine.model;

import java.util.List;

/**
 * One submission being tracked: created at send time, resolved by the watcher, then discarded.
 *
 * @param label           worker or batch label used in logs
 * @param signatures      tracking signatures, one per bundle sent
 * @param sentAtSlot      slot at which the blockhash was fetched
 * @param rewardEstimate  nominal reward of the whole batch
 * @param tipPaid         tip attached to every bundle
 * @param sentAtNanos     {@link System#nanoTime()} at send
 */
public record SubmissionRecord(
        String label,
        List<String> signatures,
        long sentAtSlot,
        long rewardEstimate,
        long tipPaid,
        long sentAtNanos
) {
    public SubmissionRecord {
        signatures = List.copyOf(signatures);
    }
}

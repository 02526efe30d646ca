package dao.ore.bmine.model;

import java.util.List;

public record WatchResult(SubmissionOutcome outcome, List<String> landedSignatures, long lastSlot, long elapsedNanos) {

    public boolean landed() {
        return outcome == SubmissionOutcome.LANDED;
    }
}

package dao.ore.bmine.model;

/**
 * Landing status of one signature. {@code confirmations == null} means the transaction is rooted.
 */
public record SignatureStatus(String confirmationStatus, Long confirmations, boolean failed) {

    public boolean isLanded() {
        if (failed) return false;
        if (confirmationStatus != null) {
            return "confirmed".equals(confirmationStatus) || "finalized".equals(confirmationStatus);
        }
        return confirmations == null;
    }
}

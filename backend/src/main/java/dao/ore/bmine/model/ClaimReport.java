package dao.ore.bmine.model;

/**
 * Totals of one claim pass, in base units.
 */
public record ClaimReport(long claimed, long rejected, long remaining, int bundlesLanded) {

    public static final ClaimReport EMPTY = new ClaimReport(0, 0, 0, 0);
}

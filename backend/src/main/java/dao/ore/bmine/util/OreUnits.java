package dao.ore.bmine.util;

import java.math.BigDecimal;

public final class OreUnits {
    private OreUnits() {}

    /** Token decimals of the mined asset. */
    public static final int TOKEN_DECIMALS = 11;

    public static String format(long amount) {
        return BigDecimal.valueOf(amount, TOKEN_DECIMALS).stripTrailingZeros().toPlainString();
    }

    public static long fromUiAmount(double uiAmount) {
        return BigDecimal.valueOf(uiAmount).movePointRight(TOKEN_DECIMALS).longValue();
    }

    public static String formatSeconds(long nanos) {
        return String.format("%.1fs", nanos / 1_000_000_000.0);
    }
}

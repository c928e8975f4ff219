package com.project.lockup.report;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;

public final class TokenAmounts {

    private static final long SECONDS_PER_DAY = 24 * 60 * 60;

    private TokenAmounts() {
    }

    /**
     * Render base units as a decimal token amount, e.g. {@code 1500000000000000000} with 18 decimals as {@code 1.5}.
     */
    public static String format(BigInteger amount, int decimals) {
        if (amount == null) {
            return "0";
        }
        BigDecimal value = new BigDecimal(amount).movePointLeft(decimals).stripTrailingZeros();
        return value.signum() == 0 ? "0" : value.toPlainString();
    }

    /**
     * Parse a decimal token amount into base units, e.g. {@code 1.5} with 18 decimals.
     *
     * @throws NumberFormatException if the text is not a number
     * @throws ArithmeticException   if it has more fractional digits than the token
     */
    public static BigInteger parse(String amount, int decimals) {
        return new BigDecimal(amount.trim()).movePointRight(decimals).toBigIntegerExact();
    }

    /**
     * Share of {@code total} with one decimal place, half-up.
     */
    public static BigDecimal percent(BigInteger part, BigInteger total) {
        if (total == null || total.signum() == 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        return new BigDecimal(part.multiply(BigInteger.valueOf(100)))
                .divide(new BigDecimal(total), 1, RoundingMode.HALF_UP);
    }

    public static String days(long seconds) {
        BigDecimal days = BigDecimal.valueOf(seconds)
                .divide(BigDecimal.valueOf(SECONDS_PER_DAY), 2, RoundingMode.DOWN)
                .stripTrailingZeros();
        return days.signum() == 0 ? "0" : days.toPlainString();
    }

    public static long elapsedDays(long fromSeconds, long toSeconds) {
        return Math.floorDiv(toSeconds - fromSeconds, SECONDS_PER_DAY);
    }

    public static String timestamp(long epochSeconds) {
        return Instant.ofEpochSecond(epochSeconds).toString();
    }

    public static String date(long epochSeconds) {
        return timestamp(epochSeconds).substring(0, 10);
    }
}

package com.project.lockup.core;

import java.math.BigInteger;

/**
 * Linear-with-cliff vesting math.
 *
 * All functions are pure: the result depends only on the record and the supplied
 * timestamp. Amounts are computed in {@link BigInteger}, so the intermediate
 * {@code totalAmount * elapsed} product never overflows; the division always
 * floors toward zero and happens last.
 */
public final class VestingCalculator {

    /** Ten years of 365 days, the longest accepted vesting duration. */
    public static final long MAX_VESTING_DURATION = 10L * 365 * 24 * 60 * 60;

    private static final BigInteger ONE_HUNDRED = BigInteger.valueOf(100);

    private VestingCalculator() {
    }

    /**
     * Amount earned by the beneficiary at {@code now}.
     *
     * Zero before the cliff, the exact total once the vesting duration has elapsed,
     * linear in between. After revocation the result never exceeds the snapshot
     * taken at revocation time.
     *
     * @param record lockup record, may be {@link LockupRecord#EMPTY}
     * @param now    current time, epoch seconds
     * @return vested amount in token base units
     */
    public static BigInteger vestedAmount(LockupRecord record, long now) {
        if (!record.exists() || now < record.cliffEnd()) {
            return BigInteger.ZERO;
        }

        BigInteger vested;
        if (now >= record.vestingEnd()) {
            vested = record.totalAmount();
        } else {
            long elapsed = now - record.startTime();
            vested = record.totalAmount()
                    .multiply(BigInteger.valueOf(elapsed))
                    .divide(BigInteger.valueOf(record.vestingDuration()));
        }

        if (record.revoked()) {
            return vested.min(record.vestedAtRevoke());
        }
        return vested;
    }

    /**
     * Vested amount not yet pushed to the beneficiary.
     */
    public static BigInteger releasableAmount(LockupRecord record, long now) {
        BigInteger releasable = vestedAmount(record, now).subtract(record.releasedAmount());
        return releasable.signum() > 0 ? releasable : BigInteger.ZERO;
    }

    /**
     * Elapsed share of the vesting duration as a floored percentage in {@code [0, 100]}.
     * The cliff is ignored.
     */
    public static int vestingProgress(LockupRecord record, long now) {
        if (!record.exists()) {
            return 0;
        }
        long capped = Math.min(now, record.vestingEnd());
        if (capped <= record.startTime()) {
            return 0;
        }
        return BigInteger.valueOf(capped - record.startTime())
                .multiply(ONE_HUNDRED)
                .divide(BigInteger.valueOf(record.vestingDuration()))
                .intValueExact();
    }

    /**
     * Seconds left until the vesting end, never negative.
     */
    public static long remainingVestingTime(LockupRecord record, long now) {
        if (!record.exists()) {
            return 0L;
        }
        return Math.max(0L, record.vestingEnd() - now);
    }
}

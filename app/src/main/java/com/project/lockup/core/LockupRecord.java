package com.project.lockup.core;

import java.math.BigInteger;

/**
 * Snapshot of the single lockup held by a {@link SimpleLockup} instance.
 *
 * Mirrors the on-chain storage layout: the beneficiary slot plus the eight scalar
 * fields returned by the contract's {@code lockupInfo()} getter. Instances are
 * immutable; every state transition produces a new record.
 *
 * @param beneficiary    checksummed address allowed to release vested tokens.
 * @param totalAmount    quantity locked at creation (token base units).
 * @param releasedAmount cumulative amount already pushed to the beneficiary.
 * @param startTime      creation timestamp, epoch seconds.
 * @param cliffDuration  seconds after {@code startTime} before anything vests.
 * @param vestingDuration seconds after {@code startTime} at which everything has vested.
 * @param revocable      whether the owner may revoke the unvested remainder.
 * @param revoked        set once by a successful revocation.
 * @param vestedAtRevoke vested amount frozen at revocation; zero while not revoked.
 */
public record LockupRecord(
        String beneficiary,
        BigInteger totalAmount,
        BigInteger releasedAmount,
        long startTime,
        long cliffDuration,
        long vestingDuration,
        boolean revocable,
        boolean revoked,
        BigInteger vestedAtRevoke
) {

    /** The all-zero record reported while no lockup has been created. */
    public static final LockupRecord EMPTY = new LockupRecord(
            LockupValidator.ZERO_ADDRESS,
            BigInteger.ZERO,
            BigInteger.ZERO,
            0L,
            0L,
            0L,
            false,
            false,
            BigInteger.ZERO
    );

    public static LockupRecord create(String beneficiary,
                                      BigInteger totalAmount,
                                      long startTime,
                                      long cliffDuration,
                                      long vestingDuration,
                                      boolean revocable) {
        return new LockupRecord(
                beneficiary,
                totalAmount,
                BigInteger.ZERO,
                startTime,
                cliffDuration,
                vestingDuration,
                revocable,
                false,
                BigInteger.ZERO
        );
    }

    /**
     * A record exists once it carries a positive locked amount.
     */
    public boolean exists() {
        return totalAmount != null && totalAmount.signum() > 0;
    }

    public long cliffEnd() {
        return startTime + cliffDuration;
    }

    public long vestingEnd() {
        return startTime + vestingDuration;
    }

    /**
     * Upper bound of what the beneficiary can ever claim: the total, or the frozen snapshot after revocation.
     */
    public BigInteger claimableCap() {
        return revoked ? vestedAtRevoke : totalAmount;
    }

    public LockupRecord withReleased(BigInteger newReleasedAmount) {
        return new LockupRecord(beneficiary, totalAmount, newReleasedAmount, startTime,
                cliffDuration, vestingDuration, revocable, revoked, vestedAtRevoke);
    }

    public LockupRecord withRevocation(BigInteger vestedSnapshot) {
        return new LockupRecord(beneficiary, totalAmount, releasedAmount, startTime,
                cliffDuration, vestingDuration, revocable, true, vestedSnapshot);
    }
}

package com.project.lockup.core;

import com.project.lockup.token.AccessControl;
import com.project.lockup.token.BlockClock;
import com.project.lockup.token.CodeInspector;
import com.project.lockup.token.SingleOwnerAccessControl;
import com.project.lockup.token.TokenLedger;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Single-beneficiary token lockup with linear vesting after an optional cliff.
 *
 * The owner locks tokens once for one beneficiary. The beneficiary releases
 * whatever has vested; a revocable lockup can be revoked by the owner, which
 * freezes vesting and returns the unvested remainder.
 *
 * Every mutating operation is all-or-nothing:
 * - authorization is checked at entry, then all preconditions, before any write
 * - the record is updated before the token transfer and restored if the transfer fails
 * - the whole operation runs under a {@link ReentrancyGuard}, so token callbacks cannot re-enter
 */
public class SimpleLockup {

    private final String address;
    private final String token;
    private final AccessControl accessControl;
    private final TokenTransferGateway gateway;
    private final BlockClock clock;
    private final ReentrancyGuard reentrancyGuard = new ReentrancyGuard();

    private Optional<LockupRecord> lockup = Optional.empty();

    /**
     * Deploy a lockup owned by {@code deployer}.
     *
     * @param lockupAddress address of this lockup on the token ledger
     * @param tokenAddress  token to lock; must be non-zero and host contract code
     * @throws LockupException with {@code INVALID_TOKEN_ADDRESS}
     */
    public SimpleLockup(String lockupAddress,
                        String tokenAddress,
                        String deployer,
                        TokenLedger ledger,
                        CodeInspector codeInspector,
                        BlockClock clock) {
        this(lockupAddress, tokenAddress, new SingleOwnerAccessControl(deployer), ledger, codeInspector, clock);
    }

    public SimpleLockup(String lockupAddress,
                        String tokenAddress,
                        AccessControl accessControl,
                        TokenLedger ledger,
                        CodeInspector codeInspector,
                        BlockClock clock) {
        Objects.requireNonNull(codeInspector, "codeInspector must not be null");
        if (!LockupValidator.isValidAddress(lockupAddress)) {
            throw new IllegalArgumentException("lockupAddress must be a 20-byte hex address: " + lockupAddress);
        }
        this.token = LockupValidator.validateTokenAddress(tokenAddress, codeInspector);
        this.address = LockupValidator.checksum(lockupAddress);
        this.accessControl = Objects.requireNonNull(accessControl, "accessControl must not be null");
        this.gateway = new TokenTransferGateway(ledger, address);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Lock {@code totalAmount} tokens of the owner for {@code beneficiary}.
     *
     * Checks, in order: caller is the owner, no lockup exists yet, beneficiary,
     * amount, durations, owner balance, owner allowance. The tokens are then pulled
     * and the received amount must match exactly.
     *
     * @param caller          account invoking the operation
     * @param cliffDuration   seconds before anything vests
     * @param vestingDuration seconds until everything has vested; strictly greater than the cliff
     * @return the created record
     */
    public synchronized LockupRecord createLockup(String caller,
                                                  String beneficiary,
                                                  BigInteger totalAmount,
                                                  long cliffDuration,
                                                  long vestingDuration,
                                                  boolean revocable) {
        return execute("createLockup", () -> {
            accessControl.checkOwner(caller);
            return reentrancyGuard.guard("createLockup", () -> {
                if (lockup.isPresent()) {
                    throw new LockupException(LockupError.LOCKUP_ALREADY_EXISTS,
                            "A lockup already exists for beneficiary " + lockup.get().beneficiary());
                }
                String normalizedBeneficiary = LockupValidator.validateBeneficiary(beneficiary);
                LockupValidator.validateAmount(totalAmount);
                LockupValidator.validateDurations(cliffDuration, vestingDuration);

                String owner = accessControl.owner();
                LockupValidator.validateBalance(gateway.balanceOf(owner), totalAmount);
                LockupValidator.validateAllowance(gateway.allowance(owner), totalAmount);

                BigInteger received = gateway.pullFromOwner(owner, totalAmount);
                verifyReceived(owner, totalAmount, received);

                LockupRecord created = LockupRecord.create(
                        normalizedBeneficiary,
                        totalAmount,
                        clock.now(),
                        cliffDuration,
                        vestingDuration,
                        revocable
                );
                lockup = Optional.of(created);

                LockupLogger.logInfo("createLockup", String.format(
                        "Locked %s for %s (cliff %ds, vesting %ds, revocable=%s)",
                        totalAmount, normalizedBeneficiary, cliffDuration, vestingDuration, revocable));
                return created;
            });
        });
    }

    /**
     * Push every vested but unreleased token to the beneficiary.
     *
     * @throws LockupException with {@code NO_TOKENS_AVAILABLE} when nothing is releasable
     */
    public synchronized ReleaseResult release(String caller) {
        return execute("release", () -> {
            LockupRecord current = requireLockup();
            if (!LockupValidator.sameAddress(current.beneficiary(), caller)) {
                throw new LockupException(LockupError.UNAUTHORIZED,
                        String.format("Account %s is not the beneficiary", caller));
            }
            return reentrancyGuard.guard("release", () -> {
                LockupRecord before = requireLockup();
                BigInteger releasable = VestingCalculator.releasableAmount(before, clock.now());
                if (releasable.signum() == 0) {
                    throw new LockupException(LockupError.NO_TOKENS_AVAILABLE,
                            "Nothing has vested beyond the " + before.releasedAmount() + " already released");
                }

                LockupRecord after = before.withReleased(before.releasedAmount().add(releasable));
                applyThenTransfer(before, after, () -> gateway.pushToBeneficiary(before.beneficiary(), releasable));

                LockupLogger.logInfo("release", String.format("Released %s to %s (total released %s of %s)",
                        releasable, before.beneficiary(), after.releasedAmount(), after.totalAmount()));
                return new ReleaseResult(before.beneficiary(), releasable, after.releasedAmount());
            });
        });
    }

    /**
     * Freeze vesting at its current value and return the unvested remainder to the owner.
     * The beneficiary keeps the right to release what had vested at this point.
     *
     * @throws LockupException with {@code NOT_REVOCABLE}, {@code ALREADY_REVOKED} or
     *         {@code NOTHING_TO_REVOKE} when everything has already vested
     */
    public synchronized RevokeResult revoke(String caller) {
        return execute("revoke", () -> {
            accessControl.checkOwner(caller);
            return reentrancyGuard.guard("revoke", () -> {
                LockupRecord before = requireLockup();
                if (!before.revocable()) {
                    throw new LockupException(LockupError.NOT_REVOCABLE, "The lockup was created as non-revocable");
                }
                if (before.revoked()) {
                    throw new LockupException(LockupError.ALREADY_REVOKED,
                            "The lockup was already revoked at " + before.vestedAtRevoke() + " vested");
                }
                BigInteger vested = VestingCalculator.vestedAmount(before, clock.now());
                if (vested.compareTo(before.totalAmount()) >= 0) {
                    throw new LockupException(LockupError.NOTHING_TO_REVOKE,
                            "Everything has vested, no unvested tokens to return");
                }

                BigInteger unvested = before.totalAmount().subtract(vested);
                String owner = accessControl.owner();
                LockupRecord after = before.withRevocation(vested);
                applyThenTransfer(before, after, () -> gateway.pushToOwner(owner, unvested));

                LockupLogger.logInfo("revoke", String.format("Revoked: %s stays claimable by %s, %s returned to %s",
                        vested, before.beneficiary(), unvested, owner));
                return new RevokeResult(vested, unvested);
            });
        });
    }

    public synchronized void transferOwnership(String caller, String newOwner) {
        execute("transferOwnership", () -> {
            accessControl.transferOwnership(caller, newOwner);
            LockupLogger.logInfo("transferOwnership", "Ownership transferred to " + accessControl.owner());
            return null;
        });
    }

    public synchronized void renounceOwnership(String caller) {
        execute("renounceOwnership", () -> {
            accessControl.renounceOwnership(caller);
            LockupLogger.logInfo("renounceOwnership", "Ownership renounced by " + caller);
            return null;
        });
    }

    // Read-only queries

    /**
     * @return the current record, or {@link LockupRecord#EMPTY} before creation
     */
    public synchronized LockupRecord lockupInfo() {
        return lockup.orElse(LockupRecord.EMPTY);
    }

    public synchronized BigInteger vestedAmount() {
        return VestingCalculator.vestedAmount(lockupInfo(), clock.now());
    }

    public synchronized BigInteger releasableAmount() {
        return VestingCalculator.releasableAmount(lockupInfo(), clock.now());
    }

    public synchronized int vestingProgress() {
        return VestingCalculator.vestingProgress(lockupInfo(), clock.now());
    }

    public synchronized long remainingVestingTime() {
        return VestingCalculator.remainingVestingTime(lockupInfo(), clock.now());
    }

    public synchronized String beneficiary() {
        return lockupInfo().beneficiary();
    }

    public synchronized LockupState state() {
        return LockupState.of(lockupInfo());
    }

    public String token() {
        return token;
    }

    public String owner() {
        return accessControl.owner();
    }

    public String address() {
        return address;
    }

    private LockupRecord requireLockup() {
        return lockup.orElseThrow(() -> new LockupException(LockupError.NO_LOCKUP, "No lockup has been created"));
    }

    private void verifyReceived(String owner, BigInteger requested, BigInteger received) {
        try {
            LockupValidator.validateReceived(requested, received);
        } catch (LockupException mismatch) {
            // the ledger already moved the tokens; hand back what arrived.
            // Fees on both legs and the spent allowance stay with the token.
            try {
                gateway.refund(owner, received);
            } catch (RuntimeException refundFailure) {
                mismatch.addSuppressed(refundFailure);
            }
            throw mismatch;
        }
    }

    /**
     * Write {@code after} before the transfer runs; put {@code before} back if it fails.
     */
    private void applyThenTransfer(LockupRecord before, LockupRecord after, Runnable transfer) {
        lockup = Optional.of(after);
        try {
            transfer.run();
        } catch (RuntimeException e) {
            lockup = Optional.of(before);
            throw e;
        }
    }

    private <T> T execute(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (LockupException e) {
            LockupLogger.logRejected(operation, e);
            throw e;
        } catch (RuntimeException e) {
            LockupLogger.logError(operation, "Operation aborted, lockup state unchanged", e);
            throw e;
        }
    }

    /**
     * Outcome of a successful {@link #release(String)}.
     *
     * @param beneficiary   recipient of the transfer
     * @param amount        tokens pushed by this call
     * @param totalReleased cumulative released amount after this call
     */
    public record ReleaseResult(String beneficiary, BigInteger amount, BigInteger totalReleased) {}

    /**
     * Outcome of a successful {@link #revoke(String)}.
     *
     * @param vestedAtRevoke  frozen amount the beneficiary can still claim in total
     * @param returnedToOwner unvested tokens pushed back to the owner
     */
    public record RevokeResult(BigInteger vestedAtRevoke, BigInteger returnedToOwner) {}
}

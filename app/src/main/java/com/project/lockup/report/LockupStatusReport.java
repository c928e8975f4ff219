package com.project.lockup.report;

import com.project.lockup.core.LockupRecord;
import com.project.lockup.core.SimpleLockup;
import com.project.lockup.eth.LockupContractClient;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Point-in-time view of a lockup: the stored record plus the derived amounts and schedule phase.
 *
 * @param contractAddress      lockup address
 * @param token                token address
 * @param owner                current owner
 * @param lockup               stored record, {@link LockupRecord#EMPTY} if none was created
 * @param vestedAmount         vested at {@code observedAt}
 * @param releasableAmount     releasable at {@code observedAt}
 * @param vestingProgress      elapsed share of the vesting duration, percent
 * @param remainingVestingTime seconds until the vesting end
 * @param observedAt           epoch seconds the phase was evaluated at
 */
public record LockupStatusReport(
        String contractAddress,
        String token,
        String owner,
        LockupRecord lockup,
        BigInteger vestedAmount,
        BigInteger releasableAmount,
        int vestingProgress,
        long remainingVestingTime,
        long observedAt
) {

    public enum VestingPhase {
        NO_LOCKUP,
        IN_CLIFF,
        VESTING,
        FULLY_VESTED
    }

    /**
     * Report on an in-process lockup.
     */
    public static LockupStatusReport of(SimpleLockup lockup, long now) {
        return new LockupStatusReport(
                lockup.address(),
                lockup.token(),
                lockup.owner(),
                lockup.lockupInfo(),
                lockup.vestedAmount(),
                lockup.releasableAmount(),
                lockup.vestingProgress(),
                lockup.remainingVestingTime(),
                now
        );
    }

    /**
     * Report on a deployed lockup. Amounts are the contract's own view results; only the
     * phase is evaluated against {@code now}.
     */
    public static LockupStatusReport fromContract(LockupContractClient client, long now) {
        LockupRecord record = client.lockupInfo();
        if (!record.exists()) {
            return new LockupStatusReport(client.contractAddress(), client.token(), client.owner(),
                    record, BigInteger.ZERO, BigInteger.ZERO, 0, 0L, now);
        }
        return new LockupStatusReport(
                client.contractAddress(),
                client.token(),
                client.owner(),
                record,
                client.vestedAmount(),
                client.releasableAmount(),
                client.vestingProgress(),
                client.remainingVestingTime(),
                now
        );
    }

    public VestingPhase phase() {
        if (!lockup.exists()) {
            return VestingPhase.NO_LOCKUP;
        }
        if (observedAt < lockup.cliffEnd()) {
            return VestingPhase.IN_CLIFF;
        }
        if (observedAt < lockup.vestingEnd()) {
            return VestingPhase.VESTING;
        }
        return VestingPhase.FULLY_VESTED;
    }

    /**
     * Human-readable lines, in the layout of the check-lockup operator tool.
     */
    public List<String> render(TokenDisplay display) {
        List<String> lines = new ArrayList<>();
        lines.add("Lockup Address: " + contractAddress);
        lines.add("Token Address:  " + token);
        lines.add("Owner:          " + owner);
        lines.add("Beneficiary:    " + lockup.beneficiary());
        lines.add("");

        if (!lockup.exists()) {
            lines.add("No lockup found");
            return lines;
        }

        lines.add("=== Lockup Details ===");
        lines.add("Total Amount:      " + display.format(lockup.totalAmount()));
        lines.add("Released Amount:   " + display.format(lockup.releasedAmount()));
        lines.add("Vested Amount:     " + display.format(vestedAmount));
        lines.add("Releasable Amount: " + display.format(releasableAmount));
        lines.add("");

        lines.add("=== Vesting Schedule ===");
        lines.add("Start Time:       " + TokenAmounts.timestamp(lockup.startTime()));
        lines.add("Cliff End:        " + TokenAmounts.timestamp(lockup.cliffEnd()));
        lines.add("Vesting End:      " + TokenAmounts.timestamp(lockup.vestingEnd()));
        lines.add("Cliff Duration:   " + TokenAmounts.days(lockup.cliffDuration()) + " days");
        lines.add("Vesting Duration: " + TokenAmounts.days(lockup.vestingDuration()) + " days");
        lines.add("");

        lines.add("=== Current Status ===");
        lines.add("Vesting Progress: " + vestingProgress + " %");
        lines.add("Remaining Time:   " + TokenAmounts.days(remainingVestingTime) + " days");
        lines.add("Revocable:        " + lockup.revocable());
        lines.add("Revoked:          " + lockup.revoked());
        if (lockup.revoked()) {
            lines.add("Vested at Revoke: " + display.format(lockup.vestedAtRevoke()));
        }
        lines.add("");

        VestingPhase phase = phase();
        if (phase == VestingPhase.IN_CLIFF) {
            lines.add("Status: In cliff period (no tokens vested yet)");
        } else if (phase == VestingPhase.VESTING) {
            lines.add("Status: Vesting in progress");
        } else {
            lines.add("Status: Fully vested");
        }
        if (releasableAmount.signum() > 0) {
            lines.add("Releasable now: " + display.format(releasableAmount));
        }
        return lines;
    }
}

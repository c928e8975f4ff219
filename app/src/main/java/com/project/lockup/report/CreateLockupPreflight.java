package com.project.lockup.report;

import com.project.lockup.core.LockupError;
import com.project.lockup.core.LockupException;
import com.project.lockup.core.LockupRecord;
import com.project.lockup.core.LockupValidator;
import com.project.lockup.core.SimpleLockup;
import com.project.lockup.token.TokenLedger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read-only check of whether {@code createLockup} would go through for an operator,
 * without sending anything.
 *
 * Runs the creation checks in the order the lockup applies them and keeps going past
 * the first failure, so every problem is reported at once.
 *
 * @param lockupAddress   lockup the tokens would be pulled into
 * @param owner           current owner of the lockup
 * @param operator        account that would call {@code createLockup}
 * @param operatorBalance token balance of the operator
 * @param allowance       operator's allowance to the lockup
 * @param existing        stored record, {@link LockupRecord#EMPTY} if none
 * @param beneficiary     requested beneficiary
 * @param amount          requested amount in base units
 * @param cliffDuration   requested cliff, seconds
 * @param vestingDuration requested vesting duration, seconds
 */
public record CreateLockupPreflight(
        String lockupAddress,
        String owner,
        String operator,
        BigInteger operatorBalance,
        BigInteger allowance,
        LockupRecord existing,
        String beneficiary,
        BigInteger amount,
        long cliffDuration,
        long vestingDuration
) {

    /**
     * Gather the inputs from an in-process lockup and its ledger.
     */
    public static CreateLockupPreflight of(SimpleLockup lockup,
                                           TokenLedger ledger,
                                           String operator,
                                           String beneficiary,
                                           BigInteger amount,
                                           long cliffDuration,
                                           long vestingDuration) {
        return new CreateLockupPreflight(
                lockup.address(),
                lockup.owner(),
                operator,
                ledger.balanceOf(operator),
                ledger.allowance(operator, lockup.address()),
                lockup.lockupInfo(),
                beneficiary,
                amount,
                cliffDuration,
                vestingDuration
        );
    }

    public boolean isOwner() {
        return !LockupValidator.isZeroAddress(owner) && LockupValidator.sameAddress(owner, operator);
    }

    /**
     * Every check that would reject the call, in the lockup's guard order. The first
     * entry is the error {@code createLockup} would raise.
     */
    public List<LockupException> findings() {
        List<LockupException> findings = new ArrayList<>();
        if (!isOwner()) {
            findings.add(new LockupException(LockupError.UNAUTHORIZED,
                    String.format("Account %s is not the owner (%s)", operator, owner)));
        }
        if (existing.exists()) {
            findings.add(new LockupException(LockupError.LOCKUP_ALREADY_EXISTS,
                    "A lockup already exists for beneficiary " + existing.beneficiary()));
        }
        collect(findings, () -> LockupValidator.validateBeneficiary(beneficiary));
        collect(findings, () -> LockupValidator.validateAmount(amount));
        collect(findings, () -> LockupValidator.validateDurations(cliffDuration, vestingDuration));
        if (amount != null && amount.signum() > 0) {
            collect(findings, () -> LockupValidator.validateBalance(operatorBalance, amount));
            collect(findings, () -> LockupValidator.validateAllowance(allowance, amount));
        }
        return findings;
    }

    public Optional<LockupError> firstFailure() {
        return findings().stream().findFirst().map(LockupException::error);
    }

    public List<String> recommendations() {
        List<String> recommendations = new ArrayList<>();
        for (LockupException finding : findings()) {
            LockupError error = finding.error();
            if (error == LockupError.UNAUTHORIZED) {
                recommendations.add("Switch to the owner account " + owner);
            } else if (error == LockupError.LOCKUP_ALREADY_EXISTS) {
                recommendations.add("Deploy a new lockup; this one already holds a lockup");
            } else if (error == LockupError.INSUFFICIENT_BALANCE) {
                recommendations.add("Get tokens first: " + amount.subtract(operatorBalance) + " base units missing");
            } else if (error == LockupError.INSUFFICIENT_ALLOWANCE) {
                recommendations.add("Approve tokens: token.approve(" + lockupAddress + ", " + amount + ")");
            } else {
                recommendations.add("Fix the request: " + finding.getMessage());
            }
        }
        return recommendations;
    }

    public List<String> render(TokenDisplay display) {
        List<String> lines = new ArrayList<>();
        lines.add("=== Contract Information ===");
        lines.add("Lockup Address: " + lockupAddress);
        lines.add("Owner:          " + owner);
        lines.add("Operator:       " + operator);
        lines.add("Is Owner?:      " + isOwner());
        lines.add("");
        lines.add("=== Token Balances ===");
        lines.add("Operator Balance:  " + display.format(operatorBalance));
        lines.add("Current Allowance: " + display.format(allowance));
        lines.add("");
        lines.add("=== Existing Lockup Check ===");
        lines.add("Lockup Exists?: " + existing.exists());
        if (existing.exists()) {
            lines.add("Beneficiary:    " + existing.beneficiary());
            lines.add("Total Amount:   " + display.format(existing.totalAmount()));
        }
        lines.add("");
        lines.add("=== Dry Run ===");
        lines.add(String.format("createLockup(%s, %s, cliff %s days, vesting %s days)", beneficiary,
                display.format(amount), TokenAmounts.days(cliffDuration), TokenAmounts.days(vestingDuration)));

        List<LockupException> findings = findings();
        if (findings.isEmpty()) {
            lines.add("No errors detected, createLockup should succeed");
            return lines;
        }
        lines.add("createLockup would fail with " + findings.get(0).error().errorName());
        lines.add("");
        lines.add("=== Error Analysis ===");
        for (LockupException finding : findings) {
            lines.add("- " + finding.getMessage());
        }
        lines.add("");
        lines.add("=== Recommendations ===");
        List<String> recommendations = recommendations();
        for (int i = 0; i < recommendations.size(); i++) {
            lines.add((i + 1) + ". " + recommendations.get(i));
        }
        return lines;
    }

    private static void collect(List<LockupException> findings, Runnable check) {
        try {
            check.run();
        } catch (LockupException e) {
            findings.add(e);
        }
    }
}

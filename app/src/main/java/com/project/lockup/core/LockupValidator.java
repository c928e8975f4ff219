package com.project.lockup.core;

import com.project.lockup.token.CodeInspector;
import org.web3j.crypto.Keys;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * Precondition checks for lockup operations.
 *
 * Provides validation for:
 * - Addresses (hex format, zero address, contract code at the token address)
 * - Amounts (positive, within the uint256 range)
 * - Schedule durations (cliff strictly shorter than vesting, ten-year ceiling)
 * - Owner balance and allowance, reported as two distinct failures
 * - Received amount after a pull, which must match the request exactly
 *
 * Every check throws {@link LockupException} and never mutates anything.
 */
public final class LockupValidator {

    public static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    /** Largest value an ERC-20 amount can take. */
    public static final BigInteger MAX_UINT256 = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private LockupValidator() {}

    /**
     * Validate the token address handed to the constructor.
     *
     * Only a sanity check: a non-zero address hosting code is accepted without
     * proving it speaks ERC-20.
     *
     * @param tokenAddress  The token address
     * @param codeInspector Lookup for code at an address
     * @return The checksummed token address
     * @throws LockupException with {@code INVALID_TOKEN_ADDRESS}
     */
    public static String validateTokenAddress(String tokenAddress, CodeInspector codeInspector) {
        String normalized = normalizeNonZero(tokenAddress, LockupError.INVALID_TOKEN_ADDRESS, "Token address");
        if (!codeInspector.hasCode(normalized)) {
            throw new LockupException(LockupError.INVALID_TOKEN_ADDRESS,
                    String.format("No contract code found at token address %s", normalized));
        }
        return normalized;
    }

    /**
     * @return The checksummed beneficiary address
     * @throws LockupException with {@code INVALID_BENEFICIARY}
     */
    public static String validateBeneficiary(String beneficiary) {
        return normalizeNonZero(beneficiary, LockupError.INVALID_BENEFICIARY, "Beneficiary");
    }

    /**
     * Validate the amount to lock.
     *
     * @throws LockupException with {@code INVALID_AMOUNT} if not in {@code (0, 2^256 - 1]}
     */
    public static void validateAmount(BigInteger totalAmount) {
        if (totalAmount == null || totalAmount.signum() <= 0) {
            throw new LockupException(LockupError.INVALID_AMOUNT,
                    String.format("Amount must be positive: got %s", totalAmount));
        }
        if (totalAmount.compareTo(MAX_UINT256) > 0) {
            throw new LockupException(LockupError.INVALID_AMOUNT,
                    "Amount exceeds the uint256 range");
        }
    }

    /**
     * Validate the schedule. A cliff equal to the vesting duration is rejected so that
     * some gradual-vesting window always exists.
     *
     * @throws LockupException with {@code INVALID_DURATION} unless
     *         {@code 0 <= cliffDuration < vestingDuration <= MAX_VESTING_DURATION}
     */
    public static void validateDurations(long cliffDuration, long vestingDuration) {
        if (cliffDuration < 0) {
            throw new LockupException(LockupError.INVALID_DURATION,
                    String.format("Cliff duration must not be negative: got %d", cliffDuration));
        }
        if (vestingDuration <= 0 || vestingDuration > VestingCalculator.MAX_VESTING_DURATION) {
            throw new LockupException(LockupError.INVALID_DURATION,
                    String.format("Vesting duration must be in range [1, %d]: got %d",
                            VestingCalculator.MAX_VESTING_DURATION, vestingDuration));
        }
        if (cliffDuration >= vestingDuration) {
            throw new LockupException(LockupError.INVALID_DURATION,
                    String.format("Cliff duration (%d) must be shorter than vesting duration (%d)",
                            cliffDuration, vestingDuration));
        }
    }

    /**
     * @throws LockupException with {@code INSUFFICIENT_BALANCE}
     */
    public static void validateBalance(BigInteger balance, BigInteger required) {
        if (balance.compareTo(required) < 0) {
            throw new LockupException(LockupError.INSUFFICIENT_BALANCE,
                    String.format("Owner balance %s is below the required %s", balance, required));
        }
    }

    /**
     * @throws LockupException with {@code INSUFFICIENT_ALLOWANCE}
     */
    public static void validateAllowance(BigInteger allowance, BigInteger required) {
        if (allowance.compareTo(required) < 0) {
            throw new LockupException(LockupError.INSUFFICIENT_ALLOWANCE,
                    String.format("Allowance %s granted to the lockup is below the required %s", allowance, required));
        }
    }

    /**
     * Compare the balance delta observed around a pull with the requested amount.
     * The only line of defense against fee-on-transfer and rebasing tokens.
     *
     * @throws LockupException with {@code TRANSFER_AMOUNT_MISMATCH}
     */
    public static void validateReceived(BigInteger requested, BigInteger received) {
        if (received.compareTo(requested) != 0) {
            throw new LockupException(LockupError.TRANSFER_AMOUNT_MISMATCH,
                    String.format("Requested %s but the lockup received %s", requested, received));
        }
    }

    /**
     * Check if the value is a well-formed 20-byte hex address.
     */
    public static boolean isValidAddress(String address) {
        return address != null && Numeric.containsHexPrefix(address.trim()) && WalletUtils.isValidAddress(address.trim());
    }

    public static boolean isZeroAddress(String address) {
        return ZERO_ADDRESS.equalsIgnoreCase(address.trim());
    }

    /**
     * Compare two addresses regardless of checksum casing. Malformed input never matches.
     */
    public static boolean sameAddress(String left, String right) {
        if (!isValidAddress(left) || !isValidAddress(right)) {
            return false;
        }
        return left.trim().equalsIgnoreCase(right.trim());
    }

    /**
     * Normalize an address to its EIP-55 checksummed form.
     * Does NOT validate - call {@link #isValidAddress(String)} first.
     */
    public static String checksum(String address) {
        return Keys.toChecksumAddress(address.trim());
    }

    private static String normalizeNonZero(String address, LockupError error, String fieldName) {
        if (address == null) {
            throw new LockupException(error, fieldName + " must not be null");
        }
        if (!isValidAddress(address)) {
            throw new LockupException(error,
                    String.format("%s is not a valid 20-byte hex address: '%s'", fieldName, address));
        }
        if (isZeroAddress(address)) {
            throw new LockupException(error, fieldName + " must not be the zero address");
        }
        return checksum(address);
    }
}

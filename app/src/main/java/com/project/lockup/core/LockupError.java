package com.project.lockup.core;

/**
 * Failure kinds raised by lockup operations.
 * Each kind carries the custom-error name the deployed contract reverts with.
 */
public enum LockupError {
    INVALID_TOKEN_ADDRESS("InvalidTokenAddress"),
    INVALID_BENEFICIARY("InvalidBeneficiary"),
    INVALID_AMOUNT("InvalidAmount"),
    LOCKUP_ALREADY_EXISTS("LockupAlreadyExists"),
    NO_LOCKUP("NoLockup"),
    INVALID_DURATION("InvalidDuration"),
    INSUFFICIENT_BALANCE("InsufficientBalance"),
    INSUFFICIENT_ALLOWANCE("InsufficientAllowance"),
    TRANSFER_AMOUNT_MISMATCH("TransferAmountMismatch"),
    TOKEN_TRANSFER_FAILED("TokenTransferFailed"),
    NOT_REVOCABLE("NotRevocable"),
    ALREADY_REVOKED("AlreadyRevoked"),
    NOTHING_TO_REVOKE("NothingToRevoke"),
    NO_TOKENS_AVAILABLE("NoTokensAvailable"),
    UNAUTHORIZED("Unauthorized"),
    INVALID_OWNER("InvalidOwner"),
    REENTRANT_CALL("ReentrantCall");

    private final String errorName;

    LockupError(String errorName) {
        this.errorName = errorName;
    }

    public String errorName() {
        return errorName;
    }
}

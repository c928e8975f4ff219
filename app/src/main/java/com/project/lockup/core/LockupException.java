package com.project.lockup.core;

import java.util.Objects;

/**
 * Thrown when a lockup operation is rejected. The lockup record is unchanged when
 * this is raised, and so are token balances, with one exception: on
 * {@link LockupError#TRANSFER_AMOUNT_MISMATCH} the tokens were already pulled and are
 * refunded, so the owner keeps paying the token's transfer fees (pull and refund) and
 * the allowance spent by the pull is not restored.
 */
public class LockupException extends RuntimeException {

    private final LockupError error;

    public LockupException(LockupError error, String detail) {
        super(error.errorName() + ": " + detail);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    public LockupException(LockupError error, String detail, Throwable cause) {
        super(error.errorName() + ": " + detail, cause);
        this.error = Objects.requireNonNull(error, "error must not be null");
    }

    public LockupError error() {
        return error;
    }
}

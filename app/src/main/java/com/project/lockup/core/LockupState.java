package com.project.lockup.core;

import java.math.BigInteger;

/**
 * Lifecycle of the single lockup held by an instance.
 *
 * UNINITIALIZED -> ACTIVE -> REVOKED, with FULLY_RELEASED reached from either
 * ACTIVE or REVOKED once everything claimable has been pushed to the beneficiary.
 */
public enum LockupState {
    UNINITIALIZED,
    ACTIVE,
    REVOKED,
    FULLY_RELEASED;

    static LockupState of(LockupRecord record) {
        if (record == null || !record.exists()) {
            return UNINITIALIZED;
        }
        BigInteger cap = record.claimableCap();
        if (cap.signum() > 0 && record.releasedAmount().compareTo(cap) >= 0) {
            return FULLY_RELEASED;
        }
        return record.revoked() ? REVOKED : ACTIVE;
    }
}

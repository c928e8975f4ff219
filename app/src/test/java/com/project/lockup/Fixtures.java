package com.project.lockup;

import com.project.lockup.core.LockupValidator;
import com.project.lockup.core.SimpleLockup;

import java.math.BigInteger;

/**
 * Accounts and amounts shared by the lockup tests.
 */
public final class Fixtures {

    public static final String OWNER = "0x1000000000000000000000000000000000000001";
    public static final String BENEFICIARY = "0x2000000000000000000000000000000000000002";
    public static final String TOKEN = "0x3000000000000000000000000000000000000003";
    public static final String LOCKUP = "0x4000000000000000000000000000000000000004";
    public static final String STRANGER = "0x5000000000000000000000000000000000000005";

    public static final long GENESIS = 1_700_000_000L;
    public static final long DAY = 24 * 60 * 60;
    public static final long MONTH = 30 * DAY;
    public static final long YEAR = 365 * DAY;

    private Fixtures() {
    }

    /**
     * Whole tokens in 18-decimal base units.
     */
    public static BigInteger tokens(long wholeTokens) {
        return BigInteger.valueOf(wholeTokens).multiply(BigInteger.TEN.pow(18));
    }

    /**
     * Lockup deployed by {@link #OWNER} on {@link #TOKEN}; only the token address hosts code.
     */
    public static SimpleLockup deploy(InMemoryTokenLedger ledger, ManualClock clock) {
        return new SimpleLockup(LOCKUP, TOKEN, OWNER, ledger,
                address -> LockupValidator.sameAddress(address, TOKEN), clock);
    }
}

package com.project.lockup.core;

import com.project.lockup.token.TokenLedger;

import java.math.BigInteger;
import java.util.Objects;

/**
 * The three token movements a lockup performs: pull from the owner at creation,
 * push to the beneficiary on release, push to the owner on revocation.
 *
 * Each movement is one synchronous ledger call. A ledger that returns {@code false}
 * is treated as a failed transfer, and an exception thrown by the ledger is passed
 * through untouched.
 */
public class TokenTransferGateway {

    private final TokenLedger ledger;
    private final String lockupAddress;

    public TokenTransferGateway(TokenLedger ledger, String lockupAddress) {
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.lockupAddress = Objects.requireNonNull(lockupAddress, "lockupAddress must not be null");
    }

    /**
     * Pull {@code amount} from {@code owner} into the lockup using the owner's allowance.
     *
     * @return the lockup's balance delta across the call, which differs from
     *         {@code amount} for fee-on-transfer tokens
     */
    public BigInteger pullFromOwner(String owner, BigInteger amount) {
        BigInteger before = ledger.balanceOf(lockupAddress);
        if (!ledger.transferFrom(lockupAddress, owner, lockupAddress, amount)) {
            throw new LockupException(LockupError.TOKEN_TRANSFER_FAILED,
                    String.format("transferFrom(%s -> %s, %s) returned false", owner, lockupAddress, amount));
        }
        BigInteger after = ledger.balanceOf(lockupAddress);
        return after.subtract(before);
    }

    public void pushToBeneficiary(String beneficiary, BigInteger amount) {
        push(beneficiary, amount);
    }

    public void pushToOwner(String owner, BigInteger amount) {
        push(owner, amount);
    }

    /**
     * Return tokens that were pulled into the lockup but must not stay there.
     */
    void refund(String owner, BigInteger amount) {
        if (amount.signum() > 0) {
            push(owner, amount);
        }
    }

    private void push(String recipient, BigInteger amount) {
        if (!ledger.transfer(lockupAddress, recipient, amount)) {
            throw new LockupException(LockupError.TOKEN_TRANSFER_FAILED,
                    String.format("transfer(%s -> %s, %s) returned false", lockupAddress, recipient, amount));
        }
    }

    public BigInteger balanceOf(String account) {
        return ledger.balanceOf(account);
    }

    public BigInteger allowance(String owner) {
        return ledger.allowance(owner, lockupAddress);
    }
}

package com.project.lockup.token;

import java.math.BigInteger;

/**
 * The ERC-20 surface a lockup needs from its token.
 *
 * The caller identity that a chain would derive from the transaction sender is
 * passed explicitly. Transfers report success through their return value, like
 * the ERC-20 {@code transfer}/{@code transferFrom} functions do.
 */
public interface TokenLedger {

    BigInteger balanceOf(String account);

    BigInteger allowance(String owner, String spender);

    /**
     * Move {@code amount} from {@code sender} to {@code recipient}.
     *
     * @return false if the token refused the transfer
     */
    boolean transfer(String sender, String recipient, BigInteger amount);

    /**
     * Move {@code amount} from {@code from} to {@code recipient} on behalf of {@code spender},
     * consuming the allowance {@code from} granted to {@code spender}.
     *
     * @return false if the token refused the transfer
     */
    boolean transferFrom(String spender, String from, String recipient, BigInteger amount);
}

package com.project.lockup.report;

import com.project.lockup.eth.Erc20Client;

import java.math.BigInteger;

/**
 * How amounts of a token are printed.
 *
 * @param decimals number of decimals of the token
 * @param symbol   ticker shown after amounts
 */
public record TokenDisplay(int decimals, String symbol) {

    public static final String DEFAULT_SYMBOL = "tokens";

    /**
     * Ask the token for its decimals and symbol. Both are optional in ERC-20, so a token
     * that does not answer falls back to {@code fallbackDecimals} and a generic symbol.
     */
    public static TokenDisplay resolve(Erc20Client token, int fallbackDecimals) {
        try {
            return new TokenDisplay(token.decimals(), token.symbol());
        } catch (IllegalStateException | ArithmeticException e) {
            System.err.printf("Warning: token %s did not report decimals/symbol (%s). Assuming %d decimals.%n",
                    token.contractAddress(), e.getMessage(), fallbackDecimals);
            return new TokenDisplay(fallbackDecimals, DEFAULT_SYMBOL);
        }
    }

    public String format(BigInteger amount) {
        return TokenAmounts.format(amount, decimals) + " " + symbol;
    }
}

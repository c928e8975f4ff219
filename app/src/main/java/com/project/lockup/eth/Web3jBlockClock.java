package com.project.lockup.eth;

import com.project.lockup.token.BlockClock;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.response.EthBlock;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link BlockClock} reading the timestamp of the latest block, so local phase
 * calculations agree with what the contract sees.
 */
public class Web3jBlockClock implements BlockClock {

    private final Web3j web3;

    public Web3jBlockClock(Web3j web3) {
        this.web3 = Objects.requireNonNull(web3, "web3 must not be null");
    }

    @Override
    public long now() {
        try {
            EthBlock response = web3.ethGetBlockByNumber(DefaultBlockParameterName.LATEST, false).send();
            if (response.hasError() || response.getBlock() == null) {
                String reason = response.hasError() ? response.getError().getMessage() : "no block returned";
                throw new IllegalStateException("Failed to read latest block: " + reason);
            }
            return response.getBlock().getTimestamp().longValueExact();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read latest block: " + e.getMessage(), e);
        }
    }
}

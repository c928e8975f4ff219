package com.project.lockup.eth;

import com.project.lockup.token.CodeInspector;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.response.EthGetCode;

import java.io.IOException;
import java.util.Objects;

/**
 * {@link CodeInspector} backed by {@code eth_getCode} at the latest block.
 */
public class Web3jCodeInspector implements CodeInspector {

    private final Web3j web3;

    public Web3jCodeInspector(Web3j web3) {
        this.web3 = Objects.requireNonNull(web3, "web3 must not be null");
    }

    @Override
    public boolean hasCode(String address) {
        try {
            return hasCode(web3, address);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read code at " + address + ": " + e.getMessage(), e);
        }
    }

    static boolean hasCode(Web3j web3, String address) throws IOException {
        EthGetCode codeResponse = web3.ethGetCode(address, DefaultBlockParameterName.LATEST).send();
        if (codeResponse.hasError()) {
            throw new IllegalStateException(
                String.format("Error checking contract code at address %s: %s",
                    address, codeResponse.getError().getMessage())
            );
        }
        return isDeployedCode(codeResponse.getCode());
    }

    /**
     * Nodes answer {@code 0x} (some {@code 0x0}) for accounts without code.
     */
    static boolean isDeployedCode(String code) {
        return code != null && !code.isEmpty() && !code.equals("0x") && !code.equals("0x0");
    }
}

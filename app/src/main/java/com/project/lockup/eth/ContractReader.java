package com.project.lockup.eth;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.http.HttpService;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Base class for read-only clients of a deployed contract.
 * Calls go through {@code eth_call} against the latest block; code presence at the
 * contract address is verified once, before the first call.
 */
abstract class ContractReader implements Closeable {

    protected final Web3j web3;
    protected final String contractAddress;
    private final boolean ownsConnection;
    private volatile boolean codeVerified;

    protected ContractReader(String rpcEndpoint, String contractAddress) {
        this(Web3j.build(new HttpService(rpcEndpoint)), contractAddress, true);
    }

    protected ContractReader(Web3j web3, String contractAddress) {
        this(web3, contractAddress, false);
    }

    private ContractReader(Web3j web3, String contractAddress, boolean ownsConnection) {
        this.web3 = Objects.requireNonNull(web3, "web3 must not be null");
        this.contractAddress = Objects.requireNonNull(contractAddress, "contractAddress must not be null");
        this.ownsConnection = ownsConnection;
    }

    public String contractAddress() {
        return contractAddress;
    }

    /**
     * Call a view function taking no arguments.
     */
    protected List<Type> call(String name, List<TypeReference<?>> outputs) {
        return call(new Function(name, List.of(), outputs));
    }

    /**
     * Execute contract call and return decoded result.
     *
     * @param function The function to call
     * @return decoded return values, never empty
     */
    @SuppressWarnings("rawtypes")
    protected List<Type> call(Function function) {
        String encoded = FunctionEncoder.encode(function);
        Transaction callTx = Transaction.createEthCallTransaction(null, contractAddress, encoded);

        try {
            checkContractExists();

            EthCall response = web3.ethCall(callTx, DefaultBlockParameterName.LATEST).send();
            if (response.hasError()) {
                throw new IllegalStateException(String.format("RPC error calling %s() on %s: %s",
                        function.getName(), contractAddress, response.getError().getMessage()));
            }
            if (response.isReverted()) {
                throw new IllegalStateException(String.format("Call to %s() on %s reverted: %s",
                        function.getName(), contractAddress, response.getRevertReason()));
            }

            List<Type> decoded = FunctionReturnDecoder.decode(response.getValue(), function.getOutputParameters());
            if (decoded.size() < function.getOutputParameters().size()) {
                throw new IllegalStateException(String.format(
                        "Empty or short response from %s() on %s. Is this the right contract?",
                        function.getName(), contractAddress));
            }
            return decoded;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to call contract: " + e.getMessage(), e);
        }
    }

    /**
     * Check if contract exists at the configured address.
     */
    private void checkContractExists() throws IOException {
        if (codeVerified) {
            return;
        }
        if (!Web3jCodeInspector.hasCode(web3, contractAddress)) {
            throw new IllegalStateException(
                String.format("No contract code found at address %s. " +
                    "If this is a local development node that was restarted, its state is gone: " +
                    "redeploy the lockup and recreate it.",
                    contractAddress)
            );
        }
        codeVerified = true;
    }

    @Override
    public void close() throws IOException {
        if (ownsConnection) {
            web3.shutdown();
        }
    }
}

package com.project.lockup.eth;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.Web3j;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only ERC-20 client used to show balances and allowances next to a lockup.
 */
public class Erc20Client extends ContractReader {

    public Erc20Client(String rpcEndpoint, String tokenAddress) {
        super(rpcEndpoint, tokenAddress);
    }

    public Erc20Client(Web3j web3, String tokenAddress) {
        super(web3, tokenAddress);
    }

    public BigInteger balanceOf(String account) {
        Function function = new Function(
                "balanceOf",
                List.of(new Address(account)),
                List.of(new TypeReference<Uint256>() {})
        );
        return ((Uint256) call(function).get(0)).getValue();
    }

    public BigInteger allowance(String owner, String spender) {
        Function function = new Function(
                "allowance",
                List.of(new Address(owner), new Address(spender)),
                List.of(new TypeReference<Uint256>() {})
        );
        return ((Uint256) call(function).get(0)).getValue();
    }

    public int decimals() {
        return ((Uint8) call("decimals", List.of(new TypeReference<Uint8>() {})).get(0)).getValue().intValueExact();
    }

    public String symbol() {
        return ((Utf8String) call("symbol", List.of(new TypeReference<Utf8String>() {})).get(0)).getValue();
    }
}

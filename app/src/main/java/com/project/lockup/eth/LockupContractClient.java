package com.project.lockup.eth;

import com.project.lockup.core.LockupRecord;
import com.project.lockup.core.LockupValidator;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;

import java.math.BigInteger;
import java.util.List;

/**
 * Read-only client for a deployed SimpleLockup contract.
 *
 * Every value comes from the contract's own view functions, so vested and releasable
 * amounts reflect the chain's block timestamp rather than the local clock.
 */
public class LockupContractClient extends ContractReader {

    static final List<TypeReference<?>> LOCKUP_INFO_OUTPUTS = List.of(
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Bool>() {},
            new TypeReference<Bool>() {},
            new TypeReference<Uint256>() {}
    );

    public LockupContractClient(String rpcEndpoint, String contractAddress) {
        super(rpcEndpoint, contractAddress);
    }

    public LockupContractClient(Web3j web3, String contractAddress) {
        super(web3, contractAddress);
    }

    /**
     * Fetch the lockup record. The contract's {@code lockupInfo()} struct does not carry
     * the beneficiary, so it is read separately and merged in.
     *
     * @return the record, {@link LockupRecord#exists()} is false when no lockup was created
     */
    public LockupRecord lockupInfo() {
        String beneficiary = beneficiary();
        return decodeLockupInfo(beneficiary, call("lockupInfo", LOCKUP_INFO_OUTPUTS));
    }

    public BigInteger vestedAmount() {
        return uint("vestedAmount");
    }

    public BigInteger releasableAmount() {
        return uint("releasableAmount");
    }

    public int vestingProgress() {
        return uint("getVestingProgress").intValueExact();
    }

    public long remainingVestingTime() {
        return uint("getRemainingVestingTime").longValueExact();
    }

    public String beneficiary() {
        return address("beneficiary");
    }

    public String token() {
        return address("token");
    }

    public String owner() {
        return address("owner");
    }

    /**
     * Decode the eight {@code lockupInfo()} words.
     *
     * @param beneficiary beneficiary read from the {@code beneficiary()} getter
     * @param decoded     values in struct order: totalAmount, releasedAmount, startTime,
     *                    cliffDuration, vestingDuration, revocable, revoked, vestedAtRevoke
     */
    @SuppressWarnings("rawtypes")
    static LockupRecord decodeLockupInfo(String beneficiary, List<Type> decoded) {
        if (decoded.size() < 8) {
            throw new IllegalStateException("lockupInfo() returned " + decoded.size() + " values, expected 8");
        }
        BigInteger totalAmount = ((Uint256) decoded.get(0)).getValue();
        if (totalAmount.signum() == 0) {
            return LockupRecord.EMPTY;
        }
        return new LockupRecord(
                normalize(beneficiary),
                totalAmount,
                ((Uint256) decoded.get(1)).getValue(),
                ((Uint256) decoded.get(2)).getValue().longValueExact(),
                ((Uint256) decoded.get(3)).getValue().longValueExact(),
                ((Uint256) decoded.get(4)).getValue().longValueExact(),
                ((Bool) decoded.get(5)).getValue(),
                ((Bool) decoded.get(6)).getValue(),
                ((Uint256) decoded.get(7)).getValue()
        );
    }

    private BigInteger uint(String function) {
        return ((Uint256) call(function, List.of(new TypeReference<Uint256>() {})).get(0)).getValue();
    }

    private String address(String function) {
        return normalize(((Address) call(function, List.of(new TypeReference<Address>() {})).get(0)).getValue());
    }

    private static String normalize(String address) {
        return LockupValidator.isValidAddress(address) ? LockupValidator.checksum(address) : address;
    }
}

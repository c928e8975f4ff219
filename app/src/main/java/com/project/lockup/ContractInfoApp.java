package com.project.lockup;

import com.project.lockup.config.LockupOptions;
import com.project.lockup.eth.DeploymentMetadata;
import com.project.lockup.eth.DeploymentRegistry;
import com.project.lockup.eth.Erc20Client;
import com.project.lockup.eth.LockupContractClient;
import com.project.lockup.eth.Web3jCodeInspector;
import com.project.lockup.report.TokenDisplay;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.Optional;

/**
 * Prints the addresses a lockup contract is bound to: token, owner, beneficiary,
 * plus the token balance it holds and the owner's remaining allowance.
 * A SimpleLockup holds a single lockup, so there is nothing to enumerate.
 *
 * Usage: LOCKUP_ADDRESS=0x... java ContractInfoApp
 */
public class ContractInfoApp {
    public static void main(String[] args) {
        LockupOptions options = LockupOptions.fromEnv();
        String lockupAddress = options.resolveLockupAddress().orElse(null);
        if (lockupAddress == null) {
            System.err.println("LOCKUP_ADDRESS environment variable is required");
            System.exit(1);
        }

        Web3j web3 = Web3j.build(new HttpService(options.rpcUrl()));
        try (LockupContractClient client = new LockupContractClient(web3, lockupAddress)) {
            System.out.println("SimpleLockup Contract Information");
            System.out.println("Contract Address: " + lockupAddress);
            printDeployment(options, lockupAddress);
            System.out.println();

            String token = client.token();
            String owner = client.owner();
            System.out.println("=== Contract Details ===");
            System.out.println("Token Address: " + token);
            System.out.println("Owner:         " + owner);
            System.out.println("Beneficiary:   " + client.beneficiary());
            System.out.println();

            if (!new Web3jCodeInspector(web3).hasCode(token)) {
                System.out.println("Warning: no contract code at the token address");
            } else {
                Erc20Client erc20 = new Erc20Client(web3, token);
                TokenDisplay display = TokenDisplay.resolve(erc20, options.tokenDecimals());
                System.out.println("=== Token Holdings ===");
                System.out.println("Held by lockup:  " + display.format(erc20.balanceOf(lockupAddress)));
                System.out.println("Owner allowance: " + display.format(erc20.allowance(owner, lockupAddress)));
            }
            System.out.println();

            System.out.println("Note: SimpleLockup supports one lockup per contract.");
            System.out.println("To check the lockup details, use:");
            System.out.println("   LOCKUP_ADDRESS=" + lockupAddress + " java CheckLockupApp");
        } catch (Exception e) {
            System.err.println("Failed to read lockup contract: " + e.getMessage());
            System.exit(1);
        } finally {
            web3.shutdown();
        }
    }

    private static void printDeployment(LockupOptions options, String lockupAddress) {
        Optional<DeploymentMetadata> deployment = new DeploymentRegistry(options.deploymentsDirectory())
                .load(options.network())
                .filter(metadata -> metadata.address().equalsIgnoreCase(lockupAddress));
        deployment.ifPresent(metadata -> {
            System.out.println("Network:          " + options.network());
            System.out.println("Deployed by:      " + metadata.deployer());
            System.out.println("Deployed at:      " + metadata.deployedAt());
        });
    }
}

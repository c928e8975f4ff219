package com.project.lockup.config;

import com.project.lockup.eth.DeploymentMetadata;
import com.project.lockup.eth.DeploymentRegistry;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

/**
 * Operator tool configuration.
 *
 * Configuration via environment variables:
 * - ETH_RPC_URL: JSON-RPC endpoint (default http://127.0.0.1:8545)
 * - NETWORK: deployment name looked up under the deployments directory (default hardhat)
 * - LOCKUP_ADDRESS: lockup contract address; overrides the deployment file
 * - DEPLOYMENTS_DIR: directory holding {@code <network>.json} files (default deployments, then ../deployments)
 * - LOCKUP_REPORT_DIR: where JSON status reports are exported (default outbox)
 * - TOKEN_DECIMALS: decimals used to format amounts when the token cannot be asked (default 18)
 */
public record LockupOptions(
        String rpcUrl,
        String network,
        Optional<String> lockupAddress,
        Path deploymentsDirectory,
        Path reportDirectory,
        int tokenDecimals
) {
    public static final String DEFAULT_RPC_URL = "http://127.0.0.1:8545";
    public static final String DEFAULT_NETWORK = "hardhat";
    public static final int DEFAULT_TOKEN_DECIMALS = 18;

    public static LockupOptions fromEnv() {
        return fromMap(System.getenv());
    }

    public static LockupOptions fromMap(Map<String, String> env) {
        String rpcUrl = valueOrDefault(env.get("ETH_RPC_URL"), DEFAULT_RPC_URL);
        String network = valueOrDefault(env.get("NETWORK"), DEFAULT_NETWORK);
        String lockupAddress = env.get("LOCKUP_ADDRESS");
        Path deployments = resolveDeploymentsDirectory(env.get("DEPLOYMENTS_DIR"));
        Path reports = Paths.get(valueOrDefault(env.get("LOCKUP_REPORT_DIR"), "outbox"));
        int decimals = parseInt(env.get("TOKEN_DECIMALS"), DEFAULT_TOKEN_DECIMALS);
        return new LockupOptions(
                rpcUrl.trim(),
                network.trim(),
                Optional.ofNullable(lockupAddress).map(String::trim).filter(value -> !value.isEmpty()),
                deployments,
                reports,
                Math.max(decimals, 0)
        );
    }

    /**
     * Resolve the lockup address: LOCKUP_ADDRESS first, then the deployment file of the configured network.
     */
    public Optional<String> resolveLockupAddress() {
        if (lockupAddress.isPresent()) {
            return lockupAddress;
        }
        return new DeploymentRegistry(deploymentsDirectory).load(network).map(DeploymentMetadata::address);
    }

    private static Path resolveDeploymentsDirectory(String configured) {
        if (configured != null && !configured.isBlank()) {
            return Paths.get(configured.trim());
        }
        Path deploymentsPath = Paths.get("deployments");
        if (!Files.exists(deploymentsPath)) {
            // Try parent directory (when running from app/ folder)
            deploymentsPath = Paths.get("..").resolve("deployments");
        }
        return deploymentsPath;
    }

    private static String valueOrDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}

package com.project.lockup.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockupOptionsTest {

    @TempDir
    Path deployments;

    @Test
    void defaultsApplyWhenUnset() {
        LockupOptions options = LockupOptions.fromMap(Map.of("DEPLOYMENTS_DIR", deployments.toString()));

        assertEquals(LockupOptions.DEFAULT_RPC_URL, options.rpcUrl());
        assertEquals(LockupOptions.DEFAULT_NETWORK, options.network());
        assertTrue(options.lockupAddress().isEmpty());
        assertEquals(Paths.get("outbox"), options.reportDirectory());
        assertEquals(18, options.tokenDecimals());
        assertTrue(options.resolveLockupAddress().isEmpty());
    }

    @Test
    void environmentOverridesDefaults() {
        LockupOptions options = LockupOptions.fromMap(Map.of(
                "ETH_RPC_URL", " https://rpc.example:8545 ",
                "NETWORK", "sepolia",
                "LOCKUP_ADDRESS", "0x4000000000000000000000000000000000000004",
                "LOCKUP_REPORT_DIR", "reports",
                "TOKEN_DECIMALS", "6"
        ));

        assertEquals("https://rpc.example:8545", options.rpcUrl());
        assertEquals("sepolia", options.network());
        assertEquals(Optional.of("0x4000000000000000000000000000000000000004"), options.resolveLockupAddress());
        assertEquals(Paths.get("reports"), options.reportDirectory());
        assertEquals(6, options.tokenDecimals());
    }

    @Test
    void unparsableDecimalsFallBack() {
        LockupOptions options = LockupOptions.fromMap(Map.of("TOKEN_DECIMALS", "eighteen"));

        assertEquals(LockupOptions.DEFAULT_TOKEN_DECIMALS, options.tokenDecimals());
    }

    @Test
    void addressComesFromDeploymentFileWhenNotSet() throws Exception {
        Files.writeString(deployments.resolve("sepolia.json"),
                "{\"address\": \"0x4000000000000000000000000000000000000004\"}", StandardCharsets.UTF_8);

        LockupOptions options = LockupOptions.fromMap(Map.of(
                "NETWORK", "sepolia",
                "LOCKUP_ADDRESS", "  ",
                "DEPLOYMENTS_DIR", deployments.toString()
        ));

        assertEquals(Optional.of("0x4000000000000000000000000000000000000004"), options.resolveLockupAddress());
    }
}

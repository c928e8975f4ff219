package com.project.lockup;

import com.project.lockup.config.LockupOptions;
import com.project.lockup.core.LockupRecord;
import com.project.lockup.core.VestingCalculator;
import com.project.lockup.eth.Erc20Client;
import com.project.lockup.eth.LockupContractClient;
import com.project.lockup.report.LockupReportWriter;
import com.project.lockup.report.TokenAmounts;
import com.project.lockup.report.TokenDisplay;
import com.project.lockup.report.VestingTimeline;
import com.project.lockup.token.BlockClock;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Prints vested amounts at the schedule milestones of a lockup, plus a monthly breakdown
 * for schedules longer than 90 days.
 *
 * Reads the deployed lockup, or a JSON report exported by {@link CheckLockupApp} when
 * its path is given, which works offline.
 *
 * Usage:
 * {@code LOCKUP_ADDRESS=0x... java VestingTimelineApp}
 * {@code java VestingTimelineApp outbox/lockup_0x....json}
 */
public class VestingTimelineApp {
    public static void main(String[] args) {
        try {
            LockupOptions options = LockupOptions.fromEnv();

            System.out.println("=== Vesting Timeline Calculator ===");
            if (args.length > 0) {
                printFromReport(Paths.get(args[0]), options);
            } else {
                printFromChain(options);
            }
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printFromReport(Path reportFile, LockupOptions options) throws Exception {
        if (!Files.exists(reportFile)) {
            System.err.println("Report file not found: " + reportFile.toAbsolutePath());
            System.exit(1);
        }
        System.out.println("Report: " + reportFile.toAbsolutePath());
        LockupRecord record = new LockupReportWriter(options.reportDirectory()).readRecord(reportFile);
        TokenDisplay display = new TokenDisplay(options.tokenDecimals(), TokenDisplay.DEFAULT_SYMBOL);
        if (print(record, display)) {
            // offline, so evaluated against the local clock
            long now = BlockClock.system().now();
            System.out.println("Status at " + TokenAmounts.timestamp(now) + " (local clock):");
            System.out.println("Vested Amount:     " + display.format(VestingCalculator.vestedAmount(record, now)));
            System.out.println("Releasable Amount: " + display.format(VestingCalculator.releasableAmount(record, now)));
            System.out.println("Vesting Progress:  " + VestingCalculator.vestingProgress(record, now) + " %");
        }
    }

    private static void printFromChain(LockupOptions options) throws Exception {
        String lockupAddress = options.resolveLockupAddress().orElseThrow(() -> new IllegalStateException(
                "LOCKUP_ADDRESS environment variable is required"));

        Web3j web3 = Web3j.build(new HttpService(options.rpcUrl()));
        try (LockupContractClient client = new LockupContractClient(web3, lockupAddress)) {
            System.out.println("Lockup Contract: " + lockupAddress);
            LockupRecord record = client.lockupInfo();
            TokenDisplay display = record.exists()
                    ? TokenDisplay.resolve(new Erc20Client(web3, client.token()), options.tokenDecimals())
                    : new TokenDisplay(options.tokenDecimals(), TokenDisplay.DEFAULT_SYMBOL);
            if (print(record, display)) {
                System.out.println("Current Status:");
                System.out.println("Vested Amount:     " + display.format(client.vestedAmount()));
                System.out.println("Releasable Amount: " + display.format(client.releasableAmount()));
                System.out.println("Vesting Progress:  " + client.vestingProgress() + " %");
            }
        } finally {
            web3.shutdown();
        }
    }

    private static boolean print(LockupRecord record, TokenDisplay display) {
        System.out.println("Beneficiary: " + record.beneficiary());
        System.out.println();
        if (!record.exists()) {
            System.out.println("No lockup found");
            return false;
        }

        System.out.println("Lockup Parameters:");
        System.out.println("Total Amount:     " + display.format(record.totalAmount()));
        System.out.println("Start Time:       " + TokenAmounts.timestamp(record.startTime()));
        System.out.println("Cliff Duration:   " + TokenAmounts.days(record.cliffDuration()) + " days");
        System.out.println("Vesting Duration: " + TokenAmounts.days(record.vestingDuration()) + " days");
        if (record.revoked()) {
            System.out.println("Revoked, vesting frozen at " + display.format(record.vestedAtRevoke()));
        }
        System.out.println();

        VestingTimeline.of(record).render(display.decimals()).forEach(System.out::println);
        System.out.println();
        return true;
    }
}

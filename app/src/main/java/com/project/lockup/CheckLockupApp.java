package com.project.lockup;

import com.project.lockup.config.LockupOptions;
import com.project.lockup.eth.Erc20Client;
import com.project.lockup.eth.LockupContractClient;
import com.project.lockup.eth.Web3jBlockClock;
import com.project.lockup.report.LockupReportWriter;
import com.project.lockup.report.LockupStatusReport;
import com.project.lockup.report.TokenDisplay;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.nio.file.Path;
import java.util.Arrays;

/**
 * Prints the state of a deployed lockup: amounts, schedule, progress and phase.
 *
 * The lockup is taken from LOCKUP_ADDRESS, or from {@code deployments/<NETWORK>.json}.
 * With {@code --export} the report is also written as JSON under LOCKUP_REPORT_DIR.
 *
 * Usage: LOCKUP_ADDRESS=0x... java CheckLockupApp [--export]
 */
public class CheckLockupApp {
    public static void main(String[] args) {
        try {
            LockupOptions options = LockupOptions.fromEnv();
            boolean export = Arrays.asList(args).contains("--export");
            String lockupAddress = options.resolveLockupAddress().orElseThrow(() -> new IllegalStateException(
                    "LOCKUP_ADDRESS environment variable is required (or deploy to "
                            + options.deploymentsDirectory().resolve(options.network() + ".json") + ")"));

            System.out.println("╔════════════════════════════════════════════════════════════════╗");
            System.out.println("║                  LOCKUP STATUS (SimpleLockup)                  ║");
            System.out.println("╚════════════════════════════════════════════════════════════════╝");
            System.out.println("RPC endpoint: " + options.rpcUrl());
            System.out.println();

            Web3j web3 = Web3j.build(new HttpService(options.rpcUrl()));
            try (LockupContractClient client = new LockupContractClient(web3, lockupAddress)) {
                long chainTime = new Web3jBlockClock(web3).now();
                LockupStatusReport report = LockupStatusReport.fromContract(client, chainTime);
                TokenDisplay display = TokenDisplay.resolve(new Erc20Client(web3, report.token()), options.tokenDecimals());

                report.render(display).forEach(System.out::println);

                if (export) {
                    Path output = new LockupReportWriter(options.reportDirectory()).write(report);
                    System.out.println();
                    System.out.printf("Lockup report exported to: %s%n", output.toAbsolutePath());
                }
            } finally {
                web3.shutdown();
            }
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }
}

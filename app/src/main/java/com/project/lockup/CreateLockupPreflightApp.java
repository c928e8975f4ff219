package com.project.lockup;

import com.project.lockup.config.LockupOptions;
import com.project.lockup.eth.Erc20Client;
import com.project.lockup.eth.LockupContractClient;
import com.project.lockup.report.CreateLockupPreflight;
import com.project.lockup.report.TokenAmounts;
import com.project.lockup.report.TokenDisplay;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.math.BigInteger;

/**
 * Checks whether {@code createLockup} would succeed for an operator before anything is sent:
 * ownership, existing lockup, request parameters, balance and allowance, in the order the
 * contract checks them. Read-only.
 *
 * Usage: LOCKUP_ADDRESS=0x... java CreateLockupPreflightApp <operator> <beneficiary> [amount] [cliffDays] [vestingDays]
 * Amount is in whole tokens (default 1000); durations default to 30 and 365 days.
 */
public class CreateLockupPreflightApp {

    private static final long DAY = 24 * 60 * 60;

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: CreateLockupPreflightApp <operator> <beneficiary> [amount] [cliffDays] [vestingDays]");
            System.exit(1);
        }
        try {
            LockupOptions options = LockupOptions.fromEnv();
            String lockupAddress = options.resolveLockupAddress().orElseThrow(() -> new IllegalStateException(
                    "LOCKUP_ADDRESS environment variable is required"));
            String operator = args[0];
            String beneficiary = args[1];
            String amountText = args.length > 2 ? args[2] : "1000";
            long cliffDuration = (args.length > 3 ? Long.parseLong(args[3]) : 30) * DAY;
            long vestingDuration = (args.length > 4 ? Long.parseLong(args[4]) : 365) * DAY;

            System.out.println("Debugging Lockup Creation");
            System.out.println("SimpleLockup Address: " + lockupAddress);
            System.out.println("Beneficiary Address:  " + beneficiary);
            System.out.println();

            Web3j web3 = Web3j.build(new HttpService(options.rpcUrl()));
            try (LockupContractClient client = new LockupContractClient(web3, lockupAddress)) {
                Erc20Client token = new Erc20Client(web3, client.token());
                TokenDisplay display = TokenDisplay.resolve(token, options.tokenDecimals());
                BigInteger amount = TokenAmounts.parse(amountText, display.decimals());

                CreateLockupPreflight preflight = new CreateLockupPreflight(
                        lockupAddress,
                        client.owner(),
                        operator,
                        token.balanceOf(operator),
                        token.allowance(operator, lockupAddress),
                        client.lockupInfo(),
                        beneficiary,
                        amount,
                        cliffDuration,
                        vestingDuration
                );
                preflight.render(display).forEach(System.out::println);
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

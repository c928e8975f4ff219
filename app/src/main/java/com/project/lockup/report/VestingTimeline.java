package com.project.lockup.report;

import com.project.lockup.core.LockupRecord;
import com.project.lockup.core.VestingCalculator;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Vested amounts of a lockup at fixed points of its schedule.
 *
 * Milestones are the start, the cliff end, 25/50/75 % of the duration and the end.
 * Schedules longer than 90 days also get a breakdown every 30 days, at most 12 rows.
 * Points after a revocation show the frozen amount.
 */
public record VestingTimeline(List<Row> milestones, List<Row> monthly) {

    static final long DAY = 24 * 60 * 60;
    static final long MONTH = 30 * DAY;
    static final long MONTHLY_BREAKDOWN_THRESHOLD = 90 * DAY;
    static final int MAX_MONTHLY_ROWS = 12;

    /**
     * @param label         milestone name, or {@code M<n>} for monthly rows
     * @param time          epoch seconds
     * @param elapsedDays   whole days since the start
     * @param vestedAmount  vested at {@code time}
     * @param vestedPercent share of the total, one decimal
     */
    public record Row(String label, long time, long elapsedDays, BigInteger vestedAmount, BigDecimal vestedPercent) {}

    public static VestingTimeline of(LockupRecord record) {
        if (!record.exists()) {
            return new VestingTimeline(List.of(), List.of());
        }

        long start = record.startTime();
        long duration = record.vestingDuration();

        List<Row> milestones = List.of(
                row(record, "Start", start),
                row(record, "Cliff End", record.cliffEnd()),
                row(record, "25% Duration", start + duration / 4),
                row(record, "50% Duration", start + duration / 2),
                row(record, "75% Duration", start + duration * 3 / 4),
                row(record, "Vesting End", record.vestingEnd())
        );

        List<Row> monthly = new ArrayList<>();
        if (duration > MONTHLY_BREAKDOWN_THRESHOLD) {
            long months = Math.min(MAX_MONTHLY_ROWS, duration / MONTH);
            for (int month = 1; month <= months; month++) {
                monthly.add(row(record, "M" + month, start + month * MONTH));
            }
        }
        return new VestingTimeline(milestones, List.copyOf(monthly));
    }

    private static Row row(LockupRecord record, String label, long time) {
        BigInteger vested = VestingCalculator.vestedAmount(record, time);
        return new Row(
                label,
                time,
                TokenAmounts.elapsedDays(record.startTime(), time),
                vested,
                TokenAmounts.percent(vested, record.totalAmount())
        );
    }

    /**
     * Table lines for the milestones and, when present, the monthly breakdown.
     */
    public List<String> render(int decimals) {
        List<String> lines = new ArrayList<>();
        String rule = "-".repeat(70);
        lines.add("Vesting Timeline:");
        lines.add(rule);
        lines.add(String.format("%-25s %-15s %-12s %s", "Date", "Elapsed", "Vested %", "Vested Amount"));
        lines.add(rule);
        for (Row row : milestones) {
            lines.add(String.format("%-25s %-15s %-12s %s",
                    TokenAmounts.date(row.time()) + " (" + row.label() + ")",
                    row.elapsedDays() + "d",
                    row.vestedPercent() + "%",
                    TokenAmounts.format(row.vestedAmount(), decimals)));
        }
        lines.add(rule);

        if (!monthly.isEmpty()) {
            lines.add("");
            lines.add("Monthly Vesting Breakdown:");
            lines.add(rule);
            lines.add(String.format("%-10s %-25s %-12s %s", "Month", "Date", "Vested %", "Vested Amount"));
            lines.add(rule);
            for (Row row : monthly) {
                lines.add(String.format("%-10s %-25s %-12s %s",
                        row.label(),
                        TokenAmounts.date(row.time()),
                        row.vestedPercent() + "%",
                        TokenAmounts.format(row.vestedAmount(), decimals)));
            }
            lines.add(rule);
        }
        return lines;
    }
}

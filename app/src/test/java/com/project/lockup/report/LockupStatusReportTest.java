package com.project.lockup.report;

import com.project.lockup.Fixtures;
import com.project.lockup.InMemoryTokenLedger;
import com.project.lockup.ManualClock;
import com.project.lockup.core.SimpleLockup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.project.lockup.Fixtures.BENEFICIARY;
import static com.project.lockup.Fixtures.GENESIS;
import static com.project.lockup.Fixtures.LOCKUP;
import static com.project.lockup.Fixtures.MONTH;
import static com.project.lockup.Fixtures.OWNER;
import static com.project.lockup.Fixtures.YEAR;
import static com.project.lockup.Fixtures.tokens;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockupStatusReportTest {

    private final TokenDisplay display = new TokenDisplay(18, "LOCK");

    private ManualClock clock;
    private SimpleLockup lockup;

    @BeforeEach
    void setUp() {
        InMemoryTokenLedger ledger = new InMemoryTokenLedger();
        clock = new ManualClock(GENESIS);
        lockup = Fixtures.deploy(ledger, clock);
        ledger.mint(OWNER, tokens(1000));
        ledger.approve(OWNER, LOCKUP, tokens(1000));
    }

    @Test
    void reportsMissingLockup() {
        LockupStatusReport report = LockupStatusReport.of(lockup, clock.now());

        assertEquals(LockupStatusReport.VestingPhase.NO_LOCKUP, report.phase());
        List<String> lines = report.render(display);
        assertEquals("No lockup found", lines.get(lines.size() - 1));
    }

    @Test
    void phaseFollowsClock() {
        lockup.createLockup(OWNER, BENEFICIARY, tokens(1000), MONTH, YEAR, true);

        assertEquals(LockupStatusReport.VestingPhase.IN_CLIFF, LockupStatusReport.of(lockup, clock.now()).phase());
        clock.advance(MONTH);
        assertEquals(LockupStatusReport.VestingPhase.VESTING, LockupStatusReport.of(lockup, clock.now()).phase());
        clock.advance(YEAR);
        assertEquals(LockupStatusReport.VestingPhase.FULLY_VESTED, LockupStatusReport.of(lockup, clock.now()).phase());
    }

    @Test
    void renderShowsAmountsAndStatus() {
        lockup.createLockup(OWNER, BENEFICIARY, tokens(1000), 0, YEAR, true);
        clock.advance(YEAR / 2);

        List<String> lines = LockupStatusReport.of(lockup, clock.now()).render(display);

        assertTrue(lines.contains("Total Amount:      1000 LOCK"));
        assertTrue(lines.contains("Vested Amount:     500 LOCK"));
        assertTrue(lines.contains("Vesting Progress: 50 %"));
        assertTrue(lines.contains("Status: Vesting in progress"));
        assertTrue(lines.contains("Releasable now: 500 LOCK"));
    }

    @Test
    void renderShowsFrozenAmountAfterRevocation() {
        lockup.createLockup(OWNER, BENEFICIARY, tokens(1000), 0, YEAR, true);
        clock.advance(YEAR / 4);
        lockup.revoke(OWNER);

        List<String> lines = LockupStatusReport.of(lockup, clock.now()).render(display);

        assertTrue(lines.contains("Revoked:          true"));
        assertTrue(lines.contains("Vested at Revoke: 250 LOCK"));
    }

    @Test
    void nothingReleasableLeavesOutReleasableLine() {
        lockup.createLockup(OWNER, BENEFICIARY, tokens(1000), MONTH, YEAR, false);

        List<String> lines = LockupStatusReport.of(lockup, clock.now()).render(display);

        assertTrue(lines.contains("Status: In cliff period (no tokens vested yet)"));
        assertFalse(lines.stream().anyMatch(line -> line.startsWith("Releasable now")));
    }
}

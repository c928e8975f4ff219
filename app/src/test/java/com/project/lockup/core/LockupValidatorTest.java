package com.project.lockup.core;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.project.lockup.Fixtures.BENEFICIARY;
import static com.project.lockup.Fixtures.TOKEN;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LockupValidatorTest {

    @Test
    void tokenAddressMustHostCode() {
        LockupException noCode = assertThrows(LockupException.class,
                () -> LockupValidator.validateTokenAddress(TOKEN, address -> false));
        assertEquals(LockupError.INVALID_TOKEN_ADDRESS, noCode.error());

        LockupException zero = assertThrows(LockupException.class,
                () -> LockupValidator.validateTokenAddress(LockupValidator.ZERO_ADDRESS, address -> true));
        assertEquals(LockupError.INVALID_TOKEN_ADDRESS, zero.error());

        String accepted = LockupValidator.validateTokenAddress(TOKEN, address -> true);
        assertTrue(LockupValidator.sameAddress(TOKEN, accepted));
    }

    @Test
    void beneficiaryIsChecksummed() {
        String lower = "0x52908400098527886e0f7030069857d2e4169ee7";
        assertEquals("0x52908400098527886E0F7030069857D2E4169EE7", LockupValidator.validateBeneficiary(lower));
    }

    @Test
    void malformedBeneficiariesAreRejected() {
        for (String bad : new String[]{null, "", "0x1234", "2000000000000000000000000000000000000002",
                LockupValidator.ZERO_ADDRESS}) {
            LockupException e = assertThrows(LockupException.class, () -> LockupValidator.validateBeneficiary(bad),
                    "expected rejection of " + bad);
            assertEquals(LockupError.INVALID_BENEFICIARY, e.error());
        }
    }

    @Test
    void amountMustBePositiveAndFitUint256() {
        assertEquals(LockupError.INVALID_AMOUNT, assertThrows(LockupException.class,
                () -> LockupValidator.validateAmount(BigInteger.ZERO)).error());
        assertEquals(LockupError.INVALID_AMOUNT, assertThrows(LockupException.class,
                () -> LockupValidator.validateAmount(BigInteger.valueOf(-1))).error());
        assertEquals(LockupError.INVALID_AMOUNT, assertThrows(LockupException.class,
                () -> LockupValidator.validateAmount(LockupValidator.MAX_UINT256.add(BigInteger.ONE))).error());
        assertDoesNotThrow(() -> LockupValidator.validateAmount(BigInteger.ONE));
        assertDoesNotThrow(() -> LockupValidator.validateAmount(LockupValidator.MAX_UINT256));
    }

    @Test
    void durationsMustLeaveAVestingWindow() {
        long max = VestingCalculator.MAX_VESTING_DURATION;
        long[][] rejected = {{0, 0}, {-1, 10}, {10, 10}, {11, 10}, {0, max + 1}};
        for (long[] pair : rejected) {
            LockupException e = assertThrows(LockupException.class,
                    () -> LockupValidator.validateDurations(pair[0], pair[1]),
                    "expected rejection of cliff=" + pair[0] + " vesting=" + pair[1]);
            assertEquals(LockupError.INVALID_DURATION, e.error());
        }
        assertDoesNotThrow(() -> LockupValidator.validateDurations(0, 1));
        assertDoesNotThrow(() -> LockupValidator.validateDurations(max - 1, max));
    }

    @Test
    void receivedMustMatchExactly() {
        LockupException e = assertThrows(LockupException.class,
                () -> LockupValidator.validateReceived(BigInteger.TEN, BigInteger.valueOf(9)));
        assertEquals(LockupError.TRANSFER_AMOUNT_MISMATCH, e.error());
        assertTrue(e.getMessage().startsWith("TransferAmountMismatch"), e.getMessage());
    }

    @Test
    void sameAddressIgnoresCaseButNotGarbage() {
        assertTrue(LockupValidator.sameAddress(BENEFICIARY, BENEFICIARY.toUpperCase().replace("0X", "0x")));
        assertFalse(LockupValidator.sameAddress(BENEFICIARY, TOKEN));
        assertFalse(LockupValidator.sameAddress(null, BENEFICIARY));
        assertFalse(LockupValidator.sameAddress("not-an-address", "not-an-address"));
    }
}

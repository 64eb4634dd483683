package com.goldminer.backend.services.sms.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

import com.goldminer.backend.enums.TransactionState;

class ContentHasherTest {

    private static final LocalDate DATE = LocalDate.of(2024, 11, 15);

    private final ContentHasher hasher = new ContentHasher();

    @Test
    void hashIsLowercaseSha256Hex() {
        String hash = hasher.hash(DATE, new BigDecimal("250.50"), "Amazon", "hsbc_credit_main", TransactionState.MONETARY);

        assertTrue(hash.matches("[0-9a-f]{64}"), hash);
    }

    @Test
    void payeeWhitespaceIsCollapsed() {
        assertEquals(hasher.hash(null, null, "x", "unknown", TransactionState.PROMO),
                hasher.hash(null, null, " x ", "unknown", TransactionState.PROMO));
    }

    @Test
    void sameContentHashesAlike() {
        String first = hasher.hash(DATE, new BigDecimal("250.5"), "Amazon  Store", "acc", TransactionState.MONETARY);
        String second = hasher.hash(DATE, new BigDecimal("250.50"), " Amazon Store ", "acc", TransactionState.MONETARY);

        assertEquals(first, second);
    }

    @Test
    void everyIdentityFieldChangesTheHash() {
        String base = hasher.hash(DATE, BigDecimal.TEN, "Amazon", "acc", TransactionState.MONETARY);

        assertNotEquals(base, hasher.hash(DATE.plusDays(1), BigDecimal.TEN, "Amazon", "acc", TransactionState.MONETARY));
        assertNotEquals(base, hasher.hash(DATE, BigDecimal.ONE, "Amazon", "acc", TransactionState.MONETARY));
        assertNotEquals(base, hasher.hash(DATE, BigDecimal.TEN, "Noon", "acc", TransactionState.MONETARY));
        assertNotEquals(base, hasher.hash(DATE, BigDecimal.TEN, "Amazon", "other", TransactionState.MONETARY));
        assertNotEquals(base, hasher.hash(DATE, BigDecimal.TEN, "Amazon", "acc", TransactionState.DECLINED));
    }

    @Test
    void accountAndStateAreRequired() {
        assertThrows(IllegalArgumentException.class,
                () -> hasher.hash(DATE, BigDecimal.TEN, "Amazon", " ", TransactionState.MONETARY));
        assertThrows(IllegalArgumentException.class,
                () -> hasher.hash(DATE, BigDecimal.TEN, "Amazon", "acc", null));
    }

    @Test
    void amountsHashAtTheStoredScale() {
        String rounded = hasher.hash(DATE, new BigDecimal("12.34"), "Amazon", "acc", TransactionState.MONETARY);

        assertEquals(rounded, hasher.hash(DATE, new BigDecimal("12.344"), "Amazon", "acc", TransactionState.MONETARY));
        assertEquals(rounded, hasher.hash(DATE, new BigDecimal("12.335"), "Amazon", "acc", TransactionState.MONETARY));
        assertNotEquals(rounded, hasher.hash(DATE, new BigDecimal("12.345"), "Amazon", "acc", TransactionState.MONETARY));
    }
}

package com.goldminer.backend.dto.sms;

import com.goldminer.backend.enums.BankMatchKind;

/**
 * Result of bank identification. Unmatched messages carry {@link #UNKNOWN_BANK} with score 0.
 */
public record BankMatch(String bankId, int confidenceScore, BankMatchKind matchKind) {

    public static final String UNKNOWN_BANK = "unknown_bank";

    public BankMatch {
        if (bankId == null || bankId.isBlank()) throw new IllegalArgumentException("bankId is required");
        if (confidenceScore < 0 || confidenceScore > 100) {
            throw new IllegalArgumentException("confidenceScore must be between 0 and 100");
        }
        if (matchKind == null) throw new IllegalArgumentException("matchKind is required");
    }

    public static BankMatch exact(String bankId) {
        return new BankMatch(bankId, 100, BankMatchKind.EXACT);
    }

    public static BankMatch fuzzy(String bankId, int score) {
        return new BankMatch(bankId, score, BankMatchKind.FUZZY);
    }

    public static BankMatch unknown() {
        return new BankMatch(UNKNOWN_BANK, 0, BankMatchKind.NONE);
    }

    public boolean unmatched() {
        return matchKind == BankMatchKind.NONE;
    }
}

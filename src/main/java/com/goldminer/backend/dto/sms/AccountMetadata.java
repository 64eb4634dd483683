package com.goldminer.backend.dto.sms;

import java.math.BigDecimal;

import com.goldminer.backend.enums.AccountType;

public record AccountMetadata(
        String accountId,
        AccountType accountType,
        BigDecimal interestRate,
        BigDecimal creditLimit,
        Integer billingCycle,
        String label,
        boolean known
) {

    public static final String UNKNOWN_ACCOUNT = "unknown";

    public AccountMetadata {
        if (accountId == null || accountId.isBlank()) throw new IllegalArgumentException("accountId is required");
        if (accountType == null) throw new IllegalArgumentException("accountType is required");
        if (billingCycle != null && (billingCycle < 1 || billingCycle > 31)) {
            throw new IllegalArgumentException("billingCycle must be between 1 and 31");
        }
        if (label == null) {
            label = accountId;
        }
    }

    /**
     * Fallback for a suffix that is not in the account table, or for a message without a suffix.
     */
    public static AccountMetadata unknown(String cardSuffix) {
        if (cardSuffix == null) {
            return new AccountMetadata(UNKNOWN_ACCOUNT, AccountType.UNKNOWN, null, null, null, "No card suffix in SMS", false);
        }
        return new AccountMetadata(UNKNOWN_ACCOUNT + "_" + cardSuffix, AccountType.UNKNOWN, null, null, null, "Unknown card", false);
    }
}

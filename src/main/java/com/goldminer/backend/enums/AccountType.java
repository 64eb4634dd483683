package com.goldminer.backend.enums;

import java.util.Locale;

public enum AccountType {
    CREDIT("Credit"),
    DEBIT("Debit"),
    PREPAID("Prepaid"),
    UNKNOWN("Unknown");

    private final String label;

    AccountType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Accepts the configuration spelling ("Credit") as well as the constant name.
     */
    public static AccountType fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("account type is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (AccountType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported account type: " + value);
    }
}

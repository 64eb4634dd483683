package com.goldminer.backend.services.sms.extraction;

import java.util.Objects;

/**
 * Which banks' templates an extraction may use: one named bank, or every configured bank.
 */
public final class BankScope {

    public enum Kind {
        SPECIFIED,
        AUTO
    }

    private static final BankScope AUTO = new BankScope(Kind.AUTO, null);

    private final Kind kind;
    private final String bankId;

    private BankScope(Kind kind, String bankId) {
        this.kind = kind;
        this.bankId = bankId;
    }

    public static BankScope specified(String bankId) {
        if (bankId == null || bankId.isBlank()) {
            throw new IllegalArgumentException("bankId is required for a specified scope");
        }
        return new BankScope(Kind.SPECIFIED, bankId);
    }

    public static BankScope auto() {
        return AUTO;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @throws IllegalStateException for the auto scope
     */
    public String bankId() {
        if (kind == Kind.AUTO) {
            throw new IllegalStateException("auto scope has no bank id");
        }
        return bankId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BankScope other)) return false;
        return kind == other.kind && Objects.equals(bankId, other.bankId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, bankId);
    }

    @Override
    public String toString() {
        return kind == Kind.AUTO ? "auto" : "specified(" + bankId + ")";
    }
}

package com.goldminer.backend.enums;

/**
 * Monetary relevance of a message. Only {@link #MONETARY} records take part in
 * expense aggregation; the other states are kept for audit.
 */
public enum TransactionState {
    MONETARY,
    PROMO,
    OTP,
    DECLINED,
    UNKNOWN;

    public boolean isAggregatable() {
        return this == MONETARY;
    }
}

package com.goldminer.backend.enums;

/**
 * Anomaly rules. Keep this additive; stored values use {@link #getCode()}.
 */
public enum AnomalyFlag {
    HIGH_VALUE("high_value"),
    BURST_FREQUENCY("burst_frequency"),
    UNKNOWN_MERCHANT("unknown_merchant");

    private final String code;

    AnomalyFlag(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static AnomalyFlag fromCode(String code) {
        for (AnomalyFlag flag : values()) {
            if (flag.code.equalsIgnoreCase(code) || flag.name().equalsIgnoreCase(code)) {
                return flag;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly flag: " + code);
    }
}

package com.goldminer.backend.enums;

public enum StoreOutcome {
    INSERTED,
    UPDATED,
    SKIPPED,
    FAILED
}

package com.goldminer.backend.enums;

public enum BankMatchKind {
    EXACT,
    FUZZY,
    NONE
}

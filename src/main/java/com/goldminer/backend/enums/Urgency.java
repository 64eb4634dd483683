package com.goldminer.backend.enums;

public enum Urgency {
    NORMAL,
    MEDIUM,
    HIGH
}

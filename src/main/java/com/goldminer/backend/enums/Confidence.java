package com.goldminer.backend.enums;

/**
 * Coarse reliability level attached to promo verdicts and extraction results.
 * Declared from weakest to strongest so that {@code compareTo} ranks results.
 */
public enum Confidence {
    LOW,
    MEDIUM,
    HIGH
}

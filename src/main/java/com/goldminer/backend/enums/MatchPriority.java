package com.goldminer.backend.enums;

/**
 * Which rule of the category cascade produced an assignment.
 */
public enum MatchPriority {
    EXACT,
    FUZZY,
    KEYWORD,
    FALLBACK
}

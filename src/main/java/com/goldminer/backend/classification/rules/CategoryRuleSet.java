package com.goldminer.backend.classification.rules;

import java.util.List;
import java.util.Set;

import com.goldminer.backend.dto.sms.CategoryAssignment;
import com.goldminer.backend.enums.MatchPriority;

public record CategoryRuleSet(List<CategoryRule> rules, CategoryAssignment fallback) {

    public static final String DEFAULT_FALLBACK_CATEGORY = "Uncategorized";
    public static final String DEFAULT_FALLBACK_SUBCATEGORY = "General";

    public CategoryRuleSet {
        rules = List.copyOf(rules);
        if (fallback == null) {
            fallback = defaultFallback();
        }
        if (fallback.matchPriority() != MatchPriority.FALLBACK) {
            fallback = fallback.withPriority(MatchPriority.FALLBACK);
        }
    }

    public static CategoryRuleSet empty() {
        return new CategoryRuleSet(List.of(), defaultFallback());
    }

    private static CategoryAssignment defaultFallback() {
        return new CategoryAssignment(DEFAULT_FALLBACK_CATEGORY, DEFAULT_FALLBACK_SUBCATEGORY, Set.of(), MatchPriority.FALLBACK);
    }
}

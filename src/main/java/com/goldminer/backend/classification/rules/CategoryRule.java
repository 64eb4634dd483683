package com.goldminer.backend.classification.rules;

import java.util.List;
import java.util.Set;

import com.goldminer.backend.dto.sms.CategoryAssignment;
import com.goldminer.backend.enums.MatchPriority;

/**
 * One configured category. Merchant names and keywords are stored lowercased.
 */
public record CategoryRule(
        String category,
        String subcategory,
        Set<String> tags,
        List<String> merchantExact,
        List<String> merchantFuzzy,
        List<String> keywords
) {
    public CategoryRule {
        if (category == null || category.isBlank()) throw new IllegalArgumentException("category is required");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        merchantExact = merchantExact == null ? List.of() : List.copyOf(merchantExact);
        merchantFuzzy = merchantFuzzy == null ? List.of() : List.copyOf(merchantFuzzy);
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }

    public CategoryAssignment assign(MatchPriority priority) {
        return new CategoryAssignment(category, subcategory, tags, priority);
    }
}

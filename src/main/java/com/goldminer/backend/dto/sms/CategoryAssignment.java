package com.goldminer.backend.dto.sms;

import java.util.Set;

import com.goldminer.backend.enums.MatchPriority;

public record CategoryAssignment(String category, String subcategory, Set<String> tags, MatchPriority matchPriority) {

    public CategoryAssignment {
        if (category == null || category.isBlank()) throw new IllegalArgumentException("category is required");
        if (matchPriority == null) throw new IllegalArgumentException("matchPriority is required");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public CategoryAssignment withPriority(MatchPriority priority) {
        return new CategoryAssignment(category, subcategory, tags, priority);
    }
}

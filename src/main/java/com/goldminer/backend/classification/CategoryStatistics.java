package com.goldminer.backend.classification;

import java.util.Map;

public record CategoryStatistics(long total, Map<String, Long> byCategory, long uncategorized, double uncategorizedPercentage) {

    public CategoryStatistics {
        byCategory = Map.copyOf(byCategory);
    }
}

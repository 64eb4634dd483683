package com.goldminer.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Fuzzy similarity thresholds (0-100) used by the matching stages.
 */
@Validated
@ConfigurationProperties(prefix = "goldminer.matching")
public record MatchingProperties(
        @Min(0) @Max(100) Integer bankFuzzyThreshold,
        @Min(0) @Max(100) Integer categoryFuzzyThreshold,
        @Min(0) @Max(100) Integer merchantAliasThreshold
) {
    public MatchingProperties {
        if (bankFuzzyThreshold == null) {
            bankFuzzyThreshold = 80;
        }
        if (categoryFuzzyThreshold == null) {
            categoryFuzzyThreshold = 80;
        }
        if (merchantAliasThreshold == null) {
            merchantAliasThreshold = 85;
        }
    }

    public static MatchingProperties defaults() {
        return new MatchingProperties(null, null, null);
    }
}

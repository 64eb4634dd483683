package com.goldminer.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Locations of the rule files. Any Spring resource location is accepted
 * ({@code classpath:}, {@code file:}).
 */
@ConfigurationProperties(prefix = "goldminer.rules")
public record RulesProperties(
        String promoKeywords,
        String bankPatterns,
        String templates,
        String accounts,
        String categoryRules,
        String merchantAliases,
        boolean autoReload,
        Long reloadIntervalMs
) {
    public RulesProperties {
        if (promoKeywords == null || promoKeywords.isBlank()) {
            promoKeywords = "classpath:rules/promo_keywords.yml";
        }
        if (bankPatterns == null || bankPatterns.isBlank()) {
            bankPatterns = "classpath:rules/bank_patterns.yml";
        }
        if (templates == null || templates.isBlank()) {
            templates = "classpath:rules/sms_templates.yml";
        }
        if (accounts == null || accounts.isBlank()) {
            accounts = "classpath:rules/accounts.yml";
        }
        if (categoryRules == null || categoryRules.isBlank()) {
            categoryRules = "classpath:rules/category_rules.yml";
        }
        if (merchantAliases == null || merchantAliases.isBlank()) {
            merchantAliases = "classpath:rules/merchant_aliases.yml";
        }
        if (reloadIntervalMs == null || reloadIntervalMs <= 0) {
            reloadIntervalMs = 30_000L;
        }
    }

    public static RulesProperties defaults() {
        return new RulesProperties(null, null, null, null, null, null, false, null);
    }
}

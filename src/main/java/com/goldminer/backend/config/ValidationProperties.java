package com.goldminer.backend.config;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Field validation and urgency settings. Currency codes are compared upper-cased; Arabic
 * currency names are accepted as written.
 */
@ConfigurationProperties(prefix = "goldminer.validation")
public record ValidationProperties(
        Set<String> currencies,
        BigDecimal highUrgencyAmount,
        BigDecimal creditMediumUrgencyAmount
) {
    private static final Set<String> DEFAULT_CURRENCIES = Set.of(
            "EGP", "USD", "EUR", "GBP", "SAR", "AED", "KWD", "QAR", "BHD", "OMR",
            "JOD", "LBP", "IQD", "SYP", "YER", "TND", "MAD", "DZD", "SDG", "LYD",
            "جنيه", "دولار", "يورو", "ريال", "درهم", "دينار");

    public ValidationProperties {
        if (currencies == null || currencies.isEmpty()) {
            currencies = DEFAULT_CURRENCIES;
        } else {
            currencies = currencies.stream()
                    .map(c -> c.strip().toUpperCase(Locale.ROOT))
                    .collect(Collectors.toUnmodifiableSet());
        }
        if (highUrgencyAmount == null) {
            highUrgencyAmount = new BigDecimal("10000");
        }
        if (creditMediumUrgencyAmount == null) {
            creditMediumUrgencyAmount = new BigDecimal("5000");
        }
    }

    public static ValidationProperties defaults() {
        return new ValidationProperties(null, null, null);
    }
}

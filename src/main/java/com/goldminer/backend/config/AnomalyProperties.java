package com.goldminer.backend.config;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.goldminer.backend.enums.AnomalyFlag;

@ConfigurationProperties(prefix = "goldminer.anomaly")
public record AnomalyProperties(
        Double highValuePercentile,
        Integer minHistory,
        Integer burstCount,
        Duration burstWindow,
        Integer unknownMerchantWindow,
        Integer historyLimit,
        Set<AnomalyFlag> enabledRules
) {
    public AnomalyProperties {
        if (highValuePercentile == null) {
            highValuePercentile = 90.0;
        }
        if (highValuePercentile < 0.0 || highValuePercentile > 100.0) {
            throw new IllegalArgumentException("highValuePercentile must be between 0 and 100");
        }
        if (minHistory == null) {
            minHistory = 10;
        }
        if (minHistory < 1) {
            throw new IllegalArgumentException("minHistory must be at least 1");
        }
        if (burstCount == null) {
            burstCount = 3;
        }
        if (burstWindow == null) {
            burstWindow = Duration.ofHours(24);
        }
        if (unknownMerchantWindow == null) {
            unknownMerchantWindow = 100;
        }
        if (historyLimit == null) {
            historyLimit = 1000;
        }
        if (enabledRules == null || enabledRules.isEmpty()) {
            enabledRules = EnumSet.allOf(AnomalyFlag.class);
        }
        enabledRules = Set.copyOf(enabledRules);
    }

    public static AnomalyProperties defaults() {
        return new AnomalyProperties(null, null, null, null, null, null, null);
    }
}

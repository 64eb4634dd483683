package com.goldminer.backend.services.sms.pipeline;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import com.goldminer.backend.config.ValidationProperties;
import com.goldminer.backend.enums.AccountType;
import com.goldminer.backend.enums.Urgency;

import lombok.RequiredArgsConstructor;

/**
 * {@code HIGH} from the high urgency amount up, {@code MEDIUM} for credit accounts from the
 * credit threshold up, otherwise {@code NORMAL}.
 */
@Component
@RequiredArgsConstructor
public class UrgencyClassifier {

    private final ValidationProperties properties;

    public Urgency classify(BigDecimal amount, AccountType accountType) {
        if (amount == null) {
            return Urgency.NORMAL;
        }
        if (amount.compareTo(properties.highUrgencyAmount()) >= 0) {
            return Urgency.HIGH;
        }
        if (accountType == AccountType.CREDIT && amount.compareTo(properties.creditMediumUrgencyAmount()) >= 0) {
            return Urgency.MEDIUM;
        }
        return Urgency.NORMAL;
    }
}

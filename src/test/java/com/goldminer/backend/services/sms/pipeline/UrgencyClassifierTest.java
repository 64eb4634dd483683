package com.goldminer.backend.services.sms.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.goldminer.backend.config.ValidationProperties;
import com.goldminer.backend.enums.AccountType;
import com.goldminer.backend.enums.Urgency;

class UrgencyClassifierTest {

    private final UrgencyClassifier classifier = new UrgencyClassifier(ValidationProperties.defaults());

    @Test
    void largeAmountsAreHighOnAnyAccount() {
        assertEquals(Urgency.HIGH, classifier.classify(new BigDecimal("10000"), AccountType.DEBIT));
        assertEquals(Urgency.HIGH, classifier.classify(new BigDecimal("25000"), AccountType.UNKNOWN));
    }

    @Test
    void creditAccountsGetMediumEarlier() {
        assertEquals(Urgency.MEDIUM, classifier.classify(new BigDecimal("5000"), AccountType.CREDIT));
        assertEquals(Urgency.NORMAL, classifier.classify(new BigDecimal("5000"), AccountType.DEBIT));
    }

    @Test
    void smallOrMissingAmountsAreNormal() {
        assertEquals(Urgency.NORMAL, classifier.classify(new BigDecimal("4999.99"), AccountType.CREDIT));
        assertEquals(Urgency.NORMAL, classifier.classify(null, AccountType.CREDIT));
    }

    @Test
    void thresholdsAreConfigurable() {
        UrgencyClassifier strict = new UrgencyClassifier(
                new ValidationProperties(null, new BigDecimal("100"), new BigDecimal("50")));

        assertEquals(Urgency.HIGH, strict.classify(new BigDecimal("100"), AccountType.DEBIT));
        assertEquals(Urgency.MEDIUM, strict.classify(new BigDecimal("60"), AccountType.CREDIT));
    }
}

package com.goldminer.backend.services.sms.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.goldminer.backend.config.ValidationProperties;
import com.goldminer.backend.dto.sms.ExtractedFields;
import com.goldminer.backend.enums.Confidence;

class FieldValidatorTest {

    private final FieldValidator validator = new FieldValidator(ValidationProperties.defaults());

    @Test
    void cleanFieldsKeepTheirConfidence() {
        FieldValidation result = validator.validate(fields("250.50", "EGP", "15/11/2024", "Amazon"), new BigDecimal("250.50"), true);

        assertTrue(result.warnings().isEmpty());
        assertEquals(Confidence.HIGH, result.fields().confidence());
        assertEquals("EGP", result.fields().currency());
    }

    @Test
    void currencyIsUpperCasedBeforeTheWhitelist() {
        FieldValidation result = validator.validate(fields("10", " egp ", null, "Amazon"), BigDecimal.TEN, false);

        assertEquals("EGP", result.fields().currency());
        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void arabicCurrencyNamesAreAccepted() {
        FieldValidation result = validator.validate(fields("10", "جنيه", null, "Amazon"), BigDecimal.TEN, false);

        assertTrue(result.warnings().isEmpty());
    }

    @Test
    void unknownCurrencyLowersHighToMedium() {
        FieldValidation result = validator.validate(fields("10", "XYZ", null, "Amazon"), BigDecimal.TEN, false);

        assertEquals(List.of("Invalid currency code: XYZ"), result.warnings());
        assertEquals(Confidence.MEDIUM, result.fields().confidence());
    }

    @Test
    void nonPositiveAmountIsFlagged() {
        FieldValidation result = validator.validate(fields("0.00", "EGP", null, "Amazon"), BigDecimal.ZERO, false);

        assertEquals(List.of("Amount must be positive"), result.warnings());
    }

    @Test
    void unparseableAmountDropsConfidenceToLow() {
        FieldValidation result = validator.validate(fields("12,34,5", "EGP", null, "Amazon"), null, false);

        assertEquals(Confidence.LOW, result.fields().confidence());
        assertTrue(result.warnings().get(0).startsWith("Invalid numeric format for amount"));
    }

    @Test
    void malformedDateIsFlagged() {
        FieldValidation result = validator.validate(fields("10", "EGP", "31/02/2024", "Amazon"), BigDecimal.TEN, false);

        assertEquals(List.of("Malformed date: 31/02/2024"), result.warnings());
    }

    @Test
    void twoWarningsGiveLow() {
        FieldValidation result = validator.validate(fields("10", "XYZ", "someday", "Amazon"), BigDecimal.TEN, false);

        assertEquals(2, result.warnings().size());
        assertEquals(Confidence.LOW, result.fields().confidence());
    }

    @Test
    void overlongTextIsCappedToItsColumn() {
        ExtractedFields longText = new ExtractedFields("10", "EGP", null, "P".repeat(300), "T".repeat(80),
                null, Confidence.HIGH, "hsbc", "purchase");

        FieldValidation result = validator.validate(longText, BigDecimal.TEN, false);

        assertEquals(FieldValidator.MAX_PAYEE_LENGTH, result.fields().payee().length());
        assertEquals(FieldValidator.MAX_TRANSACTION_TYPE_LENGTH, result.fields().transactionType().length());
        assertEquals(List.of("Payee truncated to 255 characters", "Transaction type truncated to 50 characters"),
                result.warnings());
    }

    @Test
    void confidenceIsNeverRaised() {
        assertEquals(Confidence.LOW, FieldValidator.adjust(Confidence.LOW, 0, false));
        assertEquals(Confidence.MEDIUM, FieldValidator.adjust(Confidence.MEDIUM, 1, false));
        assertEquals(Confidence.LOW, FieldValidator.adjust(Confidence.HIGH, 0, true));
    }

    private static ExtractedFields fields(String amount, String currency, String date, String payee) {
        return new ExtractedFields(amount, currency, date, payee, null, null, Confidence.HIGH, "hsbc", "purchase");
    }
}

package com.goldminer.backend.services.sms.pipeline;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Component;

import com.goldminer.backend.config.ValidationProperties;
import com.goldminer.backend.dto.sms.ExtractedFields;
import com.goldminer.backend.enums.Confidence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks the values a template captured and never throws.
 *
 * <p>Only values that are present are checked: an unparseable or non-positive amount, a
 * currency outside the configured list, a date no known format accepts, and text longer
 * than the stored columns (capped). Missing fields are already reflected in the template
 * confidence. One warning lowers {@code HIGH} to {@code MEDIUM}; two or more warnings, or
 * an unparseable amount, give {@code LOW}. Confidence is never raised.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FieldValidator {

    public static final int MAX_PAYEE_LENGTH = 255;
    public static final int MAX_CURRENCY_LENGTH = 10;
    public static final int MAX_TRANSACTION_TYPE_LENGTH = 50;

    private static final int QUOTED_VALUE_LENGTH = 40;

    private final ValidationProperties properties;

    /**
     * @param parsedAmount the amount text as a number, null when it could not be parsed
     * @param dateParsed   whether the captured date text was understood
     */
    public FieldValidation validate(ExtractedFields fields, BigDecimal parsedAmount, boolean dateParsed) {
        List<String> warnings = new ArrayList<>();
        boolean critical = false;

        if (fields.amount() != null) {
            if (parsedAmount == null) {
                warnings.add("Invalid numeric format for amount: " + quote(fields.amount()));
                critical = true;
            } else if (parsedAmount.signum() <= 0) {
                warnings.add("Amount must be positive");
            }
        }

        String currency = fields.currency() == null ? null : fields.currency().strip().toUpperCase(Locale.ROOT);
        if (currency != null && !properties.currencies().contains(currency)) {
            warnings.add("Invalid currency code: " + quote(currency));
        }

        if (fields.dateRaw() != null && !dateParsed) {
            warnings.add("Malformed date: " + quote(fields.dateRaw()));
        }

        String payee = cap(fields.payee(), MAX_PAYEE_LENGTH);
        if (payee != null && payee.length() < fields.payee().length()) {
            warnings.add("Payee truncated to " + MAX_PAYEE_LENGTH + " characters");
        }
        String transactionType = cap(fields.transactionType(), MAX_TRANSACTION_TYPE_LENGTH);
        if (transactionType != null && transactionType.length() < fields.transactionType().length()) {
            warnings.add("Transaction type truncated to " + MAX_TRANSACTION_TYPE_LENGTH + " characters");
        }

        Confidence confidence = adjust(fields.confidence(), warnings.size(), critical);
        if (!warnings.isEmpty()) {
            log.warn("[FieldValidator] template {}: {} (confidence {} -> {})",
                    fields.matchedTemplate(), warnings, fields.confidence(), confidence);
        }

        ExtractedFields validated = new ExtractedFields(
                fields.amount(),
                cap(currency, MAX_CURRENCY_LENGTH),
                fields.dateRaw(),
                payee,
                transactionType,
                fields.cardSuffix(),
                confidence,
                fields.matchedBank(),
                fields.matchedTemplate());
        return new FieldValidation(validated, warnings);
    }

    static Confidence adjust(Confidence current, int warningCount, boolean critical) {
        if (critical || warningCount >= 2) {
            return Confidence.LOW;
        }
        if (warningCount == 1 && current == Confidence.HIGH) {
            return Confidence.MEDIUM;
        }
        return current;
    }

    private static String cap(String value, int limit) {
        if (value == null || value.length() <= limit) {
            return value;
        }
        return value.substring(0, limit).strip();
    }

    private static String quote(String value) {
        return value.length() <= QUOTED_VALUE_LENGTH ? value : value.substring(0, QUOTED_VALUE_LENGTH) + "...";
    }
}

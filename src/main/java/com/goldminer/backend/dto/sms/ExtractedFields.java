package com.goldminer.backend.dto.sms;

import java.util.regex.Pattern;

import com.goldminer.backend.enums.Confidence;

/**
 * Fields pulled out of a message by an extraction template. Values are raw matched text.
 */
public record ExtractedFields(
        String amount,
        String currency,
        String dateRaw,
        String payee,
        String transactionType,
        String cardSuffix,
        Confidence confidence,
        String matchedBank,
        String matchedTemplate
) {

    private static final Pattern CARD_SUFFIX = Pattern.compile("[0-9]{4}");

    public ExtractedFields {
        if (cardSuffix != null && !CARD_SUFFIX.matcher(cardSuffix).matches()) {
            throw new IllegalArgumentException("cardSuffix must be exactly 4 ASCII digits: " + cardSuffix);
        }
        if (confidence == null) throw new IllegalArgumentException("confidence is required");
    }

    public static ExtractedFields empty(Confidence confidence, String matchedBank) {
        return new ExtractedFields(null, null, null, null, null, null, confidence, matchedBank, null);
    }

    public ExtractedFields withCardSuffix(String suffix) {
        return new ExtractedFields(amount, currency, dateRaw, payee, transactionType, suffix,
                confidence, matchedBank, matchedTemplate);
    }
}

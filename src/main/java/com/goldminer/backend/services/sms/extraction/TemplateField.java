package com.goldminer.backend.services.sms.extraction;

import java.util.Locale;

/**
 * The closed set of fields a template may extract, keyed by their configuration name.
 */
public enum TemplateField {
    AMOUNT("amount"),
    CURRENCY("currency"),
    DATE("date"),
    PAYEE("payee"),
    TRANSACTION_TYPE("transaction_type"),
    CARD_SUFFIX("card_suffix");

    private final String key;

    TemplateField(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static TemplateField fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (TemplateField field : values()) {
                if (field.key.equals(normalized)) {
                    return field;
                }
            }
        }
        throw new IllegalArgumentException("Unsupported template field: " + key);
    }
}

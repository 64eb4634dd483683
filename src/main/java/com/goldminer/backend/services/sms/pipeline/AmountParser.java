package com.goldminer.backend.services.sms.pipeline;

import java.math.BigDecimal;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.goldminer.backend.services.sms.normalization.TextNormalizer;

/**
 * Turns the raw amount text captured by a template into a number.
 *
 * <p>Handles Arabic decimal (٫) and thousands (٬) separators, comma or dot grouping, and a
 * comma used as decimal separator ("250,50"). Returns null for anything else.
 */
@Component
public class AmountParser {

    private static final Pattern GROUPED_BY_COMMA = Pattern.compile("\\d{1,3}(,\\d{3})+(\\.\\d+)?");
    private static final Pattern GROUPED_BY_DOT = Pattern.compile("\\d{1,3}(\\.\\d{3}){2,}(,\\d+)?");
    private static final Pattern DECIMAL_COMMA = Pattern.compile("\\d+,\\d{1,2}");
    private static final Pattern PLAIN = Pattern.compile("\\d+(\\.\\d+)?");

    public BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = TextNormalizer.convertDigits(raw.strip())
                .replace('٫', '.')
                .replace('٬', ',')
                .replaceAll("[\\s\\u00A0]", "");

        String canonical;
        if (GROUPED_BY_COMMA.matcher(text).matches()) {
            canonical = text.replace(",", "");
        } else if (GROUPED_BY_DOT.matcher(text).matches()) {
            canonical = text.replace(".", "").replace(',', '.');
        } else if (DECIMAL_COMMA.matcher(text).matches()) {
            canonical = text.replace(',', '.');
        } else {
            canonical = text;
        }

        if (!PLAIN.matcher(canonical).matches()) {
            return null;
        }
        try {
            return new BigDecimal(canonical);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

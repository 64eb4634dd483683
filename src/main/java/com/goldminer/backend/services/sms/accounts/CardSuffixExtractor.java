package com.goldminer.backend.services.sms.accounts;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Finds the last four card digits in a normalized message.
 *
 * <p>Patterns are tried in order, English first. Each ends with a negative lookahead so a
 * run of five or more digits never yields a suffix.
 */
@Component
public class CardSuffixExtractor {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    private static final List<Pattern> PATTERNS = List.of(
            // English
            Pattern.compile("(?:card ending|ending|ends with)\\s+(?:in\\s+)?([0-9]{4})(?![0-9])", FLAGS),
            Pattern.compile("card\\s+(?:number\\s+)?(?:no\\.?\\s+)?(?:\\*+\\s*)?([0-9]{4})(?![0-9])", FLAGS),
            Pattern.compile("\\*+([0-9]{4})(?![0-9])", FLAGS),
            // Arabic
            Pattern.compile("(?:بطاقة رقم|رقم|ينتهي)\\s+(?:ب\\s*)?([0-9]{4})(?![0-9])", FLAGS),
            Pattern.compile("بطاقة\\s+(?:\\*+\\s*)?([0-9]{4})(?![0-9])", FLAGS)
    );

    /**
     * @return the 4-digit suffix, or null when the message names no card
     */
    public String extract(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }
}

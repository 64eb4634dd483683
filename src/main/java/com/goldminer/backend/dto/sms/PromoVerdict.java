package com.goldminer.backend.dto.sms;

import java.util.List;

import com.goldminer.backend.enums.Confidence;

public record PromoVerdict(boolean skip, String reason, List<String> matchedKeywords, Confidence confidence) {

    private static final int REASON_KEYWORD_LIMIT = 3;

    public PromoVerdict {
        if (reason == null || reason.isBlank()) throw new IllegalArgumentException("reason is required");
        if (confidence == null) throw new IllegalArgumentException("confidence is required");
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    public static PromoVerdict invalidInput() {
        return new PromoVerdict(false, "Invalid input", List.of(), Confidence.LOW);
    }

    public static PromoVerdict notPromotional() {
        return new PromoVerdict(false, "No promotional keywords detected", List.of(), Confidence.HIGH);
    }

    /**
     * Verdict for a message that matched at least one keyword; confidence follows the
     * number of distinct keywords (1 low, 2 medium, 3 or more high).
     */
    public static PromoVerdict promotional(List<String> distinctKeywords) {
        if (distinctKeywords == null || distinctKeywords.isEmpty()) {
            throw new IllegalArgumentException("at least one keyword is required");
        }
        int count = distinctKeywords.size();
        Confidence confidence = count >= 3 ? Confidence.HIGH : count == 2 ? Confidence.MEDIUM : Confidence.LOW;

        String shown = String.join(", ", distinctKeywords.subList(0, Math.min(count, REASON_KEYWORD_LIMIT)));
        if (count > REASON_KEYWORD_LIMIT) {
            shown += " (and " + (count - REASON_KEYWORD_LIMIT) + " more)";
        }
        return new PromoVerdict(true, "Promotional message detected (keywords: " + shown + ")", distinctKeywords, confidence);
    }
}

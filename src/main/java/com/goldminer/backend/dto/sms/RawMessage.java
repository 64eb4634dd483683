package com.goldminer.backend.dto.sms;

import java.time.LocalDateTime;

/**
 * An SMS as received, before any processing. A null text is kept as an empty string.
 */
public record RawMessage(String text, LocalDateTime sourceTimestamp, LocalDateTime fileCreatedAt) {

    public RawMessage {
        if (text == null) {
            text = "";
        }
    }

    public static RawMessage of(String text) {
        return new RawMessage(text, null, null);
    }
}

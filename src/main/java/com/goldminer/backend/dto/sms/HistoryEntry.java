package com.goldminer.backend.dto.sms;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A prior transaction as seen by the anomaly rules. The timestamp is kept as text because
 * history may come from sources with inconsistent formats. {@code contentHash} is null when
 * the source does not know it.
 */
public record HistoryEntry(BigDecimal amount, String payee, String timestamp, String contentHash) {

    public HistoryEntry(BigDecimal amount, String payee, String timestamp) {
        this(amount, payee, timestamp, null);
    }

    public static HistoryEntry of(BigDecimal amount, String payee, LocalDateTime occurredAt) {
        return of(amount, payee, occurredAt, null);
    }

    public static HistoryEntry of(BigDecimal amount, String payee, LocalDateTime occurredAt, String contentHash) {
        return new HistoryEntry(amount, payee, occurredAt == null ? null : occurredAt.toString(), contentHash);
    }
}

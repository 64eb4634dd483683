package com.goldminer.backend.services.sms.anomaly;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import com.goldminer.backend.dto.sms.HistoryEntry;

/**
 * The transaction under evaluation. Any field may be null; rules that need a missing field do not fire.
 */
public record AnomalyCandidate(BigDecimal amount, String payee, LocalDateTime occurredAt) {

    public HistoryEntry toHistoryEntry() {
        return HistoryEntry.of(amount, payee, occurredAt);
    }
}

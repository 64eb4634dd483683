package com.goldminer.backend.services.sms.anomaly;

import java.time.LocalDateTime;
import java.util.List;

import com.goldminer.backend.dto.sms.HistoryEntry;

/**
 * Supplies the transactions that happened strictly before a point in time, oldest first.
 */
@FunctionalInterface
public interface HistoryProvider {

    /**
     * @param at evaluation time; null means "everything known"
     */
    List<HistoryEntry> historyBefore(LocalDateTime at);

    static HistoryProvider empty() {
        return at -> List.of();
    }
}

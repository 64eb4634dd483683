package com.goldminer.backend.dto.sms;

/**
 * Per-outcome counters for one processed batch.
 */
public record BatchSummary(int processed, int promoFiltered, int unknownBank, int lowConfidence, int failed) {
}

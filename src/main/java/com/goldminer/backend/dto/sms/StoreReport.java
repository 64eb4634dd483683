package com.goldminer.backend.dto.sms;

import java.util.List;

import com.goldminer.backend.enums.StoreOutcome;

/**
 * Outcome per record, in the order the records were handed to the store.
 */
public record StoreReport(List<StoreOutcome> outcomes, String error) {

    public StoreReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public long inserted() {
        return count(StoreOutcome.INSERTED);
    }

    public long updated() {
        return count(StoreOutcome.UPDATED);
    }

    public long skipped() {
        return count(StoreOutcome.SKIPPED);
    }

    public long failed() {
        return count(StoreOutcome.FAILED);
    }

    private long count(StoreOutcome outcome) {
        return outcomes.stream().filter(o -> o == outcome).count();
    }
}

package com.goldminer.backend.dto.sms;

import java.util.List;

public record IngestionReport(BatchSummary summary, StoreReport store, List<TransactionRecord> records) {

    public IngestionReport {
        records = records == null ? List.of() : List.copyOf(records);
    }
}

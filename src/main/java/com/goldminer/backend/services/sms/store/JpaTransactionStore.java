package com.goldminer.backend.services.sms.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.stereotype.Service;

import com.goldminer.backend.dto.sms.StoreReport;
import com.goldminer.backend.dto.sms.TransactionRecord;
import com.goldminer.backend.enums.StoreMode;
import com.goldminer.backend.enums.StoreOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaTransactionStore implements TransactionStore {

    private final TransactionBatchWriter writer;

    @Override
    public StoreReport store(List<TransactionRecord> records, StoreMode mode) {
        if (records == null || records.isEmpty()) {
            return new StoreReport(List.of(), null);
        }
        StoreMode effectiveMode = mode == null ? StoreMode.SKIP : mode;

        try {
            List<StoreOutcome> outcomes = writer.write(records, effectiveMode);
            log.info("[TransactionStore] mode={} stored {} records", effectiveMode, outcomes.size());
            return new StoreReport(outcomes, null);
        } catch (BatchWriteException e) {
            log.error("[TransactionStore] batch rolled back: {}", e.getMessage(), e);
            return new StoreReport(rolledBack(records.size(), e.getCompleted()), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[TransactionStore] batch commit failed", e);
            return new StoreReport(rolledBack(records.size(), List.of()), e.getMessage());
        }
    }

    private static List<StoreOutcome> rolledBack(int size, List<StoreOutcome> completed) {
        List<StoreOutcome> outcomes = new ArrayList<>(Collections.nCopies(size, StoreOutcome.FAILED));
        for (int i = 0; i < completed.size() && i < size; i++) {
            if (completed.get(i) == StoreOutcome.SKIPPED) {
                outcomes.set(i, StoreOutcome.SKIPPED);
            }
        }
        return outcomes;
    }
}

package com.goldminer.backend.services.sms.pipeline;

import java.util.List;

import com.goldminer.backend.dto.sms.BatchSummary;
import com.goldminer.backend.dto.sms.TransactionRecord;

/**
 * Records of the messages that processed successfully, in input order, with the batch counters.
 */
public record PipelineResult(List<TransactionRecord> records, BatchSummary summary) {

    public PipelineResult {
        records = List.copyOf(records);
    }
}

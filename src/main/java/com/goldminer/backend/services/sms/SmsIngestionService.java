package com.goldminer.backend.services.sms;

import java.time.LocalDateTime;
import java.util.List;

import org.springframework.stereotype.Service;

import com.goldminer.backend.dto.sms.IngestionReport;
import com.goldminer.backend.dto.sms.RawMessage;
import com.goldminer.backend.dto.sms.StoreReport;
import com.goldminer.backend.enums.StoreMode;
import com.goldminer.backend.services.sms.anomaly.HistoryProvider;
import com.goldminer.backend.services.sms.pipeline.PipelineResult;
import com.goldminer.backend.services.sms.pipeline.SmsProcessingPipeline;
import com.goldminer.backend.services.sms.store.TransactionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a batch of messages through the pipeline and persists the resulting records.
 * Anomaly history comes from the stored transactions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SmsIngestionService {

    private final SmsProcessingPipeline pipeline;
    private final TransactionStore store;
    private final HistoryProvider historyProvider;

    public IngestionReport ingest(List<RawMessage> messages, StoreMode mode) {
        return ingest(messages, mode, LocalDateTime.now());
    }

    public IngestionReport ingest(List<RawMessage> messages, StoreMode mode, LocalDateTime ingestedAt) {
        List<RawMessage> batch = messages == null ? List.of() : messages;
        log.info("[SmsIngestion] processing {} messages, mode={}", batch.size(), mode);

        PipelineResult result = pipeline.processBatch(batch, historyProvider, ingestedAt);
        StoreReport storeReport = store.store(result.records(), mode);

        log.info("[SmsIngestion] processed={}, promo={}, unknownBank={}, lowConfidence={}, failed={}",
                result.summary().processed(), result.summary().promoFiltered(), result.summary().unknownBank(),
                result.summary().lowConfidence(), result.summary().failed());
        log.info("[SmsIngestion] inserted={}, updated={}, skipped={}, storeFailed={}",
                storeReport.inserted(), storeReport.updated(), storeReport.skipped(), storeReport.failed());

        return new IngestionReport(result.summary(), storeReport, result.records());
    }
}

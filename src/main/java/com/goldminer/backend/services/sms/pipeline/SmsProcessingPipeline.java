package com.goldminer.backend.services.sms.pipeline;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.goldminer.backend.classification.MerchantAliasResolver;
import com.goldminer.backend.classification.TransactionCategorizer;
import com.goldminer.backend.dto.sms.AccountMetadata;
import com.goldminer.backend.dto.sms.BankMatch;
import com.goldminer.backend.dto.sms.BatchSummary;
import com.goldminer.backend.dto.sms.ExtractedFields;
import com.goldminer.backend.dto.sms.HistoryEntry;
import com.goldminer.backend.dto.sms.PromoVerdict;
import com.goldminer.backend.dto.sms.RawMessage;
import com.goldminer.backend.dto.sms.TransactionRecord;
import com.goldminer.backend.enums.AnomalyFlag;
import com.goldminer.backend.enums.Confidence;
import com.goldminer.backend.enums.TransactionState;
import com.goldminer.backend.enums.Urgency;
import com.goldminer.backend.services.sms.accounts.AccountResolver;
import com.goldminer.backend.services.sms.anomaly.AnomalyCandidate;
import com.goldminer.backend.services.sms.anomaly.AnomalyDetector;
import com.goldminer.backend.services.sms.anomaly.HistoryProvider;
import com.goldminer.backend.services.sms.banks.BankIdentifier;
import com.goldminer.backend.services.sms.extraction.BankScope;
import com.goldminer.backend.services.sms.extraction.FieldExtractor;
import com.goldminer.backend.services.sms.identity.ContentHasher;
import com.goldminer.backend.services.sms.normalization.TextNormalizer;
import com.goldminer.backend.services.sms.normalization.TextNormalizer.NormalizedText;
import com.goldminer.backend.services.sms.promo.PromoFilter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one message through normalization, promo filtering, bank identification, field
 * extraction, field validation, account resolution, categorization, anomaly detection,
 * urgency and hashing.
 *
 * <p>A promotional message stops after the promo filter: it keeps state {@code PROMO}, an
 * empty low-confidence extraction and the unknown account, and still gets a content hash.
 *
 * <p>Batches must be supplied in chronological order. Each message's anomaly history is the
 * provider's history before its timestamp plus the earlier monetary records of the batch that
 * the provider does not already return (matched by content hash).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SmsProcessingPipeline {

    private final TextNormalizer normalizer;
    private final PromoFilter promoFilter;
    private final BankIdentifier bankIdentifier;
    private final FieldExtractor fieldExtractor;
    private final AccountResolver accountResolver;
    private final MerchantAliasResolver merchantAliasResolver;
    private final TransactionCategorizer categorizer;
    private final AnomalyDetector anomalyDetector;
    private final ContentHasher contentHasher;
    private final TransactionStateClassifier stateClassifier;
    private final DateResolver dateResolver;
    private final AmountParser amountParser;
    private final FieldValidator fieldValidator;
    private final UrgencyClassifier urgencyClassifier;

    public TransactionRecord process(RawMessage message, HistoryProvider history, LocalDateTime ingestedAt) {
        NormalizedText text = normalizer.normalizeWithReport(message.text());
        String normalized = text.text();
        PromoVerdict verdict = promoFilter.classify(normalized);
        TransactionRecord record = TransactionRecord.start(message, normalized, text.repaired()).withPromoVerdict(verdict);

        if (verdict.skip()) {
            return finishPromotional(record, message, ingestedAt);
        }

        BankMatch bank = bankIdentifier.identify(normalized);
        BankScope scope = !bank.unmatched() && fieldExtractor.supports(bank.bankId())
                ? BankScope.specified(bank.bankId())
                : BankScope.auto();
        ExtractedFields extracted = fieldExtractor.extract(normalized, scope);
        BigDecimal amount = amountParser.parse(extracted.amount());
        LocalDate extractedDate = dateResolver.parseExtracted(extracted.dateRaw(), message.fileCreatedAt(), ingestedAt);
        FieldValidation validation = fieldValidator.validate(extracted, amount, extractedDate != null);
        ExtractedFields fields = validation.fields();

        AccountMetadata account = accountResolver.lookup(fields.cardSuffix());
        String payee = merchantAliasResolver.resolve(fields.payee());
        TransactionState state = stateClassifier.classify(verdict, normalized, amount != null && amount.signum() > 0);

        LocalDate resolvedDate = dateResolver.resolve(fields.dateRaw(), message, ingestedAt);
        LocalDateTime occurredAt = occurredAt(message, resolvedDate);
        Urgency urgency = state == TransactionState.MONETARY
                ? urgencyClassifier.classify(amount, account.accountType())
                : Urgency.NORMAL;

        Set<AnomalyFlag> anomalies = state == TransactionState.MONETARY
                ? anomalyDetector.detect(new AnomalyCandidate(amount, payee, occurredAt), history.historyBefore(occurredAt))
                : Set.of();

        if (fields.confidence() == Confidence.LOW) {
            log.debug("Low confidence extraction for bank {}; record kept for audit", bank.bankId());
        }

        return record.withBankMatch(bank)
                .withExtractedFields(fields)
                .withAccount(account)
                .withAmountAndPayee(amount, payee)
                .withState(state)
                .withCategory(categorizer.categorize(payee, normalized))
                .withTiming(resolvedDate, occurredAt)
                .withAnomalies(anomalies)
                .withValidation(validation.warnings(), urgency)
                .withContentHash(contentHasher.hash(resolvedDate, amount, payee, account.accountId(), state));
    }

    public PipelineResult processBatch(List<RawMessage> messages, HistoryProvider history, LocalDateTime ingestedAt) {
        List<TransactionRecord> records = new ArrayList<>(messages.size());
        List<HistoryEntry> batchHistory = new ArrayList<>();
        int promo = 0;
        int unknownBank = 0;
        int lowConfidence = 0;
        int failed = 0;

        for (int i = 0; i < messages.size(); i++) {
            RawMessage message = messages.get(i);
            List<HistoryEntry> earlier = List.copyOf(batchHistory);
            HistoryProvider combined = at -> withUnstored(history.historyBefore(at), earlier);

            TransactionRecord record;
            try {
                record = process(message == null ? RawMessage.of(null) : message, combined, ingestedAt);
            } catch (RuntimeException e) {
                failed++;
                log.warn("Message #{} could not be processed: {}", i, e.getMessage(), e);
                continue;
            }

            records.add(record);
            if (record.getState() == TransactionState.PROMO) {
                promo++;
                continue;
            }
            if (record.getBankMatch() != null && record.getBankMatch().unmatched()) {
                unknownBank++;
            }
            if (record.confidence() == Confidence.LOW) {
                lowConfidence++;
            }
            if (record.getState() == TransactionState.MONETARY) {
                batchHistory.add(HistoryEntry.of(record.getAmount(), record.getPayee(), record.getOccurredAt(), record.getContentHash()));
            }
        }

        BatchSummary summary = new BatchSummary(records.size(), promo, unknownBank, lowConfidence, failed);
        log.info("Processed batch: processed={} promo={} unknownBank={} lowConfidence={} failed={}",
                summary.processed(), summary.promoFiltered(), summary.unknownBank(), summary.lowConfidence(), summary.failed());
        return new PipelineResult(records, summary);
    }

    private TransactionRecord finishPromotional(TransactionRecord record, RawMessage message, LocalDateTime ingestedAt) {
        AccountMetadata account = AccountMetadata.unknown(null);
        LocalDate resolvedDate = dateResolver.resolve(null, message, ingestedAt);
        return record.withExtractedFields(ExtractedFields.empty(Confidence.LOW, FieldExtractor.UNKNOWN_BANK))
                .withAccount(account)
                .withState(TransactionState.PROMO)
                .withTiming(resolvedDate, occurredAt(message, resolvedDate))
                .withAnomalies(Set.of())
                .withValidation(List.of(), Urgency.NORMAL)
                .withContentHash(contentHasher.hash(resolvedDate, null, null, account.accountId(), TransactionState.PROMO));
    }

    /** Earlier batch entries already stored (re-ingestion) are returned by the provider once. */
    private static List<HistoryEntry> withUnstored(List<HistoryEntry> stored, List<HistoryEntry> batch) {
        List<HistoryEntry> entries = new ArrayList<>(stored);
        Set<String> storedHashes = new HashSet<>();
        for (HistoryEntry entry : stored) {
            if (entry.contentHash() != null) {
                storedHashes.add(entry.contentHash());
            }
        }
        for (HistoryEntry entry : batch) {
            if (entry.contentHash() == null || !storedHashes.contains(entry.contentHash())) {
                entries.add(entry);
            }
        }
        return entries;
    }

    private static LocalDateTime occurredAt(RawMessage message, LocalDate resolvedDate) {
        if (message.sourceTimestamp() != null) {
            return message.sourceTimestamp();
        }
        if (resolvedDate != null) {
            return resolvedDate.atStartOfDay();
        }
        return message.fileCreatedAt();
    }
}

package com.goldminer.backend.services.sms.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.goldminer.backend.dto.sms.TransactionRecord;
import com.goldminer.backend.entities.SmsTransaction;
import com.goldminer.backend.enums.StoreMode;
import com.goldminer.backend.enums.StoreOutcome;
import com.goldminer.backend.mappers.SmsTransactionMapper;
import com.goldminer.backend.repositories.SmsTransactionRepository;

import lombok.RequiredArgsConstructor;

/**
 * Writes one batch inside a single transaction. Each row is flushed immediately so that a
 * constraint violation surfaces on the record that caused it.
 */
@Component
@RequiredArgsConstructor
public class TransactionBatchWriter {

    private final SmsTransactionRepository repository;

    @Transactional(rollbackFor = BatchWriteException.class)
    public List<StoreOutcome> write(List<TransactionRecord> records, StoreMode mode) {
        List<StoreOutcome> outcomes = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            TransactionRecord record = records.get(i);
            try {
                outcomes.add(writeOne(record, mode));
            } catch (RuntimeException e) {
                throw new BatchWriteException("Failed to store record " + i + ": " + e.getMessage(), outcomes, e);
            }
        }
        return outcomes;
    }

    private StoreOutcome writeOne(TransactionRecord record, StoreMode mode) {
        if (record == null) {
            throw new IllegalArgumentException("record is null");
        }
        if (record.getContentHash() == null || record.getState() == null) {
            throw new IllegalArgumentException("record has not been through the pipeline");
        }

        Optional<SmsTransaction> existing = findDuplicate(record);
        if (existing.isEmpty()) {
            repository.saveAndFlush(SmsTransactionMapper.toEntity(record));
            return StoreOutcome.INSERTED;
        }
        if (mode == StoreMode.SKIP) {
            return StoreOutcome.SKIPPED;
        }
        SmsTransaction entity = existing.get();
        SmsTransactionMapper.updateEntity(entity, record);
        repository.saveAndFlush(entity);
        return StoreOutcome.UPDATED;
    }

    private Optional<SmsTransaction> findDuplicate(TransactionRecord record) {
        Optional<SmsTransaction> byHash = repository.findByContentHash(record.getContentHash());
        if (byHash.isPresent()) {
            return byHash;
        }
        SmsTransaction candidate = SmsTransactionMapper.toEntity(record);
        return repository.findFirstByResolvedDateAndPayeeAndAmountAndAccountId(
                candidate.getResolvedDate(), candidate.getPayee(), candidate.getAmount(), candidate.getAccountId());
    }
}

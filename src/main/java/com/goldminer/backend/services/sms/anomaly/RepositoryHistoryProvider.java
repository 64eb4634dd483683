package com.goldminer.backend.services.sms.anomaly;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.goldminer.backend.config.AnomalyProperties;
import com.goldminer.backend.dto.sms.HistoryEntry;
import com.goldminer.backend.entities.SmsTransaction;
import com.goldminer.backend.enums.TransactionState;
import com.goldminer.backend.mappers.SmsTransactionMapper;
import com.goldminer.backend.repositories.SmsTransactionRepository;

import lombok.RequiredArgsConstructor;

/**
 * History from stored monetary transactions, capped at the most recent
 * {@code goldminer.anomaly.history-limit} rows.
 */
@Component
@RequiredArgsConstructor
public class RepositoryHistoryProvider implements HistoryProvider {

    private final SmsTransactionRepository repository;
    private final AnomalyProperties properties;

    @Override
    @Transactional(readOnly = true)
    public List<HistoryEntry> historyBefore(LocalDateTime at) {
        PageRequest page = PageRequest.of(0, properties.historyLimit());
        List<SmsTransaction> newestFirst = at == null
                ? repository.findRecent(TransactionState.MONETARY, page)
                : repository.findRecentBefore(TransactionState.MONETARY, at, page);

        List<HistoryEntry> history = new ArrayList<>(newestFirst.size());
        for (SmsTransaction transaction : newestFirst) {
            history.add(SmsTransactionMapper.toHistoryEntry(transaction));
        }
        Collections.reverse(history);
        return history;
    }
}

package com.goldminer.backend.services.sms.anomaly;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import com.goldminer.backend.config.AnomalyProperties;
import com.goldminer.backend.dto.sms.HistoryEntry;
import com.goldminer.backend.entities.SmsTransaction;
import com.goldminer.backend.enums.Confidence;
import com.goldminer.backend.enums.TransactionState;
import com.goldminer.backend.repositories.SmsTransactionRepository;

@DataJpaTest(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@Import({RepositoryHistoryProvider.class, RepositoryHistoryProviderTest.Limits.class})
class RepositoryHistoryProviderTest {

    @TestConfiguration
    static class Limits {
        @Bean
        @Primary
        AnomalyProperties anomalyProperties() {
            return new AnomalyProperties(null, null, null, null, null, 3, null);
        }
    }

    @Autowired
    private RepositoryHistoryProvider provider;

    @Autowired
    private SmsTransactionRepository repository;

    @BeforeEach
    void seed() {
        save("h1", "Carrefour", "100.00", LocalDateTime.of(2024, 11, 10, 9, 0), TransactionState.MONETARY);
        save("h2", "Amazon", "250.00", LocalDateTime.of(2024, 11, 11, 9, 0), TransactionState.MONETARY);
        save("h3", "Shell", "300.00", LocalDateTime.of(2024, 11, 12, 9, 0), TransactionState.MONETARY);
        save("h4", "Uber", "75.00", LocalDateTime.of(2024, 11, 13, 9, 0), TransactionState.MONETARY);
        save("h5", null, null, LocalDateTime.of(2024, 11, 12, 12, 0), TransactionState.PROMO);
    }

    @Test
    void returnsOnlyEarlierMonetaryRowsOldestFirst() {
        List<HistoryEntry> history = provider.historyBefore(LocalDateTime.of(2024, 11, 12, 9, 0));

        assertEquals(2, history.size());
        assertEquals("Carrefour", history.get(0).payee());
        assertEquals("Amazon", history.get(1).payee());
        assertEquals(0, new BigDecimal("250.00").compareTo(history.get(1).amount()));
        assertEquals("2024-11-11T09:00", history.get(1).timestamp());
    }

    @Test
    void capsAtTheMostRecentRows() {
        List<HistoryEntry> history = provider.historyBefore(null);

        assertEquals(List.of("Amazon", "Shell", "Uber"), history.stream().map(HistoryEntry::payee).toList());
    }

    @Test
    void nothingBeforeTheFirstTransaction() {
        assertTrue(provider.historyBefore(LocalDateTime.of(2024, 1, 1, 0, 0)).isEmpty());
    }

    private void save(String hash, String payee, String amount, LocalDateTime at, TransactionState state) {
        SmsTransaction transaction = new SmsTransaction();
        transaction.setContentHash(hash);
        transaction.setPayee(payee);
        transaction.setAmount(amount == null ? null : new BigDecimal(amount));
        transaction.setOccurredAt(at);
        transaction.setResolvedDate(at.toLocalDate());
        transaction.setState(state);
        transaction.setConfidence(Confidence.HIGH);
        transaction.setAccountId("unknown");
        repository.save(transaction);
    }
}

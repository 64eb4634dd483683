package com.goldminer.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.goldminer.backend.entities.SmsTransaction;
import com.goldminer.backend.enums.TransactionState;

public interface SmsTransactionRepository extends JpaRepository<SmsTransaction, UUID> {

    Optional<SmsTransaction> findByContentHash(String contentHash);

    /**
     * Null arguments match null columns.
     */
    Optional<SmsTransaction> findFirstByResolvedDateAndPayeeAndAmountAndAccountId(
            LocalDate resolvedDate, String payee, BigDecimal amount, String accountId);

    @Query("select t from SmsTransaction t "
            + "where t.state = :state and t.occurredAt < :before "
            + "order by t.occurredAt desc")
    List<SmsTransaction> findRecentBefore(
            @Param("state") TransactionState state,
            @Param("before") LocalDateTime before,
            Pageable pageable);

    @Query("select t from SmsTransaction t "
            + "where t.state = :state and t.occurredAt is not null "
            + "order by t.occurredAt desc")
    List<SmsTransaction> findRecent(@Param("state") TransactionState state, Pageable pageable);
}

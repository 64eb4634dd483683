package com.goldminer.backend.entities;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import com.goldminer.backend.enums.AccountType;
import com.goldminer.backend.enums.BankMatchKind;
import com.goldminer.backend.enums.Confidence;
import com.goldminer.backend.enums.MatchPriority;
import com.goldminer.backend.enums.TransactionState;
import com.goldminer.backend.enums.Urgency;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "sms_transactions",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_sms_transactions_content_hash", columnNames = "content_hash"),
                @UniqueConstraint(name = "uk_sms_transactions_identity",
                        columnNames = {"resolved_date", "payee", "amount", "account_id"})
        },
        indexes = {
                @Index(name = "idx_sms_transactions_occurred_at", columnList = "occurred_at"),
                @Index(name = "idx_sms_transactions_state", columnList = "state")
        })
@Getter
@Setter
@NoArgsConstructor
public class SmsTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "resolved_date")
    private LocalDate resolvedDate;

    @Column(name = "occurred_at")
    private LocalDateTime occurredAt;

    @Column(precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(length = 10)
    private String currency;

    @Column(length = 255)
    private String payee;

    @Column(name = "raw_payee", length = 255)
    private String rawPayee;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private TransactionState state;

    @Column(name = "transaction_type", length = 50)
    private String transactionType;

    @Column(name = "bank_id", length = 100)
    private String bankId;

    @Enumerated(EnumType.STRING)
    @Column(name = "bank_match_kind", length = 20)
    private BankMatchKind bankMatchKind;

    @Column(name = "bank_score")
    private Integer bankScore;

    @Column(name = "template_name", length = 100)
    private String templateName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Confidence confidence;

    @Column(name = "card_suffix", length = 4)
    private String cardSuffix;

    @Column(name = "account_id", nullable = false, length = 100)
    private String accountId;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", length = 20)
    private AccountType accountType;

    @Column(name = "account_label", length = 255)
    private String accountLabel;

    @Column(name = "interest_rate", precision = 9, scale = 4)
    private BigDecimal interestRate;

    @Column(name = "credit_limit", precision = 19, scale = 2)
    private BigDecimal creditLimit;

    @Column(length = 100)
    private String category;

    @Column(length = 100)
    private String subcategory;

    /** Comma-separated, sorted. */
    @Column(length = 500)
    private String tags;

    @Enumerated(EnumType.STRING)
    @Column(name = "match_priority", length = 20)
    private MatchPriority matchPriority;

    /** Comma-separated anomaly codes, sorted. */
    @Column(length = 100)
    private String anomalies;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Urgency urgency = Urgency.NORMAL;

    @Column(name = "text_repaired", nullable = false)
    private boolean textRepaired;

    /** Field validation warnings joined with "; ". */
    @Column(name = "validation_warnings", length = 1000)
    private String validationWarnings;

    @Column(name = "promo_reason", length = 255)
    private String promoReason;

    @Column(name = "raw_text", length = 2000)
    private String rawText;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}

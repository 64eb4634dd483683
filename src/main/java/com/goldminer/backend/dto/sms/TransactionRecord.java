package com.goldminer.backend.dto.sms;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;

import com.goldminer.backend.enums.AnomalyFlag;
import com.goldminer.backend.enums.Confidence;
import com.goldminer.backend.enums.TransactionState;
import com.goldminer.backend.enums.Urgency;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Terminal aggregate of the SMS pipeline. Each stage adds its result through a
 * {@code withX} method that returns a new instance; a field that is already set can
 * never be replaced.
 */
@Getter
@ToString
@Builder(toBuilder = true, access = AccessLevel.PRIVATE)
public final class TransactionRecord {

    private final RawMessage source;
    private final String normalizedText;
    private final boolean textRepaired;
    private final PromoVerdict promoVerdict;
    private final BankMatch bankMatch;
    private final ExtractedFields extractedFields;
    private final BigDecimal amount;
    private final String payee;
    private final AccountMetadata account;
    private final CategoryAssignment category;
    private final Set<AnomalyFlag> anomalies;
    private final List<String> warnings;
    private final Urgency urgency;
    private final LocalDate resolvedDate;
    private final LocalDateTime occurredAt;
    private final TransactionState state;
    private final String contentHash;

    public static TransactionRecord start(RawMessage source, String normalizedText) {
        return start(source, normalizedText, false);
    }

    public static TransactionRecord start(RawMessage source, String normalizedText, boolean textRepaired) {
        if (source == null) throw new IllegalArgumentException("source is required");
        return TransactionRecord.builder()
                .source(source)
                .normalizedText(normalizedText == null ? "" : normalizedText)
                .textRepaired(textRepaired)
                .build();
    }

    public TransactionRecord withPromoVerdict(PromoVerdict verdict) {
        requireUnset(promoVerdict, "promoVerdict");
        return toBuilder().promoVerdict(required(verdict, "promoVerdict")).build();
    }

    public TransactionRecord withBankMatch(BankMatch match) {
        requireUnset(bankMatch, "bankMatch");
        return toBuilder().bankMatch(required(match, "bankMatch")).build();
    }

    public TransactionRecord withExtractedFields(ExtractedFields fields) {
        requireUnset(extractedFields, "extractedFields");
        return toBuilder().extractedFields(required(fields, "extractedFields")).build();
    }

    /**
     * Parsed amount and canonical payee. Either may be null when the message did not carry it,
     * but both can be assigned only once.
     */
    public TransactionRecord withAmountAndPayee(BigDecimal parsedAmount, String canonicalPayee) {
        requireUnset(amount, "amount");
        requireUnset(payee, "payee");
        return toBuilder().amount(parsedAmount).payee(canonicalPayee).build();
    }

    public TransactionRecord withAccount(AccountMetadata metadata) {
        requireUnset(account, "account");
        return toBuilder().account(required(metadata, "account")).build();
    }

    public TransactionRecord withCategory(CategoryAssignment assignment) {
        requireUnset(category, "category");
        return toBuilder().category(required(assignment, "category")).build();
    }

    public TransactionRecord withAnomalies(Set<AnomalyFlag> flags) {
        requireUnset(anomalies, "anomalies");
        return toBuilder().anomalies(Set.copyOf(required(flags, "anomalies"))).build();
    }

    public TransactionRecord withValidation(List<String> validationWarnings, Urgency level) {
        requireUnset(warnings, "warnings");
        requireUnset(urgency, "urgency");
        return toBuilder()
                .warnings(List.copyOf(required(validationWarnings, "warnings")))
                .urgency(required(level, "urgency"))
                .build();
    }

    public TransactionRecord withTiming(LocalDate date, LocalDateTime at) {
        requireUnset(resolvedDate, "resolvedDate");
        requireUnset(occurredAt, "occurredAt");
        return toBuilder().resolvedDate(date).occurredAt(at).build();
    }

    public TransactionRecord withState(TransactionState transactionState) {
        requireUnset(state, "state");
        return toBuilder().state(required(transactionState, "state")).build();
    }

    public TransactionRecord withContentHash(String hash) {
        requireUnset(contentHash, "contentHash");
        return toBuilder().contentHash(required(hash, "contentHash")).build();
    }

    public Confidence confidence() {
        return extractedFields == null ? Confidence.LOW : extractedFields.confidence();
    }

    public String cardSuffix() {
        return extractedFields == null ? null : extractedFields.cardSuffix();
    }

    public String accountId() {
        return account == null ? null : account.accountId();
    }

    /**
     * Only monetary records may be summed into expenses by downstream consumers.
     */
    public boolean isAggregatable() {
        return state != null && state.isAggregatable();
    }

    private static void requireUnset(Object current, String field) {
        if (current != null) {
            throw new IllegalStateException(field + " is already set");
        }
    }

    private static <T> T required(T value, String field) {
        if (value == null) throw new IllegalArgumentException(field + " is required");
        return value;
    }
}

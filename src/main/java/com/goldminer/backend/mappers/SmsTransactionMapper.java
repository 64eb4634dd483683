package com.goldminer.backend.mappers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import com.goldminer.backend.dto.sms.AccountMetadata;
import com.goldminer.backend.dto.sms.BankMatch;
import com.goldminer.backend.dto.sms.CategoryAssignment;
import com.goldminer.backend.dto.sms.ExtractedFields;
import com.goldminer.backend.dto.sms.HistoryEntry;
import com.goldminer.backend.dto.sms.TransactionRecord;
import com.goldminer.backend.entities.SmsTransaction;
import com.goldminer.backend.enums.AnomalyFlag;
import com.goldminer.backend.enums.Urgency;
import com.goldminer.backend.services.sms.identity.ContentHasher;

public class SmsTransactionMapper {

    private static final int RAW_TEXT_LIMIT = 2000;
    private static final int SHORT_TEXT_LIMIT = 100;
    private static final int TEXT_LIMIT = 255;
    private static final int CURRENCY_LIMIT = 10;
    private static final int TRANSACTION_TYPE_LIMIT = 50;
    private static final int TAGS_LIMIT = 500;
    private static final int WARNINGS_LIMIT = 1000;

    private SmsTransactionMapper() {}

    public static SmsTransaction toEntity(TransactionRecord record) {
        SmsTransaction entity = new SmsTransaction();
        updateEntity(entity, record);
        return entity;
    }

    /**
     * Copies every field of the record onto the entity; the id and audit timestamps are untouched.
     * Text is cut to its column width.
     */
    public static void updateEntity(SmsTransaction entity, TransactionRecord record) {
        entity.setContentHash(record.getContentHash());
        entity.setResolvedDate(record.getResolvedDate());
        entity.setOccurredAt(record.getOccurredAt());
        entity.setAmount(money(record.getAmount()));
        entity.setPayee(truncate(record.getPayee(), TEXT_LIMIT));
        entity.setState(record.getState());
        entity.setConfidence(record.confidence());
        entity.setRawText(truncate(record.getSource().text(), RAW_TEXT_LIMIT));
        entity.setPromoReason(record.getPromoVerdict() == null ? null
                : truncate(record.getPromoVerdict().reason(), TEXT_LIMIT));
        entity.setUrgency(record.getUrgency() == null ? Urgency.NORMAL : record.getUrgency());
        entity.setTextRepaired(record.isTextRepaired());
        entity.setValidationWarnings(warnings(record.getWarnings()));

        ExtractedFields fields = record.getExtractedFields();
        entity.setCurrency(fields == null ? null : truncate(fields.currency(), CURRENCY_LIMIT));
        entity.setRawPayee(fields == null ? null : truncate(fields.payee(), TEXT_LIMIT));
        entity.setTransactionType(fields == null ? null : truncate(fields.transactionType(), TRANSACTION_TYPE_LIMIT));
        entity.setTemplateName(fields == null ? null : truncate(fields.matchedTemplate(), SHORT_TEXT_LIMIT));
        entity.setCardSuffix(fields == null ? null : fields.cardSuffix());

        BankMatch bank = record.getBankMatch();
        entity.setBankId(bank == null ? null : truncate(bank.bankId(), SHORT_TEXT_LIMIT));
        entity.setBankMatchKind(bank == null ? null : bank.matchKind());
        entity.setBankScore(bank == null ? null : bank.confidenceScore());

        AccountMetadata account = record.getAccount();
        entity.setAccountId(account == null ? AccountMetadata.UNKNOWN_ACCOUNT : truncate(account.accountId(), SHORT_TEXT_LIMIT));
        entity.setAccountType(account == null ? null : account.accountType());
        entity.setAccountLabel(account == null ? null : truncate(account.label(), TEXT_LIMIT));
        entity.setInterestRate(account == null ? null : account.interestRate());
        entity.setCreditLimit(account == null ? null : account.creditLimit());

        CategoryAssignment category = record.getCategory();
        entity.setCategory(category == null ? null : truncate(category.category(), SHORT_TEXT_LIMIT));
        entity.setSubcategory(category == null ? null : truncate(category.subcategory(), SHORT_TEXT_LIMIT));
        entity.setTags(category == null ? null : truncate(join(category.tags()), TAGS_LIMIT));
        entity.setMatchPriority(category == null ? null : category.matchPriority());

        entity.setAnomalies(record.getAnomalies() == null ? null
                : join(record.getAnomalies().stream().map(AnomalyFlag::getCode).toList()));
    }

    public static HistoryEntry toHistoryEntry(SmsTransaction entity) {
        return HistoryEntry.of(entity.getAmount(), entity.getPayee(), entity.getOccurredAt(), entity.getContentHash());
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount == null ? null : amount.setScale(ContentHasher.AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    private static String join(Collection<String> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().sorted().collect(Collectors.joining(","));
    }

    private static String warnings(List<String> warnings) {
        if (warnings == null || warnings.isEmpty()) {
            return null;
        }
        return truncate(String.join("; ", warnings), WARNINGS_LIMIT);
    }

    private static String truncate(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit);
    }
}

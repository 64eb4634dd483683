package com.goldminer.backend.services.sms.store;

import java.util.List;

import com.goldminer.backend.dto.sms.StoreReport;
import com.goldminer.backend.dto.sms.TransactionRecord;
import com.goldminer.backend.enums.StoreMode;

/**
 * Persists transaction records idempotently.
 *
 * <p>A record is a duplicate when a stored row has the same content hash or the same
 * {@code (resolvedDate, payee, amount, accountId)}. In {@link StoreMode#SKIP} duplicates are
 * left alone, in {@link StoreMode#UPSERT} they are overwritten. A batch is all-or-nothing:
 * when any write fails, nothing is kept and every record that was not skipped reports
 * {@code FAILED}.
 */
public interface TransactionStore {

    StoreReport store(List<TransactionRecord> records, StoreMode mode);
}

package com.goldminer.backend.services.sms.store;

import java.util.List;

import com.goldminer.backend.enums.StoreOutcome;

/**
 * Raised inside the write transaction so that it rolls back. Carries the outcomes decided
 * before the failing record.
 */
public class BatchWriteException extends RuntimeException {

    private final transient List<StoreOutcome> completed;

    public BatchWriteException(String message, List<StoreOutcome> completed, Throwable cause) {
        super(message, cause);
        this.completed = List.copyOf(completed);
    }

    public List<StoreOutcome> getCompleted() {
        return completed;
    }
}

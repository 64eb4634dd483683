package com.goldminer.backend.enums;

/**
 * How the store treats a record whose identity already exists.
 */
public enum StoreMode {
    SKIP,
    UPSERT
}

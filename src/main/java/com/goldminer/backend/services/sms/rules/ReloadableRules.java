package com.goldminer.backend.services.sms.rules;

/**
 * A rule set backed by a file that can be swapped at runtime.
 * Implementations never throw from the reload methods.
 */
public interface ReloadableRules {

    String name();

    boolean reload();

    boolean reloadIfModified();
}

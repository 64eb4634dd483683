package com.goldminer.backend.services.sms.rules;

/**
 * Thrown when a rule file exists but cannot be turned into a usable rule set.
 */
public class RuleConfigurationException extends IllegalArgumentException {

    public RuleConfigurationException(String message) {
        super(message);
    }

    public RuleConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

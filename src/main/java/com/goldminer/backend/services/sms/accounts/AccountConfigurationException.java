package com.goldminer.backend.services.sms.accounts;

import com.goldminer.backend.services.sms.rules.RuleConfigurationException;

/**
 * A structurally invalid account record. Raised while loading, never at lookup time.
 */
public class AccountConfigurationException extends RuleConfigurationException {

    public AccountConfigurationException(String message) {
        super(message);
    }

    public AccountConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

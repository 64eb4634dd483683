package com.goldminer.backend.services.sms.accounts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.goldminer.backend.config.RulesProperties;
import com.goldminer.backend.dto.sms.AccountMetadata;
import com.goldminer.backend.enums.AccountType;
import com.goldminer.backend.services.sms.rules.ReloadableRuleSet;
import com.goldminer.backend.services.sms.rules.RuleConfigurationException;
import com.goldminer.backend.services.sms.rules.RuleFileReader;

/**
 * Card suffix to account metadata table.
 *
 * <p>Every record needs {@code account_id} and {@code account_type}. A bad record fails the
 * application at startup; on a later reload the whole file is rejected and the previous
 * table stays active.
 */
@Component
public class AccountRegistry extends ReloadableRuleSet<Map<String, AccountMetadata>> {

    private static final TypeReference<LinkedHashMap<String, AccountDefinition>> FILE_TYPE = new TypeReference<>() {};
    private static final Pattern SUFFIX = Pattern.compile("[0-9]{4}");

    public AccountRegistry(RuleFileReader reader, RulesProperties properties) {
        super(reader, properties.accounts(), Map.of());
        initialize(true);
    }

    @Override
    public String name() {
        return "Account";
    }

    @Override
    protected Optional<Map<String, AccountMetadata>> load(RuleFileReader reader, String location) {
        Optional<LinkedHashMap<String, AccountDefinition>> raw;
        try {
            raw = reader.read(location, FILE_TYPE);
        } catch (AccountConfigurationException e) {
            throw e;
        } catch (RuleConfigurationException e) {
            throw new AccountConfigurationException(e.getMessage(), e);
        }
        return raw.map(AccountRegistry::toTable);
    }

    /**
     * @throws AccountConfigurationException on the first invalid record
     */
    static Map<String, AccountMetadata> toTable(Map<String, AccountDefinition> raw) {
        Map<String, AccountMetadata> table = new LinkedHashMap<>();
        for (Map.Entry<String, AccountDefinition> entry : raw.entrySet()) {
            String suffix = entry.getKey() == null ? "" : entry.getKey().trim();
            if (!SUFFIX.matcher(suffix).matches()) {
                throw new AccountConfigurationException("Account key '" + entry.getKey() + "' is not a 4-digit card suffix");
            }
            table.put(suffix, toMetadata(suffix, entry.getValue()));
        }
        return Collections.unmodifiableMap(table);
    }

    private static AccountMetadata toMetadata(String suffix, AccountDefinition definition) {
        if (definition == null) {
            throw new AccountConfigurationException("Account " + suffix + " has no fields");
        }
        if (definition.getAccountId() == null || definition.getAccountId().isBlank()) {
            throw new AccountConfigurationException("Account " + suffix + " is missing required field 'account_id'");
        }
        if (definition.getAccountType() == null || definition.getAccountType().isBlank()) {
            throw new AccountConfigurationException("Account " + suffix + " is missing required field 'account_type'");
        }
        try {
            return new AccountMetadata(
                    definition.getAccountId().trim(),
                    AccountType.fromLabel(definition.getAccountType()),
                    definition.getInterestRate(),
                    definition.getCreditLimit(),
                    definition.getBillingCycle(),
                    definition.getLabel() == null ? definition.getAccountId().trim() : definition.getLabel(),
                    true);
        } catch (IllegalArgumentException e) {
            throw new AccountConfigurationException("Account " + suffix + ": " + e.getMessage(), e);
        }
    }
}

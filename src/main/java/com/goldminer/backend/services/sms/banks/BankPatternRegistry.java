package com.goldminer.backend.services.sms.banks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.goldminer.backend.config.RulesProperties;
import com.goldminer.backend.services.sms.rules.ReloadableRuleSet;
import com.goldminer.backend.services.sms.rules.RuleConfigurationException;
import com.goldminer.backend.services.sms.rules.RuleFileReader;

import lombok.extern.slf4j.Slf4j;

/**
 * Bank id to identification patterns, in file order. The file order is the priority order
 * used to break ties between banks.
 */
@Component
@Slf4j
public class BankPatternRegistry extends ReloadableRuleSet<BankPatternRegistry.BankTable> {

    private static final TypeReference<LinkedHashMap<String, List<String>>> FILE_TYPE = new TypeReference<>() {};

    /**
     * A configured pattern. When the text is not a valid regex it is matched as a literal
     * substring and {@code regex} is null.
     */
    public record BankPattern(String text, Pattern regex) {

        public boolean matches(String message) {
            if (regex != null) {
                return regex.matcher(message).find();
            }
            return message.toLowerCase(Locale.ROOT).contains(text.toLowerCase(Locale.ROOT));
        }
    }

    public record BankPatterns(String bankId, List<BankPattern> patterns) {
        public BankPatterns {
            patterns = List.copyOf(patterns);
        }
    }

    public record BankTable(List<BankPatterns> banks) {
        public BankTable {
            banks = List.copyOf(banks);
        }

        public static BankTable empty() {
            return new BankTable(List.of());
        }
    }

    public BankPatternRegistry(RuleFileReader reader, RulesProperties properties) {
        super(reader, properties.bankPatterns(), BankTable.empty());
        initialize(false);
    }

    @Override
    public String name() {
        return "Bank pattern";
    }

    @Override
    protected Optional<BankTable> load(RuleFileReader reader, String location) {
        return reader.read(location, FILE_TYPE).map(BankPatternRegistry::compile);
    }

    static BankTable compile(Map<String, List<String>> raw) {
        List<BankPatterns> banks = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : raw.entrySet()) {
            String bankId = entry.getKey();
            if (bankId == null || bankId.isBlank()) {
                throw new RuleConfigurationException("Bank id must not be blank");
            }
            List<String> patterns = entry.getValue();
            if (patterns == null || patterns.isEmpty()) {
                throw new RuleConfigurationException("Bank '" + bankId + "' has no patterns");
            }
            List<BankPattern> compiled = new ArrayList<>();
            for (String pattern : patterns) {
                if (pattern == null || pattern.isBlank()) {
                    continue;
                }
                compiled.add(new BankPattern(pattern, tryCompile(bankId, pattern)));
            }
            banks.add(new BankPatterns(bankId.trim(), compiled));
        }
        return new BankTable(banks);
    }

    private static Pattern tryCompile(String bankId, String pattern) {
        try {
            return Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            log.warn("Pattern '{}' for bank {} is not a valid regex; matching it as plain text", pattern, bankId);
            return null;
        }
    }
}

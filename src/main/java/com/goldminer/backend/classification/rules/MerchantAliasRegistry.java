package com.goldminer.backend.classification.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.goldminer.backend.config.RulesProperties;
import com.goldminer.backend.services.sms.rules.ReloadableRuleSet;
import com.goldminer.backend.services.sms.rules.RuleConfigurationException;
import com.goldminer.backend.services.sms.rules.RuleFileReader;

@Component
public class MerchantAliasRegistry extends ReloadableRuleSet<List<MerchantAliasRegistry.MerchantAlias>> {

    /**
     * A canonical merchant name with its known spellings, lowercased. The canonical name
     * itself is always one of the aliases.
     */
    public record MerchantAlias(String canonical, List<String> aliases) {
        public MerchantAlias {
            if (canonical == null || canonical.isBlank()) throw new IllegalArgumentException("canonical is required");
            aliases = List.copyOf(aliases);
        }
    }

    public MerchantAliasRegistry(RuleFileReader reader, RulesProperties properties) {
        super(reader, properties.merchantAliases(), List.of());
        initialize(false);
    }

    @Override
    public String name() {
        return "Merchant alias";
    }

    @Override
    protected Optional<List<MerchantAlias>> load(RuleFileReader reader, String location) {
        return reader.read(location, MerchantAliasFile.class).map(MerchantAliasRegistry::compile);
    }

    static List<MerchantAlias> compile(MerchantAliasFile file) {
        List<MerchantAlias> merchants = new ArrayList<>();
        if (file.getMerchants() == null) {
            return merchants;
        }
        for (MerchantAliasFile.Entry entry : file.getMerchants()) {
            if (entry == null || entry.getCanonical() == null || entry.getCanonical().isBlank()) {
                throw new RuleConfigurationException("Merchant entry #" + (merchants.size() + 1) + " has no canonical name");
            }
            String canonical = entry.getCanonical().trim();
            List<String> aliases = new ArrayList<>();
            aliases.add(canonical.toLowerCase(Locale.ROOT));
            if (entry.getAliases() != null) {
                for (String alias : entry.getAliases()) {
                    if (alias != null && !alias.isBlank()) {
                        aliases.add(alias.trim().toLowerCase(Locale.ROOT));
                    }
                }
            }
            merchants.add(new MerchantAlias(canonical, aliases));
        }
        return List.copyOf(merchants);
    }
}

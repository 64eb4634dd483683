package com.goldminer.backend.services.sms.extraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.type.TypeReference;
import com.goldminer.backend.config.RulesProperties;
import com.goldminer.backend.services.sms.rules.ReloadableRuleSet;
import com.goldminer.backend.services.sms.rules.RuleConfigurationException;
import com.goldminer.backend.services.sms.rules.RuleFileReader;

/**
 * Extraction templates per bank. Banks and templates keep their file order.
 */
@Component
public class TemplateRegistry extends ReloadableRuleSet<TemplateRegistry.TemplateCatalog> {

    private static final TypeReference<LinkedHashMap<String, List<TemplateDefinition>>> FILE_TYPE = new TypeReference<>() {};

    public record TemplateCatalog(Map<String, List<ExtractionTemplate>> byBank) {

        public TemplateCatalog {
            Map<String, List<ExtractionTemplate>> copy = new LinkedHashMap<>();
            byBank.forEach((bank, templates) -> copy.put(bank, List.copyOf(templates)));
            byBank = Collections.unmodifiableMap(copy);
        }

        public static TemplateCatalog empty() {
            return new TemplateCatalog(Map.of());
        }

        public List<ExtractionTemplate> templatesFor(String bankId) {
            return byBank.getOrDefault(bankId, List.of());
        }
    }

    public TemplateRegistry(RuleFileReader reader, RulesProperties properties) {
        super(reader, properties.templates(), TemplateCatalog.empty());
        initialize(false);
    }

    @Override
    public String name() {
        return "Extraction template";
    }

    @Override
    protected Optional<TemplateCatalog> load(RuleFileReader reader, String location) {
        return reader.read(location, FILE_TYPE).map(TemplateRegistry::compile);
    }

    static TemplateCatalog compile(Map<String, List<TemplateDefinition>> raw) {
        Map<String, List<ExtractionTemplate>> byBank = new LinkedHashMap<>();
        for (Map.Entry<String, List<TemplateDefinition>> entry : raw.entrySet()) {
            String bankId = entry.getKey();
            List<TemplateDefinition> definitions = entry.getValue();
            if (definitions == null || definitions.isEmpty()) {
                throw new RuleConfigurationException("Bank '" + bankId + "' has no templates");
            }
            List<ExtractionTemplate> templates = new ArrayList<>();
            for (TemplateDefinition definition : definitions) {
                if (definition == null) {
                    throw new RuleConfigurationException("Bank '" + bankId + "' has an empty template entry");
                }
                String name = definition.getName() == null || definition.getName().isBlank()
                        ? bankId + "_template_" + (templates.size() + 1)
                        : definition.getName();
                templates.add(ExtractionTemplate.compile(bankId, name, definition.getPatterns(), definition.getRequiredFields()));
            }
            byBank.put(bankId, templates);
        }
        return new TemplateCatalog(byBank);
    }
}

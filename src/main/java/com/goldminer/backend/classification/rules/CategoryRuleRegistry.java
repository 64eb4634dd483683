package com.goldminer.backend.classification.rules;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.goldminer.backend.config.RulesProperties;
import com.goldminer.backend.dto.sms.CategoryAssignment;
import com.goldminer.backend.enums.MatchPriority;
import com.goldminer.backend.services.sms.rules.ReloadableRuleSet;
import com.goldminer.backend.services.sms.rules.RuleConfigurationException;
import com.goldminer.backend.services.sms.rules.RuleFileReader;

/**
 * Category rules in file order. The order decides which category wins when several match.
 */
@Component
public class CategoryRuleRegistry extends ReloadableRuleSet<CategoryRuleSet> {

    public CategoryRuleRegistry(RuleFileReader reader, RulesProperties properties) {
        super(reader, properties.categoryRules(), CategoryRuleSet.empty());
        initialize(false);
    }

    @Override
    public String name() {
        return "Category";
    }

    @Override
    protected Optional<CategoryRuleSet> load(RuleFileReader reader, String location) {
        return reader.read(location, CategoryRuleFile.class).map(CategoryRuleRegistry::compile);
    }

    static CategoryRuleSet compile(CategoryRuleFile file) {
        List<CategoryRule> rules = new ArrayList<>();
        if (file.getCategories() != null) {
            for (CategoryRuleFile.CategoryEntry entry : file.getCategories()) {
                if (entry == null || entry.getCategory() == null || entry.getCategory().isBlank()) {
                    throw new RuleConfigurationException("Category entry #" + (rules.size() + 1) + " has no category name");
                }
                rules.add(new CategoryRule(
                        entry.getCategory().trim(),
                        entry.getSubcategory(),
                        tags(entry.getTags()),
                        lowered(entry.getMerchantExact()),
                        lowered(entry.getMerchantFuzzy()),
                        keywords(entry.getKeywords())));
            }
        }

        CategoryAssignment fallback = null;
        CategoryRuleFile.FallbackEntry fallbackEntry = file.getFallback();
        if (fallbackEntry != null && fallbackEntry.getCategory() != null && !fallbackEntry.getCategory().isBlank()) {
            fallback = new CategoryAssignment(
                    fallbackEntry.getCategory().trim(),
                    fallbackEntry.getSubcategory() == null ? CategoryRuleSet.DEFAULT_FALLBACK_SUBCATEGORY : fallbackEntry.getSubcategory(),
                    tags(fallbackEntry.getTags()),
                    MatchPriority.FALLBACK);
        }
        return new CategoryRuleSet(rules, fallback);
    }

    private static Set<String> tags(List<String> raw) {
        Set<String> tags = new LinkedHashSet<>();
        if (raw != null) {
            for (String tag : raw) {
                if (tag != null && !tag.isBlank()) {
                    tags.add(tag.trim());
                }
            }
        }
        return tags;
    }

    private static List<String> lowered(List<String> raw) {
        List<String> values = new ArrayList<>();
        if (raw != null) {
            for (String value : raw) {
                if (value != null && !value.isBlank()) {
                    values.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return values;
    }

    private static List<String> keywords(Map<String, List<String>> byLanguage) {
        List<String> all = new ArrayList<>();
        if (byLanguage != null) {
            byLanguage.values().forEach(list -> all.addAll(lowered(list)));
        }
        return all;
    }
}

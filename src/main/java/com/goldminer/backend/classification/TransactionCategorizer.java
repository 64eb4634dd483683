package com.goldminer.backend.classification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.goldminer.backend.classification.rules.CategoryRule;
import com.goldminer.backend.classification.rules.CategoryRuleRegistry;
import com.goldminer.backend.classification.rules.CategoryRuleSet;
import com.goldminer.backend.config.MatchingProperties;
import com.goldminer.backend.dto.sms.CategoryAssignment;
import com.goldminer.backend.enums.MatchPriority;
import com.goldminer.backend.services.sms.matching.FuzzyScores;

import lombok.extern.slf4j.Slf4j;

/**
 * Assigns a category by running an ordered cascade; the first rule that answers wins.
 *
 * <ol>
 *   <li>exact merchant name (case-insensitive)</li>
 *   <li>fuzzy merchant name: best of token-sort and token-set ratio, at or above the threshold</li>
 *   <li>keyword contained in the merchant name or the message text</li>
 *   <li>configured fallback</li>
 * </ol>
 */
@Service
@Slf4j
public class TransactionCategorizer {

    private final CategoryRuleRegistry registry;
    private final MatchingProperties matching;
    private final List<CategoryMatchRule> cascade;

    public TransactionCategorizer(CategoryRuleRegistry registry, MatchingProperties matching) {
        this.registry = registry;
        this.matching = matching;
        this.cascade = List.of(
                this::matchExactMerchant,
                this::matchFuzzyMerchant,
                this::matchKeyword,
                (rules, merchant, text) -> Optional.of(rules.fallback()));
    }

    public CategoryAssignment categorize(String merchant, String text) {
        CategoryRuleSet rules = registry.current();
        String merchantKey = merchant == null ? "" : merchant.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        String textKey = text == null ? "" : text.toLowerCase(Locale.ROOT);

        for (CategoryMatchRule rule : cascade) {
            Optional<CategoryAssignment> assignment = rule.match(rules, merchantKey, textKey);
            if (assignment.isPresent()) {
                log.debug("Merchant '{}' categorized as {} via {}", merchant, assignment.get().category(),
                        assignment.get().matchPriority());
                return assignment.get();
            }
        }
        return rules.fallback();
    }

    public List<CategoryAssignment> categorizeBatch(List<String> merchants, List<String> texts) {
        if (texts != null && texts.size() != merchants.size()) {
            throw new IllegalArgumentException("Expected " + merchants.size() + " texts but got " + texts.size());
        }
        List<CategoryAssignment> assignments = new ArrayList<>(merchants.size());
        for (int i = 0; i < merchants.size(); i++) {
            assignments.add(categorize(merchants.get(i), texts == null ? null : texts.get(i)));
        }
        return assignments;
    }

    public CategoryStatistics statistics(List<CategoryAssignment> assignments) {
        Map<String, Long> byCategory = new LinkedHashMap<>();
        long uncategorized = 0;
        for (CategoryAssignment assignment : assignments) {
            byCategory.merge(assignment.category(), 1L, Long::sum);
            if (assignment.matchPriority() == MatchPriority.FALLBACK) {
                uncategorized++;
            }
        }
        double percentage = assignments.isEmpty() ? 0.0 : 100.0 * uncategorized / assignments.size();
        return new CategoryStatistics(assignments.size(), byCategory, uncategorized, percentage);
    }

    private Optional<CategoryAssignment> matchExactMerchant(CategoryRuleSet rules, String merchant, String text) {
        if (merchant.isEmpty()) {
            return Optional.empty();
        }
        for (CategoryRule rule : rules.rules()) {
            if (rule.merchantExact().contains(merchant)) {
                return Optional.of(rule.assign(MatchPriority.EXACT));
            }
        }
        return Optional.empty();
    }

    private Optional<CategoryAssignment> matchFuzzyMerchant(CategoryRuleSet rules, String merchant, String text) {
        if (merchant.isEmpty()) {
            return Optional.empty();
        }
        CategoryRule best = null;
        int bestScore = 0;
        for (CategoryRule rule : rules.rules()) {
            int score = Math.max(bestFuzzyScore(merchant, rule.merchantExact()), bestFuzzyScore(merchant, rule.merchantFuzzy()));
            if (score >= matching.categoryFuzzyThreshold() && score > bestScore) {
                best = rule;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best).map(rule -> rule.assign(MatchPriority.FUZZY));
    }

    private Optional<CategoryAssignment> matchKeyword(CategoryRuleSet rules, String merchant, String text) {
        for (CategoryRule rule : rules.rules()) {
            for (String keyword : rule.keywords()) {
                if (merchant.contains(keyword) || text.contains(keyword)) {
                    return Optional.of(rule.assign(MatchPriority.KEYWORD));
                }
            }
        }
        return Optional.empty();
    }

    private static int bestFuzzyScore(String merchant, List<String> candidates) {
        int best = 0;
        for (String candidate : candidates) {
            int score = Math.max(FuzzyScores.tokenSortRatio(merchant, candidate), FuzzyScores.tokenSetRatio(merchant, candidate));
            best = Math.max(best, score);
        }
        return best;
    }
}

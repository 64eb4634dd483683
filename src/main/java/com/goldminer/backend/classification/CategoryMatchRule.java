package com.goldminer.backend.classification;

import java.util.Optional;

import com.goldminer.backend.classification.rules.CategoryRuleSet;
import com.goldminer.backend.dto.sms.CategoryAssignment;

/**
 * One step of the category cascade. Returns empty to let the next step run.
 *
 * @param merchant lowercased, trimmed merchant name, or empty
 * @param text     lowercased message text, or empty
 */
@FunctionalInterface
public interface CategoryMatchRule {

    Optional<CategoryAssignment> match(CategoryRuleSet rules, String merchant, String text);
}

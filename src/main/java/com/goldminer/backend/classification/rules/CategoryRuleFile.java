package com.goldminer.backend.classification.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * YAML shape of the category rules file.
 */
@Data
@NoArgsConstructor
public class CategoryRuleFile {

    private List<CategoryEntry> categories = new ArrayList<>();
    private FallbackEntry fallback;

    @Data
    @NoArgsConstructor
    public static class CategoryEntry {
        private String category;
        private String subcategory;
        private List<String> tags = new ArrayList<>();
        private List<String> merchantExact = new ArrayList<>();
        private List<String> merchantFuzzy = new ArrayList<>();
        /** Language name to keywords, e.g. {@code english}, {@code arabic}. */
        private Map<String, List<String>> keywords = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    public static class FallbackEntry {
        private String category;
        private String subcategory;
        private List<String> tags = new ArrayList<>();
    }
}

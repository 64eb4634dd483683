package com.goldminer.backend.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.goldminer.backend.dto.sms.CategoryAssignment;
import com.goldminer.backend.enums.MatchPriority;
import com.goldminer.backend.services.sms.SmsTestFixtures;

class TransactionCategorizerTest {

    private TransactionCategorizer categorizer;

    @BeforeEach
    void setUp() {
        categorizer = SmsTestFixtures.categorizer();
    }

    @Test
    void exactMerchantMatch() {
        CategoryAssignment assignment = categorizer.categorize("Carrefour", null);

        assertEquals("Food & Dining", assignment.category());
        assertEquals("Groceries", assignment.subcategory());
        assertEquals(Set.of("essential"), assignment.tags());
        assertEquals(MatchPriority.EXACT, assignment.matchPriority());
    }

    @Test
    void fuzzyMerchantMatchIgnoresExtraWords() {
        CategoryAssignment assignment = categorizer.categorize("Carrefour Market Maadi", null);

        assertEquals("Groceries", assignment.subcategory());
        assertEquals(MatchPriority.FUZZY, assignment.matchPriority());
    }

    @Test
    void keywordInMessageText() {
        CategoryAssignment assignment = categorizer.categorize(null, "ATM withdrawal of 1000 EGP");

        assertEquals("Cash", assignment.category());
        assertEquals(MatchPriority.KEYWORD, assignment.matchPriority());
    }

    @Test
    void arabicKeyword() {
        CategoryAssignment assignment = categorizer.categorize(null, "تم الدفع في سوبر ماركت");

        assertEquals("Groceries", assignment.subcategory());
        assertEquals(MatchPriority.KEYWORD, assignment.matchPriority());
    }

    @Test
    void fallbackWhenNothingMatches() {
        CategoryAssignment assignment = categorizer.categorize("Zzz Corp", "hello");

        assertEquals("Uncategorized", assignment.category());
        assertEquals("General", assignment.subcategory());
        assertEquals(MatchPriority.FALLBACK, assignment.matchPriority());
    }

    @Test
    void batchAndStatistics() {
        List<CategoryAssignment> assignments = categorizer.categorizeBatch(
                Arrays.asList("Carrefour", "Amazon", "Zzz Corp", null),
                Arrays.asList(null, null, "hello", "nothing here"));

        CategoryStatistics stats = categorizer.statistics(assignments);

        assertEquals(4, stats.total());
        assertEquals(2L, stats.byCategory().get("Uncategorized"));
        assertEquals(1L, stats.byCategory().get("Shopping"));
        assertEquals(2, stats.uncategorized());
        assertEquals(50.0, stats.uncategorizedPercentage(), 0.001);
    }

    @Test
    void batchSizesMustMatch() {
        assertThrows(IllegalArgumentException.class,
                () -> categorizer.categorizeBatch(List.of("a", "b"), List.of("x")));
    }
}

package com.goldminer.backend.services.sms.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.goldminer.backend.services.sms.rules.RuleConfigurationException;

class TemplatePatternTranslatorTest {

    @Test
    void translatesPcreNamedGroups() {
        assertEquals("card\\s+(?<cardSuffix>\\d{4})",
                TemplatePatternTranslator.translate("card\\s+(?P<card_suffix>\\d{4})"));
    }

    @Test
    void translatesBackReferences() {
        assertEquals("(?<word>\\w+) \\k<word>", TemplatePatternTranslator.translate("(?P<word>\\w+) (?P=word)"));
    }

    @Test
    void leavesLookaroundsAlone() {
        String pattern = "(?<=at )(?<payee>\\w+)(?!\\d)";
        assertEquals(pattern, TemplatePatternTranslator.translate(pattern));
        assertEquals(List.of("payee"), TemplatePatternTranslator.namedGroups(pattern));
    }

    @Test
    void groupNames() {
        assertEquals("transactionType", TemplatePatternTranslator.groupName("transaction_type"));
        assertEquals("amount", TemplatePatternTranslator.groupName("_amount"));
        assertEquals("g1st", TemplatePatternTranslator.groupName("1st"));
    }

    @Test
    void compileRejectsUnknownFieldsAndBadRegexes() {
        assertThrows(RuleConfigurationException.class,
                () -> ExtractionTemplate.compile("B", "T", Map.of("balance", "\\d+"), List.of()));
        assertThrows(RuleConfigurationException.class,
                () -> ExtractionTemplate.compile("B", "T", Map.of("amount", "(\\d+"), List.of()));
        assertThrows(RuleConfigurationException.class,
                () -> ExtractionTemplate.compile("B", "T", Map.of("amount", "\\d+"), List.of("payee")));
    }

    @Test
    void fieldPatternPrefersGroupNamedAfterField() {
        ExtractionTemplate template = ExtractionTemplate.compile("B", "T",
                Map.of("amount", "(?P<currency>EGP)\\s*(?P<amount>[\\d.]+)"), List.of("amount"));

        assertEquals("12.5", template.fieldPatterns().get(TemplateField.AMOUNT).extract("EGP 12.5").orElseThrow());
    }

    @Test
    void fieldPatternFallsBackToWholeMatch() {
        ExtractionTemplate template = ExtractionTemplate.compile("B", "T", Map.of("currency", "EGP|USD"), List.of("currency"));

        assertEquals("USD", template.fieldPatterns().get(TemplateField.CURRENCY).extract("paid 5 USD").orElseThrow());
        assertEquals(Set.of(TemplateField.CURRENCY), template.requiredFields());
    }
}

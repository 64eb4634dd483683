package com.goldminer.backend.services.sms.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.goldminer.backend.dto.sms.ExtractedFields;
import com.goldminer.backend.enums.Confidence;
import com.goldminer.backend.services.sms.SmsTestFixtures;
import com.goldminer.backend.services.sms.accounts.CardSuffixExtractor;
import com.goldminer.backend.services.sms.normalization.TextNormalizer;

@DisplayName("FieldExtractor - template based extraction")
class FieldExtractorTest {

    private static final String AMOUNT = "(?P<amount>\\d+)\\s*EGP";
    private static final String CURRENCY = "\\d\\s*(?P<currency>EGP)";

    private FieldExtractor extractor;
    private TextNormalizer normalizer;

    @BeforeEach
    void setUp() {
        extractor = SmsTestFixtures.fieldExtractor();
        normalizer = new TextNormalizer();
    }

    @Test
    void extractsAllFieldsFromEnglishHsbcMessage() {
        ExtractedFields fields = extractor.extract(
                "Your HSBC card ending 1234 was charged 250.50 EGP at Amazon Store on 15/11/2024",
                BankScope.specified("HSBC"));

        assertEquals("250.50", fields.amount());
        assertEquals("EGP", fields.currency());
        assertEquals("15/11/2024", fields.dateRaw());
        assertEquals("Amazon Store", fields.payee());
        assertEquals("charged", fields.transactionType());
        assertEquals("1234", fields.cardSuffix());
        assertEquals(Confidence.HIGH, fields.confidence());
        assertEquals("HSBC", fields.matchedBank());
        assertEquals("HSBC_Standard", fields.matchedTemplate());
    }

    @Test
    void extractsFromArabicMessageAfterNormalization() {
        String text = normalizer.normalize("عزيزي العميل، تم خصم ١٥٠ جنيه من بطاقة رقم ١٢٣٤ في محل الإلكترونيات");

        ExtractedFields fields = extractor.extract(text, BankScope.specified("HSBC"));

        assertEquals("150", fields.amount());
        assertEquals("جنيه", fields.currency());
        assertEquals("1234", fields.cardSuffix());
        assertEquals("محل الإلكترونيات", fields.payee());
        assertEquals("HSBC_Arabic", fields.matchedTemplate());
        assertEquals(Confidence.HIGH, fields.confidence());
    }

    @Test
    void cibTemplateExtractsPayeeAfterFrom() {
        ExtractedFields fields = extractor.extract(
                "CIB: Your card ending 5678 Purchase of 500.00 EGP from CARREFOUR on 14/11/2024.",
                BankScope.specified("CIB"));

        assertEquals("500.00", fields.amount());
        assertEquals("CARREFOUR", fields.payee());
        assertEquals("Purchase", fields.transactionType());
        assertEquals("5678", fields.cardSuffix());
        assertEquals(Confidence.HIGH, fields.confidence());
    }

    @Test
    void selectedTemplateWithFewMatchedFieldsIsMedium() {
        // amount and currency only: 2 of 6 declared fields
        ExtractedFields fields = extractor.extract("HSBC 75 USD", BankScope.specified("HSBC"));

        assertEquals("75", fields.amount());
        assertEquals("USD", fields.currency());
        assertEquals(Confidence.MEDIUM, fields.confidence());
        assertEquals("HSBC_Standard", fields.matchedTemplate());
    }

    @Test
    void partialMatchWithoutRequiredFieldsIsLow() {
        ExtractedFields fields = extractor.extract("HSBC card ending 4321 was used on 01/02/2024", BankScope.specified("HSBC"));

        assertNull(fields.amount());
        assertEquals("4321", fields.cardSuffix());
        assertEquals("01/02/2024", fields.dateRaw());
        assertEquals(Confidence.LOW, fields.confidence());
    }

    @Test
    void noMatchStillExtractsCardSuffix() {
        ExtractedFields fields = extractor.extract("Hello, your card **9876 is ready", BankScope.specified("CIB"));

        assertNull(fields.amount());
        assertNull(fields.matchedTemplate());
        assertEquals("CIB", fields.matchedBank());
        assertEquals("9876", fields.cardSuffix());
        assertEquals(Confidence.LOW, fields.confidence());
    }

    @Test
    void autoModePicksHighestConfidence() {
        ExtractedFields fields = extractor.extract("Transaction charged 100 EGP at Store on 10/11/2024", BankScope.auto());

        assertEquals("100", fields.amount());
        assertEquals("Store", fields.payee());
        assertEquals(Confidence.HIGH, fields.confidence());
    }

    @Test
    void autoModeWithoutAnyMatchReportsUnknownBank() {
        ExtractedFields fields = extractor.extract("good morning", BankScope.auto());

        assertEquals(FieldExtractor.UNKNOWN_BANK, fields.matchedBank());
        assertEquals(Confidence.LOW, fields.confidence());
    }

    @Test
    void unconfiguredBankFallsBackToEmptyResult() {
        ExtractedFields fields = extractor.extract("Banque Misr charged 10 EGP", BankScope.specified("Banque_Misr"));

        assertNull(fields.amount());
        assertEquals("Banque_Misr", fields.matchedBank());
        assertEquals(Confidence.LOW, fields.confidence());
    }

    @Test
    void templateNameRestrictsSelection() {
        ExtractedFields fields = extractor.extract("charged 10 EGP at Cafe", BankScope.specified("Generic_Bank"), "Generic_Arabic");

        assertNull(fields.amount());
        assertEquals(Confidence.LOW, fields.confidence());
    }

    @Test
    void batchRequiresMatchingScopeCount() {
        List<String> texts = List.of("a", "b");
        assertThrows(IllegalArgumentException.class, () -> extractor.extractBatch(texts, List.of(BankScope.auto())));
        assertEquals(2, extractor.extractBatch(texts, null).size());
    }

    @Test
    void introspection() {
        assertTrue(extractor.supports("HSBC"));
        assertTrue(extractor.supportedBanks().contains("Generic_Bank"));
        assertEquals(List.of("HSBC_Standard", "HSBC_Arabic"), extractor.templateNames("HSBC"));
        assertEquals(List.of(), extractor.templateNames("nope"));
    }

    @Test
    void scopeIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> extractor.extract("text", null));
    }

    @Test
    void firstQualifyingTemplateWinsOverRicherLaterOne() {
        Map<String, String> richer = new LinkedHashMap<>();
        richer.put("amount", AMOUNT);
        richer.put("date", "on (?P<date>\\d{2}/\\d{2}/\\d{4})");
        richer.put("payee", "at (?P<payee>\\w+)");
        richer.put("transaction_type", "(?P<transaction_type>purchase)");
        Map<String, List<TemplateDefinition>> raw = new LinkedHashMap<>();
        raw.put("ACME", List.of(
                template("ACME_Short", Map.of("amount", AMOUNT, "currency", CURRENCY), List.of("amount", "currency")),
                template("ACME_Long", richer, List.of("amount"))));

        ExtractedFields fields = extractorFor(raw).extract("purchase 100 EGP at Shop on 01/02/2024", BankScope.specified("ACME"));

        assertEquals("ACME_Short", fields.matchedTemplate());
        assertEquals("EGP", fields.currency());
        assertNull(fields.payee());
        assertEquals(Confidence.HIGH, fields.confidence());
    }

    @Test
    void partiallyMatchingTemplateIsSkippedForALaterQualifyingOne() {
        Map<String, List<TemplateDefinition>> raw = new LinkedHashMap<>();
        raw.put("ACME", List.of(
                template("ACME_Dollar", Map.of("amount", AMOUNT, "currency", "(?P<currency>USD)"), List.of("amount", "currency")),
                template("ACME_Any", Map.of("amount", AMOUNT, "payee", "at (?P<payee>\\w+)"), List.of("amount"))));

        ExtractedFields fields = extractorFor(raw).extract("paid 100 EGP at Shop", BankScope.specified("ACME"));

        assertEquals("ACME_Any", fields.matchedTemplate());
        assertEquals("100", fields.amount());
        assertEquals("Shop", fields.payee());
        assertEquals(Confidence.HIGH, fields.confidence());
    }

    @Test
    void autoModeTieGoesToTheEarlierBank() {
        Map<String, List<TemplateDefinition>> raw = new LinkedHashMap<>();
        raw.put("FIRST", List.of(template("First_Standard", Map.of("amount", AMOUNT), List.of("amount"))));
        raw.put("SECOND", List.of(template("Second_Standard", Map.of("amount", AMOUNT), List.of("amount"))));
        Map<String, List<TemplateDefinition>> reversed = new LinkedHashMap<>();
        reversed.put("SECOND", raw.get("SECOND"));
        reversed.put("FIRST", raw.get("FIRST"));

        assertEquals("FIRST", extractorFor(raw).extract("paid 100 EGP", BankScope.auto()).matchedBank());
        assertEquals("SECOND", extractorFor(reversed).extract("paid 100 EGP", BankScope.auto()).matchedBank());
    }

    private static TemplateDefinition template(String name, Map<String, String> patterns, List<String> required) {
        TemplateDefinition definition = new TemplateDefinition();
        definition.setName(name);
        definition.setPatterns(new LinkedHashMap<>(patterns));
        definition.setRequiredFields(required);
        return definition;
    }

    private static FieldExtractor extractorFor(Map<String, List<TemplateDefinition>> raw) {
        TemplateRegistry registry = mock(TemplateRegistry.class);
        when(registry.current()).thenReturn(TemplateRegistry.compile(raw));
        return new FieldExtractor(registry, new CardSuffixExtractor());
    }
}

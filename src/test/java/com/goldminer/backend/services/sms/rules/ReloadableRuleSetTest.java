package com.goldminer.backend.services.sms.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.goldminer.backend.config.RulesProperties;
import com.goldminer.backend.services.sms.SmsTestFixtures;
import com.goldminer.backend.services.sms.promo.PromoFilter;
import com.goldminer.backend.services.sms.promo.PromoKeywordFile;
import com.goldminer.backend.services.sms.promo.PromoKeywordRegistry;

class ReloadableRuleSetTest {

    @TempDir
    Path tempDir;

    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        file = tempDir.resolve("promo_keywords.yml");
        write("""
                keywords:
                  english: [jackpot]
                """, 1_000);
    }

    @Test
    void loadsFileInsteadOfBuiltInDefaults() {
        PromoFilter filter = new PromoFilter(registry());

        assertTrue(filter.isPromotional("Jackpot!"));
        assertFalse(filter.isPromotional("Special offer"));
    }

    @Test
    void missingFileKeepsBuiltInDefaults() {
        PromoKeywordRegistry registry = new PromoKeywordRegistry(SmsTestFixtures.reader(),
                properties(tempDir.resolve("absent.yml")));

        assertTrue(new PromoFilter(registry).isPromotional("Special offer"));
        assertFalse(registry.reload());
    }

    @Test
    void reloadIfModifiedPicksUpChanges() throws IOException {
        PromoKeywordRegistry registry = registry();
        assertFalse(registry.reloadIfModified());

        write("""
                keywords:
                  english: [raffle]
                  french: [tombola]
                """, 2_000);

        assertTrue(registry.reloadIfModified());
        assertEquals(2, registry.current().keywords().size());
        assertEquals("french", registry.current().keywords().get(1).language());
    }

    @Test
    void malformedReloadKeepsPreviousSnapshot() throws IOException {
        PromoKeywordRegistry registry = registry();
        PromoKeywordRegistry.KeywordSet before = registry.current();

        write("keywords: [unclosed", 3_000);
        assertFalse(registry.reload());

        write("keywords: {}", 4_000);
        assertFalse(registry.reload());

        assertEquals(before, registry.current());
    }

    @Test
    void readerReportsMalformedAndEmptyFiles() throws IOException {
        RuleFileReader reader = SmsTestFixtures.reader();

        write("keywords: [unclosed", 5_000);
        assertThrows(RuleConfigurationException.class, () -> reader.read(file.toUri().toString(), PromoKeywordFile.class));

        write("", 6_000);
        assertThrows(RuleConfigurationException.class, () -> reader.read(file.toUri().toString(), PromoKeywordFile.class));

        assertEquals(RuleFileReader.UNKNOWN_VERSION, reader.lastModified(tempDir.resolve("none.yml").toUri().toString()));
    }

    private PromoKeywordRegistry registry() {
        return new PromoKeywordRegistry(SmsTestFixtures.reader(), properties(file));
    }

    private void write(String content, long modifiedSeconds) throws IOException {
        Files.writeString(file, content, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.from(Instant.ofEpochSecond(1_700_000_000L + modifiedSeconds)));
    }

    private static RulesProperties properties(Path promo) {
        return new RulesProperties(promo.toUri().toString(), null, null, null, null, null, false, null);
    }
}

package com.goldminer.backend.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.goldminer.backend.services.sms.SmsTestFixtures;

class MerchantAliasResolverTest {

    private MerchantAliasResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = SmsTestFixtures.merchantAliasResolver();
    }

    @Test
    void exactAliasIsCaseInsensitive() {
        assertEquals("Carrefour", resolver.resolve("CARREFOUR"));
        assertEquals("Amazon", resolver.resolve("Amazon Store"));
    }

    @Test
    void arabicAlias() {
        assertEquals("Carrefour", resolver.resolve("كارفور"));
    }

    @Test
    void fuzzyAliasAboveThreshold() {
        assertEquals("Carrefour", resolver.resolve("Carrefor Maadi"));
    }

    @Test
    void unmatchedPayeeIsCleaned() {
        assertEquals("Local Bakery", resolver.resolve("  Local   Bakery "));
    }

    @Test
    void blankPayeeResolvesToNull() {
        assertNull(resolver.resolve(null));
        assertNull(resolver.resolve("   "));
    }
}

package com.goldminer.backend.services.sms.accounts;

import org.springframework.stereotype.Service;

import com.goldminer.backend.dto.sms.AccountMetadata;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves card suffixes to account metadata. Unknown suffixes resolve to a synthesized
 * record with {@code known == false}; lookups never throw.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountResolver {

    private final AccountRegistry registry;
    private final CardSuffixExtractor cardSuffixExtractor;

    public AccountMetadata lookup(String cardSuffix) {
        if (cardSuffix == null || cardSuffix.isBlank()) {
            return AccountMetadata.unknown(null);
        }
        AccountMetadata metadata = registry.current().get(cardSuffix.trim());
        if (metadata == null) {
            log.debug("Card suffix {} is not configured", cardSuffix);
            return AccountMetadata.unknown(cardSuffix.trim());
        }
        return metadata;
    }

    /**
     * Extracts the card suffix from a normalized message and resolves it.
     */
    public AccountMetadata resolve(String text) {
        return lookup(cardSuffixExtractor.extract(text));
    }

    public boolean isKnown(String cardSuffix) {
        return cardSuffix != null && registry.current().containsKey(cardSuffix.trim());
    }
}

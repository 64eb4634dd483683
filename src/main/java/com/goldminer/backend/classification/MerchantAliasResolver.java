package com.goldminer.backend.classification;

import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.goldminer.backend.classification.rules.MerchantAliasRegistry;
import com.goldminer.backend.config.MatchingProperties;
import com.goldminer.backend.services.sms.matching.FuzzyScores;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps payee spellings ("CARREFOUR MAADI", "كارفور") to one canonical merchant name.
 * Exact alias matches win; otherwise the best fuzzy ratio at or above the threshold.
 * Unmatched payees come back trimmed with whitespace collapsed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MerchantAliasResolver {

    private final MerchantAliasRegistry registry;
    private final MatchingProperties matching;

    public String resolve(String payee) {
        if (payee == null || payee.isBlank()) {
            return null;
        }
        String cleaned = payee.strip().replaceAll("\\s+", " ");
        String lowered = cleaned.toLowerCase(Locale.ROOT);
        List<MerchantAliasRegistry.MerchantAlias> merchants = registry.current();

        for (MerchantAliasRegistry.MerchantAlias merchant : merchants) {
            if (merchant.aliases().contains(lowered)) {
                return merchant.canonical();
            }
        }

        String best = null;
        int bestScore = 0;
        for (MerchantAliasRegistry.MerchantAlias merchant : merchants) {
            for (String alias : merchant.aliases()) {
                int score = FuzzyScores.ratio(lowered, alias);
                if (score >= matching.merchantAliasThreshold() && score > bestScore) {
                    best = merchant.canonical();
                    bestScore = score;
                }
            }
        }
        if (best != null) {
            log.debug("Payee '{}' resolved to '{}' (score={})", cleaned, best, bestScore);
            return best;
        }
        return cleaned;
    }
}

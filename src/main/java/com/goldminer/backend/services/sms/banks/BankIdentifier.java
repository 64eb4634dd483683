package com.goldminer.backend.services.sms.banks;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.goldminer.backend.config.MatchingProperties;
import com.goldminer.backend.dto.sms.BankMatch;
import com.goldminer.backend.services.sms.matching.FuzzyScores;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Works out which bank sent a message.
 *
 * <ol>
 *   <li>Exact stage: banks are checked in configuration order and the first bank with a
 *       matching pattern wins with score 100.</li>
 *   <li>Fuzzy stage, only when no exact match: each bank scores the best partial ratio of
 *       its patterns against the message; the highest score at or above the threshold wins,
 *       the earlier bank on ties.</li>
 * </ol>
 * An exact match always outranks any fuzzy score.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BankIdentifier {

    private final BankPatternRegistry registry;
    private final MatchingProperties matching;

    public BankMatch identify(String text) {
        if (text == null || text.isBlank()) {
            return BankMatch.unknown();
        }
        BankPatternRegistry.BankTable table = registry.current();

        for (BankPatternRegistry.BankPatterns bank : table.banks()) {
            for (BankPatternRegistry.BankPattern pattern : bank.patterns()) {
                if (pattern.matches(text)) {
                    log.debug("Exact bank match {} via '{}'", bank.bankId(), pattern.text());
                    return BankMatch.exact(bank.bankId());
                }
            }
        }

        String lowered = text.toLowerCase(Locale.ROOT);
        String bestBank = null;
        int bestScore = 0;
        for (BankPatternRegistry.BankPatterns bank : table.banks()) {
            int bankScore = 0;
            for (BankPatternRegistry.BankPattern pattern : bank.patterns()) {
                bankScore = Math.max(bankScore, FuzzyScores.partialRatio(pattern.text().toLowerCase(Locale.ROOT), lowered));
            }
            if (bankScore >= matching.bankFuzzyThreshold() && bankScore > bestScore) {
                bestBank = bank.bankId();
                bestScore = bankScore;
            }
        }

        if (bestBank != null) {
            log.debug("Fuzzy bank match {} score={}", bestBank, bestScore);
            return BankMatch.fuzzy(bestBank, bestScore);
        }
        return BankMatch.unknown();
    }

    public List<BankMatch> identifyBatch(List<String> texts) {
        List<BankMatch> matches = new ArrayList<>(texts.size());
        for (String text : texts) {
            matches.add(identify(text));
        }
        return matches;
    }

    /**
     * Number of messages attributed to each bank, unknown included, in first-seen order.
     */
    public Map<String, Long> statistics(List<String> texts) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (BankMatch match : identifyBatch(texts)) {
            counts.merge(match.bankId(), 1L, Long::sum);
        }
        return counts;
    }

    public List<String> knownBanks() {
        return registry.current().banks().stream().map(BankPatternRegistry.BankPatterns::bankId).toList();
    }
}

package com.goldminer.backend.services.sms.promo;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.goldminer.backend.dto.sms.PromoVerdict;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a message is promotional noise that should skip the parsing stages.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PromoFilter {

    private final PromoKeywordRegistry registry;

    public PromoVerdict classify(String text) {
        if (text == null || text.isBlank()) {
            return PromoVerdict.invalidInput();
        }

        PromoKeywordRegistry.KeywordSet keywordSet = registry.current();
        List<String> matched = new ArrayList<>();
        for (PromoKeywordRegistry.Keyword keyword : keywordSet.keywords()) {
            if (keyword.pattern().matcher(text).find()) {
                matched.add(keyword.text());
            }
        }

        if (matched.isEmpty()) {
            return PromoVerdict.notPromotional();
        }
        log.debug("Promo keywords matched: {}", matched);
        return PromoVerdict.promotional(matched);
    }

    public List<PromoVerdict> classifyBatch(List<String> texts) {
        List<PromoVerdict> verdicts = new ArrayList<>(texts.size());
        for (String text : texts) {
            verdicts.add(classify(text));
        }
        return verdicts;
    }

    public boolean isPromotional(String text) {
        return classify(text).skip();
    }
}

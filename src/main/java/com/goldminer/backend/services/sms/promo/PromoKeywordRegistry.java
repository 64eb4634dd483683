package com.goldminer.backend.services.sms.promo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.goldminer.backend.config.RulesProperties;
import com.goldminer.backend.services.sms.rules.ReloadableRuleSet;
import com.goldminer.backend.services.sms.rules.RuleConfigurationException;
import com.goldminer.backend.services.sms.rules.RuleFileReader;

/**
 * Active promotional keyword set. Falls back to the built-in English and Arabic lists
 * until a keyword file is loaded.
 */
@Component
public class PromoKeywordRegistry extends ReloadableRuleSet<PromoKeywordRegistry.KeywordSet> {

    private static final String BOUNDARY_BEFORE = "(?<![\\p{L}\\p{N}_])";
    private static final String BOUNDARY_AFTER = "(?![\\p{L}\\p{N}_])";

    public static final Map<String, List<String>> DEFAULT_KEYWORDS;

    static {
        Map<String, List<String>> defaults = new LinkedHashMap<>();
        defaults.put("english", List.of(
                "offer", "discount", "sale", "enjoy", "special offer", "limited time",
                "promotion", "promo", "deal", "deals", "save", "saving", "cashback",
                "reward", "rewards", "exclusive", "free", "gift", "bonus", "win", "winner",
                "congratulations", "congrats", "voucher", "coupon", "redeem"));
        defaults.put("arabic", List.of(
                "عرض خاص", "لفترة محدودة", "عروض", "توفير", "مجاني", "هدية", "مكافأة",
                "مكافآت", "حصري", "خصومات", "استمتع", "تخفيض", "تخفيضات", "كاش باك",
                "قسيمة", "كوبون", "مبروك", "فائز", "اربح", "جائزة", "وفر الآن",
                "احصل على", "فرصة"));
        DEFAULT_KEYWORDS = Collections.unmodifiableMap(defaults);
    }

    public record Keyword(String text, String language, Pattern pattern) {}

    /**
     * Distinct keywords (case-insensitive) in declaration order, languages in file order.
     */
    public record KeywordSet(List<Keyword> keywords) {
        public KeywordSet {
            keywords = List.copyOf(keywords);
        }
    }

    public PromoKeywordRegistry(RuleFileReader reader, RulesProperties properties) {
        super(reader, properties.promoKeywords(), compile(DEFAULT_KEYWORDS));
        initialize(false);
    }

    @Override
    public String name() {
        return "Promo keyword";
    }

    @Override
    protected Optional<KeywordSet> load(RuleFileReader reader, String location) {
        return reader.read(location, PromoKeywordFile.class).map(file -> {
            if (file.getKeywords() == null || file.getKeywords().isEmpty()) {
                throw new RuleConfigurationException("No promo keywords defined in " + location);
            }
            return compile(file.getKeywords());
        });
    }

    static KeywordSet compile(Map<String, List<String>> byLanguage) {
        List<Keyword> compiled = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> entry : byLanguage.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            for (String raw : entry.getValue()) {
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                String keyword = raw.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
                if (seen.add(keyword)) {
                    compiled.add(new Keyword(keyword, entry.getKey(), toPattern(keyword)));
                }
            }
        }
        return new KeywordSet(compiled);
    }

    private static Pattern toPattern(String keyword) {
        StringBuilder regex = new StringBuilder(BOUNDARY_BEFORE);
        String[] words = keyword.split(" ");
        for (int i = 0; i < words.length; i++) {
            if (i > 0) {
                regex.append("\\s+");
            }
            regex.append(Pattern.quote(words[i]));
        }
        regex.append(BOUNDARY_AFTER);
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}

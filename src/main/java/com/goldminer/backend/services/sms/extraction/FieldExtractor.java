package com.goldminer.backend.services.sms.extraction;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.springframework.stereotype.Service;

import com.goldminer.backend.dto.sms.ExtractedFields;
import com.goldminer.backend.enums.Confidence;
import com.goldminer.backend.services.sms.accounts.CardSuffixExtractor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies bank templates to a message.
 *
 * <p>Within one bank, templates are tried in declaration order and the first one whose
 * required fields all match is selected, even when a later template would extract more
 * fields. Confidence of a selected template is {@code HIGH} when at least half of its
 * declared fields matched and {@code MEDIUM} otherwise. When no template qualifies the
 * partial result with the most matched fields is returned with {@code LOW}.
 *
 * <p>In {@link BankScope#auto()} mode every bank is tried and the highest confidence wins;
 * ties go to the earlier bank.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FieldExtractor {

    public static final String UNKNOWN_BANK = "unknown";

    private static final Pattern CARD_SUFFIX = Pattern.compile("[0-9]{4}");

    private final TemplateRegistry registry;
    private final CardSuffixExtractor cardSuffixExtractor;

    public ExtractedFields extract(String text, BankScope scope) {
        return extract(text, scope, null);
    }

    /**
     * @param templateName when not null, only templates with this name are considered
     */
    public ExtractedFields extract(String text, BankScope scope, String templateName) {
        if (scope == null) {
            throw new IllegalArgumentException("scope is required");
        }
        String fallbackBank = scope.kind() == BankScope.Kind.AUTO ? UNKNOWN_BANK : scope.bankId();
        if (text == null || text.isBlank()) {
            return ExtractedFields.empty(Confidence.LOW, fallbackBank);
        }

        TemplateRegistry.TemplateCatalog catalog = registry.current();
        Optional<ExtractedFields> result = switch (scope.kind()) {
            case SPECIFIED -> extractForSpecifiedBank(text, scope.bankId(), catalog, templateName);
            case AUTO -> extractAcrossBanks(text, catalog, templateName);
        };

        return result.orElseGet(() -> {
            log.debug("No template matched for bank scope {}", scope);
            return ExtractedFields.empty(Confidence.LOW, fallbackBank).withCardSuffix(cardSuffixExtractor.extract(text));
        });
    }

    /**
     * @throws IllegalArgumentException when both lists are given with different sizes
     */
    public List<ExtractedFields> extractBatch(List<String> texts, List<BankScope> scopes) {
        if (scopes != null && scopes.size() != texts.size()) {
            throw new IllegalArgumentException("Expected " + texts.size() + " bank scopes but got " + scopes.size());
        }
        List<ExtractedFields> results = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            results.add(extract(texts.get(i), scopes == null ? BankScope.auto() : scopes.get(i)));
        }
        return results;
    }

    public List<String> supportedBanks() {
        return List.copyOf(registry.current().byBank().keySet());
    }

    public boolean supports(String bankId) {
        return registry.current().byBank().containsKey(bankId);
    }

    public List<String> templateNames(String bankId) {
        return registry.current().templatesFor(bankId).stream().map(ExtractionTemplate::name).toList();
    }

    private Optional<ExtractedFields> extractForSpecifiedBank(String text, String bankId,
            TemplateRegistry.TemplateCatalog catalog, String templateName) {
        if (!catalog.byBank().containsKey(bankId)) {
            log.warn("No extraction templates configured for bank {}", bankId);
            return Optional.empty();
        }
        return extractForBank(text, bankId, catalog.templatesFor(bankId), templateName);
    }

    private Optional<ExtractedFields> extractAcrossBanks(String text, TemplateRegistry.TemplateCatalog catalog,
            String templateName) {
        ExtractedFields best = null;
        for (Map.Entry<String, List<ExtractionTemplate>> bank : catalog.byBank().entrySet()) {
            Optional<ExtractedFields> candidate = extractForBank(text, bank.getKey(), bank.getValue(), templateName);
            if (candidate.isPresent() && (best == null || candidate.get().confidence().compareTo(best.confidence()) > 0)) {
                best = candidate.get();
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<ExtractedFields> extractForBank(String text, String bankId, List<ExtractionTemplate> templates,
            String templateName) {
        Attempt bestPartial = null;
        for (ExtractionTemplate template : templates) {
            if (templateName != null && !templateName.equals(template.name())) {
                continue;
            }
            Attempt attempt = apply(text, template);
            if (attempt.requiredMatched()) {
                Confidence confidence = attempt.values().size() * 2 >= template.declaredFieldCount()
                        ? Confidence.HIGH
                        : Confidence.MEDIUM;
                log.debug("Template {}/{} selected with confidence {}", bankId, template.name(), confidence);
                return Optional.of(toFields(text, attempt, confidence));
            }
            if (!attempt.values().isEmpty() && (bestPartial == null || attempt.values().size() > bestPartial.values().size())) {
                bestPartial = attempt;
            }
        }
        if (bestPartial == null) {
            return Optional.empty();
        }
        return Optional.of(toFields(text, bestPartial, Confidence.LOW));
    }

    private Attempt apply(String text, ExtractionTemplate template) {
        Map<TemplateField, String> values = new EnumMap<>(TemplateField.class);
        template.fieldPatterns().forEach((field, pattern) -> pattern.extract(text).ifPresent(v -> values.put(field, v)));

        String suffix = values.get(TemplateField.CARD_SUFFIX);
        if (suffix != null && !CARD_SUFFIX.matcher(suffix).matches()) {
            log.debug("Template {} captured an invalid card suffix '{}'; ignoring it", template.name(), suffix);
            values.remove(TemplateField.CARD_SUFFIX);
        }
        return new Attempt(template, values, values.keySet().containsAll(template.requiredFields()));
    }

    private ExtractedFields toFields(String text, Attempt attempt, Confidence confidence) {
        Map<TemplateField, String> values = attempt.values();
        String cardSuffix = values.get(TemplateField.CARD_SUFFIX);
        if (cardSuffix == null) {
            cardSuffix = cardSuffixExtractor.extract(text);
        }
        return new ExtractedFields(
                values.get(TemplateField.AMOUNT),
                values.get(TemplateField.CURRENCY),
                values.get(TemplateField.DATE),
                values.get(TemplateField.PAYEE),
                values.get(TemplateField.TRANSACTION_TYPE),
                cardSuffix,
                confidence,
                attempt.template().bankId(),
                attempt.template().name());
    }

    private record Attempt(ExtractionTemplate template, Map<TemplateField, String> values, boolean requiredMatched) {}
}

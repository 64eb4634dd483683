package com.goldminer.backend.services.sms.extraction;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.goldminer.backend.services.sms.normalization.TextNormalizer;
import com.goldminer.backend.services.sms.rules.RuleConfigurationException;

/**
 * A named set of field patterns for one bank, plus the fields that must match for the
 * template to be selected.
 */
public record ExtractionTemplate(
        String bankId,
        String name,
        Map<TemplateField, FieldPattern> fieldPatterns,
        Set<TemplateField> requiredFields
) {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

    public ExtractionTemplate {
        if (bankId == null || bankId.isBlank()) throw new IllegalArgumentException("bankId is required");
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
        if (fieldPatterns == null || fieldPatterns.isEmpty()) throw new IllegalArgumentException("fieldPatterns are required");
        fieldPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(fieldPatterns));
        requiredFields = requiredFields == null || requiredFields.isEmpty()
                ? Set.of(TemplateField.AMOUNT)
                : Collections.unmodifiableSet(EnumSet.copyOf(requiredFields));
    }

    /**
     * A compiled field regex. The value comes from the group named after the field, else the
     * first named group that participated, else group 1, else the whole match.
     */
    public record FieldPattern(String source, Pattern pattern, String preferredGroup, List<String> namedGroups) {

        public FieldPattern {
            namedGroups = List.copyOf(namedGroups);
        }

        public Optional<String> extract(String text) {
            Matcher matcher = pattern.matcher(text);
            if (!matcher.find()) {
                return Optional.empty();
            }
            String value = null;
            if (namedGroups.contains(preferredGroup)) {
                value = matcher.group(preferredGroup);
            }
            if (value == null) {
                for (String group : namedGroups) {
                    value = matcher.group(group);
                    if (value != null) {
                        break;
                    }
                }
            }
            if (value == null) {
                value = matcher.groupCount() > 0 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
            }
            String trimmed = value.strip();
            return trimmed.isEmpty() ? Optional.empty() : Optional.of(TextNormalizer.convertDigits(trimmed));
        }
    }

    /**
     * Builds a template from configuration text.
     *
     * @throws RuleConfigurationException for unknown fields, invalid regexes, or required
     *                                    fields without a pattern
     */
    public static ExtractionTemplate compile(String bankId, String name, Map<String, String> patterns, List<String> required) {
        if (patterns == null || patterns.isEmpty()) {
            throw new RuleConfigurationException("Template '" + name + "' of bank " + bankId + " has no patterns");
        }
        Map<TemplateField, FieldPattern> compiled = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : patterns.entrySet()) {
            TemplateField field = field(bankId, name, entry.getKey());
            String source = entry.getValue();
            if (source == null || source.isBlank()) {
                throw new RuleConfigurationException("Template '" + name + "' has an empty pattern for " + entry.getKey());
            }
            String translated = TemplatePatternTranslator.translate(source);
            try {
                compiled.put(field, new FieldPattern(source, Pattern.compile(translated, FLAGS),
                        TemplatePatternTranslator.groupName(field.getKey()),
                        TemplatePatternTranslator.namedGroups(translated)));
            } catch (PatternSyntaxException e) {
                throw new RuleConfigurationException("Template '" + name + "' of bank " + bankId
                        + " has an invalid pattern for " + entry.getKey() + ": " + e.getDescription(), e);
            }
        }

        Set<TemplateField> requiredFields = EnumSet.noneOf(TemplateField.class);
        if (required != null) {
            for (String key : required) {
                requiredFields.add(field(bankId, name, key));
            }
        }
        if (requiredFields.isEmpty()) {
            requiredFields.add(TemplateField.AMOUNT);
        }
        for (TemplateField field : requiredFields) {
            if (!compiled.containsKey(field)) {
                throw new RuleConfigurationException("Template '" + name + "' of bank " + bankId
                        + " requires " + field.getKey() + " but declares no pattern for it");
            }
        }
        return new ExtractionTemplate(bankId, name, compiled, requiredFields);
    }

    public int declaredFieldCount() {
        return fieldPatterns.size();
    }

    private static TemplateField field(String bankId, String name, String key) {
        try {
            return TemplateField.fromKey(key);
        } catch (IllegalArgumentException e) {
            throw new RuleConfigurationException("Template '" + name + "' of bank " + bankId + ": " + e.getMessage(), e);
        }
    }
}

package com.goldminer.backend.services.sms.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accepts template regexes written with PCRE-style {@code (?P<name>...)} named groups and turns them into
 * {@link java.util.regex.Pattern} syntax.
 *
 * <p>{@code (?P<card_suffix>...)} becomes {@code (?<cardSuffix>...)} and {@code (?P=name)}
 * becomes {@code \k<name>}, since Java group names may only hold letters and digits.
 */
public final class TemplatePatternTranslator {

    private static final Pattern NAMED_GROUP = Pattern.compile("(?<!\\\\)\\(\\?P?<([A-Za-z_][A-Za-z0-9_]*)>");
    private static final Pattern BACK_REFERENCE = Pattern.compile("(?<!\\\\)\\(\\?P=([A-Za-z_][A-Za-z0-9_]*)\\)");
    private static final Pattern JAVA_GROUP = Pattern.compile("(?<!\\\\)\\(\\?<([a-zA-Z][a-zA-Z0-9]*)>");

    private TemplatePatternTranslator() {}

    public static String translate(String pattern) {
        String withGroups = replace(NAMED_GROUP, pattern, name -> "(?<" + groupName(name) + ">");
        return replace(BACK_REFERENCE, withGroups, name -> "\\\\k<" + groupName(name) + ">");
    }

    /**
     * Java group name for a configuration name: {@code card_suffix} becomes {@code cardSuffix}.
     */
    public static String groupName(String name) {
        StringBuilder out = new StringBuilder();
        boolean upperNext = false;
        for (char c : name.toCharArray()) {
            if (c == '_') {
                upperNext = out.length() > 0;
                continue;
            }
            out.append(upperNext ? Character.toUpperCase(c) : c);
            upperNext = false;
        }
        if (out.length() == 0 || !Character.isLetter(out.charAt(0))) {
            out.insert(0, 'g');
        }
        return out.toString();
    }

    /**
     * Named groups of an already translated pattern, in the order they open.
     */
    public static List<String> namedGroups(String translatedPattern) {
        List<String> names = new ArrayList<>();
        Matcher matcher = JAVA_GROUP.matcher(translatedPattern);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static String replace(Pattern pattern, String input, UnaryOperator<String> replacement) {
        Matcher matcher = pattern.matcher(input);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, replacement.apply(matcher.group(1)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
